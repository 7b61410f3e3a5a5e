/**
 * Copyright 2015-2017 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package ratekeeper.zookeeper;

import java.io.Closeable;
import java.io.IOException;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.imps.CuratorFrameworkState;
import org.apache.curator.framework.recipes.leader.LeaderLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Allows a cycle only while this process is the elected leader, so that a single host owns the
 * writes to the rate key space. Pass it as the guard of a {@code CycleScheduler}.
 */
public final class CycleLeaderGuard implements Supplier<Boolean>, Closeable {
  final Logger log = LoggerFactory.getLogger(CycleLeaderGuard.class);

  /**
   * @param client must be started, and will not be closed on {@link #close()}
   * @param basePath the election happens under {@code basePath + "/election"}
   * @param id stable name of this process in the election, ex. "cluster@host:port". A random
   * UUID when null.
   */
  public static CycleLeaderGuard create(CuratorFramework client, String basePath,
      @Nullable String id) {
    checkState(checkNotNull(client, "client").getState() == CuratorFrameworkState.STARTED,
        "%s is not started", client.getState());
    checkNotNull(basePath, "basePath");
    return new CycleLeaderGuard(client, basePath + "/election",
        id != null ? id : UUID.randomUUID().toString());
  }

  final CuratorFramework client; // visible for testing
  final LeaderLatch latch; // visible for testing

  CycleLeaderGuard(CuratorFramework client, String electionPath, String id) {
    this.client = client;
    try {
      client.checkExists().creatingParentContainersIfNeeded().forPath(electionPath);
    } catch (Exception e) {
      throw new IllegalStateException("Error creating " + electionPath, e);
    }
    latch = new LeaderLatch(client, electionPath, id);
    log.debug("{} is trying to become the leader", id);
    try {
      latch.start();
    } catch (Exception e) {
      throw new IllegalStateException("Error starting latch for " + electionPath, e);
    }
  }

  @Override public Boolean get() {
    return latch.hasLeadership();
  }

  @Override public void close() throws IOException {
    if (latch.getState() != LeaderLatch.State.STARTED) return; // already closed
    latch.close();
  }
}
