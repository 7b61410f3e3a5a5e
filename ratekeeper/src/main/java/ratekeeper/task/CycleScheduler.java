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
package ratekeeper.task;

import com.google.common.io.Closer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs cycles at a fixed rate. Before each run the guard is consulted, so that in a cluster only
 * the leader writes. A cycle of a variant never overlaps with the previous one of the same variant.
 */
public final class CycleScheduler implements Closeable {
  final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

  final SamplingOrchestrator orchestrator;
  final Supplier<Boolean> guard;
  final ScheduledExecutorService executor;
  final Closer closer = Closer.create();

  /** @param guard returns true when this process may run a cycle now */
  public CycleScheduler(SamplingOrchestrator orchestrator, Supplier<Boolean> guard) {
    this.orchestrator = checkNotNull(orchestrator, "orchestrator");
    this.guard = checkNotNull(guard, "guard");
    this.executor = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("ratekeeper-scheduler-%d").setDaemon(true)
            .build());
    closer.register(executor::shutdownNow);
  }

  public CycleScheduler schedule(AlgorithmVariant variant, Duration interval) {
    checkNotNull(variant, "variant");
    checkNotNull(interval, "interval");
    checkArgument(!interval.isNegative() && !interval.isZero(), "interval <= 0: %s", interval);
    ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> runIfGuarded(variant),
        0, interval.toMillis(), TimeUnit.MILLISECONDS);
    closer.register(() -> future.cancel(true));
    log.debug("scheduled {} every {}", variant.tag(), interval);
    return this;
  }

  /** Returns null when the guard declined the run. */
  CycleResult runIfGuarded(AlgorithmVariant variant) {
    if (!Boolean.TRUE.equals(guard.get())) {
      log.debug("not running {}: guard declined", variant.tag());
      return null;
    }
    try {
      return orchestrator.run(variant);
    } catch (RuntimeException e) {
      // a throwing task would never be scheduled again
      log.error("{} cycle failed", variant.tag(), e);
      return null;
    }
  }

  @Override public void close() throws IOException {
    closer.close();
  }
}
