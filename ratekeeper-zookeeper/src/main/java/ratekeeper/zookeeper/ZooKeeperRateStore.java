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

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.api.transaction.CuratorOp;
import org.apache.curator.framework.imps.CuratorFrameworkState;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.CheckResult;
import ratekeeper.TransientIOException;
import ratekeeper.internal.Nullable;
import ratekeeper.store.RateKey;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static ratekeeper.store.RateStores.checkGroup;
import static ratekeeper.store.RateStores.checkTtl;
import static ratekeeper.store.RateStores.checkWritable;

/**
 * Publishes rates as ZooKeeper nodes, so that every edge process can watch or read them.
 *
 * <p>A key {@code ds:pp:1:42} is stored at {@code <basePath>/pp/1/42}: children of one parent are
 * a group. Multi-key writes are a single ZooKeeper transaction, which also bumps the data
 * version of each group node it touches. Group reads retry until that version is the same before
 * and after reading the children, so they never see half of a transaction.
 *
 * <h3>Implementation notes</h3>
 *
 * <p>ZooKeeper has no per-node expiry usable without server flags, so the expiry is stored in the
 * node value: {@code 0.25|1700000000000} is the rate, then the epoch millis after which it reads
 * as absent. Expired nodes are removed when their group is next replaced or they are deleted.
 *
 * <p>Connection loss, session expiry and concurrent modification surface as {@link
 * TransientIOException}, other failures as {@link IllegalStateException}.
 */
public final class ZooKeeperRateStore implements RateStore {
  static final Logger LOG = LoggerFactory.getLogger(ZooKeeperRateStore.class);
  static final char EXPIRY_SEPARATOR = '|';
  static final int MAX_GROUP_READS = 5;
  static final byte[] EMPTY = new byte[0];

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String basePath = "/ratekeeper/rates";
    Clock clock = Clock.systemUTC();

    /** Base path in ZooKeeper for rate nodes. Defaults to "/ratekeeper/rates" */
    public Builder basePath(String basePath) {
      checkNotNull(basePath, "basePath");
      checkArgument(basePath.startsWith("/") && !basePath.endsWith("/"),
          "basePath should be absolute without a trailing slash: was %s", basePath);
      this.basePath = basePath;
      return this;
    }

    /** Decides expiry. Override in tests. */
    public Builder clock(Clock clock) {
      this.clock = checkNotNull(clock, "clock");
      return this;
    }

    /**
     * @param client must be started, and will not be closed on {@link #close()}
     */
    public ZooKeeperRateStore build(CuratorFramework client) {
      checkState(checkNotNull(client, "client").getState() == CuratorFrameworkState.STARTED,
          "%s is not started", client.getState());
      return new ZooKeeperRateStore(this, client);
    }

    Builder() {
    }
  }

  final CuratorFramework client;
  final String basePath;
  final Clock clock;

  ZooKeeperRateStore(Builder builder, CuratorFramework client) {
    this.client = client;
    this.basePath = builder.basePath;
    this.clock = builder.clock;
  }

  @Override public CheckResult check() {
    try {
      client.checkExists().forPath(basePath);
      return CheckResult.OK;
    } catch (Exception e) {
      if (e instanceof InterruptedException) Thread.currentThread().interrupt();
      return CheckResult.failed(e);
    }
  }

  @Override public StoredRate get(RateKey key) {
    checkNotNull(key, "key");
    return decode(path(key), read(path(key)), clock.millis());
  }

  @Override public Map<RateKey, StoredRate> getGroup(AlgorithmVariant variant, long scopeId) {
    checkNotNull(variant, "variant");
    String groupPath = groupPath(variant, scopeId);
    long now = clock.millis();
    for (int attempt = 0; attempt < MAX_GROUP_READS; attempt++) {
      Stat before = stat(groupPath);
      if (before == null) return Collections.emptyMap();
      Map<RateKey, StoredRate> result = new LinkedHashMap<>();
      for (Long entityId : children(groupPath)) {
        RateKey key = RateKey.create(variant, scopeId, entityId);
        StoredRate value = decode(path(key), read(path(key)), now);
        if (value.kind() != StoredRate.Kind.ABSENT) result.put(key, value);
      }
      Stat after = stat(groupPath);
      if (after != null && after.getVersion() == before.getVersion()) return result;
      LOG.debug("group {} changed while reading it", groupPath);
    }
    throw new TransientIOException(
        "group " + groupPath + " changed during " + MAX_GROUP_READS + " reads");
  }

  @Override public void setBatch(Map<RateKey, StoredRate> entries, Duration ttl) {
    checkWritable(entries);
    long expiresAt = clock.millis() + checkTtl(ttl).toMillis();
    Set<String> groups = new LinkedHashSet<>();
    for (RateKey key : entries.keySet()) {
      groups.add(groupPath(key.variant, key.scopeId));
    }
    for (String group : groups) ensureExists(group);

    List<CuratorOp> ops = new ArrayList<>();
    for (Map.Entry<RateKey, StoredRate> entry : entries.entrySet()) {
      ops.add(write(entry.getKey(), entry.getValue(), expiresAt));
    }
    for (String group : groups) ops.add(touch(group));
    commit(ops, "set " + entries.size() + " rates");
  }

  @Override public void replaceGroup(AlgorithmVariant variant, long scopeId,
      Map<RateKey, StoredRate> entries, Duration ttl) {
    checkNotNull(variant, "variant");
    checkGroup(variant, scopeId, entries);
    long expiresAt = clock.millis() + checkTtl(ttl).toMillis();
    String groupPath = ensureExists(groupPath(variant, scopeId));
    Stat group = stat(groupPath);
    if (group == null) throw new TransientIOException("group " + groupPath + " was deleted");

    List<CuratorOp> ops = new ArrayList<>();
    for (Long entityId : children(groupPath)) {
      RateKey existing = RateKey.create(variant, scopeId, entityId);
      if (entries.containsKey(existing)) continue;
      ops.add(op(() -> client.transactionOp().delete().forPath(path(existing))));
    }
    for (Map.Entry<RateKey, StoredRate> entry : entries.entrySet()) {
      ops.add(write(entry.getKey(), entry.getValue(), expiresAt));
    }
    // fails if another writer changed the group after we listed it
    int version = group.getVersion();
    ops.add(op(() -> client.transactionOp().setData().withVersion(version)
        .forPath(groupPath, EMPTY)));
    commit(ops, "replace group " + groupPath);
  }

  @Override public void delete(Collection<RateKey> keys) {
    checkNotNull(keys, "keys");
    List<CuratorOp> ops = new ArrayList<>();
    Set<String> groups = new LinkedHashSet<>();
    for (RateKey key : keys) {
      if (!exists(path(key))) continue;
      ops.add(op(() -> client.transactionOp().delete().forPath(path(key))));
      groups.add(groupPath(key.variant, key.scopeId));
    }
    for (String group : groups) ops.add(touch(group));
    commit(ops, "delete " + keys.size() + " rates");
  }

  @Override public void close() {
  }

  @Override public String toString() {
    return "ZooKeeperRateStore{basePath=" + basePath + "}";
  }

  String groupPath(AlgorithmVariant variant, long scopeId) {
    return basePath + "/" + variant.keyPrefix() + "/" + scopeId;
  }

  String path(RateKey key) {
    return groupPath(key.variant, key.scopeId) + "/" + key.entityId;
  }

  CuratorOp write(RateKey key, StoredRate value, long expiresAt) {
    String path = path(key);
    byte[] data = (value.encode() + EXPIRY_SEPARATOR + expiresAt)
        .getBytes(StandardCharsets.UTF_8);
    if (exists(path)) {
      return op(() -> client.transactionOp().setData().forPath(path, data));
    }
    return op(() -> client.transactionOp().create().forPath(path, data));
  }

  /** Bumps the data version of a group node, so readers notice the change. */
  CuratorOp touch(String groupPath) {
    return op(() -> client.transactionOp().setData().forPath(groupPath, EMPTY));
  }

  /** Parses a node value. Malformed values read as {@link StoredRate#ERROR}. */
  static StoredRate decode(String path, @Nullable byte[] data, long now) {
    if (data == null) return StoredRate.ABSENT;
    String value = new String(data, StandardCharsets.UTF_8);
    int separator = value.lastIndexOf(EXPIRY_SEPARATOR);
    if (separator == -1) return StoredRate.decode(value);
    long expiresAt;
    try {
      expiresAt = Long.parseLong(value.substring(separator + 1));
    } catch (NumberFormatException e) {
      LOG.warn("malformed expiry at path {}: {}", path, value);
      return StoredRate.ERROR;
    }
    if (expiresAt <= now) return StoredRate.ABSENT;
    return StoredRate.decode(value.substring(0, separator));
  }

  @Nullable byte[] read(String path) {
    try {
      return client.getData().forPath(path);
    } catch (KeeperException.NoNodeException e) {
      return null;
    } catch (Exception e) {
      throw propagate("Error reading " + path, e);
    }
  }

  /** Entity ids under the group, ignoring nodes that aren't named by an id. */
  List<Long> children(String groupPath) {
    List<String> names;
    try {
      names = client.getChildren().forPath(groupPath);
    } catch (KeeperException.NoNodeException e) {
      return Collections.emptyList();
    } catch (Exception e) {
      throw propagate("Error listing " + groupPath, e);
    }
    List<Long> result = new ArrayList<>(names.size());
    for (String name : names) {
      try {
        result.add(Long.parseLong(name));
      } catch (NumberFormatException e) {
        LOG.debug("ignoring {}/{}: not an entity id", groupPath, name);
      }
    }
    return result;
  }

  boolean exists(String path) {
    return stat(path) != null;
  }

  @Nullable Stat stat(String path) {
    try {
      return client.checkExists().forPath(path);
    } catch (Exception e) {
      throw propagate("Error checking " + path, e);
    }
  }

  String ensureExists(String path) {
    try {
      if (client.checkExists().forPath(path) == null) {
        client.create().creatingParentsIfNeeded().forPath(path, EMPTY);
      }
      return path;
    } catch (KeeperException.NodeExistsException e) {
      return path; // created concurrently
    } catch (Exception e) {
      throw propagate("Error creating " + path, e);
    }
  }

  void commit(List<CuratorOp> ops, String description) {
    if (ops.isEmpty()) return;
    try {
      client.transaction().forOperations(ops);
      LOG.debug("committed {} in {} operations", description, ops.size());
    } catch (Exception e) {
      throw propagate("Error committing " + description, e);
    }
  }

  interface OpFactory {
    CuratorOp create() throws Exception;
  }

  static CuratorOp op(OpFactory factory) {
    try {
      return factory.create();
    } catch (Exception e) {
      throw propagate("Error preparing operation", e);
    }
  }

  static RuntimeException propagate(String message, Exception e) {
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      return new IllegalStateException(message, e);
    }
    if (e instanceof KeeperException.ConnectionLossException
        || e instanceof KeeperException.SessionExpiredException
        || e instanceof KeeperException.OperationTimeoutException) {
      return new TransientIOException(message, e);
    }
    // another writer changed the nodes between our reads and the transaction
    if (e instanceof KeeperException.NoNodeException
        || e instanceof KeeperException.NodeExistsException
        || e instanceof KeeperException.BadVersionException) {
      return new TransientIOException(message, e);
    }
    return new IllegalStateException(message, e);
  }
}
