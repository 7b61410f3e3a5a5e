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
package ratekeeper.store;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import ratekeeper.AlgorithmVariant;
import ratekeeper.CheckResult;

import static com.google.common.base.Preconditions.checkNotNull;
import static ratekeeper.store.RateStores.checkGroup;
import static ratekeeper.store.RateStores.checkTtl;
import static ratekeeper.store.RateStores.checkWritable;

/**
 * Keeps rates in memory, for tests and single process deployments. Batches are atomic because
 * they are applied under one write lock.
 */
public final class InMemoryRateStore implements RateStore {

  public static InMemoryRateStore create() {
    return new InMemoryRateStore(Ticker.systemTicker());
  }

  /** Use this to control expiration in tests. */
  public static InMemoryRateStore create(Ticker ticker) {
    return new InMemoryRateStore(checkNotNull(ticker, "ticker"));
  }

  final Ticker ticker;
  final ReadWriteLock lock = new ReentrantReadWriteLock();
  final TreeMap<RateKey, Entry> entries = new TreeMap<>();

  InMemoryRateStore(Ticker ticker) {
    this.ticker = ticker;
  }

  @Override public CheckResult check() {
    return CheckResult.OK;
  }

  @Override public StoredRate get(RateKey key) {
    checkNotNull(key, "key");
    long now = ticker.read();
    lock.readLock().lock();
    try {
      Entry entry = entries.get(key);
      return entry == null || entry.expired(now) ? StoredRate.ABSENT : entry.value;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override public Map<RateKey, StoredRate> getGroup(AlgorithmVariant variant, long scopeId) {
    checkNotNull(variant, "variant");
    long now = ticker.read();
    Map<RateKey, StoredRate> result = new LinkedHashMap<>();
    lock.readLock().lock();
    try {
      for (Map.Entry<RateKey, Entry> entry : group(variant, scopeId).entrySet()) {
        if (!entry.getValue().expired(now)) result.put(entry.getKey(), entry.getValue().value);
      }
    } finally {
      lock.readLock().unlock();
    }
    return result;
  }

  @Override public void setBatch(Map<RateKey, StoredRate> batch, Duration ttl) {
    checkWritable(batch);
    long now = ticker.read(), expiresAt = now + checkTtl(ttl).toNanos();
    lock.writeLock().lock();
    try {
      purgeExpired(now);
      put(batch, expiresAt);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override public void replaceGroup(AlgorithmVariant variant, long scopeId,
      Map<RateKey, StoredRate> batch, Duration ttl) {
    checkNotNull(variant, "variant");
    checkGroup(variant, scopeId, batch);
    long now = ticker.read(), expiresAt = now + checkTtl(ttl).toNanos();
    lock.writeLock().lock();
    try {
      purgeExpired(now);
      Iterator<RateKey> existing = group(variant, scopeId).keySet().iterator();
      while (existing.hasNext()) {
        if (!batch.containsKey(existing.next())) existing.remove();
      }
      put(batch, expiresAt);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override public void delete(Collection<RateKey> keys) {
    checkNotNull(keys, "keys");
    lock.writeLock().lock();
    try {
      for (RateKey key : keys) entries.remove(key);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Drops everything, for tests. */
  public void clear() {
    lock.writeLock().lock();
    try {
      entries.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override public void close() {
  }

  @Override public String toString() {
    return "InMemoryRateStore{}";
  }

  /** A live view of the group, which sorts contiguously by variant then scope. */
  Map<RateKey, Entry> group(AlgorithmVariant variant, long scopeId) {
    return entries.subMap(RateKey.create(variant, scopeId, Long.MIN_VALUE), true,
        RateKey.create(variant, scopeId, Long.MAX_VALUE), true);
  }

  /** Expired entries are never read again, so writes drop them. Call under the write lock. */
  void purgeExpired(long now) {
    entries.values().removeIf(entry -> entry.expired(now));
  }

  void put(Map<RateKey, StoredRate> batch, long expiresAt) {
    for (Map.Entry<RateKey, StoredRate> entry : batch.entrySet()) {
      entries.put(entry.getKey(), new Entry(entry.getValue(), expiresAt));
    }
  }

  static final class Entry {
    final StoredRate value;
    final long expiresAt;

    Entry(StoredRate value, long expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }

    boolean expired(long now) {
      return now - expiresAt >= 0;
    }
  }
}
