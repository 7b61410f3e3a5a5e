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

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.ConfigInvalidationSink;
import ratekeeper.SamplingMetrics;
import ratekeeper.Tenant;
import ratekeeper.internal.Nullable;
import ratekeeper.store.InvalidationGate;
import ratekeeper.store.RateKey;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

/**
 * Writes computed rates and tells readers about changes that matter. A rate that could not be
 * determined replaces a previously valid one with the error sentinel, so readers stop honoring a
 * stale value. Keys that never held a rate are left absent.
 */
final class RatePublisher {
  final Logger log = LoggerFactory.getLogger(RatePublisher.class);

  final RateStore store;
  final InvalidationGate gate;
  final ConfigInvalidationSink sink;
  final Duration ttl;

  RatePublisher(RateStore store, InvalidationGate gate, ConfigInvalidationSink sink,
      Duration ttl) {
    this.store = store;
    this.gate = gate;
    this.sink = sink;
    this.ttl = ttl;
  }

  /**
   * Replaces the organization's group of project rates. Projects of the group which are neither
   * rated nor undetermined are deleted.
   */
  void publishGroup(AlgorithmVariant variant, long orgId, Map<Long, Double> rates,
      Collection<Long> undetermined, SamplingMetrics metrics) {
    Map<RateKey, StoredRate> previous = store.getGroup(variant, orgId);
    Map<RateKey, StoredRate> next = new LinkedHashMap<>();
    for (Map.Entry<Long, Double> rate : rates.entrySet()) {
      next.put(RateKey.create(variant, orgId, rate.getKey()), StoredRate.valid(rate.getValue()));
    }
    int sentinels = 0;
    for (Long projectId : undetermined) {
      RateKey key = RateKey.create(variant, orgId, projectId);
      StoredRate old = previous.getOrDefault(key, StoredRate.ABSENT);
      if (old.kind() == StoredRate.Kind.ABSENT) continue;
      next.put(key, StoredRate.ERROR);
      if (old.isValid()) sentinels++;
    }

    store.replaceGroup(variant, orgId, next, ttl);
    metrics.incrementRatesWritten(rates.size());
    metrics.incrementErrorSentinels(sentinels);

    int invalidations = 0;
    for (Map.Entry<RateKey, StoredRate> entry : next.entrySet()) {
      StoredRate old = previous.getOrDefault(entry.getKey(), StoredRate.ABSENT);
      if (!gate.shouldNotify(old, entry.getValue())) continue;
      log.debug("{}: {} -> {}", entry.getKey(), old, entry.getValue());
      sink.invalidate(Tenant.project(entry.getKey().entityId), reason(variant));
      invalidations++;
    }
    metrics.incrementInvalidations(invalidations);
    if (invalidations > 0) {
      log.info("{} changed {} of {} project rates of org {}", variant.tag(), invalidations,
          next.size(), orgId);
    }
  }

  /**
   * Replaces a project's group of transaction rates. When {@code rates} is null the project's rate
   * is undetermined: whatever it held becomes the error sentinel. Readers load the group as a
   * whole, so the project is invalidated once if any rate in it changed.
   */
  void publishTransactions(AlgorithmVariant variant, long projectId,
      @Nullable Map<Long, Double> rates, SamplingMetrics metrics) {
    Map<RateKey, StoredRate> previous = store.getGroup(variant, projectId);
    Map<RateKey, StoredRate> next = new LinkedHashMap<>();
    int sentinels = 0;
    if (rates != null) {
      for (Map.Entry<Long, Double> rate : rates.entrySet()) {
        RateKey key = RateKey.create(variant, projectId, rate.getKey());
        next.put(key, StoredRate.valid(rate.getValue()));
      }
    } else if (previous.isEmpty()) {
      log.debug("{} of project {}: undetermined and never published", variant.tag(), projectId);
      return;
    } else {
      for (Map.Entry<RateKey, StoredRate> old : previous.entrySet()) {
        next.put(old.getKey(), StoredRate.ERROR);
        if (old.getValue().isValid()) sentinels++;
      }
    }

    store.replaceGroup(variant, projectId, next, ttl);
    metrics.incrementRatesWritten(rates != null ? rates.size() : 0);
    metrics.incrementErrorSentinels(sentinels);

    if (changed(previous, next)) {
      log.debug("{} rates of project {} changed", variant.tag(), projectId);
      sink.invalidate(Tenant.project(projectId), reason(variant));
      metrics.incrementInvalidations(1);
    }
  }

  /**
   * Replaces the organization's group of per-project factors. Projects missing from {@code
   * factors} are deleted, which readers treat as {@code neutral}.
   */
  void publishFactors(AlgorithmVariant variant, long orgId, Map<Long, Double> factors,
      double neutral, SamplingMetrics metrics) {
    Map<RateKey, StoredRate> previous = store.getGroup(variant, orgId);
    Map<RateKey, StoredRate> next = new LinkedHashMap<>();
    for (Map.Entry<Long, Double> factor : factors.entrySet()) {
      next.put(RateKey.create(variant, orgId, factor.getKey()),
          StoredRate.valid(factor.getValue()));
    }
    if (previous.isEmpty() && next.isEmpty()) return;

    store.replaceGroup(variant, orgId, next, ttl);
    metrics.incrementRatesWritten(next.size());

    int invalidations = 0;
    Set<RateKey> keys = new LinkedHashSet<>(previous.keySet());
    keys.addAll(next.keySet());
    for (RateKey key : keys) {
      StoredRate old = previous.getOrDefault(key, StoredRate.ABSENT), now = next.get(key);
      boolean notify = now != null
          ? gate.shouldNotify(old, now)
          : old.isValid() && InvalidationGate.shouldNotify(old.rate(), neutral, gate.epsilon());
      if (!notify) continue;
      log.debug("{}: {} -> {}", key, old, now != null ? now : "Absent");
      sink.invalidate(Tenant.project(key.entityId), reason(variant));
      invalidations++;
    }
    metrics.incrementInvalidations(invalidations);
  }

  /** True if readers of the group would see a different rate for any of its keys. */
  boolean changed(Map<RateKey, StoredRate> previous, Map<RateKey, StoredRate> next) {
    for (Map.Entry<RateKey, StoredRate> entry : next.entrySet()) {
      StoredRate old = previous.getOrDefault(entry.getKey(), StoredRate.ABSENT);
      if (gate.shouldNotify(old, entry.getValue())) return true;
    }
    for (Map.Entry<RateKey, StoredRate> entry : previous.entrySet()) {
      if (entry.getValue().isValid() && !next.containsKey(entry.getKey())) return true;
    }
    return false;
  }

  /** Writes the organization's own rate, or the error sentinel when it is undetermined. */
  void publishOrg(AlgorithmVariant variant, long orgId, Double rate, SamplingMetrics metrics) {
    RateKey key = RateKey.forOrg(variant, orgId);
    StoredRate old = store.get(key);
    StoredRate next;
    if (rate != null) {
      next = StoredRate.valid(rate);
    } else if (old.kind() != StoredRate.Kind.ABSENT) {
      next = StoredRate.ERROR;
    } else {
      log.debug("{}: undetermined and never published", key);
      return;
    }

    store.setBatch(Collections.singletonMap(key, next), ttl);
    if (next.isValid()) {
      metrics.incrementRatesWritten(1);
    } else if (old.isValid()) {
      metrics.incrementErrorSentinels(1);
    }

    if (gate.shouldNotify(old, next)) {
      log.info("{}: {} -> {}", key, old, next);
      sink.invalidate(Tenant.organization(orgId), reason(variant));
      metrics.incrementInvalidations(1);
    }
  }

  /**
   * Deletes the organization's key. Readers are told when the deleted value differed from what
   * they fall back to.
   */
  void deleteOrg(AlgorithmVariant variant, long orgId, double fallback, SamplingMetrics metrics) {
    RateKey key = RateKey.forOrg(variant, orgId);
    StoredRate old = store.get(key);
    if (old.kind() == StoredRate.Kind.ABSENT) return;

    store.delete(Collections.singleton(key));
    if (old.isValid() && InvalidationGate.shouldNotify(old.rate(), fallback, gate.epsilon())) {
      log.info("{}: {} -> Absent", key, old);
      sink.invalidate(Tenant.organization(orgId), reason(variant));
      metrics.incrementInvalidations(1);
    }
  }

  static String reason(AlgorithmVariant variant) {
    return variant.tag() + " rate changed";
  }
}
