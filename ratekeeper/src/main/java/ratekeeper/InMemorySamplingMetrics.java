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
package ratekeeper;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/** Keeps counters in memory. Mostly useful for tests and for the health of embedded setups. */
public final class InMemorySamplingMetrics implements SamplingMetrics {

  private final ConcurrentHashMap<String, AtomicLong> metrics;
  private final AtomicReference<Double> lastExtrapolatedVolume;
  private final String extrapolations;
  private final String undefinedExtrapolations;
  private final String tenantsProcessed;
  private final String tenantsSkipped;
  private final String tenantsFailed;
  private final String tenantsDeferred;
  private final String modelFailures;
  private final String retries;
  private final String ratesWritten;
  private final String errorSentinels;
  private final String invalidations;

  public InMemorySamplingMetrics() {
    this(new ConcurrentHashMap<>(), new AtomicReference<>(), null);
  }

  InMemorySamplingMetrics(ConcurrentHashMap<String, AtomicLong> metrics,
      AtomicReference<Double> lastExtrapolatedVolume, @Nullable AlgorithmVariant variant) {
    this.metrics = metrics;
    this.lastExtrapolatedVolume = lastExtrapolatedVolume;
    this.extrapolations = scope("extrapolations", variant);
    this.undefinedExtrapolations = scope("undefinedExtrapolations", variant);
    this.tenantsProcessed = scope("tenantsProcessed", variant);
    this.tenantsSkipped = scope("tenantsSkipped", variant);
    this.tenantsFailed = scope("tenantsFailed", variant);
    this.tenantsDeferred = scope("tenantsDeferred", variant);
    this.modelFailures = scope("modelFailures", variant);
    this.retries = scope("retries", variant);
    this.ratesWritten = scope("ratesWritten", variant);
    this.errorSentinels = scope("errorSentinels", variant);
    this.invalidations = scope("invalidations", variant);
  }

  @Override public InMemorySamplingMetrics forVariant(AlgorithmVariant variant) {
    return new InMemorySamplingMetrics(metrics, lastExtrapolatedVolume,
        checkNotNull(variant, "variant"));
  }

  @Override public void extrapolatedVolume(double volume) {
    lastExtrapolatedVolume.set(volume);
    increment(extrapolations, 1);
  }

  public long extrapolations() {
    return get(extrapolations);
  }

  /** The last value audited by any variant, or null if none was. */
  @Nullable public Double lastExtrapolatedVolume() {
    return lastExtrapolatedVolume.get();
  }

  @Override public void incrementUndefinedExtrapolations() {
    increment(undefinedExtrapolations, 1);
  }

  public long undefinedExtrapolations() {
    return get(undefinedExtrapolations);
  }

  @Override public void incrementTenantsProcessed() {
    increment(tenantsProcessed, 1);
  }

  public long tenantsProcessed() {
    return get(tenantsProcessed);
  }

  @Override public void incrementTenantsSkipped() {
    increment(tenantsSkipped, 1);
  }

  public long tenantsSkipped() {
    return get(tenantsSkipped);
  }

  @Override public void incrementTenantsFailed() {
    increment(tenantsFailed, 1);
  }

  public long tenantsFailed() {
    return get(tenantsFailed);
  }

  @Override public void incrementTenantsDeferred(int quantity) {
    increment(tenantsDeferred, quantity);
  }

  public long tenantsDeferred() {
    return get(tenantsDeferred);
  }

  @Override public void incrementModelFailures() {
    increment(modelFailures, 1);
  }

  public long modelFailures() {
    return get(modelFailures);
  }

  @Override public void incrementRetries() {
    increment(retries, 1);
  }

  public long retries() {
    return get(retries);
  }

  @Override public void incrementRatesWritten(int quantity) {
    increment(ratesWritten, quantity);
  }

  public long ratesWritten() {
    return get(ratesWritten);
  }

  @Override public void incrementErrorSentinels(int quantity) {
    increment(errorSentinels, quantity);
  }

  public long errorSentinels() {
    return get(errorSentinels);
  }

  @Override public void incrementInvalidations(int quantity) {
    increment(invalidations, quantity);
  }

  public long invalidations() {
    return get(invalidations);
  }

  public void clear() {
    metrics.clear();
    lastExtrapolatedVolume.set(null);
  }

  private long get(String key) {
    AtomicLong atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  private void increment(String key, int quantity) {
    if (quantity == 0) return;
    metrics.computeIfAbsent(key, k -> new AtomicLong()).addAndGet(quantity);
  }

  static String scope(String key, @Nullable AlgorithmVariant variant) {
    return key + (variant == null ? "" : "." + variant.tag());
  }
}
