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
package ratekeeper.autoconfigure;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import ratekeeper.AlgorithmVariant;
import ratekeeper.SamplingMetrics;
import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reports the following to a Micrometer registry, each tagged with the algorithm variant once
 * {@link #forVariant(AlgorithmVariant) scoped}:
 *
 * <pre>
 * <ul>
 *     <li>ratekeeper.tenants.processed - cumulative tenants whose unit of work completed</li>
 *     <li>ratekeeper.tenants.skipped - cumulative tenants deleted while a cycle ran</li>
 *     <li>ratekeeper.tenants.failed - cumulative tenants that failed or timed out</li>
 *     <li>ratekeeper.tenants.deferred - cumulative tenants left to a later cycle</li>
 *     <li>ratekeeper.model.failures - cumulative model invocations converted to no result</li>
 *     <li>ratekeeper.retries - cumulative retried attempts after transient failures</li>
 *     <li>ratekeeper.rates.written - cumulative valid rates written</li>
 *     <li>ratekeeper.rates.error_sentinels - cumulative error sentinels written</li>
 *     <li>ratekeeper.invalidations - cumulative configuration invalidations sent</li>
 *     <li>ratekeeper.extrapolations.undefined - cumulative undefined extrapolations</li>
 *     <li>ratekeeper.extrapolated_volume - distribution of extrapolated volumes</li>
 * </ul>
 * </pre>
 */
public final class MicrometerSamplingMetrics implements SamplingMetrics {

  final MeterRegistry registry;
  final Counter processed, skipped, failed, deferred, modelFailures, retries;
  final Counter ratesWritten, errorSentinels, invalidations, undefinedExtrapolations;
  final DistributionSummary extrapolatedVolume;

  public MicrometerSamplingMetrics(MeterRegistry registry) {
    this(null, registry);
  }

  MicrometerSamplingMetrics(@Nullable AlgorithmVariant variant, MeterRegistry registry) {
    this.registry = checkNotNull(registry, "registry");
    Tags tags = variant == null ? Tags.empty() : Tags.of("variant", variant.tag());
    processed = counter("ratekeeper.tenants.processed", "tenants whose unit of work completed",
        tags);
    skipped = counter("ratekeeper.tenants.skipped", "tenants deleted while a cycle ran", tags);
    failed = counter("ratekeeper.tenants.failed", "tenants that failed or timed out", tags);
    deferred = counter("ratekeeper.tenants.deferred", "tenants left to a later cycle", tags);
    modelFailures = counter("ratekeeper.model.failures",
        "model invocations converted to no result", tags);
    retries = counter("ratekeeper.retries", "attempts repeated after a transient failure", tags);
    ratesWritten = counter("ratekeeper.rates.written", "valid rates written", tags);
    errorSentinels = counter("ratekeeper.rates.error_sentinels",
        "error sentinels written over valid rates", tags);
    invalidations = counter("ratekeeper.invalidations",
        "configuration invalidations sent downstream", tags);
    undefinedExtrapolations = counter("ratekeeper.extrapolations.undefined",
        "volume extrapolations that were mathematically undefined", tags);
    extrapolatedVolume = DistributionSummary.builder("ratekeeper.extrapolated_volume")
        .description("volume extrapolated to the reference period")
        .tags(tags)
        .register(registry);
  }

  Counter counter(String name, String description, Tags tags) {
    return Counter.builder(name).description("cumulative amount of " + description)
        .tags(tags)
        .register(registry);
  }

  @Override public MicrometerSamplingMetrics forVariant(AlgorithmVariant variant) {
    checkNotNull(variant, "variant");
    return new MicrometerSamplingMetrics(variant, registry);
  }

  @Override public void extrapolatedVolume(double volume) {
    extrapolatedVolume.record(volume);
  }

  @Override public void incrementUndefinedExtrapolations() {
    undefinedExtrapolations.increment();
  }

  @Override public void incrementTenantsProcessed() {
    processed.increment();
  }

  @Override public void incrementTenantsSkipped() {
    skipped.increment();
  }

  @Override public void incrementTenantsFailed() {
    failed.increment();
  }

  @Override public void incrementTenantsDeferred(int quantity) {
    deferred.increment(quantity);
  }

  @Override public void incrementModelFailures() {
    modelFailures.increment();
  }

  @Override public void incrementRetries() {
    retries.increment();
  }

  @Override public void incrementRatesWritten(int quantity) {
    ratesWritten.increment(quantity);
  }

  @Override public void incrementErrorSentinels(int quantity) {
    errorSentinels.increment(quantity);
  }

  @Override public void incrementInvalidations(int quantity) {
    invalidations.increment(quantity);
  }

  @Override public String toString() {
    return "MicrometerSamplingMetrics{" + registry.getClass().getSimpleName() + "}";
  }
}
