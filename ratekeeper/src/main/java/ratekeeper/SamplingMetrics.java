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

/**
 * Callbacks invoked while computing and publishing sampling rates, to improve the visibility of the
 * system. A typical implementation reports counters to a telemetry system.
 *
 * <h3>Key Relationships</h3>
 *
 * <pre>
 * <ul>
 * <li>Tenants dispatched in a cycle = {@link #incrementTenantsProcessed() processed} +
 * {@link #incrementTenantsSkipped() skipped} + {@link #incrementTenantsFailed() failed}.
 * Tenants {@link #incrementTenantsDeferred(int) deferred} by a soft deadline were never
 * dispatched.</li>
 * <li>{@link #incrementInvalidations(int) Invalidations} &lt;= {@link #incrementRatesWritten(int)
 * rates written} + {@link #incrementErrorSentinels(int) error sentinels}. Alert when
 * invalidations stay high while volumes are stable: the epsilon gate is too tight.</li>
 * </ul>
 * </pre>
 */
public interface SamplingMetrics {

  /**
   * Those who wish to partition metrics by algorithm variant can call this method to include the
   * variant in the backend metric key.
   *
   * <p>For example, an implementation may by default report {@link #incrementRatesWritten(int)
   * written rates} to the key "ratekeeper.rates_written". When {@code
   * metrics.forVariant(SLIDING_WINDOW_PER_ORG)} is called, the counter would report to
   * "ratekeeper.sliding_window_per_org.rates_written"
   */
  SamplingMetrics forVariant(AlgorithmVariant variant);

  /** Audit of a successful volume extrapolation. */
  void extrapolatedVolume(double volume);

  /** Audit of an extrapolation that was mathematically undefined, ex. a non-positive window. */
  void incrementUndefinedExtrapolations();

  /** Increments the count of tenants whose unit of work completed, even if nothing was written. */
  void incrementTenantsProcessed();

  /** Increments the count of tenants which vanished between enumeration and processing. */
  void incrementTenantsSkipped();

  /** Increments the count of tenants whose unit of work failed permanently or timed out. */
  void incrementTenantsFailed();

  /** Increments the count of tenants left to the next cycle because of a soft deadline. */
  void incrementTenantsDeferred(int quantity);

  /** Increments the count of model invocations that raised and were converted to no result. */
  void incrementModelFailures();

  /** Increments the count of unit of work attempts repeated after a transient failure. */
  void incrementRetries();

  /** Increments the count of valid rates written to the store. */
  void incrementRatesWritten(int quantity);

  /** Increments the count of error sentinels written over previously valid rates. */
  void incrementErrorSentinels(int quantity);

  /** Increments the count of configuration invalidations sent downstream. */
  void incrementInvalidations(int quantity);

  SamplingMetrics NOOP_METRICS = new SamplingMetrics() {

    @Override public SamplingMetrics forVariant(AlgorithmVariant variant) {
      return this;
    }

    @Override public void extrapolatedVolume(double volume) {
    }

    @Override public void incrementUndefinedExtrapolations() {
    }

    @Override public void incrementTenantsProcessed() {
    }

    @Override public void incrementTenantsSkipped() {
    }

    @Override public void incrementTenantsFailed() {
    }

    @Override public void incrementTenantsDeferred(int quantity) {
    }

    @Override public void incrementModelFailures() {
    }

    @Override public void incrementRetries() {
    }

    @Override public void incrementRatesWritten(int quantity) {
    }

    @Override public void incrementErrorSentinels(int quantity) {
    }

    @Override public void incrementInvalidations(int quantity) {
    }

    @Override public String toString() {
      return "NoOpSamplingMetrics";
    }
  };
}
