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

import java.util.Optional;
import ratekeeper.AlgorithmVariant;
import ratekeeper.QuotaService;
import ratekeeper.store.RateKey;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

/**
 * Decides the rate an organization should be sampled at overall, preferring what the sliding
 * window pass derived from actual volume over the contractual blended rate.
 */
final class TargetRateResolver {
  /**
   * Written after a complete sliding window pass over all organizations. Organization ids are
   * positive, so scope zero never collides with a real rate.
   */
  static final RateKey SLIDING_WINDOW_EXECUTED =
      RateKey.forOrg(AlgorithmVariant.SLIDING_WINDOW_PER_ORG, 0L);

  final RateStore store;
  final QuotaService quota;
  final boolean slidingWindowEnabled;

  TargetRateResolver(RateStore store, QuotaService quota, boolean slidingWindowEnabled) {
    this.store = store;
    this.quota = quota;
    this.slidingWindowEnabled = slidingWindowEnabled;
  }

  /** Returns the target rate, or empty when it is undetermined. */
  Optional<Double> resolve(long orgId) {
    if (!slidingWindowEnabled) return quota.blendedRate(orgId);
    return fromPublished(orgId,
        store.get(RateKey.forOrg(AlgorithmVariant.SLIDING_WINDOW_PER_ORG, orgId)));
  }

  /**
   * Returns the target rate of a project, given what {@link AlgorithmVariant#PER_PROJECT_BIAS}
   * published for it, or empty when it is undetermined.
   */
  Optional<Double> resolveProject(long orgId, StoredRate projectRate) {
    return fromPublished(orgId, projectRate);
  }

  Optional<Double> fromPublished(long orgId, StoredRate rate) {
    if (rate.isValid()) return Optional.of(rate.rate());
    // The pass ran but skipped this tenant: it had no volume in the window, so keep everything.
    if (slidingWindowEnabled && rate.kind() == StoredRate.Kind.ABSENT
        && store.get(SLIDING_WINDOW_EXECUTED).kind() != StoredRate.Kind.ABSENT) {
      return Optional.of(1.0);
    }
    return quota.blendedRate(orgId);
  }
}
