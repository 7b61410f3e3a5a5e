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
import java.util.Collections;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.QuotaService;
import ratekeeper.SamplingMetrics;
import ratekeeper.SamplingTier;
import ratekeeper.VolumeSource;
import ratekeeper.model.SlidingWindowEstimator;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

/**
 * Resolves each organization's extrapolated volume to the rate of its quota tier. Once a pass has
 * visited every active organization, a marker records that organizations without a rate simply
 * had no volume.
 */
final class SlidingWindowPerOrgTask extends OrgTask {
  final Logger log = LoggerFactory.getLogger(SlidingWindowPerOrgTask.class);

  final VolumeSource volumes;
  final QuotaService quota;
  final SlidingWindowEstimator estimator;
  final RatePublisher publisher;
  final RateStore store;
  final Duration ttl;
  final int windowHours;

  SlidingWindowPerOrgTask(VolumeSource volumes, QuotaService quota, RatePublisher publisher,
      RateStore store, SamplingMetrics metrics, int windowHours, int referenceHours,
      Duration ttl) {
    super(AlgorithmVariant.SLIDING_WINDOW_PER_ORG, metrics);
    this.volumes = volumes;
    this.quota = quota;
    this.estimator = new SlidingWindowEstimator(this.metrics, referenceHours);
    this.publisher = publisher;
    this.store = store;
    this.ttl = ttl;
    this.windowHours = windowHours;
  }

  @Override int activityWindowHours() {
    return windowHours;
  }

  @Override void process(long orgId) {
    Long count = volumes.orgCounts(Collections.singletonList(orgId), windowHours).get(orgId);
    Optional<SamplingTier> tier = estimator.estimate(count != null ? count : 0L, windowHours)
        .flatMap(volume -> quota.tierForVolume(orgId, volume));
    log.debug("org {}: count {} resolved to {}", orgId, count, tier);
    publisher.publishOrg(variant, orgId, tier.isPresent() ? tier.get().rate : null, metrics);
  }

  @Override void afterCycle(CycleResult result) {
    if (!result.complete()) {
      log.info("not marking the sliding window executed: {}", result);
      return;
    }
    store.setBatch(
        Collections.singletonMap(TargetRateResolver.SLIDING_WINDOW_EXECUTED, StoredRate.valid(1.0)),
        ttl);
  }
}
