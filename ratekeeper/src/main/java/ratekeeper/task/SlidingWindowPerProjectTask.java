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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.QuotaService;
import ratekeeper.SamplingMetrics;
import ratekeeper.SamplingTier;
import ratekeeper.TenantDirectory;
import ratekeeper.VolumeRecord;
import ratekeeper.VolumeSource;
import ratekeeper.model.SlidingWindowEstimator;

/** Resolves each project's extrapolated volume to the rate of its quota tier. */
final class SlidingWindowPerProjectTask extends OrgTask {
  final Logger log = LoggerFactory.getLogger(SlidingWindowPerProjectTask.class);

  final VolumeSource volumes;
  final TenantDirectory directory;
  final QuotaService quota;
  final SlidingWindowEstimator estimator;
  final RatePublisher publisher;
  final int windowHours;

  SlidingWindowPerProjectTask(VolumeSource volumes, TenantDirectory directory, QuotaService quota,
      RatePublisher publisher, SamplingMetrics metrics, int windowHours, int referenceHours) {
    super(AlgorithmVariant.SLIDING_WINDOW_PER_PROJECT, metrics);
    this.volumes = volumes;
    this.directory = directory;
    this.quota = quota;
    this.estimator = new SlidingWindowEstimator(this.metrics, referenceHours);
    this.publisher = publisher;
    this.windowHours = windowHours;
  }

  @Override int activityWindowHours() {
    return windowHours;
  }

  @Override void process(long orgId) {
    List<Long> listed = directory.projectIds(orgId);
    Map<Long, Long> counts = volumes.projectCounts(Collections.singletonList(orgId), windowHours)
        .getOrDefault(orgId, Collections.emptyMap());

    Map<Long, Double> rates = new LinkedHashMap<>();
    List<Long> undetermined = new ArrayList<>();
    for (VolumeRecord project : zeroFill(listed, counts)) {
      Optional<SamplingTier> tier = estimator.estimate(project.observedCount, windowHours)
          .flatMap(volume -> quota.tierForVolume(orgId, volume));
      if (tier.isPresent()) {
        rates.put(project.entityId, tier.get().rate);
      } else {
        undetermined.add(project.entityId);
      }
    }
    log.debug("org {}: project rates {}, undetermined {}", orgId, rates, undetermined);
    publisher.publishGroup(variant, orgId, rates, undetermined, metrics);
  }
}
