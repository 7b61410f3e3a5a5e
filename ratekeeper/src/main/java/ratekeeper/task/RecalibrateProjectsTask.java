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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.KeepDropCounts;
import ratekeeper.SamplingMetrics;
import ratekeeper.SamplingMode;
import ratekeeper.Tenant;
import ratekeeper.TenantSettings;
import ratekeeper.VolumeSource;
import ratekeeper.model.GuardedExecutor;
import ratekeeper.model.RecalibrationInput;
import ratekeeper.model.RecalibrationModel;
import ratekeeper.store.RateKey;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

import static ratekeeper.task.RecalibrateOrgsTask.NEUTRAL;

/**
 * Recalibrates each project of an organization in {@link SamplingMode#PROJECT} mode against the
 * target the project was configured with. Projects without a configured target should keep
 * everything. Factors are stored as the organization's group: projects with a neutral or
 * implausible factor, or without events, are left out of it.
 */
final class RecalibrateProjectsTask extends OrgTask {
  final Logger log = LoggerFactory.getLogger(RecalibrateProjectsTask.class);

  final VolumeSource volumes;
  final TenantSettings settings;
  final RateStore store;
  final GuardedExecutor executor;
  final RatePublisher publisher;
  final int windowMinutes;
  final double tolerance, minFactor, maxFactor;

  RecalibrateProjectsTask(VolumeSource volumes, TenantSettings settings, RateStore store,
      RatePublisher publisher, SamplingMetrics metrics, int windowMinutes, double tolerance,
      double minFactor, double maxFactor) {
    super(AlgorithmVariant.RECALIBRATE_PROJECT, metrics);
    this.volumes = volumes;
    this.settings = settings;
    this.store = store;
    this.executor = new GuardedExecutor(this.metrics);
    this.publisher = publisher;
    this.windowMinutes = windowMinutes;
    this.tolerance = tolerance;
    this.minFactor = minFactor;
    this.maxFactor = maxFactor;
  }

  @Override int activityWindowHours() {
    return (windowMinutes + 59) / 60;
  }

  @Override void process(long orgId) {
    Map<Long, Double> factors = new LinkedHashMap<>();
    if (settings.samplingMode(orgId) != SamplingMode.PROJECT) {
      // clears factors left from when the organization was in project mode
      publisher.publishFactors(variant, orgId, factors, NEUTRAL, metrics);
      return;
    }

    Map<Long, KeepDropCounts> counts = volumes
        .projectKeepDropCounts(Collections.singletonList(orgId), windowMinutes)
        .getOrDefault(orgId, Collections.emptyMap());
    Map<RateKey, StoredRate> previous = store.getGroup(variant, orgId);
    for (Map.Entry<Long, KeepDropCounts> project : new TreeMap<>(counts).entrySet()) {
      long projectId = project.getKey();
      if (project.getValue().total() == 0) continue;
      double target = settings.projectTargetRate(orgId, projectId).orElse(1.0);
      StoredRate old = previous.getOrDefault(RateKey.create(variant, orgId, projectId),
          StoredRate.ABSENT);
      double previousFactor = old.isValid() ? old.rate() : NEUTRAL;

      Optional<Double> factor = executor.run(RecalibrationModel.INSTANCE,
          RecalibrationInput.create(previousFactor, project.getValue().effectiveRate(), target),
          Tenant.project(projectId));
      if (!factor.isPresent()) {
        if (old.isValid()) factors.put(projectId, previousFactor);
        continue;
      }
      double next = factor.get();
      if (RecalibrateOrgsTask.isUsable(next, tolerance, minFactor, maxFactor)) {
        log.debug("project {}: factor {} -> {}", projectId, previousFactor, next);
        factors.put(projectId, next);
      } else {
        log.debug("project {}: dropping factor {}", projectId, next);
      }
    }
    publisher.publishFactors(variant, orgId, factors, NEUTRAL, metrics);
  }
}
