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
import java.util.Optional;
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

/**
 * Compares what the edge effectively kept with the intended rate, and publishes the factor the
 * edge should multiply its rates by. A neutral or implausible factor removes the key.
 */
final class RecalibrateOrgsTask extends OrgTask {
  static final double NEUTRAL = 1.0;

  final Logger log = LoggerFactory.getLogger(RecalibrateOrgsTask.class);

  final VolumeSource volumes;
  final TenantSettings settings;
  final TargetRateResolver resolver;
  final RateStore store;
  final GuardedExecutor executor;
  final RatePublisher publisher;
  final int windowMinutes;
  final double tolerance, minFactor, maxFactor;

  RecalibrateOrgsTask(VolumeSource volumes, TenantSettings settings, TargetRateResolver resolver,
      RateStore store, RatePublisher publisher, SamplingMetrics metrics, int windowMinutes,
      double tolerance, double minFactor, double maxFactor) {
    super(AlgorithmVariant.RECALIBRATE_ORG, metrics);
    this.volumes = volumes;
    this.settings = settings;
    this.resolver = resolver;
    this.store = store;
    this.executor = new GuardedExecutor(this.metrics);
    this.publisher = publisher;
    this.windowMinutes = windowMinutes;
    this.tolerance = tolerance;
    this.minFactor = minFactor;
    this.maxFactor = maxFactor;
  }

  /** Recalibration looks at minutes, so the smallest window of hours covers it. */
  @Override int activityWindowHours() {
    return (windowMinutes + 59) / 60;
  }

  @Override void process(long orgId) {
    if (settings.samplingMode(orgId) == SamplingMode.PROJECT) {
      log.debug("org {} is in project mode: its projects are recalibrated instead", orgId);
      publisher.deleteOrg(variant, orgId, NEUTRAL, metrics);
      return;
    }
    KeepDropCounts counts =
        volumes.keepDropCounts(Collections.singletonList(orgId), windowMinutes).get(orgId);
    if (counts == null || counts.total() == 0) {
      log.debug("org {} has no kept or dropped events in the last {}m", orgId, windowMinutes);
      return;
    }
    Optional<Double> target = resolver.resolve(orgId);
    if (!target.isPresent()) {
      log.debug("target rate of org {} is undetermined", orgId);
      return;
    }

    StoredRate previous = store.get(RateKey.forOrg(variant, orgId));
    double previousFactor = previous.isValid() ? previous.rate() : NEUTRAL;
    Optional<Double> factor = executor.run(RecalibrationModel.INSTANCE,
        RecalibrationInput.create(previousFactor, counts.effectiveRate(), target.get()),
        Tenant.organization(orgId));
    if (!factor.isPresent()) return;

    double next = factor.get();
    if (isUsable(next, tolerance, minFactor, maxFactor)) {
      log.debug("org {}: factor {} -> {}", orgId, previousFactor, next);
      publisher.publishOrg(variant, orgId, next, metrics);
    } else {
      log.debug("org {}: dropping factor {}", orgId, next);
      publisher.deleteOrg(variant, orgId, NEUTRAL, metrics);
    }
  }

  /** False when the factor is close enough to neutral, or too far from it to be trusted. */
  static boolean isUsable(double factor, double tolerance, double minFactor, double maxFactor) {
    return Math.abs(factor - NEUTRAL) > tolerance && factor >= minFactor && factor <= maxFactor;
  }
}
