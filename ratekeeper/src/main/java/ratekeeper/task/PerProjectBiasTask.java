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
import ratekeeper.SamplingMetrics;
import ratekeeper.SamplingMode;
import ratekeeper.Tenant;
import ratekeeper.TenantDirectory;
import ratekeeper.TenantSettings;
import ratekeeper.VolumeRecord;
import ratekeeper.VolumeSource;
import ratekeeper.model.GuardedExecutor;
import ratekeeper.model.RebalancedItem;
import ratekeeper.model.RebalancingInput;
import ratekeeper.model.RebalancingModel;

/**
 * Boosts low volume projects: spreads the organization's target rate across its projects so that
 * small projects keep proportionally more, while the organization as a whole keeps its target.
 * Organizations in project mode publish each project's configured target instead.
 */
final class PerProjectBiasTask extends OrgTask {
  final Logger log = LoggerFactory.getLogger(PerProjectBiasTask.class);

  final VolumeSource volumes;
  final TenantDirectory directory;
  final TenantSettings settings;
  final TargetRateResolver resolver;
  final RebalancingModel model;
  final GuardedExecutor executor;
  final RatePublisher publisher;
  final int windowHours;

  PerProjectBiasTask(VolumeSource volumes, TenantDirectory directory, TenantSettings settings,
      TargetRateResolver resolver, RebalancingModel model, RatePublisher publisher,
      SamplingMetrics metrics, int windowHours) {
    super(AlgorithmVariant.PER_PROJECT_BIAS, metrics);
    this.volumes = volumes;
    this.directory = directory;
    this.settings = settings;
    this.resolver = resolver;
    this.model = model;
    this.executor = new GuardedExecutor(this.metrics);
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
    List<VolumeRecord> items = zeroFill(listed, counts);

    if (settings.samplingMode(orgId) == SamplingMode.PROJECT) {
      Map<Long, Double> configured = new LinkedHashMap<>();
      for (VolumeRecord item : items) {
        double rate = settings.projectTargetRate(orgId, item.entityId).orElse(1.0);
        configured.put(item.entityId, rate);
      }
      log.debug("org {} is in project mode: configured rates {}", orgId, configured);
      publisher.publishGroup(variant, orgId, configured, Collections.emptyList(), metrics);
      return;
    }

    Optional<Double> target = resolver.resolve(orgId);
    if (!target.isPresent()) {
      log.debug("target rate of org {} is undetermined", orgId);
      publisher.publishGroup(variant, orgId, Collections.emptyMap(), ids(items), metrics);
      return;
    }

    Map<Long, Double> rates = new LinkedHashMap<>();
    if (total(items) == 0) {
      // Nothing to rebalance: every project gets the target.
      for (VolumeRecord item : items) rates.put(item.entityId, target.get());
    } else {
      Optional<List<RebalancedItem>> rebalanced = executor.run(model,
          RebalancingInput.create(target.get(), items), Tenant.organization(orgId));
      if (!rebalanced.isPresent()) return; // keep what was published before
      for (RebalancedItem item : rebalanced.get()) rates.put(item.id, item.newRate);
    }
    log.debug("org {} at {}: project rates {}", orgId, target.get(), rates);
    publisher.publishGroup(variant, orgId, rates, Collections.emptyList(), metrics);
  }

  static long total(List<VolumeRecord> items) {
    long total = 0;
    for (VolumeRecord item : items) total += item.observedCount;
    return total;
  }

  static List<Long> ids(List<VolumeRecord> items) {
    List<Long> result = new ArrayList<>(items.size());
    for (VolumeRecord item : items) result.add(item.entityId);
    return result;
  }
}
