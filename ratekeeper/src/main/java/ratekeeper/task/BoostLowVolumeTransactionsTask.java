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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.AlgorithmVariant;
import ratekeeper.SamplingMetrics;
import ratekeeper.Tenant;
import ratekeeper.TransactionVolumes;
import ratekeeper.VolumeRecord;
import ratekeeper.VolumeSource;
import ratekeeper.internal.Nullable;
import ratekeeper.model.GuardedExecutor;
import ratekeeper.model.RebalancedItem;
import ratekeeper.model.RebalancingInput;
import ratekeeper.model.RebalancingModel;
import ratekeeper.store.RateKey;
import ratekeeper.store.RateStore;
import ratekeeper.store.StoredRate;

/**
 * Boosts low volume transactions: spreads each project's rate across its transactions, so that
 * rare transactions keep proportionally more while the project keeps its rate overall.
 *
 * <p>Only the transactions the {@link VolumeSource} lists explicitly get their own rate. The rest
 * share the rate stored under {@link #IMPLICIT}. When a project keeps everything there is nothing
 * to boost, and its group is cleared.
 */
final class BoostLowVolumeTransactionsTask extends OrgTask {
  /** Entity id of the rate of transactions without their own. Transaction ids are positive. */
  static final long IMPLICIT = 0L;

  final Logger log = LoggerFactory.getLogger(BoostLowVolumeTransactionsTask.class);

  final VolumeSource volumes;
  final RateStore store;
  final TargetRateResolver resolver;
  final RebalancingModel model;
  final GuardedExecutor executor;
  final RatePublisher publisher;
  final int windowHours, largest, smallest;

  BoostLowVolumeTransactionsTask(VolumeSource volumes, RateStore store,
      TargetRateResolver resolver, RebalancingModel model, RatePublisher publisher,
      SamplingMetrics metrics, int windowHours, int largest, int smallest) {
    super(AlgorithmVariant.BOOST_LOW_VOLUME_TRANSACTIONS, metrics);
    this.volumes = volumes;
    this.store = store;
    this.resolver = resolver;
    this.model = model;
    this.executor = new GuardedExecutor(this.metrics);
    this.publisher = publisher;
    this.windowHours = windowHours;
    this.largest = largest;
    this.smallest = smallest;
  }

  @Override int activityWindowHours() {
    return windowHours;
  }

  @Override void process(long orgId) {
    Map<Long, TransactionVolumes> projects =
        volumes.transactionVolumes(orgId, windowHours, largest, smallest);
    if (projects.isEmpty()) {
      log.debug("org {} has no transactions in the last {}h", orgId, windowHours);
      return;
    }
    Map<RateKey, StoredRate> projectRates =
        store.getGroup(AlgorithmVariant.PER_PROJECT_BIAS, orgId);

    for (Map.Entry<Long, TransactionVolumes> project : new TreeMap<>(projects).entrySet()) {
      long projectId = project.getKey();
      StoredRate projectRate = projectRates.getOrDefault(
          RateKey.create(AlgorithmVariant.PER_PROJECT_BIAS, orgId, projectId), StoredRate.ABSENT);
      Optional<Double> target = resolver.resolveProject(orgId, projectRate);
      if (!target.isPresent()) {
        log.debug("target rate of project {} is undetermined", projectId);
        publisher.publishTransactions(variant, projectId, null, metrics);
        continue;
      }
      Map<Long, Double> rates = rebalance(projectId, target.get(), project.getValue());
      if (rates == null) continue; // keep what was published before
      log.debug("project {} at {}: transaction rates {}", projectId, target.get(), rates);
      publisher.publishTransactions(variant, projectId, rates, metrics);
    }
  }

  /** Returns rates by transaction id, or null if the model failed. */
  @Nullable Map<Long, Double> rebalance(long projectId, double target, TransactionVolumes volumes) {
    Map<Long, Double> rates = new LinkedHashMap<>();
    if (target >= 1.0) return rates;

    long implicitClasses = volumes.implicitClasses();
    if (volumes.total == 0) {
      for (VolumeRecord item : volumes.explicit) rates.put(item.entityId, target);
      if (implicitClasses > 0) rates.put(IMPLICIT, target);
      return rates;
    }

    // Each implicit transaction is assumed to have the average implicit count. They get negative
    // ids, which can't collide with explicit ones, and all end up with the same rate.
    List<VolumeRecord> items = new ArrayList<>(volumes.explicit);
    long implicitTotal = volumes.implicitTotal();
    long implicitCount = implicitTotal == 0
        ? 0L
        : Math.max(1L, Math.round((double) implicitTotal / implicitClasses));
    for (long i = 1; i <= implicitClasses; i++) {
      items.add(VolumeRecord.create(-i, implicitCount));
    }

    Optional<List<RebalancedItem>> rebalanced = executor.run(model,
        RebalancingInput.create(target, items), Tenant.project(projectId));
    if (!rebalanced.isPresent()) return null;
    for (RebalancedItem item : rebalanced.get()) {
      rates.put(item.id > 0 ? item.id : IMPLICIT, item.newRate);
    }
    return rates;
  }
}
