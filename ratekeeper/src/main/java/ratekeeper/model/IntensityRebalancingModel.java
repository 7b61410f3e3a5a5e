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
package ratekeeper.model;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Moves each child from the target rate towards its {@link FullRebalancingModel fully rebalanced}
 * rate by the policy intensity: {@code newRate = r + intensity * (full - r)}.
 *
 * <p>Both ends preserve the target and favor smaller children, so does any blend of them. This lets
 * a deployment boost low volume children less aggressively than full rebalancing would.
 */
final class IntensityRebalancingModel implements RebalancingModel {
  final RebalancingPolicy policy;
  final FullRebalancingModel full;

  IntensityRebalancingModel(RebalancingPolicy policy) {
    this.policy = checkNotNull(policy, "policy");
    this.full = new FullRebalancingModel(policy);
  }

  @Override public RebalancingPolicy policy() {
    return policy;
  }

  @Override public List<RebalancedItem> run(RebalancingInput input) {
    List<RebalancedItem> rebalanced = full.run(input);
    double targetRate = input.targetRate;
    double intensity = policy.intensity;

    List<RebalancedItem> result = new ArrayList<>(rebalanced.size());
    double kept = 0;
    long total = 0;
    for (RebalancedItem item : rebalanced) {
      double rate = policy.clamp(targetRate + intensity * (item.newRate - targetRate));
      kept += rate * item.count;
      total += item.count;
      result.add(RebalancedItem.create(item.id, item.count, rate));
    }
    FullRebalancingModel.checkTargetPreserved(kept / total, targetRate, policy.tolerance);
    return result;
  }

  @Override public String toString() {
    return "IntensityRebalancingModel{" + policy + "}";
  }
}
