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
import ratekeeper.VolumeRecord;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Gives every child the same budget of kept events. With a target rate {@code r} and a total count
 * {@code N}, the kept budget {@code r * N} is shared so that each child keeps {@code L} events,
 * except where the policy bounds apply: {@code newRate = clamp(L / count, minRate, maxRate)}.
 *
 * <p>Small children are sampled more, large ones less, and the aggregate keeps {@code r * N}. For
 * example, a target of 0.25 over counts 9, 7, 3 and 1 gives {@code L = 4/3}: rates 0.148, 0.190,
 * 0.444 and 1.0 (the smallest child can't keep more than all its events).
 *
 * <p>Children without volume have nothing to bias from. They get the highest rate any child with
 * volume got, which is the target itself when all children are sampled equally.
 */
final class FullRebalancingModel implements RebalancingModel {
  static final int MAX_ITERATIONS = 200;

  final RebalancingPolicy policy;

  FullRebalancingModel(RebalancingPolicy policy) {
    this.policy = checkNotNull(policy, "policy");
  }

  @Override public RebalancingPolicy policy() {
    return policy;
  }

  @Override public List<RebalancedItem> run(RebalancingInput input) {
    long total = input.checkValid();
    double targetRate = input.targetRate;
    if (targetRate < policy.minRate - policy.tolerance
        || targetRate > policy.maxRate + policy.tolerance) {
      throw new InvalidModelInputException("targetRate " + targetRate + " can't be honored within ["
          + policy.minRate + ", " + policy.maxRate + "]");
    }

    double budget = policy.clamp(targetRate) * total;
    double level = keptPerChild(input.items, budget, policy.minRate, policy.maxRate);

    double[] rates = new double[input.items.size()];
    double neutralRate = policy.minRate;
    for (int i = 0; i < rates.length; i++) {
      long count = input.items.get(i).observedCount;
      if (count == 0) continue;
      rates[i] = policy.clamp(level / count);
      neutralRate = Math.max(neutralRate, rates[i]);
    }

    List<RebalancedItem> result = new ArrayList<>(rates.length);
    double kept = 0;
    for (int i = 0; i < rates.length; i++) {
      VolumeRecord item = input.items.get(i);
      double rate = item.observedCount == 0 ? neutralRate : rates[i];
      kept += rate * item.observedCount;
      result.add(RebalancedItem.create(item.entityId, item.observedCount, rate));
    }
    checkTargetPreserved(kept / total, targetRate, policy.tolerance);
    return result;
  }

  /**
   * Solves {@code sum(clamp(level, minRate * count, maxRate * count)) == budget} for {@code level}.
   * The sum is piecewise linear and non-decreasing in {@code level}, so a bisection finds the piece
   * holding the solution, which is then computed in closed form.
   */
  static double keptPerChild(List<VolumeRecord> items, double budget, double minRate,
      double maxRate) {
    double low = 0, high = 0;
    for (VolumeRecord item : items) {
      high = Math.max(high, maxRate * item.observedCount);
    }
    for (int i = 0; i < MAX_ITERATIONS; i++) {
      double mid = (low + high) / 2;
      if (mid <= low || mid >= high) break;
      if (kept(items, mid, minRate, maxRate) < budget) {
        low = mid;
      } else {
        high = mid;
      }
    }
    double level = (low + high) / 2;

    double saturated = 0;
    int free = 0;
    for (VolumeRecord item : items) {
      long count = item.observedCount;
      if (count == 0) continue;
      if (maxRate * count <= level) {
        saturated += maxRate * count;
      } else if (minRate * count >= level) {
        saturated += minRate * count;
      } else {
        free++;
      }
    }
    return free == 0 ? level : Math.max(0, (budget - saturated) / free);
  }

  static double kept(List<VolumeRecord> items, double level, double minRate, double maxRate) {
    double result = 0;
    for (VolumeRecord item : items) {
      long count = item.observedCount;
      result += Math.max(minRate * count, Math.min(maxRate * count, level));
    }
    return result;
  }

  static void checkTargetPreserved(double mean, double targetRate, double tolerance) {
    if (Math.abs(mean - targetRate) > tolerance) {
      throw new InvalidModelInputException("weighted mean " + mean + " is more than " + tolerance
          + " away from target " + targetRate);
    }
  }

  @Override public String toString() {
    return "FullRebalancingModel{" + policy + "}";
  }
}
