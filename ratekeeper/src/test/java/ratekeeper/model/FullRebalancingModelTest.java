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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import ratekeeper.VolumeRecord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class FullRebalancingModelTest {
  RebalancingModel model = ModelType.FULL_REBALANCING.newModel(RebalancingPolicy.DEFAULT);

  @Test public void equalKeptBudget() {
    List<RebalancedItem> result = model.run(input(0.25, 9, 7, 3, 1));

    assertThat(result).extracting(i -> i.id).containsExactly(1L, 2L, 3L, 4L);
    assertThat(result.get(0).newRate).isCloseTo(0.14814814814814817, within(1e-9));
    assertThat(result.get(1).newRate).isCloseTo(0.1904761904761905, within(1e-9));
    assertThat(result.get(2).newRate).isCloseTo(0.4444444444444444, within(1e-9));
    assertThat(result.get(3).newRate).isEqualTo(1.0);
  }

  @Test public void equalCountsGetTheTarget() {
    for (RebalancedItem item : model.run(input(0.3, 50, 50, 50))) {
      assertThat(item.newRate).isCloseTo(0.3, within(1e-9));
    }
  }

  @Test public void zeroCountGetsTheNeutralRate() {
    List<RebalancedItem> result = model.run(input(0.5, 100, 0));

    assertThat(result).hasSize(2);
    assertThat(result.get(0).newRate).isCloseTo(0.5, within(1e-9));
    assertThat(result.get(1).newRate).isCloseTo(0.5, within(1e-9));
    assertThat(result.get(1).count).isZero();
  }

  /** A zero count item never gets less than a busier one. */
  @Test public void zeroCountGetsTheHighestRate() {
    List<RebalancedItem> result = model.run(input(0.25, 9, 0, 7, 3, 1));

    assertThat(result.get(1).newRate).isEqualTo(1.0);
  }

  @Test public void keepsEverythingAtFullRate() {
    for (RebalancedItem item : model.run(input(1.0, 1000, 10, 1))) {
      assertThat(item.newRate).isEqualTo(1.0);
    }
  }

  @Test public void dropsEverythingAtZeroRate() {
    for (RebalancedItem item : model.run(input(0.0, 1000, 10, 0))) {
      assertThat(item.newRate).isZero();
    }
  }

  @Test public void respectsPolicyBounds() {
    RebalancingModel bounded = ModelType.FULL_REBALANCING.newModel(
        RebalancingPolicy.newBuilder().minRate(0.1).maxRate(0.8).build());

    List<RebalancedItem> result = bounded.run(input(0.25, 100000, 100, 1));

    assertThat(result).allSatisfy(i -> assertThat(i.newRate).isBetween(0.1, 0.8));
    assertThat(result.get(2).newRate).isEqualTo(0.8);
    assertThat(weightedMean(result)).isCloseTo(0.25, within(0.005));
  }

  @Test public void targetOutsideBounds() {
    RebalancingModel bounded = ModelType.FULL_REBALANCING.newModel(
        RebalancingPolicy.newBuilder().minRate(0.1).maxRate(0.8).build());

    assertThatThrownBy(() -> bounded.run(input(0.9, 10, 20)))
        .isInstanceOf(InvalidModelInputException.class);
    assertThatThrownBy(() -> bounded.run(input(0.05, 10, 20)))
        .isInstanceOf(InvalidModelInputException.class);
  }

  @Test public void degenerateInput() {
    assertThatThrownBy(() -> model.run(RebalancingInput.create(0.5, Collections.emptyList())))
        .isInstanceOf(InvalidModelInputException.class)
        .hasMessage("no items to rebalance");
    assertThatThrownBy(() -> model.run(input(0.5, 0, 0)))
        .isInstanceOf(InvalidModelInputException.class);
    assertThatThrownBy(() -> model.run(input(Double.NaN, 1, 2)))
        .isInstanceOf(InvalidModelInputException.class);
    assertThatThrownBy(() -> model.run(input(1.5, 1, 2)))
        .isInstanceOf(InvalidModelInputException.class);
    assertThatThrownBy(() -> model.run(RebalancingInput.create(0.5,
        Arrays.asList(VolumeRecord.create(1, 10), VolumeRecord.create(1, 20)))))
        .isInstanceOf(InvalidModelInputException.class)
        .hasMessage("duplicate item 1");
  }

  @Test public void negativeCountRejectedOnCreation() {
    assertThatThrownBy(() -> VolumeRecord.create(1, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test public void deterministic() {
    RebalancingInput input = input(0.17, 500, 3, 77, 0, 12000);

    assertThat(model.run(input)).isEqualTo(model.run(input));
  }

  /** Checks bounds, fairness and target preservation over many random inputs. */
  @Test public void invariantsHoldForRandomInput() {
    Random random = new Random(42);
    for (int run = 0; run < 500; run++) {
      double minRate = random.nextBoolean() ? 0.0 : random.nextDouble() * 0.2;
      double maxRate = random.nextBoolean() ? 1.0 : 0.5 + random.nextDouble() * 0.5;
      RebalancingModel bounded = ModelType.FULL_REBALANCING.newModel(
          RebalancingPolicy.newBuilder().minRate(minRate).maxRate(maxRate).build());
      double targetRate = minRate + random.nextDouble() * (maxRate - minRate);

      int size = 1 + random.nextInt(30);
      long[] counts = new long[size];
      for (int i = 0; i < size; i++) {
        counts[i] = random.nextInt(4) == 0 ? 0 : 1 + (long) (random.nextDouble() * 1_000_000);
      }
      counts[random.nextInt(size)] = 1 + random.nextInt(1000); // at least one with volume

      List<RebalancedItem> result = bounded.run(input(targetRate, counts));

      assertThat(result).allSatisfy(i -> assertThat(i.newRate).isBetween(minRate, maxRate));
      assertThat(weightedMean(result)).isCloseTo(targetRate, within(0.005));
      assertFair(result);
    }
  }

  static void assertFair(List<RebalancedItem> result) {
    for (RebalancedItem a : result) {
      for (RebalancedItem b : result) {
        if (a.count < b.count) {
          assertThat(a.newRate).isGreaterThanOrEqualTo(b.newRate - 1e-12);
        }
      }
    }
  }

  static double weightedMean(List<RebalancedItem> result) {
    double kept = 0;
    long total = 0;
    for (RebalancedItem item : result) {
      kept += item.newRate * item.count;
      total += item.count;
    }
    return kept / total;
  }

  /** Items are numbered from 1 in the order of their counts. */
  static RebalancingInput input(double targetRate, long... counts) {
    List<VolumeRecord> items = new ArrayList<>();
    for (int i = 0; i < counts.length; i++) {
      items.add(VolumeRecord.create(i + 1, counts[i]));
    }
    return RebalancingInput.create(targetRate, items);
  }
}
