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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import ratekeeper.VolumeRecord;

import static com.google.common.base.Preconditions.checkNotNull;

/** The aggregate rate to honor, and the children to spread it across. */
// @Immutable
public final class RebalancingInput {

  public static RebalancingInput create(double targetRate, List<VolumeRecord> items) {
    return new RebalancingInput(targetRate, items);
  }

  public final double targetRate;
  public final List<VolumeRecord> items;

  RebalancingInput(double targetRate, List<VolumeRecord> items) {
    this.targetRate = targetRate;
    this.items = Collections.unmodifiableList(new ArrayList<>(checkNotNull(items, "items")));
  }

  /** Returns the total count, after rejecting input that has no defined rebalancing. */
  long checkValid() {
    if (Double.isNaN(targetRate) || targetRate < 0 || targetRate > 1) {
      throw new InvalidModelInputException(
          "targetRate should be between 0 and 1: was " + targetRate);
    }
    if (items.isEmpty()) throw new InvalidModelInputException("no items to rebalance");
    Set<Long> ids = new HashSet<>();
    long total = 0;
    for (VolumeRecord item : items) {
      if (!ids.add(item.entityId)) {
        throw new InvalidModelInputException("duplicate item " + item.entityId);
      }
      total += item.observedCount;
    }
    if (total <= 0) {
      throw new InvalidModelInputException("all " + items.size() + " items have zero count");
    }
    return total;
  }

  @Override public String toString() {
    int size = items.size();
    return "RebalancingInput{targetRate=" + targetRate + ", items="
        + (size <= 10 ? items.toString() : size + " items") + "}";
  }
}
