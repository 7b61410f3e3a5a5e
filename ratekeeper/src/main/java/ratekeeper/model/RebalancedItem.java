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

/** One entity's share of a rebalanced target rate. {@code 0 <= newRate <= 1}. */
// @Immutable
public final class RebalancedItem {

  public static RebalancedItem create(long id, long count, double newRate) {
    return new RebalancedItem(id, count, newRate);
  }

  public final long id;
  public final long count;
  public final double newRate;

  RebalancedItem(long id, long count, double newRate) {
    this.id = id;
    this.count = count;
    this.newRate = newRate;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RebalancedItem)) return false;
    RebalancedItem that = (RebalancedItem) o;
    return this.id == that.id
        && this.count == that.count
        && Double.compare(this.newRate, that.newRate) == 0;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= Long.hashCode(id);
    h *= 1000003;
    h ^= Long.hashCode(count);
    h *= 1000003;
    h ^= Double.hashCode(newRate);
    return h;
  }

  @Override public String toString() {
    return "RebalancedItem{id=" + id + ", count=" + count + ", newRate=" + newRate + "}";
  }
}
