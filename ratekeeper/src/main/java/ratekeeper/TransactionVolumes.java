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
package ratekeeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Root transaction counts of one project. Only the largest and smallest transactions are listed
 * explicitly: the rest are summarized by their total count and how many there are.
 */
// @Immutable
public final class TransactionVolumes {

  /**
   * @param explicit transactions by positive id, each listed once
   * @param total count of all transactions of the project, explicit or not
   * @param classes number of distinct transactions of the project, explicit or not
   */
  public static TransactionVolumes create(List<VolumeRecord> explicit, long total, long classes) {
    return new TransactionVolumes(explicit, total, classes);
  }

  public final List<VolumeRecord> explicit;
  public final long total;
  public final long classes;

  TransactionVolumes(List<VolumeRecord> explicit, long total, long classes) {
    this.explicit =
        Collections.unmodifiableList(new ArrayList<>(checkNotNull(explicit, "explicit")));
    long explicitTotal = 0;
    for (VolumeRecord record : this.explicit) {
      checkArgument(record.entityId > 0, "transaction ids are positive: was %s", record.entityId);
      explicitTotal += record.observedCount;
    }
    checkArgument(total >= explicitTotal, "total %s < explicit total %s", total, explicitTotal);
    checkArgument(classes >= this.explicit.size(), "classes %s < explicit transactions %s",
        classes, this.explicit.size());
    this.total = total;
    this.classes = classes;
  }

  /** Count of the transactions that aren't listed explicitly. */
  public long implicitTotal() {
    long result = total;
    for (VolumeRecord record : explicit) result -= record.observedCount;
    return result;
  }

  public long implicitClasses() {
    return classes - explicit.size();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TransactionVolumes)) return false;
    TransactionVolumes that = (TransactionVolumes) o;
    return this.explicit.equals(that.explicit)
        && this.total == that.total
        && this.classes == that.classes;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= explicit.hashCode();
    h *= 1000003;
    h ^= (int) ((total >>> 32) ^ total);
    h *= 1000003;
    h ^= (int) ((classes >>> 32) ^ classes);
    return h;
  }

  @Override public String toString() {
    return "TransactionVolumes{explicit=" + explicit + ", total=" + total + ", classes=" + classes
        + "}";
  }
}
