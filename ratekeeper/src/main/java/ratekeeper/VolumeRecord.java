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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Count of root events observed for one entity in a window. Recomputed every cycle from the
 * {@link VolumeSource}, never persisted.
 */
// @Immutable
public final class VolumeRecord {

  public static VolumeRecord create(long entityId, long observedCount) {
    return new VolumeRecord(entityId, observedCount);
  }

  public final long entityId;
  public final long observedCount;

  VolumeRecord(long entityId, long observedCount) {
    checkArgument(observedCount >= 0, "observedCount < 0: %s", observedCount);
    this.entityId = entityId;
    this.observedCount = observedCount;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof VolumeRecord)) return false;
    VolumeRecord that = (VolumeRecord) o;
    return this.entityId == that.entityId && this.observedCount == that.observedCount;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((entityId >>> 32) ^ entityId);
    h *= 1000003;
    h ^= (int) ((observedCount >>> 32) ^ observedCount);
    return h;
  }

  @Override public String toString() {
    return "VolumeRecord{entityId=" + entityId + ", observedCount=" + observedCount + "}";
  }
}
