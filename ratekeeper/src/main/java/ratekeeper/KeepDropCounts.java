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

/** Root events kept and dropped by the edge sampler for one organization in a short window. */
// @Immutable
public final class KeepDropCounts {

  public static KeepDropCounts create(long kept, long dropped) {
    return new KeepDropCounts(kept, dropped);
  }

  public final long kept;
  public final long dropped;

  KeepDropCounts(long kept, long dropped) {
    checkArgument(kept >= 0 && dropped >= 0, "negative count: kept=%s, dropped=%s", kept, dropped);
    this.kept = kept;
    this.dropped = dropped;
  }

  public long total() {
    return kept + dropped;
  }

  /** The rate the edge actually applied, or NaN when nothing was observed. */
  public double effectiveRate() {
    long total = total();
    return total == 0 ? Double.NaN : (double) kept / total;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof KeepDropCounts)) return false;
    KeepDropCounts that = (KeepDropCounts) o;
    return this.kept == that.kept && this.dropped == that.dropped;
  }

  @Override public int hashCode() {
    return 31 * Long.hashCode(kept) + Long.hashCode(dropped);
  }

  @Override public String toString() {
    return "KeepDropCounts{kept=" + kept + ", dropped=" + dropped + "}";
  }
}
