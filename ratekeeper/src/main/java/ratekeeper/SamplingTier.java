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
 * A step of the volume based rate policy, as answered by {@link QuotaService#tierForVolume}. The
 * tiers themselves are owned by the quota service: their ordering is not re-validated here.
 */
// @Immutable
public final class SamplingTier {

  public static SamplingTier create(double thresholdVolume, double rate) {
    return new SamplingTier(thresholdVolume, rate);
  }

  public final double thresholdVolume;
  public final double rate;

  SamplingTier(double thresholdVolume, double rate) {
    checkArgument(rate >= 0 && rate <= 1, "rate should be between 0 and 1: was %s", rate);
    this.thresholdVolume = thresholdVolume;
    this.rate = rate;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SamplingTier)) return false;
    SamplingTier that = (SamplingTier) o;
    return Double.compare(this.thresholdVolume, that.thresholdVolume) == 0
        && Double.compare(this.rate, that.rate) == 0;
  }

  @Override public int hashCode() {
    return 31 * Double.hashCode(thresholdVolume) + Double.hashCode(rate);
  }

  @Override public String toString() {
    return "SamplingTier{thresholdVolume=" + thresholdVolume + ", rate=" + rate + "}";
  }
}
