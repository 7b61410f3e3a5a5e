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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Numeric bounds of rebalancing. The defaults impose no floor or ceiling beyond {@code [0, 1]};
 * deployments choose their own policy.
 */
// @Immutable
public final class RebalancingPolicy {
  public static final RebalancingPolicy DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    double minRate = 0.0, maxRate = 1.0, tolerance = 0.005, intensity = 1.0;

    Builder() {
    }

    Builder(RebalancingPolicy source) {
      this.minRate = source.minRate;
      this.maxRate = source.maxRate;
      this.tolerance = source.tolerance;
      this.intensity = source.intensity;
    }

    /** Floor for any one entity, preventing total starvation. Defaults to 0.0 */
    public Builder minRate(double minRate) {
      checkArgument(minRate >= 0 && minRate <= 1, "minRate should be between 0 and 1: was %s",
          minRate);
      this.minRate = minRate;
      return this;
    }

    /** Ceiling for any one entity. Defaults to 1.0 */
    public Builder maxRate(double maxRate) {
      checkArgument(maxRate >= 0 && maxRate <= 1, "maxRate should be between 0 and 1: was %s",
          maxRate);
      this.maxRate = maxRate;
      return this;
    }

    /**
     * Largest allowed difference between the count-weighted mean of the output rates and the
     * target. Defaults to 0.005
     */
    public Builder tolerance(double tolerance) {
      checkArgument(tolerance > 0 && tolerance < 1, "tolerance should be in (0, 1): was %s",
          tolerance);
      this.tolerance = tolerance;
      return this;
    }

    /**
     * How far {@link ModelType#INTENSITY_REBALANCING} moves from the uniform rate towards full
     * rebalancing: 0 keeps everyone at the target, 1 is full rebalancing. Defaults to 1.0
     */
    public Builder intensity(double intensity) {
      checkArgument(intensity >= 0 && intensity <= 1,
          "intensity should be between 0 and 1: was %s", intensity);
      this.intensity = intensity;
      return this;
    }

    public RebalancingPolicy build() {
      checkArgument(minRate <= maxRate, "minRate %s > maxRate %s", minRate, maxRate);
      return new RebalancingPolicy(this);
    }
  }

  public final double minRate, maxRate, tolerance, intensity;

  RebalancingPolicy(Builder builder) {
    this.minRate = builder.minRate;
    this.maxRate = builder.maxRate;
    this.tolerance = builder.tolerance;
    this.intensity = builder.intensity;
  }

  double clamp(double rate) {
    return Math.max(minRate, Math.min(maxRate, rate));
  }

  @Override public String toString() {
    return "RebalancingPolicy{minRate=" + minRate + ", maxRate=" + maxRate
        + ", tolerance=" + tolerance + ", intensity=" + intensity + "}";
  }
}
