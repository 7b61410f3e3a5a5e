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

import java.time.Duration;
import ratekeeper.model.ModelType;
import ratekeeper.model.RebalancingPolicy;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tunables of every cycle. Created once per process, usually from properties, and never mutated.
 * None of the defaults encode business policy: rate bounds default to {@code [0, 1]}.
 */
// @Immutable
public final class RatekeeperConfig {
  public static final RatekeeperConfig DEFAULT = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static final class Builder {
    ModelType modelType = ModelType.FULL_REBALANCING;
    RebalancingPolicy rebalancingPolicy = RebalancingPolicy.DEFAULT;
    double invalidationEpsilon = 0.01;
    Duration ttl = Duration.ofHours(24);
    int referenceHours = 30 * 24;
    int biasWindowHours = 1;
    int transactionWindowHours = 1;
    int largeTransactions = 30, smallTransactions = 0;
    double transactionIntensity = 0.8;
    boolean slidingWindowEnabled = true;
    int slidingWindowHours = 24;
    int recalibrationWindowMinutes = 5;
    double recalibrationTolerance = 0.001;
    double minFactor = 0.1, maxFactor = 10.0;
    int pageSize = 100;
    int concurrency = 4;
    int maxRetries = 3;
    Duration retryBackoff = Duration.ofMillis(100);
    Duration softDeadline = Duration.ofMinutes(10);
    Duration unitDeadline = Duration.ofSeconds(60);
    Duration cycleDeadline = Duration.ofMinutes(30);

    Builder() {
    }

    Builder(RatekeeperConfig source) {
      this.modelType = source.modelType;
      this.rebalancingPolicy = source.rebalancingPolicy;
      this.invalidationEpsilon = source.invalidationEpsilon;
      this.ttl = source.ttl;
      this.referenceHours = source.referenceHours;
      this.biasWindowHours = source.biasWindowHours;
      this.transactionWindowHours = source.transactionWindowHours;
      this.largeTransactions = source.largeTransactions;
      this.smallTransactions = source.smallTransactions;
      this.transactionIntensity = source.transactionIntensity;
      this.slidingWindowEnabled = source.slidingWindowEnabled;
      this.slidingWindowHours = source.slidingWindowHours;
      this.recalibrationWindowMinutes = source.recalibrationWindowMinutes;
      this.recalibrationTolerance = source.recalibrationTolerance;
      this.minFactor = source.minFactor;
      this.maxFactor = source.maxFactor;
      this.pageSize = source.pageSize;
      this.concurrency = source.concurrency;
      this.maxRetries = source.maxRetries;
      this.retryBackoff = source.retryBackoff;
      this.softDeadline = source.softDeadline;
      this.unitDeadline = source.unitDeadline;
      this.cycleDeadline = source.cycleDeadline;
    }

    /** Model used to spread an organization's rate across its projects. */
    public Builder modelType(ModelType modelType) {
      this.modelType = checkNotNull(modelType, "modelType");
      return this;
    }

    public Builder rebalancingPolicy(RebalancingPolicy rebalancingPolicy) {
      this.rebalancingPolicy = checkNotNull(rebalancingPolicy, "rebalancingPolicy");
      return this;
    }

    /** Smallest rate change that tells readers to reload. Defaults to 0.01 */
    public Builder invalidationEpsilon(double invalidationEpsilon) {
      checkArgument(invalidationEpsilon >= 0 && invalidationEpsilon < 1,
          "invalidationEpsilon should be in [0, 1): was %s", invalidationEpsilon);
      this.invalidationEpsilon = invalidationEpsilon;
      return this;
    }

    /** How long a published rate is honored if no later cycle rewrites it. Defaults to 24 hours */
    public Builder ttl(Duration ttl) {
      this.ttl = checkPositive(ttl, "ttl");
      return this;
    }

    /** Period volumes are extrapolated to before tier lookup. Defaults to 720 (30 days) */
    public Builder referenceHours(int referenceHours) {
      checkArgument(referenceHours > 0, "referenceHours <= 0: %s", referenceHours);
      this.referenceHours = referenceHours;
      return this;
    }

    /** Window of project volumes used for per-project bias. Defaults to 1 */
    public Builder biasWindowHours(int biasWindowHours) {
      checkArgument(biasWindowHours > 0, "biasWindowHours <= 0: %s", biasWindowHours);
      this.biasWindowHours = biasWindowHours;
      return this;
    }

    /** Window of transaction volumes used to boost low volume transactions. Defaults to 1 */
    public Builder transactionWindowHours(int transactionWindowHours) {
      checkArgument(transactionWindowHours > 0, "transactionWindowHours <= 0: %s",
          transactionWindowHours);
      this.transactionWindowHours = transactionWindowHours;
      return this;
    }

    /**
     * How many of a project's busiest transactions get their own rate. The others share one
     * implicit rate. Defaults to 30
     */
    public Builder largeTransactions(int largeTransactions) {
      checkArgument(largeTransactions >= 0, "largeTransactions < 0: %s", largeTransactions);
      this.largeTransactions = largeTransactions;
      return this;
    }

    /** How many of a project's quietest transactions get their own rate. Defaults to 0 */
    public Builder smallTransactions(int smallTransactions) {
      checkArgument(smallTransactions >= 0, "smallTransactions < 0: %s", smallTransactions);
      this.smallTransactions = smallTransactions;
      return this;
    }

    /**
     * Intensity of rebalancing across transactions, between the project rate (0) and full
     * rebalancing (1). Defaults to 0.8
     */
    public Builder transactionIntensity(double transactionIntensity) {
      checkArgument(transactionIntensity >= 0 && transactionIntensity <= 1,
          "transactionIntensity should be between 0 and 1: was %s", transactionIntensity);
      this.transactionIntensity = transactionIntensity;
      return this;
    }

    /**
     * When false, target rates come from the blended rate only, ignoring sliding window output.
     * Defaults to true
     */
    public Builder slidingWindowEnabled(boolean slidingWindowEnabled) {
      this.slidingWindowEnabled = slidingWindowEnabled;
      return this;
    }

    /** Trailing window the sliding window variants extrapolate from. Defaults to 24 */
    public Builder slidingWindowHours(int slidingWindowHours) {
      checkArgument(slidingWindowHours > 0, "slidingWindowHours <= 0: %s", slidingWindowHours);
      this.slidingWindowHours = slidingWindowHours;
      return this;
    }

    /** Window of keep and drop counts used for recalibration. Defaults to 5 */
    public Builder recalibrationWindowMinutes(int recalibrationWindowMinutes) {
      checkArgument(recalibrationWindowMinutes > 0, "recalibrationWindowMinutes <= 0: %s",
          recalibrationWindowMinutes);
      this.recalibrationWindowMinutes = recalibrationWindowMinutes;
      return this;
    }

    /** Factors this close to 1.0 are neutral and their key is removed. Defaults to 0.001 */
    public Builder recalibrationTolerance(double recalibrationTolerance) {
      checkArgument(recalibrationTolerance >= 0, "recalibrationTolerance < 0: %s",
          recalibrationTolerance);
      this.recalibrationTolerance = recalibrationTolerance;
      return this;
    }

    /** Factors below this are considered broken and their key is removed. Defaults to 0.1 */
    public Builder minFactor(double minFactor) {
      checkArgument(minFactor > 0, "minFactor <= 0: %s", minFactor);
      this.minFactor = minFactor;
      return this;
    }

    /** Factors above this are considered broken and their key is removed. Defaults to 10.0 */
    public Builder maxFactor(double maxFactor) {
      checkArgument(maxFactor > 0, "maxFactor <= 0: %s", maxFactor);
      this.maxFactor = maxFactor;
      return this;
    }

    /** Organizations fetched and dispatched at a time. Defaults to 100 */
    public Builder pageSize(int pageSize) {
      checkArgument(pageSize > 0, "pageSize <= 0: %s", pageSize);
      this.pageSize = pageSize;
      return this;
    }

    /** Units of work in flight at once. Defaults to 4 */
    public Builder concurrency(int concurrency) {
      checkArgument(concurrency > 0, "concurrency <= 0: %s", concurrency);
      this.concurrency = concurrency;
      return this;
    }

    /** Attempts repeated after a transient failure. Defaults to 3 */
    public Builder maxRetries(int maxRetries) {
      checkArgument(maxRetries >= 0, "maxRetries < 0: %s", maxRetries);
      this.maxRetries = maxRetries;
      return this;
    }

    /** Delay before the first retry, doubled for each following one. Defaults to 100ms */
    public Builder retryBackoff(Duration retryBackoff) {
      checkNotNull(retryBackoff, "retryBackoff");
      checkArgument(!retryBackoff.isNegative(), "retryBackoff < 0: %s", retryBackoff);
      this.retryBackoff = retryBackoff;
      return this;
    }

    /** After this, no more pages are dispatched and the rest waits for the next cycle. */
    public Builder softDeadline(Duration softDeadline) {
      this.softDeadline = checkPositive(softDeadline, "softDeadline");
      return this;
    }

    /** A unit of work running longer than this is interrupted and counted failed. */
    public Builder unitDeadline(Duration unitDeadline) {
      this.unitDeadline = checkPositive(unitDeadline, "unitDeadline");
      return this;
    }

    /** The longest a cycle waits for its units, after which the rest are cancelled. */
    public Builder cycleDeadline(Duration cycleDeadline) {
      this.cycleDeadline = checkPositive(cycleDeadline, "cycleDeadline");
      return this;
    }

    public RatekeeperConfig build() {
      checkArgument(minFactor <= maxFactor, "minFactor %s > maxFactor %s", minFactor, maxFactor);
      checkArgument(softDeadline.compareTo(cycleDeadline) <= 0,
          "softDeadline %s > cycleDeadline %s", softDeadline, cycleDeadline);
      return new RatekeeperConfig(this);
    }

    static Duration checkPositive(Duration duration, String name) {
      checkNotNull(duration, name);
      checkArgument(!duration.isNegative() && !duration.isZero(), "%s <= 0: %s", name, duration);
      return duration;
    }
  }

  public final ModelType modelType;
  public final RebalancingPolicy rebalancingPolicy;
  public final double invalidationEpsilon;
  public final Duration ttl;
  public final int referenceHours;
  public final int biasWindowHours;
  public final int transactionWindowHours;
  public final int largeTransactions, smallTransactions;
  public final double transactionIntensity;
  public final boolean slidingWindowEnabled;
  public final int slidingWindowHours;
  public final int recalibrationWindowMinutes;
  public final double recalibrationTolerance;
  public final double minFactor, maxFactor;
  public final int pageSize;
  public final int concurrency;
  public final int maxRetries;
  public final Duration retryBackoff;
  public final Duration softDeadline;
  public final Duration unitDeadline;
  public final Duration cycleDeadline;

  RatekeeperConfig(Builder builder) {
    this.modelType = builder.modelType;
    this.rebalancingPolicy = builder.rebalancingPolicy;
    this.invalidationEpsilon = builder.invalidationEpsilon;
    this.ttl = builder.ttl;
    this.referenceHours = builder.referenceHours;
    this.biasWindowHours = builder.biasWindowHours;
    this.transactionWindowHours = builder.transactionWindowHours;
    this.largeTransactions = builder.largeTransactions;
    this.smallTransactions = builder.smallTransactions;
    this.transactionIntensity = builder.transactionIntensity;
    this.slidingWindowEnabled = builder.slidingWindowEnabled;
    this.slidingWindowHours = builder.slidingWindowHours;
    this.recalibrationWindowMinutes = builder.recalibrationWindowMinutes;
    this.recalibrationTolerance = builder.recalibrationTolerance;
    this.minFactor = builder.minFactor;
    this.maxFactor = builder.maxFactor;
    this.pageSize = builder.pageSize;
    this.concurrency = builder.concurrency;
    this.maxRetries = builder.maxRetries;
    this.retryBackoff = builder.retryBackoff;
    this.softDeadline = builder.softDeadline;
    this.unitDeadline = builder.unitDeadline;
    this.cycleDeadline = builder.cycleDeadline;
  }

  @Override public String toString() {
    return "RatekeeperConfig{modelType=" + modelType
        + ", rebalancingPolicy=" + rebalancingPolicy
        + ", invalidationEpsilon=" + invalidationEpsilon
        + ", ttl=" + ttl
        + ", referenceHours=" + referenceHours
        + ", biasWindowHours=" + biasWindowHours
        + ", transactionWindowHours=" + transactionWindowHours
        + ", largeTransactions=" + largeTransactions
        + ", smallTransactions=" + smallTransactions
        + ", transactionIntensity=" + transactionIntensity
        + ", slidingWindowEnabled=" + slidingWindowEnabled
        + ", slidingWindowHours=" + slidingWindowHours
        + ", recalibrationWindowMinutes=" + recalibrationWindowMinutes
        + ", recalibrationTolerance=" + recalibrationTolerance
        + ", minFactor=" + minFactor
        + ", maxFactor=" + maxFactor
        + ", pageSize=" + pageSize
        + ", concurrency=" + concurrency
        + ", maxRetries=" + maxRetries
        + ", retryBackoff=" + retryBackoff
        + ", softDeadline=" + softDeadline
        + ", unitDeadline=" + unitDeadline
        + ", cycleDeadline=" + cycleDeadline
        + "}";
  }
}
