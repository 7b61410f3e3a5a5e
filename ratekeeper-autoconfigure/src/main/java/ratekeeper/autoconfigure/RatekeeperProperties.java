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
package ratekeeper.autoconfigure;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import ratekeeper.RatekeeperConfig;
import ratekeeper.model.ModelType;
import ratekeeper.model.RebalancingPolicy;

@ConfigurationProperties("ratekeeper")
public class RatekeeperProperties {
  private ModelType modelType = ModelType.FULL_REBALANCING;
  private double minRate = 0.0;
  private double maxRate = 1.0;
  private double tolerance = 0.005;
  private double intensity = 1.0;
  private double invalidationEpsilon = 0.01;
  private Duration ttl = Duration.ofHours(24);
  private int referenceHours = 30 * 24;
  private int biasWindowHours = 1;
  private boolean slidingWindowEnabled = true;
  private int slidingWindowHours = 24;
  private int recalibrationWindowMinutes = 5;
  private double recalibrationTolerance = 0.001;
  private double minFactor = 0.1;
  private double maxFactor = 10.0;
  private int transactionWindowHours = 1;
  private int largeTransactions = 30;
  private int smallTransactions = 0;
  private double transactionIntensity = 0.8;
  private int pageSize = 100;
  private int concurrency = 4;
  private int maxRetries = 3;
  private Duration retryBackoff = Duration.ofMillis(100);
  private Duration softDeadline = Duration.ofMinutes(10);
  private Duration unitDeadline = Duration.ofSeconds(60);
  private Duration cycleDeadline = Duration.ofMinutes(30);
  private final ZooKeeper zookeeper = new ZooKeeper();
  private final Scheduler scheduler = new Scheduler();

  public ModelType getModelType() {
    return modelType;
  }

  public void setModelType(ModelType modelType) {
    this.modelType = modelType;
  }

  public double getMinRate() {
    return minRate;
  }

  public void setMinRate(double minRate) {
    this.minRate = minRate;
  }

  public double getMaxRate() {
    return maxRate;
  }

  public void setMaxRate(double maxRate) {
    this.maxRate = maxRate;
  }

  public double getTolerance() {
    return tolerance;
  }

  public void setTolerance(double tolerance) {
    this.tolerance = tolerance;
  }

  public double getIntensity() {
    return intensity;
  }

  public void setIntensity(double intensity) {
    this.intensity = intensity;
  }

  public double getInvalidationEpsilon() {
    return invalidationEpsilon;
  }

  public void setInvalidationEpsilon(double invalidationEpsilon) {
    this.invalidationEpsilon = invalidationEpsilon;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public int getReferenceHours() {
    return referenceHours;
  }

  public void setReferenceHours(int referenceHours) {
    this.referenceHours = referenceHours;
  }

  public int getBiasWindowHours() {
    return biasWindowHours;
  }

  public void setBiasWindowHours(int biasWindowHours) {
    this.biasWindowHours = biasWindowHours;
  }

  public boolean isSlidingWindowEnabled() {
    return slidingWindowEnabled;
  }

  public void setSlidingWindowEnabled(boolean slidingWindowEnabled) {
    this.slidingWindowEnabled = slidingWindowEnabled;
  }

  public int getSlidingWindowHours() {
    return slidingWindowHours;
  }

  public void setSlidingWindowHours(int slidingWindowHours) {
    this.slidingWindowHours = slidingWindowHours;
  }

  public int getRecalibrationWindowMinutes() {
    return recalibrationWindowMinutes;
  }

  public void setRecalibrationWindowMinutes(int recalibrationWindowMinutes) {
    this.recalibrationWindowMinutes = recalibrationWindowMinutes;
  }

  public double getRecalibrationTolerance() {
    return recalibrationTolerance;
  }

  public void setRecalibrationTolerance(double recalibrationTolerance) {
    this.recalibrationTolerance = recalibrationTolerance;
  }

  public double getMinFactor() {
    return minFactor;
  }

  public void setMinFactor(double minFactor) {
    this.minFactor = minFactor;
  }

  public double getMaxFactor() {
    return maxFactor;
  }

  public void setMaxFactor(double maxFactor) {
    this.maxFactor = maxFactor;
  }

  public int getTransactionWindowHours() {
    return transactionWindowHours;
  }

  public void setTransactionWindowHours(int transactionWindowHours) {
    this.transactionWindowHours = transactionWindowHours;
  }

  /** How many of the most frequent transactions of a project get their own rate. */
  public int getLargeTransactions() {
    return largeTransactions;
  }

  public void setLargeTransactions(int largeTransactions) {
    this.largeTransactions = largeTransactions;
  }

  /** How many of the least frequent transactions of a project get their own rate. */
  public int getSmallTransactions() {
    return smallTransactions;
  }

  public void setSmallTransactions(int smallTransactions) {
    this.smallTransactions = smallTransactions;
  }

  public double getTransactionIntensity() {
    return transactionIntensity;
  }

  public void setTransactionIntensity(double transactionIntensity) {
    this.transactionIntensity = transactionIntensity;
  }

  public int getPageSize() {
    return pageSize;
  }

  public void setPageSize(int pageSize) {
    this.pageSize = pageSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getRetryBackoff() {
    return retryBackoff;
  }

  public void setRetryBackoff(Duration retryBackoff) {
    this.retryBackoff = retryBackoff;
  }

  public Duration getSoftDeadline() {
    return softDeadline;
  }

  public void setSoftDeadline(Duration softDeadline) {
    this.softDeadline = softDeadline;
  }

  public Duration getUnitDeadline() {
    return unitDeadline;
  }

  public void setUnitDeadline(Duration unitDeadline) {
    this.unitDeadline = unitDeadline;
  }

  public Duration getCycleDeadline() {
    return cycleDeadline;
  }

  public void setCycleDeadline(Duration cycleDeadline) {
    this.cycleDeadline = cycleDeadline;
  }

  public ZooKeeper getZookeeper() {
    return zookeeper;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public RatekeeperConfig toConfig() {
    return RatekeeperConfig.newBuilder()
        .modelType(modelType)
        .rebalancingPolicy(RebalancingPolicy.newBuilder()
            .minRate(minRate)
            .maxRate(maxRate)
            .tolerance(tolerance)
            .intensity(intensity)
            .build())
        .invalidationEpsilon(invalidationEpsilon)
        .ttl(ttl)
        .referenceHours(referenceHours)
        .biasWindowHours(biasWindowHours)
        .slidingWindowEnabled(slidingWindowEnabled)
        .slidingWindowHours(slidingWindowHours)
        .recalibrationWindowMinutes(recalibrationWindowMinutes)
        .recalibrationTolerance(recalibrationTolerance)
        .minFactor(minFactor)
        .maxFactor(maxFactor)
        .transactionWindowHours(transactionWindowHours)
        .largeTransactions(largeTransactions)
        .smallTransactions(smallTransactions)
        .transactionIntensity(transactionIntensity)
        .pageSize(pageSize)
        .concurrency(concurrency)
        .maxRetries(maxRetries)
        .retryBackoff(retryBackoff)
        .softDeadline(softDeadline)
        .unitDeadline(unitDeadline)
        .cycleDeadline(cycleDeadline)
        .build();
  }

  public static class ZooKeeper {
    private String connect;
    private String basePath = "/ratekeeper";
    private String id;
    private Duration sessionTimeout = Duration.ofSeconds(60);

    /** Connect string, ex. "zk1:2181,zk2:2181". The rate store is in-memory when unset. */
    public String getConnect() {
      return connect;
    }

    public void setConnect(String connect) {
      this.connect = "".equals(connect) ? null : connect;
    }

    /** Rates are published under {@code basePath + "/rates"}, the election is beside them. */
    public String getBasePath() {
      return basePath;
    }

    public void setBasePath(String basePath) {
      this.basePath = basePath;
    }

    /** Name of this host in the leader election. Defaults to a random UUID. */
    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = "".equals(id) ? null : id;
    }

    public Duration getSessionTimeout() {
      return sessionTimeout;
    }

    public void setSessionTimeout(Duration sessionTimeout) {
      this.sessionTimeout = sessionTimeout;
    }
  }

  /** Fixed-rate runs of each cycle. A null interval leaves that cycle unscheduled. */
  public static class Scheduler {
    private boolean enabled = false;
    private Duration perProjectBias = Duration.ofMinutes(5);
    private Duration slidingWindowPerProject = Duration.ofHours(1);
    private Duration slidingWindowPerOrg = Duration.ofHours(1);
    private Duration recalibrateOrgs = Duration.ofMinutes(5);
    private Duration recalibrateProjects = Duration.ofMinutes(5);
    private Duration boostLowVolumeTransactions = Duration.ofMinutes(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getPerProjectBias() {
      return perProjectBias;
    }

    public void setPerProjectBias(Duration perProjectBias) {
      this.perProjectBias = perProjectBias;
    }

    public Duration getSlidingWindowPerProject() {
      return slidingWindowPerProject;
    }

    public void setSlidingWindowPerProject(Duration slidingWindowPerProject) {
      this.slidingWindowPerProject = slidingWindowPerProject;
    }

    public Duration getSlidingWindowPerOrg() {
      return slidingWindowPerOrg;
    }

    public void setSlidingWindowPerOrg(Duration slidingWindowPerOrg) {
      this.slidingWindowPerOrg = slidingWindowPerOrg;
    }

    public Duration getRecalibrateOrgs() {
      return recalibrateOrgs;
    }

    public void setRecalibrateOrgs(Duration recalibrateOrgs) {
      this.recalibrateOrgs = recalibrateOrgs;
    }

    public Duration getRecalibrateProjects() {
      return recalibrateProjects;
    }

    public void setRecalibrateProjects(Duration recalibrateProjects) {
      this.recalibrateProjects = recalibrateProjects;
    }

    public Duration getBoostLowVolumeTransactions() {
      return boostLowVolumeTransactions;
    }

    public void setBoostLowVolumeTransactions(Duration boostLowVolumeTransactions) {
      this.boostLowVolumeTransactions = boostLowVolumeTransactions;
    }
  }
}
