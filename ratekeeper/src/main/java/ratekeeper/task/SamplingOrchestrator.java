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
package ratekeeper.task;

import com.google.common.base.Ticker;
import java.io.Closeable;
import ratekeeper.AlgorithmVariant;
import ratekeeper.ConfigInvalidationSink;
import ratekeeper.QuotaService;
import ratekeeper.RatekeeperConfig;
import ratekeeper.SamplingMetrics;
import ratekeeper.TenantDirectory;
import ratekeeper.TenantSettings;
import ratekeeper.VolumeSource;
import ratekeeper.model.ModelType;
import ratekeeper.model.RebalancingPolicy;
import ratekeeper.store.InvalidationGate;
import ratekeeper.store.RateStore;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry points of the sampling rate controller. Each one is a complete cycle of one {@link
 * AlgorithmVariant}: it pages through active organizations, computes their rates and publishes the
 * ones that changed to the {@link RateStore}.
 *
 * <h3>Implementation notes</h3>
 *
 * <p>Cycles are idempotent: running one twice with unchanged volumes rewrites the same rates
 * without invalidating anything. Each variant writes its own keys, so cycles of different variants
 * can run concurrently. Two concurrent cycles of the same variant are not supported; in a cluster
 * use a leader guard so that only one host runs them.
 *
 * <p>This object owns a pool of worker threads, released on {@link #close()}.
 */
public final class SamplingOrchestrator implements Closeable {

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    VolumeSource volumeSource;
    QuotaService quotaService;
    TenantDirectory tenantDirectory;
    TenantSettings tenantSettings = TenantSettings.DEFAULT;
    ConfigInvalidationSink invalidationSink = ConfigInvalidationSink.NOOP;
    RateStore store;
    SamplingMetrics metrics = SamplingMetrics.NOOP_METRICS;
    RatekeeperConfig config = RatekeeperConfig.DEFAULT;
    Ticker ticker = Ticker.systemTicker();

    public Builder volumeSource(VolumeSource volumeSource) {
      this.volumeSource = checkNotNull(volumeSource, "volumeSource");
      return this;
    }

    public Builder quotaService(QuotaService quotaService) {
      this.quotaService = checkNotNull(quotaService, "quotaService");
      return this;
    }

    public Builder tenantDirectory(TenantDirectory tenantDirectory) {
      this.tenantDirectory = checkNotNull(tenantDirectory, "tenantDirectory");
      return this;
    }

    /**
     * Decides which organizations have dynamic sampling, and in which mode. Defaults to every
     * organization, in organization mode.
     */
    public Builder tenantSettings(TenantSettings tenantSettings) {
      this.tenantSettings = checkNotNull(tenantSettings, "tenantSettings");
      return this;
    }

    /** Told about tenants whose rate changed. Defaults to ignore notices. */
    public Builder invalidationSink(ConfigInvalidationSink invalidationSink) {
      this.invalidationSink = checkNotNull(invalidationSink, "invalidationSink");
      return this;
    }

    /** Where rates are published. Not closed by {@link SamplingOrchestrator#close()}. */
    public Builder store(RateStore store) {
      this.store = checkNotNull(store, "store");
      return this;
    }

    public Builder metrics(SamplingMetrics metrics) {
      this.metrics = checkNotNull(metrics, "metrics");
      return this;
    }

    public Builder config(RatekeeperConfig config) {
      this.config = checkNotNull(config, "config");
      return this;
    }

    /** Measures deadlines. Override in tests. */
    public Builder ticker(Ticker ticker) {
      this.ticker = checkNotNull(ticker, "ticker");
      return this;
    }

    public SamplingOrchestrator build() {
      checkNotNull(volumeSource, "volumeSource");
      checkNotNull(quotaService, "quotaService");
      checkNotNull(tenantDirectory, "tenantDirectory");
      checkNotNull(store, "store");
      return new SamplingOrchestrator(this);
    }

    Builder() {
    }
  }

  final RatekeeperConfig config;
  final CycleDispatcher dispatcher;
  final PerProjectBiasTask perProjectBias;
  final SlidingWindowPerProjectTask slidingWindowPerProject;
  final SlidingWindowPerOrgTask slidingWindowPerOrg;
  final RecalibrateOrgsTask recalibrateOrgs;
  final RecalibrateProjectsTask recalibrateProjects;
  final BoostLowVolumeTransactionsTask boostLowVolumeTransactions;

  SamplingOrchestrator(Builder builder) {
    config = builder.config;
    RatePublisher publisher = new RatePublisher(builder.store,
        new InvalidationGate(config.invalidationEpsilon), builder.invalidationSink, config.ttl);
    TargetRateResolver resolver =
        new TargetRateResolver(builder.store, builder.quotaService, config.slidingWindowEnabled);

    perProjectBias = new PerProjectBiasTask(builder.volumeSource, builder.tenantDirectory,
        builder.tenantSettings, resolver, config.modelType.newModel(config.rebalancingPolicy),
        publisher, builder.metrics, config.biasWindowHours);
    slidingWindowPerProject = new SlidingWindowPerProjectTask(builder.volumeSource,
        builder.tenantDirectory, builder.quotaService, publisher, builder.metrics,
        config.slidingWindowHours, config.referenceHours);
    slidingWindowPerOrg = new SlidingWindowPerOrgTask(builder.volumeSource,
        builder.quotaService, publisher, builder.store, builder.metrics,
        config.slidingWindowHours, config.referenceHours, config.ttl);
    recalibrateOrgs = new RecalibrateOrgsTask(builder.volumeSource, builder.tenantSettings,
        resolver, builder.store, publisher, builder.metrics, config.recalibrationWindowMinutes,
        config.recalibrationTolerance, config.minFactor, config.maxFactor);
    recalibrateProjects = new RecalibrateProjectsTask(builder.volumeSource,
        builder.tenantSettings, builder.store, publisher, builder.metrics,
        config.recalibrationWindowMinutes, config.recalibrationTolerance, config.minFactor,
        config.maxFactor);
    RebalancingPolicy transactionPolicy =
        config.rebalancingPolicy.toBuilder().intensity(config.transactionIntensity).build();
    boostLowVolumeTransactions = new BoostLowVolumeTransactionsTask(builder.volumeSource,
        builder.store, resolver, ModelType.INTENSITY_REBALANCING.newModel(transactionPolicy),
        publisher, builder.metrics, config.transactionWindowHours, config.largeTransactions,
        config.smallTransactions);
    dispatcher = new CycleDispatcher(builder.volumeSource, builder.tenantSettings, config,
        builder.ticker);
  }

  /**
   * Spreads each organization's target rate across its projects, boosting low volume projects
   * while the organization keeps its target overall.
   */
  public CycleResult runPerProjectBias() {
    return dispatcher.run(perProjectBias);
  }

  /** Resolves each project's extrapolated volume to a quota tier rate. */
  public CycleResult runSlidingWindowPerProject() {
    return dispatcher.run(slidingWindowPerProject);
  }

  /**
   * Resolves each organization's extrapolated volume to a quota tier rate. Run this before the
   * cycles that use the organization's target rate.
   */
  public CycleResult runSlidingWindowPerOrg() {
    return dispatcher.run(slidingWindowPerOrg);
  }

  /** Corrects the drift between each organization's effective and intended rate. */
  public CycleResult runRecalibrateOrgs() {
    return dispatcher.run(recalibrateOrgs);
  }

  /** Corrects the drift of each project of organizations in project mode. */
  public CycleResult runRecalibrateProjects() {
    return dispatcher.run(recalibrateProjects);
  }

  /**
   * Spreads each project's rate across its transactions, boosting rare transactions. Run this
   * after {@link #runPerProjectBias()}, whose output is each project's rate.
   */
  public CycleResult runBoostLowVolumeTransactions() {
    return dispatcher.run(boostLowVolumeTransactions);
  }

  public CycleResult run(AlgorithmVariant variant) {
    switch (checkNotNull(variant, "variant")) {
      case PER_PROJECT_BIAS:
        return runPerProjectBias();
      case SLIDING_WINDOW_PER_PROJECT:
        return runSlidingWindowPerProject();
      case SLIDING_WINDOW_PER_ORG:
        return runSlidingWindowPerOrg();
      case RECALIBRATE_ORG:
        return runRecalibrateOrgs();
      case RECALIBRATE_PROJECT:
        return runRecalibrateProjects();
      case BOOST_LOW_VOLUME_TRANSACTIONS:
        return runBoostLowVolumeTransactions();
      default:
        throw new AssertionError(variant);
    }
  }

  public RatekeeperConfig config() {
    return config;
  }

  @Override public void close() {
    dispatcher.close();
  }

  @Override public String toString() {
    return "SamplingOrchestrator{" + config + "}";
  }
}
