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

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.function.Supplier;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import ratekeeper.AlgorithmVariant;
import ratekeeper.ConfigInvalidationSink;
import ratekeeper.QuotaService;
import ratekeeper.SamplingMetrics;
import ratekeeper.TenantDirectory;
import ratekeeper.TenantSettings;
import ratekeeper.VolumeSource;
import ratekeeper.internal.Nullable;
import ratekeeper.store.InMemoryRateStore;
import ratekeeper.store.RateStore;
import ratekeeper.task.CycleScheduler;
import ratekeeper.task.SamplingOrchestrator;
import ratekeeper.zookeeper.CycleLeaderGuard;
import ratekeeper.zookeeper.ZooKeeperRateStore;

/**
 * Wires the sampling rate controller once the application supplies a {@link VolumeSource}, a
 * {@link QuotaService} and a {@link TenantDirectory}. A {@link TenantSettings} bean, when present,
 * says which organizations use dynamic sampling and how.
 *
 * <p>Rates are published to ZooKeeper when {@code ratekeeper.zookeeper.connect} is set, and only
 * the elected leader runs scheduled cycles. Otherwise rates stay in memory, which only suits a
 * single host.
 */
@Configuration
@EnableConfigurationProperties(RatekeeperProperties.class)
public class RatekeeperAutoConfiguration {
  static final Logger LOG = LoggerFactory.getLogger(RatekeeperAutoConfiguration.class);

  @Configuration
  @Conditional(ZooKeeperSetCondition.class)
  static class ZooKeeperConfiguration {

    /** Started here, but connected lazily so that a ZooKeeper outage doesn't crash startup. */
    @Bean(destroyMethod = "close") @ConditionalOnMissingBean
    CuratorFramework ratekeeperCuratorFramework(RatekeeperProperties properties) {
      RatekeeperProperties.ZooKeeper zookeeper = properties.getZookeeper();
      CuratorFramework result = CuratorFrameworkFactory.builder()
          .connectString(zookeeper.getConnect())
          .sessionTimeoutMs((int) zookeeper.getSessionTimeout().toMillis())
          .retryPolicy(new ExponentialBackoffRetry(1000, 3))
          .build();
      result.start();
      return result;
    }

    @Bean @ConditionalOnMissingBean
    RateStore zooKeeperRateStore(RatekeeperProperties properties, CuratorFramework client) {
      return ZooKeeperRateStore.newBuilder()
          .basePath(properties.getZookeeper().getBasePath() + "/rates")
          .build(client);
    }

    @Bean @ConditionalOnMissingBean
    CycleLeaderGuard cycleLeaderGuard(RatekeeperProperties properties, CuratorFramework client) {
      RatekeeperProperties.ZooKeeper zookeeper = properties.getZookeeper();
      return CycleLeaderGuard.create(client, zookeeper.getBasePath(), zookeeper.getId());
    }
  }

  @Bean @ConditionalOnMissingBean RateStore inMemoryRateStore() {
    LOG.info("ratekeeper.zookeeper.connect isn't set: publishing rates in memory");
    return InMemoryRateStore.create();
  }

  @Bean @ConditionalOnMissingBean
  SamplingMetrics samplingMetrics(ObjectProvider<MeterRegistry> registry) {
    MeterRegistry meterRegistry = registry.getIfAvailable();
    if (meterRegistry == null) return SamplingMetrics.NOOP_METRICS;
    return new MicrometerSamplingMetrics(meterRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnBean({VolumeSource.class, QuotaService.class, TenantDirectory.class})
  SamplingOrchestrator samplingOrchestrator(RatekeeperProperties properties,
      VolumeSource volumeSource, QuotaService quotaService, TenantDirectory tenantDirectory,
      ObjectProvider<TenantSettings> tenantSettings,
      ObjectProvider<ConfigInvalidationSink> invalidationSink, RateStore store,
      SamplingMetrics metrics) {
    return SamplingOrchestrator.newBuilder()
        .volumeSource(volumeSource)
        .quotaService(quotaService)
        .tenantDirectory(tenantDirectory)
        .tenantSettings(tenantSettings.getIfAvailable(() -> TenantSettings.DEFAULT))
        .invalidationSink(invalidationSink.getIfAvailable(() -> ConfigInvalidationSink.NOOP))
        .store(store)
        .metrics(metrics)
        .config(properties.toConfig())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(SamplingOrchestrator.class)
  @ConditionalOnProperty(value = "ratekeeper.scheduler.enabled", havingValue = "true")
  CycleScheduler cycleScheduler(RatekeeperProperties properties,
      SamplingOrchestrator orchestrator, ObjectProvider<CycleLeaderGuard> leaderGuard) {
    CycleLeaderGuard guard = leaderGuard.getIfAvailable();
    Supplier<Boolean> runCycles = guard != null ? guard : () -> true;
    CycleScheduler result = new CycleScheduler(orchestrator, runCycles);

    RatekeeperProperties.Scheduler scheduler = properties.getScheduler();
    // the other cycles resolve target rates from the per-org output, so it runs first
    schedule(result, AlgorithmVariant.SLIDING_WINDOW_PER_ORG, scheduler.getSlidingWindowPerOrg());
    schedule(result, AlgorithmVariant.SLIDING_WINDOW_PER_PROJECT,
        scheduler.getSlidingWindowPerProject());
    schedule(result, AlgorithmVariant.PER_PROJECT_BIAS, scheduler.getPerProjectBias());
    // transaction rates are relative to the per-project bias
    schedule(result, AlgorithmVariant.BOOST_LOW_VOLUME_TRANSACTIONS,
        scheduler.getBoostLowVolumeTransactions());
    schedule(result, AlgorithmVariant.RECALIBRATE_ORG, scheduler.getRecalibrateOrgs());
    schedule(result, AlgorithmVariant.RECALIBRATE_PROJECT, scheduler.getRecalibrateProjects());
    return result;
  }

  static void schedule(CycleScheduler scheduler, AlgorithmVariant variant,
      @Nullable Duration interval) {
    if (interval == null) return;
    scheduler.schedule(variant, interval);
  }
}
