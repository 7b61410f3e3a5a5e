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

import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import org.junit.After;
import org.junit.Test;
import ratekeeper.InMemorySamplingMetrics;
import ratekeeper.RatekeeperConfig;
import ratekeeper.Tenant;
import ratekeeper.model.RebalancingPolicy;
import ratekeeper.store.InMemoryRateStore;
import ratekeeper.store.RateKey;
import ratekeeper.store.StoredRate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static ratekeeper.AlgorithmVariant.PER_PROJECT_BIAS;

public class PerProjectBiasTest {
  FakeVolumeSource volumes = new FakeVolumeSource();
  FakeQuotaService quota = new FakeQuotaService();
  FakeTenantDirectory directory = new FakeTenantDirectory();
  FakeTenantSettings settings = new FakeTenantSettings();
  RecordingInvalidationSink sink = new RecordingInvalidationSink();
  InMemoryRateStore store = InMemoryRateStore.create();
  InMemorySamplingMetrics metrics = new InMemorySamplingMetrics();
  InMemorySamplingMetrics variantMetrics = metrics.forVariant(PER_PROJECT_BIAS);
  RatekeeperConfig config = RatekeeperConfig.newBuilder()
      .retryBackoff(Duration.ofMillis(1))
      .build();

  SamplingOrchestrator orchestrator;

  @After public void close() {
    if (orchestrator != null) orchestrator.close();
  }

  @Test public void boostsLowVolumeProjects() {
    quota.blendedRate(1L, 0.25);
    volumes.project(1L, 11L, 9).project(1L, 12L, 7).project(1L, 13L, 3).project(1L, 14L, 1);
    directory.projects(1L, 11L, 12L, 13L, 14L, 15L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.processed()).isEqualTo(1);
    assertThat(rate(1L, 11L)).isCloseTo(0.14814814814814817, within(1e-9));
    assertThat(rate(1L, 12L)).isCloseTo(0.1904761904761905, within(1e-9));
    assertThat(rate(1L, 13L)).isCloseTo(0.4444444444444444, within(1e-9));
    assertThat(rate(1L, 14L)).isEqualTo(1.0);
    assertThat(rate(1L, 15L)).isEqualTo(1.0); // empty project
    assertThat(sink.invalidated).containsExactlyInAnyOrder(Tenant.project(11L),
        Tenant.project(12L), Tenant.project(13L), Tenant.project(14L), Tenant.project(15L));
  }

  @Test public void secondIdenticalCycleDoesntInvalidate() {
    quota.blendedRate(1L, 0.25);
    volumes.project(1L, 11L, 9).project(1L, 12L, 1);
    directory.projects(1L, 11L, 12L);

    orchestrator().runPerProjectBias();
    orchestrator.runPerProjectBias();

    assertThat(sink.invalidated).hasSize(2);
    assertThat(variantMetrics.ratesWritten()).isEqualTo(4);
    assertThat(variantMetrics.invalidations()).isEqualTo(2);
  }

  @Test public void singleBusyProjectAndAnEmptyOne() {
    quota.blendedRate(1L, 0.5);
    volumes.project(1L, 1L, 100);
    directory.projects(1L, 1L, 2L);

    orchestrator().runPerProjectBias();

    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).hasSize(2);
    assertThat(rate(1L, 1L)).isCloseTo(0.5, within(1e-9));
    assertThat(rate(1L, 2L)).isCloseTo(0.5, within(1e-9));
  }

  @Test public void zeroFillsListedProjects() {
    quota.blendedRate(1L, 0.2);
    volumes.project(1L, 1L, 50).project(1L, 2L, 50);
    directory.projects(1L, 1L, 2L, 3L);

    orchestrator().runPerProjectBias();

    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).hasSize(3);
    assertThat(rate(1L, 3L)).isCloseTo(0.2, within(1e-9));
  }

  /** The directory replica may not list a project that already has volume. */
  @Test public void ratesProjectsMissingFromStaleListing() {
    quota.blendedRate(1L, 0.2);
    volumes.project(1L, 1L, 50).project(1L, 2L, 50);
    directory.projects(1L, 1L);

    orchestrator().runPerProjectBias();

    assertThat(store.get(RateKey.create(PER_PROJECT_BIAS, 1L, 2L)).isValid()).isTrue();
  }

  @Test public void allProjectsWithoutVolumeGetTheTarget() {
    quota.blendedRate(1L, 0.3);
    volumes.project(1L, 1L, 0);
    directory.projects(1L, 1L, 2L);

    orchestrator().runPerProjectBias();

    assertThat(rate(1L, 1L)).isEqualTo(0.3);
    assertThat(rate(1L, 2L)).isEqualTo(0.3);
    assertThat(variantMetrics.modelFailures()).isZero();
  }

  @Test public void deletesProjectsNoLongerPresent() {
    store.setBatch(ImmutableMap.of(RateKey.create(PER_PROJECT_BIAS, 1L, 99L),
        StoredRate.valid(0.5)), config.ttl);
    quota.blendedRate(1L, 0.2);
    volumes.project(1L, 1L, 50);
    directory.projects(1L, 1L);

    orchestrator().runPerProjectBias();

    assertThat(store.get(RateKey.create(PER_PROJECT_BIAS, 1L, 99L)))
        .isSameAs(StoredRate.ABSENT);
  }

  @Test public void undeterminedTargetReplacesValidRatesWithError() {
    RateKey previouslyValid = RateKey.create(PER_PROJECT_BIAS, 1L, 1L);
    store.setBatch(ImmutableMap.of(previouslyValid, StoredRate.valid(0.5)), config.ttl);
    volumes.project(1L, 1L, 50).project(1L, 2L, 50);
    directory.projects(1L, 1L, 2L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.processed()).isEqualTo(1);
    assertThat(store.get(previouslyValid)).isSameAs(StoredRate.ERROR);
    assertThat(store.get(RateKey.create(PER_PROJECT_BIAS, 1L, 2L))).isSameAs(StoredRate.ABSENT);
    assertThat(variantMetrics.errorSentinels()).isOne();
    assertThat(sink.invalidated).containsExactly(Tenant.project(1L));
  }

  @Test public void modelFailureKeepsPreviousRates() {
    config = config.toBuilder()
        .rebalancingPolicy(RebalancingPolicy.newBuilder().minRate(0.5).build())
        .build();
    RateKey previous = RateKey.create(PER_PROJECT_BIAS, 1L, 1L);
    store.setBatch(ImmutableMap.of(previous, StoredRate.valid(0.9)), config.ttl);
    quota.blendedRate(1L, 0.1); // below the floor
    volumes.project(1L, 1L, 50).project(1L, 2L, 5);
    directory.projects(1L, 1L, 2L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.processed()).isEqualTo(1);
    assertThat(variantMetrics.modelFailures()).isOne();
    assertThat(store.get(previous)).isEqualTo(StoredRate.valid(0.9));
    assertThat(sink.invalidated).isEmpty();
  }

  @Test public void skipsDeletedOrganizations() {
    quota.blendedRate(1L, 0.2).blendedRate(2L, 0.2);
    volumes.project(1L, 1L, 50).project(2L, 2L, 50);
    directory.projects(1L, 1L).projects(2L, 2L).delete(1L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.skipped()).isEqualTo(1);
    assertThat(result.processed()).isEqualTo(1);
    assertThat(result.failed()).isZero();
    assertThat(variantMetrics.tenantsSkipped()).isOne();
    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).isEmpty();
    assertThat(store.getGroup(PER_PROJECT_BIAS, 2L)).hasSize(1);
  }

  @Test public void retriesTransientFailures() {
    quota.blendedRate(1L, 0.2);
    volumes.project(1L, 1L, 50).failTransiently(1L, 2);
    directory.projects(1L, 1L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.processed()).isEqualTo(1);
    assertThat(variantMetrics.retries()).isEqualTo(2);
    assertThat(rate(1L, 1L)).isCloseTo(0.2, within(1e-9));
  }

  @Test public void disabledOrganizationIsLeftAlone() {
    quota.blendedRate(1L, 0.25).blendedRate(2L, 0.25);
    volumes.project(1L, 11L, 9).project(1L, 12L, 1).project(2L, 21L, 5);
    directory.projects(1L, 11L, 12L).projects(2L, 21L);
    settings.disable(1L);

    CycleResult result = orchestrator().runPerProjectBias();

    assertThat(result.skipped()).isOne();
    assertThat(result.processed()).isOne();
    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).isEmpty();
    assertThat(store.getGroup(PER_PROJECT_BIAS, 2L)).hasSize(1);
    assertThat(sink.invalidated).containsExactly(Tenant.project(21L));
  }

  @Test public void projectModePublishesConfiguredTargets() {
    quota.blendedRate(1L, 0.25);
    volumes.project(1L, 11L, 9).project(1L, 12L, 1);
    directory.projects(1L, 11L, 12L, 13L);
    settings.projectMode(1L).projectTarget(11L, 0.2);

    orchestrator().runPerProjectBias();

    assertThat(rate(1L, 11L)).isEqualTo(0.2);
    assertThat(rate(1L, 12L)).isEqualTo(1.0); // no configured target
    assertThat(rate(1L, 13L)).isEqualTo(1.0);
    assertThat(variantMetrics.modelFailures()).isZero();
  }

  double rate(long orgId, long projectId) {
    return store.get(RateKey.create(PER_PROJECT_BIAS, orgId, projectId)).rate();
  }

  SamplingOrchestrator orchestrator() {
    return orchestrator = SamplingOrchestrator.newBuilder()
        .volumeSource(volumes)
        .quotaService(quota)
        .tenantDirectory(directory)
        .tenantSettings(settings)
        .invalidationSink(sink)
        .store(store)
        .metrics(metrics)
        .config(config)
        .build();
  }
}
