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
import ratekeeper.store.InMemoryRateStore;
import ratekeeper.store.RateKey;
import ratekeeper.store.StoredRate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static ratekeeper.AlgorithmVariant.PER_PROJECT_BIAS;
import static ratekeeper.AlgorithmVariant.SLIDING_WINDOW_PER_ORG;
import static ratekeeper.AlgorithmVariant.SLIDING_WINDOW_PER_PROJECT;

public class SlidingWindowTest {
  FakeVolumeSource volumes = new FakeVolumeSource();
  // monthly volume tiers
  FakeQuotaService quota = new FakeQuotaService()
      .tier(0, 1.0)
      .tier(10_000, 0.5)
      .tier(1_000_000, 0.1);
  FakeTenantDirectory directory = new FakeTenantDirectory();
  RecordingInvalidationSink sink = new RecordingInvalidationSink();
  InMemoryRateStore store = InMemoryRateStore.create();
  InMemorySamplingMetrics metrics = new InMemorySamplingMetrics();
  RatekeeperConfig config = RatekeeperConfig.newBuilder()
      .retryBackoff(Duration.ofMillis(1))
      .maxRetries(1)
      .build();

  SamplingOrchestrator orchestrator;

  @After public void close() {
    if (orchestrator != null) orchestrator.close();
  }

  @Test public void perOrg_resolvesExtrapolatedVolumeToTier() {
    volumes.org(1L, 1000); // 30,000 a month
    volumes.org(2L, 100_000); // 3,000,000 a month

    CycleResult result = orchestrator().runSlidingWindowPerOrg();

    assertThat(result.processed()).isEqualTo(2);
    assertThat(orgRate(1L)).isEqualTo(StoredRate.valid(0.5));
    assertThat(orgRate(2L)).isEqualTo(StoredRate.valid(0.1));
    assertThat(sink.invalidated)
        .containsExactlyInAnyOrder(Tenant.organization(1L), Tenant.organization(2L));
    assertThat(metrics.forVariant(SLIDING_WINDOW_PER_ORG).extrapolations()).isEqualTo(2);
  }

  @Test public void perOrg_zeroVolumeIsTheLowestTier() {
    volumes.org(1L, 0);

    orchestrator().runSlidingWindowPerOrg();

    assertThat(orgRate(1L)).isEqualTo(StoredRate.valid(1.0));
  }

  @Test public void perOrg_undeterminedTierReplacesValidRateWithError() {
    store.setBatch(ImmutableMap.of(RateKey.forOrg(SLIDING_WINDOW_PER_ORG, 1L),
        StoredRate.valid(0.5)), config.ttl);
    volumes.org(1L, 1000).org(2L, 1000);
    quota.undetermined(1L).undetermined(2L);

    orchestrator().runSlidingWindowPerOrg();

    assertThat(orgRate(1L)).isSameAs(StoredRate.ERROR);
    assertThat(orgRate(2L)).isSameAs(StoredRate.ABSENT); // never written
    assertThat(sink.invalidated).containsExactly(Tenant.organization(1L));
    assertThat(metrics.forVariant(SLIDING_WINDOW_PER_ORG).errorSentinels()).isOne();
  }

  @Test public void perOrg_marksCompletePass() {
    volumes.org(1L, 1000);

    orchestrator().runSlidingWindowPerOrg();

    assertThat(store.get(TargetRateResolver.SLIDING_WINDOW_EXECUTED).isValid()).isTrue();
  }

  @Test public void perOrg_doesntMarkIncompletePass() {
    volumes.org(1L, 1000).org(2L, 1000).failTransiently(2L, 10);

    CycleResult result = orchestrator().runSlidingWindowPerOrg();

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.complete()).isFalse();
    assertThat(store.get(TargetRateResolver.SLIDING_WINDOW_EXECUTED))
        .isSameAs(StoredRate.ABSENT);
  }

  /** An organization not visited by a complete pass had no volume, so keeps everything. */
  @Test public void orgWithoutSlidingWindowVolumeKeepsEverything() {
    volumes.org(1L, 1000);
    orchestrator().runSlidingWindowPerOrg();

    volumes.project(2L, 21L, 10);
    directory.projects(2L, 21L);
    quota.blendedRate(2L, 0.01);
    orchestrator.runPerProjectBias();

    assertThat(store.get(RateKey.create(PER_PROJECT_BIAS, 2L, 21L)))
        .isEqualTo(StoredRate.valid(1.0));
  }

  @Test public void perProject_resolvesEachProject() {
    volumes.project(1L, 11L, 2400); // 72,000 a month
    directory.projects(1L, 11L, 12L);

    orchestrator().runSlidingWindowPerProject();

    assertThat(store.getGroup(SLIDING_WINDOW_PER_PROJECT, 1L)).containsOnly(
        entry(
            RateKey.create(SLIDING_WINDOW_PER_PROJECT, 1L, 11L), StoredRate.valid(0.5)),
        entry(
            RateKey.create(SLIDING_WINDOW_PER_PROJECT, 1L, 12L), StoredRate.valid(1.0)));
    assertThat(sink.invalidated)
        .containsExactlyInAnyOrder(Tenant.project(11L), Tenant.project(12L));
  }

  @Test public void perProject_undeterminedProjectsKeepNoRate() {
    volumes.project(1L, 11L, 2400);
    directory.projects(1L, 11L);
    quota.undetermined(1L);

    orchestrator().runSlidingWindowPerProject();

    assertThat(store.getGroup(SLIDING_WINDOW_PER_PROJECT, 1L)).isEmpty();
    assertThat(sink.invalidated).isEmpty();
  }

  StoredRate orgRate(long orgId) {
    return store.get(RateKey.forOrg(SLIDING_WINDOW_PER_ORG, orgId));
  }

  SamplingOrchestrator orchestrator() {
    return orchestrator = SamplingOrchestrator.newBuilder()
        .volumeSource(volumes)
        .quotaService(quota)
        .tenantDirectory(directory)
        .invalidationSink(sink)
        .store(store)
        .metrics(metrics)
        .config(config)
        .build();
  }
}
