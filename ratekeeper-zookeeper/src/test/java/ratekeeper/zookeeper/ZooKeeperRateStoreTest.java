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
package ratekeeper.zookeeper;

import com.google.common.collect.ImmutableMap;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.curator.retry.RetryOneTime;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import ratekeeper.TransientIOException;
import ratekeeper.store.RateKey;
import ratekeeper.store.StoredRate;

import static org.apache.curator.framework.CuratorFrameworkFactory.newClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static ratekeeper.AlgorithmVariant.PER_PROJECT_BIAS;
import static ratekeeper.AlgorithmVariant.SLIDING_WINDOW_PER_ORG;

public class ZooKeeperRateStoreTest {
  static final Duration TTL = Duration.ofHours(24);
  static final Instant NOW = Instant.parse("2017-06-01T00:00:00Z");

  @Rule public ZooKeeperRule zookeeper = new ZooKeeperRule();

  ZooKeeperRateStore store;

  RateKey org1Project1 = RateKey.create(PER_PROJECT_BIAS, 1L, 1L);
  RateKey org1Project2 = RateKey.create(PER_PROJECT_BIAS, 1L, 2L);
  RateKey org1 = RateKey.forOrg(SLIDING_WINDOW_PER_ORG, 1L);

  @Before public void createStore() {
    store = storeAt(NOW);
  }

  @Test public void missingKeyIsAbsent() {
    assertThat(store.get(org1)).isSameAs(StoredRate.ABSENT);
    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).isEmpty();
  }

  @Test public void setBatch_createsThenUpdates() throws Exception {
    store.setBatch(ImmutableMap.of(org1, StoredRate.valid(0.25)), TTL);
    store.setBatch(ImmutableMap.of(org1, StoredRate.valid(0.5)), TTL);

    assertThat(store.get(org1)).isEqualTo(StoredRate.valid(0.5));
    assertThat(new String(zookeeper.client.getData().forPath("/ratekeeper/rates/swo/1/1"),
        StandardCharsets.UTF_8))
        .isEqualTo("0.5|" + NOW.plus(TTL).toEpochMilli());
  }

  @Test public void errorSentinel() {
    store.setBatch(ImmutableMap.of(org1, StoredRate.ERROR), TTL);

    assertThat(store.get(org1)).isSameAs(StoredRate.ERROR);
  }

  @Test public void expiredReadsAbsent() {
    store.setBatch(ImmutableMap.of(org1, StoredRate.valid(0.5)), TTL);

    assertThat(storeAt(NOW.plus(TTL).minusMillis(1)).get(org1).isValid()).isTrue();
    assertThat(storeAt(NOW.plus(TTL)).get(org1)).isSameAs(StoredRate.ABSENT);
  }

  @Test public void malformedValueIsError() throws Exception {
    zookeeper.client.create().creatingParentsIfNeeded()
        .forPath("/ratekeeper/rates/swo/1/1", "invalid".getBytes(StandardCharsets.UTF_8));

    assertThat(store.get(org1)).isSameAs(StoredRate.ERROR);
  }

  @Test public void replaceGroup() {
    store.setBatch(ImmutableMap.of(
        org1Project1, StoredRate.valid(0.5),
        org1Project2, StoredRate.valid(0.25)), TTL);

    store.replaceGroup(PER_PROJECT_BIAS, 1L, ImmutableMap.of(
        org1Project2, StoredRate.valid(0.75),
        RateKey.create(PER_PROJECT_BIAS, 1L, 3L), StoredRate.valid(1.0)), TTL);

    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).containsOnly(
        entry(org1Project2, StoredRate.valid(0.75)),
        entry(RateKey.create(PER_PROJECT_BIAS, 1L, 3L), StoredRate.valid(1.0)));
  }

  @Test public void replaceGroup_emptyDeletesAll() {
    store.setBatch(ImmutableMap.of(org1Project1, StoredRate.valid(0.5)), TTL);

    store.replaceGroup(PER_PROJECT_BIAS, 1L, Collections.emptyMap(), TTL);

    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L)).isEmpty();
  }

  @Test public void writesBumpGroupVersion() throws Exception {
    store.setBatch(ImmutableMap.of(org1Project1, StoredRate.valid(0.5)), TTL);
    int afterSet = groupVersion("/ratekeeper/rates/pp/1");

    store.replaceGroup(PER_PROJECT_BIAS, 1L,
        ImmutableMap.of(org1Project2, StoredRate.valid(0.25)), TTL);
    int afterReplace = groupVersion("/ratekeeper/rates/pp/1");

    store.delete(Collections.singletonList(org1Project2));

    assertThat(afterReplace).isGreaterThan(afterSet);
    assertThat(groupVersion("/ratekeeper/rates/pp/1")).isGreaterThan(afterReplace);
  }

  @Test public void getGroup_neverSeesPartOfAReplacement() throws Exception {
    RateKey org1Project3 = RateKey.create(PER_PROJECT_BIAS, 1L, 3L);
    store.replaceGroup(PER_PROJECT_BIAS, 1L, generation(0, org1Project1, org1Project2), TTL);
    AtomicBoolean done = new AtomicBoolean();
    Thread writer = new Thread(() -> {
      try {
        write200Generations(org1Project1, org1Project2, org1Project3);
      } finally {
        done.set(true);
      }
    });
    writer.start();

    while (!done.get()) {
      Map<RateKey, StoredRate> group;
      try {
        group = store.getGroup(PER_PROJECT_BIAS, 1L);
      } catch (TransientIOException e) {
        continue; // the writer outpaced every retry
      }
      assertThat(group).hasSize(2);
      assertThat(new HashSet<>(group.values())).hasSize(1);
    }
    writer.join();

    assertThat(store.getGroup(PER_PROJECT_BIAS, 1L))
        .containsOnlyKeys(org1Project1, org1Project2);
  }

  /** Alternates key sets, so a torn read would mix children as well as values. */
  void write200Generations(RateKey org1Project1, RateKey org1Project2, RateKey org1Project3) {
    for (int i = 1; i <= 200; i++) {
      if (i % 2 == 0) {
        store.replaceGroup(PER_PROJECT_BIAS, 1L, generation(i, org1Project1, org1Project2), TTL);
      } else {
        store.replaceGroup(PER_PROJECT_BIAS, 1L, generation(i, org1Project2, org1Project3), TTL);
      }
    }
  }

  static Map<RateKey, StoredRate> generation(int generation, RateKey... keys) {
    Map<RateKey, StoredRate> result = new LinkedHashMap<>();
    for (RateKey key : keys) result.put(key, StoredRate.valid(1.0 / (generation + 1)));
    return result;
  }

  int groupVersion(String path) throws Exception {
    return zookeeper.client.checkExists().forPath(path).getVersion();
  }

  @Test public void replaceGroup_rejectsOtherGroups() {
    assertThatThrownBy(() -> store.replaceGroup(PER_PROJECT_BIAS, 2L,
        ImmutableMap.of(org1Project1, StoredRate.valid(0.5)), TTL))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test public void delete() {
    store.setBatch(ImmutableMap.of(
        org1Project1, StoredRate.valid(0.5),
        org1, StoredRate.valid(0.5)), TTL);

    store.delete(Arrays.asList(org1Project1, org1Project2));

    assertThat(store.get(org1Project1)).isSameAs(StoredRate.ABSENT);
    assertThat(store.get(org1).isValid()).isTrue();
  }

  @Test public void check() {
    assertThat(store.check().ok()).isTrue();
  }

  @Test public void requiresStartedClient() {
    assertThatThrownBy(() -> ZooKeeperRateStore.newBuilder()
        .build(newClient("localhost:1", new RetryOneTime(1))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test public void rejectsRelativeBasePath() {
    assertThatThrownBy(() -> ZooKeeperRateStore.newBuilder().basePath("rates"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  ZooKeeperRateStore storeAt(Instant now) {
    return ZooKeeperRateStore.newBuilder()
        .clock(Clock.fixed(now, ZoneOffset.UTC))
        .build(zookeeper.client);
  }
}
