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
import org.junit.Test;
import ratekeeper.model.ModelType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RatekeeperConfigTest {

  @Test public void defaults() {
    RatekeeperConfig config = RatekeeperConfig.DEFAULT;

    assertThat(config.modelType).isEqualTo(ModelType.FULL_REBALANCING);
    assertThat(config.rebalancingPolicy.minRate).isEqualTo(0.0);
    assertThat(config.rebalancingPolicy.maxRate).isEqualTo(1.0);
    assertThat(config.invalidationEpsilon).isEqualTo(0.01);
    assertThat(config.ttl).isEqualTo(Duration.ofHours(24));
    assertThat(config.referenceHours).isEqualTo(720);
    assertThat(config.slidingWindowHours).isEqualTo(24);
    assertThat(config.pageSize).isEqualTo(100);
    assertThat(config.maxRetries).isEqualTo(3);
    assertThat(config.softDeadline).isEqualTo(Duration.ofMinutes(10));
    assertThat(config.transactionWindowHours).isEqualTo(1);
    assertThat(config.largeTransactions).isEqualTo(30);
    assertThat(config.smallTransactions).isZero();
    assertThat(config.transactionIntensity).isEqualTo(0.8);
  }

  @Test public void toBuilder() {
    RatekeeperConfig config = RatekeeperConfig.newBuilder()
        .modelType(ModelType.INTENSITY_REBALANCING)
        .pageSize(10)
        .build();

    assertThat(config.toBuilder().build()).hasToString(config.toString());
  }

  @Test public void validates() {
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().pageSize(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().ttl(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().invalidationEpsilon(1.0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().largeTransactions(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().transactionIntensity(1.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder().minFactor(5).maxFactor(2).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RatekeeperConfig.newBuilder()
        .softDeadline(Duration.ofHours(1))
        .cycleDeadline(Duration.ofMinutes(30))
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
