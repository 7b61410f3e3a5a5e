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
package ratekeeper.store;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StoredRateTest {

  @Test public void encode() {
    assertThat(StoredRate.valid(0.25).encode()).isEqualTo("0.25");
    assertThat(StoredRate.valid(0.0).encode()).isEqualTo("0.0");
    assertThat(StoredRate.ERROR.encode()).isEqualTo("error");
  }

  @Test public void absentIsNeverWritten() {
    assertThatThrownBy(StoredRate.ABSENT::encode).isInstanceOf(IllegalStateException.class);
  }

  @Test public void decode() {
    assertThat(StoredRate.decode("0.25")).isEqualTo(StoredRate.valid(0.25));
    assertThat(StoredRate.decode("error")).isSameAs(StoredRate.ERROR);
    assertThat(StoredRate.decode(null)).isSameAs(StoredRate.ABSENT);
  }

  @Test public void malformedValueIsError() {
    assertThat(StoredRate.decode("invalid")).isSameAs(StoredRate.ERROR);
    assertThat(StoredRate.decode("")).isSameAs(StoredRate.ERROR);
    assertThat(StoredRate.decode("-0.5")).isSameAs(StoredRate.ERROR);
    assertThat(StoredRate.decode("NaN")).isSameAs(StoredRate.ERROR);
  }

  /** Dropping everything is a decision, not a failure. */
  @Test public void zeroIsDistinctFromSentinels() {
    StoredRate zero = StoredRate.valid(0.0);

    assertThat(zero.isValid()).isTrue();
    assertThat(zero).isNotEqualTo(StoredRate.ERROR).isNotEqualTo(StoredRate.ABSENT);
    assertThat(StoredRate.decode(zero.encode())).isEqualTo(zero);
  }

  @Test public void factorsAboveOne() {
    assertThat(StoredRate.decode("4.0").rate()).isEqualTo(4.0);
  }

  @Test public void sentinelsHaveNoRate() {
    assertThatThrownBy(StoredRate.ERROR::rate).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(StoredRate.ABSENT::rate).isInstanceOf(IllegalStateException.class);
  }

  @Test public void rejectsUnstorableRates() {
    assertThatThrownBy(() -> StoredRate.valid(-0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> StoredRate.valid(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
