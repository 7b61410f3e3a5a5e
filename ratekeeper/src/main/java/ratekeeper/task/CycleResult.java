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

import java.time.Duration;
import ratekeeper.AlgorithmVariant;

import static com.google.common.base.Preconditions.checkNotNull;

/** What happened to the organizations of one cycle. */
// @Immutable
public final class CycleResult {

  final AlgorithmVariant variant;
  final int processed, skipped, failed, deferred;
  final boolean complete;
  final Duration duration;

  CycleResult(AlgorithmVariant variant, int processed, int skipped, int failed, int deferred,
      boolean complete, Duration duration) {
    this.variant = checkNotNull(variant, "variant");
    this.processed = processed;
    this.skipped = skipped;
    this.failed = failed;
    this.deferred = deferred;
    this.complete = complete;
    this.duration = duration;
  }

  public AlgorithmVariant variant() {
    return variant;
  }

  /** Organizations whose unit of work finished, even if it wrote nothing. */
  public int processed() {
    return processed;
  }

  /** Organizations that vanished before they were processed. */
  public int skipped() {
    return skipped;
  }

  /** Organizations whose unit of work failed permanently, ran out of retries or timed out. */
  public int failed() {
    return failed;
  }

  /** Organizations left for the next cycle because the soft deadline passed. */
  public int deferred() {
    return deferred;
  }

  /** True when paging reached the last organization and no unit was abandoned. */
  public boolean complete() {
    return complete;
  }

  public Duration duration() {
    return duration;
  }

  @Override public String toString() {
    return "CycleResult{variant=" + variant.tag()
        + ", processed=" + processed
        + ", skipped=" + skipped
        + ", failed=" + failed
        + ", deferred=" + deferred
        + ", complete=" + complete
        + ", duration=" + duration
        + "}";
  }
}
