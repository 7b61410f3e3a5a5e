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
package ratekeeper.model;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.SamplingMetrics;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Extrapolates a count observed over a trailing window to a longer reference period, by default a
 * 30 day month. Every estimate is audited through {@link SamplingMetrics}, including undefined
 * ones.
 */
public final class SlidingWindowEstimator {
  public static final int MONTH_HOURS = 30 * 24;

  final Logger log = LoggerFactory.getLogger(SlidingWindowEstimator.class);

  final SamplingMetrics metrics;
  final int referenceHours;

  public SlidingWindowEstimator(SamplingMetrics metrics) {
    this(metrics, MONTH_HOURS);
  }

  public SlidingWindowEstimator(SamplingMetrics metrics, int referenceHours) {
    checkArgument(referenceHours > 0, "referenceHours <= 0: %s", referenceHours);
    this.metrics = checkNotNull(metrics, "metrics");
    this.referenceHours = referenceHours;
  }

  /**
   * Returns the volume expected over the reference period, or empty when that is undefined, ex.
   * for a non-positive window. A zero count extrapolates to zero.
   */
  public Optional<Double> estimate(long observedCount, int windowHours) {
    if (windowHours <= 0 || observedCount < 0) {
      return undefined(observedCount, windowHours);
    }
    double volume = (double) observedCount * referenceHours / windowHours;
    if (Double.isNaN(volume) || Double.isInfinite(volume)) {
      return undefined(observedCount, windowHours);
    }
    log.debug("extrapolated {} over {}h to {} over {}h", observedCount, windowHours, volume,
        referenceHours);
    metrics.extrapolatedVolume(volume);
    return Optional.of(volume);
  }

  Optional<Double> undefined(long observedCount, int windowHours) {
    log.debug("can't extrapolate {} over {}h", observedCount, windowHours);
    metrics.incrementUndefinedExtrapolations();
    return Optional.empty();
  }
}
