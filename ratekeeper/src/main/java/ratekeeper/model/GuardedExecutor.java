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
import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs a model, converting any failure into an absent result. Callers must treat absent as "skip
 * the write this cycle", never as a rate of zero.
 *
 * <p>This is the only place a model failure is swallowed. It is logged with the model, the input
 * and the tenant it was computed for, and counted.
 */
public final class GuardedExecutor {
  final Logger log = LoggerFactory.getLogger(GuardedExecutor.class);

  final SamplingMetrics metrics;

  public GuardedExecutor(SamplingMetrics metrics) {
    this.metrics = checkNotNull(metrics, "metrics");
  }

  public <I, O> Optional<O> run(Model<I, O> model, I input) {
    return run(model, input, null);
  }

  /** @param context usually the tenant the input belongs to, included in the failure log */
  public <I, O> Optional<O> run(Model<I, O> model, I input, @Nullable Object context) {
    checkNotNull(model, "model");
    try {
      return Optional.ofNullable(model.run(input));
    } catch (RuntimeException e) {
      metrics.incrementModelFailures();
      log.warn("{} failed for {} with input {}: {}", model, context, input, e.getMessage(), e);
      return Optional.empty();
    }
  }
}
