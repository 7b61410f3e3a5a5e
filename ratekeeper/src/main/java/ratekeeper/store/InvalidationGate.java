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

import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decides if a rate change is big enough to tell readers to reload their configuration. Without
 * this, every cycle would invalidate every tenant even when rates only jitter.
 */
public final class InvalidationGate {
  public static final double DEFAULT_EPSILON = 0.01;

  final double epsilon;

  public InvalidationGate(double epsilon) {
    checkArgument(epsilon >= 0 && epsilon < 1, "epsilon should be in [0, 1): was %s", epsilon);
    this.epsilon = epsilon;
  }

  public double epsilon() {
    return epsilon;
  }

  /** True if there was no old rate, or it differs from the new one by more than epsilon. */
  public static boolean shouldNotify(@Nullable Double oldRate, double newRate, double epsilon) {
    if (oldRate == null) return true;
    return Math.abs(oldRate - newRate) > epsilon;
  }

  /**
   * Lifts {@link #shouldNotify(Double, double, double)} to stored values: the readers' effective
   * rate changes when a valid rate replaces anything else, and when the error sentinel replaces a
   * valid rate.
   */
  public boolean shouldNotify(StoredRate oldValue, StoredRate newValue) {
    if (newValue.isValid()) {
      return shouldNotify(oldValue.isValid() ? oldValue.rate() : null, newValue.rate(), epsilon);
    }
    return newValue.kind() == StoredRate.Kind.ERROR && oldValue.isValid();
  }

  @Override public String toString() {
    return "InvalidationGate{epsilon=" + epsilon + "}";
  }
}
