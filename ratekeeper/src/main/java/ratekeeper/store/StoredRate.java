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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.internal.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A rate as seen at the store boundary. The store only holds strings: a valid rate is its decimal
 * representation, ex. "0.25", and the error sentinel is the literal "error". A missing key is
 * {@link #ABSENT}.
 *
 * <p>{@code valid(0.0)} is a real decision to drop everything, and is never equal to {@link #ERROR}
 * or {@link #ABSENT}.
 *
 * <p>Most keys hold a rate in {@code [0, 1]}. Recalibration keys hold a multiplicative factor,
 * which can exceed one, so the store boundary only requires a finite, non-negative value.
 */
// @Immutable
public final class StoredRate {
  static final Logger LOG = LoggerFactory.getLogger(StoredRate.class);
  static final String ERROR_VALUE = "error";

  public enum Kind {
    VALID, ERROR, ABSENT
  }

  /** Written when a previously valid rate can no longer be determined. */
  public static final StoredRate ERROR = new StoredRate(Kind.ERROR, Double.NaN);
  public static final StoredRate ABSENT = new StoredRate(Kind.ABSENT, Double.NaN);

  public static StoredRate valid(double rate) {
    checkArgument(isStorable(rate), "rate should be finite and non-negative: was %s", rate);
    return new StoredRate(Kind.VALID, rate);
  }

  /**
   * Parses a value read from the store. Null means the key was missing. A value that is neither a
   * rate nor the sentinel exists but is unusable, so it reads as {@link #ERROR}.
   */
  public static StoredRate decode(@Nullable String value) {
    if (value == null) return ABSENT;
    if (ERROR_VALUE.equals(value)) return ERROR;
    try {
      double rate = Double.parseDouble(value);
      if (isStorable(rate)) return new StoredRate(Kind.VALID, rate);
    } catch (NumberFormatException e) {
      LOG.warn("malformed stored rate {}", value, e);
      return ERROR;
    }
    LOG.warn("stored rate out of range: {}", value);
    return ERROR;
  }

  static boolean isStorable(double rate) {
    return rate >= 0 && !Double.isInfinite(rate);
  }

  final Kind kind;
  final double rate;

  StoredRate(Kind kind, double rate) {
    this.kind = kind;
    this.rate = rate;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isValid() {
    return kind == Kind.VALID;
  }

  /** The stored rate. Only defined when {@link #isValid()}. */
  public double rate() {
    if (kind != Kind.VALID) throw new IllegalStateException(kind + " has no rate");
    return rate;
  }

  /** The string written to the store. Absent is never written. */
  public String encode() {
    switch (kind) {
      case VALID:
        return Double.toString(rate);
      case ERROR:
        return ERROR_VALUE;
      default:
        throw new IllegalStateException("absent rates aren't written, they are deleted");
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof StoredRate)) return false;
    StoredRate that = (StoredRate) o;
    return kind == that.kind
        && Double.doubleToLongBits(rate) == Double.doubleToLongBits(that.rate);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= kind.hashCode();
    h *= 1000003;
    long bits = Double.doubleToLongBits(rate);
    h ^= (int) (bits ^ (bits >>> 32));
    return h;
  }

  @Override public String toString() {
    return kind == Kind.VALID ? "Valid(" + rate + ")" : kind == Kind.ERROR ? "Error" : "Absent";
  }
}
