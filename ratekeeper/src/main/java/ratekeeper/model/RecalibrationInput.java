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

/** What the edge was told, what it effectively did, and what was intended. */
// @Immutable
public final class RecalibrationInput {

  public static RecalibrationInput create(double previousFactor, double effectiveRate,
      double targetRate) {
    return new RecalibrationInput(previousFactor, effectiveRate, targetRate);
  }

  public final double previousFactor;
  public final double effectiveRate;
  public final double targetRate;

  RecalibrationInput(double previousFactor, double effectiveRate, double targetRate) {
    this.previousFactor = previousFactor;
    this.effectiveRate = effectiveRate;
    this.targetRate = targetRate;
  }

  @Override public String toString() {
    return "RecalibrationInput{previousFactor=" + previousFactor
        + ", effectiveRate=" + effectiveRate + ", targetRate=" + targetRate + "}";
  }
}
