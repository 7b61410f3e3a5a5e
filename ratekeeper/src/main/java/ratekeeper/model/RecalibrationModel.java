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

/**
 * Computes the factor an organization's rates should be multiplied by so that the rate the edge
 * effectively applies converges to the target: {@code previousFactor * target / effective}.
 *
 * <p>The factor compounds: if sampling at 10% with a factor of 2 still yields 10% when 20% was
 * intended, the next factor is 4.
 */
public final class RecalibrationModel implements Model<RecalibrationInput, Double> {
  public static final RecalibrationModel INSTANCE = new RecalibrationModel();

  @Override public Double run(RecalibrationInput input) {
    if (!(input.previousFactor > 0) || Double.isInfinite(input.previousFactor)) {
      throw new InvalidModelInputException("previousFactor should be positive: was "
          + input.previousFactor);
    }
    if (!(input.effectiveRate > 0) || input.effectiveRate > 1) {
      throw new InvalidModelInputException("effectiveRate should be in (0, 1]: was "
          + input.effectiveRate);
    }
    if (!(input.targetRate >= 0) || input.targetRate > 1) {
      throw new InvalidModelInputException("targetRate should be between 0 and 1: was "
          + input.targetRate);
    }
    return input.previousFactor * (input.targetRate / input.effectiveRate);
  }

  @Override public String toString() {
    return "RecalibrationModel";
  }

  RecalibrationModel() {
  }
}
