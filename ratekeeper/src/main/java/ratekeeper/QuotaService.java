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

import java.util.Optional;

/** Source of truth for contractual sampling policy. Rates are in {@code [0, 1]}. */
public interface QuotaService {

  /** The organization's contractual rate, or empty when there is no quota data. */
  Optional<Double> blendedRate(long orgId);

  /**
   * Resolves a monthly volume to the tier that applies to it, or empty when the tier can't be
   * determined.
   */
  Optional<SamplingTier> tierForVolume(long orgId, double extrapolatedVolume);
}
