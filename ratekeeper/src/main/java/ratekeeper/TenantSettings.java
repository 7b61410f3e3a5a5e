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

/**
 * Per-tenant switches owned by the embedding platform, such as feature flags and organization
 * options. Implementations may throw {@link TransientIOException} when a lookup can be retried.
 */
public interface TenantSettings {

  /** Every organization has dynamic sampling, in {@link SamplingMode#ORGANIZATION} mode. */
  TenantSettings DEFAULT = new TenantSettings() {
    @Override public boolean dynamicSamplingEnabled(long orgId) {
      return true;
    }

    @Override public SamplingMode samplingMode(long orgId) {
      return SamplingMode.ORGANIZATION;
    }

    @Override public Optional<Double> projectTargetRate(long orgId, long projectId) {
      return Optional.empty();
    }

    @Override public String toString() {
      return "DefaultTenantSettings{}";
    }
  };

  /** When false, no cycle computes or publishes anything for the organization. */
  boolean dynamicSamplingEnabled(long orgId);

  SamplingMode samplingMode(long orgId);

  /**
   * The target a project was configured with in {@link SamplingMode#PROJECT} mode. Empty means
   * the project keeps everything.
   */
  Optional<Double> projectTargetRate(long orgId, long projectId);
}
