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

import java.util.Locale;

/**
 * Each variant is a complete, independently scheduled cycle. The {@link #keyPrefix} is part of
 * every store key the variant writes, so variants never overwrite each other.
 */
public enum AlgorithmVariant {
  /** Rebalances an organization's target rate across its projects by relative volume. */
  PER_PROJECT_BIAS("pp"),
  /** Extrapolates each project's own volume and resolves it to a quota tier. */
  SLIDING_WINDOW_PER_PROJECT("swp"),
  /** Extrapolates an organization's total volume and resolves it to a quota tier. */
  SLIDING_WINDOW_PER_ORG("swo"),
  /** Corrects the difference between the intended and the effectively applied rate. */
  RECALIBRATE_ORG("rco"),
  /** Like {@link #RECALIBRATE_ORG}, for each project of organizations in project mode. */
  RECALIBRATE_PROJECT("rcp"),
  /**
   * Rebalances each project's rate across its transactions, so that rare transactions keep
   * proportionally more. Groups are per project: the scope is the project id.
   */
  BOOST_LOW_VOLUME_TRANSACTIONS("blt");

  final String keyPrefix;

  AlgorithmVariant(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }

  public String keyPrefix() {
    return keyPrefix;
  }

  /** Tags used in logs and metric names, ex. "sliding_window_per_org" */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
