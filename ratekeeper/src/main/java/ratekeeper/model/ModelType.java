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

/** The closed set of rebalancing models, selected explicitly where a cycle is configured. */
public enum ModelType {
  /** Each child keeps the same number of events, within the policy bounds. */
  FULL_REBALANCING {
    @Override public RebalancingModel newModel(RebalancingPolicy policy) {
      return new FullRebalancingModel(policy);
    }
  },
  /** A blend of the uniform target and {@link #FULL_REBALANCING}, by the policy intensity. */
  INTENSITY_REBALANCING {
    @Override public RebalancingModel newModel(RebalancingPolicy policy) {
      return new IntensityRebalancingModel(policy);
    }
  };

  public abstract RebalancingModel newModel(RebalancingPolicy policy);
}
