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

import java.util.List;

/**
 * Redistributes a target aggregate rate across a tenant's children, proportional to their relative
 * volume. Output is in input order, one item per input item, and satisfies:
 *
 * <ul>
 *   <li>every rate is within the policy's {@code [minRate, maxRate]}</li>
 *   <li>the count-weighted mean of the rates is within the policy tolerance of the target</li>
 *   <li>an item with a lower count never gets a lower rate than an item with a higher count</li>
 * </ul>
 */
public interface RebalancingModel extends Model<RebalancingInput, List<RebalancedItem>> {

  RebalancingPolicy policy();
}
