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
package ratekeeper.task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import ratekeeper.AlgorithmVariant;
import ratekeeper.SamplingMetrics;
import ratekeeper.VolumeRecord;

/**
 * The unit of work of one variant, applied to one organization at a time. Implementations keep no
 * state between organizations: everything they need is read from collaborators or the store.
 */
abstract class OrgTask {
  final AlgorithmVariant variant;
  final SamplingMetrics metrics;

  OrgTask(AlgorithmVariant variant, SamplingMetrics metrics) {
    this.variant = variant;
    this.metrics = metrics.forVariant(variant);
  }

  /** Window used to enumerate organizations with volume worth processing. */
  abstract int activityWindowHours();

  /**
   * Computes and publishes the organization's rates. Throws {@link
   * ratekeeper.TenantNotFoundException} when it vanished, {@link ratekeeper.TransientIOException}
   * when an attempt may succeed later.
   */
  abstract void process(long orgId);

  /** Invoked once all pages were dispatched. */
  void afterCycle(CycleResult result) {
  }

  /**
   * Every listed project with its count, zero when it had no volume, followed by projects that had
   * volume but are missing from a stale listing.
   */
  static List<VolumeRecord> zeroFill(List<Long> listed, Map<Long, Long> counts) {
    Map<Long, Long> merged = new LinkedHashMap<>();
    for (Long projectId : listed) {
      Long count = counts.get(projectId);
      merged.put(projectId, count != null ? count : 0L);
    }
    for (Map.Entry<Long, Long> unlisted : new TreeMap<>(counts).entrySet()) {
      merged.putIfAbsent(unlisted.getKey(), unlisted.getValue());
    }
    List<VolumeRecord> result = new ArrayList<>(merged.size());
    for (Map.Entry<Long, Long> entry : merged.entrySet()) {
      result.add(VolumeRecord.create(entry.getKey(), entry.getValue()));
    }
    return result;
  }

  @Override public String toString() {
    return variant.tag();
  }
}
