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

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Supplies observed root event counts. Queries are batched by organization so that one call costs
 * at most a page of tenants, regardless of how many organizations exist.
 *
 * <p>Implementations may throw {@link TransientIOException} when a query can be retried.
 */
public interface VolumeSource {

  /**
   * Returns up to {@code limit} ids of organizations with root volume in the window, in ascending
   * order and strictly greater than {@code afterOrgId}. An empty result ends paging.
   */
  List<Long> activeOrgs(long afterOrgId, int limit, int windowHours);

  /** Root event count per organization. Organizations without volume may be absent. */
  Map<Long, Long> orgCounts(Collection<Long> orgIds, int windowHours);

  /**
   * Root event count per project, grouped by organization. Projects without volume may be absent.
   */
  Map<Long, Map<Long, Long>> projectCounts(Collection<Long> orgIds, int windowHours);

  /** Kept and dropped root events per organization, for recalibration. */
  Map<Long, KeepDropCounts> keepDropCounts(Collection<Long> orgIds, int windowMinutes);

  /**
   * Kept and dropped root events per project, grouped by organization. Projects without events may
   * be absent.
   */
  Map<Long, Map<Long, KeepDropCounts>> projectKeepDropCounts(Collection<Long> orgIds,
      int windowMinutes);

  /**
   * Root transaction counts per project of the organization. Each project lists up to {@code
   * largest} of its busiest and up to {@code smallest} of its quietest transactions explicitly.
   * Projects without transactions may be absent.
   */
  Map<Long, TransactionVolumes> transactionVolumes(long orgId, int windowHours, int largest,
      int smallest);
}
