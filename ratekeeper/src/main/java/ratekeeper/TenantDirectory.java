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

import java.util.List;

/**
 * Authoritative list of an organization's projects. This is typically served by a read replica, so
 * it can lag the {@link VolumeSource}: a project may show up in one and not yet in the other.
 */
public interface TenantDirectory {

  /**
   * @throws TenantNotFoundException when the organization was deleted after it was enumerated
   */
  List<Long> projectIds(long orgId);
}
