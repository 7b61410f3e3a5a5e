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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import ratekeeper.Tenant;
import ratekeeper.TenantDirectory;
import ratekeeper.TenantNotFoundException;

final class FakeTenantDirectory implements TenantDirectory {
  final Map<Long, List<Long>> projects = new ConcurrentHashMap<>();
  final Set<Long> deleted = ConcurrentHashMap.newKeySet();

  FakeTenantDirectory projects(long orgId, Long... projectIds) {
    projects.put(orgId, new ArrayList<>(Arrays.asList(projectIds)));
    return this;
  }

  FakeTenantDirectory delete(long orgId) {
    deleted.add(orgId);
    return this;
  }

  @Override public List<Long> projectIds(long orgId) {
    if (deleted.contains(orgId)) throw new TenantNotFoundException(Tenant.organization(orgId));
    List<Long> result = projects.get(orgId);
    return result != null ? new ArrayList<>(result) : new ArrayList<>();
  }
}
