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
package ratekeeper.store;

import ratekeeper.AlgorithmVariant;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifies one published rate. Keys are deterministic: the same variant and entity always map
 * to the same key, so a cycle overwrites what the previous one wrote.
 *
 * <p>Keys sharing a variant and scope form a group, ex. the project rates of one organization.
 * For organization level variants the scope is the organization itself.
 */
// @Immutable
public final class RateKey implements Comparable<RateKey> {

  public static RateKey create(AlgorithmVariant variant, long scopeId, long entityId) {
    return new RateKey(variant, scopeId, entityId);
  }

  /** A key whose scope and entity are the same organization. */
  public static RateKey forOrg(AlgorithmVariant variant, long orgId) {
    return new RateKey(variant, orgId, orgId);
  }

  public final AlgorithmVariant variant;
  public final long scopeId;
  public final long entityId;

  RateKey(AlgorithmVariant variant, long scopeId, long entityId) {
    this.variant = checkNotNull(variant, "variant");
    this.scopeId = scopeId;
    this.entityId = entityId;
  }

  /** Returns true if this key belongs to the group of the given variant and scope. */
  public boolean inGroup(AlgorithmVariant variant, long scopeId) {
    return this.variant == variant && this.scopeId == scopeId;
  }

  @Override public int compareTo(RateKey that) {
    int result = variant.compareTo(that.variant);
    if (result != 0) return result;
    result = Long.compare(scopeId, that.scopeId);
    if (result != 0) return result;
    return Long.compare(entityId, that.entityId);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RateKey)) return false;
    RateKey that = (RateKey) o;
    return variant == that.variant && scopeId == that.scopeId && entityId == that.entityId;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= variant.hashCode();
    h *= 1000003;
    h ^= (int) (scopeId ^ (scopeId >>> 32));
    h *= 1000003;
    h ^= (int) (entityId ^ (entityId >>> 32));
    return h;
  }

  /** The canonical form, ex. "ds:pp:1:42" */
  @Override public String toString() {
    return "ds:" + variant.keyPrefix() + ":" + scopeId + ":" + entityId;
  }
}
