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

import static com.google.common.base.Preconditions.checkNotNull;

/** An organization or a project: the unit a sampling rate is assigned to. */
// @Immutable
public final class Tenant {

  public enum Kind {
    ORGANIZATION,
    PROJECT
  }

  public static Tenant organization(long id) {
    return new Tenant(Kind.ORGANIZATION, id);
  }

  public static Tenant project(long id) {
    return new Tenant(Kind.PROJECT, id);
  }

  public final Kind kind;
  public final long id;

  Tenant(Kind kind, long id) {
    this.kind = checkNotNull(kind, "kind");
    this.id = id;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Tenant)) return false;
    Tenant that = (Tenant) o;
    return this.kind == that.kind && this.id == that.id;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= kind.hashCode();
    h *= 1000003;
    h ^= (int) ((id >>> 32) ^ id);
    return h;
  }

  @Override public String toString() {
    return (kind == Kind.ORGANIZATION ? "org:" : "project:") + id;
  }
}
