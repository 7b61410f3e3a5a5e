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

import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import ratekeeper.AlgorithmVariant;
import ratekeeper.CheckResult;

/**
 * A shared, string valued store of published rates. Readers outside this process consult it to
 * decide what to keep.
 *
 * <p>Every multi-key operation is applied atomically: a reader sees either all or none of it.
 * Entries expire after the ttl they were written with, after which they read as {@link
 * StoredRate#ABSENT}.
 */
public interface RateStore extends Closeable {

  /**
   * Answers the question: Are operations on this store likely to succeed?
   *
   * <p>Implementations should use least resources possible to establish a meaningful result, and
   * be safe to call many times, even concurrently.
   */
  CheckResult check();

  /** Never returns null: a missing or expired key is {@link StoredRate#ABSENT}. */
  StoredRate get(RateKey key);

  /** Returns all unexpired entries of the group, keyed by their full key. */
  Map<RateKey, StoredRate> getGroup(AlgorithmVariant variant, long scopeId);

  /** Writes all entries in one atomic operation. {@link StoredRate#ABSENT} values are rejected. */
  void setBatch(Map<RateKey, StoredRate> entries, Duration ttl);

  /**
   * Atomically deletes the keys of the group which are not in {@code entries}, and writes {@code
   * entries}. Every entry must belong to the group.
   */
  void replaceGroup(AlgorithmVariant variant, long scopeId, Map<RateKey, StoredRate> entries,
      Duration ttl);

  /** Atomically deletes the keys. Missing keys are ignored. */
  void delete(Collection<RateKey> keys);
}
