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

import java.time.Duration;
import java.util.Map;
import ratekeeper.AlgorithmVariant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** Argument checks shared by {@link RateStore} implementations. */
public final class RateStores {

  public static Duration checkTtl(Duration ttl) {
    checkNotNull(ttl, "ttl");
    checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl should be positive: was %s", ttl);
    return ttl;
  }

  public static Map<RateKey, StoredRate> checkWritable(Map<RateKey, StoredRate> entries) {
    checkNotNull(entries, "entries");
    for (Map.Entry<RateKey, StoredRate> entry : entries.entrySet()) {
      checkNotNull(entry.getKey(), "key");
      StoredRate value = checkNotNull(entry.getValue(), "value of %s", entry.getKey());
      checkArgument(value.kind() != StoredRate.Kind.ABSENT,
          "%s: delete keys instead of writing absent", entry.getKey());
    }
    return entries;
  }

  public static Map<RateKey, StoredRate> checkGroup(AlgorithmVariant variant, long scopeId,
      Map<RateKey, StoredRate> entries) {
    checkWritable(entries);
    for (RateKey key : entries.keySet()) {
      checkArgument(key.inGroup(variant, scopeId), "%s is not in group %s:%s", key,
          variant.keyPrefix(), scopeId);
    }
    return entries;
  }

  RateStores() {
  }
}
