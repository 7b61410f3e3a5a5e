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

/**
 * Receives a notice that a tenant's sampling configuration should be rebuilt. Delivery is fire and
 * forget; implementations must tolerate duplicate and late notices.
 */
public interface ConfigInvalidationSink {

  ConfigInvalidationSink NOOP = new ConfigInvalidationSink() {
    @Override public void invalidate(Tenant tenant, String reason) {
    }

    @Override public String toString() {
      return "NoopConfigInvalidationSink";
    }
  };

  void invalidate(Tenant tenant, String reason);
}
