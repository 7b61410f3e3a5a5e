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
package ratekeeper.autoconfigure;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * This condition passes when {@link RatekeeperProperties.ZooKeeper#getConnect()} is set to
 * non-empty.
 *
 * <p>Deployments default the property from an environment variable, ex. {@code
 * ${RATEKEEPER_ZOOKEEPER:}}, and spring-boot doesn't treat empty properties as unset.
 */
final class ZooKeeperSetCondition extends SpringBootCondition {
  static final String PROPERTY_NAME = "ratekeeper.zookeeper.connect";

  @Override
  public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata a) {
    String connect = context.getEnvironment().getProperty(PROPERTY_NAME);
    return connect == null || connect.isEmpty() ?
        ConditionOutcome.noMatch(PROPERTY_NAME + " isn't set") :
        ConditionOutcome.match();
  }
}
