/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package software.amazon.docdb.hostavailability;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.Test;

class HostAvailabilityStrategyFactoryTests {

  private final HostAvailabilityStrategyFactory factory = new HostAvailabilityStrategyFactory();

  @Test
  void testDefaultStrategy() {
    assertTrue(factory.create(new Properties()) instanceof SimpleHostAvailabilityStrategy);
    assertTrue(factory.create(null) instanceof SimpleHostAvailabilityStrategy);
  }

  @Test
  void testNamedStrategies() {
    Properties props = new Properties();
    props.setProperty(HostAvailabilityStrategyFactory.DEFAULT_HOST_AVAILABILITY_STRATEGY.name, "Simple");
    assertTrue(factory.create(props) instanceof SimpleHostAvailabilityStrategy);

    props.setProperty(HostAvailabilityStrategyFactory.DEFAULT_HOST_AVAILABILITY_STRATEGY.name, "exponentialBackoff");
    assertTrue(factory.create(props) instanceof ExponentialBackoffHostAvailabilityStrategy);
  }

  @Test
  void testUnknownStrategyIsRejected() {
    Properties props = new Properties();
    props.setProperty(HostAvailabilityStrategyFactory.DEFAULT_HOST_AVAILABILITY_STRATEGY.name, "roundRobin");
    assertThrows(IllegalArgumentException.class, () -> factory.create(props));
  }
}
