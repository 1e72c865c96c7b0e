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

import java.util.Properties;
import software.amazon.docdb.DriverProperty;
import software.amazon.docdb.util.Messages;
import software.amazon.docdb.util.StringUtils;

public class HostAvailabilityStrategyFactory {

  public static final DriverProperty DEFAULT_HOST_AVAILABILITY_STRATEGY = new DriverProperty(
      "defaultHostAvailabilityStrategy", "",
      "Strategy deciding when a down node is probed again: simple or exponentialBackoff.");

  public static final DriverProperty DOWN_INTERVAL_MS = new DriverProperty(
      "downIntervalMs", "30000",
      "Time in milliseconds a down node is left alone before it is refreshed, used by the simple strategy.");

  public static final DriverProperty HOST_AVAILABILITY_STRATEGY_MAX_RETRIES = new DriverProperty(
      "hostAvailabilityStrategyMaxRetries", "5",
      "Max number of times the backoff between refreshes of a down node is doubled.");

  public static final DriverProperty HOST_AVAILABILITY_STRATEGY_INITIAL_BACKOFF_TIME = new DriverProperty(
      "hostAvailabilityStrategyInitialBackoffTime", "30",
      "The initial backoff time in seconds.");

  public HostAvailabilityStrategy create(final Properties props) {
    final String name = props == null ? null : DEFAULT_HOST_AVAILABILITY_STRATEGY.getString(props);
    if (StringUtils.isNullOrEmpty(name) || SimpleHostAvailabilityStrategy.NAME.equalsIgnoreCase(name)) {
      return new SimpleHostAvailabilityStrategy(props == null ? new Properties() : props);
    } else if (ExponentialBackoffHostAvailabilityStrategy.NAME.equalsIgnoreCase(name)) {
      return new ExponentialBackoffHostAvailabilityStrategy(props);
    }
    throw new IllegalArgumentException(
        Messages.get("HostAvailabilityStrategyFactory.unknownStrategy", new Object[] {name}));
  }
}
