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

import static software.amazon.docdb.hostavailability.HostAvailabilityStrategyFactory.DOWN_INTERVAL_MS;

import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.util.Messages;

/**
 * Re-probes a down node once a fixed interval has passed since it was last seen down.
 */
public class SimpleHostAvailabilityStrategy implements HostAvailabilityStrategy {

  public static final String NAME = "simple";

  private final Duration downInterval;

  public SimpleHostAvailabilityStrategy(final Properties props) {
    final long downIntervalMs = DOWN_INTERVAL_MS.getLong(props);
    if (downIntervalMs < 0) {
      throw new IllegalArgumentException(
          Messages.get("HostAvailabilityStrategy.invalidDownInterval", new Object[] {downIntervalMs}));
    }
    this.downInterval = Duration.ofMillis(downIntervalMs);
  }

  @Override
  public void setHostAvailability(final HostAvailability hostAvailability) {
    // stateless
  }

  @Override
  public boolean isRefreshDue(
      final HostAvailability availability, final @Nullable Instant downAt, final Instant now) {
    switch (availability) {
      case AVAILABLE:
        return false;
      case NOT_AVAILABLE:
        return downAt == null || !downAt.plus(this.downInterval).isAfter(now);
      default:
        return true;
    }
  }
}
