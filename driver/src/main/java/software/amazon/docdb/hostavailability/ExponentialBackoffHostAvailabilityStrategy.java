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

import static software.amazon.docdb.hostavailability.HostAvailabilityStrategyFactory.HOST_AVAILABILITY_STRATEGY_INITIAL_BACKOFF_TIME;
import static software.amazon.docdb.hostavailability.HostAvailabilityStrategyFactory.HOST_AVAILABILITY_STRATEGY_MAX_RETRIES;

import java.time.Instant;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.util.Messages;

/**
 * Doubles the wait before the next refresh with every consecutive failure, up to {@code maxRetries} doublings.
 */
public class ExponentialBackoffHostAvailabilityStrategy implements HostAvailabilityStrategy {

  public static final String NAME = "exponentialBackoff";

  private final int maxRetries;
  private final int initialBackoffTimeSeconds;
  private volatile int notAvailableCount = 0;

  public ExponentialBackoffHostAvailabilityStrategy(final Properties props) {
    if (HOST_AVAILABILITY_STRATEGY_MAX_RETRIES.getInteger(props) < 1) {
      throw new IllegalArgumentException(Messages.get("HostAvailabilityStrategy.invalidMaxRetries",
          new Object[] {HOST_AVAILABILITY_STRATEGY_MAX_RETRIES.getInteger(props)}));
    }
    this.maxRetries = HOST_AVAILABILITY_STRATEGY_MAX_RETRIES.getInteger(props);

    if (HOST_AVAILABILITY_STRATEGY_INITIAL_BACKOFF_TIME.getInteger(props) < 1) {
      throw new IllegalArgumentException(Messages.get("HostAvailabilityStrategy.invalidInitialBackoffTime",
          new Object[] {HOST_AVAILABILITY_STRATEGY_INITIAL_BACKOFF_TIME.getInteger(props)}));
    }
    this.initialBackoffTimeSeconds = HOST_AVAILABILITY_STRATEGY_INITIAL_BACKOFF_TIME.getInteger(props);
  }

  @Override
  public void setHostAvailability(final HostAvailability hostAvailability) {
    if (hostAvailability == HostAvailability.AVAILABLE) {
      this.notAvailableCount = 0;
    } else if (hostAvailability == HostAvailability.NOT_AVAILABLE) {
      this.notAvailableCount++;
    }
  }

  @Override
  public boolean isRefreshDue(
      final HostAvailability availability, final @Nullable Instant downAt, final Instant now) {
    if (availability == HostAvailability.AVAILABLE) {
      return false;
    }
    if (availability == HostAvailability.UNKNOWN || downAt == null) {
      return true;
    }

    final int doublings = Math.min(Math.max(this.notAvailableCount - 1, 0), this.maxRetries);
    final long retryDelayMillis = (1L << doublings) * this.initialBackoffTimeSeconds * 1000L;
    final Instant earliestRetry = downAt.plusMillis(retryDelayMillis);
    return !earliestRetry.isAfter(now);
  }

  int getNotAvailableCount() {
    return this.notAvailableCount;
  }
}
