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

import java.time.Instant;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides when a node that is down should be probed again. A node reports every health observation to its
 * strategy, including repeated failures of an already-down node.
 */
public interface HostAvailabilityStrategy {

  void setHostAvailability(HostAvailability hostAvailability);

  /**
   * Tells a replica set monitor whether the node is due for a refresh.
   *
   * @param availability the node's current availability
   * @param downAt       when the node was last observed down, null unless it is down
   * @param now          the current time
   * @return true if a refresh should be attempted now
   */
  boolean isRefreshDue(HostAvailability availability, @Nullable Instant downAt, Instant now);
}
