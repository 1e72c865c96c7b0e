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

package software.amazon.docdb;

import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The role a replica set member reported about itself the last time it was probed.
 */
public enum HostRole {
  UNKNOWN,
  PRIMARY,
  SECONDARY,
  ARBITER;

  /**
   * Derives the role from an {@code isMaster} reply.
   *
   * @param reply the decoded reply, may be null when no probe has succeeded.
   * @return the reported role, {@link #UNKNOWN} when the reply names none.
   */
  public static HostRole fromIsMasterReply(final @Nullable Map<String, Object> reply) {
    if (reply == null) {
      return UNKNOWN;
    }
    if (isTrue(reply.get("ismaster")) || isTrue(reply.get("isWritablePrimary"))) {
      return PRIMARY;
    }
    if (isTrue(reply.get("secondary"))) {
      return SECONDARY;
    }
    if (isTrue(reply.get("arbiterOnly"))) {
      return ARBITER;
    }
    return UNKNOWN;
  }

  private static boolean isTrue(final @Nullable Object value) {
    return Boolean.TRUE.equals(value);
  }
}
