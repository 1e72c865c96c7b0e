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

import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class PropertyDefinition {

  public static final int DEFAULT_PORT = 27017;

  public static final DriverProperty CONNECT_TIMEOUT_MS =
      new DriverProperty(
          "connectTimeoutMs", "10000",
          "Socket connect timeout in milliseconds. Zero waits indefinitely.");

  public static final DriverProperty SOCKET_TIMEOUT_MS =
      new DriverProperty(
          "socketTimeoutMs", "0",
          "Time in milliseconds to wait for a reply once a request has been sent. Zero waits indefinitely.");

  public static final DriverProperty TCP_KEEP_ALIVE =
      new DriverProperty(
          "tcpKeepAlive", "true",
          "Enable or disable TCP keep-alive probes on node connections.");

  public static final DriverProperty TCP_NO_DELAY =
      new DriverProperty(
          "tcpNoDelay", "true",
          "Enable or disable Nagle's algorithm on node connections.");

  public static final DriverProperty STALE_CONNECTION_CHECK_TIMEOUT_MS =
      new DriverProperty(
          "staleConnectionCheckTimeoutMs", "1",
          "Time in milliseconds spent probing a connection for a peer-side close before each request.");

  private static final List<DriverProperty> PROPERTIES = Collections.unmodifiableList(
      Arrays.stream(PropertyDefinition.class.getDeclaredFields())
          .filter(f -> f.getType() == DriverProperty.class
              && Modifier.isPublic(f.getModifiers())
              && Modifier.isStatic(f.getModifiers()))
          .map(f -> {
            try {
              return (DriverProperty) f.get(null);
            } catch (final IllegalAccessException ex) {
              throw new IllegalStateException(ex);
            }
          })
          .collect(Collectors.toList()));

  private PropertyDefinition() {
  }

  public static List<DriverProperty> getProperties() {
    return PROPERTIES;
  }
}
