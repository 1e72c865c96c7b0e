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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * The address of a replica set member: a host name or IP literal and a TCP port.
 */
public class HostSpec {

  public static final int NO_PORT = -1;

  protected final @NonNull String host;
  protected final int port;
  protected final boolean portSpecified;

  HostSpec(final @NonNull String host, final int port, final boolean portSpecified) {
    this.host = host;
    this.port = port;
    this.portSpecified = portSpecified;
  }

  public @NonNull String getHost() {
    return this.host;
  }

  public int getPort() {
    return this.port;
  }

  public boolean isPortSpecified() {
    return this.portSpecified;
  }

  /**
   * Returns the address in {@code host:port} form, bracketing IPv6 literals.
   *
   * @return the printable address.
   */
  public String asAlias() {
    return (this.host.indexOf(':') >= 0 ? "[" + this.host + "]" : this.host) + ":" + this.port;
  }

  @Override
  public String toString() {
    return asAlias();
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.host.toLowerCase(), this.port);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof HostSpec)) {
      return false;
    }
    final HostSpec other = (HostSpec) obj;
    return this.port == other.port && this.host.equalsIgnoreCase(other.host);
  }
}
