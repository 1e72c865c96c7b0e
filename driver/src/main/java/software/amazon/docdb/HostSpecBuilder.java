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

import software.amazon.docdb.util.Messages;
import software.amazon.docdb.util.StringUtils;

public class HostSpecBuilder {
  private String host;
  private int port = HostSpec.NO_PORT;
  private boolean portSet;

  public HostSpecBuilder() {
  }

  public HostSpecBuilder(final HostSpecBuilder hostSpecBuilder) {
    this.host = hostSpecBuilder.host;
    this.port = hostSpecBuilder.port;
    this.portSet = hostSpecBuilder.portSet;
  }

  public HostSpecBuilder copyFrom(final HostSpec hostSpec) {
    this.host = hostSpec.host;
    this.portSet = hostSpec.portSpecified;
    this.port = hostSpec.portSpecified ? hostSpec.port : HostSpec.NO_PORT;
    return this;
  }

  public HostSpecBuilder host(final String host) {
    this.host = host;
    return this;
  }

  public HostSpecBuilder port(final int port) {
    this.port = port;
    this.portSet = true;
    return this;
  }

  public HostSpec build() {
    checkHostIsSet();
    if (!this.portSet) {
      return new HostSpec(this.host, PropertyDefinition.DEFAULT_PORT, false);
    }
    checkPortInRange();
    return new HostSpec(this.host, this.port, true);
  }

  private void checkHostIsSet() {
    if (StringUtils.isNullOrEmpty(this.host)) {
      throw new IllegalArgumentException(Messages.get("HostSpecBuilder.hostNotSet"));
    }
  }

  private void checkPortInRange() {
    if (this.port < 1 || this.port > 65535) {
      throw new IllegalArgumentException(
          Messages.get("HostSpecBuilder.portOutOfRange", new Object[] {this.port, this.host}));
    }
  }
}
