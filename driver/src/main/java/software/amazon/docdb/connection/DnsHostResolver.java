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

package software.amazon.docdb.connection;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.logging.Logger;
import software.amazon.docdb.util.Messages;

/**
 * Resolves hosts through the JVM's name service. The JVM's own address cache applies.
 */
public class DnsHostResolver implements HostResolver {

  private static final Logger LOGGER = Logger.getLogger(DnsHostResolver.class.getName());

  @Override
  public InetAddress resolve(final String host) throws UnknownHostException {
    final InetAddress address = InetAddress.getByName(host);
    LOGGER.finest(() -> Messages.get("DnsHostResolver.resolved", new Object[] {host, address.getHostAddress()}));
    return address;
  }
}
