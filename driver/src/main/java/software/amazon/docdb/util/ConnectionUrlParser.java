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

package software.amazon.docdb.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.NonNull;
import software.amazon.docdb.HostSpec;
import software.amazon.docdb.HostSpecBuilder;

/**
 * Parses member addresses ({@code host}, {@code host:port}, {@code [ipv6]:port}) and seed lists of the form
 * {@code mongodb://host1,host2:27018/database?options}.
 */
public class ConnectionUrlParser {

  public static final String URL_SCHEME = "mongodb://";

  /**
   * Parses a single member address. The default port applies when the address names none.
   *
   * @param address the address to parse
   * @return the parsed host and port
   * @throws IllegalArgumentException if the address is empty or its port is malformed or out of range
   */
  public HostSpec parseHostPortPair(final String address) {
    if (StringUtils.isNullOrEmpty(address) || address.trim().isEmpty()) {
      throw new IllegalArgumentException(Messages.get("ConnectionUrlParser.emptyAddress"));
    }
    final String trimmed = address.trim();

    final String host;
    String port = null;
    if (trimmed.startsWith("[")) {
      final int closing = trimmed.indexOf(']');
      if (closing < 0) {
        throw new IllegalArgumentException(
            Messages.get("ConnectionUrlParser.unclosedIpv6Literal", new Object[] {address}));
      }
      host = trimmed.substring(1, closing);
      final String rest = trimmed.substring(closing + 1);
      if (!rest.isEmpty()) {
        if (rest.charAt(0) != ':') {
          throw new IllegalArgumentException(
              Messages.get("ConnectionUrlParser.malformedAddress", new Object[] {address}));
        }
        port = rest.substring(1);
      }
    } else {
      final int separator = trimmed.indexOf(':');
      if (separator >= 0 && separator == trimmed.lastIndexOf(':')) {
        host = trimmed.substring(0, separator);
        port = trimmed.substring(separator + 1);
      } else {
        // zero or several colons: either a bare host name or an unbracketed IPv6 literal
        host = trimmed;
      }
    }

    final HostSpecBuilder builder = new HostSpecBuilder().host(host);
    if (port != null) {
      builder.port(parsePort(address, port));
    }
    return builder.build();
  }

  /**
   * Parses the hosts of a seed list URL. The scheme is optional; a database path and query options are ignored.
   *
   * @param url the seed list
   * @return the hosts in the order they appear
   */
  public List<HostSpec> getHostsFromConnectionUrl(final @NonNull String url) {
    String hosts = url.trim();
    if (hosts.regionMatches(true, 0, URL_SCHEME, 0, URL_SCHEME.length())) {
      hosts = hosts.substring(URL_SCHEME.length());
    }

    final int credentialsEnd = hosts.lastIndexOf('@');
    if (credentialsEnd >= 0) {
      hosts = hosts.substring(credentialsEnd + 1);
    }

    final int pathStart = indexOfAny(hosts, '/', '?');
    if (pathStart >= 0) {
      hosts = hosts.substring(0, pathStart);
    }

    final List<HostSpec> result = new ArrayList<>();
    for (final String address : StringUtils.splitAndTrim(hosts, ',')) {
      result.add(parseHostPortPair(address));
    }
    if (result.isEmpty()) {
      throw new IllegalArgumentException(Messages.get("ConnectionUrlParser.noHosts", new Object[] {url}));
    }
    return result;
  }

  private static int parsePort(final String address, final String port) {
    try {
      return Integer.parseInt(port);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException(
          Messages.get("ConnectionUrlParser.malformedPort", new Object[] {port, address}), e);
    }
  }

  private static int indexOfAny(final String value, final char first, final char second) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == first || c == second) {
        return i;
      }
    }
    return -1;
  }
}
