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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DnsHostResolverTests {

  private static final Logger LOGGER = Logger.getLogger(DnsHostResolver.class.getName());

  private final List<LogRecord> records = new CopyOnWriteArrayList<>();
  private final Handler handler = new Handler() {
    @Override
    public void publish(final LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  };
  private Level previousLevel;

  @BeforeEach
  void setUp() {
    previousLevel = LOGGER.getLevel();
    LOGGER.setLevel(Level.FINEST);
    LOGGER.addHandler(handler);
  }

  @AfterEach
  void tearDown() {
    LOGGER.removeHandler(handler);
    LOGGER.setLevel(previousLevel);
  }

  @Test
  void testResolvesAddressLiteralAndLogsIt() throws Exception {
    final InetAddress address = new DnsHostResolver().resolve("127.0.0.1");

    assertEquals("127.0.0.1", address.getHostAddress());
    assertEquals(1, records.size());
    assertEquals(Level.FINEST, records.get(0).getLevel());
    assertEquals("Resolved '127.0.0.1' to 127.0.0.1.", records.get(0).getMessage());
  }
}
