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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HostRoleTests {

  @Test
  void testRoleFromIsMasterReply() {
    assertEquals(HostRole.PRIMARY, HostRole.fromIsMasterReply(Collections.singletonMap("ismaster", (Object) true)));
    assertEquals(HostRole.PRIMARY,
        HostRole.fromIsMasterReply(Collections.singletonMap("isWritablePrimary", (Object) true)));
    assertEquals(HostRole.ARBITER, HostRole.fromIsMasterReply(Collections.singletonMap("arbiterOnly", (Object) true)));
    assertEquals(HostRole.UNKNOWN, HostRole.fromIsMasterReply(null));
    assertEquals(HostRole.UNKNOWN, HostRole.fromIsMasterReply(Collections.singletonMap("ok", (Object) 1)));

    final Map<String, Object> secondary = new LinkedHashMap<>();
    secondary.put("ismaster", false);
    secondary.put("secondary", true);
    assertEquals(HostRole.SECONDARY, HostRole.fromIsMasterReply(secondary));
  }
}
