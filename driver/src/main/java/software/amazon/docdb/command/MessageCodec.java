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

package software.amazon.docdb.command;

import java.util.Map;
import org.checkerframework.checker.nullness.qual.NonNull;
import software.amazon.docdb.exceptions.SocketErrorException;

/**
 * Converts command documents to request messages and reply messages back to documents. The node itself treats
 * both as opaque bytes.
 */
public interface MessageCodec {

  /**
   * Encodes a command addressed at a logical database.
   *
   * @param database the target database
   * @param command  the command document, its first key naming the command
   * @return the complete, framed request message
   * @throws IllegalArgumentException if the command cannot be encoded
   */
  byte[] encodeCommand(@NonNull String database, @NonNull Map<String, Object> command);

  /**
   * Decodes a complete, framed reply message.
   *
   * @param request the request the reply answers, as returned by {@link #encodeCommand(String, Map)}
   * @param reply   the reply as read from the connection
   * @return the reply document
   * @throws SocketErrorException if the reply cannot be decoded or answers another request; the request was
   *                              already sent
   */
  Map<String, Object> decodeReply(byte[] request, byte[] reply) throws SocketErrorException;
}
