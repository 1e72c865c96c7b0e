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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import software.amazon.docdb.connection.SocketConnection;
import software.amazon.docdb.util.Messages;

/**
 * A protocol message: a 16 byte little-endian header (total length, request id, id of the request being answered,
 * operation code) followed by the body.
 */
public class WireMessage {

  private final int requestId;
  private final int responseTo;
  private final int opCode;
  private final byte[] body;

  public WireMessage(final int requestId, final int responseTo, final int opCode, final byte[] body) {
    this.requestId = requestId;
    this.responseTo = responseTo;
    this.opCode = opCode;
    this.body = body;
  }

  public static WireMessage parse(final byte[] message) {
    if (message.length < SocketConnection.HEADER_LENGTH) {
      throw new IllegalArgumentException(
          Messages.get("WireMessage.tooShort", new Object[] {message.length}));
    }
    final ByteBuffer buffer = ByteBuffer.wrap(message).order(ByteOrder.LITTLE_ENDIAN);
    final int length = buffer.getInt();
    if (length != message.length) {
      throw new IllegalArgumentException(
          Messages.get("WireMessage.lengthMismatch", new Object[] {length, message.length}));
    }
    final int requestId = buffer.getInt();
    final int responseTo = buffer.getInt();
    final int opCode = buffer.getInt();
    return new WireMessage(requestId, responseTo, opCode,
        Arrays.copyOfRange(message, SocketConnection.HEADER_LENGTH, message.length));
  }

  public byte[] toBytes() {
    final int length = SocketConnection.HEADER_LENGTH + this.body.length;
    return ByteBuffer.allocate(length)
        .order(ByteOrder.LITTLE_ENDIAN)
        .putInt(length)
        .putInt(this.requestId)
        .putInt(this.responseTo)
        .putInt(this.opCode)
        .put(this.body)
        .array();
  }

  public int getRequestId() {
    return this.requestId;
  }

  public int getResponseTo() {
    return this.responseTo;
  }

  public int getOpCode() {
    return this.opCode;
  }

  public byte[] getBody() {
    return this.body;
  }
}
