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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.NonNull;
import software.amazon.docdb.exceptions.SocketErrorException;
import software.amazon.docdb.util.Messages;

/**
 * A {@link MessageCodec} carrying documents as UTF-8 JSON bodies. The target database travels in the
 * {@code $db} field of the command document.
 */
public class JsonMessageCodec implements MessageCodec {

  public static final int OP_MSG = 2013;
  public static final String DATABASE_FIELD = "$db";

  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};

  private final ObjectMapper mapper;
  private final AtomicInteger requestIds = new AtomicInteger();

  public JsonMessageCodec() {
    this(new ObjectMapper());
  }

  public JsonMessageCodec(final @NonNull ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public byte[] encodeCommand(final @NonNull String database, final @NonNull Map<String, Object> command) {
    final Map<String, Object> document = new LinkedHashMap<>(command);
    document.put(DATABASE_FIELD, database);
    final byte[] body;
    try {
      body = this.mapper.writeValueAsBytes(document);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          Messages.get("JsonMessageCodec.cannotEncode", new Object[] {command, e.getMessage()}), e);
    }
    return new WireMessage(this.requestIds.incrementAndGet(), 0, OP_MSG, body).toBytes();
  }

  @Override
  public Map<String, Object> decodeReply(final byte[] request, final byte[] reply) throws SocketErrorException {
    final WireMessage message;
    try {
      message = WireMessage.parse(reply);
    } catch (final IllegalArgumentException e) {
      throw new SocketErrorException(Messages.get("JsonMessageCodec.malformedReply", new Object[] {e.getMessage()}), e);
    }
    if (message.getOpCode() != OP_MSG) {
      throw new SocketErrorException(
          Messages.get("JsonMessageCodec.unexpectedOpCode", new Object[] {message.getOpCode()}));
    }
    final int requestId = WireMessage.parse(request).getRequestId();
    if (message.getResponseTo() != requestId) {
      throw new SocketErrorException(Messages.get("JsonMessageCodec.responseToMismatch",
          new Object[] {message.getResponseTo(), requestId}));
    }

    try {
      return this.mapper.readValue(message.getBody(), DOCUMENT_TYPE);
    } catch (final IOException e) {
      throw new SocketErrorException(Messages.get("JsonMessageCodec.malformedReply", new Object[] {e.getMessage()}), e);
    }
  }
}
