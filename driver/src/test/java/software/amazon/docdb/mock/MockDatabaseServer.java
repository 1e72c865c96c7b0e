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

package software.amazon.docdb.mock;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import software.amazon.docdb.command.JsonMessageCodec;
import software.amazon.docdb.command.WireMessage;

/**
 * An in-process server speaking the driver's framing with JSON bodies. It answers {@code ping} and
 * {@code isMaster}, rejects every other command, and can be told to drop its connections.
 */
public class MockDatabaseServer implements AutoCloseable {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};
  private static final long HANDLER_JOIN_TIMEOUT_MS = 2000;
  private static final long CLOSE_PROPAGATION_MS = 50;

  private final List<Socket> clients = new CopyOnWriteArrayList<>();
  private final List<Thread> handlers = new CopyOnWriteArrayList<>();
  private final AtomicInteger acceptedConnections = new AtomicInteger();
  private final AtomicInteger receivedMessages = new AtomicInteger();
  private final AtomicInteger replyIds = new AtomicInteger(1000);
  private final AtomicBoolean hiccupOnNextMessage = new AtomicBoolean();
  private final AtomicReference<byte[]> rawReply = new AtomicReference<>();
  private volatile Map<String, Object> isMasterReply;
  private volatile ServerSocket serverSocket;
  private volatile Thread acceptor;

  public MockDatabaseServer start() throws IOException {
    this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    final Map<String, Object> reply = new LinkedHashMap<>();
    reply.put("ismaster", true);
    reply.put("secondary", false);
    reply.put("hosts", Arrays.asList(getAddress(), "replica-2.example.com:27018"));
    reply.put("ok", 1);
    this.isMasterReply = reply;

    this.acceptor = new Thread(this::acceptLoop, "mock-database-server-acceptor");
    this.acceptor.setDaemon(true);
    this.acceptor.start();
    return this;
  }

  public String getAddress() {
    return this.serverSocket.getInetAddress().getHostAddress() + ":" + this.serverSocket.getLocalPort();
  }

  public int getPort() {
    return this.serverSocket.getLocalPort();
  }

  public int getAcceptedConnections() {
    return this.acceptedConnections.get();
  }

  /**
   * Waits until at least the given number of connections were accepted, or the timeout elapsed.
   *
   * @return the number of accepted connections
   */
  public int awaitAcceptedConnections(final int expected, final long timeoutMs) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (this.acceptedConnections.get() < expected && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    return this.acceptedConnections.get();
  }

  public int getReceivedMessages() {
    return this.receivedMessages.get();
  }

  public void setIsMasterReply(final Map<String, Object> reply) {
    this.isMasterReply = reply;
  }

  /**
   * Closes every client connection without telling the clients.
   */
  public void hiccup() throws InterruptedException {
    for (final Socket client : this.clients) {
      closeQuietly(client);
    }
    for (final Thread handler : this.handlers) {
      handler.join(HANDLER_JOIN_TIMEOUT_MS);
    }
    this.clients.clear();
    this.handlers.clear();
    Thread.sleep(CLOSE_PROPAGATION_MS);
  }

  /**
   * The next request is read in full and its connection closed without a reply.
   */
  public void hiccupOnNextMessage() {
    this.hiccupOnNextMessage.set(true);
  }

  /**
   * The next request is answered with the given bytes instead of a reply.
   */
  public void respondNextWith(final byte[] bytes) {
    this.rawReply.set(bytes);
  }

  public void stop() throws InterruptedException {
    final ServerSocket current = this.serverSocket;
    if (current != null) {
      closeQuietly(current);
    }
    if (this.acceptor != null) {
      this.acceptor.join(HANDLER_JOIN_TIMEOUT_MS);
    }
    hiccup();
  }

  @Override
  public void close() throws InterruptedException {
    stop();
  }

  private void acceptLoop() {
    while (!this.serverSocket.isClosed()) {
      final Socket client;
      try {
        client = this.serverSocket.accept();
      } catch (final IOException e) {
        return;
      }
      this.acceptedConnections.incrementAndGet();
      this.clients.add(client);
      final Thread handler = new Thread(() -> handle(client), "mock-database-server-client");
      handler.setDaemon(true);
      this.handlers.add(handler);
      handler.start();
    }
  }

  private void handle(final Socket client) {
    try {
      final DataInputStream in = new DataInputStream(client.getInputStream());
      final OutputStream out = client.getOutputStream();
      while (true) {
        final WireMessage request = readMessage(in);
        this.receivedMessages.incrementAndGet();

        if (this.hiccupOnNextMessage.getAndSet(false)) {
          client.close();
          return;
        }
        final byte[] raw = this.rawReply.getAndSet(null);
        if (raw != null) {
          out.write(raw);
          out.flush();
          continue;
        }

        final Map<String, Object> command = MAPPER.readValue(request.getBody(), DOCUMENT_TYPE);
        final byte[] body = MAPPER.writeValueAsBytes(answer(command));
        out.write(new WireMessage(this.replyIds.incrementAndGet(), request.getRequestId(),
            JsonMessageCodec.OP_MSG, body).toBytes());
        out.flush();
      }
    } catch (final IOException e) {
      closeQuietly(client);
    }
  }

  private Map<String, Object> answer(final Map<String, Object> command) {
    final String name = command.keySet().iterator().next();
    if ("ping".equals(name)) {
      return Collections.singletonMap("ok", (Object) 1);
    }
    if ("isMaster".equalsIgnoreCase(name)) {
      return this.isMasterReply;
    }
    final Map<String, Object> reply = new LinkedHashMap<>();
    reply.put("ok", 0);
    reply.put("errmsg", "no such command: '" + name + "'");
    reply.put("code", 59);
    return reply;
  }

  private static WireMessage readMessage(final DataInputStream in) throws IOException {
    final byte[] lengthField = new byte[4];
    in.readFully(lengthField);
    final int length = ByteBuffer.wrap(lengthField).order(ByteOrder.LITTLE_ENDIAN).getInt();
    final byte[] message = new byte[length];
    System.arraycopy(lengthField, 0, message, 0, 4);
    in.readFully(message, 4, length - 4);
    return WireMessage.parse(message);
  }

  private static void closeQuietly(final AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (final Exception e) {
      // already closed
    }
  }
}
