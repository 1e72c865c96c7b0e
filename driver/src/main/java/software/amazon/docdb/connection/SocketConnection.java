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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Properties;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.PropertyDefinition;
import software.amazon.docdb.exceptions.ConnectionFailureException;
import software.amazon.docdb.exceptions.SocketErrorException;
import software.amazon.docdb.exceptions.StaleConnectionException;
import software.amazon.docdb.util.Messages;

/**
 * A {@link RawConnection} over a blocking TCP socket. Messages are framed by a little-endian int32 that holds the
 * total message length, the length field included.
 */
public class SocketConnection implements RawConnection {

  private static final Logger LOGGER = Logger.getLogger(SocketConnection.class.getName());

  public static final int HEADER_LENGTH = 16;
  public static final int MAX_MESSAGE_SIZE_BYTES = 48_000_000;
  private static final int LENGTH_FIELD_SIZE = 4;

  private final @NonNull InetSocketAddress address;
  private final int connectTimeoutMs;
  private final int socketTimeoutMs;
  private final int staleConnectionCheckTimeoutMs;
  private final boolean tcpKeepAlive;
  private final boolean tcpNoDelay;

  private @Nullable Socket socket;
  private @Nullable InputStream input;
  private @Nullable OutputStream output;
  private volatile boolean connected;

  public SocketConnection(final @NonNull InetSocketAddress address, final @NonNull Properties props) {
    this.address = address;
    this.connectTimeoutMs = PropertyDefinition.CONNECT_TIMEOUT_MS.getInteger(props);
    this.socketTimeoutMs = PropertyDefinition.SOCKET_TIMEOUT_MS.getInteger(props);
    this.staleConnectionCheckTimeoutMs = PropertyDefinition.STALE_CONNECTION_CHECK_TIMEOUT_MS.getInteger(props);
    this.tcpKeepAlive = PropertyDefinition.TCP_KEEP_ALIVE.getBoolean(props);
    this.tcpNoDelay = PropertyDefinition.TCP_NO_DELAY.getBoolean(props);
  }

  @Override
  public void connect() throws ConnectionFailureException {
    if (this.connected) {
      return;
    }
    if (this.address.isUnresolved()) {
      throw new ConnectionFailureException(
          Messages.get("SocketConnection.unresolvedAddress", new Object[] {this.address}));
    }

    final Socket newSocket = new Socket();
    try {
      newSocket.setTcpNoDelay(this.tcpNoDelay);
      newSocket.setKeepAlive(this.tcpKeepAlive);
      newSocket.connect(this.address, this.connectTimeoutMs);
      newSocket.setSoTimeout(this.socketTimeoutMs);
      this.input = newSocket.getInputStream();
      this.output = newSocket.getOutputStream();
    } catch (final IOException e) {
      closeSocket(newSocket);
      throw new ConnectionFailureException(
          Messages.get("SocketConnection.connectFailed", new Object[] {this.address, e.getMessage()}), e);
    }

    this.socket = newSocket;
    this.connected = true;
    LOGGER.finest(() -> Messages.get("SocketConnection.connected", new Object[] {this.address}));
  }

  @Override
  public void disconnect() {
    this.connected = false;
    final Socket current = this.socket;
    this.socket = null;
    this.input = null;
    this.output = null;
    if (current != null) {
      closeSocket(current);
      LOGGER.finest(() -> Messages.get("SocketConnection.disconnected", new Object[] {this.address}));
    }
  }

  @Override
  public boolean isConnected() {
    return this.connected;
  }

  @Override
  public byte[] execute(final byte[] request) throws StaleConnectionException, SocketErrorException {
    final Socket current = this.socket;
    final InputStream in = this.input;
    final OutputStream out = this.output;
    if (current == null || in == null || out == null
        || current.isClosed() || current.isInputShutdown() || current.isOutputShutdown()) {
      throw new StaleConnectionException(
          Messages.get("SocketConnection.socketUnusable", new Object[] {this.address}));
    }
    checkPeerOpen(current, in);

    try {
      out.write(request);
      out.flush();
    } catch (final IOException e) {
      disconnect();
      throw new SocketErrorException(
          Messages.get("SocketConnection.writeFailed", new Object[] {this.address, e.getMessage()}), e);
    }

    try {
      return readReply(in);
    } catch (final SocketErrorException e) {
      disconnect();
      throw e;
    }
  }

  /**
   * Reads from the socket with a very short timeout to learn whether the peer closed its side since the last
   * exchange. The protocol is strictly request/reply, so nothing is pending on a healthy connection and a read
   * that times out is the only healthy outcome.
   */
  private void checkPeerOpen(final Socket current, final InputStream in) throws StaleConnectionException {
    if (this.staleConnectionCheckTimeoutMs <= 0) {
      return;
    }

    final int read;
    try {
      current.setSoTimeout(this.staleConnectionCheckTimeoutMs);
      try {
        read = in.read();
      } finally {
        current.setSoTimeout(this.socketTimeoutMs);
      }
    } catch (final SocketTimeoutException e) {
      return;
    } catch (final IOException e) {
      throw new StaleConnectionException(
          Messages.get("SocketConnection.peerCheckFailed", new Object[] {this.address, e.getMessage()}), e);
    }

    if (read < 0) {
      throw new StaleConnectionException(
          Messages.get("SocketConnection.closedByPeer", new Object[] {this.address}));
    }
    throw new StaleConnectionException(
        Messages.get("SocketConnection.unexpectedData", new Object[] {this.address}));
  }

  private byte[] readReply(final InputStream in) throws SocketErrorException {
    try {
      final byte[] lengthField = new byte[LENGTH_FIELD_SIZE];
      readFully(in, lengthField, 0, LENGTH_FIELD_SIZE);
      final int length = ByteBuffer.wrap(lengthField).order(ByteOrder.LITTLE_ENDIAN).getInt();
      if (length < HEADER_LENGTH || length > MAX_MESSAGE_SIZE_BYTES) {
        throw new SocketErrorException(
            Messages.get("SocketConnection.invalidMessageLength", new Object[] {length, this.address}));
      }

      final byte[] reply = new byte[length];
      System.arraycopy(lengthField, 0, reply, 0, LENGTH_FIELD_SIZE);
      readFully(in, reply, LENGTH_FIELD_SIZE, length - LENGTH_FIELD_SIZE);
      return reply;
    } catch (final SocketTimeoutException e) {
      throw new SocketErrorException(
          Messages.get("SocketConnection.readTimedOut", new Object[] {this.address, this.socketTimeoutMs}), e);
    } catch (final EOFException e) {
      throw new SocketErrorException(
          Messages.get("SocketConnection.closedBeforeReply", new Object[] {this.address}), e);
    } catch (final IOException e) {
      throw new SocketErrorException(
          Messages.get("SocketConnection.readFailed", new Object[] {this.address, e.getMessage()}), e);
    }
  }

  private static void readFully(final InputStream in, final byte[] buffer, final int offset, final int length)
      throws IOException {
    int total = 0;
    while (total < length) {
      final int read = in.read(buffer, offset + total, length - total);
      if (read < 0) {
        throw new EOFException();
      }
      total += read;
    }
  }

  private void closeSocket(final Socket toClose) {
    try {
      toClose.close();
    } catch (final IOException e) {
      LOGGER.finest(() -> Messages.get("SocketConnection.closeFailed", new Object[] {this.address, e.getMessage()}));
    }
  }

  @Nullable Socket getSocket() {
    return this.socket;
  }

  @Override
  public String toString() {
    return String.format("%s [address=%s, connected=%s]", super.toString(), this.address, this.connected);
  }
}
