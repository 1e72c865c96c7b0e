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

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.command.CommandExecutor;
import software.amazon.docdb.command.JsonMessageCodec;
import software.amazon.docdb.command.MessageCodec;
import software.amazon.docdb.connection.ConnectionProvider;
import software.amazon.docdb.connection.DnsHostResolver;
import software.amazon.docdb.connection.HostResolver;
import software.amazon.docdb.connection.RawConnection;
import software.amazon.docdb.connection.SocketConnectionProvider;
import software.amazon.docdb.exceptions.CommandFailureException;
import software.amazon.docdb.exceptions.ConnectionFailureException;
import software.amazon.docdb.exceptions.DocumentDbException;
import software.amazon.docdb.exceptions.SocketErrorException;
import software.amazon.docdb.exceptions.StaleConnectionException;
import software.amazon.docdb.hostavailability.HostAvailability;
import software.amazon.docdb.hostavailability.HostAvailabilityStrategy;
import software.amazon.docdb.hostavailability.HostAvailabilityStrategyFactory;
import software.amazon.docdb.util.ConnectionUrlParser;
import software.amazon.docdb.util.Messages;

/**
 * The driver-side representative of one replica set member. A node owns exactly one connection to its server,
 * tracks whether the server is reachable and offers {@link #ensureConnected(NodeCallable)} as the context in
 * which commands are run.
 *
 * <p>Failures are handled according to when they happen:
 * <ul>
 *   <li>a connection that cannot be opened, or an address that cannot be resolved, marks the node down and
 *   raises {@link ConnectionFailureException};</li>
 *   <li>a connection found unusable before a request is written is reopened and the request is retried, at most
 *   {@link #MAX_RECONNECT_ATTEMPTS} time;</li>
 *   <li>a connection that fails while a request is written or its reply is read marks the node down and raises
 *   {@link SocketErrorException}. The request is never retried, the server may have applied it.</li>
 * </ul>
 *
 * <p>All operations that use the connection are serialized on a per-node lock, so at most one request is in
 * flight at a time. Health observers may be called from any thread without taking the lock.
 */
public class Node {

  private static final Logger LOGGER = Logger.getLogger(Node.class.getName());

  public static final int MAX_RECONNECT_ATTEMPTS = 1;
  public static final String ADMIN_DATABASE = "admin";

  private static final Map<String, Object> IS_MASTER_COMMAND =
      Collections.singletonMap("isMaster", (Object) 1);

  private final @NonNull HostSpec hostSpec;
  private final @NonNull Properties props;
  private final @NonNull ConnectionProvider connectionProvider;
  private final @NonNull HostResolver hostResolver;
  private final @NonNull HostAvailabilityStrategy availabilityStrategy;
  private final @NonNull CommandExecutor commandExecutor;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile @Nullable InetSocketAddress resolvedAddress;
  private volatile Health health = Health.UNKNOWN;
  private volatile HostRole role = HostRole.UNKNOWN;
  private volatile @Nullable Duration latency;
  private volatile List<HostSpec> peers = Collections.emptyList();
  private volatile @Nullable RawConnection connection;

  public Node(final @NonNull String address) {
    this(address, new Properties());
  }

  public Node(final @NonNull String address, final @NonNull Properties props) {
    this(new ConnectionUrlParser().parseHostPortPair(address), props, new SocketConnectionProvider(),
        new DnsHostResolver(), new JsonMessageCodec());
  }

  /**
   * Creates a node and resolves its address. An address that cannot be resolved leaves the node down; it does
   * not fail construction.
   *
   * @param hostSpec           the member's address
   * @param props              driver properties
   * @param connectionProvider creates the node's raw connection on every connection attempt
   * @param hostResolver       resolves the member's host name
   * @param codec              encodes commands and decodes replies
   */
  public Node(
      final @NonNull HostSpec hostSpec,
      final @NonNull Properties props,
      final @NonNull ConnectionProvider connectionProvider,
      final @NonNull HostResolver hostResolver,
      final @NonNull MessageCodec codec) {
    this.hostSpec = hostSpec;
    this.props = props;
    this.connectionProvider = connectionProvider;
    this.hostResolver = hostResolver;
    this.availabilityStrategy = new HostAvailabilityStrategyFactory().create(props);
    this.commandExecutor = new CommandExecutor(this, codec);

    try {
      resolveAddress();
    } catch (final ConnectionFailureException e) {
      markDown(e);
    }
  }

  /**
   * Runs the block once the node's connection is established. Commands issued through this node inside the
   * block reuse the connection.
   *
   * @param block the work to run
   * @param <T>   the block's result type
   * @param <E>   the exception type the block may throw
   * @return the block's result
   * @throws ConnectionFailureException if the connection could not be established, before or during the block;
   *                                    the node is marked down
   * @throws SocketErrorException       if the connection failed while the block was sending a request or
   *                                    reading its reply; the node is marked down
   * @throws E                          any other exception the block throws, health is left untouched
   */
  public <T, E extends Exception> T ensureConnected(final @NonNull NodeCallable<T, E> block)
      throws ConnectionFailureException, SocketErrorException, E {
    this.lock.lock();
    try {
      connectedConnection();
      try {
        return block.call();
      } catch (final Exception e) {
        if (e instanceof ConnectionFailureException || e instanceof SocketErrorException) {
          closeConnection();
          markDown((DocumentDbException) e);
        }
        throw e;
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Sends a request and returns its reply. A connection found stale before the request is written is reopened
   * and the request is sent again, once.
   *
   * @param request the complete request message
   * @return the complete reply message
   * @throws ConnectionFailureException if the connection could not be (re)established; nothing was sent
   * @throws SocketErrorException       if the connection failed after the request may have been sent
   */
  public byte[] execute(final byte[] request) throws ConnectionFailureException, SocketErrorException {
    this.lock.lock();
    try {
      for (int attempt = 0; ; attempt++) {
        final RawConnection current = connectedConnection();
        try {
          final byte[] reply = current.execute(request);
          markUp();
          return reply;
        } catch (final StaleConnectionException e) {
          closeConnection();
          if (attempt >= MAX_RECONNECT_ATTEMPTS) {
            final ConnectionFailureException failure = new ConnectionFailureException(
                Messages.get("Node.reconnectAttemptsExhausted", new Object[] {this.hostSpec, attempt + 1}), e);
            markDown(failure);
            throw failure;
          }
          LOGGER.fine(() -> Messages.get("Node.reconnectingStaleConnection",
              new Object[] {this.hostSpec, e.getMessage()}));
        } catch (final SocketErrorException e) {
          closeConnection();
          markDown(e);
          throw e;
        }
      }
    } finally {
      this.lock.unlock();
    }
  }

  /**
   * Runs a command through {@link #ensureConnected(NodeCallable)}.
   *
   * @param database the database the command is addressed at
   * @param command  the command document
   * @return the reply document
   * @throws DocumentDbException see {@link CommandExecutor#command(String, Map)}
   */
  public Map<String, Object> command(final @NonNull String database, final @NonNull Map<String, Object> command)
      throws DocumentDbException {
    return this.commandExecutor.command(database, command);
  }

  /**
   * Connects if needed and probes the server with {@code isMaster}, recording its role, peers and latency.
   * Transport failures are not raised: they are recorded in the node's health, and a failure of a node that is
   * already down moves {@link #getDownAt()} forward.
   *
   * @return true if the node is up after the probe
   */
  public boolean refresh() {
    this.lock.lock();
    try {
      final long startNano = System.nanoTime();
      final Map<String, Object> reply = this.commandExecutor.command(ADMIN_DATABASE, IS_MASTER_COMMAND);
      this.latency = Duration.ofNanos(System.nanoTime() - startNano);
      this.role = HostRole.fromIsMasterReply(reply);
      this.peers = parsePeers(reply);
      LOGGER.finest(() -> Messages.get("Node.refreshed",
          new Object[] {this.hostSpec, this.role, this.latency, this.peers}));
    } catch (final CommandFailureException e) {
      this.role = HostRole.UNKNOWN;
      this.peers = Collections.emptyList();
      LOGGER.fine(() -> Messages.get("Node.probeRejected", new Object[] {this.hostSpec, e.getMessage()}));
    } catch (final DocumentDbException e) {
      this.role = HostRole.UNKNOWN;
      LOGGER.fine(() -> Messages.get("Node.refreshFailed", new Object[] {this.hostSpec, e.getMessage()}));
    } finally {
      this.lock.unlock();
    }
    return isUp();
  }

  /**
   * Closes the connection. Health is left as it is: closing a connection says nothing about the server.
   */
  public void disconnect() {
    this.lock.lock();
    try {
      closeConnection();
    } finally {
      this.lock.unlock();
    }
  }

  public boolean isConnected() {
    final RawConnection current = this.connection;
    return current != null && current.isConnected();
  }

  public boolean isUp() {
    return this.health.availability == HostAvailability.AVAILABLE;
  }

  public boolean isDown() {
    return this.health.availability == HostAvailability.NOT_AVAILABLE;
  }

  public HostAvailability getAvailability() {
    return this.health.availability;
  }

  /**
   * Returns when the node was last observed down.
   *
   * @return the time of the last failed connection attempt, null unless the node is down
   */
  public @Nullable Instant getDownAt() {
    return this.health.downAt;
  }

  /**
   * Tells a replica set monitor whether this node should be refreshed now, according to the configured
   * {@link HostAvailabilityStrategy}.
   *
   * @return true if a refresh is due
   */
  public boolean isRefreshDue() {
    final Health current = this.health;
    return this.availabilityStrategy.isRefreshDue(current.availability, current.downAt, Instant.now());
  }

  public @NonNull HostSpec getHostSpec() {
    return this.hostSpec;
  }

  public @NonNull String getHost() {
    return this.hostSpec.getHost();
  }

  public int getPort() {
    return this.hostSpec.getPort();
  }

  public @Nullable InetSocketAddress getResolvedAddress() {
    return this.resolvedAddress;
  }

  public HostRole getRole() {
    return this.role;
  }

  public boolean isPrimary() {
    return this.role == HostRole.PRIMARY;
  }

  public boolean isSecondary() {
    return this.role == HostRole.SECONDARY;
  }

  public boolean isArbiter() {
    return this.role == HostRole.ARBITER;
  }

  public @Nullable Duration getLatency() {
    return this.latency;
  }

  public List<HostSpec> getPeers() {
    return this.peers;
  }

  private RawConnection connectedConnection() throws ConnectionFailureException {
    final RawConnection current = this.connection;
    if (current != null && current.isConnected()) {
      return current;
    }
    return connect();
  }

  private RawConnection connect() throws ConnectionFailureException {
    closeConnection();
    final RawConnection newConnection;
    try {
      final InetSocketAddress address = resolveAddress();
      newConnection = this.connectionProvider.createConnection(address, this.props);
      try {
        newConnection.connect();
      } catch (final ConnectionFailureException e) {
        newConnection.disconnect();
        throw e;
      }
      this.connection = newConnection;
    } catch (final ConnectionFailureException e) {
      markDown(e);
      throw e;
    }
    markUp();
    return newConnection;
  }

  private InetSocketAddress resolveAddress() throws ConnectionFailureException {
    try {
      final InetAddress address = this.hostResolver.resolve(this.hostSpec.getHost());
      final InetSocketAddress resolved = new InetSocketAddress(address, this.hostSpec.getPort());
      this.resolvedAddress = resolved;
      return resolved;
    } catch (final UnknownHostException e) {
      this.resolvedAddress = null;
      throw new ConnectionFailureException(
          Messages.get("Node.unresolvableAddress", new Object[] {this.hostSpec, e.getMessage()}), e);
    }
  }

  private void closeConnection() {
    final RawConnection current = this.connection;
    this.connection = null;
    if (current != null) {
      current.disconnect();
    }
  }

  private void markUp() {
    if (this.health.availability != HostAvailability.AVAILABLE) {
      LOGGER.fine(() -> Messages.get("Node.markedUp", new Object[] {this.hostSpec}));
    }
    this.health = Health.UP;
    this.availabilityStrategy.setHostAvailability(HostAvailability.AVAILABLE);
  }

  private void markDown(final DocumentDbException cause) {
    if (this.health.cause == cause) {
      // already recorded where it was raised
      return;
    }
    this.health = new Health(HostAvailability.NOT_AVAILABLE, Instant.now(), cause);
    this.availabilityStrategy.setHostAvailability(HostAvailability.NOT_AVAILABLE);
    LOGGER.fine(() -> Messages.get("Node.markedDown", new Object[] {this.hostSpec, cause.getMessage()}));
  }

  private List<HostSpec> parsePeers(final Map<String, Object> reply) {
    final Map<HostSpec, Boolean> found = new LinkedHashMap<>();
    for (final String field : new String[] {"hosts", "passives"}) {
      final Object addresses = reply.get(field);
      if (!(addresses instanceof List)) {
        continue;
      }
      for (final Object address : (List<?>) addresses) {
        try {
          found.put(new ConnectionUrlParser().parseHostPortPair(String.valueOf(address)), Boolean.TRUE);
        } catch (final IllegalArgumentException e) {
          LOGGER.fine(() -> Messages.get("Node.invalidPeerAddress", new Object[] {this.hostSpec, address}));
        }
      }
    }
    return Collections.unmodifiableList(new ArrayList<>(found.keySet()));
  }

  @Override
  public int hashCode() {
    return this.hostSpec.hashCode();
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    return this.hostSpec.equals(((Node) obj).hostSpec);
  }

  @Override
  public String toString() {
    final Health current = this.health;
    return String.format("%s [host=%s, availability=%s, downAt=%s, role=%s]",
        super.toString(), this.hostSpec, current.availability, current.downAt, this.role);
  }

  /**
   * Availability, down time and the failure that caused it, always replaced together.
   */
  private static final class Health {
    static final Health UNKNOWN = new Health(HostAvailability.UNKNOWN, null, null);
    static final Health UP = new Health(HostAvailability.AVAILABLE, null, null);

    final HostAvailability availability;
    final @Nullable Instant downAt;
    final @Nullable DocumentDbException cause;

    Health(
        final HostAvailability availability,
        final @Nullable Instant downAt,
        final @Nullable DocumentDbException cause) {
      this.availability = availability;
      this.downAt = downAt;
      this.cause = cause;
    }
  }
}
