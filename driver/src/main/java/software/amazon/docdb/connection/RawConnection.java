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

import software.amazon.docdb.exceptions.ConnectionFailureException;
import software.amazon.docdb.exceptions.SocketErrorException;
import software.amazon.docdb.exceptions.StaleConnectionException;

/**
 * A single socket to one server, carrying one request/reply exchange at a time. Implementations know nothing
 * about retries or node health.
 */
public interface RawConnection {

  /**
   * Opens the socket. Does nothing if the connection already believes it is open.
   *
   * @throws ConnectionFailureException if the server cannot be reached
   */
  void connect() throws ConnectionFailureException;

  /**
   * Closes the socket if it is open. Safe to call any number of times.
   */
  void disconnect();

  /**
   * Returns whether the socket is believed to be open. The answer is advisory: the peer may already have closed
   * its side without this connection having noticed.
   *
   * @return true between a successful {@link #connect()} and the next {@link #disconnect()} or transport failure
   */
  boolean isConnected();

  /**
   * Writes a complete request message and blocks until its complete reply has been read.
   *
   * @param request the framed request message
   * @return the framed reply message, including its length prefix
   * @throws StaleConnectionException if the socket was found unusable before anything was written
   * @throws SocketErrorException     if writing failed or the reply could not be read in full
   */
  byte[] execute(byte[] request) throws StaleConnectionException, SocketErrorException;
}
