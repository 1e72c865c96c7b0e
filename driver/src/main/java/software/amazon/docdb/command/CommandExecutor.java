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
import java.util.logging.Logger;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.Node;
import software.amazon.docdb.exceptions.CommandFailureException;
import software.amazon.docdb.exceptions.DocumentDbException;
import software.amazon.docdb.util.Messages;

/**
 * Runs database commands on a node and checks the status the server reports for them.
 */
public class CommandExecutor {

  private static final Logger LOGGER = Logger.getLogger(CommandExecutor.class.getName());

  private final @NonNull Node node;
  private final @NonNull MessageCodec codec;

  public CommandExecutor(final @NonNull Node node, final @NonNull MessageCodec codec) {
    this.node = node;
    this.codec = codec;
  }

  /**
   * Runs a command against a database on this executor's node.
   *
   * @param database the database the command is addressed at, e.g. {@code admin}
   * @param command  the command document, its first key naming the command
   * @return the reply document
   * @throws software.amazon.docdb.exceptions.ConnectionFailureException if no connection could be established;
   *                                                                       the command was not sent
   * @throws software.amazon.docdb.exceptions.SocketErrorException       if the connection failed after the
   *                                                                       command may have been sent
   * @throws CommandFailureException                                     if the server reports that the command
   *                                                                       failed
   */
  public Map<String, Object> command(final @NonNull String database, final @NonNull Map<String, Object> command)
      throws DocumentDbException {
    if (command.isEmpty()) {
      throw new IllegalArgumentException(Messages.get("CommandExecutor.emptyCommand"));
    }
    final byte[] request = this.codec.encodeCommand(database, command);

    return this.node.ensureConnected(() -> {
      final Map<String, Object> reply = this.codec.decodeReply(request, this.node.execute(request));
      if (!isOk(reply)) {
        LOGGER.finest(() -> Messages.get("CommandExecutor.commandFailed",
            new Object[] {command.keySet().iterator().next(), this.node.getHostSpec(), reply}));
        throw new CommandFailureException(command, reply);
      }
      return reply;
    });
  }

  static boolean isOk(final Map<String, Object> reply) {
    final @Nullable Object ok = reply.get("ok");
    if (ok instanceof Number) {
      return ((Number) ok).doubleValue() == 1.0d;
    }
    return Boolean.TRUE.equals(ok);
  }
}
