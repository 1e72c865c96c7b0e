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

package software.amazon.docdb.exceptions;

import java.util.Collections;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import software.amazon.docdb.util.Messages;

/**
 * The server received the command and answered with a well-formed reply that reports a failure.
 */
public class CommandFailureException extends DocumentDbException {

  private final transient Map<String, Object> reply;
  private final @Nullable Integer code;

  public CommandFailureException(final @NonNull Map<String, Object> command, final @NonNull Map<String, Object> reply) {
    super(Messages.get("CommandFailureException.commandFailed",
        new Object[] {command, errorMessageOf(reply), codeOf(reply)}));
    this.reply = Collections.unmodifiableMap(reply);
    this.code = codeOf(reply);
  }

  public Map<String, Object> getReply() {
    return this.reply;
  }

  public @Nullable Integer getCode() {
    return this.code;
  }

  public @Nullable String getErrorMessage() {
    return errorMessageOf(this.reply);
  }

  private static @Nullable String errorMessageOf(final Map<String, Object> reply) {
    final Object errmsg = reply.get("errmsg");
    return errmsg == null ? null : errmsg.toString();
  }

  private static @Nullable Integer codeOf(final Map<String, Object> reply) {
    final Object code = reply.get("code");
    return code instanceof Number ? ((Number) code).intValue() : null;
  }
}
