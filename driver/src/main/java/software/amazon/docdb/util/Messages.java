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

package software.amazon.docdb.util;

import java.text.MessageFormat;
import java.util.ResourceBundle;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

public class Messages {

  private static final ResourceBundle MESSAGES = ResourceBundle.getBundle("aws_docdb_messages");
  public static final Object[] emptyArgs = {};

  private Messages() {
  }

  /**
   * Retrieve the localized message associated with the provided key.
   *
   * @param key The key mapped to a message in the driver's resource bundle.
   * @return The associated localized message.
   */
  public static @NonNull String get(final @NonNull String key) {
    return get(key, emptyArgs);
  }

  /**
   * Retrieve the localized message associated with the provided key, formatted with the given arguments.
   *
   * @param key  The key mapped to a message in the driver's resource bundle.
   * @param args Values substituted into the message placeholders.
   * @return The formatted message.
   */
  public static @NonNull String get(final @NonNull String key, final @Nullable Object @NonNull [] args) {
    return MessageFormat.format(MESSAGES.getString(key), args);
  }
}
