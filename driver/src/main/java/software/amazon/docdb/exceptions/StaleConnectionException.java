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

/**
 * Raised by a raw connection when the socket is found unusable before anything was written. The node handles
 * it by reconnecting and retrying the same request; it only reaches callers as the cause of a
 * {@link ConnectionFailureException}.
 */
public class StaleConnectionException extends DocumentDbException {

  public StaleConnectionException(final String message) {
    super(message);
  }

  public StaleConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
