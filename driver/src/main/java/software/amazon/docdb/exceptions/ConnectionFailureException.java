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
 * A connection to a node could not be established, or could not be re-established after it was found stale.
 * No bytes of the current request were sent, so retrying at a higher level is always safe.
 */
public class ConnectionFailureException extends DocumentDbException {

  public ConnectionFailureException(final String message) {
    super(message);
  }

  public ConnectionFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
