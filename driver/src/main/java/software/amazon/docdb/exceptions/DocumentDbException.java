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
 * Base type of every error raised by the driver's node layer. Callers that need to know whether a request may
 * have reached the server catch the subclasses separately.
 */
public class DocumentDbException extends Exception {

  public DocumentDbException(final String message) {
    super(message);
  }

  public DocumentDbException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
