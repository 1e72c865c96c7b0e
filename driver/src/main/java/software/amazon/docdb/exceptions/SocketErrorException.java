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
 * An established connection failed while a request was being written or before its complete reply was read.
 * The server may or may not have applied the request.
 */
public class SocketErrorException extends DocumentDbException {

  public SocketErrorException(final String message) {
    super(message);
  }

  public SocketErrorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
