/**
 * Copyright 2015-2017 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package ratekeeper;

/**
 * Thrown by collaborators and stores when the failed call may succeed if attempted again, for
 * example after a connection loss. Units of work failing with this are retried a bounded number of
 * times.
 */
public class TransientIOException extends RuntimeException {
  static final long serialVersionUID = 1L;

  public TransientIOException(String message, Throwable cause) {
    super(message, cause);
  }

  public TransientIOException(String message) {
    super(message);
  }
}
