/*
 * Copyright (C) 2026 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package okmux;

import javax.annotation.Nullable;

/** A transfer failed in the transport, before a complete response could be received. */
public final class TransportException extends RequestException {
  private final TransferResult result;

  public TransportException(TransferResult result, String message, Request request,
      @Nullable Response response, @Nullable Throwable cause) {
    super("[" + result + "] " + message + " [url] " + request.url(), request, response, cause);
    if (!result.isFailure()) throw new IllegalArgumentException("not a failure: " + result);
    this.result = result;
  }

  /** Returns the low-level result that the transport reported. */
  public TransferResult result() {
    return result;
  }
}
