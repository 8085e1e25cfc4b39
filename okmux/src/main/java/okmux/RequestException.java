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

import java.io.IOException;
import javax.annotation.Nullable;

/**
 * A failure of a transfer that lifecycle listeners may recover from. Failures of any other kind are
 * wrapped in a request exception before they are shown to error listeners.
 */
public class RequestException extends IOException {
  private final Request request;
  private final @Nullable Response response;
  private volatile boolean throwImmediately;

  public RequestException(String message, Request request) {
    this(message, request, null, null);
  }

  public RequestException(String message, Request request, @Nullable Response response,
      @Nullable Throwable cause) {
    super(message, cause);
    if (request == null) throw new NullPointerException("request == null");
    this.request = request;
    this.response = response;
  }

  /** Returns the request that failed. */
  public Request request() {
    return request;
  }

  /** Returns the response received before the failure, or null if there was none. */
  public @Nullable Response response() {
    return response;
  }

  /**
   * Returns true if this failure must abort the batch it occurred in, even a batch that otherwise
   * reports failures and carries on with its other transfers.
   */
  public boolean throwImmediately() {
    return throwImmediately;
  }

  public void setThrowImmediately(boolean throwImmediately) {
    this.throwImmediately = throwImmediately;
  }
}
