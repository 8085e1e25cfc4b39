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
package okmux.event;

import javax.annotation.Nullable;
import okmux.RequestException;
import okmux.Response;
import okmux.Transaction;
import okmux.TransferStats;

/**
 * Emitted when a transfer fails. Unless a listener stops propagation, the failure is thrown once all
 * listeners have run. A listener that recovers from the failure calls {@link #intercept} with a
 * substitute response.
 */
public final class ErrorEvent extends TransferEvent {
  private final RequestException exception;
  private final TransferStats transferStats;

  public ErrorEvent(Transaction transaction, RequestException exception,
      TransferStats transferStats) {
    super(transaction);
    if (exception == null) throw new NullPointerException("exception == null");
    this.exception = exception;
    this.transferStats = transferStats;
  }

  public RequestException exception() {
    return exception;
  }

  /** Returns the response received before the failure, or null if there was none. */
  public @Nullable Response response() {
    return transaction().response();
  }

  public TransferStats transferStats() {
    return transferStats;
  }

  /** Recovers from the failure with {@code response}. The failure will not be thrown. */
  public void intercept(Response response) {
    if (response == null) throw new NullPointerException("response == null");
    transaction().setResponse(response);
    stopPropagation();
  }

  /**
   * Requests that the failure abort the whole batch when it is thrown, even if the batch would
   * otherwise report it and carry on with the other transfers.
   */
  public void throwImmediately(boolean throwImmediately) {
    exception.setThrowImmediately(throwImmediately);
  }
}
