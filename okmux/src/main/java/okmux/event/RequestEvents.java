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

import java.io.IOException;
import okmux.Request;
import okmux.RequestException;
import okmux.Response;
import okmux.Transaction;
import okmux.TransferStats;

/**
 * Emits the lifecycle events of a transaction: {@link #BEFORE}, then optionally {@link #HEADERS},
 * then exactly one of {@link #COMPLETE} or {@link #ERROR} per attempt.
 *
 * <p>Failures raised while emitting are funneled into the error event so that listeners get one
 * chance to recover from each failure, whichever stage raised it. A failure is shown to error
 * listeners at most once: the transaction records each failure it reports, and a reported failure
 * that resurfaces from a {@code before} or {@code complete} listener is rethrown as-is.
 */
public final class RequestEvents {
  public static final String BEFORE = "before";
  public static final String HEADERS = "headers";
  public static final String COMPLETE = "complete";
  public static final String ERROR = "error";

  // Generic event priorities.
  public static final int EARLY = 10000;
  public static final int LATE = -10000;

  // Priorities of "before" listeners.
  public static final int PREPARE_REQUEST = -100;
  public static final int SIGN_REQUEST = -10000;

  // Priorities of "complete" and "error" listeners.
  public static final int VERIFY_RESPONSE = 100;
  public static final int REDIRECT_RESPONSE = 200;

  private RequestEvents() {
  }

  /**
   * Emits the before event for {@code transaction}. Failures thrown by listeners are emitted as
   * error events.
   *
   * @throws RequestException if a failure was not recovered by an error listener.
   */
  public static void emitBefore(Transaction transaction) throws RequestException {
    Request request = transaction.request();
    try {
      request.emitter().emit(BEFORE, new BeforeEvent(transaction));
    } catch (RequestException e) {
      if (transaction.hasReported(e)) throw e;
      emitError(transaction, e, TransferStats.NONE);
    } catch (IOException | RuntimeException e) {
      emitError(transaction, e, TransferStats.NONE);
    }
  }

  /** Emits the headers event for {@code transaction}, whose response must be set. */
  public static void emitHeaders(Transaction transaction) throws IOException {
    transaction.request().emitter().emit(HEADERS, new HeadersEvent(transaction));
  }

  /**
   * Records the effective URL on the response of {@code transaction} and emits the complete
   * event. Request exceptions thrown by listeners are emitted as error events.
   *
   * @throws RequestException if a failure was not recovered by an error listener.
   * @throws IOException if a listener failed with another exception.
   */
  public static void emitComplete(Transaction transaction, TransferStats transferStats)
      throws IOException {
    Request request = transaction.request();
    Response response = transaction.response();
    if (response == null) throw new IllegalStateException("transaction has no response");

    response.setEffectiveUrl(request.url());
    try {
      request.emitter().emit(COMPLETE, new CompleteEvent(transaction, transferStats));
    } catch (RequestException e) {
      if (transaction.hasReported(e)) throw e;
      emitError(transaction, e, transferStats);
    }
  }

  /**
   * Emits the error event for {@code failure}. Failures that aren't request exceptions are wrapped
   * in one first.
   *
   * @throws RequestException unless an error listener stopped the event's propagation.
   */
  public static void emitError(Transaction transaction, Exception failure,
      TransferStats transferStats) throws RequestException {
    Request request = transaction.request();

    RequestException exception;
    if (failure instanceof RequestException) {
      exception = (RequestException) failure;
    } else {
      String message = failure.getMessage() != null ? failure.getMessage() : failure.toString();
      exception = new RequestException(message, request, transaction.response(), failure);
    }

    transaction.markReported(exception);

    ErrorEvent event = new ErrorEvent(transaction, exception, transferStats);
    try {
      request.emitter().emit(ERROR, event);
    } catch (IOException | RuntimeException e) {
      // A listener failed while handling the failure. Report the original one.
      exception.addSuppressed(e);
      throw exception;
    }

    if (!event.isPropagationStopped()) {
      throw exception;
    }
  }
}
