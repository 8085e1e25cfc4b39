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

/**
 * What the engine does with a finished attempt. Only the reporting kinds carry a failure; a
 * retryable gap is handled silently by restarting the exchange.
 */
final class Outcome {
  enum Kind {
    /** A response was received. Emit complete. */
    SUCCESS,
    /** The connection closed before any response, and the request body can be replayed. */
    RETRYABLE_GAP,
    /** The transport reported a failure. */
    TRANSPORT_FAILURE,
    /** No response was received and the exchange can't be retried. */
    APPLICATION_FAILURE
  }

  private static final Outcome SUCCESS = new Outcome(Kind.SUCCESS, null);
  private static final Outcome RETRYABLE_GAP = new Outcome(Kind.RETRYABLE_GAP, null);

  private final Kind kind;
  private final @Nullable RequestException failure;

  private Outcome(Kind kind, @Nullable RequestException failure) {
    this.kind = kind;
    this.failure = failure;
  }

  Kind kind() {
    return kind;
  }

  /** Returns the failure to report, or null for the kinds that don't report one. */
  @Nullable RequestException failure() {
    return failure;
  }

  /**
   * Classifies the attempt of {@code transaction} that {@code completion} finished.
   *
   * @param retried true if the transaction was already retried once. A second connection loss is
   *     reported instead of retried again.
   */
  static Outcome classify(Transaction transaction, Completion completion, boolean retried) {
    Request request = transaction.request();

    if (completion.result().isFailure()) {
      String message = completion.message() != null
          ? completion.message()
          : completion.result().description();
      return new Outcome(Kind.TRANSPORT_FAILURE, new TransportException(completion.result(),
          message, request, transaction.response(), completion.cause()));
    }

    if (transaction.response() != null) return SUCCESS;

    RequestBody body = request.body();
    if (body == null) {
      return new Outcome(Kind.APPLICATION_FAILURE, new RequestException(
          "No response was received for a request with no body. This could mean that you are "
              + "saturating your network.", request));
    }

    if (retried) {
      return new Outcome(Kind.APPLICATION_FAILURE, new RequestException(
          "The connection was unexpectedly closed again after the request was retried.",
          request));
    }

    if (!body.isRewindable() || !body.rewind()) {
      return new Outcome(Kind.APPLICATION_FAILURE, new RequestException(
          "The connection was unexpectedly closed. The request would have been retried, but "
              + "rewinding the request body failed. Use a rewindable request body, such as one "
              + "created from a byte array, to allow retries.", request));
    }

    return RETRYABLE_GAP;
  }

  @Override public String toString() {
    return failure != null ? kind + ": " + failure.getMessage() : kind.toString();
  }
}
