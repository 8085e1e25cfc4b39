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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * One request and, once it is known, its response. The transfer engine works on transactions: it
 * emits their lifecycle events, hands them to the transport, and records the statistics of each
 * attempt.
 *
 * <p>A transaction also remembers which failures it has already reported through the error event.
 * That record keeps a failure that resurfaces from a later listener from being reported twice.
 */
public final class Transaction {
  private final Request request;
  private @Nullable Response response;
  private TransferStats transferStats = TransferStats.NONE;
  private final Set<Throwable> reportedFailures =
      Collections.newSetFromMap(new IdentityHashMap<Throwable, Boolean>());

  public Transaction(Request request) {
    if (request == null) throw new NullPointerException("request == null");
    this.request = request;
  }

  public Request request() {
    return request;
  }

  /** Returns the response, or null if none has been received or supplied yet. */
  public @Nullable Response response() {
    return response;
  }

  public void setResponse(@Nullable Response response) {
    this.response = response;
  }

  /** Returns the statistics of the most recent attempt to transfer this transaction. */
  public TransferStats transferStats() {
    return transferStats;
  }

  public void setTransferStats(TransferStats transferStats) {
    if (transferStats == null) throw new NullPointerException("transferStats == null");
    this.transferStats = transferStats;
  }

  /** Returns true if {@code failure} was already reported through the error event. */
  public boolean hasReported(Throwable failure) {
    return reportedFailures.contains(failure);
  }

  /** Records that {@code failure} is being reported through the error event. */
  public void markReported(Throwable failure) {
    reportedFailures.add(failure);
  }

  @Override public String toString() {
    return "Transaction{request=" + request + ", response=" + response + '}';
  }
}
