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
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Bookkeeping of one batch: the transactions in flight on its multiplexing handle, keyed both ways
 * by their transport handles, and the lazily consumed transactions that are waiting to be admitted.
 */
@NotThreadSafe
final class BatchContext {
  private final MultiplexHandle multiplexHandle;
  private final Iterator<Transaction> pending;
  private final int parallelism;
  private final boolean throwsExceptions;

  private final Map<TransportHandle, Transaction> handleToTransaction = new IdentityHashMap<>();
  private final Map<Transaction, TransportHandle> transactionToHandle = new IdentityHashMap<>();
  private final Set<Transaction> retried =
      Collections.newSetFromMap(new IdentityHashMap<Transaction, Boolean>());

  BatchContext(MultiplexHandle multiplexHandle, Iterator<Transaction> pending, int parallelism,
      boolean throwsExceptions) {
    this.multiplexHandle = multiplexHandle;
    this.pending = pending;
    this.parallelism = parallelism;
    this.throwsExceptions = throwsExceptions;
  }

  MultiplexHandle multiplexHandle() {
    return multiplexHandle;
  }

  /** Returns the most transactions this batch keeps in flight at once. */
  int parallelism() {
    return parallelism;
  }

  /**
   * Returns true if every failure that reaches the engine must abort this batch. Otherwise only
   * failures marked to throw immediately do.
   */
  boolean throwsExceptions() {
    return throwsExceptions;
  }

  /** Puts {@code transaction} in flight on {@code handle}. */
  void addTransaction(Transaction transaction, TransportHandle handle) throws IOException {
    if (transactionToHandle.containsKey(transaction)) {
      throw new IllegalStateException("already in-flight: " + transaction);
    }
    multiplexHandle.add(handle);
    handleToTransaction.put(handle, transaction);
    transactionToHandle.put(transaction, handle);
  }

  /**
   * Takes {@code transaction} out of flight and returns the statistics of its attempt. The caller
   * owns the detached transport handle: it must close it or recycle it for a retry.
   */
  TransferStats removeTransaction(Transaction transaction) {
    TransportHandle handle = transactionToHandle.remove(transaction);
    if (handle == null) throw new IllegalStateException("wasn't in-flight: " + transaction);
    handleToTransaction.remove(handle);
    multiplexHandle.remove(handle);
    return handle.stats();
  }

  /** Returns the transaction in flight on {@code handle}. */
  Transaction findTransaction(TransportHandle handle) {
    Transaction transaction = handleToTransaction.get(handle);
    if (transaction == null) {
      throw new IllegalStateException("no transaction is in flight on " + handle);
    }
    return transaction;
  }

  /** Returns the next transaction to admit, or null if every transaction was admitted. */
  @Nullable Transaction nextPending() {
    return pending.hasNext() ? pending.next() : null;
  }

  /** Returns true while transactions are in flight or waiting to be admitted. */
  boolean isActive() {
    return !handleToTransaction.isEmpty() || pending.hasNext();
  }

  int activeCount() {
    return handleToTransaction.size();
  }

  /** Takes every transaction out of flight and closes their transport handles. */
  void removeAll() {
    for (TransportHandle handle : new ArrayList<>(handleToTransaction.keySet())) {
      removeTransaction(handleToTransaction.get(handle));
      handle.close();
    }
  }

  /** Records that {@code transaction} is being retried. */
  void markRetried(Transaction transaction) {
    retried.add(transaction);
  }

  /** Returns true if {@code transaction} was already retried in this batch. */
  boolean hasRetried(Transaction transaction) {
    return retried.contains(transaction);
  }
}
