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

/** A transport handle that does no I/O. {@link FakeMultiplexHandle} decides how it finishes. */
final class FakeTransportHandle implements TransportHandle {
  final Transaction transaction;
  final @Nullable TransportHandle existing;
  boolean closed;

  FakeTransportHandle(Transaction transaction, @Nullable TransportHandle existing) {
    this.transaction = transaction;
    this.existing = existing;
  }

  @Override public Transaction transaction() {
    return transaction;
  }

  @Override public TransferStats stats() {
    return new TransferStats.Builder()
        .url(transaction.request().url())
        .bytesSent(42L)
        .build();
  }

  @Override public void close() {
    closed = true;
  }

  @Override public String toString() {
    return "FakeTransportHandle{" + transaction.request().url() + '}';
  }
}
