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

import okmux.Response;
import okmux.Transaction;
import okmux.TransferStats;

/** Emitted once a response has been received in full. */
public final class CompleteEvent extends TransferEvent {
  private final TransferStats transferStats;

  public CompleteEvent(Transaction transaction, TransferStats transferStats) {
    super(transaction);
    if (transaction.response() == null) {
      throw new IllegalArgumentException("transaction has no response");
    }
    this.transferStats = transferStats;
  }

  public Response response() {
    return transaction().response();
  }

  public TransferStats transferStats() {
    return transferStats;
  }
}
