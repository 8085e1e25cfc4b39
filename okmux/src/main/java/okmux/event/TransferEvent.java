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

import okmux.Request;
import okmux.Transaction;

/** An event in the lifecycle of one {@link Transaction}. */
public abstract class TransferEvent extends Event {
  private final Transaction transaction;

  TransferEvent(Transaction transaction) {
    if (transaction == null) throw new NullPointerException("transaction == null");
    this.transaction = transaction;
  }

  public final Transaction transaction() {
    return transaction;
  }

  public final Request request() {
    return transaction.request();
  }
}
