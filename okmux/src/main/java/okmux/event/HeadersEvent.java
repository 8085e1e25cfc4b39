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

/**
 * Emitted when the response headers have been received, before the body is complete. Listeners may
 * throw to abort the transfer, for example to refuse a body that is too large.
 */
public final class HeadersEvent extends TransferEvent {
  public HeadersEvent(Transaction transaction) {
    super(transaction);
    if (transaction.response() == null) {
      throw new IllegalArgumentException("transaction has no response");
    }
  }

  /** Returns the response whose headers arrived. Its body may still be incomplete. */
  public Response response() {
    return transaction().response();
  }
}
