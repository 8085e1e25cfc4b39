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
 * Emitted before a request is handed to the transport. A listener that already has a response, such
 * as a cache or a mock, calls {@link #intercept} and the request is never sent.
 */
public final class BeforeEvent extends TransferEvent {
  public BeforeEvent(Transaction transaction) {
    super(transaction);
  }

  /** Completes the transaction with {@code response} and skips the transport. */
  public void intercept(Response response) {
    if (response == null) throw new NullPointerException("response == null");
    transaction().setResponse(response);
    stopPropagation();
  }
}
