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
package okmux.internal.nio;

import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import okmux.HandleFactory;
import okmux.MessageFactory;
import okmux.Transaction;
import okmux.TransportHandle;

import static okmux.internal.Util.checkDuration;

/**
 * Creates HTTP/1.1 exchanges for a {@link SelectorMultiplexHandle}. Each exchange uses its own
 * connection, so handles of earlier attempts are closed rather than recycled.
 */
public final class NioHandleFactory implements HandleFactory {
  private final long timeoutMillis;

  /** Creates exchanges that never time out. */
  public NioHandleFactory() {
    timeoutMillis = 0L;
  }

  /**
   * Creates exchanges that fail with {@code OPERATION_TIMEDOUT} if they run longer than {@code
   * timeout}, connecting included. Zero means no timeout.
   */
  public NioHandleFactory(long timeout, TimeUnit unit) {
    timeoutMillis = checkDuration("timeout", timeout, unit);
  }

  public long timeoutMillis() {
    return timeoutMillis;
  }

  @Override public TransportHandle create(Transaction transaction, MessageFactory messageFactory,
      @Nullable TransportHandle existing) {
    if (existing != null) existing.close();
    return new HttpExchange(transaction, messageFactory, timeoutMillis);
  }
}
