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
import java.util.Iterator;

/** Transfers many transactions concurrently. */
public interface ParallelTransport {
  /**
   * Transfers every transaction of {@code transactions}, at most {@code parallelism} at a time. The
   * iterator is consumed lazily, as transfers finish, so it may be unbounded.
   *
   * <p>Failures are reported to the error listeners of each request and don't stop the other
   * transfers.
   *
   * @throws IOException if a failure was marked to {@linkplain RequestException#throwImmediately()
   *     throw immediately}. The transfers still in flight are abandoned.
   */
  void sendAll(Iterator<Transaction> transactions, int parallelism) throws IOException;
}
