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

import java.io.Closeable;

/**
 * The transport's state for one attempt to transfer a transaction: its connection, its buffers,
 * and how far the exchange has progressed. A handle is driven by the {@link MultiplexHandle} it is
 * added to and is closed once its attempt is over.
 */
public interface TransportHandle extends Closeable {
  /** Returns the transaction this handle transfers. */
  Transaction transaction();

  /** Returns the statistics of this attempt so far. */
  TransferStats stats();

  /** Releases the resources of this handle, abandoning the exchange if it is still running. */
  @Override void close();
}
