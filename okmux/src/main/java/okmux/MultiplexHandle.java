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
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * Drives many {@linkplain TransportHandle transport handles} at once with non-blocking I/O. Work
 * happens only when the caller invokes {@link #perform}; finished handles are then reported
 * through {@link #readCompletion}. {@link #select} blocks until one of the handles can make
 * progress.
 *
 * <p>Multiplexing handles are expensive to create and are pooled by a {@link MultiplexPool}. A
 * handle is used by one batch at a time and is not thread safe.
 */
public interface MultiplexHandle extends Closeable {
  /** Starts driving {@code handle}. */
  void add(TransportHandle handle) throws IOException;

  /**
   * Stops driving {@code handle} and discards its completion if it wasn't read yet. Does nothing if
   * the handle isn't driven by this.
   */
  void remove(TransportHandle handle);

  /**
   * Performs the I/O that is possible without blocking. Returns true if calling again right away
   * could make more progress.
   *
   * @throws IOException if this multiplexing handle itself failed. Failures of individual
   *     exchanges are reported as completions instead.
   */
  boolean perform() throws IOException;

  /** Returns the number of handles that are added and haven't finished yet. */
  int runningCount();

  /** Returns the next unread completion, or null if there is none. */
  @Nullable Completion readCompletion();

  /**
   * Blocks until at least one handle is ready for I/O, or {@code timeoutMillis} elapses. Returns the
   * number of ready handles, or -1 if there was nothing to wait on.
   */
  int select(long timeoutMillis) throws IOException;

  /** Closes this and every handle it still drives. */
  @Override void close();

  interface Factory {
    MultiplexHandle create() throws IOException;
  }
}
