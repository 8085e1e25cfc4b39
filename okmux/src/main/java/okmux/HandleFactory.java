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
import javax.annotation.Nullable;

/**
 * Creates the transport handle for each attempt to transfer a transaction. Replace the factory to
 * use another transport, or a fake one in tests.
 */
public interface HandleFactory {
  /**
   * Returns a new handle that transfers {@code transaction}, using {@code messageFactory} to build
   * its response.
   *
   * @param existing a handle of an earlier attempt that the factory may recycle, or null. Factories
   *     that don't recycle handles close it.
   */
  TransportHandle create(Transaction transaction, MessageFactory messageFactory,
      @Nullable TransportHandle existing) throws IOException;
}
