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

import java.io.IOException;

/**
 * Receives events emitted by an {@link Emitter}.
 *
 * <p>A listener may throw to report a failure. A listener that wants to suppress the default
 * handling of an event, or to stop listeners of lower priority from seeing it, calls {@link
 * Event#stopPropagation()}.
 */
public interface Listener {
  /**
   * Handles {@code event} emitted under {@code name} by {@code emitter}.
   */
  void onEvent(Event event, String name, Emitter emitter) throws IOException;
}
