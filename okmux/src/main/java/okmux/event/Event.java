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

/** Base class for events passed to a {@link Listener}. */
public abstract class Event {
  private boolean propagationStopped;

  /** Returns true if a listener stopped the propagation of this event. */
  public final boolean isPropagationStopped() {
    return propagationStopped;
  }

  /**
   * Prevents listeners of lower priority from receiving this event. Emitters of lifecycle events
   * also treat this as a signal that the event was handled.
   */
  public final void stopPropagation() {
    propagationStopped = true;
  }
}
