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

/** A listener bound to an event name at a priority, as declared by a {@link Subscriber}. */
public final class Subscription {
  final String eventName;
  final Listener listener;
  final int priority;

  public Subscription(String eventName, Listener listener, int priority) {
    if (eventName == null) throw new NullPointerException("eventName == null");
    if (listener == null) throw new NullPointerException("listener == null");
    this.eventName = eventName;
    this.listener = listener;
    this.priority = priority;
  }

  public Subscription(String eventName, Listener listener) {
    this(eventName, listener, 0);
  }

  public String eventName() {
    return eventName;
  }

  public Listener listener() {
    return listener;
  }

  public int priority() {
    return priority;
  }

  @Override public String toString() {
    return eventName + "@" + priority + ": " + listener;
  }
}
