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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Dispatches named events to listeners in priority order. Each request owns one emitter.
 *
 * <p>Listeners with a higher priority are invoked earlier. Listeners with equal priority are invoked
 * in the order they were registered. Pass {@link #FIRST} or {@link #LAST} as a priority to place a
 * listener ahead of, or behind, every listener currently registered for the event.
 */
@NotThreadSafe
public final class Emitter {
  /** Priority one greater than the highest priority currently registered for an event. */
  public static final int FIRST = Integer.MAX_VALUE;

  /** Priority one less than the lowest priority currently registered for an event. */
  public static final int LAST = Integer.MIN_VALUE;

  /** Registrations by event name, each list sorted by descending priority. */
  private final Map<String, List<Registration>> registrations = new LinkedHashMap<>();

  /** Binds {@code listener} to {@code eventName} at priority 0. */
  public void on(String eventName, Listener listener) {
    on(eventName, listener, 0);
  }

  /** Binds {@code listener} to {@code eventName} at {@code priority}. */
  public void on(String eventName, Listener listener, int priority) {
    register(eventName, listener, priority, false);
  }

  /**
   * Binds {@code listener} to {@code eventName} at priority 0, and removes it as soon as it is
   * invoked.
   */
  public void once(String eventName, Listener listener) {
    once(eventName, listener, 0);
  }

  /**
   * Binds {@code listener} to {@code eventName} at {@code priority}, and removes it as soon as it is
   * invoked. The listener is removed before it runs, so it is gone even if it throws.
   */
  public void once(String eventName, Listener listener, int priority) {
    register(eventName, listener, priority, true);
  }

  /** Removes {@code listener} from {@code eventName}. Does nothing if it isn't registered. */
  public void removeListener(String eventName, Listener listener) {
    List<Registration> list = registrations.get(eventName);
    if (list == null) return;

    for (Iterator<Registration> i = list.iterator(); i.hasNext(); ) {
      Registration registration = i.next();
      if (registration.listener == listener) {
        registration.removed = true;
        i.remove();
      }
    }
    if (list.isEmpty()) registrations.remove(eventName);
  }

  /** Returns the listeners of {@code eventName} in the order they'd be invoked. */
  public List<Listener> listeners(String eventName) {
    List<Registration> list = registrations.get(eventName);
    if (list == null) return Collections.emptyList();

    List<Listener> result = new ArrayList<>(list.size());
    for (Registration registration : list) {
      result.add(registration.listener);
    }
    return Collections.unmodifiableList(result);
  }

  /** Returns the listeners of every event, by event name. */
  public Map<String, List<Listener>> listeners() {
    Map<String, List<Listener>> result = new LinkedHashMap<>();
    for (String eventName : registrations.keySet()) {
      result.put(eventName, listeners(eventName));
    }
    return Collections.unmodifiableMap(result);
  }

  public boolean hasListeners(String eventName) {
    return registrations.containsKey(eventName);
  }

  /**
   * Invokes the listeners of {@code eventName} with {@code event} until one of them stops its
   * propagation. Returns {@code event}.
   */
  public <E extends Event> E emit(String eventName, E event) throws IOException {
    List<Registration> list = registrations.get(eventName);
    if (list == null) return event;

    // Listeners may add or remove listeners while this event is dispatched.
    for (Registration registration : new ArrayList<>(list)) {
      if (registration.removed) continue;
      if (registration.once) unregister(eventName, registration);

      registration.listener.onEvent(event, eventName, this);
      if (event.isPropagationStopped()) break;
    }

    return event;
  }

  /** Binds each listener of {@code subscriber}. */
  public void attach(Subscriber subscriber) {
    for (Subscription subscription : subscriber.subscriptions()) {
      on(subscription.eventName, subscription.listener, subscription.priority);
    }
  }

  /** Removes each listener of {@code subscriber}. */
  public void detach(Subscriber subscriber) {
    for (Subscription subscription : subscriber.subscriptions()) {
      removeListener(subscription.eventName, subscription.listener);
    }
  }

  private void register(String eventName, Listener listener, int priority, boolean once) {
    if (eventName == null) throw new NullPointerException("eventName == null");
    if (listener == null) throw new NullPointerException("listener == null");

    List<Registration> list = registrations.get(eventName);
    if (list == null) {
      list = new ArrayList<>();
      registrations.put(eventName, list);
    }

    if (priority == FIRST) {
      priority = list.isEmpty() ? 1 : list.get(0).priority + 1;
    } else if (priority == LAST) {
      priority = list.isEmpty() ? -1 : list.get(list.size() - 1).priority - 1;
    }

    // Insert after every listener of equal or greater priority.
    int index = list.size();
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).priority < priority) {
        index = i;
        break;
      }
    }
    list.add(index, new Registration(listener, priority, once));
  }

  private void unregister(String eventName, Registration registration) {
    List<Registration> list = registrations.get(eventName);
    registration.removed = true;
    if (list != null && list.remove(registration) && list.isEmpty()) {
      registrations.remove(eventName);
    }
  }

  @Override public String toString() {
    return "Emitter" + listeners();
  }

  static final class Registration {
    final Listener listener;
    final int priority;
    final boolean once;
    boolean removed;

    Registration(Listener listener, int priority, boolean once) {
      this.listener = listener;
      this.priority = priority;
      this.once = once;
    }
  }
}
