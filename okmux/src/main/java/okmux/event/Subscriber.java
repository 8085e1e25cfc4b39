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

import java.util.List;

/**
 * Bundles listeners for several events so they can be attached to and detached from an {@link
 * Emitter} at once.
 *
 * <p>{@link Emitter#detach} removes listeners by identity, so implementations must return the same
 * listener instances each time {@link #subscriptions} is called.
 */
public interface Subscriber {
  /** Returns the listeners of this subscriber, each with the event it handles and its priority. */
  List<Subscription> subscriptions();
}
