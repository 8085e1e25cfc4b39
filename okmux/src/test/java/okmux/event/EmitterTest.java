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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public final class EmitterTest {
  private final Emitter emitter = new Emitter();
  private final List<String> calls = new ArrayList<>();

  @Test public void higherPriorityRunsFirst() throws Exception {
    emitter.on("foo", recorder("low"), -10);
    emitter.on("foo", recorder("high"), 10);
    emitter.on("foo", recorder("default"));

    emitter.emit("foo", new TestEvent());

    assertThat(calls).containsExactly("high", "default", "low");
  }

  @Test public void equalPrioritiesRunInRegistrationOrder() throws Exception {
    emitter.on("foo", recorder("a"), 5);
    emitter.on("foo", recorder("b"), 5);
    emitter.on("foo", recorder("c"), 5);

    emitter.emit("foo", new TestEvent());

    assertThat(calls).containsExactly("a", "b", "c");
  }

  @Test public void firstAndLastSentinels() throws Exception {
    emitter.on("foo", recorder("middle"), 3);
    emitter.on("foo", recorder("first"), Emitter.FIRST);
    emitter.on("foo", recorder("last"), Emitter.LAST);
    emitter.on("foo", recorder("very first"), Emitter.FIRST);

    emitter.emit("foo", new TestEvent());

    assertThat(calls).containsExactly("very first", "first", "middle", "last");
  }

  @Test public void sentinelsOnEmptyEvent() throws Exception {
    Listener first = recorder("first");
    Listener last = recorder("last");
    emitter.on("foo", first, Emitter.FIRST);
    emitter.on("bar", last, Emitter.LAST);
    emitter.on("bar", recorder("zero"));

    emitter.emit("bar", new TestEvent());

    assertThat(calls).containsExactly("zero", "last");
  }

  @Test public void onceListenerIsInvokedOnce() throws Exception {
    Listener once = recorder("once");
    emitter.once("foo", once);

    emitter.emit("foo", new TestEvent());
    emitter.emit("foo", new TestEvent());

    assertThat(calls).containsExactly("once");
    assertThat(emitter.listeners("foo")).isEmpty();
    assertThat(emitter.hasListeners("foo")).isFalse();
  }

  @Test public void onceListenerIsRemovedBeforeItRuns() throws Exception {
    List<List<Listener>> seen = new ArrayList<>();
    emitter.once("foo", (event, name, emitter) -> seen.add(emitter.listeners("foo")));
    emitter.on("foo", recorder("other"));

    emitter.emit("foo", new TestEvent());

    assertThat(seen.get(0)).hasSize(1);
  }

  @Test public void onceListenerIsRemovedEvenIfItThrows() throws Exception {
    emitter.once("foo", (event, name, emitter) -> {
      throw new IOException("boom");
    });

    try {
      emitter.emit("foo", new TestEvent());
      fail();
    } catch (IOException expected) {
    }
    assertThat(emitter.listeners("foo")).isEmpty();
  }

  @Test public void stoppingPropagationSkipsRemainingListeners() throws Exception {
    emitter.on("foo", recorder("a"), 10);
    emitter.on("foo", (event, name, emitter) -> {
      calls.add("stopper");
      event.stopPropagation();
    }, 5);
    emitter.on("foo", recorder("c"), 0);

    TestEvent event = emitter.emit("foo", new TestEvent());

    assertThat(event.isPropagationStopped()).isTrue();
    assertThat(calls).containsExactly("a", "stopper");
  }

  @Test public void emitReturnsEvent() throws Exception {
    TestEvent event = new TestEvent();
    assertThat(emitter.emit("nobody", event)).isSameAs(event);
    assertThat(event.isPropagationStopped()).isFalse();
  }

  @Test public void listenerReceivesNameAndEmitter() throws Exception {
    List<Object> received = new ArrayList<>();
    emitter.on("foo", (event, name, emitter) -> {
      received.add(name);
      received.add(emitter);
    });

    emitter.emit("foo", new TestEvent());

    assertThat(received).containsExactly("foo", emitter);
  }

  @Test public void removeListener() throws Exception {
    Listener a = recorder("a");
    Listener b = recorder("b");
    emitter.on("foo", a);
    emitter.on("foo", b);

    emitter.removeListener("foo", a);
    emitter.removeListener("foo", recorder("never registered"));
    emitter.removeListener("bar", b);

    emitter.emit("foo", new TestEvent());
    assertThat(calls).containsExactly("b");
    assertThat(emitter.listeners("foo")).containsExactly(b);
  }

  @Test public void listenerRemovedDuringEmitIsSkipped() throws Exception {
    Listener victim = recorder("victim");
    emitter.on("foo", (event, name, emitter) -> emitter.removeListener("foo", victim), 10);
    emitter.on("foo", victim);

    emitter.emit("foo", new TestEvent());

    assertThat(calls).isEmpty();
  }

  @Test public void allListenersByEventName() {
    Listener a = recorder("a");
    Listener b = recorder("b");
    Listener c = recorder("c");
    emitter.on("foo", a);
    emitter.on("bar", b);
    emitter.on("foo", c, 1);

    Map<String, List<Listener>> listeners = emitter.listeners();

    assertThat(listeners.keySet()).containsExactly("foo", "bar");
    assertThat(listeners.get("foo")).containsExactly(c, a);
    assertThat(listeners.get("bar")).containsExactly(b);
  }

  @Test public void attachAndDetachSubscriber() throws Exception {
    Listener before = recorder("before");
    Listener error = recorder("error");
    Subscriber subscriber = () -> Arrays.asList(
        new Subscription("before", before, RequestEvents.LATE),
        new Subscription("error", error));
    emitter.on("before", recorder("other"));

    emitter.attach(subscriber);
    emitter.emit("before", new TestEvent());
    emitter.emit("error", new TestEvent());
    assertThat(calls).containsExactly("other", "before", "error");

    emitter.detach(subscriber);
    assertThat(emitter.listeners("before")).hasSize(1);
    assertThat(emitter.hasListeners("error")).isFalse();
  }

  static final class TestEvent extends Event {
  }

  private Listener recorder(String label) {
    return (event, name, emitter) -> calls.add(label);
  }
}
