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
package okmux.internal.nio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.annotation.Nullable;
import okmux.Completion;
import okmux.MultiplexHandle;
import okmux.TransportHandle;
import okmux.internal.platform.Platform;

import static okmux.internal.platform.Platform.WARN;

/** Drives {@link HttpExchange HTTP exchanges} with a {@link Selector}. */
public final class SelectorMultiplexHandle implements MultiplexHandle {
  private final Selector selector;
  private final Set<HttpExchange> running = new LinkedHashSet<>();
  private final Deque<Completion> completions = new ArrayDeque<>();

  /** Reused for every read; exchanges copy what they read out of it right away. */
  private final ByteBuffer readBuffer = ByteBuffer.allocate(8192);

  private boolean closed;

  private SelectorMultiplexHandle(Selector selector) {
    this.selector = selector;
  }

  public static SelectorMultiplexHandle open() throws IOException {
    return new SelectorMultiplexHandle(Selector.open());
  }

  @Override public void add(TransportHandle handle) throws IOException {
    if (closed) throw new IllegalStateException("closed");
    if (!(handle instanceof HttpExchange)) {
      throw new IllegalArgumentException("Unexpected transport handle: " + handle);
    }
    HttpExchange exchange = (HttpExchange) handle;
    running.add(exchange);
    exchange.start(selector);
    if (exchange.isDone()) finished(exchange);
  }

  @Override public void remove(TransportHandle handle) {
    if (!running.remove(handle)) {
      for (Iterator<Completion> i = completions.iterator(); i.hasNext(); ) {
        if (i.next().handle() == handle) i.remove();
      }
    }
  }

  @Override public boolean perform() throws IOException {
    if (closed) throw new IllegalStateException("closed");

    selector.selectNow();
    Set<SelectionKey> readyKeys = selector.selectedKeys();
    boolean progressed = !readyKeys.isEmpty();
    for (Iterator<SelectionKey> i = readyKeys.iterator(); i.hasNext(); ) {
      SelectionKey key = i.next();
      i.remove();
      HttpExchange exchange = (HttpExchange) key.attachment();
      exchange.onReady(key, readBuffer);
      if (exchange.isDone()) finished(exchange);
    }

    long now = System.nanoTime();
    for (HttpExchange exchange : new ArrayList<>(running)) {
      exchange.checkTimeout(now);
      if (exchange.isDone()) finished(exchange);
    }

    return progressed;
  }

  private void finished(HttpExchange exchange) {
    if (!running.remove(exchange)) return;
    completions.add(new Completion(exchange, exchange.result(), exchange.resultMessage(),
        exchange.cause()));
  }

  @Override public int runningCount() {
    return running.size();
  }

  @Override public @Nullable Completion readCompletion() {
    return completions.pollFirst();
  }

  @Override public int select(long timeoutMillis) throws IOException {
    if (closed) throw new IllegalStateException("closed");
    if (running.isEmpty()) return -1;
    return timeoutMillis > 0L ? selector.select(timeoutMillis) : selector.selectNow();
  }

  @Override public void close() {
    if (closed) return;
    closed = true;
    for (HttpExchange exchange : running) {
      exchange.close();
    }
    running.clear();
    completions.clear();
    try {
      selector.close();
    } catch (IOException e) {
      Platform.get().log(WARN, "Failed to close selector", e);
    }
  }

  @Override public String toString() {
    return "SelectorMultiplexHandle{running=" + running.size() + '}';
  }
}
