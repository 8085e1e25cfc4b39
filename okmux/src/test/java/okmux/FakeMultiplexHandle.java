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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A multiplexing handle that finishes one running handle per call to {@link #perform}, oldest
 * first, with the result its {@link Responder} picks.
 */
final class FakeMultiplexHandle implements MultiplexHandle {
  interface Responder {
    /** Returns the result of {@code handle}'s attempt, setting a response if it has one. */
    TransferResult respond(FakeTransportHandle handle) throws IOException;
  }

  private final Responder responder;
  final List<FakeTransportHandle> running = new ArrayList<>();
  private final Deque<Completion> completions = new ArrayDeque<>();

  /** "add url" and "finish url" entries, in the order they happened. */
  final List<String> log = new ArrayList<>();
  int maxRunning;
  int selectCount;
  boolean closed;
  @Nullable IOException performFailure;

  FakeMultiplexHandle(Responder responder) {
    this.responder = responder;
  }

  void enqueueCompletion(Completion completion) {
    completions.add(completion);
  }

  @Override public void add(TransportHandle handle) {
    if (closed) throw new IllegalStateException("closed");
    FakeTransportHandle fake = (FakeTransportHandle) handle;
    running.add(fake);
    log.add("add " + fake.transaction.request().url());
    maxRunning = Math.max(maxRunning, running.size());
  }

  @Override public void remove(TransportHandle handle) {
    running.remove(handle);
    for (Iterator<Completion> i = completions.iterator(); i.hasNext(); ) {
      if (i.next().handle() == handle) i.remove();
    }
  }

  @Override public boolean perform() throws IOException {
    if (performFailure != null) throw performFailure;
    if (running.isEmpty()) return false;

    FakeTransportHandle handle = running.remove(0);
    log.add("finish " + handle.transaction.request().url());
    TransferResult result = responder.respond(handle);
    completions.add(new Completion(handle, result,
        result.isFailure() ? "fake failure" : null, null));
    return false;
  }

  @Override public int runningCount() {
    return running.size();
  }

  @Override public @Nullable Completion readCompletion() {
    return completions.pollFirst();
  }

  @Override public int select(long timeoutMillis) {
    selectCount++;
    return running.isEmpty() ? -1 : 1;
  }

  @Override public void close() {
    closed = true;
  }
}
