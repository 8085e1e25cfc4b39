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
import java.util.List;
import okmux.internal.nio.SelectorMultiplexHandle;

/**
 * Recycles multiplexing handles between batches. A batch checks out a handle when it starts and
 * releases it when it ends; at most {@code maxIdle} released handles are kept for reuse and the rest
 * are closed right away.
 *
 * <p>Pools are safe for use by concurrent threads. Share one pool between engines to share its idle
 * handles.
 */
public final class MultiplexPool {
  private final int maxIdle;
  private final MultiplexHandle.Factory factory;

  /** Released handles, most recently released first. */
  private final Deque<MultiplexHandle> idle = new ArrayDeque<>();

  /** Creates a pool that keeps up to 3 idle {@linkplain SelectorMultiplexHandle selectors}. */
  public MultiplexPool() {
    this(3, new MultiplexHandle.Factory() {
      @Override public MultiplexHandle create() throws IOException {
        return SelectorMultiplexHandle.open();
      }
    });
  }

  public MultiplexPool(int maxIdle, MultiplexHandle.Factory factory) {
    if (maxIdle < 0) throw new IllegalArgumentException("maxIdle < 0: " + maxIdle);
    if (factory == null) throw new NullPointerException("factory == null");
    this.maxIdle = maxIdle;
    this.factory = factory;
  }

  /** Returns an idle handle, or a new one if none is idle. */
  public MultiplexHandle checkout() throws IOException {
    synchronized (this) {
      MultiplexHandle handle = idle.pollFirst();
      if (handle != null) return handle;
    }
    return factory.create();
  }

  /** Returns {@code handle} to this pool, closing it if the pool already holds enough. */
  public void release(MultiplexHandle handle) {
    synchronized (this) {
      for (MultiplexHandle idleHandle : idle) {
        if (idleHandle == handle) throw new IllegalStateException("handle was already released");
      }
      if (idle.size() < maxIdle) {
        idle.addFirst(handle);
        return;
      }
    }
    handle.close();
  }

  public synchronized int idleCount() {
    return idle.size();
  }

  /** Closes and removes all idle handles. */
  public void evictAll() {
    List<MultiplexHandle> evicted;
    synchronized (this) {
      evicted = new ArrayList<>(idle);
      idle.clear();
    }
    for (MultiplexHandle handle : evicted) {
      handle.close();
    }
  }
}
