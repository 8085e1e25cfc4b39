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

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public final class MultiplexPoolTest {
  private final List<FakeMultiplexHandle> created = new ArrayList<>();
  private final MultiplexPool pool = new MultiplexPool(3, () -> {
    FakeMultiplexHandle handle = new FakeMultiplexHandle(h -> TransferResult.OK);
    created.add(handle);
    return handle;
  });

  @Test public void checkoutCreatesHandleWhenNoneIdle() throws Exception {
    MultiplexHandle a = pool.checkout();
    MultiplexHandle b = pool.checkout();
    assertThat(a).isNotSameAs(b);
    assertThat(created).hasSize(2);
    assertThat(pool.idleCount()).isEqualTo(0);
  }

  @Test public void releasedHandleIsReused() throws Exception {
    MultiplexHandle a = pool.checkout();
    pool.release(a);
    assertThat(pool.idleCount()).isEqualTo(1);

    assertThat(pool.checkout()).isSameAs(a);
    assertThat(pool.idleCount()).isEqualTo(0);
    assertThat(created).hasSize(1);
  }

  @Test public void keepsAtMostThreeIdleHandles() throws Exception {
    MultiplexHandle a = pool.checkout();
    MultiplexHandle b = pool.checkout();
    MultiplexHandle c = pool.checkout();
    MultiplexHandle d = pool.checkout();

    pool.release(a);
    pool.release(b);
    pool.release(c);
    pool.release(d);

    assertThat(pool.idleCount()).isEqualTo(3);
    assertThat(created.get(0).closed).isFalse();
    assertThat(created.get(1).closed).isFalse();
    assertThat(created.get(2).closed).isFalse();
    assertThat(created.get(3).closed).isTrue();
  }

  @Test public void releasingTwiceFails() throws Exception {
    MultiplexHandle a = pool.checkout();
    pool.release(a);
    try {
      pool.release(a);
      fail();
    } catch (IllegalStateException expected) {
    }
    assertThat(pool.idleCount()).isEqualTo(1);
  }

  @Test public void zeroMaxIdleClosesOnRelease() throws Exception {
    List<FakeMultiplexHandle> handles = new ArrayList<>();
    MultiplexPool pool = new MultiplexPool(0, () -> {
      FakeMultiplexHandle handle = new FakeMultiplexHandle(h -> TransferResult.OK);
      handles.add(handle);
      return handle;
    });
    pool.release(pool.checkout());
    assertThat(pool.idleCount()).isEqualTo(0);
    assertThat(handles.get(0).closed).isTrue();
  }

  @Test public void evictAllClosesIdleHandles() throws Exception {
    MultiplexHandle a = pool.checkout();
    MultiplexHandle b = pool.checkout();
    pool.release(a);
    pool.release(b);

    pool.evictAll();

    assertThat(pool.idleCount()).isEqualTo(0);
    assertThat(created.get(0).closed).isTrue();
    assertThat(created.get(1).closed).isTrue();
  }

  @Test public void negativeMaxIdle() {
    try {
      new MultiplexPool(-1, () -> {
        throw new AssertionError();
      });
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected.getMessage()).isEqualTo("maxIdle < 0: -1");
    }
  }
}
