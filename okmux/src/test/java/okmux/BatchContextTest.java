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

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public final class BatchContextTest {
  private final FakeMultiplexHandle multiplexHandle =
      new FakeMultiplexHandle(handle -> TransferResult.OK);
  private final Transaction a = new Transaction(new Request.Builder().url("http://a/").build());
  private final Transaction b = new Transaction(new Request.Builder().url("http://b/").build());

  @Test public void addAndFindTransaction() throws Exception {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    FakeTransportHandle handle = new FakeTransportHandle(a, null);

    context.addTransaction(a, handle);

    assertThat(context.findTransaction(handle)).isSameAs(a);
    assertThat(context.activeCount()).isEqualTo(1);
    assertThat(context.isActive()).isTrue();
    assertThat(multiplexHandle.running).containsExactly(handle);
    assertThat(multiplexHandle.runningCount()).isEqualTo(1);
  }

  @Test public void addingInFlightTransactionFails() throws Exception {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    context.addTransaction(a, new FakeTransportHandle(a, null));

    try {
      context.addTransaction(a, new FakeTransportHandle(a, null));
      fail();
    } catch (IllegalStateException expected) {
    }
    assertThat(context.activeCount()).isEqualTo(1);
  }

  @Test public void removeTransactionReturnsStats() throws Exception {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    FakeTransportHandle handle = new FakeTransportHandle(a, null);
    context.addTransaction(a, handle);

    TransferStats stats = context.removeTransaction(a);

    assertThat(stats.url()).isEqualTo("http://a/");
    assertThat(stats.bytesSent()).isEqualTo(42L);
    assertThat(context.activeCount()).isEqualTo(0);
    assertThat(context.isActive()).isFalse();
    assertThat(multiplexHandle.runningCount()).isEqualTo(0);
    assertThat(handle.closed).isFalse();
  }

  @Test public void removeUnknownTransactionFails() {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    try {
      context.removeTransaction(a);
      fail();
    } catch (IllegalStateException expected) {
      assertThat(expected.getMessage()).startsWith("wasn't in-flight");
    }
  }

  @Test public void findUnknownHandleFails() {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    try {
      context.findTransaction(new FakeTransportHandle(a, null));
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  @Test public void pendingTransactionsInSequenceOrder() {
    BatchContext context = newContext(Arrays.asList(a, b).iterator());

    assertThat(context.isActive()).isTrue();
    assertThat(context.nextPending()).isSameAs(a);
    assertThat(context.nextPending()).isSameAs(b);
    assertThat(context.nextPending()).isNull();
    assertThat(context.isActive()).isFalse();
  }

  @Test public void removeAllClosesHandles() throws Exception {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    FakeTransportHandle handleA = new FakeTransportHandle(a, null);
    FakeTransportHandle handleB = new FakeTransportHandle(b, null);
    context.addTransaction(a, handleA);
    context.addTransaction(b, handleB);

    context.removeAll();

    assertThat(context.activeCount()).isEqualTo(0);
    assertThat(handleA.closed).isTrue();
    assertThat(handleB.closed).isTrue();
    assertThat(multiplexHandle.running).isEmpty();
  }

  @Test public void retriesAreTracked() {
    BatchContext context = newContext(Collections.<Transaction>emptyIterator());
    assertThat(context.hasRetried(a)).isFalse();
    context.markRetried(a);
    assertThat(context.hasRetried(a)).isTrue();
    assertThat(context.hasRetried(b)).isFalse();
  }

  @Test public void throwsExceptionsMode() {
    Iterator<Transaction> none = Collections.emptyIterator();
    assertThat(new BatchContext(multiplexHandle, none, 1, true).throwsExceptions()).isTrue();
    assertThat(new BatchContext(multiplexHandle, none, 5, false).throwsExceptions()).isFalse();
  }

  private BatchContext newContext(Iterator<Transaction> pending) {
    return new BatchContext(multiplexHandle, pending, 2, false);
  }
}
