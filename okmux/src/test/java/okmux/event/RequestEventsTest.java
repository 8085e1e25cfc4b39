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
import java.util.List;
import okmux.Request;
import okmux.RequestException;
import okmux.Response;
import okmux.ResponseBody;
import okmux.Transaction;
import okmux.TransferStats;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public final class RequestEventsTest {
  private final Request request = new Request.Builder().url("http://example.com/a").build();
  private final Transaction transaction = new Transaction(request);
  private final List<ErrorEvent> errors = new ArrayList<>();

  @Before public void setUp() {
    request.emitter().on(RequestEvents.ERROR,
        (event, name, emitter) -> errors.add((ErrorEvent) event), Emitter.FIRST);
  }

  @Test public void emitBeforeInvokesListeners() throws Exception {
    List<Transaction> seen = new ArrayList<>();
    request.emitter().on(RequestEvents.BEFORE,
        (event, name, emitter) -> seen.add(((BeforeEvent) event).transaction()));

    RequestEvents.emitBefore(transaction);

    assertThat(seen).containsExactly(transaction);
    assertThat(errors).isEmpty();
  }

  @Test public void beforeFailureIsWrappedAndEmitted() throws Exception {
    IOException failure = new IOException("boom");
    request.emitter().on(RequestEvents.BEFORE, (event, name, emitter) -> {
      throw failure;
    });

    try {
      RequestEvents.emitBefore(transaction);
      fail();
    } catch (RequestException expected) {
      assertThat(expected.getCause()).isSameAs(failure);
      assertThat(expected.getMessage()).isEqualTo("boom");
      assertThat(expected.request()).isSameAs(request);
    }
    assertThat(errors).hasSize(1);
  }

  @Test public void failureWithoutMessageIsDescribed() throws Exception {
    request.emitter().on(RequestEvents.BEFORE, (event, name, emitter) -> {
      throw new IllegalStateException();
    });

    try {
      RequestEvents.emitBefore(transaction);
      fail();
    } catch (RequestException expected) {
      assertThat(expected.getMessage()).isEqualTo("java.lang.IllegalStateException");
    }
  }

  @Test public void reportedFailureReenteringBeforeIsNotEmittedTwice() throws Exception {
    RequestException failure = new RequestException("already handled", request);
    request.emitter().on(RequestEvents.BEFORE, (event, name, emitter) -> {
      throw failure;
    });

    try {
      RequestEvents.emitBefore(transaction);
      fail();
    } catch (RequestException expected) {
      assertThat(expected).isSameAs(failure);
    }
    try {
      RequestEvents.emitBefore(transaction);
      fail();
    } catch (RequestException expected) {
      assertThat(expected).isSameAs(failure);
    }

    assertThat(errors).hasSize(1);
    assertThat(transaction.hasReported(failure)).isTrue();
  }

  @Test public void reportedFailuresAreTrackedPerTransaction() throws Exception {
    RequestException failure = new RequestException("shared", request);
    Transaction other = new Transaction(request);
    request.emitter().on(RequestEvents.BEFORE, (event, name, emitter) -> {
      throw failure;
    });

    try {
      RequestEvents.emitBefore(transaction);
      fail();
    } catch (RequestException expected) {
    }
    try {
      RequestEvents.emitBefore(other);
      fail();
    } catch (RequestException expected) {
    }

    assertThat(errors).hasSize(2);
  }

  @Test public void emitCompleteSetsEffectiveUrl() throws Exception {
    Response response = response();
    transaction.setResponse(response);
    List<TransferStats> seen = new ArrayList<>();
    request.emitter().on(RequestEvents.COMPLETE,
        (event, name, emitter) -> seen.add(((CompleteEvent) event).transferStats()));
    TransferStats stats = new TransferStats.Builder().url(request.url()).build();

    RequestEvents.emitComplete(transaction, stats);

    assertThat(response.effectiveUrl()).isEqualTo("http://example.com/a");
    assertThat(seen).containsExactly(stats);
  }

  @Test public void completeRequiresResponse() throws Exception {
    try {
      RequestEvents.emitComplete(transaction, TransferStats.NONE);
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  @Test public void completeFailureIsEmittedWithSameStats() throws Exception {
    transaction.setResponse(response());
    TransferStats stats = new TransferStats.Builder().bytesReceived(7L).build();
    request.emitter().on(RequestEvents.COMPLETE, (event, name, emitter) -> {
      throw new RequestException("bad status", request);
    });

    try {
      RequestEvents.emitComplete(transaction, stats);
      fail();
    } catch (RequestException expected) {
      assertThat(expected.getMessage()).isEqualTo("bad status");
    }
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).transferStats()).isSameAs(stats);
  }

  @Test public void stoppingErrorPropagationSuppressesThrow() throws Exception {
    request.emitter().on(RequestEvents.ERROR, (event, name, emitter) -> event.stopPropagation());

    RequestEvents.emitError(transaction, new IOException("ignored"), TransferStats.NONE);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).exception().getMessage()).isEqualTo("ignored");
  }

  @Test public void errorInterceptSuppliesResponse() throws Exception {
    Response fallback = response();
    request.emitter().on(RequestEvents.ERROR,
        (event, name, emitter) -> ((ErrorEvent) event).intercept(fallback));

    RequestEvents.emitError(transaction, new IOException("down"), TransferStats.NONE);

    assertThat(transaction.response()).isSameAs(fallback);
  }

  @Test public void requestExceptionIsNotWrapped() throws Exception {
    RequestException failure = new RequestException("as is", request);
    try {
      RequestEvents.emitError(transaction, failure, TransferStats.NONE);
      fail();
    } catch (RequestException expected) {
      assertThat(expected).isSameAs(failure);
    }
    assertThat(errors.get(0).exception()).isSameAs(failure);
  }

  @Test public void failingErrorListenerIsSuppressed() throws Exception {
    RuntimeException listenerFailure = new RuntimeException("listener broke");
    request.emitter().on(RequestEvents.ERROR, (event, name, emitter) -> {
      throw listenerFailure;
    });
    RequestException failure = new RequestException("original", request);

    try {
      RequestEvents.emitError(transaction, failure, TransferStats.NONE);
      fail();
    } catch (RequestException expected) {
      assertThat(expected).isSameAs(failure);
      assertThat(expected.getSuppressed()).containsExactly(listenerFailure);
    }
  }

  @Test public void headersEventCarriesResponse() throws Exception {
    Response response = response();
    transaction.setResponse(response);
    List<Response> seen = new ArrayList<>();
    request.emitter().on(RequestEvents.HEADERS,
        (event, name, emitter) -> seen.add(((HeadersEvent) event).response()));

    RequestEvents.emitHeaders(transaction);

    assertThat(seen).containsExactly(response);
  }

  private Response response() {
    return new Response.Builder()
        .request(request)
        .code(200)
        .message("OK")
        .body(ResponseBody.create("text/plain", "hello"))
        .build();
  }
}
