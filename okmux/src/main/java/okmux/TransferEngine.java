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
import java.io.InterruptedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import okmux.event.RequestEvents;
import okmux.internal.nio.NioHandleFactory;
import okmux.internal.platform.Platform;

import static okmux.internal.Util.checkDuration;
import static okmux.internal.platform.Platform.INFO;

/**
 * Transfers transactions over pooled {@linkplain MultiplexHandle multiplexing handles}. Each call
 * to {@link #send} or {@link #sendAll} is one batch: it checks out a multiplexing handle, drives
 * its transfers on the calling thread until every one of them finished, and returns the handle to
 * the pool.
 *
 * <p>Every transfer passes through the lifecycle events of its request. Listeners of the {@code
 * before} event may intercept a transfer by supplying its response; such transfers never reach
 * the transport. Failures are shown to the {@code error} listeners once, and then either thrown
 * to the caller or, in parallel batches, left to the listeners.
 *
 * <p>If the connection closes before any response arrives and the request has a rewindable body,
 * the transfer is restarted once without emitting any event.
 *
 * <p>Engines are safe for use by concurrent threads; each batch runs on the thread that started
 * it.
 */
public final class TransferEngine implements Transport, ParallelTransport {
  /** Environment variable holding the default select timeout, in decimal seconds. */
  static final String SELECT_TIMEOUT_ENV = "OKMUX_SELECT_TIMEOUT";

  /** How long to sleep when a select had nothing to wait on. */
  private static final long EMPTY_SELECT_BACKOFF_MICROS = 250;

  private final HandleFactory handleFactory;
  private final MessageFactory messageFactory;
  private final MultiplexPool multiplexPool;
  private final long selectTimeoutMillis;

  public TransferEngine() {
    this(new Builder());
  }

  TransferEngine(Builder builder) {
    this.handleFactory = builder.handleFactory != null
        ? builder.handleFactory
        : new NioHandleFactory();
    this.messageFactory = builder.messageFactory;
    this.multiplexPool = builder.multiplexPool != null
        ? builder.multiplexPool
        : new MultiplexPool();
    this.selectTimeoutMillis = builder.selectTimeoutMillis != -1L
        ? builder.selectTimeoutMillis
        : selectTimeoutFromEnvironment(builder.environment);
  }

  public HandleFactory handleFactory() {
    return handleFactory;
  }

  public MessageFactory messageFactory() {
    return messageFactory;
  }

  public MultiplexPool multiplexPool() {
    return multiplexPool;
  }

  /** Returns the longest time a batch blocks waiting for I/O, in milliseconds. */
  public long selectTimeoutMillis() {
    return selectTimeoutMillis;
  }

  public Builder newBuilder() {
    return new Builder(this);
  }

  /**
   * Transfers {@code transaction} and returns its response. Any failure that an error listener
   * didn't recover from is thrown.
   *
   * @throws RequestException if the transfer failed, or if it ended without a response because an
   *     error listener stopped the failure without supplying one.
   */
  @Override public Response send(Transaction transaction) throws IOException {
    execute(Collections.singletonList(transaction).iterator(), 1, true);

    Response response = transaction.response();
    if (response == null) {
      throw new RequestException("No response was received", transaction.request());
    }
    return response;
  }

  @Override public void sendAll(Iterator<Transaction> transactions, int parallelism)
      throws IOException {
    if (transactions == null) throw new NullPointerException("transactions == null");
    if (parallelism < 1) throw new IllegalArgumentException("parallelism < 1: " + parallelism);
    execute(transactions, parallelism, false);
  }

  private void execute(Iterator<Transaction> transactions, int parallelism,
      boolean throwsExceptions) throws IOException {
    MultiplexHandle multiplexHandle = multiplexPool.checkout();
    BatchContext context =
        new BatchContext(multiplexHandle, transactions, parallelism, throwsExceptions);

    // Only a batch that ended normally or by a reported failure leaves its handle reusable.
    boolean reusable = false;
    try {
      perform(context);
      reusable = true;
    } catch (RequestException e) {
      reusable = true;
      throw e;
    } finally {
      context.removeAll();
      if (reusable) {
        multiplexPool.release(multiplexHandle);
      } else {
        multiplexHandle.close();
      }
    }
  }

  /** Drives the batch until every transaction was admitted and finished. */
  private void perform(BatchContext context) throws IOException {
    MultiplexHandle multiplexHandle = context.multiplexHandle();

    while (true) {
      admitPending(context);
      if (!context.isActive()) return;

      while (multiplexHandle.perform()) {
        // More work is possible right away.
      }

      processCompletions(context);

      if (context.activeCount() > 0 && multiplexHandle.select(selectTimeoutMillis) == -1) {
        backOff();
      }
    }
  }

  /** Admits pending transactions until the window is full or none remain. */
  private void admitPending(BatchContext context) throws IOException {
    while (context.activeCount() < context.parallelism()) {
      Transaction next = context.nextPending();
      if (next == null) return;
      addHandle(next, context);
    }
  }

  /** Emits {@code before} and starts the transfer unless a listener intercepted it. */
  private void addHandle(Transaction transaction, BatchContext context) throws IOException {
    try {
      RequestEvents.emitBefore(transaction);
      if (transaction.response() != null) return; // Intercepted.
      startTransfer(transaction, context, null);
    } catch (RequestException e) {
      escalate(e, context);
    }
  }

  private void startTransfer(Transaction transaction, BatchContext context,
      @Nullable TransportHandle existing) throws RequestException {
    TransportHandle handle;
    try {
      handle = handleFactory.create(transaction, messageFactory, existing);
    } catch (IOException | RuntimeException e) {
      report(transaction, e, TransferStats.NONE);
      return;
    }

    try {
      context.addTransaction(transaction, handle);
    } catch (IOException e) {
      handle.close();
      report(transaction, e, handle.stats());
    } catch (RuntimeException e) {
      handle.close();
      throw e;
    }
  }

  private void processCompletions(BatchContext context) throws IOException {
    MultiplexHandle multiplexHandle = context.multiplexHandle();
    for (Completion completion; (completion = multiplexHandle.readCompletion()) != null; ) {
      Transaction transaction = context.findTransaction(completion.handle());
      TransferStats stats = context.removeTransaction(transaction);
      transaction.setTransferStats(stats);
      processResponse(transaction, completion, stats, context);
      admitPending(context);
    }
  }

  private void processResponse(Transaction transaction, Completion completion,
      TransferStats stats, BatchContext context) throws IOException {
    Outcome outcome = Outcome.classify(transaction, completion, context.hasRetried(transaction));

    if (outcome.kind() == Outcome.Kind.RETRYABLE_GAP) {
      retry(transaction, completion.handle(), context);
      return;
    }

    completion.handle().close();
    try {
      if (outcome.kind() == Outcome.Kind.SUCCESS) {
        complete(transaction, stats);
      } else {
        report(transaction, outcome.failure(), stats);
      }
    } catch (RequestException e) {
      escalate(e, context);
    }
  }

  private void complete(Transaction transaction, TransferStats stats) throws RequestException {
    try {
      RequestEvents.emitComplete(transaction, stats);
    } catch (RequestException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      report(transaction, e, stats);
    }
  }

  /** Restarts the transfer of {@code transaction} from its rewound body. */
  private void retry(Transaction transaction, TransportHandle previous, BatchContext context)
      throws IOException {
    Request request = transaction.request();
    Platform.get().log(INFO, "Connection closed before a response to " + request.method() + " "
        + request.url() + "; retrying with the rewound request body", null);

    context.markRetried(transaction);
    try {
      startTransfer(transaction, context, previous);
    } catch (RequestException e) {
      escalate(e, context);
    }
  }

  /** Shows {@code failure} to the error listeners unless they saw it already. */
  private void report(Transaction transaction, Exception failure, TransferStats stats)
      throws RequestException {
    if (failure instanceof RequestException && transaction.hasReported(failure)) {
      throw (RequestException) failure;
    }
    RequestEvents.emitError(transaction, failure, stats);
  }

  /**
   * Throws {@code e} if it must abort the batch. Otherwise the error listeners already handled it
   * and the batch carries on.
   */
  private void escalate(RequestException e, BatchContext context) throws RequestException {
    if (context.throwsExceptions() || e.throwImmediately()) throw e;
  }

  private void backOff() throws InterruptedIOException {
    try {
      TimeUnit.MICROSECONDS.sleep(EMPTY_SELECT_BACKOFF_MICROS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted");
    }
  }

  static long selectTimeoutFromEnvironment(Map<String, String> environment) {
    String value = environment.get(SELECT_TIMEOUT_ENV);
    if (value == null) return TimeUnit.SECONDS.toMillis(1);

    double seconds;
    try {
      seconds = Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(SELECT_TIMEOUT_ENV + " is not a number: " + value, e);
    }
    if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
      throw new IllegalArgumentException(SELECT_TIMEOUT_ENV + " < 0 or not finite: " + value);
    }
    return Math.round(seconds * 1000d);
  }

  public static final class Builder {
    @Nullable HandleFactory handleFactory;
    MessageFactory messageFactory;
    @Nullable MultiplexPool multiplexPool;
    long selectTimeoutMillis;
    Map<String, String> environment;

    public Builder() {
      messageFactory = MessageFactory.DEFAULT;
      selectTimeoutMillis = -1L;
      environment = System.getenv();
    }

    Builder(TransferEngine engine) {
      this.handleFactory = engine.handleFactory;
      this.messageFactory = engine.messageFactory;
      this.multiplexPool = engine.multiplexPool;
      this.selectTimeoutMillis = engine.selectTimeoutMillis;
      this.environment = System.getenv();
    }

    /** Sets the factory of transport handles. Defaults to the built-in HTTP/1.1 transport. */
    public Builder handleFactory(HandleFactory handleFactory) {
      if (handleFactory == null) throw new NullPointerException("handleFactory == null");
      this.handleFactory = handleFactory;
      return this;
    }

    public Builder messageFactory(MessageFactory messageFactory) {
      if (messageFactory == null) throw new NullPointerException("messageFactory == null");
      this.messageFactory = messageFactory;
      return this;
    }

    /**
     * Sets the pool that batches check multiplexing handles out of. Engines that share a pool share
     * its idle handles.
     */
    public Builder multiplexPool(MultiplexPool multiplexPool) {
      if (multiplexPool == null) throw new NullPointerException("multiplexPool == null");
      this.multiplexPool = multiplexPool;
      return this;
    }

    /**
     * Sets the longest time a batch blocks waiting for I/O before checking on its transfers again.
     * Defaults to the number of seconds in the {@code OKMUX_SELECT_TIMEOUT} environment variable,
     * or 1 second if it isn't set. Zero polls without blocking.
     */
    public Builder selectTimeout(long timeout, TimeUnit unit) {
      this.selectTimeoutMillis = checkDuration("timeout", timeout, unit);
      return this;
    }

    Builder environment(Map<String, String> environment) {
      this.environment = environment;
      return this;
    }

    public TransferEngine build() {
      return new TransferEngine(this);
    }
  }
}
