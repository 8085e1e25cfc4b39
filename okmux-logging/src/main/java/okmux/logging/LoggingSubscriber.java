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
package okmux.logging;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okio.Buffer;
import okio.BufferedSource;
import okmux.Headers;
import okmux.Request;
import okmux.RequestBody;
import okmux.Response;
import okmux.ResponseBody;
import okmux.event.CompleteEvent;
import okmux.event.Emitter;
import okmux.event.ErrorEvent;
import okmux.event.Event;
import okmux.event.Listener;
import okmux.event.RequestEvents;
import okmux.event.Subscriber;
import okmux.event.Subscription;
import okmux.event.TransferEvent;
import okmux.internal.Util;
import okmux.internal.platform.Platform;

import static okmux.internal.Util.UTF_8;

/**
 * Logs the requests and responses of the transfers it is attached to. Attach it to the {@linkplain
 * Request#emitter() emitter} of each request to log.
 *
 * <p>Requests are logged after every other {@code before} listener ran, so the log shows the
 * request as it is sent. Responses and failures are logged before other listeners can replace
 * them.
 *
 * <p>The format of the logs created by this class should not be considered stable and may change
 * slightly between releases. If you need a stable logging format, use your own subscriber.
 */
public final class LoggingSubscriber implements Subscriber {
  public enum Level {
    /** No logs. */
    NONE,
    /**
     * Logs request and response lines.
     *
     * <p>Example:
     * <pre>{@code
     * --> POST http://example.com/greeting (3-byte body)
     *
     * <-- 200 OK http://example.com/greeting (22ms, 6-byte body)
     * }</pre>
     */
    BASIC,
    /**
     * Logs request and response lines and their respective headers.
     *
     * <p>Example:
     * <pre>{@code
     * --> POST http://example.com/greeting
     * Content-Type: plain/text
     * --> END POST
     *
     * <-- 200 OK http://example.com/greeting (22ms)
     * Content-Type: plain/text
     * Content-Length: 6
     * <-- END HTTP
     * }</pre>
     */
    HEADERS,
    /**
     * Logs request and response lines and their respective headers and bodies (if present). A
     * request body is only logged if it can be rewound after it was read.
     *
     * <p>Example:
     * <pre>{@code
     * --> POST http://example.com/greeting
     * Content-Type: plain/text
     *
     * Hi?
     * --> END POST (3-byte body)
     *
     * <-- 200 OK http://example.com/greeting (22ms)
     * Content-Type: plain/text
     * Content-Length: 6
     *
     * Hello!
     * <-- END HTTP (6-byte body)
     * }</pre>
     */
    BODY
  }

  public interface Logger {
    void log(String message);

    /** A {@link Logger} defaults output appropriate for the current platform. */
    Logger DEFAULT = new Logger() {
      @Override public void log(String message) {
        Platform.get().log(Platform.INFO, message, null);
      }
    };
  }

  private final Logger logger;
  private volatile Level level = Level.NONE;

  private final Listener beforeListener = new Listener() {
    @Override public void onEvent(Event event, String name, Emitter emitter) throws IOException {
      logRequest(((TransferEvent) event).request());
    }
  };

  private final Listener completeListener = new Listener() {
    @Override public void onEvent(Event event, String name, Emitter emitter) throws IOException {
      CompleteEvent completeEvent = (CompleteEvent) event;
      logResponse(completeEvent.response(),
          completeEvent.transferStats().totalTime(TimeUnit.MILLISECONDS));
    }
  };

  private final Listener errorListener = new Listener() {
    @Override public void onEvent(Event event, String name, Emitter emitter) {
      if (level == Level.NONE) return;
      logger.log("<-- HTTP FAILED: " + ((ErrorEvent) event).exception());
    }
  };

  public LoggingSubscriber() {
    this(Logger.DEFAULT);
  }

  public LoggingSubscriber(Logger logger) {
    this.logger = logger;
  }

  /** Change the level at which this subscriber logs. */
  public LoggingSubscriber setLevel(Level level) {
    if (level == null) throw new NullPointerException("level == null. Use Level.NONE instead.");
    this.level = level;
    return this;
  }

  public Level getLevel() {
    return level;
  }

  @Override public List<Subscription> subscriptions() {
    return Util.immutableList(
        new Subscription(RequestEvents.BEFORE, beforeListener, RequestEvents.LATE),
        new Subscription(RequestEvents.COMPLETE, completeListener, RequestEvents.EARLY),
        new Subscription(RequestEvents.ERROR, errorListener, RequestEvents.EARLY));
  }

  private void logRequest(Request request) throws IOException {
    Level level = this.level;
    if (level == Level.NONE) return;

    boolean logBody = level == Level.BODY;
    boolean logHeaders = logBody || level == Level.HEADERS;

    RequestBody requestBody = request.body();
    boolean hasRequestBody = requestBody != null;

    String requestStartMessage = "--> " + request.method() + ' ' + request.url();
    if (!logHeaders && hasRequestBody) {
      requestStartMessage += " (" + requestBody.contentLength() + "-byte body)";
    }
    logger.log(requestStartMessage);

    if (!logHeaders) return;

    logHeaders(request.headers());

    String endMessage = "--> END " + request.method();
    if (logBody && hasRequestBody) {
      if (!requestBody.isRewindable()) {
        endMessage += " (one-shot body omitted)";
      } else {
        Buffer buffer = new Buffer();
        while (requestBody.read(buffer, 8192L) != -1L) {
          // Read the whole body.
        }
        if (!requestBody.rewind()) {
          throw new IOException("Failed to rewind the request body after logging it");
        }
        Charset charset = Util.charset(requestBody.contentType(), UTF_8);
        logger.log("");
        logger.log(buffer.clone().readString(charset));
        endMessage += " (" + buffer.size() + "-byte body)";
      }
    }
    logger.log(endMessage);
  }

  private void logResponse(Response response, long tookMs) throws IOException {
    Level level = this.level;
    if (level == Level.NONE) return;

    boolean logBody = level == Level.BODY;
    boolean logHeaders = logBody || level == Level.HEADERS;

    ResponseBody responseBody = response.body();
    long contentLength = responseBody.contentLength();
    String bodySize = contentLength != -1L ? contentLength + "-byte" : "unknown-length";
    String message = response.message().isEmpty() ? "" : " " + response.message();
    logger.log("<-- " + response.code() + message + ' ' + response.effectiveUrl()
        + " (" + tookMs + "ms" + (!logHeaders ? ", " + bodySize + " body" : "") + ')');

    if (!logHeaders) return;

    logHeaders(response.headers());

    String endMessage = "<-- END HTTP";
    if (logBody) {
      BufferedSource source = responseBody.source();
      source.request(Long.MAX_VALUE); // Buffer the entire body.
      Buffer buffer = source.buffer();

      Charset charset = Util.charset(responseBody.contentType(), UTF_8);
      if (buffer.size() != 0L) {
        logger.log("");
        logger.log(buffer.clone().readString(charset));
      }
      endMessage += " (" + buffer.size() + "-byte body)";
    }
    logger.log(endMessage);
  }

  private void logHeaders(Headers headers) {
    for (int i = 0, count = headers.size(); i < count; i++) {
      logger.log(headers.name(i) + ": " + headers.value(i));
    }
  }
}
