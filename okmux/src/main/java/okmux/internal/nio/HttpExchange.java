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
import java.net.InetSocketAddress;
import java.net.ProtocolException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import okio.Buffer;
import okmux.Headers;
import okmux.MessageFactory;
import okmux.Request;
import okmux.RequestBody;
import okmux.Response;
import okmux.ResponseBody;
import okmux.Transaction;
import okmux.TransferResult;
import okmux.TransferStats;
import okmux.TransportHandle;
import okmux.event.RequestEvents;
import okmux.internal.Util;

import static okmux.internal.Util.closeQuietly;

/**
 * One HTTP/1.1 exchange over a non-blocking socket channel. The exchange is driven by a {@link
 * SelectorMultiplexHandle}, which calls {@link #onReady} whenever its channel is ready. It opens a
 * fresh connection, writes the request and reads the response, then closes the connection.
 */
final class HttpExchange implements TransportHandle {
  private static final int STATE_NEW = 0;
  private static final int STATE_CONNECTING = 1;
  private static final int STATE_WRITING = 2;
  private static final int STATE_READING_STATUS = 3;
  private static final int STATE_READING_HEADERS = 4;
  private static final int STATE_READING_BODY = 5;
  private static final int STATE_DONE = 6;

  private static final int FRAMING_NONE = 0;
  private static final int FRAMING_FIXED = 1;
  private static final int FRAMING_CHUNKED = 2;
  private static final int FRAMING_UNTIL_CLOSE = 3;

  private static final long NO_CHUNK_SIZE = -1L;
  private static final long MAX_LINE_LENGTH = 64 * 1024;
  private static final long BODY_SEGMENT_SIZE = 8192;

  private final Transaction transaction;
  private final MessageFactory messageFactory;
  private final long timeoutNanos;

  private int state = STATE_NEW;
  private @Nullable SocketChannel channel;
  private @Nullable SelectionKey key;
  private @Nullable String remoteAddress;

  /** Request bytes that are encoded but not yet written. */
  private final Buffer outgoing = new Buffer();
  private @Nullable ByteBuffer sending;
  private boolean chunkedRequest;
  private boolean requestBodyExhausted;

  /** Response bytes that are read but not yet parsed. */
  private final Buffer incoming = new Buffer();
  private Headers.Builder responseHeaders = new Headers.Builder();
  private @Nullable StatusLine statusLine;
  private int framing;
  private long bytesRemainingInBody;
  private long bytesRemainingInChunk = NO_CHUNK_SIZE;
  private boolean readingTrailers;
  private final Buffer responseBody = new Buffer();

  private long startNanos;
  private long connectNanos = -1L;
  private long finishNanos = -1L;
  private long bytesSent;
  private long bytesReceived;

  private TransferResult result = TransferResult.IN_PROGRESS;
  private @Nullable String resultMessage;
  private @Nullable Throwable cause;

  HttpExchange(Transaction transaction, MessageFactory messageFactory, long timeoutMillis) {
    this.transaction = transaction;
    this.messageFactory = messageFactory;
    this.timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
  }

  @Override public Transaction transaction() {
    return transaction;
  }

  /** Resolves the request's host, encodes the request head and starts connecting. */
  void start(Selector selector) {
    if (state != STATE_NEW) throw new IllegalStateException("already started");
    startNanos = System.nanoTime();
    state = STATE_CONNECTING;

    Request request = transaction.request();
    URI uri;
    try {
      uri = new URI(request.url());
    } catch (URISyntaxException e) {
      finish(TransferResult.URL_MALFORMAT, e.getMessage(), e);
      return;
    }
    String scheme = uri.getScheme();
    if (scheme == null || !scheme.toLowerCase(Locale.US).equals("http")) {
      finish(TransferResult.UNSUPPORTED_PROTOCOL, "Protocol \"" + scheme + "\" not supported", null);
      return;
    }
    String host = uri.getHost();
    if (host == null) {
      finish(TransferResult.URL_MALFORMAT, "No host in URL", null);
      return;
    }
    int port = uri.getPort() != -1 ? uri.getPort() : 80;

    try {
      writeRequestHead(uri, host, port);
    } catch (IOException e) {
      finish(TransferResult.READ_ERROR, "Failed to read the request body: " + e, e);
      return;
    }

    InetSocketAddress address = new InetSocketAddress(host, port);
    if (address.isUnresolved()) {
      finish(TransferResult.COULDNT_RESOLVE_HOST, "Could not resolve host: " + host, null);
      return;
    }

    try {
      channel = SocketChannel.open();
      channel.configureBlocking(false);
      boolean connected = channel.connect(address);
      key = channel.register(selector, SelectionKey.OP_CONNECT, this);
      if (connected) onConnected();
    } catch (IOException e) {
      finish(TransferResult.COULDNT_CONNECT, "Failed to connect to " + address + ": " + e, e);
    }
  }

  private void writeRequestHead(URI uri, String host, int port) throws IOException {
    Request request = transaction.request();
    RequestBody body = request.body();
    Headers headers = request.headers();

    String target = uri.getRawPath() == null || uri.getRawPath().isEmpty()
        ? "/"
        : uri.getRawPath();
    if (uri.getRawQuery() != null) target += "?" + uri.getRawQuery();

    outgoing.writeUtf8(request.method()).writeUtf8(" ").writeUtf8(target)
        .writeUtf8(" HTTP/1.1\r\n");
    if (headers.get("Host") == null) {
      writeHeader("Host", port == 80 ? host : host + ":" + port);
    }
    for (int i = 0, size = headers.size(); i < size; i++) {
      String name = headers.name(i);
      if (name.equalsIgnoreCase("Connection")
          || name.equalsIgnoreCase("Content-Length")
          || name.equalsIgnoreCase("Transfer-Encoding")) {
        continue; // Framing is ours to decide.
      }
      writeHeader(name, headers.value(i));
    }
    if (body != null) {
      String contentType = body.contentType();
      if (contentType != null && headers.get("Content-Type") == null) {
        writeHeader("Content-Type", contentType);
      }
      long contentLength = body.contentLength();
      if (contentLength != -1L) {
        writeHeader("Content-Length", Long.toString(contentLength));
      } else {
        writeHeader("Transfer-Encoding", "chunked");
        chunkedRequest = true;
      }
    } else {
      requestBodyExhausted = true;
    }
    writeHeader("Connection", "close");
    if (headers.get("User-Agent") == null) {
      writeHeader("User-Agent", Util.USER_AGENT);
    }
    outgoing.writeUtf8("\r\n");
  }

  private void writeHeader(String name, String value) {
    outgoing.writeUtf8(name).writeUtf8(": ").writeUtf8(value).writeUtf8("\r\n");
  }

  /** Advances this exchange after its channel became ready. */
  void onReady(SelectionKey readyKey, ByteBuffer readBuffer) {
    if (state == STATE_DONE) return;

    if (readyKey.isValid() && readyKey.isConnectable()) {
      try {
        if (!channel.finishConnect()) return;
      } catch (IOException e) {
        finish(TransferResult.COULDNT_CONNECT, "Failed to connect to "
            + transaction.request().url() + ": " + e, e);
        return;
      }
      onConnected();
    }

    if (state == STATE_WRITING && readyKey.isValid() && readyKey.isWritable()) {
      try {
        write();
      } catch (IOException e) {
        connectionLost(TransferResult.SEND_ERROR, e);
        return;
      }
    }

    if (state != STATE_DONE && readyKey.isValid() && readyKey.isReadable()) {
      try {
        read(readBuffer);
      } catch (IOException e) {
        connectionLost(TransferResult.RECV_ERROR, e);
      }
    }
  }

  private void onConnected() {
    connectNanos = System.nanoTime() - startNanos;
    remoteAddress = String.valueOf(channel.socket().getRemoteSocketAddress());
    state = STATE_WRITING;
    // Read while writing: a server may answer before it has consumed the whole request.
    key.interestOps(SelectionKey.OP_WRITE | SelectionKey.OP_READ);
  }

  private void write() throws IOException {
    while (true) {
      if (sending == null || !sending.hasRemaining()) {
        if (outgoing.size() == 0L && !requestBodyExhausted) {
          try {
            encodeRequestBody();
          } catch (IOException e) {
            finish(TransferResult.READ_ERROR, "Failed to read the request body: " + e, e);
            return;
          }
        }
        if (outgoing.size() == 0L) {
          // The whole request is written.
          sending = null;
          state = STATE_READING_STATUS;
          key.interestOps(SelectionKey.OP_READ);
          return;
        }
        sending = ByteBuffer.wrap(outgoing.readByteArray(Math.min(outgoing.size(), 8192L)));
      }

      int written = channel.write(sending);
      bytesSent += written;
      if (sending.hasRemaining()) return; // Wait until the channel is writable again.
    }
  }

  /** Moves the next segment of the request body into {@link #outgoing}. */
  private void encodeRequestBody() throws IOException {
    RequestBody body = transaction.request().body();
    Buffer segment = new Buffer();
    long read = body.read(segment, BODY_SEGMENT_SIZE);

    if (read == -1L) {
      requestBodyExhausted = true;
      if (chunkedRequest) outgoing.writeUtf8("0\r\n\r\n");
      return;
    }

    if (chunkedRequest) {
      outgoing.writeHexadecimalUnsignedLong(read).writeUtf8("\r\n");
      outgoing.write(segment, read);
      outgoing.writeUtf8("\r\n");
    } else {
      outgoing.write(segment, read);
    }
  }

  private void read(ByteBuffer readBuffer) throws IOException {
    readBuffer.clear();
    int read = channel.read(readBuffer);
    if (read == -1) {
      onEndOfStream();
      return;
    }
    bytesReceived += read;
    incoming.write(readBuffer.array(), readBuffer.arrayOffset(), read);

    try {
      parse();
    } catch (ProtocolException e) {
      finish(TransferResult.WEIRD_SERVER_REPLY, e.getMessage(), e);
    }
  }

  private void parse() throws ProtocolException {
    while (state != STATE_DONE) {
      if (state == STATE_WRITING || state == STATE_READING_STATUS) {
        String line = readLine();
        if (line == null) return;
        statusLine = StatusLine.parse(line);
        if (state == STATE_WRITING) {
          // The server answered early. Stop sending the request.
          key.interestOps(SelectionKey.OP_READ);
        }
        state = STATE_READING_HEADERS;
      } else if (state == STATE_READING_HEADERS) {
        String line = readLine();
        if (line == null) return;
        if (!line.isEmpty()) {
          responseHeaders.addLenient(line);
        } else if (statusLine.isInterim()) {
          responseHeaders = new Headers.Builder();
          state = STATE_READING_STATUS;
        } else {
          onHeadersComplete();
        }
      } else if (state == STATE_READING_BODY) {
        if (!readBody()) return;
      } else {
        return;
      }
    }
  }

  /** Returns the next line of the response head, or null if it hasn't been fully received yet. */
  private @Nullable String readLine() throws ProtocolException {
    long newline = incoming.indexOf((byte) '\n');
    if (newline == -1L) {
      if (incoming.size() > MAX_LINE_LENGTH) {
        throw new ProtocolException("Response line longer than " + MAX_LINE_LENGTH + " bytes");
      }
      return null;
    }
    String line;
    try {
      line = incoming.readUtf8(newline);
      incoming.skip(1L);
    } catch (IOException e) {
      throw new AssertionError(e); // The newline was found in the buffer.
    }
    return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
  }

  private void onHeadersComplete() throws ProtocolException {
    Headers headers = responseHeaders.build();
    Request request = transaction.request();

    long contentLength = -1L;
    String transferEncoding = headers.get("Transfer-Encoding");
    String contentLengthString = headers.get("Content-Length");
    if (request.method().equals("HEAD")
        || statusLine.code == StatusLine.HTTP_NO_CONTENT
        || statusLine.code == StatusLine.HTTP_NOT_MODIFIED) {
      framing = FRAMING_NONE;
      contentLength = 0L;
    } else if (transferEncoding != null && transferEncoding.equalsIgnoreCase("chunked")) {
      framing = FRAMING_CHUNKED;
    } else if (contentLengthString != null) {
      try {
        contentLength = Long.parseLong(contentLengthString.trim());
      } catch (NumberFormatException e) {
        throw new ProtocolException("Unexpected Content-Length: " + contentLengthString);
      }
      if (contentLength < 0L) {
        throw new ProtocolException("Unexpected Content-Length: " + contentLengthString);
      }
      framing = FRAMING_FIXED;
      bytesRemainingInBody = contentLength;
    } else {
      framing = FRAMING_UNTIL_CLOSE;
    }

    ResponseBody body = ResponseBody.create(headers.get("Content-Type"), contentLength,
        responseBody);
    Response response = messageFactory.createResponse(request, statusLine.protocol,
        statusLine.code, statusLine.message, headers, body);
    transaction.setResponse(response);
    state = STATE_READING_BODY;

    try {
      RequestEvents.emitHeaders(transaction);
    } catch (IOException | RuntimeException e) {
      finish(TransferResult.ABORTED_BY_CALLBACK, "A headers listener failed: " + e, e);
      return;
    }

    if (framing == FRAMING_NONE || (framing == FRAMING_FIXED && bytesRemainingInBody == 0L)) {
      finish(TransferResult.OK, null, null);
    }
  }

  /** Consumes body bytes from {@link #incoming}. Returns false if it needs more bytes. */
  private boolean readBody() throws ProtocolException {
    if (framing == FRAMING_FIXED) {
      long count = Math.min(bytesRemainingInBody, incoming.size());
      responseBody.write(incoming, count);
      bytesRemainingInBody -= count;
      if (bytesRemainingInBody == 0L) {
        finish(TransferResult.OK, null, null);
        return true;
      }
      return false;
    }

    if (framing == FRAMING_UNTIL_CLOSE) {
      responseBody.write(incoming, incoming.size());
      return false;
    }

    // Chunked.
    if (readingTrailers) {
      String line = readLine();
      if (line == null) return false;
      if (line.isEmpty()) finish(TransferResult.OK, null, null);
      return true;
    }
    if (bytesRemainingInChunk == NO_CHUNK_SIZE) {
      String line = readLine();
      if (line == null) return false;
      int extensions = line.indexOf(';');
      String size = (extensions != -1 ? line.substring(0, extensions) : line).trim();
      try {
        bytesRemainingInChunk = Long.parseLong(size, 16);
      } catch (NumberFormatException e) {
        throw new ProtocolException("Expected a hex chunk size but was \"" + line + "\"");
      }
      if (bytesRemainingInChunk < 0L) {
        throw new ProtocolException("Expected a hex chunk size but was \"" + line + "\"");
      }
      if (bytesRemainingInChunk == 0L) readingTrailers = true;
      return true;
    }
    if (bytesRemainingInChunk > 0L) {
      long count = Math.min(bytesRemainingInChunk, incoming.size());
      responseBody.write(incoming, count);
      bytesRemainingInChunk -= count;
      return bytesRemainingInChunk == 0L;
    }
    // The CRLF that follows the chunk's data.
    String line = readLine();
    if (line == null) return false;
    if (!line.isEmpty()) throw new ProtocolException("Expected CRLF after chunk, got " + line);
    bytesRemainingInChunk = NO_CHUNK_SIZE;
    return true;
  }

  private void onEndOfStream() {
    if (state == STATE_READING_BODY) {
      if (framing == FRAMING_UNTIL_CLOSE) {
        finish(TransferResult.OK, null, null);
      } else {
        finish(TransferResult.PARTIAL_FILE, "Connection closed with body bytes remaining", null);
      }
      return;
    }
    connectionLost(TransferResult.RECV_ERROR, null);
  }

  /**
   * Ends this exchange after its connection failed. A connection lost before any response byte
   * arrived while sending a body finishes without a response, so that the engine may retry it.
   */
  private void connectionLost(TransferResult failure, @Nullable IOException e) {
    if (bytesReceived == 0L) {
      if (transaction.request().body() != null) {
        finish(TransferResult.OK, null, e);
      } else {
        finish(TransferResult.GOT_NOTHING, "Empty reply from server", e);
      }
    } else if (state == STATE_READING_BODY) {
      finish(failure, e != null ? e.toString() : "Unexpected end of stream", e);
    } else {
      finish(failure, "Connection closed in the response head"
          + (e != null ? ": " + e : ""), e);
    }
  }

  /** Fails this exchange if it has run longer than its timeout. */
  void checkTimeout(long nowNanos) {
    if (state == STATE_DONE || timeoutNanos == 0L) return;
    if (nowNanos - startNanos >= timeoutNanos) {
      finish(TransferResult.OPERATION_TIMEDOUT, "Operation timed out after "
          + TimeUnit.NANOSECONDS.toMillis(nowNanos - startNanos) + " milliseconds", null);
    }
  }

  boolean isDone() {
    return state == STATE_DONE;
  }

  TransferResult result() {
    return result;
  }

  @Nullable String resultMessage() {
    return resultMessage;
  }

  @Nullable Throwable cause() {
    return cause;
  }

  private void finish(TransferResult result, @Nullable String message, @Nullable Throwable cause) {
    if (state == STATE_DONE) return;
    state = STATE_DONE;
    this.result = result;
    this.resultMessage = message;
    this.cause = cause;
    finishNanos = System.nanoTime();
    closeChannel();
  }

  @Override public TransferStats stats() {
    long elapsed = (finishNanos != -1L ? finishNanos : System.nanoTime()) - startNanos;
    return new TransferStats.Builder()
        .url(transaction.request().url())
        .result(result, resultMessage)
        .totalTime(startNanos != 0L ? elapsed : 0L, TimeUnit.NANOSECONDS)
        .connectTime(connectNanos != -1L ? connectNanos : 0L, TimeUnit.NANOSECONDS)
        .bytesSent(bytesSent)
        .bytesReceived(bytesReceived)
        .remoteAddress(remoteAddress)
        .build();
  }

  @Override public void close() {
    closeChannel();
  }

  private void closeChannel() {
    if (key != null) key.cancel();
    if (channel != null) closeQuietly(channel);
  }

  @Override public String toString() {
    return "HttpExchange{" + transaction.request().method() + " " + transaction.request().url()
        + ", result=" + result + '}';
  }
}
