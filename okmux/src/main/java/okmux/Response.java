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

import java.io.Closeable;
import javax.annotation.Nullable;
import okmux.internal.Util;

/**
 * The response to a {@link Request}. A transport attaches it to its transaction as soon as the
 * response head arrived; the body keeps filling until the transfer completes. The effective URL is
 * only known once the complete event was emitted.
 */
public final class Response implements Closeable {
  private final Request request;
  private final String protocol;
  private final int code;
  private final String message;
  private final Headers headers;
  private final ResponseBody body;
  private volatile @Nullable String effectiveUrl;

  Response(Builder builder) {
    this.request = builder.request;
    this.protocol = builder.protocol;
    this.code = builder.code;
    this.message = builder.message;
    this.headers = builder.headers.build();
    this.body = builder.body;
  }

  public Request request() {
    return request;
  }

  /** Returns the protocol of the status line, like {@code HTTP/1.1}. */
  public String protocol() {
    return protocol;
  }

  public int code() {
    return code;
  }

  /** Returns true for 2xx codes. */
  public boolean isSuccessful() {
    return code >= 200 && code < 300;
  }

  /** Returns the reason phrase of the status line, which may be empty. */
  public String message() {
    return message;
  }

  public Headers headers() {
    return headers;
  }

  public @Nullable String header(String name) {
    return headers.get(name);
  }

  public ResponseBody body() {
    return body;
  }

  /** Returns the URL the response was received from, or null before the transfer completed. */
  public @Nullable String effectiveUrl() {
    return effectiveUrl;
  }

  public void setEffectiveUrl(@Nullable String effectiveUrl) {
    this.effectiveUrl = effectiveUrl;
  }

  @Override public void close() {
    body.close();
  }

  @Override public String toString() {
    return "Response{" + protocol + " " + code + " " + message + ", url=" + request.url() + '}';
  }

  public static final class Builder {
    @Nullable Request request;
    String protocol = "HTTP/1.1";
    int code = -1;
    String message = "";
    Headers.Builder headers = new Headers.Builder();
    @Nullable ResponseBody body;

    public Builder request(Request request) {
      this.request = request;
      return this;
    }

    public Builder protocol(String protocol) {
      if (protocol == null) throw new NullPointerException("protocol == null");
      this.protocol = protocol;
      return this;
    }

    public Builder code(int code) {
      this.code = code;
      return this;
    }

    public Builder message(String message) {
      if (message == null) throw new NullPointerException("message == null");
      this.message = message;
      return this;
    }

    public Builder header(String name, String value) {
      headers.set(name, value);
      return this;
    }

    public Builder headers(Headers headers) {
      this.headers = headers.newBuilder();
      return this;
    }

    /** Sets the body. Responses built without one get an empty body. */
    public Builder body(@Nullable ResponseBody body) {
      this.body = body;
      return this;
    }

    public Response build() {
      if (request == null) throw new IllegalStateException("request == null");
      if (code < 0) throw new IllegalStateException("code < 0: " + code);
      if (body == null) body = ResponseBody.create(null, Util.EMPTY_BYTE_ARRAY);
      return new Response(this);
    }
  }
}
