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

import javax.annotation.Nullable;
import okmux.event.Emitter;

/**
 * A request to transfer. Its URL, method, headers and body are fixed when it is built. Each request
 * also owns the {@link Emitter} of its lifecycle events, so listeners are registered per request.
 */
public final class Request {
  private final String url;
  private final String method;
  private final Headers headers;
  private final @Nullable RequestBody body;
  private final Emitter emitter = new Emitter();

  Request(Builder builder) {
    this.url = builder.url;
    this.method = builder.method;
    this.headers = builder.headers.build();
    this.body = builder.body;
  }

  /** Returns the absolute URL of this request. */
  public String url() {
    return url;
  }

  public String method() {
    return method;
  }

  public Headers headers() {
    return headers;
  }

  public @Nullable RequestBody body() {
    return body;
  }

  public Emitter emitter() {
    return emitter;
  }

  @Override public String toString() {
    return "Request{method=" + method + ", url=" + url + '}';
  }

  public static final class Builder {
    @Nullable String url;
    String method = "GET";
    final Headers.Builder headers = new Headers.Builder();
    @Nullable RequestBody body;

    public Builder url(String url) {
      if (url == null) throw new NullPointerException("url == null");
      if (url.isEmpty()) throw new IllegalArgumentException("url is empty");
      this.url = url;
      return this;
    }

    /** Replaces any headers named {@code name} with one holding {@code value}. */
    public Builder header(String name, String value) {
      headers.set(name, value);
      return this;
    }

    public Builder addHeader(String name, String value) {
      headers.add(name, value);
      return this;
    }

    public Builder get() {
      return method("GET", null);
    }

    public Builder post(RequestBody body) {
      return method("POST", body);
    }

    public Builder put(RequestBody body) {
      return method("PUT", body);
    }

    /**
     * Sets the method and body. GET and HEAD requests can't have a body, since the transport would
     * have no way to tell the server how it is framed.
     */
    public Builder method(String method, @Nullable RequestBody body) {
      if (method == null) throw new NullPointerException("method == null");
      if (method.isEmpty()) throw new IllegalArgumentException("method is empty");
      if (body != null && (method.equals("GET") || method.equals("HEAD"))) {
        throw new IllegalArgumentException("method " + method + " must not have a request body.");
      }
      this.method = method;
      this.body = body;
      return this;
    }

    public Request build() {
      if (url == null) throw new IllegalStateException("url == null");
      return new Request(this);
    }
  }
}
