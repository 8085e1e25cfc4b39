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
import java.io.IOException;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSource;
import okmux.internal.Util;

import static okmux.internal.Util.UTF_8;

/**
 * The bytes of a response body. A transport fills the body while the response arrives, so a
 * {@code headers} listener sees whatever was received so far; by the {@code complete} event the
 * body is whole. It can be read once.
 */
public abstract class ResponseBody implements Closeable {
  public abstract @Nullable String contentType();

  /** Returns the length announced by the server, or -1 if it didn't announce one. */
  public abstract long contentLength();

  public abstract BufferedSource source();

  /**
   * Reads the whole body and decodes it with the charset of its content type, or UTF-8. Closes
   * this body.
   */
  public final String string() throws IOException {
    BufferedSource source = source();
    try {
      return source.readString(Util.charset(contentType(), UTF_8));
    } finally {
      Util.closeQuietly(source);
    }
  }

  @Override public void close() {
    Util.closeQuietly(source());
  }

  public static ResponseBody create(@Nullable String contentType, String content) {
    Buffer buffer = new Buffer().writeString(content, Util.charset(contentType, UTF_8));
    return create(contentType, buffer.size(), buffer);
  }

  public static ResponseBody create(@Nullable String contentType, byte[] content) {
    return create(contentType, content.length, new Buffer().write(content));
  }

  /** Returns a body reading from {@code source}, which the caller may keep appending to. */
  public static ResponseBody create(@Nullable final String contentType, final long contentLength,
      final BufferedSource source) {
    if (source == null) throw new NullPointerException("source == null");
    return new ResponseBody() {
      @Override public @Nullable String contentType() {
        return contentType;
      }

      @Override public long contentLength() {
        return contentLength;
      }

      @Override public BufferedSource source() {
        return source;
      }
    };
  }
}
