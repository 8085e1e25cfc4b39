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
import javax.annotation.Nullable;
import okio.Buffer;
import okio.ByteString;
import okio.Source;
import okmux.internal.Util;

import static okmux.internal.Util.UTF_8;
import static okmux.internal.Util.checkOffsetAndCount;

/**
 * The bytes of a request body, produced incrementally as the transport is ready to send them.
 *
 * <p>A body is <i>rewindable</i> if it can be repositioned at its first byte after some or all of
 * it was sent. Transports use that to restart an exchange whose connection died while the body was
 * in flight. Bodies that wrap a one-shot {@link Source} cannot be rewound; bodies built from bytes
 * in memory always can.
 */
public abstract class RequestBody {
  /** Returns the Content-Type header for this body, or null if none is known. */
  public abstract @Nullable String contentType();

  /**
   * Returns the number of bytes that will be produced by {@link #read}, or -1 if that count is
   * unknown.
   */
  public long contentLength() throws IOException {
    return -1;
  }

  /**
   * Removes at least 1, and up to {@code byteCount} bytes from this body and appends them to {@code
   * sink}. Returns the number of bytes read, or -1 if this body is exhausted.
   */
  public abstract long read(Buffer sink, long byteCount) throws IOException;

  /** Returns true if {@link #rewind} can reposition this body at its first byte. */
  public boolean isRewindable() {
    return false;
  }

  /**
   * Repositions this body at its first byte so it can be sent again. Returns false if that isn't
   * possible.
   */
  public boolean rewind() {
    return false;
  }

  /**
   * Returns a new request body that transmits {@code content}. If {@code contentType} lacks a
   * charset, the content is encoded as UTF-8.
   */
  public static RequestBody create(@Nullable String contentType, String content) {
    return create(contentType, content.getBytes(Util.charset(contentType, UTF_8)));
  }

  /** Returns a new request body that transmits {@code content}. */
  public static RequestBody create(@Nullable String contentType, ByteString content) {
    return create(contentType, content.toByteArray());
  }

  /** Returns a new request body that transmits {@code content}. */
  public static RequestBody create(@Nullable String contentType, byte[] content) {
    return create(contentType, content, 0, content.length);
  }

  /** Returns a new request body that transmits {@code byteCount} bytes of {@code content}. */
  public static RequestBody create(@Nullable final String contentType, final byte[] content,
      final int offset, final int byteCount) {
    if (content == null) throw new NullPointerException("content == null");
    checkOffsetAndCount(content.length, offset, byteCount);
    return new RequestBody() {
      int position = offset;

      @Override public @Nullable String contentType() {
        return contentType;
      }

      @Override public long contentLength() {
        return byteCount;
      }

      @Override public long read(Buffer sink, long limit) {
        int remaining = offset + byteCount - position;
        if (remaining == 0) return -1;
        int count = (int) Math.min(limit, remaining);
        sink.write(content, position, count);
        position += count;
        return count;
      }

      @Override public boolean isRewindable() {
        return true;
      }

      @Override public boolean rewind() {
        position = offset;
        return true;
      }
    };
  }

  /**
   * Returns a one-shot request body that streams {@code source}. Pass -1 for {@code contentLength}
   * if the length isn't known; the transport will then frame the body itself.
   */
  public static RequestBody create(@Nullable final String contentType, final long contentLength,
      final Source source) {
    if (source == null) throw new NullPointerException("source == null");
    return new RequestBody() {
      @Override public @Nullable String contentType() {
        return contentType;
      }

      @Override public long contentLength() {
        return contentLength;
      }

      @Override public long read(Buffer sink, long byteCount) throws IOException {
        return source.read(sink, byteCount);
      }
    };
  }
}
