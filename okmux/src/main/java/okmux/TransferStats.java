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

import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Statistics of one attempt to transfer a request: its timing, its byte counts and the result the
 * transport reported.
 */
public final class TransferStats {
  /** Statistics of an attempt that never reached the transport. */
  public static final TransferStats NONE = new Builder().build();

  private final @Nullable String url;
  private final TransferResult result;
  private final @Nullable String resultMessage;
  private final long totalTimeNanos;
  private final long connectTimeNanos;
  private final long bytesSent;
  private final long bytesReceived;
  private final @Nullable String remoteAddress;

  TransferStats(Builder builder) {
    this.url = builder.url;
    this.result = builder.result;
    this.resultMessage = builder.resultMessage;
    this.totalTimeNanos = builder.totalTimeNanos;
    this.connectTimeNanos = builder.connectTimeNanos;
    this.bytesSent = builder.bytesSent;
    this.bytesReceived = builder.bytesReceived;
    this.remoteAddress = builder.remoteAddress;
  }

  /** Returns the URL that was transferred, or null if the transport was never reached. */
  public @Nullable String url() {
    return url;
  }

  public TransferResult result() {
    return result;
  }

  /** Returns the transport's description of a failed result, or null. */
  public @Nullable String resultMessage() {
    return resultMessage;
  }

  /** Returns the time from the start of the attempt until it finished, in {@code unit}. */
  public long totalTime(TimeUnit unit) {
    return unit.convert(totalTimeNanos, TimeUnit.NANOSECONDS);
  }

  /** Returns the time spent establishing the connection, in {@code unit}. */
  public long connectTime(TimeUnit unit) {
    return unit.convert(connectTimeNanos, TimeUnit.NANOSECONDS);
  }

  /** Returns the number of bytes written to the network, including the request head. */
  public long bytesSent() {
    return bytesSent;
  }

  /** Returns the number of bytes read from the network, including the response head. */
  public long bytesReceived() {
    return bytesReceived;
  }

  /** Returns the address of the peer, like {@code 10.0.0.1:80}, or null if it never connected. */
  public @Nullable String remoteAddress() {
    return remoteAddress;
  }

  public Builder newBuilder() {
    return new Builder(this);
  }

  @Override public String toString() {
    return "TransferStats{url="
        + url
        + ", result="
        + result
        + (resultMessage != null ? ", resultMessage=" + resultMessage : "")
        + ", totalTimeMs="
        + totalTime(TimeUnit.MILLISECONDS)
        + ", bytesSent="
        + bytesSent
        + ", bytesReceived="
        + bytesReceived
        + '}';
  }

  public static final class Builder {
    @Nullable String url;
    TransferResult result = TransferResult.OK;
    @Nullable String resultMessage;
    long totalTimeNanos;
    long connectTimeNanos;
    long bytesSent;
    long bytesReceived;
    @Nullable String remoteAddress;

    public Builder() {
    }

    Builder(TransferStats stats) {
      this.url = stats.url;
      this.result = stats.result;
      this.resultMessage = stats.resultMessage;
      this.totalTimeNanos = stats.totalTimeNanos;
      this.connectTimeNanos = stats.connectTimeNanos;
      this.bytesSent = stats.bytesSent;
      this.bytesReceived = stats.bytesReceived;
      this.remoteAddress = stats.remoteAddress;
    }

    public Builder url(@Nullable String url) {
      this.url = url;
      return this;
    }

    public Builder result(TransferResult result, @Nullable String resultMessage) {
      if (result == null) throw new NullPointerException("result == null");
      this.result = result;
      this.resultMessage = resultMessage;
      return this;
    }

    public Builder totalTime(long duration, TimeUnit unit) {
      this.totalTimeNanos = unit.toNanos(duration);
      return this;
    }

    public Builder connectTime(long duration, TimeUnit unit) {
      this.connectTimeNanos = unit.toNanos(duration);
      return this;
    }

    public Builder bytesSent(long bytesSent) {
      this.bytesSent = bytesSent;
      return this;
    }

    public Builder bytesReceived(long bytesReceived) {
      this.bytesReceived = bytesReceived;
      return this;
    }

    public Builder remoteAddress(@Nullable String remoteAddress) {
      this.remoteAddress = remoteAddress;
      return this;
    }

    public TransferStats build() {
      return new TransferStats(this);
    }
  }
}
