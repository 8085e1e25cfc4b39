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

/** Reports that a transport handle finished, successfully or not. */
public final class Completion {
  private final TransportHandle handle;
  private final TransferResult result;
  private final @Nullable String message;
  private final @Nullable Throwable cause;

  public Completion(TransportHandle handle, TransferResult result, @Nullable String message,
      @Nullable Throwable cause) {
    if (handle == null) throw new NullPointerException("handle == null");
    if (result == null) throw new NullPointerException("result == null");
    this.handle = handle;
    this.result = result;
    this.message = message;
    this.cause = cause;
  }

  public TransportHandle handle() {
    return handle;
  }

  public TransferResult result() {
    return result;
  }

  /** Returns a description of a failed result, or null. */
  public @Nullable String message() {
    return message;
  }

  /** Returns the exception that caused a failed result, or null. */
  public @Nullable Throwable cause() {
    return cause;
  }

  @Override public String toString() {
    return "Completion{result=" + result + (message != null ? ", message=" + message : "") + '}';
  }
}
