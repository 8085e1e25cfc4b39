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

/** The outcome of one attempt to transfer a request, as reported by the transport. */
public enum TransferResult {
  /** The exchange finished without a transport failure. */
  OK(0, "No error"),

  /** The exchange is still running. */
  IN_PROGRESS(-1, "Transfer in progress"),

  UNSUPPORTED_PROTOCOL(1, "Unsupported protocol"),
  URL_MALFORMAT(3, "URL using bad/illegal format"),
  COULDNT_RESOLVE_HOST(6, "Couldn't resolve host name"),
  COULDNT_CONNECT(7, "Couldn't connect to server"),
  WEIRD_SERVER_REPLY(8, "Weird server reply"),
  PARTIAL_FILE(18, "Transferred a partial file"),
  READ_ERROR(26, "Failed to read the request body"),
  OPERATION_TIMEDOUT(28, "Timeout was reached"),
  ABORTED_BY_CALLBACK(42, "Operation was aborted by an application callback"),
  GOT_NOTHING(52, "Server returned nothing (no headers, no data)"),
  SEND_ERROR(55, "Failed sending data to the peer"),
  RECV_ERROR(56, "Failure when receiving data from the peer");

  private final int code;
  private final String description;

  TransferResult(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /** Returns the numeric code of this result. */
  public int code() {
    return code;
  }

  public String description() {
    return description;
  }

  /** Returns true unless this is {@link #OK} or {@link #IN_PROGRESS}. */
  public boolean isFailure() {
    return this != OK && this != IN_PROGRESS;
  }

  @Override public String toString() {
    return "#" + code + " " + description;
  }
}
