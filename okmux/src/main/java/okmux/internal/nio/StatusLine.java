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

import java.net.ProtocolException;

/** The first line of an HTTP/1.x response, like {@code HTTP/1.1 200 OK}. */
final class StatusLine {
  static final int HTTP_CONTINUE = 100;
  static final int HTTP_NO_CONTENT = 204;
  static final int HTTP_NOT_MODIFIED = 304;

  final String protocol;
  final int code;
  final String message;

  private StatusLine(String protocol, int code, String message) {
    this.protocol = protocol;
    this.code = code;
    this.message = message;
  }

  /**
   * Parses {@code line}. The protocol must be HTTP/1.0 or HTTP/1.1 and the code exactly three
   * digits; the reason phrase is optional.
   */
  static StatusLine parse(String line) throws ProtocolException {
    int firstSpace = line.indexOf(' ');
    if (firstSpace == -1) throw new ProtocolException("Unexpected status line: " + line);

    String protocol = line.substring(0, firstSpace);
    if (!protocol.equals("HTTP/1.1") && !protocol.equals("HTTP/1.0")) {
      throw new ProtocolException("Unexpected status line: " + line);
    }

    int codeEnd = firstSpace + 4;
    if (line.length() < codeEnd) throw new ProtocolException("Unexpected status line: " + line);
    int code = 0;
    for (int i = firstSpace + 1; i < codeEnd; i++) {
      char c = line.charAt(i);
      if (c < '0' || c > '9') throw new ProtocolException("Unexpected status line: " + line);
      code = code * 10 + (c - '0');
    }

    String message = "";
    if (line.length() > codeEnd) {
      if (line.charAt(codeEnd) != ' ') {
        throw new ProtocolException("Unexpected status line: " + line);
      }
      message = line.substring(codeEnd + 1);
    }
    return new StatusLine(protocol, code, message);
  }

  /** Returns true for 1xx responses, which precede the final response. */
  boolean isInterim() {
    return code >= HTTP_CONTINUE && code < 200;
  }

  @Override public String toString() {
    return protocol + ' ' + code + (message.isEmpty() ? "" : " " + message);
  }
}
