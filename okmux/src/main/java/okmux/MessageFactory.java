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

/**
 * Builds responses from what a transport parsed off the wire. Install a custom factory to return
 * responses that carry additional application state.
 */
public interface MessageFactory {
  /** Builds responses with {@link Response.Builder}. */
  MessageFactory DEFAULT = new MessageFactory() {
    @Override public Response createResponse(Request request, String protocol, int code,
        String message, Headers headers, ResponseBody body) {
      return new Response.Builder()
          .request(request)
          .protocol(protocol)
          .code(code)
          .message(message)
          .headers(headers)
          .body(body)
          .build();
    }
  };

  /**
   * Returns a response to {@code request} for a status line and headers. The transport keeps
   * appending to {@code body} after this returns, until the response is complete.
   */
  Response createResponse(Request request, String protocol, int code, String message,
      Headers headers, ResponseBody body);
}
