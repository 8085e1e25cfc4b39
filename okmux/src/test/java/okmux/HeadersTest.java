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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.fail;

public final class HeadersTest {
  @Test public void getIsCaseInsensitiveAndReturnsLastValue() {
    Headers headers = Headers.of("Set-Cookie", "a=1", "set-cookie", "b=2");
    assertThat(headers.get("SET-COOKIE")).isEqualTo("b=2");
    assertThat(headers.values("Set-Cookie")).containsExactly("a=1", "b=2");
    assertThat(headers.get("Cookie")).isNull();
  }

  @Test public void namesAndValuesKeepInsertionOrder() {
    Headers headers = new Headers.Builder()
        .add("B", "1")
        .add("A: 2")
        .add("b", "3")
        .build();
    assertThat(headers.size()).isEqualTo(3);
    assertThat(headers.name(1)).isEqualTo("A");
    assertThat(headers.value(1)).isEqualTo("2");
    assertThat(headers.toString()).isEqualTo("B: 1\nA: 2\nb: 3\n");
  }

  @Test public void addLenientAcceptsWhatPeersSend() {
    Headers headers = new Headers.Builder()
        .addLenient("Content-Type: text/plain")
        .addLenient(":status: 200")
        .addLenient(":empty-name")
        .addLenient("no colon")
        .build();
    assertThat(headers.get("Content-Type")).isEqualTo("text/plain");
    assertThat(headers.get(":status")).isEqualTo("200");
    assertThat(headers.values("")).containsExactly("empty-name", "no colon");
  }

  @Test public void setReplacesValues() {
    Headers headers = Headers.of("A", "1", "a", "2").newBuilder()
        .set("A", "3")
        .build();
    assertThat(headers.values("a")).containsExactly("3");
  }

  @Test public void removeAll() {
    Headers headers = Headers.of("A", "1", "B", "2", "a", "3").newBuilder()
        .removeAll("a")
        .build();
    assertThat(headers.size()).isEqualTo(1);
    assertThat(headers.names()).containsExactly("B");
  }

  @Test public void ofRejectsOddArguments() {
    try {
      Headers.of("A");
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void addRejectsControlCharacters() {
    try {
      new Headers.Builder().add("Na\nme", "value");
      fail();
    } catch (IllegalArgumentException expected) {
      assertThat(expected.getMessage()).isEqualTo("Unexpected char 0x0a at 2 in header name: Na\nme");
    }
    try {
      new Headers.Builder().add("Name", "va\u0000lue");
      fail();
    } catch (IllegalArgumentException expected) {
    }
    try {
      new Headers.Builder().add("", "value");
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test public void equality() {
    assertThat(Headers.of("A", "1")).isEqualTo(Headers.of("A", "1"));
    assertThat(Headers.of("A", "1").hashCode()).isEqualTo(Headers.of("A", "1").hashCode());
    assertThat(Headers.of("A", "1")).isNotEqualTo(Headers.of("a", "1"));
  }
}
