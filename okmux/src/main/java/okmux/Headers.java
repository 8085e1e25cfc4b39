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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;
import okmux.internal.Util;

/**
 * An ordered, immutable list of header fields. Names compare case-insensitively; values are kept as
 * sent, minus surrounding whitespace. A field repeated on several lines is several entries.
 */
public final class Headers {
  private final String[] names;
  private final String[] values;

  private Headers(List<String> names, List<String> values) {
    this.names = names.toArray(new String[0]);
    this.values = values.toArray(new String[0]);
  }

  /** Returns the value of the last field named {@code name}, or null if there is none. */
  public @Nullable String get(String name) {
    int index = lastIndexOf(Arrays.asList(names), name);
    return index != -1 ? values[index] : null;
  }

  public int size() {
    return names.length;
  }

  public String name(int index) {
    return names[index];
  }

  public String value(int index) {
    return values[index];
  }

  /** Returns the distinct field names, case-insensitively ordered. */
  public Set<String> names() {
    Set<String> result = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    Collections.addAll(result, names);
    return Collections.unmodifiableSet(result);
  }

  /** Returns the values of every field named {@code name}, in order. */
  public List<String> values(String name) {
    List<String> result = new ArrayList<>();
    for (int i = 0; i < names.length; i++) {
      if (names[i].equalsIgnoreCase(name)) result.add(values[i]);
    }
    return Collections.unmodifiableList(result);
  }

  public Builder newBuilder() {
    Builder result = new Builder();
    result.names.addAll(Arrays.asList(names));
    result.values.addAll(Arrays.asList(values));
    return result;
  }

  /** Headers are equal if they hold the same fields, with the same casing, in the same order. */
  @Override public boolean equals(@Nullable Object other) {
    if (!(other instanceof Headers)) return false;
    Headers that = (Headers) other;
    return Arrays.equals(names, that.names) && Arrays.equals(values, that.values);
  }

  @Override public int hashCode() {
    return 31 * Arrays.hashCode(names) + Arrays.hashCode(values);
  }

  /** Returns the fields as they'd appear in a message head, one per line. */
  @Override public String toString() {
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < names.length; i++) {
      result.append(names[i]).append(": ").append(values[i]).append('\n');
    }
    return result.toString();
  }

  /** Returns headers built from alternating names and values. */
  public static Headers of(String... namesAndValues) {
    if (namesAndValues == null) throw new NullPointerException("namesAndValues == null");
    if (namesAndValues.length % 2 == 1) {
      throw new IllegalArgumentException("Expected alternating header names and values");
    }
    Builder builder = new Builder();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      builder.add(namesAndValues[i], namesAndValues[i + 1]);
    }
    return builder.build();
  }

  private static int lastIndexOf(List<String> names, String name) {
    for (int i = names.size() - 1; i >= 0; i--) {
      if (names.get(i).equalsIgnoreCase(name)) return i;
    }
    return -1;
  }

  public static final class Builder {
    final List<String> names = new ArrayList<>();
    final List<String> values = new ArrayList<>();

    /**
     * Adds a header line as received from a server, without validating it. A line with no colon
     * after its first character has an empty name.
     */
    public Builder addLenient(String line) {
      int colon = line.indexOf(':', 1);
      if (colon != -1) return addLenient(line.substring(0, colon), line.substring(colon + 1));
      return addLenient("", line.startsWith(":") ? line.substring(1) : line);
    }

    /** Adds a {@code name: value} line. */
    public Builder add(String line) {
      int colon = line.indexOf(':');
      if (colon == -1) throw new IllegalArgumentException("Unexpected header: " + line);
      return add(line.substring(0, colon).trim(), line.substring(colon + 1));
    }

    public Builder add(String name, String value) {
      checkName(name);
      checkValue(name, value);
      return addLenient(name, value);
    }

    Builder addLenient(String name, String value) {
      names.add(name.trim());
      values.add(value.trim());
      return this;
    }

    /** Replaces every field named {@code name} with a single one holding {@code value}. */
    public Builder set(String name, String value) {
      checkName(name);
      checkValue(name, value);
      return removeAll(name).addLenient(name, value);
    }

    public Builder removeAll(String name) {
      for (int i = names.size() - 1; i >= 0; i--) {
        if (names.get(i).equalsIgnoreCase(name)) {
          names.remove(i);
          values.remove(i);
        }
      }
      return this;
    }

    public @Nullable String get(String name) {
      int index = lastIndexOf(names, name);
      return index != -1 ? values.get(index) : null;
    }

    public Headers build() {
      return new Headers(names, values);
    }

    private static void checkName(String name) {
      if (name == null) throw new NullPointerException("name == null");
      if (name.isEmpty()) throw new IllegalArgumentException("name is empty");
      for (int i = 0; i < name.length(); i++) {
        char c = name.charAt(i);
        if (c <= ' ' || c >= '\u007f' || c == ':') {
          throw new IllegalArgumentException(Util.format(
              "Unexpected char %#04x at %d in header name: %s", (int) c, i, name));
        }
      }
    }

    private static void checkValue(String name, String value) {
      if (value == null) throw new NullPointerException("value for name " + name + " == null");
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        // Horizontal tabs are the only control character allowed in values.
        if ((c < ' ' && c != '\t') || c >= '\u007f') {
          throw new IllegalArgumentException(Util.format(
              "Unexpected char %#04x at %d in %s value: %s", (int) c, i, name, value));
        }
      }
    }
  }
}
