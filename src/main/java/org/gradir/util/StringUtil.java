/*
 * Copyright 2025 The Gradir Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gradir.util;

import java.util.List;
import java.util.function.Function;

/** A static-only class with helpers for formatting strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Returns {@code s} as a double-quoted string literal, with backslashes, quotes, and
   * non-printable characters escaped.
   */
  public static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Appends the result of applying {@code toString} to each element of {@code items}, separated by
   * ", ".
   */
  public static <T> StringBuilder joinTo(
      StringBuilder sb, List<T> items, Function<? super T, String> toString) {
    for (int i = 0; i < items.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(toString.apply(items.get(i)));
    }
    return sb;
  }
}
