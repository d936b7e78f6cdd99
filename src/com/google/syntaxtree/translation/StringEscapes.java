/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.syntaxtree.translation;

/**
 * Resolves the backslash escapes of a double-quoted string fragment into the characters they
 * denote. Sequences that are not recognized are kept as written.
 */
final class StringEscapes {

  static String unescape(String text) {
    if (text.indexOf('\\') < 0) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c != '\\' || i + 1 == text.length()) {
        sb.append(c);
        i++;
        continue;
      }
      char next = text.charAt(i + 1);
      switch (next) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case 'f' -> sb.append('\f');
        case 'v' -> sb.append('\u000b');
        case 'a' -> sb.append('\u0007');
        case 'b' -> sb.append('\b');
        case 'e' -> sb.append('\u001b');
        case 's' -> sb.append(' ');
        case '\\', '"', '#', '\'' -> sb.append(next);
        case 'x' -> {
          int end = scanHex(text, i + 2, 2);
          if (end > i + 2) {
            sb.append((char) Integer.parseInt(text.substring(i + 2, end), 16));
            i = end;
            continue;
          }
          sb.append("\\x");
        }
        case 'u' -> {
          int consumed = appendUnicode(text, i + 2, sb);
          if (consumed > 0) {
            i += 2 + consumed;
            continue;
          }
          sb.append("\\u");
        }
        default -> sb.append('\\').append(next);
      }
      i += 2;
    }
    return sb.toString();
  }

  /**
   * Resolves the escapes of a single-quoted fragment, where a backslash only escapes another
   * backslash or one of {@code delimiters}. Every other backslash is kept as written.
   */
  static String unescapeSingleQuoted(String text, String delimiters) {
    if (text.indexOf('\\') < 0) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        char next = text.charAt(i + 1);
        if (next == '\\' || delimiters.indexOf(next) >= 0) {
          sb.append(next);
          i += 2;
          continue;
        }
      }
      sb.append(c);
      i++;
    }
    return sb.toString();
  }

  /** Appends the code points of a unicode escape body and returns the number of chars read. */
  private static int appendUnicode(String text, int start, StringBuilder sb) {
    if (start < text.length() && text.charAt(start) == '{') {
      int close = text.indexOf('}', start);
      if (close < 0) {
        return 0;
      }
      for (String hex : text.substring(start + 1, close).trim().split("\\s+")) {
        if (hex.isEmpty() || scanHex(hex, 0, 6) != hex.length()) {
          return 0;
        }
      }
      for (String hex : text.substring(start + 1, close).trim().split("\\s+")) {
        sb.appendCodePoint(Integer.parseInt(hex, 16));
      }
      return close + 1 - start;
    }
    int end = scanHex(text, start, 4);
    if (end - start != 4) {
      return 0;
    }
    sb.append((char) Integer.parseInt(text.substring(start, end), 16));
    return 4;
  }

  private static int scanHex(String text, int start, int max) {
    int end = start;
    while (end < text.length() && end - start < max && Character.digit(text.charAt(end), 16) >= 0) {
      end++;
    }
    return end;
  }

  private StringEscapes() {}
}
