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

package com.google.syntaxtree.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/** Renders child values the way Ruby's {@code inspect} does. */
final class RubyInspect {

  private static final BigDecimal PLAIN_FLOAT_LIMIT = BigDecimal.valueOf(1e16);
  private static final BigDecimal SMALL_FLOAT_LIMIT = BigDecimal.valueOf(1e-4);

  static String value(@Nullable Object value) {
    if (value == null) {
      return "nil";
    } else if (value instanceof String) {
      return string((String) value);
    } else if (value instanceof Double) {
      return floatValue((Double) value);
    } else if (value instanceof BigInteger
        || value instanceof Symbol
        || value instanceof TargetNode
        || value instanceof RationalValue
        || value instanceof ComplexValue) {
      return value.toString();
    }
    throw new IllegalArgumentException("Unexpected child value: " + value.getClass());
  }

  static String string(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        case '\f' -> sb.append("\\f");
        case '\u000b' -> sb.append("\\v");
        case '\u0007' -> sb.append("\\a");
        case '\b' -> sb.append("\\b");
        case '\u001b' -> sb.append("\\e");
        case '#' -> {
          char next = i + 1 < value.length() ? value.charAt(i + 1) : 0;
          sb.append(next == '{' || next == '$' || next == '@' ? "\\#" : "#");
        }
        default -> {
          if (c < 0x20 || c == 0x7f) {
            sb.append(String.format("\\x%02X", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  static String floatValue(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    } else if (value == 0) {
      return 1 / value < 0 ? "-0.0" : "0.0";
    }
    BigDecimal decimal = new BigDecimal(Double.toString(value));
    BigDecimal magnitude = decimal.abs();
    if (magnitude.compareTo(PLAIN_FLOAT_LIMIT) < 0 && magnitude.compareTo(SMALL_FLOAT_LIMIT) >= 0) {
      String plain = decimal.stripTrailingZeros().toPlainString();
      return plain.contains(".") ? plain : plain + ".0";
    }
    // Ruby writes 1.0e+20 where Java writes 1.0E20.
    String java = Double.toString(value);
    int e = java.indexOf('E');
    String mantissa = java.substring(0, e);
    String exponent = java.substring(e + 1);
    if (!exponent.startsWith("-")) {
      exponent = "+" + exponent;
    }
    if (exponent.length() == 2) {
      exponent = exponent.charAt(0) + "0" + exponent.charAt(1);
    }
    return mantissa + "e" + exponent;
  }

  private RubyInspect() {}
}
