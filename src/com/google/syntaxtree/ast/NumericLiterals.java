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

/**
 * Reads the text of Ruby numeric literals into values. Only literal syntax is accepted: an
 * optional sign, an optional radix prefix, digits with single underscores between them and the
 * {@code r} and {@code i} suffixes.
 *
 * <p>Malformed text raises {@link NumberFormatException}.
 */
public final class NumericLiterals {

  /** Reads an integer literal such as {@code 1_000}, {@code 0x1F}, {@code 0b101} or {@code 017}. */
  public static BigInteger parseInteger(String text) {
    String digits = stripUnderscores(text);
    boolean negative = false;
    if (digits.startsWith("-") || digits.startsWith("+")) {
      negative = digits.charAt(0) == '-';
      digits = digits.substring(1);
    }
    int radix = 10;
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      switch (Character.toLowerCase(digits.charAt(1))) {
        case 'x' -> {
          radix = 16;
          digits = digits.substring(2);
        }
        case 'b' -> {
          radix = 2;
          digits = digits.substring(2);
        }
        case 'o' -> {
          radix = 8;
          digits = digits.substring(2);
        }
        case 'd' -> digits = digits.substring(2);
        default -> {
          radix = 8;
          digits = digits.substring(1);
        }
      }
    }
    if (digits.isEmpty() || digits.startsWith("-") || digits.startsWith("+")) {
      throw new NumberFormatException("Not an integer literal: " + text);
    }
    BigInteger value = new BigInteger(digits, radix);
    return negative ? value.negate() : value;
  }

  /** Reads a float literal such as {@code 1.5}, {@code 1e10} or {@code 1_000.0}. */
  public static double parseFloat(String text) {
    String digits = stripUnderscores(text);
    if (digits.isEmpty() || digits.endsWith("d") || digits.endsWith("f")) {
      throw new NumberFormatException("Not a float literal: " + text);
    }
    return Double.parseDouble(digits);
  }

  /** Reads a rational literal such as {@code 3r} or {@code 1.5r}. */
  public static RationalValue parseRational(String text) {
    if (!text.endsWith("r")) {
      throw new NumberFormatException("Not a rational literal: " + text);
    }
    String body = text.substring(0, text.length() - 1);
    if (body.contains(".")) {
      BigDecimal decimal = new BigDecimal(stripUnderscores(body));
      return RationalValue.of(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }
    return RationalValue.of(parseInteger(body));
  }

  /** Reads an imaginary literal such as {@code 2i}, {@code 1.5i} or {@code 3ri}. */
  public static ComplexValue parseImaginary(String text) {
    if (!text.endsWith("i")) {
      throw new NumberFormatException("Not an imaginary literal: " + text);
    }
    String body = text.substring(0, text.length() - 1);
    if (body.endsWith("r")) {
      return ComplexValue.imaginary(parseRational(body));
    } else if (isFloat(body)) {
      return ComplexValue.imaginary(parseFloat(body));
    }
    return ComplexValue.imaginary(parseInteger(body));
  }

  private static boolean isFloat(String body) {
    String unsigned = body.startsWith("-") || body.startsWith("+") ? body.substring(1) : body;
    if (unsigned.length() > 1
        && unsigned.charAt(0) == '0'
        && Character.isLetter(unsigned.charAt(1))) {
      return false;
    }
    return unsigned.contains(".") || unsigned.contains("e") || unsigned.contains("E");
  }

  private static String stripUnderscores(String text) {
    if (text.startsWith("_") || text.endsWith("_") || text.contains("__")) {
      throw new NumberFormatException("Misplaced underscore: " + text);
    }
    return text.replace("_", "");
  }

  private NumericLiterals() {}
}
