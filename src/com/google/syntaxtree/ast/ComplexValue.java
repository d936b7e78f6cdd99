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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.math.BigInteger;

/**
 * A complex number whose parts are each a {@link BigInteger}, a {@link Double} or a {@link
 * RationalValue}.
 */
@AutoValue
public abstract class ComplexValue {
  public abstract Object real();

  public abstract Object imaginary();

  public static ComplexValue of(Object real, Object imaginary) {
    checkArgument(isPart(real), "Bad real part: %s", real);
    checkArgument(isPart(imaginary), "Bad imaginary part: %s", imaginary);
    return new AutoValue_ComplexValue(real, imaginary);
  }

  /** Returns the purely imaginary number {@code 0+imaginary*i}. */
  public static ComplexValue imaginary(Object imaginary) {
    return of(BigInteger.ZERO, imaginary);
  }

  private static boolean isPart(Object part) {
    return part instanceof BigInteger || part instanceof Double || part instanceof RationalValue;
  }

  @Override
  public final String toString() {
    Object imaginary = imaginary();
    String sign = "+";
    if (imaginary instanceof BigInteger && ((BigInteger) imaginary).signum() < 0) {
      sign = "-";
      imaginary = ((BigInteger) imaginary).negate();
    } else if (imaginary instanceof Double && ((Double) imaginary) < 0) {
      sign = "-";
      imaginary = -((Double) imaginary);
    } else if (imaginary instanceof RationalValue
        && ((RationalValue) imaginary).numerator().signum() < 0) {
      sign = "-";
      RationalValue rational = (RationalValue) imaginary;
      imaginary = RationalValue.of(rational.numerator().negate(), rational.denominator());
    }
    String suffix = imaginary instanceof RationalValue ? "*i" : "i";
    return "(" + RubyInspect.value(real()) + sign + RubyInspect.value(imaginary) + suffix + ")";
  }
}
