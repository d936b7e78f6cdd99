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

/** An exact fraction, always stored in lowest terms with a positive denominator. */
@AutoValue
public abstract class RationalValue {
  public abstract BigInteger numerator();

  public abstract BigInteger denominator();

  public static RationalValue of(BigInteger numerator, BigInteger denominator) {
    checkArgument(denominator.signum() != 0, "Zero denominator");
    BigInteger gcd = numerator.gcd(denominator);
    if (gcd.signum() == 0) {
      gcd = BigInteger.ONE;
    }
    if (denominator.signum() < 0) {
      gcd = gcd.negate();
    }
    return new AutoValue_RationalValue(numerator.divide(gcd), denominator.divide(gcd));
  }

  public static RationalValue of(BigInteger integer) {
    return of(integer, BigInteger.ONE);
  }

  @Override
  public final String toString() {
    return "(" + numerator() + "/" + denominator() + ")";
  }
}
