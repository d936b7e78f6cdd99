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

import static com.google.common.truth.Truth.assertThat;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RubyInspectTest {

  @Test
  public void testFloats() {
    assertThat(RubyInspect.floatValue(1.0)).isEqualTo("1.0");
    assertThat(RubyInspect.floatValue(1.5)).isEqualTo("1.5");
    assertThat(RubyInspect.floatValue(-0.0)).isEqualTo("-0.0");
    assertThat(RubyInspect.floatValue(100.0)).isEqualTo("100.0");
    assertThat(RubyInspect.floatValue(1e20)).isEqualTo("1.0e+20");
    assertThat(RubyInspect.floatValue(1.5e-7)).isEqualTo("1.5e-07");
    assertThat(RubyInspect.floatValue(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    assertThat(RubyInspect.floatValue(Double.NaN)).isEqualTo("NaN");
  }

  @Test
  public void testStrings() {
    assertThat(RubyInspect.string("abc")).isEqualTo("\"abc\"");
    assertThat(RubyInspect.string("a\nb")).isEqualTo("\"a\\nb\"");
    assertThat(RubyInspect.string("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
    assertThat(RubyInspect.string("#{x} #y")).isEqualTo("\"\\#{x} #y\"");
    assertThat(RubyInspect.string("\u0001")).isEqualTo("\"\\x01\"");
  }

  @Test
  public void testValues() {
    assertThat(RubyInspect.value(null)).isEqualTo("nil");
    assertThat(RubyInspect.value(BigInteger.TEN)).isEqualTo("10");
    assertThat(RubyInspect.value(Symbol.of("a"))).isEqualTo(":a");
  }
}
