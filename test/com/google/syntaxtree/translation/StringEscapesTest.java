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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StringEscapesTest {

  @Test
  public void testPlainTextIsUnchanged() {
    String text = "no escapes here";
    assertThat(StringEscapes.unescape(text)).isSameInstanceAs(text);
  }

  @Test
  public void testSimpleEscapes() {
    assertThat(StringEscapes.unescape("a\\nb\\tc")).isEqualTo("a\nb\tc");
    assertThat(StringEscapes.unescape("\\\\ \\\" \\#")).isEqualTo("\\ \" #");
    assertThat(StringEscapes.unescape("\\s\\e")).isEqualTo(" \u001b");
  }

  @Test
  public void testHexAndUnicode() {
    assertThat(StringEscapes.unescape("\\x41\\x7")).isEqualTo("A\u0007");
    assertThat(StringEscapes.unescape("caf\\u00e9")).isEqualTo("caf\u00e9");
    assertThat(StringEscapes.unescape("\\u{48 69}")).isEqualTo("Hi");
    assertThat(StringEscapes.unescape("\\u{1F600}")).isEqualTo("\uD83D\uDE00");
  }

  @Test
  public void testUnknownEscapesAreKept() {
    assertThat(StringEscapes.unescape("\\q")).isEqualTo("\\q");
    assertThat(StringEscapes.unescape("\\xZ")).isEqualTo("\\xZ");
    assertThat(StringEscapes.unescape("\\u12")).isEqualTo("\\u12");
    assertThat(StringEscapes.unescape("trailing\\")).isEqualTo("trailing\\");
  }

  @Test
  public void testSingleQuotedKeepsOtherEscapes() {
    assertThat(StringEscapes.unescapeSingleQuoted("a\\tb", "'")).isEqualTo("a\\tb");
    assertThat(StringEscapes.unescapeSingleQuoted("it\\'s \\\\", "'")).isEqualTo("it's \\");
    assertThat(StringEscapes.unescapeSingleQuoted("x\\)\\n", "()")).isEqualTo("x)\\n");
    assertThat(StringEscapes.unescapeSingleQuoted("end\\", "'")).isEqualTo("end\\");
  }
}
