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

package com.google.syntaxtree.sourcemap;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.syntaxtree.cst.SourceBuffer;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceRangeTest {
  private final SourceBuffer buffer = new SourceBuffer("foo.rb", "def foo\n  bar\nend");

  @Test
  public void testSourceAndPosition() {
    SourceRange range = new SourceRange(buffer, 10, 13);
    assertThat(range.getSource()).isEqualTo("bar");
    assertThat(range.size()).isEqualTo(3);
    assertThat(range.isEmpty()).isFalse();
    assertThat(range.getLine()).isEqualTo(2);
    assertThat(range.getColumn()).isEqualTo(2);
    assertThat(range.getLastLine()).isEqualTo(2);
    assertThat(range.getLastColumn()).isEqualTo(5);
    assertThat(range.toString()).isEqualTo("#<Source::Range foo.rb 10...13>");
  }

  @Test
  public void testMultiLineRange() {
    SourceRange range = new SourceRange(buffer, 0, buffer.length());
    assertThat(range.getLine()).isEqualTo(1);
    assertThat(range.getLastLine()).isEqualTo(3);
    assertThat(range.getLastColumn()).isEqualTo(3);
  }

  @Test
  public void testJoinAndContains() {
    SourceRange def = new SourceRange(buffer, 0, 3);
    SourceRange end = new SourceRange(buffer, 14, 17);
    SourceRange joined = end.join(def);
    assertThat(joined).isEqualTo(new SourceRange(buffer, 0, 17));
    assertThat(joined.contains(def)).isTrue();
    assertThat(joined.contains(end)).isTrue();
    assertThat(def.contains(joined)).isFalse();
    assertThat(def.with(4, 7).getSource()).isEqualTo("foo");
  }

  @Test
  public void testRangesOfDifferentBuffers() {
    SourceBuffer other = new SourceBuffer("foo.rb", "def foo\n  bar\nend");
    SourceRange first = new SourceRange(buffer, 0, 3);
    SourceRange second = new SourceRange(other, 0, 3);
    assertThat(first).isNotEqualTo(second);
    assertThat(first.contains(second)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> first.join(second));
  }

  @Test
  public void testBadBounds() {
    assertThrows(IllegalArgumentException.class, () -> new SourceRange(buffer, 3, 2));
    assertThrows(IllegalArgumentException.class, () -> new SourceRange(buffer, -1, 2));
  }
}
