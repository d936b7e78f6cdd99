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

package com.google.syntaxtree.cst;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceBufferTest {

  @Test
  public void testLinesAndColumns() {
    SourceBuffer buffer = new SourceBuffer("foo\nbar\n\nbaz");
    assertThat(buffer.getName()).isEqualTo(SourceBuffer.DEFAULT_NAME);
    assertThat(buffer.getNumLines()).isEqualTo(4);
    assertThat(buffer.getLineOffset(2)).isEqualTo(4);
    assertThat(buffer.getLineOffset(4)).isEqualTo(9);

    assertThat(buffer.getLineOfOffset(0)).isEqualTo(1);
    assertThat(buffer.getLineOfOffset(3)).isEqualTo(1);
    assertThat(buffer.getLineOfOffset(4)).isEqualTo(2);
    assertThat(buffer.getLineOfOffset(8)).isEqualTo(3);
    assertThat(buffer.getLineOfOffset(11)).isEqualTo(4);

    assertThat(buffer.getColumnOfOffset(0)).isEqualTo(0);
    assertThat(buffer.getColumnOfOffset(6)).isEqualTo(2);
    assertThat(buffer.getColumnOfOffset(12)).isEqualTo(3);
  }

  @Test
  public void testFirstLine() {
    SourceBuffer buffer = new SourceBuffer("fragment.rb", 10, "a\nb");
    assertThat(buffer.getName()).isEqualTo("fragment.rb");
    assertThat(buffer.getLineOfOffset(0)).isEqualTo(10);
    assertThat(buffer.getLineOfOffset(2)).isEqualTo(11);
    assertThat(buffer.getLineOffset(2)).isEqualTo(2);
  }

  @Test
  public void testSliceIsClamped() {
    SourceBuffer buffer = new SourceBuffer("hello");
    assertThat(buffer.slice(1, 3)).isEqualTo("el");
    assertThat(buffer.slice(-2, 2)).isEqualTo("he");
    assertThat(buffer.slice(3, 99)).isEqualTo("lo");
    assertThat(buffer.slice(4, 2)).isEmpty();
    assertThat(buffer.slice(10, 12)).isEmpty();
  }

  @Test
  public void testBadLineNumber() {
    SourceBuffer buffer = new SourceBuffer("x");
    assertThrows(IllegalArgumentException.class, () -> buffer.getLineOffset(0));
    assertThrows(IllegalArgumentException.class, () -> buffer.getLineOffset(2));
  }

  @Test
  public void testLocationJoin() {
    Location first = Location.create(1, 0, 0, 1, 3, 3);
    Location second = Location.create(2, 4, 0, 2, 7, 3);
    Location joined = first.to(second);
    assertThat(joined.startChar()).isEqualTo(0);
    assertThat(joined.endChar()).isEqualTo(7);
    assertThat(joined.endLine()).isEqualTo(2);
    assertThrows(IllegalArgumentException.class, () -> Location.create(1, 5, 5, 1, 2, 2));
  }
}
