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
import static org.junit.Assert.assertThrows;

import com.google.syntaxtree.cst.Ident;
import com.google.syntaxtree.sourcemap.SourceRange;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceRangesTest {
  private final CstFixture f = new CstFixture("a = b = c");
  private final SourceRanges ranges = new SourceRanges(f.buffer());

  @Test
  public void testSearchStaysWithinWindow() {
    SourceRange second = ranges.search(4, 9, "=");
    assertThat(second.getBeginPos()).isEqualTo(6);
    assertThat(second.getEndPos()).isEqualTo(7);
    assertThat(ranges.search(0, 1, "=")).isNull();
    assertThat(ranges.search(20, 30, "=")).isNull();
  }

  @Test
  public void testFindReportsWindow() {
    TranslationException e =
        assertThrows(TranslationException.class, () -> ranges.find(0, 5, "c"));
    assertThat(e).hasMessageThat().isEqualTo("Could not find \"c\" in \"a = b\"");
  }

  @Test
  public void testBetweenNodes() {
    Ident a = f.ident("a");
    Ident b = f.ident("b");
    Ident c = f.ident("c");
    assertThat(ranges.findBetween(a, b, "=").getBeginPos()).isEqualTo(2);
    assertThat(ranges.findBetween(b, c, "=").getBeginPos()).isEqualTo(6);
    assertThat(ranges.searchBetween(a, a, "=")).isNull();
    assertThat(ranges.of(c).getSource()).isEqualTo("c");
  }

  @Test
  public void testAt() {
    assertThat(ranges.at(4, 1).getSource()).isEqualTo("b");
    assertThat(ranges.at(5, -3).getSource()).isEqualTo("= b");
    assertThat(ranges.findFrom(3, "=").getBeginPos()).isEqualTo(6);
  }
}
