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
public final class SourceMapTest {
  private final SourceBuffer buffer = new SourceBuffer("foo.bar(1)");

  private SourceRange range(int begin, int end) {
    return new SourceRange(buffer, begin, end);
  }

  @Test
  public void testRangesSkipMissingAndPutExpressionFirst() {
    SourceMap.Send send =
        new SourceMap.Send(range(3, 4), range(4, 7), range(7, 8), range(9, 10), range(0, 10));
    assertThat(send.ranges().keySet())
        .containsExactly("expression", "dot", "selector", "begin", "end")
        .inOrder();
    assertThat(send.innerRanges().keySet())
        .containsExactly("dot", "selector", "begin", "end")
        .inOrder();

    SourceMap.Send bare = new SourceMap.Send(null, range(0, 3), null, null, range(0, 3));
    assertThat(bare.ranges().keySet()).containsExactly("expression", "selector").inOrder();
  }

  @Test
  public void testWithExpression() {
    SourceMap.Variable variable = new SourceMap.Variable(range(0, 3), range(0, 3));
    SourceMap widened = variable.withExpression(range(0, 7));
    assertThat(widened).isInstanceOf(SourceMap.Variable.class);
    assertThat(widened.expression()).isEqualTo(range(0, 7));
    assertThat(((SourceMap.Variable) widened).name()).isEqualTo(range(0, 3));
  }

  @Test
  public void testWithOperator() {
    SourceMap.Variable variable = new SourceMap.Variable(range(0, 3), range(0, 3));
    SourceMap assigned = variable.withOperator(range(4, 5));
    assertThat(assigned.ranges()).containsEntry("operator", range(4, 5));

    SourceMap map = new SourceMap.Map(range(0, 3));
    assertThrows(UnsupportedOperationException.class, () -> map.withOperator(range(4, 5)));
  }

  @Test
  public void testHeredocHasNoInnerRanges() {
    SourceMap.Heredoc heredoc = new SourceMap.Heredoc(range(0, 3), range(4, 8), range(8, 10));
    assertThat(heredoc.ranges().keySet())
        .containsExactly("expression", "heredoc_body", "heredoc_end")
        .inOrder();
    assertThat(heredoc.innerRanges()).isEmpty();
  }

  @Test
  public void testMapWithoutExpression() {
    assertThat(new SourceMap.Map(null).ranges()).isEmpty();
  }
}
