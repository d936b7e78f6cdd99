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
import static com.google.syntaxtree.ast.TargetNode.s;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.sourcemap.SourceMap;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TargetNodeTest {
  private final SourceBuffer buffer = new SourceBuffer("1 + 2");

  @Test
  public void testToString() {
    TargetNode node =
        s(
            NodeType.SEND,
            s(NodeType.INT, BigInteger.ONE),
            Symbol.of("+"),
            s(NodeType.INT, BigInteger.TWO));
    assertThat(node.toString()).isEqualTo("s(:send, s(:int, 1), :+, s(:int, 2))");
    assertThat(s(NodeType.SEND, null, Symbol.of("foo")).toString())
        .isEqualTo("s(:send, nil, :foo)");
    assertThat(s(NodeType.STR, "a\n").toString()).isEqualTo("s(:str, \"a\\n\")");
  }

  @Test
  public void testToStringTree() {
    TargetNode node = s(NodeType.SEND, s(NodeType.INT, BigInteger.ONE), Symbol.of("-@"));
    assertThat(node.toStringTree()).isEqualTo("s(:send,\n  s(:int, 1), :-@)");
  }

  @Test
  public void testEqualityIgnoresLocation() {
    SourceMap map = new SourceMap.Map(new SourceRange(buffer, 0, 1));
    TargetNode located = TargetNode.of(NodeType.INT, ImmutableList.<Object>of(BigInteger.ONE), map);
    TargetNode bare = s(NodeType.INT, BigInteger.ONE);
    assertThat(located).isEqualTo(bare);
    assertThat(located.hashCode()).isEqualTo(bare.hashCode());
    assertThat(located).isNotEqualTo(s(NodeType.INT, BigInteger.TWO));
    assertThat(located).isNotEqualTo(s(NodeType.FLOAT, BigInteger.ONE));
  }

  @Test
  public void testRejectsUnknownChildren() {
    assertThrows(IllegalArgumentException.class, () -> s(NodeType.INT, 1));
    assertThrows(IllegalArgumentException.class, () -> s(NodeType.SYM, new Object()));
  }

  @Test
  public void testChildAccess() {
    TargetNode left = s(NodeType.INT, BigInteger.ONE);
    TargetNode node = s(NodeType.SEND, left, Symbol.of("to_s"));
    assertThat(node.getChildCount()).isEqualTo(2);
    assertThat(node.getChildNode(0)).isSameInstanceAs(left);
    assertThat(node.getChildNodes()).containsExactly(left);
    assertThrows(IllegalArgumentException.class, () -> node.getChildNode(1));
    assertThrows(UnsupportedOperationException.class, () -> node.getChildren().add(null));
  }

  @Test
  public void testUpdated() {
    SourceMap map = new SourceMap.Map(new SourceRange(buffer, 0, 5));
    TargetNode node = TargetNode.of(NodeType.NIL, map);
    TargetNode retyped = node.updated(NodeType.TRUE, null, null);
    assertThat(retyped.getType()).isEqualTo(NodeType.TRUE);
    assertThat(retyped.getLocation()).isSameInstanceAs(map);
    assertThat(node.withLocation(null).getLocation()).isNull();
  }
}
