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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.sourcemap.SourceMap;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.math.BigInteger;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TargetNodeJsonTest {

  @Test
  public void testLocatedSend() {
    SourceBuffer buffer = new SourceBuffer("foo.bar");
    TargetNode receiver =
        TargetNode.of(
            NodeType.SEND,
            Arrays.<Object>asList(null, Symbol.of("foo")),
            new SourceMap.Send(
                null,
                new SourceRange(buffer, 0, 3),
                null,
                null,
                new SourceRange(buffer, 0, 3)));
    TargetNode send =
        TargetNode.of(
            NodeType.SEND,
            Arrays.<Object>asList(receiver, Symbol.of("bar")),
            new SourceMap.Send(
                new SourceRange(buffer, 3, 4),
                new SourceRange(buffer, 4, 7),
                null,
                null,
                new SourceRange(buffer, 0, 7)));

    JsonObject json = JsonParser.parseString(TargetNodeJson.toJson(send)).getAsJsonObject();

    assertThat(json.get("type").getAsString()).isEqualTo("send");
    JsonArray children = json.getAsJsonArray("children");
    assertThat(children.size()).isEqualTo(2);
    assertThat(children.get(1).getAsJsonObject().get("sym").getAsString()).isEqualTo("bar");
    JsonObject inner = children.get(0).getAsJsonObject();
    assertThat(inner.getAsJsonArray("children").get(0).isJsonNull()).isTrue();

    JsonObject location = json.getAsJsonObject("location");
    assertThat(location.keySet()).containsExactly("expression", "dot", "selector").inOrder();
    assertThat(location.getAsJsonArray("dot").get(0).getAsInt()).isEqualTo(3);
    assertThat(location.getAsJsonArray("dot").get(1).getAsInt()).isEqualTo(4);
    assertThat(location.getAsJsonArray("expression").get(1).getAsInt()).isEqualTo(7);
  }

  @Test
  public void testScalars() {
    TargetNode node =
        s(
            NodeType.ARRAY,
            s(NodeType.STR, "a\"b"),
            s(NodeType.INT, new BigInteger("123456789012345678901234567890")),
            s(NodeType.FLOAT, 1.5),
            s(NodeType.FLOAT, Double.POSITIVE_INFINITY),
            s(NodeType.RATIONAL, RationalValue.of(BigInteger.valueOf(3), BigInteger.TWO)),
            s(NodeType.COMPLEX, ComplexValue.imaginary(BigInteger.TWO)));

    JsonObject json = JsonParser.parseString(TargetNodeJson.toJson(node)).getAsJsonObject();

    assertThat(json.get("location").isJsonNull()).isTrue();
    JsonArray children = json.getAsJsonArray("children");
    assertThat(firstChild(children, 0).getAsString()).isEqualTo("a\"b");
    assertThat(firstChild(children, 1).getAsBigInteger())
        .isEqualTo(new BigInteger("123456789012345678901234567890"));
    assertThat(firstChild(children, 2).getAsDouble()).isEqualTo(1.5);
    assertThat(firstChild(children, 3).getAsJsonObject().get("float").getAsString())
        .isEqualTo("Infinity");
    assertThat(firstChild(children, 4).getAsJsonObject().get("rational").getAsString())
        .isEqualTo("(3/2)");
    assertThat(firstChild(children, 5).getAsJsonObject().get("complex").getAsString())
        .isEqualTo("(0+2i)");
  }

  @Test
  public void testEmptyChildren() {
    TargetNode node = TargetNode.of(NodeType.NIL, ImmutableList.of(), null);
    assertThat(TargetNodeJson.toJson(node))
        .isEqualTo("{\"type\":\"nil\",\"children\":[],\"location\":null}");
  }

  private static JsonElement firstChild(JsonArray children, int index) {
    return children.get(index).getAsJsonObject().getAsJsonArray("children").get(0);
  }
}
