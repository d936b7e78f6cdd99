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

import com.google.gson.stream.JsonWriter;
import com.google.syntaxtree.sourcemap.SourceMap;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Writes a target tree as JSON. Each node becomes an object:
 *
 * <pre>
 * {"type": "send",
 *  "children": [{"type": "int", ...}, {"sym": "+"}, {"type": "int", ...}],
 *  "location": {"expression": [0, 5], "selector": [2, 3]}}
 * </pre>
 *
 * <p>Symbols are written as {@code {"sym": name}}, rationals and complex numbers as {@code
 * {"rational": "(3/2)"}} and {@code {"complex": "(0+1i)"}}, so that every scalar keeps its Ruby
 * class. Ranges are {@code [begin, end)} character offsets. A node without a source map has a
 * {@code null} location.
 */
public final class TargetNodeJson {

  public static String toJson(TargetNode node) {
    StringWriter out = new StringWriter();
    write(node, out);
    return out.toString();
  }

  /** Writes {@code node} to {@code out}. The writer is flushed but not closed. */
  public static void write(TargetNode node, Writer out) {
    try {
      JsonWriter jsonWriter = new JsonWriter(out);
      writeNode(jsonWriter, node);
      jsonWriter.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeNode(JsonWriter jsonWriter, TargetNode node) throws IOException {
    jsonWriter.beginObject();
    jsonWriter.name("type").value(node.getType().getName());
    jsonWriter.name("children").beginArray();
    for (Object child : node.getChildren()) {
      writeChild(jsonWriter, child);
    }
    jsonWriter.endArray();
    jsonWriter.name("location");
    SourceMap location = node.getLocation();
    if (location == null) {
      jsonWriter.nullValue();
    } else {
      jsonWriter.beginObject();
      for (Map.Entry<String, SourceRange> entry : location.ranges().entrySet()) {
        jsonWriter.name(entry.getKey()).beginArray();
        jsonWriter.value(entry.getValue().getBeginPos());
        jsonWriter.value(entry.getValue().getEndPos());
        jsonWriter.endArray();
      }
      jsonWriter.endObject();
    }
    jsonWriter.endObject();
  }

  private static void writeChild(JsonWriter jsonWriter, @Nullable Object child)
      throws IOException {
    if (child == null) {
      jsonWriter.nullValue();
    } else if (child instanceof TargetNode) {
      writeNode(jsonWriter, (TargetNode) child);
    } else if (child instanceof Symbol) {
      jsonWriter.beginObject().name("sym").value(((Symbol) child).getName()).endObject();
    } else if (child instanceof String) {
      jsonWriter.value((String) child);
    } else if (child instanceof BigInteger) {
      jsonWriter.value((BigInteger) child);
    } else if (child instanceof Double) {
      double value = (Double) child;
      if (Double.isFinite(value)) {
        jsonWriter.value(value);
      } else {
        jsonWriter.beginObject().name("float").value(RubyInspect.floatValue(value)).endObject();
      }
    } else if (child instanceof RationalValue) {
      jsonWriter.beginObject().name("rational").value(child.toString()).endObject();
    } else if (child instanceof ComplexValue) {
      jsonWriter.beginObject().name("complex").value(child.toString()).endObject();
    } else {
      throw new IllegalArgumentException("Unexpected child value: " + child.getClass());
    }
  }

  private TargetNodeJson() {}
}
