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

import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.ast.NodeType;
import com.google.syntaxtree.ast.TargetNode;
import com.google.syntaxtree.cst.Heredoc;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Collects the translated segments of one heredoc body and normalizes them into the fragments
 * the parser gem emits: adjacent literal text on one line is merged, and the body of a squiggly
 * heredoc ({@code <<~}) is dedented.
 */
final class HeredocBuilder {
  private final Heredoc node;
  private final List<Segment> segments = new ArrayList<>();

  /** A translated segment. Literal segments carry their text separately so it can be edited. */
  private static final class Segment {
    final TargetNode node;
    final @Nullable StringBuilder text;

    Segment(TargetNode node) {
      this.node = node;
      this.text =
          node.getType() == NodeType.STR ? new StringBuilder((String) node.getChild(0)) : null;
    }

    boolean isLiteral() {
      return text != null;
    }

    TargetNode build() {
      return text == null ? node : node.updated(null, ImmutableList.of(text.toString()), null);
    }
  }

  /** The segments of one physical line, with the literal text seen so far on it. */
  private static final class Line {
    final StringBuilder value = new StringBuilder();
    final List<Segment> segments = new ArrayList<>();
  }

  HeredocBuilder(Heredoc node) {
    this.node = node;
  }

  /** Appends a segment, merging literal text onto a previous literal that has no line break. */
  void add(TargetNode segment) {
    Segment next = new Segment(segment);
    Segment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);
    if (next.isLiteral() && last != null && last.isLiteral() && !endsWith(last.text, "\n")) {
      last.text.append(next.text);
    } else {
      segments.add(next);
    }
  }

  /**
   * Removes the common indentation from the body of a squiggly heredoc. Other heredocs are left
   * alone.
   */
  void trim() {
    String beginning = node.beginning().value();
    if (beginning.length() < 3 || beginning.charAt(2) != '~') {
      return;
    }
    boolean interpolating = beginning.length() < 4 || beginning.charAt(3) != '\'';

    List<Line> lines = new ArrayList<>();
    lines.add(new Line());
    for (Segment segment : segments) {
      Line line = lines.get(lines.size() - 1);
      line.segments.add(segment);
      if (segment.isLiteral()) {
        line.value.append(segment.text);
        if (endsWith(line.value, "\n")) {
          lines.add(new Line());
        }
      }
    }
    if (lines.get(lines.size() - 1).value.length() == 0) {
      lines.remove(lines.size() - 1);
    }
    if (lines.isEmpty()) {
      return;
    }

    segments.clear();
    for (Line line : lines) {
      int remaining = node.dedent();
      for (Segment segment : line.segments) {
        if (!segment.isLiteral()) {
          segments.add(segment);
          continue;
        }
        if (remaining > 0) {
          int stripped = 0;
          while (stripped < remaining
              && stripped < segment.text.length()
              && isIndentation(segment.text.charAt(stripped))) {
            stripped++;
          }
          segment.text.delete(0, stripped);
          remaining -= stripped;
        }

        Segment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);
        if (interpolating && last != null && last.isLiteral() && endsWith(last.text, "\\\n")) {
          last.text.setLength(last.text.length() - 2);
          last.text.append(segment.text);
        } else if (segment.text.length() > 0) {
          segments.add(segment);
        }
      }
    }
  }

  List<TargetNode> getSegments() {
    List<TargetNode> result = new ArrayList<>();
    for (Segment segment : segments) {
      result.add(segment.build());
    }
    return result;
  }

  // Line breaks end a line rather than indent it.
  private static boolean isIndentation(char c) {
    return c == ' ' || c == '\t' || c == '\f' || c == '\u000b' || c == '\r';
  }

  private static boolean endsWith(CharSequence text, String suffix) {
    int offset = text.length() - suffix.length();
    return offset >= 0 && text.subSequence(offset, text.length()).toString().equals(suffix);
  }
}
