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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.syntaxtree.cst.Location;
import com.google.syntaxtree.cst.Node;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.sourcemap.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * Builds {@link SourceRange}s over one buffer, either from origin node locations or by locating
 * tokens in the text between nodes.
 */
final class SourceRanges {
  private final SourceBuffer buffer;

  SourceRanges(SourceBuffer buffer) {
    this.buffer = checkNotNull(buffer);
  }

  SourceBuffer getBuffer() {
    return buffer;
  }

  SourceRange range(int start, int end) {
    return new SourceRange(buffer, start, end);
  }

  SourceRange of(Node node) {
    return of(node.location());
  }

  SourceRange of(Location location) {
    return range(location.startChar(), location.endChar());
  }

  /**
   * Returns the range of {@code length} characters starting at {@code start}, or for a negative
   * length the {@code -length} characters that end at {@code start}.
   */
  SourceRange at(int start, int length) {
    return length > 0 ? range(start, start + length) : range(start + length, start);
  }

  /** Returns the first occurrence of {@code needle} in {@code [start, end)}, or null. */
  @Nullable SourceRange search(int start, int end, String needle) {
    if (start < 0 || start > buffer.length()) {
      return null;
    }
    int index = buffer.slice(start, end).indexOf(needle);
    if (index < 0) {
      return null;
    }
    return at(start + index, needle.length());
  }

  /** Like {@link #search}, but a missing needle is an error. */
  SourceRange find(int start, int end, String needle) {
    SourceRange range = search(start, end, needle);
    if (range == null) {
      throw new TranslationException(
          "Could not find " + quote(needle) + " in " + quote(buffer.slice(start, end)));
    }
    return range;
  }

  /** Searches the gap between the end of {@code before} and the start of {@code after}. */
  @Nullable SourceRange searchBetween(Node before, Node after, String needle) {
    return search(before.endChar(), after.startChar(), needle);
  }

  SourceRange findBetween(Node before, Node after, String needle) {
    return find(before.endChar(), after.startChar(), needle);
  }

  /** Searches from {@code start} to the end of the buffer. */
  SourceRange findFrom(int start, String needle) {
    return find(start, buffer.length(), needle);
  }

  private static String quote(String text) {
    return "\""
        + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t")
        + "\"";
  }
}
