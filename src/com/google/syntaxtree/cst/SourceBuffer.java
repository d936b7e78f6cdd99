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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Arrays;

/**
 * The source text a tree was parsed from. Instances never change after construction, so one
 * buffer can back any number of concurrent translations.
 */
@Immutable
public final class SourceBuffer {

  /** The name used for buffers that did not come from a file. */
  public static final String DEFAULT_NAME = "(string)";

  private final String name;
  private final String source;
  private final int firstLine;

  @SuppressWarnings("Immutable") // never written after the constructor
  private final int[] lineOffsets;

  public SourceBuffer(String source) {
    this(DEFAULT_NAME, 1, source);
  }

  public SourceBuffer(String name, String source) {
    this(name, 1, source);
  }

  /**
   * @param name the display name, reported by {@code __FILE__}
   * @param firstLine the line number of the first line of {@code source}, for buffers that are a
   *     fragment of a larger file
   * @param source the text
   */
  public SourceBuffer(String name, int firstLine, String source) {
    this.name = checkNotNull(name);
    this.source = checkNotNull(source);
    this.firstLine = firstLine;
    this.lineOffsets = findLineOffsets(source);
  }

  private static int[] findLineOffsets(String source) {
    int[] offsets = new int[16];
    int count = 1; // the first line always starts at offset 0
    int offset = 0;
    while ((offset = source.indexOf('\n', offset)) != -1) {
      // +1 because this is the offset of the next line which is one past the newline
      offset++;
      if (count == offsets.length) {
        offsets = Arrays.copyOf(offsets, count * 2);
      }
      offsets[count++] = offset;
    }
    return Arrays.copyOf(offsets, count);
  }

  public String getName() {
    return name;
  }

  public String getSource() {
    return source;
  }

  public int getFirstLine() {
    return firstLine;
  }

  public int length() {
    return source.length();
  }

  public char charAt(int offset) {
    return source.charAt(offset);
  }

  /** Returns the text between the two offsets, clamped to the buffer. */
  public String slice(int start, int end) {
    int from = Math.max(0, Math.min(start, source.length()));
    int to = Math.max(from, Math.min(end, source.length()));
    return source.substring(from, to);
  }

  /** Returns the number of lines in the buffer. */
  public int getNumLines() {
    return lineOffsets.length;
  }

  /**
   * Returns the offset of the start of the given 1-based line, counted from the start of the
   * buffer regardless of {@link #getFirstLine()}.
   */
  public int getLineOffset(int lineno) {
    checkArgument(
        lineno >= 1 && lineno <= lineOffsets.length,
        "Expected line number between 1 and %s\nActual: %s",
        lineOffsets.length,
        lineno);
    return lineOffsets[lineno - 1];
  }

  /** Gets the line number of the given offset, taking {@link #getFirstLine()} into account. */
  public int getLineOfOffset(int offset) {
    return lineIndexOf(offset) + firstLine;
  }

  /** Gets the 0-based column of the given offset. */
  public int getColumnOfOffset(int offset) {
    return offset - lineOffsets[lineIndexOf(offset)];
  }

  private int lineIndexOf(int offset) {
    int search = Arrays.binarySearch(lineOffsets, offset);
    if (search >= 0) {
      return search;
    }
    // binarySearch returns (-insertionPoint - 1); the line is the one before the insertion point.
    return -search - 2;
  }

  @Override
  public String toString() {
    return name;
  }
}
