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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import com.google.syntaxtree.cst.SourceBuffer;
import org.jspecify.annotations.Nullable;

/**
 * A half-open span of characters, {@code [beginPos, endPos)}, in a {@link SourceBuffer}.
 *
 * <p>Ranges compare equal when they cover the same characters of the same buffer.
 */
@Immutable
public final class SourceRange {
  private final SourceBuffer buffer;
  private final int beginPos;
  private final int endPos;

  public SourceRange(SourceBuffer buffer, int beginPos, int endPos) {
    checkNotNull(buffer);
    checkArgument(
        0 <= beginPos && beginPos <= endPos,
        "Recorded bad position information\nbegin: %s\nend: %s",
        beginPos,
        endPos);
    this.buffer = buffer;
    this.beginPos = beginPos;
    this.endPos = endPos;
  }

  public SourceBuffer getBuffer() {
    return buffer;
  }

  public int getBeginPos() {
    return beginPos;
  }

  public int getEndPos() {
    return endPos;
  }

  public int size() {
    return endPos - beginPos;
  }

  public boolean isEmpty() {
    return beginPos == endPos;
  }

  /** Returns the text this range covers. */
  public String getSource() {
    return buffer.slice(beginPos, endPos);
  }

  /** Returns the line the range begins on. */
  public int getLine() {
    return buffer.getLineOfOffset(beginPos);
  }

  /** Returns the 0-based column the range begins at. */
  public int getColumn() {
    return buffer.getColumnOfOffset(beginPos);
  }

  /** Returns the line the range ends on. */
  public int getLastLine() {
    return buffer.getLineOfOffset(endPos);
  }

  /** Returns the 0-based column the range ends at. */
  public int getLastColumn() {
    return buffer.getColumnOfOffset(endPos);
  }

  /** Returns the smallest range that covers both this range and {@code other}. */
  public SourceRange join(SourceRange other) {
    checkArgument(other.buffer == buffer, "Cannot join ranges of different buffers");
    return new SourceRange(
        buffer, Math.min(beginPos, other.beginPos), Math.max(endPos, other.endPos));
  }

  /** Returns a range of the same buffer with the given bounds. */
  public SourceRange with(int beginPos, int endPos) {
    return new SourceRange(buffer, beginPos, endPos);
  }

  /** Whether {@code other} lies entirely within this range. */
  public boolean contains(SourceRange other) {
    return other.buffer == buffer && beginPos <= other.beginPos && other.endPos <= endPos;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof SourceRange)) {
      return false;
    }
    SourceRange that = (SourceRange) o;
    return buffer == that.buffer && beginPos == that.beginPos && endPos == that.endPos;
  }

  @Override
  public int hashCode() {
    return 31 * beginPos + endPos;
  }

  @Override
  public String toString() {
    return "#<Source::Range " + buffer.getName() + " " + beginPos + "..." + endPos + ">";
  }
}
