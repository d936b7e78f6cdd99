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

import com.google.auto.value.AutoValue;

/**
 * The span of an origin node in its source buffer. Lines are 1-based, columns and character
 * offsets 0-based, and the end offsets are exclusive.
 */
@AutoValue
public abstract class Location {

  public static Location create(
      int startLine, int startChar, int startColumn, int endLine, int endChar, int endColumn) {
    checkArgument(
        startChar <= endChar, "Recorded bad position information: %s > %s", startChar, endChar);
    return new AutoValue_Location(startLine, startChar, startColumn, endLine, endChar, endColumn);
  }

  public abstract int startLine();

  public abstract int startChar();

  public abstract int startColumn();

  public abstract int endLine();

  public abstract int endChar();

  public abstract int endColumn();

  /** Returns a location from the start of this one to the end of {@code other}. */
  public final Location to(Location other) {
    return create(
        startLine(),
        startChar(),
        startColumn(),
        other.endLine(),
        other.endChar(),
        other.endColumn());
  }
}
