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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the concrete syntax tree produced by the Syntax Tree parser. The set of
 * implementations is closed: every one of them has a method on {@link Visitor}, so a visitor
 * that compiles handles every kind of node.
 *
 * <p>Nodes are immutable and may be shared across threads.
 */
public interface Node {

  Location location();

  /**
   * Returns the direct children of this node in source order. Absent optional children are
   * reported as {@code null} entries.
   */
  List<@Nullable Node> childNodes();

  <R extends @Nullable Object> R accept(Visitor<R> visitor);

  default int startChar() {
    return location().startChar();
  }

  default int endChar() {
    return location().endChar();
  }
}
