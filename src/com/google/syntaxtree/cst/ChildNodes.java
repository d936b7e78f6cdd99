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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Builds the child lists that nodes report from {@link Node#childNodes()}. */
final class ChildNodes {

  /**
   * Flattens the given parts, in order, into a list of nodes. A part is a node, {@code null},
   * a {@link NodeGroup} or a list of any of those.
   */
  static List<@Nullable Node> of(@Nullable Object... parts) {
    List<@Nullable Node> children = new ArrayList<>();
    for (Object part : parts) {
      add(children, part);
    }
    return Collections.unmodifiableList(children);
  }

  private static void add(List<@Nullable Node> children, @Nullable Object part) {
    if (part == null || part instanceof Node) {
      children.add((Node) part);
    } else if (part instanceof NodeGroup) {
      children.addAll(((NodeGroup) part).nodes());
    } else if (part instanceof List) {
      for (Object element : (List<?>) part) {
        add(children, element);
      }
    } else {
      throw new IllegalArgumentException("Not a child node: " + part);
    }
  }

  private ChildNodes() {}
}
