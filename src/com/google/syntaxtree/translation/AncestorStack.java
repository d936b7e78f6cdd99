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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.syntaxtree.cst.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The chain of origin nodes from the root down to the node being translated. The translator
 * pushes a node before visiting it and pops it afterwards, so rules can look at their parent and
 * grandparent.
 */
final class AncestorStack {
  private final List<Node> nodes = new ArrayList<>();

  void push(Node node) {
    nodes.add(node);
  }

  Node pop() {
    checkState(!nodes.isEmpty(), "Popped an empty ancestor stack");
    return nodes.remove(nodes.size() - 1);
  }

  /**
   * Returns the node {@code depth} levels above the current one: 0 is the current node, 1 its
   * parent. Returns null past the root.
   */
  @Nullable Node peek(int depth) {
    checkArgument(depth >= 0, "Negative depth: %s", depth);
    int index = nodes.size() - 1 - depth;
    return index >= 0 ? nodes.get(index) : null;
  }

  int size() {
    return nodes.size();
  }

  boolean isEmpty() {
    return nodes.isEmpty();
  }
}
