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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.syntaxtree.sourcemap.SourceMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the parser gem's abstract syntax tree.
 *
 * <p>Nodes are immutable. Two nodes are equal when their types and children are equal; the
 * source map takes no part in equality, so trees built from different source text can still be
 * compared structurally. Compare maps through {@link #getLocation()}.
 *
 * <p>Children are other nodes, {@link Symbol}s, {@link String}s, {@link BigInteger}s, {@link
 * Double}s, {@link RationalValue}s, {@link ComplexValue}s or {@code null}.
 */
public final class TargetNode {
  private final NodeType type;
  private final List<@Nullable Object> children;
  private final @Nullable SourceMap location;

  private TargetNode(NodeType type, List<@Nullable Object> children, @Nullable SourceMap location) {
    this.type = checkNotNull(type);
    for (Object child : children) {
      checkArgument(
          child == null
              || child instanceof TargetNode
              || child instanceof Symbol
              || child instanceof String
              || child instanceof BigInteger
              || child instanceof Double
              || child instanceof RationalValue
              || child instanceof ComplexValue,
          "Unexpected child of %s: %s",
          type,
          child);
    }
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
    this.location = location;
  }

  public static TargetNode of(
      NodeType type, List<@Nullable Object> children, @Nullable SourceMap location) {
    return new TargetNode(type, children, location);
  }

  public static TargetNode of(NodeType type, @Nullable SourceMap location) {
    return new TargetNode(type, Collections.emptyList(), location);
  }

  /** Builds a node without a source map, mainly for writing expected trees. */
  public static TargetNode s(NodeType type, @Nullable Object... children) {
    return new TargetNode(type, Arrays.asList(children), null);
  }

  public NodeType getType() {
    return type;
  }

  public List<@Nullable Object> getChildren() {
    return children;
  }

  public @Nullable Object getChild(int index) {
    return children.get(index);
  }

  /** Returns the child at {@code index}, which must be a node. */
  public TargetNode getChildNode(int index) {
    Object child = children.get(index);
    checkArgument(child instanceof TargetNode, "Child %s of %s is not a node", index, type);
    return (TargetNode) child;
  }

  public int getChildCount() {
    return children.size();
  }

  public @Nullable SourceMap getLocation() {
    return location;
  }

  /** Returns a copy of this node with some of its parts replaced. Null arguments keep the part. */
  public TargetNode updated(
      @Nullable NodeType type,
      @Nullable List<@Nullable Object> children,
      @Nullable SourceMap location) {
    return new TargetNode(
        type != null ? type : this.type,
        children != null ? children : this.children,
        location != null ? location : this.location);
  }

  public TargetNode withLocation(@Nullable SourceMap location) {
    return new TargetNode(type, children, location);
  }

  /** Returns every node child, skipping scalars and nils. */
  public List<TargetNode> getChildNodes() {
    List<TargetNode> nodes = new ArrayList<>();
    for (Object child : children) {
      if (child instanceof TargetNode) {
        nodes.add((TargetNode) child);
      }
    }
    return nodes;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TargetNode)) {
      return false;
    }
    TargetNode that = (TargetNode) o;
    return type == that.type && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + children.hashCode();
  }

  /** Renders the node on one line, for example {@code s(:send, s(:int, 1), :+, s(:int, 2))}. */
  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    parts.add(":" + type.getName());
    for (Object child : children) {
      parts.add(RubyInspect.value(child));
    }
    return "s(" + Joiner.on(", ").join(parts) + ")";
  }

  /** Renders the node with one nested node per line, the way the parser gem's inspect does. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int indent) {
    sb.append("  ".repeat(indent)).append("s(:").append(type.getName());
    for (Object child : children) {
      if (child instanceof TargetNode) {
        sb.append(",\n");
        ((TargetNode) child).appendTree(sb, indent + 1);
      } else {
        sb.append(", ").append(RubyInspect.value(child));
      }
    }
    sb.append(')');
  }
}
