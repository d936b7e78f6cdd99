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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A heredoc string literal. The dedent is the amount of leading whitespace the parser computed for
 * a squiggly heredoc.
 */
public record Heredoc(
    HeredocBeg beginning,
    HeredocEnd ending,
    int dedent,
    List<Node> parts,
    Location location)
    implements Node {

  public Heredoc {
    checkNotNull(beginning, "beginning");
    checkNotNull(ending, "ending");
    parts = ImmutableList.copyOf(parts);
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(beginning, parts);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitHeredoc(this);
  }
}
