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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The body of a method, class, module or {@code begin} block, with its optional {@code rescue},
 * {@code else} and {@code ensure} clauses.
 */
public record BodyStmt(
    Statements statements,
    @Nullable Rescue rescueClause,
    @Nullable Kw elseKeyword,
    @Nullable Statements elseClause,
    @Nullable Ensure ensureClause,
    Location location)
    implements Node {

  public BodyStmt {
    checkNotNull(statements, "statements");
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(statements, rescueClause, elseClause, ensureClause);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitBodyStmt(this);
  }

  public boolean isEmpty() {
    return statements.isEmpty()
        && rescueClause == null
        && elseClause == null
        && ensureClause == null;
  }
}
