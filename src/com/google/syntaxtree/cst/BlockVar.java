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

/** The parameters declared between pipes at the start of a block. */
public record BlockVar(
    Params params,
    List<Ident> locals,
    Location location)
    implements Node {

  public BlockVar {
    checkNotNull(params, "params");
    locals = ImmutableList.copyOf(locals);
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(params, locals);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitBlockVar(this);
  }

  /**
   * Whether the block declares exactly one required parameter and nothing else, in which case an
   * array passed to the block may be destructured into it.
   */
  public boolean isArg0() {
    return params.requireds().size() == 1
        && params.optionals().isEmpty()
        && params.rest() == null
        && params.posts().isEmpty()
        && params.keywords().isEmpty()
        && params.keywordRest() == null
        && params.block() == null;
  }
}
