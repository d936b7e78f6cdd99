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

/** An index used as an assignment target, as in {@code collection[index] = value}. */
public record ARefField(
    Node collection,
    @Nullable Args index,
    Location location)
    implements Node {

  public ARefField {
    checkNotNull(collection, "collection");
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(collection, index);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitARefField(this);
  }
}
