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
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A hash pattern, as in {@code in { key: value }}. */
public record HshPtn(
    @Nullable Node constant,
    List<HshPtn.Entry> keywords,
    @Nullable Node keywordRest,
    Location location)
    implements Node {

  public HshPtn {
    keywords = ImmutableList.copyOf(keywords);
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(constant, keywords, keywordRest);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitHshPtn(this);
  }

  /** A key of a hash pattern, with the pattern its value must match when there is one. */
  public record Entry(Node key, @Nullable Node value) implements NodeGroup {
    public Entry {
      checkNotNull(key, "key");
    }

    @Override
    public List<@Nullable Node> nodes() {
      return Arrays.asList(key, value);
    }
  }
}
