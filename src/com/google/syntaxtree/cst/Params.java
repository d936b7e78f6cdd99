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

/** The parameters of a method, block or lambda. */
public record Params(
    List<Node> requireds,
    List<Params.OptionalParam> optionals,
    @Nullable Node rest,
    List<Node> posts,
    List<Params.KeywordParam> keywords,
    @Nullable Node keywordRest,
    @Nullable BlockArg block,
    Location location)
    implements Node {

  public Params {
    requireds = ImmutableList.copyOf(requireds);
    optionals = ImmutableList.copyOf(optionals);
    posts = ImmutableList.copyOf(posts);
    keywords = ImmutableList.copyOf(keywords);
    checkNotNull(location, "location");
  }

  @Override
  public List<@Nullable Node> childNodes() {
    return ChildNodes.of(requireds, optionals, rest, posts, keywords, keywordRest, block);
  }

  @Override
  public <R extends @Nullable Object> R accept(Visitor<R> visitor) {
    return visitor.visitParams(this);
  }

  public boolean isEmpty() {
    return requireds.isEmpty()
        && optionals.isEmpty()
        && rest == null
        && posts.isEmpty()
        && keywords.isEmpty()
        && keywordRest == null
        && block == null;
  }

  /** An optional positional parameter, as in {@code name = value}. */
  public record OptionalParam(Ident name, Node value) implements NodeGroup {
    public OptionalParam {
      checkNotNull(name, "name");
      checkNotNull(value, "value");
    }

    @Override
    public List<@Nullable Node> nodes() {
      return Arrays.asList(name, value);
    }
  }

  /** A keyword parameter, with its default value when it has one. */
  public record KeywordParam(Label name, @Nullable Node value) implements NodeGroup {
    public KeywordParam {
      checkNotNull(name, "name");
    }

    @Override
    public List<@Nullable Node> nodes() {
      return Arrays.asList(name, value);
    }
  }
}
