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

package com.google.syntaxtree.sourcemap;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The location information of a target node: the range of the whole node plus the ranges of the
 * tokens that make it up. Each category of node has its own shape, named after the source maps of
 * the parser gem ({@code Parser::Source::Map::Send} is {@link Send}, and so on).
 *
 * <p>Field names in {@link #ranges()} use the parser gem's spelling, such as {@code
 * double_colon}.
 */
public sealed interface SourceMap
    permits SourceMap.Map,
        SourceMap.Collection,
        SourceMap.Condition,
        SourceMap.Constant,
        SourceMap.Definition,
        SourceMap.For,
        SourceMap.Heredoc,
        SourceMap.Index,
        SourceMap.Keyword,
        SourceMap.MethodDefinition,
        SourceMap.Operator,
        SourceMap.RescueBody,
        SourceMap.Send,
        SourceMap.Ternary,
        SourceMap.Variable {

  /** The range of the whole node, or {@code null} for nodes with no text of their own. */
  @Nullable SourceRange expression();

  SourceMap withExpression(@Nullable SourceRange expression);

  /**
   * Returns a copy with the given operator range. Only the maps of assignable nodes have an
   * operator.
   */
  default SourceMap withOperator(@Nullable SourceRange operator) {
    throw new UnsupportedOperationException(
        getClass().getSimpleName() + " source maps have no operator");
  }

  /** Returns every populated range, keyed by field name, the expression first. */
  ImmutableMap<String, SourceRange> ranges();

  /**
   * Returns the populated ranges that must lie within the expression. For most maps that is
   * every range but the expression itself.
   */
  default ImmutableMap<String, SourceRange> innerRanges() {
    ImmutableMap.Builder<String, SourceRange> inner = ImmutableMap.builder();
    ranges().forEach(
        (name, range) -> {
          if (!name.equals("expression")) {
            inner.put(name, range);
          }
        });
    return inner.buildOrThrow();
  }

  private static ImmutableMap<String, SourceRange> named(@Nullable Object... namesAndRanges) {
    ImmutableMap.Builder<String, SourceRange> ranges = ImmutableMap.builder();
    for (int i = 0; i < namesAndRanges.length; i += 2) {
      SourceRange range = (SourceRange) namesAndRanges[i + 1];
      if (range != null) {
        ranges.put((String) namesAndRanges[i], range);
      }
    }
    return ranges.buildOrThrow();
  }

  /** A node described by its expression alone. */
  record Map(@Nullable SourceRange expression) implements SourceMap {
    @Override
    public Map withExpression(@Nullable SourceRange expression) {
      return new Map(expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named("expression", expression);
    }
  }

  /** Arrays, hashes, strings, parenthesized expressions and argument lists. */
  record Collection(
      @Nullable SourceRange begin, @Nullable SourceRange end, @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public Collection withExpression(@Nullable SourceRange expression) {
      return new Collection(begin, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named("expression", expression, "begin", begin, "end", end);
    }
  }

  /** Conditionals, {@code case} and {@code rescue}. */
  record Condition(
      @Nullable SourceRange keyword,
      @Nullable SourceRange begin,
      @Nullable SourceRange elseToken,
      @Nullable SourceRange end,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public Condition withExpression(@Nullable SourceRange expression) {
      return new Condition(keyword, begin, elseToken, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "begin", begin,
          "else", elseToken,
          "end", end);
    }
  }

  /** Constant references and assignments. */
  record Constant(
      @Nullable SourceRange doubleColon,
      @Nullable SourceRange name,
      @Nullable SourceRange operator,
      @Nullable SourceRange expression)
      implements SourceMap {
    public Constant(
        @Nullable SourceRange doubleColon,
        @Nullable SourceRange name,
        @Nullable SourceRange expression) {
      this(doubleColon, name, null, expression);
    }

    @Override
    public Constant withExpression(@Nullable SourceRange expression) {
      return new Constant(doubleColon, name, operator, expression);
    }

    @Override
    public Constant withOperator(@Nullable SourceRange operator) {
      return new Constant(doubleColon, name, operator, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "double_colon", doubleColon,
          "name", name,
          "operator", operator);
    }
  }

  /** Class, singleton class and module declarations. */
  record Definition(
      @Nullable SourceRange keyword,
      @Nullable SourceRange operator,
      @Nullable SourceRange name,
      @Nullable SourceRange end,
      @Nullable SourceRange expression)
      implements SourceMap {
    /** Creates a definition map whose expression is filled in later. */
    public Definition(
        @Nullable SourceRange keyword,
        @Nullable SourceRange operator,
        @Nullable SourceRange name,
        @Nullable SourceRange end) {
      this(keyword, operator, name, end, null);
    }

    @Override
    public Definition withExpression(@Nullable SourceRange expression) {
      return new Definition(keyword, operator, name, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "operator", operator,
          "name", name,
          "end", end);
    }
  }

  /** {@code for} loops. */
  record For(
      @Nullable SourceRange keyword,
      @Nullable SourceRange in,
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public For withExpression(@Nullable SourceRange expression) {
      return new For(keyword, in, begin, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "in", in,
          "begin", begin,
          "end", end);
    }
  }

  /**
   * Heredocs. The expression covers only the opening declaration; the body and terminator are on
   * the following lines.
   */
  record Heredoc(
      @Nullable SourceRange expression,
      @Nullable SourceRange heredocBody,
      @Nullable SourceRange heredocEnd)
      implements SourceMap {
    @Override
    public Heredoc withExpression(@Nullable SourceRange expression) {
      return new Heredoc(expression, heredocBody, heredocEnd);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "heredoc_body", heredocBody,
          "heredoc_end", heredocEnd);
    }

    @Override
    public ImmutableMap<String, SourceRange> innerRanges() {
      return ImmutableMap.of();
    }
  }

  /** Index reads and assignments. */
  record Index(
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      @Nullable SourceRange operator,
      @Nullable SourceRange expression)
      implements SourceMap {
    public Index(
        @Nullable SourceRange begin, @Nullable SourceRange end, @Nullable SourceRange expression) {
      this(begin, end, null, expression);
    }

    @Override
    public Index withExpression(@Nullable SourceRange expression) {
      return new Index(begin, end, operator, expression);
    }

    @Override
    public Index withOperator(@Nullable SourceRange operator) {
      return new Index(begin, end, operator, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "begin", begin,
          "end", end,
          "operator", operator);
    }
  }

  /** Keyword-led expressions such as {@code return}, {@code while} and {@code defined?}. */
  record Keyword(
      @Nullable SourceRange keyword,
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public Keyword withExpression(@Nullable SourceRange expression) {
      return new Keyword(keyword, begin, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "begin", begin,
          "end", end);
    }
  }

  /** Method definitions. {@code assignment} is the {@code =} of an endless definition. */
  record MethodDefinition(
      @Nullable SourceRange keyword,
      @Nullable SourceRange operator,
      @Nullable SourceRange name,
      @Nullable SourceRange end,
      @Nullable SourceRange assignment,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public MethodDefinition withExpression(@Nullable SourceRange expression) {
      return new MethodDefinition(keyword, operator, name, end, assignment, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "operator", operator,
          "name", name,
          "end", end,
          "assignment", assignment);
    }
  }

  /** Operators, numeric literals with a sign, splats and similar prefixed nodes. */
  record Operator(@Nullable SourceRange operator, @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public Operator withExpression(@Nullable SourceRange expression) {
      return new Operator(operator, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named("expression", expression, "operator", operator);
    }
  }

  /** The body of a {@code rescue} clause. {@code assoc} is the {@code =>} before the variable. */
  record RescueBody(
      @Nullable SourceRange keyword,
      @Nullable SourceRange assoc,
      @Nullable SourceRange begin,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public RescueBody withExpression(@Nullable SourceRange expression) {
      return new RescueBody(keyword, assoc, begin, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "keyword", keyword,
          "assoc", assoc,
          "begin", begin);
    }
  }

  /** Method calls. */
  record Send(
      @Nullable SourceRange dot,
      @Nullable SourceRange selector,
      @Nullable SourceRange operator,
      @Nullable SourceRange begin,
      @Nullable SourceRange end,
      @Nullable SourceRange expression)
      implements SourceMap {
    public Send(
        @Nullable SourceRange dot,
        @Nullable SourceRange selector,
        @Nullable SourceRange begin,
        @Nullable SourceRange end,
        @Nullable SourceRange expression) {
      this(dot, selector, null, begin, end, expression);
    }

    @Override
    public Send withExpression(@Nullable SourceRange expression) {
      return new Send(dot, selector, operator, begin, end, expression);
    }

    @Override
    public Send withOperator(@Nullable SourceRange operator) {
      return new Send(dot, selector, operator, begin, end, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named(
          "expression", expression,
          "dot", dot,
          "selector", selector,
          "operator", operator,
          "begin", begin,
          "end", end);
    }
  }

  /** Ternary conditionals. */
  record Ternary(
      @Nullable SourceRange question,
      @Nullable SourceRange colon,
      @Nullable SourceRange expression)
      implements SourceMap {
    @Override
    public Ternary withExpression(@Nullable SourceRange expression) {
      return new Ternary(question, colon, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named("expression", expression, "question", question, "colon", colon);
    }
  }

  /** Variables, parameters and their assignments. */
  record Variable(
      @Nullable SourceRange name,
      @Nullable SourceRange operator,
      @Nullable SourceRange expression)
      implements SourceMap {
    public Variable(@Nullable SourceRange name, @Nullable SourceRange expression) {
      this(name, null, expression);
    }

    @Override
    public Variable withExpression(@Nullable SourceRange expression) {
      return new Variable(name, operator, expression);
    }

    @Override
    public Variable withOperator(@Nullable SourceRange operator) {
      return new Variable(name, operator, expression);
    }

    @Override
    public ImmutableMap<String, SourceRange> ranges() {
      return named("expression", expression, "name", name, "operator", operator);
    }
  }
}
