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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * A name compared by value, printed the way Ruby prints a symbol: {@code :foo}, {@code :"foo bar"}.
 */
@Immutable
public final class Symbol implements Comparable<Symbol> {
  private static final Pattern PLAIN =
      Pattern.compile(
          "(?:[A-Za-z_][A-Za-z0-9_]*[?!=]?"
              + "|\\$(?:[A-Za-z_][A-Za-z0-9_]*|[0-9]+|[~*$?!@/\\\\;,.=:<>\"&`'+])"
              + "|@@?[A-Za-z_][A-Za-z0-9_]*"
              + "|\\[\\]=?|\\*\\*?|[+\\-]@?|[/%~^&|!]|!=|!~|=~|==|===|<=>|<<?|>>?|<=|>=)");

  private final String name;

  private Symbol(String name) {
    this.name = checkNotNull(name);
  }

  public static Symbol of(String name) {
    return new Symbol(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(Symbol other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof Symbol && ((Symbol) o).name.equals(name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    if (!name.isEmpty() && PLAIN.matcher(name).matches() && !name.endsWith("?=")) {
      return ":" + name;
    }
    return ":" + RubyInspect.string(name);
  }
}
