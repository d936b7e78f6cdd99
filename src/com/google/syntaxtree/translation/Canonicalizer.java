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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.cst.Args;
import com.google.syntaxtree.cst.Binary;
import com.google.syntaxtree.cst.CommandCall;
import com.google.syntaxtree.cst.FloatLiteral;
import com.google.syntaxtree.cst.Imaginary;
import com.google.syntaxtree.cst.Int;
import com.google.syntaxtree.cst.Location;
import com.google.syntaxtree.cst.Node;
import com.google.syntaxtree.cst.Op;
import com.google.syntaxtree.cst.RationalLiteral;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.cst.Unary;

/**
 * Rewrites operator expressions into the method calls they stand for, so that {@code a + b}
 * translates exactly like {@code a.+(b)}. The input tree is never modified; new origin nodes are
 * returned.
 */
final class Canonicalizer {
  private final SourceBuffer buffer;

  Canonicalizer(SourceBuffer buffer) {
    this.buffer = buffer;
  }

  /**
   * Turns {@code left op right} into a call of {@code op} on {@code left} with {@code right} as
   * the only argument. A call is returned unchanged.
   */
  Node canonicalBinary(Node node) {
    if (node instanceof CommandCall) {
      return node;
    }
    checkArgument(node instanceof Binary, "Not a binary expression: %s", node);
    Binary binary = (Binary) node;
    String operator = binary.operator();

    int start = binary.left().endChar();
    int index = buffer.slice(start, binary.right().startChar()).indexOf(operator);
    if (index < 0) {
      throw new TranslationException(
          "Could not find " + operator + " between the operands of " + node);
    }
    int opStart = start + index;
    int line =
        binary.location().startLine()
            + CharMatcher.is('\n').countIn(buffer.slice(binary.startChar(), opStart));
    int column = buffer.getColumnOfOffset(opStart);
    Location opLocation =
        Location.create(
            line, opStart, column, line, opStart + operator.length(), column + operator.length());

    return new CommandCall(
        binary.left(),
        null,
        new Op(operator, opLocation),
        new Args(ImmutableList.of(binary.right()), binary.right().location()),
        null,
        binary.location());
  }

  /**
   * Turns a prefix operator into a call of its method on the operand: {@code -x} calls {@code
   * -@}. A sign on a numeric literal is folded into the literal instead. A call is returned
   * unchanged.
   */
  Node canonicalUnary(Node node) {
    if (node instanceof CommandCall) {
      return node;
    }
    checkArgument(node instanceof Unary, "Not a unary expression: %s", node);
    Unary unary = (Unary) node;
    String operator = unary.operator();
    Node statement = unary.statement();
    boolean sign = operator.equals("+") || operator.equals("-");

    if (sign && statement instanceof Int) {
      return new Int(operator + ((Int) statement).value(), unary.location());
    } else if (sign && statement instanceof FloatLiteral) {
      return new FloatLiteral(operator + ((FloatLiteral) statement).value(), unary.location());
    } else if (sign && statement instanceof RationalLiteral) {
      return new RationalLiteral(
          operator + ((RationalLiteral) statement).value(), unary.location());
    } else if (sign && statement instanceof Imaginary) {
      return new Imaginary(operator + ((Imaginary) statement).value(), unary.location());
    }

    String message = sign ? operator + "@" : operator;
    Location location = unary.location();
    Location opLocation =
        Location.create(
            location.startLine(),
            location.startChar(),
            location.startColumn(),
            location.startLine(),
            location.startChar() + operator.length(),
            location.startColumn() + operator.length());
    return new CommandCall(statement, null, new Op(message, opLocation), null, null, location);
  }
}
