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

import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.ast.TargetNode;
import com.google.syntaxtree.sourcemap.SourceMap;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Checks that every named range of a source map, such as a selector or an {@code end} keyword,
 * lies within the map's expression.
 *
 * <p>The body and terminator of a heredoc are not checked: they follow the line that opens the
 * heredoc while its expression covers only the opening delimiter.
 */
public final class SourceMapValidator {

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, TargetNode n);
  }

  private final ViolationHandler violationHandler;

  public SourceMapValidator(ViolationHandler handler) {
    this.violationHandler = handler;
  }

  /** Creates a validator that throws on the first violation. */
  public SourceMapValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, TargetNode n) {
            throw new IllegalStateException(message + ". Reference node:\n" + n.toStringTree());
          }
        });
  }

  /** Returns the messages of every violation in the tree rooted at {@code root}. */
  public static ImmutableList<String> findViolations(@Nullable TargetNode root) {
    List<String> messages = new ArrayList<>();
    new SourceMapValidator((message, n) -> messages.add(message)).validate(root);
    return ImmutableList.copyOf(messages);
  }

  public void validate(@Nullable TargetNode root) {
    if (root != null) {
      validateNode(root);
    }
  }

  private void validateNode(TargetNode n) {
    SourceMap location = n.getLocation();
    SourceRange expression = location == null ? null : location.expression();
    if (expression != null) {
      for (Map.Entry<String, SourceRange> entry : location.innerRanges().entrySet()) {
        if (!expression.contains(entry.getValue())) {
          violation(
              "Range " + entry.getKey() + " " + entry.getValue() + " lies outside " + expression,
              n);
        }
      }
    }
    for (TargetNode child : n.getChildNodes()) {
      validateNode(child);
    }
  }

  private void violation(String message, TargetNode n) {
    violationHandler.handleViolation(message, n);
  }
}
