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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.syntaxtree.ast.TargetNode;
import com.google.syntaxtree.cst.Node;
import com.google.syntaxtree.cst.SourceBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Entry point for translating a Syntax Tree program into the parser gem's abstract syntax tree.
 *
 * <p>Each call works on its own translator, so independent calls may run concurrently. The origin
 * tree is never modified.
 */
public final class Translation {
  private static final Logger logger = Logger.getLogger(Translation.class.getName());

  private Translation() {}

  /**
   * Translates {@code root} with the default options.
   *
   * @return the translated tree, or null for a program without statements
   * @throws TranslationException if the tree has a shape that cannot be translated or a token
   *     could not be found in the source
   */
  public static @Nullable TargetNode translate(SourceBuffer buffer, Node root) {
    return translate(buffer, root, new TranslatorOptions());
  }

  public static @Nullable TargetNode translate(
      SourceBuffer buffer, Node root, TranslatorOptions options) {
    checkNotNull(buffer);
    checkNotNull(root);
    logger.fine("Translating " + buffer.getName() + " with " + options);
    try {
      TargetNode result = new Translator(buffer, options).translate(root);
      logger.fine("Finished translating " + buffer.getName());
      return result;
    } catch (TranslationException e) {
      logger.log(Level.FINE, "Translation of " + buffer.getName() + " failed", e);
      throw e;
    }
  }
}
