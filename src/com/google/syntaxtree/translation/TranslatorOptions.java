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

import com.google.common.base.MoreObjects;
import java.io.Serializable;

/**
 * Options that select between the node shapes of the parser gem's builder versions. Each option
 * matches one of the builder's {@code emit_*} class attributes. A fresh instance selects every
 * modern shape; {@link #legacy()} selects none of them.
 */
public class TranslatorOptions implements Serializable {
  /** Emit {@code lambda} rather than {@code send(nil, :lambda)} for {@code ->}. */
  private boolean emitLambda = true;

  /** Emit {@code procarg0} for a block's single parameter. */
  private boolean emitProcarg0 = true;

  /** Emit {@code __ENCODING__} rather than {@code const(const(nil, :Encoding), :UTF_8)}. */
  private boolean emitEncoding = true;

  /** Emit {@code index} and {@code indexasgn} rather than sends of {@code []} and {@code []=}. */
  private boolean emitIndex = true;

  /** Wrap a plain {@code arg} inside {@code procarg0}, rather than flattening it. */
  private boolean emitArgInsideProcarg0 = true;

  /** Emit {@code forward_arg} inside {@code args}, rather than a bare {@code forward_args}. */
  private boolean emitForwardArg = true;

  /** Emit {@code kwargs} for keyword arguments of calls, rather than {@code hash}. */
  private boolean emitKwargs = true;

  /** Returns options that select the oldest shape for every construct. */
  public static TranslatorOptions legacy() {
    TranslatorOptions options = new TranslatorOptions();
    options.setEmitLambda(false);
    options.setEmitProcarg0(false);
    options.setEmitEncoding(false);
    options.setEmitIndex(false);
    options.setEmitArgInsideProcarg0(false);
    options.setEmitForwardArg(false);
    options.setEmitKwargs(false);
    return options;
  }

  public boolean shouldEmitLambda() {
    return emitLambda;
  }

  public void setEmitLambda(boolean emitLambda) {
    this.emitLambda = emitLambda;
  }

  public boolean shouldEmitProcarg0() {
    return emitProcarg0;
  }

  public void setEmitProcarg0(boolean emitProcarg0) {
    this.emitProcarg0 = emitProcarg0;
  }

  public boolean shouldEmitEncoding() {
    return emitEncoding;
  }

  public void setEmitEncoding(boolean emitEncoding) {
    this.emitEncoding = emitEncoding;
  }

  public boolean shouldEmitIndex() {
    return emitIndex;
  }

  public void setEmitIndex(boolean emitIndex) {
    this.emitIndex = emitIndex;
  }

  public boolean shouldEmitArgInsideProcarg0() {
    return emitArgInsideProcarg0;
  }

  public void setEmitArgInsideProcarg0(boolean emitArgInsideProcarg0) {
    this.emitArgInsideProcarg0 = emitArgInsideProcarg0;
  }

  public boolean shouldEmitForwardArg() {
    return emitForwardArg;
  }

  public void setEmitForwardArg(boolean emitForwardArg) {
    this.emitForwardArg = emitForwardArg;
  }

  public boolean shouldEmitKwargs() {
    return emitKwargs;
  }

  public void setEmitKwargs(boolean emitKwargs) {
    this.emitKwargs = emitKwargs;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("emitLambda", emitLambda)
        .add("emitProcarg0", emitProcarg0)
        .add("emitEncoding", emitEncoding)
        .add("emitIndex", emitIndex)
        .add("emitArgInsideProcarg0", emitArgInsideProcarg0)
        .add("emitForwardArg", emitForwardArg)
        .add("emitKwargs", emitKwargs)
        .toString();
  }
}
