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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The node types of the parser gem's abstract syntax tree. */
public enum NodeType {
  // literals
  INT("int"),
  FLOAT("float"),
  RATIONAL("rational"),
  COMPLEX("complex"),
  STR("str"),
  DSTR("dstr"),
  XSTR("xstr"),
  SYM("sym"),
  DSYM("dsym"),
  REGEXP("regexp"),
  REGOPT("regopt"),
  ARRAY("array"),
  HASH("hash"),
  PAIR("pair"),
  KWSPLAT("kwsplat"),
  IRANGE("irange"),
  ERANGE("erange"),
  NTH_REF("nth_ref"),
  BACK_REF("back_ref"),
  NIL("nil"),
  TRUE("true"),
  FALSE("false"),
  SELF("self"),
  ENCODING("__ENCODING__"),
  // variables and constants
  LVAR("lvar"),
  IVAR("ivar"),
  CVAR("cvar"),
  GVAR("gvar"),
  CONST("const"),
  CBASE("cbase"),
  CASGN("casgn"),
  LVASGN("lvasgn"),
  IVASGN("ivasgn"),
  CVASGN("cvasgn"),
  GVASGN("gvasgn"),
  // calls
  SEND("send"),
  CSEND("csend"),
  BLOCK("block"),
  NUMBLOCK("numblock"),
  BLOCK_PASS("block_pass"),
  SPLAT("splat"),
  KWARGS("kwargs"),
  INDEX("index"),
  INDEXASGN("indexasgn"),
  LAMBDA("lambda"),
  SUPER("super"),
  ZSUPER("zsuper"),
  YIELD("yield"),
  DEFINED("defined?"),
  MATCH_WITH_LVASGN("match_with_lvasgn"),
  MATCH_CURRENT_LINE("match_current_line"),
  // assignments
  MASGN("masgn"),
  MLHS("mlhs"),
  OP_ASGN("op_asgn"),
  OR_ASGN("or_asgn"),
  AND_ASGN("and_asgn"),
  // definitions
  DEF("def"),
  DEFS("defs"),
  CLASS("class"),
  SCLASS("sclass"),
  MODULE("module"),
  ARGS("args"),
  ARG("arg"),
  OPTARG("optarg"),
  RESTARG("restarg"),
  KWARG("kwarg"),
  KWOPTARG("kwoptarg"),
  KWRESTARG("kwrestarg"),
  KWNILARG("kwnilarg"),
  BLOCKARG("blockarg"),
  SHADOWARG("shadowarg"),
  FORWARD_ARG("forward_arg"),
  FORWARD_ARGS("forward_args"),
  FORWARDED_ARGS("forwarded_args"),
  PROCARG0("procarg0"),
  ALIAS("alias"),
  UNDEF("undef"),
  // control flow
  AND("and"),
  OR("or"),
  IF("if"),
  CASE("case"),
  WHEN("when"),
  CASE_MATCH("case_match"),
  IN_PATTERN("in_pattern"),
  IF_GUARD("if_guard"),
  UNLESS_GUARD("unless_guard"),
  EMPTY_ELSE("empty_else"),
  WHILE("while"),
  UNTIL("until"),
  WHILE_POST("while_post"),
  UNTIL_POST("until_post"),
  FOR("for"),
  BREAK("break"),
  NEXT("next"),
  RETURN("return"),
  REDO("redo"),
  RETRY("retry"),
  KWBEGIN("kwbegin"),
  BEGIN("begin"),
  RESCUE("rescue"),
  RESBODY("resbody"),
  ENSURE("ensure"),
  PREEXE("preexe"),
  POSTEXE("postexe"),
  IFLIPFLOP("iflipflop"),
  EFLIPFLOP("eflipflop"),
  // patterns
  ARRAY_PATTERN("array_pattern"),
  ARRAY_PATTERN_WITH_TAIL("array_pattern_with_tail"),
  FIND_PATTERN("find_pattern"),
  HASH_PATTERN("hash_pattern"),
  CONST_PATTERN("const_pattern"),
  MATCH_REST("match_rest"),
  MATCH_VAR("match_var"),
  MATCH_NIL_PATTERN("match_nil_pattern"),
  MATCH_ALT("match_alt"),
  MATCH_AS("match_as"),
  PIN("pin"),
  MATCH_PATTERN("match_pattern"),
  MATCH_PATTERN_P("match_pattern_p");

  private static final ImmutableMap<String, NodeType> BY_NAME;

  static {
    ImmutableMap.Builder<String, NodeType> byName = ImmutableMap.builder();
    for (NodeType type : values()) {
      byName.put(type.name, type);
    }
    BY_NAME = byName.buildOrThrow();
  }

  private final String name;

  NodeType(String name) {
    this.name = name;
  }

  /** Returns the type as the parser gem spells it, for example {@code op_asgn}. */
  public String getName() {
    return name;
  }

  /** Returns the type spelled {@code name}, or null if there is none. */
  public static @Nullable NodeType fromName(String name) {
    return BY_NAME.get(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
