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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.ast.NodeType;
import com.google.syntaxtree.ast.TargetNode;
import com.google.syntaxtree.cst.ARef;
import com.google.syntaxtree.cst.AliasNode;
import com.google.syntaxtree.cst.ArgBlock;
import com.google.syntaxtree.cst.ArgParen;
import com.google.syntaxtree.cst.ArgStar;
import com.google.syntaxtree.cst.Args;
import com.google.syntaxtree.cst.ArgsForward;
import com.google.syntaxtree.cst.AryPtn;
import com.google.syntaxtree.cst.Assign;
import com.google.syntaxtree.cst.Assoc;
import com.google.syntaxtree.cst.Backref;
import com.google.syntaxtree.cst.BareAssocHash;
import com.google.syntaxtree.cst.Begin;
import com.google.syntaxtree.cst.Binary;
import com.google.syntaxtree.cst.BlockNode;
import com.google.syntaxtree.cst.BlockVar;
import com.google.syntaxtree.cst.BodyStmt;
import com.google.syntaxtree.cst.CallNode;
import com.google.syntaxtree.cst.Case;
import com.google.syntaxtree.cst.ClassDeclaration;
import com.google.syntaxtree.cst.Comma;
import com.google.syntaxtree.cst.Comment;
import com.google.syntaxtree.cst.Const;
import com.google.syntaxtree.cst.ConstPathRef;
import com.google.syntaxtree.cst.ConstRef;
import com.google.syntaxtree.cst.DefNode;
import com.google.syntaxtree.cst.Defined;
import com.google.syntaxtree.cst.Else;
import com.google.syntaxtree.cst.Ensure;
import com.google.syntaxtree.cst.FloatLiteral;
import com.google.syntaxtree.cst.FndPtn;
import com.google.syntaxtree.cst.For;
import com.google.syntaxtree.cst.GVar;
import com.google.syntaxtree.cst.HashLiteral;
import com.google.syntaxtree.cst.Heredoc;
import com.google.syntaxtree.cst.HeredocBeg;
import com.google.syntaxtree.cst.HeredocEnd;
import com.google.syntaxtree.cst.HshPtn;
import com.google.syntaxtree.cst.IVar;
import com.google.syntaxtree.cst.Ident;
import com.google.syntaxtree.cst.IfNode;
import com.google.syntaxtree.cst.IfOp;
import com.google.syntaxtree.cst.Imaginary;
import com.google.syntaxtree.cst.In;
import com.google.syntaxtree.cst.Int;
import com.google.syntaxtree.cst.Kw;
import com.google.syntaxtree.cst.LBrace;
import com.google.syntaxtree.cst.LParen;
import com.google.syntaxtree.cst.Label;
import com.google.syntaxtree.cst.Lambda;
import com.google.syntaxtree.cst.Location;
import com.google.syntaxtree.cst.MAssign;
import com.google.syntaxtree.cst.MLHS;
import com.google.syntaxtree.cst.MRHS;
import com.google.syntaxtree.cst.MethodAddBlock;
import com.google.syntaxtree.cst.ModuleDeclaration;
import com.google.syntaxtree.cst.Node;
import com.google.syntaxtree.cst.Not;
import com.google.syntaxtree.cst.OpAssign;
import com.google.syntaxtree.cst.Params;
import com.google.syntaxtree.cst.Paren;
import com.google.syntaxtree.cst.Period;
import com.google.syntaxtree.cst.PinnedVarRef;
import com.google.syntaxtree.cst.Program;
import com.google.syntaxtree.cst.QSymbols;
import com.google.syntaxtree.cst.QSymbolsBeg;
import com.google.syntaxtree.cst.QWords;
import com.google.syntaxtree.cst.QWordsBeg;
import com.google.syntaxtree.cst.RAssign;
import com.google.syntaxtree.cst.RangeNode;
import com.google.syntaxtree.cst.RationalLiteral;
import com.google.syntaxtree.cst.RegexpLiteral;
import com.google.syntaxtree.cst.Rescue;
import com.google.syntaxtree.cst.RescueEx;
import com.google.syntaxtree.cst.RescueMod;
import com.google.syntaxtree.cst.SClass;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.cst.Statements;
import com.google.syntaxtree.cst.StringEmbExpr;
import com.google.syntaxtree.cst.StringLiteral;
import com.google.syntaxtree.cst.SymbolLiteral;
import com.google.syntaxtree.cst.TStringContent;
import com.google.syntaxtree.cst.TopConstRef;
import com.google.syntaxtree.cst.Unary;
import com.google.syntaxtree.cst.Undef;
import com.google.syntaxtree.cst.UnlessNode;
import com.google.syntaxtree.cst.UntilNode;
import com.google.syntaxtree.cst.VCall;
import com.google.syntaxtree.cst.VarField;
import com.google.syntaxtree.cst.VarRef;
import com.google.syntaxtree.cst.VoidStmt;
import com.google.syntaxtree.cst.When;
import com.google.syntaxtree.cst.WhileNode;
import com.google.syntaxtree.cst.YieldNode;
import com.google.syntaxtree.cst.ZSuper;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.util.function.BiFunction;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Translator}, one origin tree per test, built by hand over its source text. */
@RunWith(JUnit4.class)
public final class TranslatorTest {

  @Test
  public void testBinaryOperatorBecomesSend() {
    CstFixture f = new CstFixture("1 + 2");
    Binary binary = new Binary(f.integer("1"), "+", f.integer("2"), f.all());

    TargetNode result = translate(f, binary);

    assertThat(result.toString()).isEqualTo("s(:send, s(:int, 1), :+, s(:int, 2))");
    assertRange(result, "selector", "+", 2);
    assertRange(result, "expression", "1 + 2", 0);
  }

  @Test
  public void testCallWithParenthesizedArguments() {
    CstFixture f = new CstFixture("foo.bar(1)");
    CallNode call =
        new CallNode(
            f.vcall("foo"),
            new Period(".", f.loc(".")),
            f.ident("bar"),
            new ArgParen(new Args(ImmutableList.of(f.integer("1")), f.loc("1")), f.loc("(1)")),
            f.all());

    TargetNode result = translate(f, call);

    assertThat(result.toString()).isEqualTo("s(:send, s(:send, nil, :foo), :bar, s(:int, 1))");
    assertRange(result, "dot", ".", 3);
    assertRange(result, "selector", "bar", 4);
    assertRange(result, "begin", "(", 7);
    assertRange(result, "end", ")", 9);
    assertRange(result.getChildNode(0), "selector", "foo", 0);
  }

  @Test
  public void testSafeNavigation() {
    CstFixture f = new CstFixture("foo&.bar");
    CallNode call = new CallNode(f.vcall("foo"), f.op("&."), f.ident("bar"), null, f.all());

    TargetNode result = translate(f, call);

    assertThat(result.toString()).isEqualTo("s(:csend, s(:send, nil, :foo), :bar)");
    assertRange(result, "dot", "&.", 3);
  }

  @Test
  public void testRescueModifier() {
    CstFixture f = new CstFixture("foo.bar rescue nil");
    CallNode call =
        new CallNode(
            f.vcall("foo"), new Period(".", f.loc(".")), f.ident("bar"), null, f.loc("foo.bar"));
    Kw nil = f.kw("nil");
    RescueMod rescue = new RescueMod(call, new VarRef(nil, nil.location()), f.all());

    TargetNode result = translate(f, rescue);

    assertThat(result.toString())
        .isEqualTo(
            "s(:rescue, s(:send, s(:send, nil, :foo), :bar), s(:resbody, nil, nil, s(:nil)), nil)");
    TargetNode resbody = result.getChildNode(1);
    assertRange(resbody, "keyword", "rescue", 8);
    assertRange(resbody, "expression", "rescue nil", 8);
  }

  @Test
  public void testArrayPatternWithTrailingComma() {
    CstFixture f = new CstFixture("case foo; in [bar,]; end");
    AryPtn pattern =
        new AryPtn(
            null,
            ImmutableList.of(f.varField("bar")),
            new VarField(null, f.loc(18, 18)),
            ImmutableList.of(),
            f.loc("[bar,]"));
    In in =
        new In(
            pattern,
            new Statements(
                ImmutableList.of(new VoidStmt(ImmutableList.of(), f.loc(19, 19))), f.loc(19, 21)),
            null,
            f.loc(10, 21));
    Case node = new Case(f.kw("case"), f.vcall("foo"), in, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :foo), "
                + "s(:in_pattern, s(:array_pattern_with_tail, s(:match_var, :bar)), nil, nil), "
                + "nil)");
  }

  @Test
  public void testArrayPatternWithNamedRest() {
    CstFixture f = new CstFixture("case x\nin [a, *r] then a\nend");
    AryPtn pattern =
        new AryPtn(
            null,
            ImmutableList.of(f.varField("a", 1)),
            new VarField(f.ident("r"), f.loc("*r")),
            ImmutableList.of(),
            f.loc("[a, *r]"));
    In in =
        new In(
            pattern,
            new Statements(ImmutableList.of(f.varRef("a", 2)), f.loc(22, 24)),
            null,
            f.loc(7, 24));
    Case node = new Case(f.kw("case"), f.vcall("x"), in, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), s(:in_pattern, s(:array_pattern, "
                + "s(:match_var, :a), s(:match_rest, s(:match_var, :r))), nil, s(:lvar, :a)), "
                + "nil)");
    TargetNode inPattern = result.getChildNode(1);
    assertRange(inPattern, "keyword", "in", 7);
    assertRange(inPattern, "begin", "then", 18);
  }

  @Test
  public void testAlternativesInsidePattern() {
    CstFixture f = new CstFixture("case x; in 1 | 2; end");
    Binary alternatives = new Binary(f.integer("1"), "|", f.integer("2"), f.loc("1 | 2"));
    In in =
        new In(
            alternatives,
            new Statements(
                ImmutableList.of(new VoidStmt(ImmutableList.of(), f.loc(16, 16))), f.loc(16, 17)),
            null,
            f.loc(8, 17));
    Case node = new Case(f.kw("case"), f.vcall("x"), in, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), "
                + "s(:in_pattern, s(:match_alt, s(:int, 1), s(:int, 2)), nil, nil), nil)");
  }

  @Test
  public void testBinaryOrOutsidePatternIsCall() {
    CstFixture f = new CstFixture("1 | 2");
    Binary binary = new Binary(f.integer("1"), "|", f.integer("2"), f.all());

    assertThat(translate(f, binary).toString()).isEqualTo("s(:send, s(:int, 1), :|, s(:int, 2))");
  }

  @Test
  public void testNestedAssignmentInParameterDefault() {
    CstFixture f = new CstFixture("def m(a = b = c); end");
    Assign inner = new Assign(f.varField("b"), f.vcall("c"), f.loc("b = c"));
    Params params =
        new Params(
            ImmutableList.of(),
            ImmutableList.of(new Params.OptionalParam(f.ident("a"), inner)),
            null,
            ImmutableList.of(),
            ImmutableList.of(),
            null,
            null,
            f.loc("a = b = c"));
    DefNode def =
        new DefNode(
            null,
            null,
            f.ident("m"),
            new Paren(new LParen("(", f.loc("(")), params, f.loc("(a = b = c)")),
            emptyBody(f, 16, 18),
            f.all());

    TargetNode result = translate(f, def);

    assertThat(result.toString())
        .isEqualTo(
            "s(:def, :m, s(:args, s(:optarg, :a, s(:lvasgn, :b, s(:send, nil, :c)))), nil)");
    TargetNode optarg = result.getChildNode(1).getChildNode(0);
    assertRange(optarg, "name", "a", 6);
    assertRange(optarg, "operator", "=", 8);
    assertRange(optarg.getChildNode(1), "operator", "=", 12);
    assertRange(result, "end", "end", 18);
  }

  @Test
  public void testNestedAssignmentAsStatement() {
    CstFixture f = new CstFixture("a = b = c");
    Assign inner = new Assign(f.varField("b"), f.vcall("c"), f.loc("b = c"));
    Assign outer = new Assign(f.varField("a"), inner, f.all());

    TargetNode result = translate(f, outer);

    assertThat(result.toString())
        .isEqualTo("s(:lvasgn, :a, s(:lvasgn, :b, s(:send, nil, :c)))");
    assertRange(result, "operator", "=", 2);
    assertRange(result, "name", "a", 0);
  }

  @Test
  public void testSquigglyHeredocDedent() {
    CstFixture f = new CstFixture("<<~EOS\n  a\n    b\n  c\nEOS\n");
    Heredoc heredoc =
        new Heredoc(
            new HeredocBeg("<<~EOS", f.loc("<<~EOS")),
            new HeredocEnd("EOS\n", f.loc(21, 25)),
            2,
            ImmutableList.of(new TStringContent("  a\n    b\n  c\n", f.loc(7, 21))),
            f.loc("<<~EOS"));

    TargetNode result = translate(f, heredoc);

    assertThat(result.toString())
        .isEqualTo("s(:dstr, s(:str, \"a\\n\"), s(:str, \"  b\\n\"), s(:str, \"c\\n\"))");
    assertRange(result, "expression", "<<~EOS", 0);
    assertRange(result, "heredoc_body", "  a\n    b\n  c\n", 7);
    assertRange(result, "heredoc_end", "EOS", 21);
  }

  @Test
  public void testQuotedHeredocKeepsEscapes() {
    CstFixture f = new CstFixture("<<~'EOS'\n  a\\tb\n  c\nEOS\n");
    Heredoc heredoc =
        new Heredoc(
            new HeredocBeg("<<~'EOS'", f.loc("<<~'EOS'")),
            new HeredocEnd("EOS\n", f.loc(20, 24)),
            2,
            ImmutableList.of(new TStringContent("  a\\tb\n  c\n", f.loc(9, 20))),
            f.loc("<<~'EOS'"));

    TargetNode result = translate(f, heredoc);

    assertThat(result.toString())
        .isEqualTo("s(:dstr, s(:str, \"a\\\\tb\\n\"), s(:str, \"c\\n\"))");
    assertRange(result, "heredoc_body", "  a\\tb\n  c\n", 9);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();

    CstFixture g = new CstFixture("<<-EOS\na\\tb\nEOS\n");
    Heredoc interpreted =
        new Heredoc(
            new HeredocBeg("<<-EOS", g.loc("<<-EOS")),
            new HeredocEnd("EOS\n", g.loc(12, 16)),
            0,
            ImmutableList.of(new TStringContent("a\\tb\n", g.loc(7, 12))),
            g.loc("<<-EOS"));
    assertThat(translate(g, interpreted).toString()).isEqualTo("s(:str, \"a\\tb\\n\")");
  }

  @Test
  public void testSquigglyHeredocWithInterpolation() {
    CstFixture f = new CstFixture("<<~FOO\n  bar\n  #{baz}\nFOO");
    Ident baz = f.ident("baz");
    Heredoc heredoc =
        new Heredoc(
            new HeredocBeg("<<~FOO", f.loc("<<~FOO")),
            new HeredocEnd("FOO", f.loc("FOO", 1)),
            2,
            ImmutableList.of(
                new TStringContent("  bar\n", f.loc(7, 13)),
                new TStringContent("  ", f.loc(13, 15)),
                new StringEmbExpr(
                    new Statements(
                        ImmutableList.of(new VarRef(baz, baz.location())), baz.location()),
                    f.loc("#{baz}")),
                new TStringContent("\n", f.loc(21, 22))),
            f.loc("<<~FOO"));

    TargetNode result = translate(f, heredoc);

    assertThat(result.toString())
        .isEqualTo(
            "s(:dstr, s(:str, \"bar\\n\"), s(:begin, s(:lvar, :baz)), s(:str, \"\\n\"))");
    TargetNode embed = result.getChildNode(1);
    assertRange(embed, "begin", "#{", 15);
    assertRange(embed, "end", "}", 20);
  }

  @Test
  public void testIfElse() {
    CstFixture f = new CstFixture("if a then b else c end");
    Else elseClause = new Else(f.kw("else"), f.statements(f.vcall("c")), f.loc("else c"));
    IfNode node = new IfNode(f.vcall("a"), f.statements(f.vcall("b")), elseClause, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:if, s(:send, nil, :a), s(:send, nil, :b), s(:send, nil, :c))");
    assertRange(result, "keyword", "if", 0);
    assertRange(result, "begin", "then", 5);
    assertRange(result, "else", "else", 12);
    assertRange(result, "end", "end", 19);
  }

  @Test
  public void testModifierIf() {
    CstFixture f = new CstFixture("foo if bar");
    IfNode node = new IfNode(f.vcall("bar"), f.statements(f.vcall("foo")), null, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:if, s(:send, nil, :bar), s(:send, nil, :foo), nil)");
    assertRange(result, "keyword", "if", 4);
  }

  @Test
  public void testTernary() {
    CstFixture f = new CstFixture("a ? b : c");
    IfOp node = new IfOp(f.vcall("a"), f.vcall("b"), f.vcall("c"), f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:if, s(:send, nil, :a), s(:send, nil, :b), s(:send, nil, :c))");
    assertRange(result, "question", "?", 2);
    assertRange(result, "colon", ":", 6);
  }

  @Test
  public void testCaseWhenWithoutElse() {
    CstFixture f = new CstFixture("case a\nwhen 1 then b\nend");
    When when =
        new When(
            new Args(ImmutableList.of(f.integer("1")), f.loc("1")),
            new Statements(ImmutableList.of(f.vcall("b")), f.loc(13, 20)),
            null,
            f.loc(7, 20));
    VCall a = new VCall(new Ident("a", f.loc(5, 6)), f.loc(5, 6));
    Case node = new Case(f.kw("case"), a, when, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo(
            "s(:case, s(:send, nil, :a), s(:when, s(:int, 1), s(:send, nil, :b)), nil)");
    assertRange(result, "keyword", "case", 0);
    assertRange(result, "end", "end", 21);
    assertRange(result.getChildNode(1), "keyword", "when", 7);
  }

  @Test
  public void testWhileLoops() {
    CstFixture f = new CstFixture("while x\n  y\nend");
    WhileNode loop = new WhileNode(f.vcall("x"), f.statements(f.vcall("y")), f.all());

    TargetNode result = translate(f, loop);

    assertThat(result.toString()).isEqualTo("s(:while, s(:send, nil, :x), s(:send, nil, :y))");
    assertRange(result, "keyword", "while", 0);
    assertRange(result, "end", "end", 12);

    CstFixture g = new CstFixture("y while x");
    WhileNode modifier = new WhileNode(g.vcall("x"), g.statements(g.vcall("y")), g.all());
    TargetNode modified = translate(g, modifier);
    assertThat(modified.toString()).isEqualTo("s(:while, s(:send, nil, :x), s(:send, nil, :y))");
    assertRange(modified, "keyword", "while", 2);
  }

  @Test
  public void testBlockWithNumberedParameter() {
    CstFixture f = new CstFixture("foo { _1 }");
    CallNode call = new CallNode(null, null, f.ident("foo"), null, f.loc("foo"));
    BlockNode block =
        new BlockNode(
            new LBrace("{", f.loc("{")),
            null,
            f.statements(f.varRef("_1", 0)),
            f.loc("{ _1 }"));
    MethodAddBlock node = new MethodAddBlock(call, block, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:numblock, s(:send, nil, :foo), 1, s(:lvar, :_1))");
    assertRange(result, "begin", "{", 4);
    assertRange(result, "end", "}", 9);
  }

  @Test
  public void testUnderscoreNamesBeyondNineAreNotNumberedParameters() {
    CstFixture f = new CstFixture("foo { _10 + _99999999999 }");
    CallNode call = new CallNode(null, null, f.ident("foo"), null, f.loc("foo"));
    Binary sum =
        new Binary(
            f.varRef("_10", 0), "+", f.varRef("_99999999999", 0), f.loc("_10 + _99999999999"));
    BlockNode block =
        new BlockNode(
            new LBrace("{", f.loc("{")), null, f.statements(sum), f.loc("{ _10 + _99999999999 }"));

    TargetNode result = translate(f, new MethodAddBlock(call, block, f.all()));

    assertThat(result.getType()).isEqualTo(NodeType.BLOCK);
    assertThat(result.toString())
        .isEqualTo(
            "s(:block, s(:send, nil, :foo), s(:args), "
                + "s(:send, s(:lvar, :_10), :+, s(:lvar, :_99999999999)))");
  }

  @Test
  public void testBlockWithSingleParameter() {
    CstFixture f = new CstFixture("foo { |x| x }");
    TargetNode modern = translate(f, blockWithSingleParameter(f), new TranslatorOptions());
    assertThat(modern.toString())
        .isEqualTo(
            "s(:block, s(:send, nil, :foo), s(:args, s(:procarg0, s(:arg, :x))), s(:lvar, :x))");

    TargetNode legacy = translate(f, blockWithSingleParameter(f), TranslatorOptions.legacy());
    assertThat(legacy.toString())
        .isEqualTo("s(:block, s(:send, nil, :foo), s(:args, s(:arg, :x)), s(:lvar, :x))");
  }

  private static MethodAddBlock blockWithSingleParameter(CstFixture f) {
    Params params =
        new Params(
            ImmutableList.of(f.ident("x")),
            ImmutableList.of(),
            null,
            ImmutableList.of(),
            ImmutableList.of(),
            null,
            null,
            f.loc(7, 8));
    BlockNode block =
        new BlockNode(
            new LBrace("{", f.loc("{")),
            new BlockVar(params, ImmutableList.of(), f.loc("|x|")),
            f.statements(f.varRef("x", 1)),
            f.loc(4, 13));
    return new MethodAddBlock(
        new CallNode(null, null, f.ident("foo"), null, f.loc("foo")), block, f.all());
  }

  @Test
  public void testStabbyLambda() {
    CstFixture f = new CstFixture("->(x) { x }");
    Params params =
        new Params(
            ImmutableList.of(f.ident("x")),
            ImmutableList.of(),
            null,
            ImmutableList.of(),
            ImmutableList.of(),
            null,
            null,
            f.loc(3, 4));
    Lambda lambda =
        new Lambda(
            new Paren(new LParen("(", f.loc("(")), params, f.loc("(x)")),
            f.statements(f.varRef("x", 1)),
            f.all());

    TargetNode result = translate(f, lambda, new TranslatorOptions());
    assertThat(result.toString())
        .isEqualTo("s(:block, s(:lambda), s(:args, s(:arg, :x)), s(:lvar, :x))");
    assertRange(result.getChildNode(0), "expression", "->", 0);
    assertRange(result, "begin", "{", 6);

    TargetNode legacy = translate(f, lambda, TranslatorOptions.legacy());
    assertThat(legacy.toString())
        .isEqualTo("s(:block, s(:send, nil, :lambda), s(:args, s(:arg, :x)), s(:lvar, :x))");
  }

  @Test
  public void testKeywordArguments() {
    CstFixture f = new CstFixture("foo(a: 1)");
    Assoc assoc = new Assoc(new Label("a:", f.loc("a:")), f.integer("1"), f.loc("a: 1"));
    CallNode call =
        new CallNode(
            null,
            null,
            f.ident("foo"),
            new ArgParen(
                new Args(
                    ImmutableList.of(new BareAssocHash(ImmutableList.of(assoc), f.loc("a: 1"))),
                    f.loc("a: 1")),
                f.loc("(a: 1)")),
            f.all());

    assertThat(translate(f, call, new TranslatorOptions()).toString())
        .isEqualTo("s(:send, nil, :foo, s(:kwargs, s(:pair, s(:sym, :a), s(:int, 1))))");
    assertThat(translate(f, call, TranslatorOptions.legacy()).toString())
        .isEqualTo("s(:send, nil, :foo, s(:hash, s(:pair, s(:sym, :a), s(:int, 1))))");
  }

  @Test
  public void testHashLiteral() {
    CstFixture f = new CstFixture("{ a: 1 }");
    Assoc assoc = new Assoc(new Label("a:", f.loc("a:")), f.integer("1"), f.loc("a: 1"));
    HashLiteral hash =
        new HashLiteral(new LBrace("{", f.loc("{")), ImmutableList.of(assoc), f.all());

    TargetNode result = translate(f, hash);

    assertThat(result.toString()).isEqualTo("s(:hash, s(:pair, s(:sym, :a), s(:int, 1)))");
    TargetNode pair = result.getChildNode(0);
    assertRange(pair, "operator", ":", 3);
    assertRange(pair.getChildNode(0), "expression", "a", 2);
  }

  @Test
  public void testIndex() {
    CstFixture f = new CstFixture("foo[1]");
    ARef node =
        new ARef(
            f.vcall("foo"), new Args(ImmutableList.of(f.integer("1")), f.loc("1")), f.all());

    TargetNode modern = translate(f, node, new TranslatorOptions());
    assertThat(modern.toString()).isEqualTo("s(:index, s(:send, nil, :foo), s(:int, 1))");
    assertRange(modern, "begin", "[", 3);
    assertRange(modern, "end", "]", 5);

    TargetNode legacy = translate(f, node, TranslatorOptions.legacy());
    assertThat(legacy.toString()).isEqualTo("s(:send, s(:send, nil, :foo), :[], s(:int, 1))");
    assertRange(legacy, "selector", "[1]", 3);
  }

  @Test
  public void testSplatAndBlockPass() {
    CstFixture f = new CstFixture("foo(*a, &b)");
    Args args =
        new Args(
            ImmutableList.of(
                new ArgStar(f.vcall("a"), f.loc("*a")), new ArgBlock(f.vcall("b"), f.loc("&b"))),
            f.loc("*a, &b"));
    CallNode call =
        new CallNode(null, null, f.ident("foo"), new ArgParen(args, f.loc("(*a, &b)")), f.all());

    TargetNode result = translate(f, call);

    assertThat(result.toString())
        .isEqualTo(
            "s(:send, nil, :foo, s(:splat, s(:send, nil, :a)), "
                + "s(:block_pass, s(:send, nil, :b)))");
    assertRange(result.getChildNode(1), "operator", "*", 4);
  }

  @Test
  public void testSignFoldedIntoLiteral() {
    CstFixture f = new CstFixture("-1");
    Unary node = new Unary("-", new Int("1", f.loc("1")), f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString()).isEqualTo("s(:int, -1)");
    assertRange(result, "operator", "-", 0);
  }

  @Test
  public void testNegation() {
    CstFixture f = new CstFixture("!foo");
    TargetNode bang = translate(f, new Unary("!", f.vcall("foo"), f.all()));
    assertThat(bang.toString()).isEqualTo("s(:send, s(:send, nil, :foo), :!)");
    assertRange(bang, "selector", "!", 0);

    CstFixture g = new CstFixture("not x");
    TargetNode not = translate(g, new Not(g.vcall("x"), false, g.all()));
    assertThat(not.toString()).isEqualTo("s(:send, s(:send, nil, :x), :!)");
    assertRange(not, "selector", "not", 0);
  }

  @Test
  public void testMultipleAssignment() {
    CstFixture f = new CstFixture("a, b = 1, 2");
    MLHS targets =
        new MLHS(ImmutableList.of(f.varField("a"), f.varField("b")), false, f.loc("a, b"));
    MRHS values = new MRHS(ImmutableList.of(f.integer("1"), f.integer("2")), f.loc("1, 2"));

    TargetNode result = translate(f, new MAssign(targets, values, f.all()));

    assertThat(result.toString())
        .isEqualTo(
            "s(:masgn, s(:mlhs, s(:lvasgn, :a), s(:lvasgn, :b)), "
                + "s(:array, s(:int, 1), s(:int, 2)))");
    assertRange(result, "operator", "=", 5);
  }

  @Test
  public void testOperatorAssignments() {
    CstFixture f = new CstFixture("x += 1");
    OpAssign add = new OpAssign(f.varField("x"), f.op("+="), f.integer("1"), f.all());
    TargetNode result = translate(f, add);
    assertThat(result.toString()).isEqualTo("s(:op_asgn, s(:lvasgn, :x), :+, s(:int, 1))");
    assertRange(result, "operator", "+=", 2);

    CstFixture g = new CstFixture("a ||= b");
    OpAssign or = new OpAssign(g.varField("a"), g.op("||="), g.vcall("b"), g.all());
    assertThat(translate(g, or).toString())
        .isEqualTo("s(:or_asgn, s(:lvasgn, :a), s(:send, nil, :b))");
  }

  @Test
  public void testConstants() {
    CstFixture f = new CstFixture("Foo::Bar");
    Const foo = new Const("Foo", f.loc("Foo"));
    ConstPathRef path =
        new ConstPathRef(
            new VarRef(foo, foo.location()), new Const("Bar", f.loc("Bar")), f.all());
    TargetNode result = translate(f, path);
    assertThat(result.toString()).isEqualTo("s(:const, s(:const, nil, :Foo), :Bar)");
    assertRange(result, "double_colon", "::", 3);
    assertRange(result, "name", "Bar", 5);

    CstFixture g = new CstFixture("::Foo");
    TargetNode top = translate(g, new TopConstRef(new Const("Foo", g.loc("Foo")), g.all()));
    assertThat(top.toString()).isEqualTo("s(:const, s(:cbase), :Foo)");

    CstFixture h = new CstFixture("Foo = 1");
    Const target = new Const("Foo", h.loc("Foo"));
    Assign assign =
        new Assign(new VarField(target, target.location()), h.integer("1"), h.all());
    TargetNode casgn = translate(h, assign);
    assertThat(casgn.toString()).isEqualTo("s(:casgn, nil, :Foo, s(:int, 1))");
    assertRange(casgn, "operator", "=", 4);
  }

  @Test
  public void testClassDeclaration() {
    CstFixture f = new CstFixture("class Foo < Bar\nend");
    Const foo = new Const("Foo", f.loc("Foo"));
    Const bar = new Const("Bar", f.loc("Bar"));
    ClassDeclaration node =
        new ClassDeclaration(
            new ConstRef(foo, foo.location()),
            new VarRef(bar, bar.location()),
            emptyBody(f, 15, 16),
            f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:class, s(:const, nil, :Foo), s(:const, nil, :Bar), nil)");
    assertRange(result, "keyword", "class", 0);
    assertRange(result, "operator", "<", 10);
    assertRange(result, "name", "Foo", 6);
    assertRange(result, "end", "end", 16);
  }

  @Test
  public void testSingletonMethodDefinition() {
    CstFixture f = new CstFixture("def self.foo; end");
    Kw self = f.kw("self");
    DefNode def =
        new DefNode(
            new VarRef(self, self.location()),
            new Period(".", f.loc(".")),
            f.ident("foo"),
            null,
            emptyBody(f, 12, 13),
            f.all());

    TargetNode result = translate(f, def);

    assertThat(result.toString()).isEqualTo("s(:defs, s(:self), :foo, s(:args), nil)");
    assertRange(result, "operator", ".", 8);
    assertRange(result, "name", "foo", 9);
  }

  @Test
  public void testEndlessMethodDefinition() {
    CstFixture f = new CstFixture("def foo = 1");
    DefNode def = new DefNode(null, null, f.ident("foo"), null, f.integer("1"), f.all());

    TargetNode result = translate(f, def);

    assertThat(result.toString()).isEqualTo("s(:def, :foo, s(:args), s(:int, 1))");
    assertRange(result, "assignment", "=", 8);
    assertThat(result.getLocation().ranges()).doesNotContainKey("end");
  }

  @Test
  public void testBeginRescue() {
    CstFixture f = new CstFixture("begin\n  a\nrescue E => e\n  b\nend");
    Const e = new Const("E", f.loc("E"));
    Rescue rescue =
        new Rescue(
            f.kw("rescue"),
            new RescueEx(new ConstRef(e, e.location()), f.varField("e", 3), f.loc("E => e")),
            f.statements(f.vcall("b", 1)),
            null,
            f.loc(10, 27));
    BodyStmt body =
        new BodyStmt(
            new Statements(ImmutableList.of(f.vcall("a")), f.loc(8, 9)),
            rescue,
            null,
            null,
            null,
            f.loc(8, 27));

    TargetNode result = translate(f, new Begin(body, f.all()));

    assertThat(result.toString())
        .isEqualTo(
            "s(:kwbegin, s(:rescue, s(:send, nil, :a), s(:resbody, s(:array, s(:const, nil, :E)),"
                + " s(:lvasgn, :e), s(:send, nil, :b)), nil))");
    assertRange(result, "begin", "begin", 0);
    TargetNode resbody = result.getChildNode(0).getChildNode(1);
    assertRange(resbody, "keyword", "rescue", 10);
    assertRange(resbody, "assoc", "=>", 19);
  }

  @Test
  public void testPatternMatchingAssignment() {
    CstFixture f = new CstFixture("x => ^y");
    Ident y = f.ident("y");
    RAssign node =
        new RAssign(
            f.vcall("x"),
            f.op("=>"),
            new PinnedVarRef(new VarRef(y, y.location()), f.loc("^y")),
            f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:match_pattern, s(:send, nil, :x), s(:pin, s(:lvar, :y)))");
    assertRange(result.getChildNode(1), "selector", "^", 5);

    CstFixture g = new CstFixture("x => y");
    RAssign binding = new RAssign(g.vcall("x"), g.op("=>"), g.varField("y"), g.all());
    assertThat(translate(g, binding).toString())
        .isEqualTo("s(:match_pattern, s(:send, nil, :x), s(:match_var, :y))");
  }

  @Test
  public void testLiterals() {
    assertThat(translateToken("1.5", FloatLiteral::new).toString())
        .isEqualTo("s(:float, 1.5)");
    assertThat(translateToken("3r", RationalLiteral::new).toString())
        .isEqualTo("s(:rational, (3/1))");
    assertThat(translateToken("2i", Imaginary::new).toString())
        .isEqualTo("s(:complex, (0+2i))");
    assertThat(translateToken("0x1f", Int::new).toString())
        .isEqualTo("s(:int, 31)");
    assertThat(translateToken("$1", Backref::new).toString())
        .isEqualTo("s(:nth_ref, 1)");
    assertThat(translateToken("$&", Backref::new).toString())
        .isEqualTo("s(:back_ref, :$&)");
    assertThat(translateToken("@foo", IVar::new).toString())
        .isEqualTo("s(:ivar, :@foo)");
  }

  @Test
  public void testSignedRationalAndImaginary() {
    CstFixture f = new CstFixture("-1r");
    TargetNode rational =
        translate(f, new Unary("-", new RationalLiteral("1r", f.loc("1r")), f.all()));
    assertThat(rational.toString()).isEqualTo("s(:rational, (-1/1))");
    assertRange(rational, "operator", "-", 0);
    assertRange(rational, "expression", "-1r", 0);

    CstFixture g = new CstFixture("-2i");
    TargetNode complex = translate(g, new Unary("-", new Imaginary("2i", g.loc("2i")), g.all()));
    assertThat(complex.toString()).isEqualTo("s(:complex, (0-2i))");
    assertRange(complex, "operator", "-", 0);

    TargetNode unsigned = translateToken("3r", RationalLiteral::new);
    assertThat(unsigned.getLocation().ranges().get("operator")).isNull();
  }

  @Test
  public void testStrings() {
    CstFixture f = new CstFixture("'foo'");
    StringLiteral plain =
        new StringLiteral(
            ImmutableList.of(new TStringContent("foo", f.loc("foo"))), "'", f.all());
    TargetNode str = translate(f, plain);
    assertThat(str.toString()).isEqualTo("s(:str, \"foo\")");
    assertRange(str, "begin", "'", 0);
    assertRange(str, "end", "'", 4);

    CstFixture g = new CstFixture("\"a#{b}\"");
    StringEmbExpr embed = new StringEmbExpr(g.statements(g.vcall("b")), g.loc("#{b}"));
    StringLiteral interpolated =
        new StringLiteral(
            ImmutableList.of(new TStringContent("a", g.loc("a")), embed), "\"", g.all());
    assertThat(translate(g, interpolated).toString())
        .isEqualTo("s(:dstr, s(:str, \"a\"), s(:begin, s(:send, nil, :b)))");

    CstFixture h = new CstFixture(":foo");
    TargetNode sym = translate(h, new SymbolLiteral(h.ident("foo"), h.all()));
    assertThat(sym.toString()).isEqualTo("s(:sym, :foo)");
    assertRange(sym, "begin", ":", 0);
  }

  @Test
  public void testSingleQuotedStringsKeepEscapes() {
    CstFixture f = new CstFixture("'a\\tb'");
    StringLiteral plain =
        new StringLiteral(
            ImmutableList.of(new TStringContent("a\\tb", f.loc(1, 5))), "'", f.all());
    TargetNode str = translate(f, plain);
    assertThat(str.toString()).isEqualTo("s(:str, \"a\\\\tb\")");
    assertThat(SourceMapValidator.findViolations(str)).isEmpty();

    CstFixture g = new CstFixture("%q(it\\'s \\) \\n)");
    StringLiteral percent =
        new StringLiteral(
            ImmutableList.of(new TStringContent("it\\'s \\) \\n", g.loc(3, 14))),
            "%q(",
            g.all());
    assertThat(translate(g, percent).toString()).isEqualTo("s(:str, \"it\\\\'s ) \\\\n\")");

    CstFixture h = new CstFixture("\"a\\tb\"");
    StringLiteral interpreted =
        new StringLiteral(
            ImmutableList.of(new TStringContent("a\\tb", h.loc(1, 5))), "\"", h.all());
    assertThat(translate(h, interpreted).toString()).isEqualTo("s(:str, \"a\\tb\")");
  }

  @Test
  public void testPercentListsResolveOnlyEscapedSeparators() {
    CstFixture f = new CstFixture("%w[a\\ b c\\d]");
    QWords words =
        new QWords(
            new QWordsBeg("%w[", f.loc("%w[")),
            ImmutableList.of(
                new TStringContent("a\\ b", f.loc(3, 7)),
                new TStringContent("c\\d", f.loc(8, 11))),
            f.all());
    TargetNode array = translate(f, words);
    assertThat(array.toString()).isEqualTo("s(:array, s(:str, \"a b\"), s(:str, \"c\\\\d\"))");

    CstFixture g = new CstFixture("%i[a\\]b]");
    QSymbols symbols =
        new QSymbols(
            new QSymbolsBeg("%i[", g.loc("%i[")),
            ImmutableList.of(new TStringContent("a\\]b", g.loc(3, 7))),
            g.all());
    assertThat(translate(g, symbols).toString()).isEqualTo("s(:array, s(:sym, :\"a]b\"))");
  }

  @Test
  public void testRegexpWithOptions() {
    CstFixture f = new CstFixture("/ab/i");
    RegexpLiteral regexp =
        new RegexpLiteral(
            "/", "/i", ImmutableList.of(new TStringContent("ab", f.loc("ab"))), f.all());

    TargetNode result = translate(f, regexp);

    assertThat(result.toString()).isEqualTo("s(:regexp, s(:str, \"ab\"), s(:regopt, :i))");
    assertRange(result, "begin", "/", 0);
    assertRange(result, "end", "/", 3);
    assertRange(result.getChildNode(1), "expression", "i", 4);
  }

  @Test
  public void testRanges() {
    CstFixture f = new CstFixture("1..2");
    RangeNode range = new RangeNode(f.integer("1"), f.op(".."), f.integer("2"), f.all());

    TargetNode result = translate(f, range);

    assertThat(result.toString()).isEqualTo("s(:irange, s(:int, 1), s(:int, 2))");
    assertRange(result, "operator", "..", 1);
  }

  @Test
  public void testKeywordsAndSpecialVariables() {
    SourceBuffer buffer = new SourceBuffer("lib/foo.rb", 10, "__LINE__");
    CstFixture f = new CstFixture(buffer);
    assertThat(translate(f, f.kw("__LINE__")).toString()).isEqualTo("s(:int, 10)");

    CstFixture g = new CstFixture(new SourceBuffer("lib/foo.rb", "__FILE__"));
    assertThat(translate(g, g.kw("__FILE__")).toString()).isEqualTo("s(:str, \"lib/foo.rb\")");

    CstFixture h = new CstFixture("__ENCODING__");
    assertThat(translate(h, h.kw("__ENCODING__"), new TranslatorOptions()).toString())
        .isEqualTo("s(:__ENCODING__)");
    assertThat(translate(h, h.kw("__ENCODING__"), TranslatorOptions.legacy()).toString())
        .isEqualTo("s(:const, s(:const, nil, :Encoding), :UTF_8)");
  }

  @Test
  public void testDefined() {
    CstFixture f = new CstFixture("defined?(x)");
    TargetNode result = translate(f, new Defined(f.vcall("x"), f.all()));

    assertThat(result.toString()).isEqualTo("s(:defined?, s(:send, nil, :x))");
    assertRange(result, "keyword", "defined?", 0);
    assertRange(result, "begin", "(", 8);
  }

  @Test
  public void testYieldAndZsuper() {
    CstFixture f = new CstFixture("yield 1");
    YieldNode yield =
        new YieldNode(new Args(ImmutableList.of(f.integer("1")), f.loc("1")), f.all());
    TargetNode result = translate(f, yield);
    assertThat(result.toString()).isEqualTo("s(:yield, s(:int, 1))");
    assertRange(result, "keyword", "yield", 0);

    CstFixture g = new CstFixture("super");
    assertThat(translate(g, new ZSuper(g.all())).toString()).isEqualTo("s(:zsuper)");
  }

  @Test
  public void testEmptyProgram() {
    CstFixture f = new CstFixture("");
    Program program = new Program(new Statements(ImmutableList.of(), f.all()), f.all());

    assertThat(Translation.translate(f.buffer(), program)).isNull();
  }

  @Test
  public void testMultipleStatementsBecomeBegin() {
    CstFixture f = new CstFixture("a\nb");
    TargetNode result = Translation.translate(f.buffer(), f.program(f.vcall("a"), f.vcall("b")));

    assertThat(result.toString()).isEqualTo("s(:begin, s(:send, nil, :a), s(:send, nil, :b))");
    assertRange(result, "expression", "a\nb", 0);
  }

  @Test
  public void testCommentsAreSkipped() {
    CstFixture f = new CstFixture("# hi\na");
    Comment comment = new Comment("# hi", false, f.loc("# hi"));
    TargetNode result = Translation.translate(f.buffer(), f.program(comment, f.vcall("a", 0)));

    assertThat(result.toString()).isEqualTo("s(:send, nil, :a)");
  }

  @Test
  public void testStackIsBalanced() {
    CstFixture f = new CstFixture("foo(a: 1)");
    Assoc assoc = new Assoc(new Label("a:", f.loc("a:")), f.integer("1"), f.loc("a: 1"));
    CallNode call =
        new CallNode(
            null,
            null,
            f.ident("foo"),
            new ArgParen(
                new Args(
                    ImmutableList.of(new BareAssocHash(ImmutableList.of(assoc), f.loc("a: 1"))),
                    f.loc("a: 1")),
                f.loc("(a: 1)")),
            f.all());
    Translator translator = new Translator(f.buffer(), new TranslatorOptions());

    translator.translate(f.program(call));

    assertThat(translator.getStackDepth()).isEqualTo(0);
  }

  @Test
  public void testStackIsBalancedAfterFailure() {
    CstFixture f = new CstFixture("a b");
    Assign assign = new Assign(f.varField("a"), f.vcall("b"), f.all());
    Translator translator = new Translator(f.buffer(), new TranslatorOptions());

    TranslationException e =
        assertThrows(TranslationException.class, () -> translator.translate(f.program(assign)));

    assertThat(e).hasMessageThat().contains("Could not find \"=\"");
    assertThat(translator.getStackDepth()).isEqualTo(0);
  }

  @Test
  public void testTokenWithoutTargetFormFails() {
    CstFixture f = new CstFixture(",");
    Program program = f.program(new Comma(",", f.all()));

    TranslationException e =
        assertThrows(
            TranslationException.class, () -> Translation.translate(f.buffer(), program));

    assertThat(e).hasMessageThat().isEqualTo("Cannot translate Comma at offset 0");
  }

  @Test
  public void testSourceMapsAreContained() {
    CstFixture f = new CstFixture("foo.bar(1)");
    CallNode call =
        new CallNode(
            f.vcall("foo"),
            new Period(".", f.loc(".")),
            f.ident("bar"),
            new ArgParen(new Args(ImmutableList.of(f.integer("1")), f.loc("1")), f.loc("(1)")),
            f.all());
    assertThat(SourceMapValidator.findViolations(translate(f, call))).isEmpty();

    CstFixture g = new CstFixture("class Foo < Bar\nend");
    Const foo = new Const("Foo", g.loc("Foo"));
    Const bar = new Const("Bar", g.loc("Bar"));
    ClassDeclaration declaration =
        new ClassDeclaration(
            new ConstRef(foo, foo.location()),
            new VarRef(bar, bar.location()),
            emptyBody(g, 15, 16),
            g.all());
    assertThat(SourceMapValidator.findViolations(translate(g, declaration))).isEmpty();

    CstFixture h = new CstFixture("foo { |x| x }");
    assertThat(SourceMapValidator.findViolations(translate(h, blockWithSingleParameter(h))))
        .isEmpty();
  }

  @Test
  public void testFlipFlopConditions() {
    CstFixture f = new CstFixture("if a..b then c end");
    RangeNode inclusive = new RangeNode(f.vcall("a"), f.op(".."), f.vcall("b"), f.loc("a..b"));
    IfNode node = new IfNode(inclusive, f.statements(f.vcall("c")), null, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo(
            "s(:if, s(:iflipflop, s(:send, nil, :a), s(:send, nil, :b)), s(:send, nil, :c), nil)");
    assertRange(result, "begin", "then", 8);
    assertRange(result.getChildNode(0), "operator", "..", 4);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();

    CstFixture g = new CstFixture("unless a...b then c end");
    RangeNode exclusive = new RangeNode(g.vcall("a"), g.op("..."), g.vcall("b"), g.loc("a...b"));
    TargetNode negated =
        translate(g, new UnlessNode(exclusive, g.statements(g.vcall("c")), null, g.all()));
    assertThat(negated.toString())
        .isEqualTo(
            "s(:if, s(:eflipflop, s(:send, nil, :a), s(:send, nil, :b)), nil, s(:send, nil, :c))");
    assertRange(negated, "keyword", "unless", 0);
    assertThat(SourceMapValidator.findViolations(negated)).isEmpty();

    CstFixture h = new CstFixture("!(a..b)");
    RangeNode range = new RangeNode(h.vcall("a"), h.op(".."), h.vcall("b"), h.loc("a..b"));
    Paren paren =
        new Paren(
            new LParen("(", h.loc("(")),
            new Statements(ImmutableList.of(range), range.location()),
            h.loc("(a..b)"));
    TargetNode not = translate(h, new Unary("!", paren, h.all()));
    assertThat(not.toString())
        .isEqualTo("s(:send, s(:begin, s(:iflipflop, s(:send, nil, :a), s(:send, nil, :b))), :!)");
    assertRange(not, "selector", "!", 0);
    assertThat(SourceMapValidator.findViolations(not)).isEmpty();
  }

  @Test
  public void testUnlessElse() {
    CstFixture f = new CstFixture("unless x then y else z end");
    Else otherwise = new Else(f.kw("else"), f.statements(f.vcall("z")), f.loc(16, 22));
    UnlessNode node = new UnlessNode(f.vcall("x"), f.statements(f.vcall("y")), otherwise, f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:if, s(:send, nil, :x), s(:send, nil, :z), s(:send, nil, :y))");
    assertRange(result, "keyword", "unless", 0);
    assertRange(result, "else", "else", 16);
    assertRange(result, "end", "end", 23);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testRegexpMatches() {
    CstFixture f = new CstFixture("/(?<x>a)/ =~ y");
    RegexpLiteral named =
        new RegexpLiteral(
            "/",
            "/",
            ImmutableList.of(new TStringContent("(?<x>a)", f.loc("(?<x>a)"))),
            f.loc("/(?<x>a)/"));

    TargetNode result = translate(f, new Binary(named, "=~", f.vcall("y"), f.all()));

    assertThat(result.toString())
        .isEqualTo(
            "s(:match_with_lvasgn, s(:regexp, s(:str, \"(?<x>a)\"), s(:regopt)), "
                + "s(:send, nil, :y))");
    assertRange(result, "operator", "=~", 10);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();

    CstFixture g = new CstFixture("if /a/ then b end");
    RegexpLiteral bare =
        new RegexpLiteral(
            "/", "/", ImmutableList.of(new TStringContent("a", g.loc("a"))), g.loc("/a/"));
    TargetNode condition =
        translate(g, new IfNode(bare, g.statements(g.vcall("b")), null, g.all()));
    assertThat(condition.toString())
        .isEqualTo(
            "s(:if, s(:match_current_line, s(:regexp, s(:str, \"a\"), s(:regopt))), "
                + "s(:send, nil, :b), nil)");
    assertRange(condition.getChildNode(0), "expression", "/a/", 3);
    assertThat(SourceMapValidator.findViolations(condition)).isEmpty();

    CstFixture h = new CstFixture("!/a/");
    RegexpLiteral negated =
        new RegexpLiteral(
            "/", "/", ImmutableList.of(new TStringContent("a", h.loc("a"))), h.loc("/a/"));
    TargetNode not = translate(h, new Unary("!", negated, h.all()));
    assertThat(not.toString())
        .isEqualTo("s(:send, s(:match_current_line, s(:regexp, s(:str, \"a\"), s(:regopt))), :!)");
    assertThat(SourceMapValidator.findViolations(not)).isEmpty();
  }

  @Test
  public void testPatternBindingWithAs() {
    CstFixture f = new CstFixture("case x; in Integer => v; end");
    Const integer = new Const("Integer", f.loc("Integer"));
    Binary binding =
        new Binary(
            new VarRef(integer, integer.location()), "=>", f.varField("v"), f.loc("Integer => v"));

    TargetNode result = translate(f, caseIn(f, binding, 23));

    assertThat(result.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), s(:in_pattern, "
                + "s(:match_as, s(:const, nil, :Integer), s(:match_var, :v)), nil, nil), nil)");
    assertRange(result.getChildNode(1).getChildNode(0), "operator", "=>", 19);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testPatternGuards() {
    CstFixture f = new CstFixture("case x; in v if v; end");
    IfNode ifGuard =
        new IfNode(f.varRef("v", 1), f.statements(f.varField("v")), null, f.loc("v if v"));
    TargetNode guarded = translate(f, caseIn(f, ifGuard, 17));
    assertThat(guarded.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), s(:in_pattern, s(:match_var, :v), "
                + "s(:if_guard, s(:lvar, :v)), nil), nil)");
    assertThat(SourceMapValidator.findViolations(guarded)).isEmpty();

    CstFixture g = new CstFixture("case x; in v unless v; end");
    UnlessNode unlessGuard =
        new UnlessNode(g.varRef("v", 1), g.statements(g.varField("v")), null, g.loc("v unless v"));
    assertThat(translate(g, caseIn(g, unlessGuard, 21)).toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), s(:in_pattern, s(:match_var, :v), "
                + "s(:unless_guard, s(:lvar, :v)), nil), nil)");
  }

  @Test
  public void testHashPattern() {
    CstFixture f = new CstFixture("case x; in {a: 1, b:, **nil}; end");
    HshPtn pattern =
        new HshPtn(
            null,
            ImmutableList.of(
                new HshPtn.Entry(new Label("a:", f.loc("a:")), f.integer("1")),
                new HshPtn.Entry(new Label("b:", f.loc("b:")), null)),
            new VarField(f.kw("nil"), f.loc("**nil")),
            f.loc("{a: 1, b:, **nil}"));

    TargetNode result = translate(f, caseIn(f, pattern, 28));

    assertThat(result.toString())
        .isEqualTo(
            "s(:case_match, s(:send, nil, :x), s(:in_pattern, s(:hash_pattern, "
                + "s(:pair, s(:sym, :a), s(:int, 1)), s(:match_var, :b), s(:match_nil_pattern)), "
                + "nil, nil), nil)");
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testFindPattern() {
    CstFixture f = new CstFixture("case x; in [*, 1, *r]; end");
    FndPtn pattern =
        new FndPtn(
            null,
            new VarField(null, f.loc(12, 13)),
            ImmutableList.of(f.integer("1")),
            new VarField(f.ident("r"), f.loc("*r")),
            f.loc("[*, 1, *r]"));

    TargetNode result = translate(f, caseIn(f, pattern, 21));

    TargetNode find = result.getChildNode(1).getChildNode(0);
    assertThat(find.toString())
        .isEqualTo(
            "s(:find_pattern, s(:match_rest), s(:int, 1), s(:match_rest, s(:match_var, :r)))");
    assertRange(find, "begin", "[", 11);
    assertRange(find, "end", "]", 20);
    assertRange(find.getChildNode(0), "operator", "*", 12);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testConstantPattern() {
    CstFixture f = new CstFixture("case x; in Foo[1]; end");
    Const foo = new Const("Foo", f.loc("Foo"));
    AryPtn pattern =
        new AryPtn(
            new VarRef(foo, foo.location()),
            ImmutableList.of(f.integer("1")),
            null,
            ImmutableList.of(),
            f.loc("Foo[1]"));

    TargetNode result = translate(f, caseIn(f, pattern, 17));

    TargetNode constant = result.getChildNode(1).getChildNode(0);
    assertThat(constant.toString())
        .isEqualTo("s(:const_pattern, s(:const, nil, :Foo), s(:array_pattern, s(:int, 1)))");
    assertRange(constant, "begin", "[", 14);
    assertRange(constant, "end", "]", 16);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testCommandHeredoc() {
    CstFixture f = new CstFixture("<<~`CMD`\n  ls\n  pwd\nCMD\n");
    Heredoc heredoc =
        new Heredoc(
            new HeredocBeg("<<~`CMD`", f.loc("<<~`CMD`")),
            new HeredocEnd("CMD\n", f.loc(20, 24)),
            2,
            ImmutableList.of(new TStringContent("  ls\n  pwd\n", f.loc(9, 20))),
            f.loc("<<~`CMD`"));

    TargetNode result = translate(f, heredoc);

    assertThat(result.toString()).isEqualTo("s(:xstr, s(:str, \"ls\\n\"), s(:str, \"pwd\\n\"))");
    assertRange(result, "heredoc_end", "CMD", 20);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testBeginEnsure() {
    CstFixture f = new CstFixture("begin\n  a\nensure\n  b\nend");
    Ensure ensure = new Ensure(f.kw("ensure"), f.statements(f.vcall("b", 1)), f.loc(10, 20));
    BodyStmt body =
        new BodyStmt(
            new Statements(ImmutableList.of(f.vcall("a")), f.loc(8, 9)),
            null,
            null,
            null,
            ensure,
            f.loc(8, 20));

    TargetNode result = translate(f, new Begin(body, f.all()));

    assertThat(result.toString())
        .isEqualTo("s(:kwbegin, s(:ensure, s(:send, nil, :a), s(:send, nil, :b)))");
    assertRange(result.getChildNode(0), "keyword", "ensure", 10);
    assertRange(result.getChildNode(0), "expression", "a\nensure\n  b", 8);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testUntilAndPostLoops() {
    CstFixture f = new CstFixture("until x do y end");
    TargetNode until =
        translate(f, new UntilNode(f.vcall("x"), f.statements(f.vcall("y")), f.all()));
    assertThat(until.toString()).isEqualTo("s(:until, s(:send, nil, :x), s(:send, nil, :y))");
    assertRange(until, "keyword", "until", 0);
    assertRange(until, "begin", "do", 8);
    assertRange(until, "end", "end", 13);
    assertThat(SourceMapValidator.findViolations(until)).isEmpty();

    CstFixture g = new CstFixture("begin a end until b");
    Begin untilBody = new Begin(postLoopBody(g), g.loc(0, 11));
    TargetNode untilPost =
        translate(g, new UntilNode(g.vcall("b", 1), g.statements(untilBody), g.all()));
    assertThat(untilPost.toString())
        .isEqualTo("s(:until_post, s(:send, nil, :b), s(:kwbegin, s(:send, nil, :a)))");
    assertRange(untilPost, "keyword", "until", 12);
    assertThat(SourceMapValidator.findViolations(untilPost)).isEmpty();

    CstFixture h = new CstFixture("begin a end while b");
    Begin whileBody = new Begin(postLoopBody(h), h.loc(0, 11));
    TargetNode whilePost =
        translate(h, new WhileNode(h.vcall("b", 1), h.statements(whileBody), h.all()));
    assertThat(whilePost.toString())
        .isEqualTo("s(:while_post, s(:send, nil, :b), s(:kwbegin, s(:send, nil, :a)))");
    assertRange(whilePost, "keyword", "while", 12);
  }

  @Test
  public void testForLoop() {
    CstFixture f = new CstFixture("for i in xs do i end");
    For node = new For(f.varField("i"), f.vcall("xs"), f.statements(f.varRef("i", 2)), f.all());

    TargetNode result = translate(f, node);

    assertThat(result.toString())
        .isEqualTo("s(:for, s(:lvasgn, :i), s(:send, nil, :xs), s(:lvar, :i))");
    assertRange(result, "keyword", "for", 0);
    assertRange(result, "in", "in", 6);
    assertRange(result, "begin", "do", 12);
    assertRange(result, "end", "end", 17);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();
  }

  @Test
  public void testModuleAndSingletonClass() {
    CstFixture f = new CstFixture("module Foo; end");
    Const foo = new Const("Foo", f.loc("Foo"));
    ModuleDeclaration module =
        new ModuleDeclaration(new ConstRef(foo, foo.location()), emptyBody(f, 10, 12), f.all());
    TargetNode result = translate(f, module);
    assertThat(result.toString()).isEqualTo("s(:module, s(:const, nil, :Foo), nil)");
    assertRange(result, "keyword", "module", 0);
    assertRange(result, "name", "Foo", 7);
    assertRange(result, "end", "end", 12);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();

    CstFixture g = new CstFixture("class << self; end");
    Kw self = g.kw("self");
    SClass sclass = new SClass(new VarRef(self, self.location()), emptyBody(g, 13, 15), g.all());
    TargetNode singleton = translate(g, sclass);
    assertThat(singleton.toString()).isEqualTo("s(:sclass, s(:self), nil)");
    assertRange(singleton, "keyword", "class", 0);
    assertRange(singleton, "operator", "<<", 6);
    assertRange(singleton, "end", "end", 15);
    assertThat(SourceMapValidator.findViolations(singleton)).isEmpty();
  }

  @Test
  public void testAliasAndUndef() {
    CstFixture f = new CstFixture("alias $a $b");
    AliasNode alias =
        new AliasNode(new GVar("$a", f.loc("$a")), new GVar("$b", f.loc("$b")), f.all());
    TargetNode aliased = translate(f, alias);
    assertThat(aliased.toString()).isEqualTo("s(:alias, s(:gvar, :$a), s(:gvar, :$b))");
    assertRange(aliased, "keyword", "alias", 0);
    assertThat(SourceMapValidator.findViolations(aliased)).isEmpty();

    CstFixture g = new CstFixture("undef foo, :bar");
    Undef undef =
        new Undef(
            ImmutableList.of(
                new SymbolLiteral(g.ident("foo"), g.loc("foo")),
                new SymbolLiteral(g.ident("bar"), g.loc(":bar"))),
            g.all());
    TargetNode undefined = translate(g, undef);
    assertThat(undefined.toString()).isEqualTo("s(:undef, s(:sym, :foo), s(:sym, :bar))");
    assertRange(undefined, "keyword", "undef", 0);
    assertRange(undefined.getChildNode(1), "begin", ":", 11);
    assertThat(SourceMapValidator.findViolations(undefined)).isEmpty();
  }

  @Test
  public void testForwardedParameters() {
    CstFixture f = new CstFixture("def foo(...); end");
    Params params =
        new Params(
            ImmutableList.of(),
            ImmutableList.of(),
            null,
            ImmutableList.of(),
            ImmutableList.of(),
            new ArgsForward(f.loc("...")),
            null,
            f.loc("..."));
    DefNode def =
        new DefNode(
            null,
            null,
            f.ident("foo"),
            new Paren(new LParen("(", f.loc("(")), params, f.loc("(...)")),
            emptyBody(f, 12, 14),
            f.all());

    TargetNode result = translate(f, def);
    assertThat(result.toString()).isEqualTo("s(:def, :foo, s(:args, s(:forward_arg)), nil)");
    assertRange(result.getChildNode(1), "begin", "(", 7);
    assertRange(result.getChildNode(1).getChildNode(0), "expression", "...", 8);
    assertThat(SourceMapValidator.findViolations(result)).isEmpty();

    TranslatorOptions legacy = new TranslatorOptions();
    legacy.setEmitForwardArg(false);
    assertThat(translate(f, def, legacy).toString())
        .isEqualTo("s(:def, :foo, s(:forward_args), nil)");
  }

  @Test
  public void testNullBufferIsRejected() {
    CstFixture f = new CstFixture("foo");
    Program program = f.program(f.vcall("foo"));
    assertThrows(NullPointerException.class, () -> Translation.translate(null, program));
  }

  /** A case/in over {@code x} whose one clause runs from offset 8 to a {@code ;}. */
  private static Case caseIn(CstFixture f, Node pattern, int semicolon) {
    Statements empty =
        new Statements(
            ImmutableList.of(new VoidStmt(ImmutableList.of(), f.loc(semicolon, semicolon))),
            f.loc(semicolon, semicolon + 2));
    In in = new In(pattern, empty, null, f.loc(8, semicolon + 2));
    return new Case(f.kw("case"), f.vcall("x"), in, f.all());
  }

  /** The body of {@code begin a end}. */
  private static BodyStmt postLoopBody(CstFixture f) {
    return new BodyStmt(f.statements(f.vcall("a")), null, null, null, null, f.loc(6, 7));
  }

  private static BodyStmt emptyBody(CstFixture f, int start, int end) {
    Statements statements =
        new Statements(
            ImmutableList.of(new VoidStmt(ImmutableList.of(), f.loc(start, start))),
            f.loc(start, end));
    return new BodyStmt(statements, null, null, null, null, f.loc(start, end));
  }

  private static TargetNode translateToken(
      String text, BiFunction<String, Location, Node> factory) {
    CstFixture f = new CstFixture(text);
    return translate(f, factory.apply(text, f.all()));
  }

  private static TargetNode translate(CstFixture f, Node statement) {
    return translate(f, statement, new TranslatorOptions());
  }

  private static TargetNode translate(CstFixture f, Node statement, TranslatorOptions options) {
    TargetNode result = Translation.translate(f.buffer(), f.program(statement), options);
    assertThat(result).isNotNull();
    return result;
  }

  private static void assertRange(TargetNode node, String name, String source, int begin) {
    SourceRange range = node.getLocation().ranges().get(name);
    assertWithMessage("%s of %s", name, node).that(range).isNotNull();
    assertThat(range.getSource()).isEqualTo(source);
    assertThat(range.getBeginPos()).isEqualTo(begin);
  }
}
