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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.syntaxtree.ast.ComplexValue;
import com.google.syntaxtree.ast.NodeType;
import com.google.syntaxtree.ast.NumericLiterals;
import com.google.syntaxtree.ast.RationalValue;
import com.google.syntaxtree.ast.Symbol;
import com.google.syntaxtree.ast.TargetNode;
import com.google.syntaxtree.cst.ARef;
import com.google.syntaxtree.cst.ARefField;
import com.google.syntaxtree.cst.AliasNode;
import com.google.syntaxtree.cst.ArgBlock;
import com.google.syntaxtree.cst.ArgParen;
import com.google.syntaxtree.cst.ArgStar;
import com.google.syntaxtree.cst.Args;
import com.google.syntaxtree.cst.ArgsForward;
import com.google.syntaxtree.cst.ArrayLiteral;
import com.google.syntaxtree.cst.AryPtn;
import com.google.syntaxtree.cst.Assign;
import com.google.syntaxtree.cst.Assoc;
import com.google.syntaxtree.cst.AssocSplat;
import com.google.syntaxtree.cst.BEGINBlock;
import com.google.syntaxtree.cst.Backref;
import com.google.syntaxtree.cst.Backtick;
import com.google.syntaxtree.cst.BareAssocHash;
import com.google.syntaxtree.cst.Begin;
import com.google.syntaxtree.cst.Binary;
import com.google.syntaxtree.cst.BlockArg;
import com.google.syntaxtree.cst.BlockNode;
import com.google.syntaxtree.cst.BlockVar;
import com.google.syntaxtree.cst.BodyStmt;
import com.google.syntaxtree.cst.Break;
import com.google.syntaxtree.cst.CHAR;
import com.google.syntaxtree.cst.CVar;
import com.google.syntaxtree.cst.CallNode;
import com.google.syntaxtree.cst.Case;
import com.google.syntaxtree.cst.ClassDeclaration;
import com.google.syntaxtree.cst.Comma;
import com.google.syntaxtree.cst.Command;
import com.google.syntaxtree.cst.CommandCall;
import com.google.syntaxtree.cst.Comment;
import com.google.syntaxtree.cst.Const;
import com.google.syntaxtree.cst.ConstPathField;
import com.google.syntaxtree.cst.ConstPathRef;
import com.google.syntaxtree.cst.ConstRef;
import com.google.syntaxtree.cst.DefNode;
import com.google.syntaxtree.cst.Defined;
import com.google.syntaxtree.cst.DynaSymbol;
import com.google.syntaxtree.cst.ENDBlock;
import com.google.syntaxtree.cst.Else;
import com.google.syntaxtree.cst.Elsif;
import com.google.syntaxtree.cst.EmbDoc;
import com.google.syntaxtree.cst.EmbExprBeg;
import com.google.syntaxtree.cst.EmbExprEnd;
import com.google.syntaxtree.cst.EmbVar;
import com.google.syntaxtree.cst.EndContent;
import com.google.syntaxtree.cst.Ensure;
import com.google.syntaxtree.cst.ExcessedComma;
import com.google.syntaxtree.cst.Field;
import com.google.syntaxtree.cst.FloatLiteral;
import com.google.syntaxtree.cst.FndPtn;
import com.google.syntaxtree.cst.For;
import com.google.syntaxtree.cst.GVar;
import com.google.syntaxtree.cst.HashLiteral;
import com.google.syntaxtree.cst.HeredocBeg;
import com.google.syntaxtree.cst.HeredocEnd;
import com.google.syntaxtree.cst.Heredoc;
import com.google.syntaxtree.cst.HshPtn;
import com.google.syntaxtree.cst.IVar;
import com.google.syntaxtree.cst.Ident;
import com.google.syntaxtree.cst.IfNode;
import com.google.syntaxtree.cst.IfOp;
import com.google.syntaxtree.cst.Imaginary;
import com.google.syntaxtree.cst.In;
import com.google.syntaxtree.cst.Int;
import com.google.syntaxtree.cst.Kw;
import com.google.syntaxtree.cst.KwRestParam;
import com.google.syntaxtree.cst.LBrace;
import com.google.syntaxtree.cst.LBracket;
import com.google.syntaxtree.cst.LParen;
import com.google.syntaxtree.cst.Label;
import com.google.syntaxtree.cst.LabelEnd;
import com.google.syntaxtree.cst.Lambda;
import com.google.syntaxtree.cst.LambdaVar;
import com.google.syntaxtree.cst.MAssign;
import com.google.syntaxtree.cst.MLHS;
import com.google.syntaxtree.cst.MLHSParen;
import com.google.syntaxtree.cst.MRHS;
import com.google.syntaxtree.cst.MethodAddBlock;
import com.google.syntaxtree.cst.ModuleDeclaration;
import com.google.syntaxtree.cst.Next;
import com.google.syntaxtree.cst.Node;
import com.google.syntaxtree.cst.Not;
import com.google.syntaxtree.cst.Op;
import com.google.syntaxtree.cst.OpAssign;
import com.google.syntaxtree.cst.Params;
import com.google.syntaxtree.cst.Paren;
import com.google.syntaxtree.cst.Period;
import com.google.syntaxtree.cst.PinnedBegin;
import com.google.syntaxtree.cst.PinnedVarRef;
import com.google.syntaxtree.cst.Program;
import com.google.syntaxtree.cst.QSymbols;
import com.google.syntaxtree.cst.QSymbolsBeg;
import com.google.syntaxtree.cst.QWords;
import com.google.syntaxtree.cst.QWordsBeg;
import com.google.syntaxtree.cst.RAssign;
import com.google.syntaxtree.cst.RBrace;
import com.google.syntaxtree.cst.RBracket;
import com.google.syntaxtree.cst.RParen;
import com.google.syntaxtree.cst.RangeNode;
import com.google.syntaxtree.cst.RationalLiteral;
import com.google.syntaxtree.cst.Redo;
import com.google.syntaxtree.cst.RegexpBeg;
import com.google.syntaxtree.cst.RegexpContent;
import com.google.syntaxtree.cst.RegexpEnd;
import com.google.syntaxtree.cst.RegexpLiteral;
import com.google.syntaxtree.cst.Rescue;
import com.google.syntaxtree.cst.RescueEx;
import com.google.syntaxtree.cst.RescueMod;
import com.google.syntaxtree.cst.RestParam;
import com.google.syntaxtree.cst.Retry;
import com.google.syntaxtree.cst.ReturnNode;
import com.google.syntaxtree.cst.SClass;
import com.google.syntaxtree.cst.SourceBuffer;
import com.google.syntaxtree.cst.Statements;
import com.google.syntaxtree.cst.StringConcat;
import com.google.syntaxtree.cst.StringContent;
import com.google.syntaxtree.cst.StringDVar;
import com.google.syntaxtree.cst.StringEmbExpr;
import com.google.syntaxtree.cst.StringLiteral;
import com.google.syntaxtree.cst.Super;
import com.google.syntaxtree.cst.SymBeg;
import com.google.syntaxtree.cst.SymbolContent;
import com.google.syntaxtree.cst.SymbolLiteral;
import com.google.syntaxtree.cst.Symbols;
import com.google.syntaxtree.cst.SymbolsBeg;
import com.google.syntaxtree.cst.TLamBeg;
import com.google.syntaxtree.cst.TLambda;
import com.google.syntaxtree.cst.TStringBeg;
import com.google.syntaxtree.cst.TStringContent;
import com.google.syntaxtree.cst.TStringEnd;
import com.google.syntaxtree.cst.Token;
import com.google.syntaxtree.cst.TopConstField;
import com.google.syntaxtree.cst.TopConstRef;
import com.google.syntaxtree.cst.Unary;
import com.google.syntaxtree.cst.Undef;
import com.google.syntaxtree.cst.UnlessNode;
import com.google.syntaxtree.cst.UntilNode;
import com.google.syntaxtree.cst.VCall;
import com.google.syntaxtree.cst.VarField;
import com.google.syntaxtree.cst.VarRef;
import com.google.syntaxtree.cst.Visitor;
import com.google.syntaxtree.cst.VoidStmt;
import com.google.syntaxtree.cst.When;
import com.google.syntaxtree.cst.WhileNode;
import com.google.syntaxtree.cst.Word;
import com.google.syntaxtree.cst.Words;
import com.google.syntaxtree.cst.WordsBeg;
import com.google.syntaxtree.cst.XString;
import com.google.syntaxtree.cst.XStringLiteral;
import com.google.syntaxtree.cst.YieldNode;
import com.google.syntaxtree.cst.ZSuper;
import com.google.syntaxtree.sourcemap.SourceMap;
import com.google.syntaxtree.sourcemap.SourceRange;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Translates an origin tree into the parser gem's abstract syntax tree, one visit method per
 * origin node type.
 *
 * <p>Every translated node is pushed onto an {@link AncestorStack} while it is visited, so rules
 * can depend on where a node appears. Nodes synthesized during translation, such as the calls
 * built for operators, go through {@link #visit} like any other node; the rewrites that only
 * reshape a node into a {@link CommandCall} are translated in place without a push.
 *
 * <p>A translator is used for a single tree and then thrown away.
 */
final class Translator implements Visitor<@Nullable TargetNode> {
  private static final Logger logger = Logger.getLogger(Translator.class.getName());

  private static final Pattern NTH_REF = Pattern.compile("\\$[0-9]+");
  private static final Pattern NUMBERED_PARAMETER = Pattern.compile("_([1-9])");
  private static final Pattern SINGLE_QUOTE = Pattern.compile(":?'|%[qs]");
  private static final Pattern XSTRING_HEREDOC = Pattern.compile("`\\w+`$");

  private final SourceBuffer buffer;
  private final TranslatorOptions options;
  private final SourceRanges ranges;
  private final Canonicalizer canonicalizer;
  private final AncestorStack stack = new AncestorStack();

  Translator(SourceBuffer buffer, TranslatorOptions options) {
    this.buffer = checkNotNull(buffer);
    this.options = checkNotNull(options);
    this.ranges = new SourceRanges(buffer);
    this.canonicalizer = new Canonicalizer(buffer);
  }

  /** Translates a whole tree. Returns null for a program with no statements. */
  @Nullable TargetNode translate(Node root) {
    TargetNode result = visit(root);
    checkState(stack.isEmpty(), "Unbalanced ancestor stack");
    return result;
  }

  @Nullable TargetNode visit(@Nullable Node node) {
    if (node == null) {
      return null;
    }
    stack.push(node);
    try {
      return node.accept(this);
    } finally {
      stack.pop();
    }
  }

  int getStackDepth() {
    return stack.size();
  }

  private List<@Nullable Object> visitAll(List<? extends Node> nodes) {
    List<@Nullable Object> result = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      result.add(visit(node));
    }
    return result;
  }

  // Literals

  @Override
  public TargetNode visitArrayLiteral(ArrayLiteral node) {
    List<@Nullable Object> children =
        node.contents() == null ? new ArrayList<>() : visitAll(node.contents().parts());
    SourceMap location =
        node.lbracket() == null
            ? bare(rangeOf(node))
            : new SourceMap.Collection(
                rangeOf(node.lbracket()), ranges.at(node.endChar(), -1), rangeOf(node));
    return s(NodeType.ARRAY, children, location);
  }

  @Override
  public TargetNode visitBackref(Backref node) {
    SourceMap location = new SourceMap.Map(rangeOf(node));
    if (NTH_REF.matcher(node.value()).matches()) {
      return s(
          NodeType.NTH_REF, list(new BigInteger(node.value().substring(1))), location);
    }
    return s(NodeType.BACK_REF, list(Symbol.of(node.value())), location);
  }

  @Override
  public TargetNode visitBareAssocHash(BareAssocHash node) {
    NodeType type =
        options.shouldEmitKwargs() && !(stack.peek(1) instanceof ArrayLiteral)
            ? NodeType.KWARGS
            : NodeType.HASH;
    return s(type, visitAll(node.assocs()), bare(rangeOf(node)));
  }

  @Override
  public TargetNode visitCHAR(CHAR node) {
    return s(
        NodeType.STR,
        list(node.value().substring(1)),
        new SourceMap.Collection(ranges.at(node.startChar(), 1), null, rangeOf(node)));
  }

  @Override
  public TargetNode visitDynaSymbol(DynaSymbol node) {
    SourceMap location =
        node.quote() == null
            ? bare(rangeOf(node))
            : new SourceMap.Collection(
                ranges.at(node.startChar(), node.quote().length()),
                ranges.at(node.endChar(), -1),
                rangeOf(node));
    if (node.parts().size() == 1 && node.parts().get(0) instanceof TStringContent) {
      String value = ((TStringContent) node.parts().get(0)).value();
      return s(NodeType.SYM, list(Symbol.of(unescape(value))), location);
    }
    return s(NodeType.DSYM, visitAll(node.parts()), location);
  }

  @Override
  public TargetNode visitFloatLiteral(FloatLiteral node) {
    double value;
    try {
      value = NumericLiterals.parseFloat(node.value());
    } catch (NumberFormatException e) {
      throw new TranslationException("Invalid float literal " + node.value(), e);
    }
    return s(NodeType.FLOAT, list(value), new SourceMap.Operator(signOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitHashLiteral(HashLiteral node) {
    return s(
        NodeType.HASH,
        visitAll(node.assocs()),
        new SourceMap.Collection(
            ranges.at(node.startChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node)));
  }

  @Override
  public TargetNode visitHeredoc(Heredoc node) {
    HeredocBuilder heredoc = new HeredocBuilder(node);

    // Literal parts that span lines become one fragment per line.
    for (Node part : node.parts()) {
      if (part instanceof TStringContent && countLineBreaks(((TStringContent) part).value()) > 1) {
        String value = ((TStringContent) part).value();
        int index = part.startChar();
        int lineStart = 0;
        while (lineStart < value.length()) {
          int lineEnd = value.indexOf('\n', lineStart);
          lineEnd = lineEnd < 0 ? value.length() : lineEnd + 1;
          SourceRange range = ranges.range(index + lineStart, index + lineEnd);
          String line = unescape(value.substring(lineStart, lineEnd));
          heredoc.add(s(NodeType.STR, list(line), bare(range)));
          lineStart = lineEnd;
        }
      } else {
        heredoc.add(checkTranslated(part, visit(part)));
      }
    }
    heredoc.trim();

    int bodyStart =
        node.parts().isEmpty() ? node.beginning().endChar() + 1 : node.parts().get(0).startChar();
    SourceMap location =
        new SourceMap.Heredoc(
            rangeOf(node.beginning()),
            ranges.range(bodyStart, node.ending().startChar()),
            ranges.range(node.ending().startChar(), node.ending().endChar() - 1));

    List<TargetNode> segments = heredoc.getSegments();
    if (XSTRING_HEREDOC.matcher(node.beginning().value()).find()) {
      return s(NodeType.XSTR, new ArrayList<>(segments), location);
    } else if (segments.size() == 1) {
      TargetNode segment = segments.get(0);
      return s(segment.getType(), segment.getChildren(), location);
    }
    return s(NodeType.DSTR, new ArrayList<>(segments), location);
  }

  @Override
  public TargetNode visitImaginary(Imaginary node) {
    ComplexValue value;
    try {
      value = NumericLiterals.parseImaginary(node.value());
    } catch (NumberFormatException e) {
      throw new TranslationException("Invalid imaginary literal " + node.value(), e);
    }
    return s(NodeType.COMPLEX, list(value), new SourceMap.Operator(signOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitInt(Int node) {
    BigInteger value;
    try {
      value = NumericLiterals.parseInteger(node.value());
    } catch (NumberFormatException e) {
      throw new TranslationException("Invalid integer literal " + node.value(), e);
    }
    return s(NodeType.INT, list(value), new SourceMap.Operator(signOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitKw(Kw node) {
    SourceMap location = new SourceMap.Map(rangeOf(node));
    switch (node.value()) {
      case "__FILE__":
        return s(NodeType.STR, list(buffer.getName()), location);
      case "__LINE__":
        int line = node.location().startLine() + buffer.getFirstLine() - 1;
        return s(NodeType.INT, list(BigInteger.valueOf(line)), location);
      case "__ENCODING__":
        if (options.shouldEmitEncoding()) {
          return s(NodeType.ENCODING, location);
        }
        return s(
            NodeType.CONST,
            list(TargetNode.s(NodeType.CONST, null, Symbol.of("Encoding")), Symbol.of("UTF_8")),
            location);
      case "nil":
        return s(NodeType.NIL, location);
      case "true":
        return s(NodeType.TRUE, location);
      case "false":
        return s(NodeType.FALSE, location);
      case "self":
        return s(NodeType.SELF, location);
      default:
        throw new TranslationException(
            "Keyword " + node.value() + " cannot appear on its own at offset " + node.startChar());
    }
  }

  @Override
  public TargetNode visitLabel(Label node) {
    return s(
        NodeType.SYM,
        list(Symbol.of(chomp(node.value(), ":"))),
        bare(ranges.range(node.startChar(), node.endChar() - 1)));
  }

  @Override
  public TargetNode visitQSymbols(QSymbols node) {
    List<Node> parts = new ArrayList<>();
    for (TStringContent element : node.elements()) {
      parts.add(new SymbolLiteral(element, element.location()));
    }
    return visitArrayLiteral(
        new ArrayLiteral(node.beginning(), new Args(parts, node.location()), node.location()));
  }

  @Override
  public TargetNode visitQWords(QWords node) {
    return visitArrayLiteral(
        new ArrayLiteral(
            node.beginning(),
            new Args(ImmutableList.<Node>copyOf(node.elements()), node.location()),
            node.location()));
  }

  @Override
  public TargetNode visitRangeNode(RangeNode node) {
    return s(
        node.operator().value().equals("..") ? NodeType.IRANGE : NodeType.ERANGE,
        list(visit(node.left()), visit(node.right())),
        new SourceMap.Operator(rangeOf(node.operator()), rangeOf(node)));
  }

  @Override
  public TargetNode visitRationalLiteral(RationalLiteral node) {
    RationalValue value;
    try {
      value = NumericLiterals.parseRational(node.value());
    } catch (NumberFormatException e) {
      throw new TranslationException("Invalid rational literal " + node.value(), e);
    }
    return s(
        NodeType.RATIONAL, list(value), new SourceMap.Operator(signOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitRegexpLiteral(RegexpLiteral node) {
    List<Symbol> flags = new ArrayList<>();
    for (char c : node.ending().toCharArray()) {
      if (c >= 'a' && c <= 'z') {
        flags.add(Symbol.of(String.valueOf(c)));
      }
    }
    Collections.sort(flags);

    List<@Nullable Object> children = visitAll(node.parts());
    children.add(
        s(
            NodeType.REGOPT,
            new ArrayList<>(flags),
            new SourceMap.Map(ranges.at(node.endChar(), -(node.ending().length() - 1)))));
    return s(
        NodeType.REGEXP,
        children,
        new SourceMap.Collection(
            ranges.at(node.startChar(), node.beginning().length()),
            ranges.at(node.endChar() - node.ending().length(), 1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitStringConcat(StringConcat node) {
    return s(
        NodeType.DSTR, list(visit(node.left()), visit(node.right())), bare(rangeOf(node)));
  }

  @Override
  public @Nullable TargetNode visitStringDVar(StringDVar node) {
    return visit(node.variable());
  }

  @Override
  public TargetNode visitStringEmbExpr(StringEmbExpr node) {
    TargetNode child = visit(node.statements());
    return s(
        NodeType.BEGIN,
        child == null ? new ArrayList<>() : list(child),
        new SourceMap.Collection(
            ranges.at(node.startChar(), 2), ranges.at(node.endChar(), -1), rangeOf(node)));
  }

  @Override
  public TargetNode visitStringLiteral(StringLiteral node) {
    SourceMap location =
        node.quote() == null
            ? bare(rangeOf(node))
            : new SourceMap.Collection(
                ranges.at(node.startChar(), node.quote().length()),
                ranges.at(node.endChar(), -1),
                rangeOf(node));
    if (node.parts().isEmpty()) {
      return s(NodeType.STR, list(""), location);
    } else if (node.parts().size() == 1 && node.parts().get(0) instanceof TStringContent) {
      TargetNode child = checkTranslated(node.parts().get(0), visit(node.parts().get(0)));
      return s(child.getType(), child.getChildren(), location);
    }
    return s(NodeType.DSTR, visitAll(node.parts()), location);
  }

  @Override
  public TargetNode visitSymbolLiteral(SymbolLiteral node) {
    SourceRange begin =
        buffer.charAt(node.startChar()) == ':' ? ranges.at(node.startChar(), 1) : null;
    String name = tokenValue(node.value());
    if (node.value() instanceof TStringContent) {
      // An element of a %i list.
      name = unescape(name);
    }
    return s(
        NodeType.SYM, list(Symbol.of(name)), new SourceMap.Collection(begin, null, rangeOf(node)));
  }

  @Override
  public TargetNode visitSymbols(Symbols node) {
    List<Node> parts = new ArrayList<>();
    for (Word element : node.elements()) {
      Node part = element.parts().isEmpty() ? null : element.parts().get(0);
      if (element.parts().size() == 1 && part instanceof TStringContent) {
        parts.add(new SymbolLiteral(part, part.location()));
      } else {
        parts.add(new DynaSymbol(element.parts(), null, element.location()));
      }
    }
    return visitArrayLiteral(
        new ArrayLiteral(node.beginning(), new Args(parts, node.location()), node.location()));
  }

  @Override
  public TargetNode visitTStringContent(TStringContent node) {
    return s(NodeType.STR, list(unescape(node.value())), bare(rangeOf(node)));
  }

  @Override
  public TargetNode visitWord(Word node) {
    return visitStringLiteral(new StringLiteral(node.parts(), null, node.location()));
  }

  @Override
  public TargetNode visitWords(Words node) {
    return visitArrayLiteral(
        new ArrayLiteral(
            node.beginning(),
            new Args(ImmutableList.<Node>copyOf(node.elements()), node.location()),
            node.location()));
  }

  @Override
  public TargetNode visitXStringLiteral(XStringLiteral node) {
    int beginLength = buffer.charAt(node.startChar()) == '%' ? 3 : 1;
    return s(
        NodeType.XSTR,
        visitAll(node.parts()),
        new SourceMap.Collection(
            ranges.at(node.startChar(), beginLength),
            ranges.at(node.endChar(), -1),
            rangeOf(node)));
  }

  // Variables and constants

  @Override
  public TargetNode visitConst(Const node) {
    return s(
        NodeType.CONST,
        list(null, Symbol.of(node.value())),
        new SourceMap.Constant(null, rangeOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitConstPathField(ConstPathField node) {
    if (isSelf(node.parent()) && node.constant() instanceof Ident) {
      return s(
          NodeType.SEND,
          list(visit(node.parent()), Symbol.of(tokenValue(node.constant()) + "=")),
          new SourceMap.Send(
              ranges.findBetween(node.parent(), node.constant(), "::"),
              rangeOf(node.constant()),
              null,
              null,
              rangeOf(node)));
    }
    return s(
        NodeType.CASGN,
        list(visit(node.parent()), Symbol.of(tokenValue(node.constant()))),
        new SourceMap.Constant(
            ranges.findBetween(node.parent(), node.constant(), "::"),
            rangeOf(node.constant()),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitConstPathRef(ConstPathRef node) {
    return s(
        NodeType.CONST,
        list(visit(node.parent()), Symbol.of(node.constant().value())),
        new SourceMap.Constant(
            ranges.findBetween(node.parent(), node.constant(), "::"),
            rangeOf(node.constant()),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitConstRef(ConstRef node) {
    return s(
        NodeType.CONST,
        list(null, Symbol.of(node.constant().value())),
        new SourceMap.Constant(null, rangeOf(node.constant()), rangeOf(node)));
  }

  @Override
  public TargetNode visitCVar(CVar node) {
    return variable(NodeType.CVAR, node);
  }

  @Override
  public TargetNode visitGVar(GVar node) {
    return variable(NodeType.GVAR, node);
  }

  @Override
  public TargetNode visitIdent(Ident node) {
    return variable(NodeType.LVAR, node);
  }

  @Override
  public TargetNode visitIVar(IVar node) {
    return variable(NodeType.IVAR, node);
  }

  @Override
  public TargetNode visitTopConstField(TopConstField node) {
    return topConstant(NodeType.CASGN, node, node.constant());
  }

  @Override
  public TargetNode visitTopConstRef(TopConstRef node) {
    return topConstant(NodeType.CONST, node, node.constant());
  }

  private TargetNode topConstant(NodeType type, Node node, Const constant) {
    return s(
        type,
        list(
            s(NodeType.CBASE, new SourceMap.Map(ranges.at(node.startChar(), 2))),
            Symbol.of(constant.value())),
        new SourceMap.Constant(ranges.at(node.startChar(), 2), rangeOf(constant), rangeOf(node)));
  }

  @Override
  public TargetNode visitVarField(VarField node) {
    Node value = node.value();
    if (isPatternContext(stack.peek(2)) || isPatternContext(stack.peek(1))) {
      return s(
          NodeType.MATCH_VAR,
          list(Symbol.of(tokenValue(value))),
          new SourceMap.Variable(rangeOf(value), rangeOf(value)));
    } else if (value instanceof Const) {
      return s(
          NodeType.CASGN,
          list(null, Symbol.of(((Const) value).value())),
          new SourceMap.Constant(null, rangeOf(value), rangeOf(node)));
    }

    NodeType type;
    if (value instanceof CVar) {
      type = NodeType.CVASGN;
    } else if (value instanceof GVar) {
      type = NodeType.GVASGN;
    } else if (value instanceof Ident || value instanceof VarRef) {
      type = NodeType.LVASGN;
    } else if (value instanceof IVar) {
      type = NodeType.IVASGN;
    } else {
      return s(NodeType.MATCH_REST, null);
    }
    return s(
        type,
        list(Symbol.of(tokenValue(value))),
        new SourceMap.Variable(rangeOf(node), rangeOf(node)));
  }

  private static boolean isPatternContext(@Nullable Node parent) {
    if (parent instanceof Binary) {
      return ((Binary) parent).operator().equals("=>");
    }
    return parent instanceof AryPtn
        || parent instanceof FndPtn
        || parent instanceof HshPtn
        || parent instanceof In
        || parent instanceof RAssign;
  }

  @Override
  public @Nullable TargetNode visitVarRef(VarRef node) {
    return visit(node.value());
  }

  // Assignments

  @Override
  public TargetNode visitAssign(Assign node) {
    TargetNode target = checkTranslated(node.target(), visit(node.target()));
    SourceMap location =
        locationOf(target)
            .withOperator(ranges.findBetween(node.target(), node.value(), "="))
            .withExpression(rangeOf(node));
    List<@Nullable Object> children = new ArrayList<>(target.getChildren());
    children.add(visit(node.value()));
    return s(target.getType(), children, location);
  }

  @Override
  public TargetNode visitMAssign(MAssign node) {
    return s(
        NodeType.MASGN,
        list(visit(node.target()), visit(node.value())),
        new SourceMap.Operator(
            ranges.findBetween(node.target(), node.value(), "="), rangeOf(node)));
  }

  @Override
  public TargetNode visitMLHS(MLHS node) {
    List<@Nullable Object> children = new ArrayList<>();
    for (Node part : node.parts()) {
      children.add(part instanceof Ident ? argument(NodeType.ARG, part) : visit(part));
    }
    return s(NodeType.MLHS, children, bare(rangeOf(node)));
  }

  @Override
  public TargetNode visitMLHSParen(MLHSParen node) {
    TargetNode child = checkTranslated(node.contents(), visit(node.contents()));
    return s(child.getType(), child.getChildren(), parenthesized(node));
  }

  @Override
  public TargetNode visitMRHS(MRHS node) {
    return visitArrayLiteral(
        new ArrayLiteral(null, new Args(node.parts(), node.location()), node.location()));
  }

  @Override
  public TargetNode visitOpAssign(OpAssign node) {
    TargetNode target = checkTranslated(node.target(), visit(node.target()));
    SourceMap location =
        locationOf(target).withExpression(rangeOf(node)).withOperator(rangeOf(node.operator()));
    String operator = node.operator().value();
    switch (operator) {
      case "||=":
        return s(NodeType.OR_ASGN, list(target, visit(node.value())), location);
      case "&&=":
        return s(NodeType.AND_ASGN, list(target, visit(node.value())), location);
      default:
        return s(
            NodeType.OP_ASGN,
            list(target, Symbol.of(chomp(operator, "=")), visit(node.value())),
            location);
    }
  }

  // Hashes, arrays and patterns

  @Override
  public TargetNode visitAryPtn(AryPtn node) {
    NodeType type = NodeType.ARRAY_PATTERN;
    List<@Nullable Object> children = visitAll(node.requireds());

    if (node.rest() instanceof VarField) {
      VarField rest = (VarField) node.rest();
      if (rest.value() != null) {
        children.add(s(NodeType.MATCH_REST, list(visit(rest)), null));
      } else if (node.posts().isEmpty() && rest.startChar() == rest.endChar()) {
        // An implicit rest, as in [foo,].
        type = NodeType.ARRAY_PATTERN_WITH_TAIL;
      } else {
        children.add(s(NodeType.MATCH_REST, null));
      }
    }
    children.addAll(visitAll(node.posts()));

    if (node.constant() != null) {
      Node constant = node.constant();
      TargetNode inner =
          s(type, children, bare(ranges.range(constant.endChar() + 1, node.endChar() - 1)));
      return s(
          NodeType.CONST_PATTERN,
          list(visit(constant), inner),
          new SourceMap.Collection(
              ranges.at(constant.endChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node)));
    }
    SourceMap location =
        buffer.charAt(node.startChar()) == '['
            ? new SourceMap.Collection(
                ranges.at(node.startChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node))
            : bare(rangeOf(node));
    return s(type, children, location);
  }

  @Override
  public TargetNode visitAssoc(Assoc node) {
    Node key = node.key();
    SourceMap operatorAfterKey =
        new SourceMap.Operator(ranges.at(key.endChar(), -1), rangeOf(node));

    if (node.value() == null) {
      // Shorthand, as in { foo: }.
      String name = chomp(tokenValue(key), ":");
      SourceRange expression = ranges.range(node.startChar(), node.endChar() - 1);
      TargetNode value =
          !name.isEmpty() && Character.isUpperCase(name.charAt(0))
              ? s(
                  NodeType.CONST,
                  list(null, Symbol.of(name)),
                  new SourceMap.Constant(null, expression, expression))
              : s(NodeType.SEND, list(null, Symbol.of(name)), sendBare(expression, expression));
      return s(NodeType.PAIR, list(visit(key), value), operatorAfterKey);
    } else if (key instanceof Label) {
      return s(NodeType.PAIR, list(visit(key), visit(node.value())), operatorAfterKey);
    }

    SourceRange operator = ranges.searchBetween(key, node.value(), "=>");
    if (operator != null) {
      return s(
          NodeType.PAIR,
          list(visit(key), visit(node.value())),
          new SourceMap.Operator(operator, rangeOf(node)));
    }

    // A quoted label, as in { "foo": 1 }.
    TargetNode translatedKey = checkTranslated(key, visit(key));
    SourceRange begin =
        translatedKey.getLocation() instanceof SourceMap.Collection
            ? ((SourceMap.Collection) translatedKey.getLocation()).begin()
            : null;
    SourceMap keyLocation =
        new SourceMap.Collection(
            begin,
            ranges.at(key.endChar() - 2, 1),
            ranges.range(key.startChar(), key.endChar() - 1));
    return s(
        NodeType.PAIR,
        list(translatedKey.withLocation(keyLocation), visit(node.value())),
        operatorAfterKey);
  }

  @Override
  public TargetNode visitAssocSplat(AssocSplat node) {
    return s(
        NodeType.KWSPLAT,
        list(visit(node.value())),
        new SourceMap.Operator(ranges.at(node.startChar(), 2), rangeOf(node)));
  }

  @Override
  public TargetNode visitFndPtn(FndPtn node) {
    List<@Nullable Object> children = new ArrayList<>();
    children.add(findPatternRest(node.left()));
    children.addAll(visitAll(node.values()));
    children.add(findPatternRest(node.right()));

    TargetNode inner =
        s(
            NodeType.FIND_PATTERN,
            children,
            new SourceMap.Collection(
                ranges.at(node.startChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node)));
    if (node.constant() != null) {
      return s(NodeType.CONST_PATTERN, list(visit(node.constant()), inner), null);
    }
    return inner;
  }

  private TargetNode findPatternRest(VarField rest) {
    SourceMap location = new SourceMap.Operator(ranges.at(rest.startChar(), 1), rangeOf(rest));
    if (rest.value() == null) {
      return s(NodeType.MATCH_REST, location);
    }
    return s(NodeType.MATCH_REST, list(visit(rest)), location);
  }

  @Override
  public TargetNode visitHshPtn(HshPtn node) {
    List<@Nullable Object> children = new ArrayList<>();
    for (HshPtn.Entry entry : node.keywords()) {
      Node key = entry.key();
      if (entry.value() != null) {
        children.add(s(NodeType.PAIR, list(visit(key), visit(entry.value())), null));
      } else if (key instanceof DynaSymbol) {
        List<Node> parts = ((DynaSymbol) key).parts();
        if (parts.size() != 1) {
          throw new TranslationException(
              "Interpolated hash pattern key at offset " + key.startChar());
        }
        children.add(s(NodeType.MATCH_VAR, list(Symbol.of(tokenValue(parts.get(0)))), null));
      } else if (key instanceof Label) {
        children.add(
            s(NodeType.MATCH_VAR, list(Symbol.of(chomp(((Label) key).value(), ":"))), null));
      } else {
        throw unexpected(key);
      }
    }

    if (node.keywordRest() instanceof VarField) {
      VarField rest = (VarField) node.keywordRest();
      if (rest.value() == null) {
        children.add(s(NodeType.MATCH_REST, null));
      } else if (isKeyword(rest.value(), "nil")) {
        children.add(s(NodeType.MATCH_NIL_PATTERN, null));
      } else {
        children.add(s(NodeType.MATCH_REST, list(visit(rest)), null));
      }
    }

    TargetNode inner = s(NodeType.HASH_PATTERN, children, null);
    if (node.constant() != null) {
      return s(NodeType.CONST_PATTERN, list(visit(node.constant()), inner), null);
    }
    return inner;
  }

  @Override
  public TargetNode visitPinnedBegin(PinnedBegin node) {
    TargetNode begin =
        s(
            NodeType.BEGIN,
            list(visit(node.statement())),
            new SourceMap.Collection(
                ranges.at(node.startChar() + 1, 1),
                ranges.at(node.endChar(), -1),
                ranges.range(node.startChar() + 1, node.endChar())));
    return s(
        NodeType.PIN, list(begin), sendBare(ranges.at(node.startChar(), 1), rangeOf(node)));
  }

  @Override
  public TargetNode visitPinnedVarRef(PinnedVarRef node) {
    return s(
        NodeType.PIN,
        list(visit(node.value())),
        sendBare(ranges.at(node.startChar(), 1), rangeOf(node)));
  }

  @Override
  public TargetNode visitRAssign(RAssign node) {
    NodeType type =
        tokenValue(node.operator()).equals("=>")
            ? NodeType.MATCH_PATTERN
            : NodeType.MATCH_PATTERN_P;
    return s(
        type,
        list(visit(node.value()), visit(node.pattern())),
        new SourceMap.Operator(rangeOf(node.operator()), rangeOf(node)));
  }

  // Calls

  @Override
  public TargetNode visitARef(ARef node) {
    return index(node, node.collection(), node.index(), NodeType.INDEX, "[]");
  }

  @Override
  public TargetNode visitARefField(ARefField node) {
    return index(node, node.collection(), node.index(), NodeType.INDEXASGN, "[]=");
  }

  private TargetNode index(
      Node node, Node collection, @Nullable Args index, NodeType indexType, String method) {
    List<@Nullable Object> children = list(visit(collection));
    if (options.shouldEmitIndex()) {
      SourceRange begin =
          index == null
              ? ranges.find(collection.endChar(), node.endChar(), "[")
              : ranges.findBetween(collection, index, "[");
      if (index != null) {
        children.addAll(visitAll(index.parts()));
      }
      return s(
          indexType,
          children,
          new SourceMap.Index(begin, ranges.at(node.endChar(), -1), rangeOf(node)));
    }

    children.add(Symbol.of(method));
    SourceRange selector;
    if (index == null) {
      selector = ranges.find(collection.endChar(), node.endChar(), "[]");
    } else {
      children.addAll(visitAll(index.parts()));
      selector =
          ranges.range(
              ranges.findBetween(collection, index, "[").getBeginPos(), node.endChar());
    }
    return s(NodeType.SEND, children, sendBare(selector, rangeOf(node)));
  }

  @Override
  public TargetNode visitArgBlock(ArgBlock node) {
    return s(
        NodeType.BLOCK_PASS,
        list(visit(node.value())),
        new SourceMap.Operator(ranges.at(node.startChar(), 1), rangeOf(node)));
  }

  @Override
  public TargetNode visitArgStar(ArgStar node) {
    Node grandparent = stack.peek(2);
    if (grandparent instanceof MLHSParen
        && ((MLHSParen) grandparent).contents() instanceof MLHS) {
      if (node.value() == null) {
        return s(NodeType.RESTARG, new SourceMap.Variable(null, rangeOf(node)));
      }
      return s(
          NodeType.RESTARG,
          list(Symbol.of(tokenValue(node.value()))),
          new SourceMap.Variable(rangeOf(node.value()), rangeOf(node)));
    }
    return s(
        NodeType.SPLAT,
        node.value() == null ? new ArrayList<>() : list(visit(node.value())),
        new SourceMap.Operator(ranges.at(node.startChar(), 1), rangeOf(node)));
  }

  @Override
  public TargetNode visitArgsForward(ArgsForward node) {
    return s(NodeType.FORWARDED_ARGS, new SourceMap.Map(rangeOf(node)));
  }

  @Override
  public TargetNode visitCallNode(CallNode node) {
    return visitCommandCall(
        new CommandCall(
            node.receiver(),
            node.operator(),
            node.message(),
            node.arguments(),
            null,
            node.location()));
  }

  @Override
  public TargetNode visitCommand(Command node) {
    return visitCommandCall(
        new CommandCall(
            null, null, node.message(), node.arguments(), node.block(), node.location()));
  }

  @Override
  public TargetNode visitCommandCall(CommandCall node) {
    Node receiver = node.receiver();
    Node message = node.message();
    Node arguments = node.arguments();
    BlockNode block = node.block();

    List<@Nullable Object> children =
        list(visit(receiver), message == null ? Symbol.of("call") : Symbol.of(tokenValue(message)));
    SourceRange begin = null;
    SourceRange end = null;
    if (arguments instanceof Args) {
      children.addAll(visitAll(((Args) arguments).parts()));
    } else if (arguments instanceof ArgParen) {
      Node inner = ((ArgParen) arguments).arguments();
      if (inner instanceof ArgsForward) {
        children.add(visit(inner));
      } else if (inner != null) {
        children.addAll(visitAll(asArgs(inner).parts()));
      }
      begin = ranges.at(arguments.startChar(), 1);
      end = ranges.at(arguments.endChar(), -1);
    }

    int dotBound;
    if (arguments != null) {
      dotBound = arguments.startChar();
    } else if (block != null) {
      dotBound = block.startChar();
    } else {
      dotBound = node.endChar();
    }

    SourceRange expression;
    if (arguments instanceof ArgParen) {
      expression = ranges.range(node.startChar(), arguments.endChar());
    } else if (arguments instanceof Args && !((Args) arguments).parts().isEmpty()) {
      List<Node> parts = ((Args) arguments).parts();
      Node lastPart = parts.get(parts.size() - 1);
      int endChar =
          lastPart instanceof Heredoc
              ? ((Heredoc) lastPart).beginning().endChar()
              : lastPart.endChar();
      expression = ranges.range(node.startChar(), endChar);
    } else if (block != null && message != null) {
      expression =
          receiver != null
              ? ranges.range(receiver.startChar(), message.endChar())
              : rangeOf(message);
    } else {
      expression = rangeOf(node);
    }

    Node operator = node.operator();
    SourceRange dot = null;
    if (isOperator(operator, "::")) {
      dot =
          ranges.find(
              checkNotNull(receiver).endChar(),
              message == null ? dotBound : message.startChar(),
              "::");
    } else if (operator != null) {
      dot = rangeOf(operator);
    }

    TargetNode call =
        s(
            isOperator(operator, "&.") ? NodeType.CSEND : NodeType.SEND,
            children,
            new SourceMap.Send(
                dot, message == null ? null : rangeOf(message), begin, end, expression));

    if (block == null) {
      return call;
    }
    BlockChildren blockChildren = blockChildren(block);
    return s(
        blockChildren.type(),
        list(call, blockChildren.arguments(), visit(block.bodystmt())),
        new SourceMap.Collection(
            rangeOf(block.opening()),
            ranges.at(node.endChar(), block.opening() instanceof Kw ? -3 : -1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitDefined(Defined node) {
    int parenStart = node.startChar() + 8;
    SourceRange begin = null;
    SourceRange end = null;
    if (buffer.slice(parenStart, node.endChar()).contains("(")) {
      begin = ranges.find(parenStart, node.endChar(), "(");
      end = ranges.at(node.endChar(), -1);
    }
    return s(
        NodeType.DEFINED,
        list(visit(node.value())),
        new SourceMap.Keyword(ranges.at(node.startChar(), 8), begin, end, rangeOf(node)));
  }

  @Override
  public TargetNode visitField(Field node) {
    Node parent = stack.peek(1);
    Node message = node.name();
    if (parent instanceof Assign || parent instanceof MLHS) {
      message = new Ident(tokenValue(node.name()) + "=", node.name().location());
    }
    return visitCommandCall(
        new CommandCall(node.parent(), node.operator(), message, null, null, node.location()));
  }

  @Override
  public TargetNode visitLambda(Lambda node) {
    Node params = node.params();
    Node args = params instanceof Paren ? ((Paren) params).contents() : params;
    Object arguments = visit(args);
    if (arguments == null) {
      arguments = s(NodeType.ARGS, bare(null));
    }

    NodeType type = NodeType.BLOCK;
    boolean declaresNothing =
        args == null
            || (args instanceof LambdaVar && ((LambdaVar) args).isEmpty())
            || (args instanceof Params && ((Params) args).isEmpty());
    if (declaresNothing) {
      Integer maximum = maximumNumberedParameter(node.statements());
      if (maximum != null) {
        type = NodeType.NUMBLOCK;
        arguments = BigInteger.valueOf(maximum);
      }
    }

    SourceRange begin = ranges.searchBetween(params, node.statements(), "{");
    SourceRange end;
    if (begin != null) {
      end = ranges.at(node.endChar(), -1);
    } else {
      begin = ranges.findBetween(params, node.statements(), "do");
      end = ranges.at(node.endChar(), -3);
    }

    SourceRange selector = ranges.at(node.startChar(), 2);
    TargetNode lambda =
        options.shouldEmitLambda()
            ? s(NodeType.LAMBDA, new SourceMap.Map(selector))
            : s(NodeType.SEND, list(null, Symbol.of("lambda")), sendBare(selector, selector));
    return s(
        type,
        list(lambda, arguments, visit(node.statements())),
        new SourceMap.Collection(begin, end, rangeOf(node)));
  }

  @Override
  public TargetNode visitMethodAddBlock(MethodAddBlock node) {
    Node call = node.call();
    BlockNode block = node.block();
    if (call instanceof ARef || call instanceof Super || call instanceof ZSuper) {
      BlockChildren blockChildren = blockChildren(block);
      return s(
          blockChildren.type(),
          list(visit(call), blockChildren.arguments(), visit(block.bodystmt())),
          new SourceMap.Collection(
              rangeOf(block.opening()),
              ranges.at(block.endChar(), block.hasKeywords() ? -3 : -1),
              rangeOf(node)));
    }

    CommandCall withBlock;
    if (call instanceof CallNode) {
      CallNode callNode = (CallNode) call;
      withBlock =
          new CommandCall(
              callNode.receiver(),
              callNode.operator(),
              callNode.message(),
              callNode.arguments(),
              block,
              node.location());
    } else if (call instanceof CommandCall) {
      CommandCall commandCall = (CommandCall) call;
      withBlock =
          new CommandCall(
              commandCall.receiver(),
              commandCall.operator(),
              commandCall.message(),
              commandCall.arguments(),
              block,
              node.location());
    } else if (call instanceof Command) {
      Command command = (Command) call;
      withBlock =
          new CommandCall(
              null, null, command.message(), command.arguments(), block, node.location());
    } else {
      throw unexpected(call);
    }
    return visitCommandCall(withBlock);
  }

  @Override
  public TargetNode visitNot(Not node) {
    SourceRange selector = ranges.at(node.startChar(), 3);
    if (node.statement() == null) {
      SourceRange begin = ranges.findFrom(node.startChar(), "(");
      SourceRange end = ranges.findFrom(node.startChar(), ")");
      TargetNode empty =
          s(NodeType.BEGIN, new SourceMap.Collection(begin, end, begin.join(end)));
      return s(NodeType.SEND, list(empty, Symbol.of("!")), sendBare(selector, rangeOf(node)));
    }

    SourceRange begin = null;
    SourceRange end = null;
    if (node.parentheses()) {
      begin = ranges.find(node.startChar() + 3, node.statement().startChar(), "(");
      end = ranges.at(node.endChar(), -1);
    }
    return s(
        NodeType.SEND,
        list(visit(node.statement()), Symbol.of("!")),
        new SourceMap.Send(null, selector, begin, end, rangeOf(node)));
  }

  @Override
  public TargetNode visitSuper(Super node) {
    SourceRange keyword = ranges.at(node.startChar(), 5);
    if (node.arguments() instanceof Args) {
      return s(
          NodeType.SUPER,
          visitAll(((Args) node.arguments()).parts()),
          keywordBare(keyword, rangeOf(node)));
    } else if (!(node.arguments() instanceof ArgParen)) {
      throw unexpected(node.arguments());
    }

    Node inner = ((ArgParen) node.arguments()).arguments();
    List<@Nullable Object> children;
    if (inner == null) {
      children = new ArrayList<>();
    } else if (inner instanceof ArgsForward) {
      children = list(visit(inner));
    } else {
      children = visitAll(asArgs(inner).parts());
    }
    return s(
        NodeType.SUPER,
        children,
        new SourceMap.Keyword(
            keyword,
            ranges.find(node.startChar() + 5, node.endChar(), "("),
            ranges.at(node.endChar(), -1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitVCall(VCall node) {
    return visitCommandCall(
        new CommandCall(null, null, node.value(), null, null, node.location()));
  }

  @Override
  public TargetNode visitYieldNode(YieldNode node) {
    SourceRange keyword = ranges.at(node.startChar(), 5);
    Node arguments = node.arguments();
    if (arguments == null) {
      return s(NodeType.YIELD, keywordBare(keyword, rangeOf(node)));
    } else if (arguments instanceof Args) {
      return s(
          NodeType.YIELD,
          visitAll(((Args) arguments).parts()),
          keywordBare(keyword, rangeOf(node)));
    } else if (!(arguments instanceof Paren)) {
      throw unexpected(arguments);
    }
    Node contents = ((Paren) arguments).contents();
    return s(
        NodeType.YIELD,
        contents == null ? new ArrayList<>() : visitAll(asArgs(contents).parts()),
        new SourceMap.Keyword(
            keyword,
            ranges.at(arguments.startChar(), 1),
            ranges.at(node.endChar(), -1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitZSuper(ZSuper node) {
    return s(NodeType.ZSUPER, keywordBare(ranges.at(node.startChar(), 5), rangeOf(node)));
  }

  /** The type and second child of a block: its parameters, or the highest numbered parameter. */
  private record BlockChildren(NodeType type, Object arguments) {}

  private BlockChildren blockChildren(BlockNode block) {
    if (block.blockVar() != null) {
      return new BlockChildren(
          NodeType.BLOCK, checkTranslated(block.blockVar(), visit(block.blockVar())));
    }
    Integer maximum = maximumNumberedParameter(block.bodystmt());
    if (maximum != null) {
      return new BlockChildren(NodeType.NUMBLOCK, BigInteger.valueOf(maximum));
    }
    return new BlockChildren(NodeType.BLOCK, s(NodeType.ARGS, bare(null)));
  }

  /**
   * Returns the highest numbered parameter ({@code _1} to {@code _9}) that appears anywhere
   * below {@code body}, or null if there is none.
   */
  private @Nullable Integer maximumNumberedParameter(Node body) {
    Integer maximum = null;
    Deque<Node> queue = new ArrayDeque<>();
    queue.add(body);
    while (!queue.isEmpty()) {
      Node node = queue.poll();
      if (node instanceof VarRef && ((VarRef) node).value() instanceof Ident) {
        Matcher matcher =
            NUMBERED_PARAMETER.matcher(((Ident) ((VarRef) node).value()).value());
        if (matcher.matches()) {
          int number = Integer.parseInt(matcher.group(1));
          maximum = maximum == null ? number : Math.max(maximum, number);
        }
      }
      for (Node child : node.childNodes()) {
        if (child != null) {
          queue.add(child);
        }
      }
    }
    if (maximum != null) {
      logger.fine("Numbered parameters up to _" + maximum + " at offset " + body.startChar());
    }
    return maximum;
  }

  // Definitions

  @Override
  public TargetNode visitAliasNode(AliasNode node) {
    return s(
        NodeType.ALIAS,
        list(visit(node.left()), visit(node.right())),
        keywordBare(ranges.at(node.startChar(), 5), rangeOf(node)));
  }

  @Override
  public TargetNode visitBlockArg(BlockArg node) {
    if (node.name() == null) {
      return s(NodeType.BLOCKARG, list((Object) null), new SourceMap.Variable(null, rangeOf(node)));
    }
    return s(
        NodeType.BLOCKARG,
        list(Symbol.of(node.name().value())),
        new SourceMap.Variable(rangeOf(node.name()), rangeOf(node)));
  }

  @Override
  public TargetNode visitBlockVar(BlockVar node) {
    List<@Nullable Object> children;
    if (options.shouldEmitProcarg0() && node.isArg0()) {
      // A lone required parameter may be auto-splatted, which the parser gem marks.
      Node required = node.params().requireds().get(0);
      TargetNode procarg0;
      if (options.shouldEmitArgInsideProcarg0() && required instanceof Ident) {
        procarg0 =
            s(
                NodeType.PROCARG0,
                list(argument(NodeType.ARG, required)),
                bare(rangeOf(required)));
      } else {
        TargetNode child = checkTranslated(required, visit(required));
        procarg0 = s(NodeType.PROCARG0, child.getChildren(), child.getLocation());
      }
      children = list(procarg0);
    } else {
      children =
          new ArrayList<>(checkTranslated(node.params(), visit(node.params())).getChildren());
    }
    for (Ident local : node.locals()) {
      children.add(argument(NodeType.SHADOWARG, local));
    }
    return s(
        NodeType.ARGS,
        children,
        new SourceMap.Collection(
            ranges.at(node.startChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node)));
  }

  @Override
  public TargetNode visitClassDeclaration(ClassDeclaration node) {
    SourceRange operator =
        node.superclass() == null
            ? null
            : ranges.findBetween(node.constant(), node.superclass(), "<");
    return s(
        NodeType.CLASS,
        list(visit(node.constant()), visit(node.superclass()), visit(node.bodystmt())),
        new SourceMap.Definition(
            ranges.at(node.startChar(), 5),
            operator,
            rangeOf(node.constant()),
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitDefNode(DefNode node) {
    Symbol name = Symbol.of(tokenValue(node.name()));
    Node params = node.params();
    TargetNode args;
    if (params instanceof Params) {
      TargetNode child = checkTranslated(params, visit(params));
      SourceMap location = child.getLocation();
      args =
          s(
              child.getType(),
              child.getChildren(),
              bare(location == null ? null : location.expression()));
    } else if (params instanceof Paren) {
      TargetNode child = visit(((Paren) params).contents());
      args =
          s(
              child == null ? NodeType.ARGS : child.getType(),
              child == null ? new ArrayList<>() : child.getChildren(),
              parenthesized(params));
    } else {
      args = s(NodeType.ARGS, bare(null));
    }

    SourceRange keyword = ranges.at(node.startChar(), 3);
    SourceRange end = null;
    SourceRange assignment = null;
    if (node.isEndless()) {
      assignment =
          ranges.findBetween(params != null ? params : node.name(), node.bodystmt(), "=");
    } else {
      end = ranges.at(node.endChar(), -3);
    }

    if (node.target() != null) {
      Node target = node.target();
      if (target instanceof Paren) {
        target = ((Paren) target).contents();
      }
      return s(
          NodeType.DEFS,
          list(visit(target), name, args, visit(node.bodystmt())),
          new SourceMap.MethodDefinition(
              keyword,
              rangeOf(checkNotNull(node.operator())),
              rangeOf(node.name()),
              end,
              assignment,
              rangeOf(node)));
    }
    return s(
        NodeType.DEF,
        list(name, args, visit(node.bodystmt())),
        new SourceMap.MethodDefinition(
            keyword, null, rangeOf(node.name()), end, assignment, rangeOf(node)));
  }

  @Override
  public TargetNode visitKwRestParam(KwRestParam node) {
    if (node.name() == null) {
      return s(NodeType.KWRESTARG, new SourceMap.Variable(null, rangeOf(node)));
    }
    return s(
        NodeType.KWRESTARG,
        list(Symbol.of(node.name().value())),
        new SourceMap.Variable(rangeOf(node.name()), rangeOf(node)));
  }

  @Override
  public TargetNode visitLambdaVar(LambdaVar node) {
    SourceMap location;
    if (node.startChar() == node.endChar()) {
      location = bare(null);
    } else if (node.startChar() > 0 && buffer.charAt(node.startChar() - 1) == '(') {
      location = parenthesized(node);
    } else {
      location = bare(rangeOf(node));
    }
    List<@Nullable Object> children =
        new ArrayList<>(checkTranslated(node.params(), visit(node.params())).getChildren());
    for (Ident local : node.locals()) {
      children.add(argument(NodeType.SHADOWARG, local));
    }
    return s(NodeType.ARGS, children, location);
  }

  @Override
  public TargetNode visitModuleDeclaration(ModuleDeclaration node) {
    return s(
        NodeType.MODULE,
        list(visit(node.constant()), visit(node.bodystmt())),
        new SourceMap.Definition(
            ranges.at(node.startChar(), 6),
            null,
            rangeOf(node.constant()),
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitParams(Params node) {
    List<@Nullable Object> children = new ArrayList<>();
    for (Node required : node.requireds()) {
      children.add(
          required instanceof MLHSParen ? visit(required) : argument(NodeType.ARG, required));
    }
    for (Params.OptionalParam optional : node.optionals()) {
      Ident name = optional.name();
      Node value = optional.value();
      children.add(
          s(
              NodeType.OPTARG,
              list(Symbol.of(name.value()), visit(value)),
              new SourceMap.Variable(rangeOf(name), rangeOf(name).join(rangeOf(value)))
                  .withOperator(ranges.findBetween(name, value, "="))));
    }
    if (node.rest() != null && !(node.rest() instanceof ExcessedComma)) {
      children.add(visit(node.rest()));
    }
    for (Node post : node.posts()) {
      children.add(argument(NodeType.ARG, post));
    }
    for (Params.KeywordParam keyword : node.keywords()) {
      Label name = keyword.name();
      Symbol key = Symbol.of(chomp(name.value(), ":"));
      SourceRange nameRange = ranges.range(name.startChar(), name.endChar() - 1);
      if (keyword.value() != null) {
        children.add(
            s(
                NodeType.KWOPTARG,
                list(key, visit(keyword.value())),
                new SourceMap.Variable(nameRange, rangeOf(name).join(rangeOf(keyword.value())))));
      } else {
        children.add(
            s(NodeType.KWARG, list(key), new SourceMap.Variable(nameRange, rangeOf(name))));
      }
    }

    Node keywordRest = node.keywordRest();
    if (isKeyword(keywordRest, "nil")) {
      children.add(
          s(
              NodeType.KWNILARG,
              new SourceMap.Variable(ranges.at(node.endChar(), -3), rangeOf(node))));
    } else if (keywordRest != null && !(keywordRest instanceof ArgsForward)) {
      children.add(visit(keywordRest));
    }
    if (node.block() != null) {
      children.add(visit(node.block()));
    }

    if (keywordRest instanceof ArgsForward) {
      SourceMap location = new SourceMap.Map(rangeOf(keywordRest));
      if (children.isEmpty() && !options.shouldEmitForwardArg()) {
        return s(NodeType.FORWARD_ARGS, location);
      }
      // forward_arg goes before any keyword rest or block parameter.
      int index = node.requireds().size() + node.optionals().size() + node.keywords().size();
      children.add(index, s(NodeType.FORWARD_ARG, location));
    }

    SourceMap location = null;
    if (!children.isEmpty()) {
      SourceRange first = expressionOf(children.get(0));
      SourceRange last = expressionOf(children.get(children.size() - 1));
      location = bare(first.join(last));
    }
    return s(NodeType.ARGS, children, location);
  }

  @Override
  public TargetNode visitRestParam(RestParam node) {
    if (node.name() == null) {
      return s(NodeType.RESTARG, new SourceMap.Variable(null, rangeOf(node)));
    }
    return s(
        NodeType.RESTARG,
        list(Symbol.of(node.name().value())),
        new SourceMap.Variable(rangeOf(node.name()), rangeOf(node)));
  }

  @Override
  public TargetNode visitSClass(SClass node) {
    return s(
        NodeType.SCLASS,
        list(visit(node.target()), visit(node.bodystmt())),
        new SourceMap.Definition(
            ranges.at(node.startChar(), 5),
            ranges.find(node.startChar() + 5, node.target().startChar(), "<<"),
            null,
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitUndef(Undef node) {
    return s(
        NodeType.UNDEF,
        visitAll(node.symbols()),
        keywordBare(ranges.at(node.startChar(), 5), rangeOf(node)));
  }

  // Control flow

  @Override
  public TargetNode visitBEGINBlock(BEGINBlock node) {
    return s(
        NodeType.PREEXE,
        list(visit(node.statements())),
        new SourceMap.Keyword(
            ranges.at(node.startChar(), 5),
            ranges.find(node.startChar() + 5, node.statements().startChar(), "{"),
            ranges.at(node.endChar(), -1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitENDBlock(ENDBlock node) {
    return s(
        NodeType.POSTEXE,
        list(visit(node.statements())),
        new SourceMap.Keyword(
            ranges.at(node.startChar(), 3),
            ranges.find(node.startChar() + 3, node.statements().startChar(), "{"),
            ranges.at(node.endChar(), -1),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitBegin(Begin node) {
    SourceMap location =
        new SourceMap.Collection(
            ranges.at(node.startChar(), 5), ranges.at(node.endChar(), -3), rangeOf(node));
    BodyStmt bodystmt = node.bodystmt();
    if (bodystmt.isEmpty()) {
      return s(NodeType.KWBEGIN, location);
    } else if (bodystmt.rescueClause() == null
        && bodystmt.ensureClause() == null
        && bodystmt.elseClause() == null) {
      TargetNode child = visit(bodystmt.statements());
      List<@Nullable Object> children;
      if (child == null) {
        children = new ArrayList<>();
      } else if (child.getType() == NodeType.BEGIN) {
        children = child.getChildren();
      } else {
        children = list(child);
      }
      return s(NodeType.KWBEGIN, children, location);
    }
    return s(NodeType.KWBEGIN, list(visit(bodystmt)), location);
  }

  @Override
  public TargetNode visitBinary(Binary node) {
    String operator = node.operator();
    switch (operator) {
      case "|":
        int depth = 1;
        while (stack.peek(depth) instanceof Binary
            && ((Binary) stack.peek(depth)).operator().equals("|")) {
          depth++;
        }
        if (stack.peek(depth) instanceof In) {
          return s(NodeType.MATCH_ALT, list(visit(node.left()), visit(node.right())), null);
        }
        return canonicalBinary(node);
      case "=>":
        return logicalOperator(NodeType.MATCH_AS, node);
      case "&&":
      case "and":
        return logicalOperator(NodeType.AND, node);
      case "||":
      case "or":
        return logicalOperator(NodeType.OR, node);
      case "=~":
        // A literal regexp on the left assigns its named captures to local variables.
        if (node.left() instanceof RegexpLiteral) {
          List<Node> parts = ((RegexpLiteral) node.left()).parts();
          if (parts.size() == 1 && parts.get(0) instanceof TStringContent) {
            return logicalOperator(NodeType.MATCH_WITH_LVASGN, node);
          }
        }
        return canonicalBinary(node);
      default:
        return canonicalBinary(node);
    }
  }

  private TargetNode logicalOperator(NodeType type, Binary node) {
    return s(
        type,
        list(visit(node.left()), visit(node.right())),
        new SourceMap.Operator(
            ranges.findBetween(node.left(), node.right(), node.operator()), rangeOf(node)));
  }

  private TargetNode canonicalBinary(Binary node) {
    return checkTranslated(node, visit(canonicalizer.canonicalBinary(node)));
  }

  @Override
  public @Nullable TargetNode visitBodyStmt(BodyStmt node) {
    TargetNode result = visit(node.statements());

    if (node.rescueClause() != null) {
      TargetNode rescue = checkTranslated(node.rescueClause(), visit(node.rescueClause()));
      List<@Nullable Object> children = list(result);
      children.addAll(rescue.getChildren());
      SourceMap location = rescue.getLocation();

      Statements elseClause = node.elseClause();
      if (elseClause != null) {
        children.remove(children.size() - 1);
        children.add(visit(elseClause));
        SourceRange elseToken =
            node.elseKeyword() != null
                ? rangeOf(node.elseKeyword())
                : ranges.at(elseClause.startChar() - 3, -4);
        location =
            new SourceMap.Condition(
                null,
                null,
                elseToken,
                null,
                ranges.range(locationOf(rescue).expression().getBeginPos(), elseClause.endChar()));
      }
      result = s(rescue.getType(), children, location);
    }

    if (node.ensureClause() != null) {
      TargetNode ensure = checkTranslated(node.ensureClause(), visit(node.ensureClause()));
      SourceRange expression = expressionOf(ensure);
      if (result != null) {
        expression = expressionOf(result).join(expression);
      }
      List<@Nullable Object> children = list(result);
      children.addAll(ensure.getChildren());
      result = s(ensure.getType(), children, locationOf(ensure).withExpression(expression));
    }
    return result;
  }

  @Override
  public TargetNode visitBreak(Break node) {
    return s(
        NodeType.BREAK,
        visitAll(node.arguments().parts()),
        keywordBare(ranges.at(node.startChar(), 5), rangeOf(node)));
  }

  @Override
  public TargetNode visitCase(Case node) {
    List<@Nullable Node> clauses = new ArrayList<>();
    clauses.add(node.consequent());
    Node last = node.consequent();
    while (last != null && !(last instanceof Else)) {
      last = consequentOf(last);
      clauses.add(last);
    }

    SourceRange elseToken = last instanceof Else ? ranges.at(last.startChar(), 4) : null;
    List<@Nullable Object> children = list(visit(node.value()));
    for (Node clause : clauses) {
      children.add(visit(clause));
    }
    return s(
        node.consequent() instanceof In ? NodeType.CASE_MATCH : NodeType.CASE,
        children,
        new SourceMap.Condition(
            ranges.at(node.startChar(), 4),
            null,
            elseToken,
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  private @Nullable Node consequentOf(Node clause) {
    if (clause instanceof When) {
      return ((When) clause).consequent();
    } else if (clause instanceof In) {
      return ((In) clause).consequent();
    }
    throw unexpected(clause);
  }

  @Override
  public @Nullable TargetNode visitElse(Else node) {
    if (node.statements().isEmpty() && stack.peek(1) instanceof Case) {
      return s(NodeType.EMPTY_ELSE, null);
    }
    return visit(node.statements());
  }

  @Override
  public TargetNode visitElsif(Elsif node) {
    return s(
        NodeType.IF,
        list(visit(node.predicate()), visit(node.statements()), visit(node.consequent())),
        new SourceMap.Condition(
            ranges.at(node.startChar(), 5),
            conditionBegin(node.predicate(), node.statements()),
            conditionElse(node.consequent()),
            null,
            ranges.range(node.startChar(), node.statements().endChar() - 1)));
  }

  @Override
  public TargetNode visitEnsure(Ensure node) {
    int start = node.startChar();
    int end = node.statements().isEmpty() ? start + 6 : lastStatement(node.statements()).endChar();
    return s(
        NodeType.ENSURE,
        list(visit(node.statements())),
        new SourceMap.Condition(
            ranges.at(start, 6), null, null, null, ranges.range(start, end)));
  }

  @Override
  public TargetNode visitFor(For node) {
    SourceRange begin = ranges.searchBetween(node.collection(), node.statements(), "do");
    if (begin == null) {
      begin = ranges.searchBetween(node.collection(), node.statements(), ";");
    }
    return s(
        NodeType.FOR,
        list(visit(node.index()), visit(node.collection()), visit(node.statements())),
        new SourceMap.For(
            ranges.at(node.startChar(), 3),
            ranges.findBetween(node.index(), node.collection(), "in"),
            begin,
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitIfNode(IfNode node) {
    List<@Nullable Object> children =
        list(
            visitPredicate(node.predicate()),
            visit(node.statements()),
            visit(node.consequent()));
    if (node.isModifier()) {
      return s(
          NodeType.IF,
          children,
          keywordBare(
              ranges.findBetween(node.statements(), node.predicate(), "if"), rangeOf(node)));
    }
    return s(
        NodeType.IF,
        children,
        new SourceMap.Condition(
            ranges.at(node.startChar(), 2),
            conditionBegin(node.predicate(), node.statements()),
            conditionElse(node.consequent()),
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitIfOp(IfOp node) {
    return s(
        NodeType.IF,
        list(visit(node.predicate()), visit(node.truthy()), visit(node.falsy())),
        new SourceMap.Ternary(
            ranges.findBetween(node.predicate(), node.truthy(), "?"),
            ranges.findBetween(node.truthy(), node.falsy(), ":"),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitIn(In node) {
    Node pattern = node.pattern();
    if (pattern instanceof IfNode) {
      IfNode guarded = (IfNode) pattern;
      return s(
          NodeType.IN_PATTERN,
          list(
              visit(guarded.statements()),
              s(NodeType.IF_GUARD, list(visit(guarded.predicate())), null),
              visit(node.statements())),
          null);
    } else if (pattern instanceof UnlessNode) {
      UnlessNode guarded = (UnlessNode) pattern;
      return s(
          NodeType.IN_PATTERN,
          list(
              visit(guarded.statements()),
              s(NodeType.UNLESS_GUARD, list(visit(guarded.predicate())), null),
              visit(node.statements())),
          null);
    }

    SourceRange begin = ranges.searchBetween(pattern, node.statements(), "then");
    int end =
        begin != null || node.statements().isEmpty()
            ? node.statements().endChar() - 1
            : lastStatement(node.statements()).startChar();
    return s(
        NodeType.IN_PATTERN,
        list(visit(pattern), null, visit(node.statements())),
        new SourceMap.Keyword(
            ranges.at(node.startChar(), 2), begin, null, ranges.range(node.startChar(), end)));
  }

  @Override
  public TargetNode visitNext(Next node) {
    return s(
        NodeType.NEXT,
        visitAll(node.arguments().parts()),
        keywordBare(ranges.at(node.startChar(), 4), rangeOf(node)));
  }

  @Override
  public TargetNode visitParen(Paren node) {
    SourceMap location = parenthesized(node);
    Node contents = node.contents();
    if (contents == null || (contents instanceof Statements && ((Statements) contents).isEmpty())) {
      return s(NodeType.BEGIN, location);
    }
    TargetNode child = visit(contents);
    if (child == null) {
      return s(NodeType.BEGIN, location);
    }
    return child.getType() == NodeType.BEGIN ? child : s(NodeType.BEGIN, list(child), location);
  }

  @Override
  public @Nullable TargetNode visitProgram(Program node) {
    return visit(node.statements());
  }

  @Override
  public TargetNode visitRedo(Redo node) {
    return s(NodeType.REDO, keywordBare(rangeOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitRescue(Rescue node) {
    int start = node.startChar();
    int bodyEnd =
        node.statements().isEmpty() ? start + 6 : lastStatement(node.statements()).endChar();
    int end = bodyEnd;
    if (node.consequent() != null) {
      Rescue last = node.consequent();
      while (last.consequent() != null) {
        last = last.consequent();
      }
      end = last.statements().isEmpty() ? start + 6 : lastStatement(last.statements()).endChar();
    }

    SourceRange keyword = ranges.at(start, 6);
    SourceRange bodyExpression = ranges.range(start, bodyEnd);

    RescueEx exception = node.exception();
    TargetNode exceptions = null;
    if (exception != null && exception.exceptions() != null) {
      Node classes = exception.exceptions();
      List<Node> parts =
          classes instanceof MRHS ? ((MRHS) classes).parts() : ImmutableList.of(classes);
      exceptions =
          visitArrayLiteral(
              new ArrayLiteral(null, new Args(parts, classes.location()), classes.location()));
    }

    TargetNode resbody;
    if (exception == null || exception.variable() == null) {
      resbody =
          s(
              NodeType.RESBODY,
              list(exceptions, null, visit(node.statements())),
              new SourceMap.RescueBody(keyword, null, null, bodyExpression));
    } else {
      Node variable = exception.variable();
      resbody =
          s(
              NodeType.RESBODY,
              list(exceptions, visit(variable), visit(node.statements())),
              new SourceMap.RescueBody(
                  keyword,
                  ranges.find(start + 6, variable.startChar(), "=>"),
                  null,
                  bodyExpression));
    }

    List<@Nullable Object> children = list(resbody);
    if (node.consequent() != null) {
      children.addAll(checkTranslated(node.consequent(), visit(node.consequent())).getChildren());
    } else {
      children.add(null);
    }
    return s(
        NodeType.RESCUE,
        children,
        new SourceMap.Condition(null, null, null, null, ranges.range(start, end)));
  }

  @Override
  public TargetNode visitRescueMod(RescueMod node) {
    SourceRange keyword = ranges.findBetween(node.statement(), node.value(), "rescue");
    TargetNode resbody =
        s(
            NodeType.RESBODY,
            list(null, null, visit(node.value())),
            new SourceMap.RescueBody(keyword, null, null, keyword.join(rangeOf(node.value()))));
    return s(
        NodeType.RESCUE,
        list(visit(node.statement()), resbody, null),
        new SourceMap.Condition(null, null, null, null, rangeOf(node)));
  }

  @Override
  public TargetNode visitRetry(Retry node) {
    return s(NodeType.RETRY, keywordBare(rangeOf(node), rangeOf(node)));
  }

  @Override
  public TargetNode visitReturnNode(ReturnNode node) {
    return s(
        NodeType.RETURN,
        node.arguments() == null ? new ArrayList<>() : visitAll(node.arguments().parts()),
        keywordBare(ranges.at(node.startChar(), 6), rangeOf(node)));
  }

  @Override
  public @Nullable TargetNode visitStatements(Statements node) {
    List<Node> children = new ArrayList<>();
    for (Node child : node.body()) {
      if (!(child instanceof Comment
          || child instanceof EmbDoc
          || child instanceof EndContent
          || child instanceof VoidStmt)) {
        children.add(child);
      }
    }
    switch (children.size()) {
      case 0:
        return null;
      case 1:
        return visit(children.get(0));
      default:
        return s(
            NodeType.BEGIN,
            visitAll(children),
            bare(
                ranges.range(
                    children.get(0).startChar(), children.get(children.size() - 1).endChar())));
    }
  }

  @Override
  public @Nullable TargetNode visitUnary(Unary node) {
    Node statement = node.statement();
    if (node.operator().equals("!") && statement instanceof Paren) {
      Paren paren = (Paren) statement;
      if (paren.contents() instanceof Statements
          && ((Statements) paren.contents()).body().size() == 1
          && ((Statements) paren.contents()).body().get(0) instanceof RangeNode) {
        // A negated flip-flop, as in !(a..b).
        RangeNode range = (RangeNode) ((Statements) paren.contents()).body().get(0);
        TargetNode flipFlop = flipFlop(range);
        return s(
            NodeType.SEND,
            list(s(NodeType.BEGIN, list(flipFlop), parenthesized(paren)), Symbol.of("!")),
            sendBare(ranges.at(node.startChar(), 1), rangeOf(node)));
      }
    } else if (node.operator().equals("!") && statement instanceof RegexpLiteral) {
      TargetNode match =
          s(
              NodeType.MATCH_CURRENT_LINE,
              list(visit(statement)),
              new SourceMap.Map(rangeOf(statement)));
      return s(
          NodeType.SEND,
          list(match, Symbol.of("!")),
          sendBare(ranges.at(node.startChar(), 1), rangeOf(node)));
    }
    return visit(canonicalizer.canonicalUnary(node));
  }

  @Override
  public TargetNode visitUnlessNode(UnlessNode node) {
    List<@Nullable Object> children =
        list(
            visitPredicate(node.predicate()),
            visit(node.consequent()),
            visit(node.statements()));
    if (node.isModifier()) {
      return s(
          NodeType.IF,
          children,
          keywordBare(
              ranges.findBetween(node.statements(), node.predicate(), "unless"), rangeOf(node)));
    }
    SourceRange elseToken =
        node.consequent() == null ? null : ranges.at(node.consequent().startChar(), 4);
    return s(
        NodeType.IF,
        children,
        new SourceMap.Condition(
            ranges.at(node.startChar(), 6),
            conditionBegin(node.predicate(), node.statements()),
            elseToken,
            ranges.at(node.endChar(), -3),
            rangeOf(node)));
  }

  @Override
  public TargetNode visitUntilNode(UntilNode node) {
    return loop(
        isPostLoop(node.isModifier(), node.statements()) ? NodeType.UNTIL_POST : NodeType.UNTIL,
        "until",
        node,
        node.predicate(),
        node.statements(),
        node.isModifier());
  }

  @Override
  public TargetNode visitWhileNode(WhileNode node) {
    return loop(
        isPostLoop(node.isModifier(), node.statements()) ? NodeType.WHILE_POST : NodeType.WHILE,
        "while",
        node,
        node.predicate(),
        node.statements(),
        node.isModifier());
  }

  private TargetNode loop(
      NodeType type,
      String keyword,
      Node node,
      Node predicate,
      Statements statements,
      boolean modifier) {
    List<@Nullable Object> children = list(visit(predicate), visit(statements));
    if (modifier) {
      return s(
          type,
          children,
          keywordBare(ranges.findBetween(statements, predicate, keyword), rangeOf(node)));
    }
    SourceRange begin = ranges.searchBetween(predicate, statements, "do");
    if (begin == null) {
      begin = ranges.searchBetween(predicate, statements, ";");
    }
    return s(
        type,
        children,
        new SourceMap.Keyword(
            ranges.at(node.startChar(), 5), begin, ranges.at(node.endChar(), -3), rangeOf(node)));
  }

  /** Whether a modifier loop runs its body first, as {@code begin ... end while x} does. */
  private static boolean isPostLoop(boolean modifier, Statements statements) {
    return modifier && statements.body().size() == 1 && statements.body().get(0) instanceof Begin;
  }

  @Override
  public TargetNode visitWhen(When node) {
    SourceRange keyword = ranges.at(node.startChar(), 4);
    Statements statements = node.statements();
    SourceRange begin =
        buffer.charAt(statements.startChar()) == ';' ? ranges.at(statements.startChar(), 1) : null;
    int end =
        statements.body().isEmpty() ? statements.endChar() : lastStatement(statements).endChar();

    List<@Nullable Object> children = visitAll(node.arguments().parts());
    children.add(visit(statements));
    return s(
        NodeType.WHEN,
        children,
        new SourceMap.Keyword(keyword, begin, null, ranges.range(keyword.getBeginPos(), end)));
  }

  /**
   * Translates the condition of an {@code if} or {@code unless}, where ranges become flip-flops
   * and bare regexps match against the last line read.
   */
  private @Nullable TargetNode visitPredicate(Node predicate) {
    if (predicate instanceof RangeNode) {
      return flipFlop((RangeNode) predicate);
    } else if (predicate instanceof RegexpLiteral) {
      return s(
          NodeType.MATCH_CURRENT_LINE,
          list(visit(predicate)),
          new SourceMap.Map(rangeOf(predicate)));
    }
    return visit(predicate);
  }

  private TargetNode flipFlop(RangeNode range) {
    TargetNode translated = checkTranslated(range, visit(range));
    return s(
        range.operator().value().equals("..") ? NodeType.IFLIPFLOP : NodeType.EFLIPFLOP,
        translated.getChildren(),
        new SourceMap.Operator(rangeOf(range.operator()), rangeOf(range)));
  }

  /** Finds the {@code then} or {@code ;} that separates a condition from its body, if any. */
  private @Nullable SourceRange conditionBegin(Node predicate, Statements statements) {
    int start = predicate.endChar();
    int end = statements.isEmpty() ? statements.endChar() : statements.body().get(0).startChar();
    String between = buffer.slice(start, end);
    if (between.contains("then")) {
      return ranges.find(start, end, "then");
    } else if (between.contains(";")) {
      return ranges.find(start, end, ";");
    }
    return null;
  }

  private @Nullable SourceRange conditionElse(@Nullable Node consequent) {
    if (consequent instanceof Elsif) {
      return ranges.at(consequent.startChar(), 5);
    } else if (consequent instanceof Else) {
      return ranges.at(consequent.startChar(), 4);
    }
    return null;
  }

  // Tokens and wrappers that never appear on their own.

  @Override
  public TargetNode visitArgParen(ArgParen node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitArgs(Args node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitBacktick(Backtick node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitBlockNode(BlockNode node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitComma(Comma node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitComment(Comment node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitEmbDoc(EmbDoc node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitEmbExprBeg(EmbExprBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitEmbExprEnd(EmbExprEnd node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitEmbVar(EmbVar node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitEndContent(EndContent node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitExcessedComma(ExcessedComma node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitHeredocBeg(HeredocBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitHeredocEnd(HeredocEnd node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitLabelEnd(LabelEnd node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitLBrace(LBrace node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitLBracket(LBracket node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitLParen(LParen node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitOp(Op node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitPeriod(Period node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitQSymbolsBeg(QSymbolsBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitQWordsBeg(QWordsBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRBrace(RBrace node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRBracket(RBracket node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRegexpBeg(RegexpBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRegexpContent(RegexpContent node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRegexpEnd(RegexpEnd node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRescueEx(RescueEx node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitRParen(RParen node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitStringContent(StringContent node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitSymBeg(SymBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitSymbolContent(SymbolContent node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitSymbolsBeg(SymbolsBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitTLambda(TLambda node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitTLamBeg(TLamBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitTStringBeg(TStringBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitTStringEnd(TStringEnd node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitVoidStmt(VoidStmt node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitWordsBeg(WordsBeg node) {
    throw unexpected(node);
  }

  @Override
  public TargetNode visitXString(XString node) {
    throw unexpected(node);
  }

  // Helpers

  private static TargetNode s(
      NodeType type, List<@Nullable Object> children, @Nullable SourceMap location) {
    return TargetNode.of(type, children, location);
  }

  private static TargetNode s(NodeType type, @Nullable SourceMap location) {
    return TargetNode.of(type, location);
  }

  private static List<@Nullable Object> list(@Nullable Object... items) {
    return new ArrayList<>(Arrays.asList(items));
  }

  private SourceRange rangeOf(Node node) {
    return ranges.of(node);
  }

  private static SourceMap.Collection bare(@Nullable SourceRange expression) {
    return new SourceMap.Collection(null, null, expression);
  }

  private static SourceMap.Keyword keywordBare(SourceRange keyword, SourceRange expression) {
    return new SourceMap.Keyword(keyword, null, null, expression);
  }

  private static SourceMap.Send sendBare(SourceRange selector, SourceRange expression) {
    return new SourceMap.Send(null, selector, null, null, expression);
  }

  /** A collection map whose first and last characters are its delimiters. */
  private SourceMap.Collection parenthesized(Node node) {
    return new SourceMap.Collection(
        ranges.at(node.startChar(), 1), ranges.at(node.endChar(), -1), rangeOf(node));
  }

  private TargetNode variable(NodeType type, Token node) {
    return s(
        type,
        list(Symbol.of(node.value())),
        new SourceMap.Variable(rangeOf(node), rangeOf(node)));
  }

  /** Builds a plain parameter, such as {@code arg} or {@code shadowarg}, from its name. */
  private TargetNode argument(NodeType type, Node name) {
    return s(
        type,
        list(Symbol.of(tokenValue(name))),
        new SourceMap.Variable(rangeOf(name), rangeOf(name)));
  }

  /**
   * Resolves the escapes of literal text the way the innermost enclosing literal does. Double
   * quotes resolve every escape. Single quotes and {@code %q}, {@code %w} and {@code %i} lists
   * only resolve an escaped backslash or delimiter, and a quoted heredoc resolves none.
   */
  private String unescape(String text) {
    for (int depth = 0; stack.peek(depth) != null; depth++) {
      Node ancestor = stack.peek(depth);
      if (ancestor instanceof StringLiteral) {
        return unescapeQuoted(text, ((StringLiteral) ancestor).quote());
      } else if (ancestor instanceof DynaSymbol) {
        return unescapeQuoted(text, ((DynaSymbol) ancestor).quote());
      } else if (ancestor instanceof Heredoc) {
        return ((Heredoc) ancestor).beginning().value().contains("'")
            ? text
            : StringEscapes.unescape(text);
      } else if (ancestor instanceof QWords) {
        return StringEscapes.unescapeSingleQuoted(
            text, delimitersOf(((QWords) ancestor).beginning().value()) + " \t\n");
      } else if (ancestor instanceof QSymbols) {
        return StringEscapes.unescapeSingleQuoted(
            text, delimitersOf(((QSymbols) ancestor).beginning().value()) + " \t\n");
      } else if (ancestor instanceof Words
          || ancestor instanceof Symbols
          || ancestor instanceof XStringLiteral
          || ancestor instanceof RegexpLiteral) {
        break;
      }
    }
    return StringEscapes.unescape(text);
  }

  private static String unescapeQuoted(String text, @Nullable String quote) {
    if (quote != null && SINGLE_QUOTE.matcher(quote).lookingAt()) {
      return StringEscapes.unescapeSingleQuoted(text, delimitersOf(quote));
    }
    return StringEscapes.unescape(text);
  }

  /** Returns the characters that open and close a literal whose opener ends with its delimiter. */
  private static String delimitersOf(String opener) {
    char open = opener.charAt(opener.length() - 1);
    switch (open) {
      case '(':
        return "()";
      case '[':
        return "[]";
      case '{':
        return "{}";
      case '<':
        return "<>";
      default:
        return String.valueOf(open);
    }
  }

  private @Nullable SourceRange signOf(Node literal) {
    char first = buffer.charAt(literal.startChar());
    return first == '+' || first == '-' ? ranges.at(literal.startChar(), 1) : null;
  }

  private static SourceMap locationOf(TargetNode node) {
    if (node.getLocation() == null) {
      throw new TranslationException("Node " + node.getType() + " has no source map");
    }
    return node.getLocation();
  }

  private static SourceRange expressionOf(@Nullable Object node) {
    if (!(node instanceof TargetNode)) {
      throw new TranslationException("Expected a node but found " + node);
    }
    SourceRange expression = locationOf((TargetNode) node).expression();
    if (expression == null) {
      throw new TranslationException("Node " + ((TargetNode) node).getType() + " has no range");
    }
    return expression;
  }

  /** Returns the text of a token, looking through variable wrappers. */
  private static String tokenValue(Node node) {
    if (node instanceof Token) {
      return ((Token) node).value();
    } else if (node instanceof VarRef) {
      return tokenValue(((VarRef) node).value());
    } else if (node instanceof VarField && ((VarField) node).value() != null) {
      return tokenValue(((VarField) node).value());
    }
    throw new TranslationException(
        "Expected a name but found " + node.getClass().getSimpleName() + " at offset "
            + node.startChar());
  }

  private static boolean isKeyword(@Nullable Node node, String keyword) {
    return node instanceof Kw && ((Kw) node).value().equals(keyword);
  }

  private static boolean isOperator(@Nullable Node node, String operator) {
    return node instanceof Op && ((Op) node).value().equals(operator);
  }

  private static boolean isSelf(Node node) {
    return node instanceof VarRef && isKeyword(((VarRef) node).value(), "self");
  }

  private static Args asArgs(Node node) {
    if (!(node instanceof Args)) {
      throw unexpected(node);
    }
    return (Args) node;
  }

  private static Node lastStatement(Statements statements) {
    List<Node> body = statements.body();
    return body.get(body.size() - 1);
  }

  private static TargetNode checkTranslated(Node origin, @Nullable TargetNode translated) {
    if (translated == null) {
      throw new TranslationException(
          origin.getClass().getSimpleName() + " at offset " + origin.startChar()
              + " translated to nothing");
    }
    return translated;
  }

  private static String chomp(String value, String suffix) {
    return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
  }

  private static int countLineBreaks(String value) {
    return CharMatcher.is('\n').countIn(value);
  }

  private static TranslationException unexpected(Node node) {
    return new TranslationException(
        "Cannot translate " + node.getClass().getSimpleName() + " at offset " + node.startChar());
  }
}
