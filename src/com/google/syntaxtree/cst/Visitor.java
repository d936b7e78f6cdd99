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

import org.jspecify.annotations.Nullable;

/**
 * A visitor over every kind of {@link Node}. Implementations must handle each variant, so adding
 * a node type is a compile error everywhere it is not yet handled.
 *
 * @param <R> the result of visiting a node
 */
public interface Visitor<R extends @Nullable Object> {

  R visitAliasNode(AliasNode node);

  R visitARef(ARef node);

  R visitARefField(ARefField node);

  R visitArgBlock(ArgBlock node);

  R visitArgParen(ArgParen node);

  R visitArgs(Args node);

  R visitArgsForward(ArgsForward node);

  R visitArgStar(ArgStar node);

  R visitArrayLiteral(ArrayLiteral node);

  R visitAryPtn(AryPtn node);

  R visitAssign(Assign node);

  R visitAssoc(Assoc node);

  R visitAssocSplat(AssocSplat node);

  R visitBackref(Backref node);

  R visitBacktick(Backtick node);

  R visitBareAssocHash(BareAssocHash node);

  R visitBegin(Begin node);

  R visitBEGINBlock(BEGINBlock node);

  R visitBinary(Binary node);

  R visitBlockArg(BlockArg node);

  R visitBlockNode(BlockNode node);

  R visitBlockVar(BlockVar node);

  R visitBodyStmt(BodyStmt node);

  R visitBreak(Break node);

  R visitCallNode(CallNode node);

  R visitCase(Case node);

  R visitCHAR(CHAR node);

  R visitClassDeclaration(ClassDeclaration node);

  R visitComma(Comma node);

  R visitCommand(Command node);

  R visitCommandCall(CommandCall node);

  R visitComment(Comment node);

  R visitConst(Const node);

  R visitConstPathField(ConstPathField node);

  R visitConstPathRef(ConstPathRef node);

  R visitConstRef(ConstRef node);

  R visitCVar(CVar node);

  R visitDefined(Defined node);

  R visitDefNode(DefNode node);

  R visitDynaSymbol(DynaSymbol node);

  R visitElse(Else node);

  R visitElsif(Elsif node);

  R visitEmbDoc(EmbDoc node);

  R visitEmbExprBeg(EmbExprBeg node);

  R visitEmbExprEnd(EmbExprEnd node);

  R visitEmbVar(EmbVar node);

  R visitENDBlock(ENDBlock node);

  R visitEndContent(EndContent node);

  R visitEnsure(Ensure node);

  R visitExcessedComma(ExcessedComma node);

  R visitField(Field node);

  R visitFloatLiteral(FloatLiteral node);

  R visitFndPtn(FndPtn node);

  R visitFor(For node);

  R visitGVar(GVar node);

  R visitHashLiteral(HashLiteral node);

  R visitHeredoc(Heredoc node);

  R visitHeredocBeg(HeredocBeg node);

  R visitHeredocEnd(HeredocEnd node);

  R visitHshPtn(HshPtn node);

  R visitIdent(Ident node);

  R visitIfNode(IfNode node);

  R visitIfOp(IfOp node);

  R visitImaginary(Imaginary node);

  R visitIn(In node);

  R visitInt(Int node);

  R visitIVar(IVar node);

  R visitKw(Kw node);

  R visitKwRestParam(KwRestParam node);

  R visitLabel(Label node);

  R visitLabelEnd(LabelEnd node);

  R visitLambda(Lambda node);

  R visitLambdaVar(LambdaVar node);

  R visitLBrace(LBrace node);

  R visitLBracket(LBracket node);

  R visitLParen(LParen node);

  R visitMAssign(MAssign node);

  R visitMethodAddBlock(MethodAddBlock node);

  R visitMLHS(MLHS node);

  R visitMLHSParen(MLHSParen node);

  R visitModuleDeclaration(ModuleDeclaration node);

  R visitMRHS(MRHS node);

  R visitNext(Next node);

  R visitNot(Not node);

  R visitOp(Op node);

  R visitOpAssign(OpAssign node);

  R visitParams(Params node);

  R visitParen(Paren node);

  R visitPeriod(Period node);

  R visitPinnedBegin(PinnedBegin node);

  R visitPinnedVarRef(PinnedVarRef node);

  R visitProgram(Program node);

  R visitQSymbols(QSymbols node);

  R visitQSymbolsBeg(QSymbolsBeg node);

  R visitQWords(QWords node);

  R visitQWordsBeg(QWordsBeg node);

  R visitRangeNode(RangeNode node);

  R visitRAssign(RAssign node);

  R visitRationalLiteral(RationalLiteral node);

  R visitRBrace(RBrace node);

  R visitRBracket(RBracket node);

  R visitRedo(Redo node);

  R visitRegexpBeg(RegexpBeg node);

  R visitRegexpContent(RegexpContent node);

  R visitRegexpEnd(RegexpEnd node);

  R visitRegexpLiteral(RegexpLiteral node);

  R visitRescue(Rescue node);

  R visitRescueEx(RescueEx node);

  R visitRescueMod(RescueMod node);

  R visitRestParam(RestParam node);

  R visitRetry(Retry node);

  R visitReturnNode(ReturnNode node);

  R visitRParen(RParen node);

  R visitSClass(SClass node);

  R visitStatements(Statements node);

  R visitStringConcat(StringConcat node);

  R visitStringContent(StringContent node);

  R visitStringDVar(StringDVar node);

  R visitStringEmbExpr(StringEmbExpr node);

  R visitStringLiteral(StringLiteral node);

  R visitSuper(Super node);

  R visitSymBeg(SymBeg node);

  R visitSymbolContent(SymbolContent node);

  R visitSymbolLiteral(SymbolLiteral node);

  R visitSymbols(Symbols node);

  R visitSymbolsBeg(SymbolsBeg node);

  R visitTLambda(TLambda node);

  R visitTLamBeg(TLamBeg node);

  R visitTopConstField(TopConstField node);

  R visitTopConstRef(TopConstRef node);

  R visitTStringBeg(TStringBeg node);

  R visitTStringContent(TStringContent node);

  R visitTStringEnd(TStringEnd node);

  R visitUnary(Unary node);

  R visitUndef(Undef node);

  R visitUnlessNode(UnlessNode node);

  R visitUntilNode(UntilNode node);

  R visitVarField(VarField node);

  R visitVarRef(VarRef node);

  R visitVCall(VCall node);

  R visitVoidStmt(VoidStmt node);

  R visitWhen(When node);

  R visitWhileNode(WhileNode node);

  R visitWord(Word node);

  R visitWords(Words node);

  R visitWordsBeg(WordsBeg node);

  R visitXString(XString node);

  R visitXStringLiteral(XStringLiteral node);

  R visitYieldNode(YieldNode node);

  R visitZSuper(ZSuper node);
}
