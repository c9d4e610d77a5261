package org.pragmatica.exprjson.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.exprjson.error.ParseError;
import org.pragmatica.exprjson.tree.BinOp;
import org.pragmatica.exprjson.tree.Expr;
import org.pragmatica.exprjson.tree.Member;
import org.pragmatica.exprjson.tree.RangeLimits;
import org.pragmatica.exprjson.tree.Stmt;
import org.pragmatica.exprjson.tree.UnOp;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private static Expr parse(String source) {
        var result = Parser.create().parse(source);
        assertTrue(result.isSuccess(), () -> "Parse failed: " + result);
        return result.unwrap();
    }

    private static <T extends Expr> T parseAs(Class<T> type, String source) {
        var expr = parse(source);
        assertInstanceOf(type, expr);
        return type.cast(expr);
    }

    private static ParseError parseError(String source) {
        var result = Parser.create().parse(source);
        assertTrue(result.isFailure(), () -> "Expected failure for: " + source);
        return ((ParseResult.Failure) result).error();
    }

    // === Precedence and Associativity ===

    @Test
    void parse_productBindsTighterThanSum() {
        var sum = parseAs(Expr.Binary.class, "1 + 2 * 3");

        assertInstanceOf(BinOp.Add.class, sum.op());
        assertInstanceOf(Expr.Lit.class, sum.left());
        var product = assertInstanceOf(Expr.Binary.class, sum.right());
        assertInstanceOf(BinOp.Mul.class, product.op());
    }

    @Test
    void parse_subtraction_isLeftAssociative() {
        var outer = parseAs(Expr.Binary.class, "a - b - c");

        var inner = assertInstanceOf(Expr.Binary.class, outer.left());
        assertInstanceOf(BinOp.Sub.class, inner.op());
        assertInstanceOf(Expr.Path.class, outer.right());
    }

    @Test
    void parse_assignment_isRightAssociative() {
        var outer = parseAs(Expr.Assign.class, "a = b = c");

        assertInstanceOf(Expr.Path.class, outer.left());
        assertInstanceOf(Expr.Assign.class, outer.right());
    }

    @Test
    void parse_compoundAssignment_isBinary() {
        var binary = parseAs(Expr.Binary.class, "x >>= 1");

        assertInstanceOf(BinOp.ShrAssign.class, binary.op());
    }

    @Test
    void parse_logicalOperators_andBindsTighterThanOr() {
        var or = parseAs(Expr.Binary.class, "a && b || c");

        assertInstanceOf(BinOp.Or.class, or.op());
        var and = assertInstanceOf(Expr.Binary.class, or.left());
        assertInstanceOf(BinOp.And.class, and.op());
    }

    @Test
    void parse_comparisonAboveLogical() {
        var and = parseAs(Expr.Binary.class, "a == b && c != d");

        assertInstanceOf(BinOp.And.class, and.op());
        assertInstanceOf(BinOp.Eq.class, ((Expr.Binary) and.left()).op());
        assertInstanceOf(BinOp.Ne.class, ((Expr.Binary) and.right()).op());
    }

    @Test
    void parse_unaryBindsTighterThanCast() {
        var cast = parseAs(Expr.Cast.class, "-x as u8");

        var unary = assertInstanceOf(Expr.Unary.class, cast.expr());
        assertInstanceOf(UnOp.Neg.class, unary.op());
    }

    @Test
    void parse_castBindsTighterThanProduct() {
        var product = parseAs(Expr.Binary.class, "a * b as f64");

        assertInstanceOf(Expr.Cast.class, product.right());
    }

    @Test
    void parse_chainedComparison_fails() {
        var error = parseError("a < b < c");

        var invalid = assertInstanceOf(ParseError.InvalidSyntax.class, error);
        assertEquals("comparison operators cannot be chained", invalid.reason());
    }

    // === Ranges ===

    @Test
    void parse_ranges_allForms() {
        var full = parseAs(Expr.Range.class, "a..b");
        assertTrue(full.start().isPresent());
        assertTrue(full.end().isPresent());
        assertEquals(RangeLimits.HALF_OPEN, full.limits());

        var all = parseAs(Expr.Range.class, "..");
        assertTrue(all.start().isEmpty());
        assertTrue(all.end().isEmpty());

        var closed = parseAs(Expr.Range.class, "..=5");
        assertEquals(RangeLimits.CLOSED, closed.limits());
        assertTrue(closed.end().isPresent());

        var from = parseAs(Expr.Range.class, "a..");
        assertTrue(from.end().isEmpty());
    }

    @Test
    void parse_rangeEnd_includesSum() {
        var range = parseAs(Expr.Range.class, "0..n + 1");

        assertInstanceOf(Expr.Binary.class, range.end().orElseThrow());
    }

    @Test
    void parse_closedRangeWithoutEnd_fails() {
        var error = parseError("a..=");

        assertEquals("inclusive range with no end", error.message());
    }

    @Test
    void parse_chainedRange_fails() {
        var error = parseError("a..b..c");

        assertEquals("range operators cannot be chained", error.message());
    }

    // === Postfix ===

    @Test
    void parse_methodCall_receiverAndArgs() {
        var call = parseAs(Expr.MethodCall.class, "foo.bar(baz)");

        assertEquals("bar", call.method());
        assertInstanceOf(Expr.Path.class, call.receiver());
        assertEquals(1, call.args().size());
        assertTrue(call.turbofish().isEmpty());
    }

    @Test
    void parse_turbofishWithNestedGenerics_splitsShiftToken() {
        var call = parseAs(Expr.MethodCall.class, "iter.collect::<Vec<Vec<u8>>>()");

        assertTrue(call.turbofish().isPresent());
        assertTrue(call.args().isEmpty());
    }

    @Test
    void parse_pathWithGenericArguments_splitsShiftToken() {
        var call = parseAs(Expr.Call.class, "Vec::<Vec<u8>>::new()");

        assertInstanceOf(Expr.Path.class, call.func());
    }

    @Test
    void parse_castToNestedGeneric_splitsShiftToken() {
        var cast = parseAs(Expr.Cast.class, "x as Box<Vec<u8>>");

        assertEquals(7, cast.ty().tokens().size());
    }

    @Test
    void parse_nestedTupleIndex_splitsFloatLiteral() {
        var outer = parseAs(Expr.Field.class, "t.0.1");

        assertEquals(new Member.Unnamed(1), outer.member());
        var inner = assertInstanceOf(Expr.Field.class, outer.base());
        assertEquals(new Member.Unnamed(0), inner.member());
    }

    @Test
    void parse_tupleIndex_wholeUnsignedRange() {
        var field = parseAs(Expr.Field.class, "x.4294967295");

        assertEquals(new Member.Unnamed(4_294_967_295L), field.member());
        var invalid = assertInstanceOf(ParseError.InvalidSyntax.class, parseError("x.4294967296"));
        assertEquals("tuple index out of range: 4294967296", invalid.reason());
        assertTrue(invalid.help().isEmpty());
    }

    @Test
    void parse_awaitThenTry_nestsInOrder() {
        var tryExpr = parseAs(Expr.Try.class, "f().await?");

        var await = assertInstanceOf(Expr.Await.class, tryExpr.expr());
        assertInstanceOf(Expr.Call.class, await.base());
    }

    @Test
    void parse_index_andNamedField() {
        var index = parseAs(Expr.Index.class, "a.b[0]");

        var field = assertInstanceOf(Expr.Field.class, index.expr());
        assertEquals(new Member.Named("b"), field.member());
    }

    // === Prefix ===

    @Test
    void parse_doubleReference_splitsAndAnd() {
        var outer = parseAs(Expr.Reference.class, "&&x");

        assertInstanceOf(Expr.Reference.class, outer.expr());
        assertFalse(outer.mutability());
    }

    @Test
    void parse_mutableReference_andRawAddress() {
        assertTrue(parseAs(Expr.Reference.class, "&mut x").mutability());
        assertFalse(parseAs(Expr.RawAddr.class, "&raw const x").mutability());
        assertTrue(parseAs(Expr.RawAddr.class, "&raw mut x").mutability());
    }

    @Test
    void parse_boxExpression_isVerbatim() {
        var verbatim = parseAs(Expr.Verbatim.class, "box 5");

        assertEquals(2, verbatim.tokens().size());
        assertTrue(verbatim.attrs().isEmpty());
    }

    @Test
    void parse_outerAttribute_attachedToExpression() {
        var call = parseAs(Expr.Call.class, "#[inline] foo()");

        assertEquals(1, call.attrs().size());
        assertFalse(call.attrs().get(0).inner());
    }

    // === Aggregates ===

    @Test
    void parse_parenAndTuples_distinguished() {
        parseAs(Expr.Paren.class, "(a)");
        assertEquals(1, parseAs(Expr.Tuple.class, "(a,)").elems().size());
        assertEquals(0, parseAs(Expr.Tuple.class, "()").elems().size());
        assertEquals(3, parseAs(Expr.Tuple.class, "(a, b, c)").elems().size());
    }

    @Test
    void parse_arrayAndRepeat_distinguished() {
        assertEquals(3, parseAs(Expr.Array.class, "[1, 2, 3,]").elems().size());
        assertEquals(0, parseAs(Expr.Array.class, "[]").elems().size());
        parseAs(Expr.Repeat.class, "[0; 4]");
    }

    @Test
    void parse_structLiteral_fieldsShorthandAndRest() {
        var struct = parseAs(Expr.Struct.class, "Point { x: 1, y, ..base }");

        assertEquals(2, struct.fields().size());
        assertInstanceOf(Expr.Path.class, struct.fields().get(1).expr());
        assertTrue(struct.dot2());
        assertTrue(struct.rest().isPresent());
    }

    @Test
    void parse_structLiteralWithoutRest_dot2Only() {
        var struct = parseAs(Expr.Struct.class, "S { a: 1, .. }");

        assertTrue(struct.dot2());
        assertTrue(struct.rest().isEmpty());
    }

    @Test
    void parse_macroInvocation() {
        var macro = parseAs(Expr.Macro.class, "vec![1, 2]");

        assertEquals(7, macro.mac().size());
    }

    @Test
    void parse_qualifiedPath_hasQself() {
        var path = parseAs(Expr.Path.class, "<T as Default>::default");

        assertTrue(path.qself().isPresent());
    }

    @Test
    void parse_underscore_isInfer() {
        parseAs(Expr.Infer.class, "_");
    }

    // === Control Flow ===

    @Test
    void parse_ifCondition_doesNotTakeStructLiteral() {
        var ifExpr = parseAs(Expr.If.class, "if x { y }");

        assertInstanceOf(Expr.Path.class, ifExpr.cond());
        assertTrue(ifExpr.elseBranch().isEmpty());
    }

    @Test
    void parse_whileAndForHeads_doNotTakeStructLiteral() {
        assertInstanceOf(Expr.Path.class, parseAs(Expr.While.class, "while running { tick(); }").cond());
        assertInstanceOf(Expr.Path.class, parseAs(Expr.ForLoop.class, "for i in items { use_it(i); }").expr());
        assertInstanceOf(Expr.Path.class, parseAs(Expr.Match.class, "match v { _ => 0 }").expr());
    }

    @Test
    void parse_parenthesizedStructInCondition_allowed() {
        var ifExpr = parseAs(Expr.If.class, "if (S { a: 1 }).a { }");

        assertInstanceOf(Expr.Field.class, ifExpr.cond());
    }

    @Test
    void parse_elseIf_nestsIf() {
        var ifExpr = parseAs(Expr.If.class, "if a { 1 } else if b { 2 } else { 3 }");

        var elseIf = assertInstanceOf(Expr.If.class, ifExpr.elseBranch().orElseThrow());
        assertInstanceOf(Expr.Block.class, elseIf.elseBranch().orElseThrow());
    }

    @Test
    void parse_letChain_inCondition() {
        var ifExpr = parseAs(Expr.If.class, "if let Some(x) = y && x > 0 { x }");

        var and = assertInstanceOf(Expr.Binary.class, ifExpr.cond());
        assertInstanceOf(BinOp.And.class, and.op());
        var let = assertInstanceOf(Expr.Let.class, and.left());
        assertInstanceOf(Expr.Path.class, let.expr());
        assertInstanceOf(Expr.Binary.class, and.right());
    }

    @Test
    void parse_match_armsGuardsAndBlockBodies() {
        var match = parseAs(Expr.Match.class, "match x { 0 => a, n if n > 0 => { b } _ => c }");

        assertEquals(3, match.arms().size());
        assertTrue(match.arms().get(0).guard().isEmpty());
        assertTrue(match.arms().get(1).guard().isPresent());
        assertInstanceOf(Expr.Block.class, match.arms().get(1).body());
    }

    @Test
    void parse_matchArmWithoutComma_fails() {
        var error = parseError("match x { 0 => a 1 => b }");

        assertInstanceOf(ParseError.UnexpectedToken.class, error);
    }

    @Test
    void parse_labeledLoops() {
        var loop = parseAs(Expr.Loop.class, "'outer: loop { break 'outer; }");
        assertEquals("outer", loop.label().orElseThrow().name());

        var whileLoop = parseAs(Expr.While.class, "'w: while a { continue 'w; }");
        assertEquals("w", whileLoop.label().orElseThrow().name());

        var block = parseAs(Expr.Block.class, "'b: { 1 }");
        assertEquals("b", block.label().orElseThrow().name());
    }

    @Test
    void parse_breakWithAndWithoutValue() {
        assertTrue(parseAs(Expr.Break.class, "break").expr().isEmpty());
        assertInstanceOf(Expr.Lit.class, parseAs(Expr.Break.class, "break 42").expr().orElseThrow());

        var labeled = parseAs(Expr.Break.class, "break 'a 1");
        assertEquals("a", labeled.label().orElseThrow().name());
        assertTrue(labeled.expr().isPresent());
    }

    @Test
    void parse_returnAndYield() {
        assertTrue(parseAs(Expr.Return.class, "return").expr().isEmpty());
        assertTrue(parseAs(Expr.Yield.class, "yield x").expr().isPresent());
    }

    // === Blocks and Closures ===

    @Test
    void parse_blockKinds() {
        parseAs(Expr.Unsafe.class, "unsafe { f() }");
        assertTrue(parseAs(Expr.Async.class, "async move { 1 }").capture());
        parseAs(Expr.Const.class, "const { 1 }");
        parseAs(Expr.TryBlock.class, "try { x? }");
    }

    @Test
    void parse_blockStatements_localItemAndTrailingExpression() {
        var block = parseAs(Expr.Block.class, "{ let x = 1; fn f() {} x }");
        var stmts = block.block().stmts();

        assertEquals(3, stmts.size());
        assertInstanceOf(Stmt.Local.class, stmts.get(0));
        assertInstanceOf(Stmt.Item.class, stmts.get(1));
        var last = assertInstanceOf(Stmt.Expression.class, stmts.get(2));
        assertFalse(last.semi());
    }

    @Test
    void parse_letElse_hasDivergeBlock() {
        var block = parseAs(Expr.Block.class, "{ let Some(x) = y else { return; }; x }");

        var local = assertInstanceOf(Stmt.Local.class, block.block().stmts().get(0));
        assertTrue(local.init().isPresent());
        assertTrue(local.diverge().isPresent());
    }

    @Test
    void parse_blockLikeStatement_endsWithoutSemicolon() {
        var block = parseAs(Expr.Block.class, "{ if a { b } else { c } d }");

        assertEquals(2, block.block().stmts().size());
    }

    @Test
    void parse_blockLikeStatementWithMethodCall_continues() {
        var block = parseAs(Expr.Block.class, "{ match x { _ => y }.len() }");

        var stmt = assertInstanceOf(Stmt.Expression.class, block.block().stmts().get(0));
        assertInstanceOf(Expr.MethodCall.class, stmt.expr());
    }

    @Test
    void parse_missingSemicolonBetweenStatements_fails() {
        var error = parseError("{ a b }");

        assertInstanceOf(ParseError.UnexpectedToken.class, error);
    }

    @Test
    void parse_closures() {
        var twoArgs = parseAs(Expr.Closure.class, "|a, b| a + b");
        assertEquals(2, twoArgs.inputs().size());
        assertInstanceOf(Expr.Binary.class, twoArgs.body());

        var noArgs = parseAs(Expr.Closure.class, "move || 1");
        assertTrue(noArgs.capture());
        assertTrue(noArgs.inputs().isEmpty());

        var typed = parseAs(Expr.Closure.class, "|x: i32| -> i32 { x }");
        assertInstanceOf(Expr.Block.class, typed.body());
        assertFalse(typed.output().isEmpty());
    }

    @Test
    void parse_closureReturnTypeWithoutBlock_fails() {
        var error = parseError("|x| -> i32 x");

        assertInstanceOf(ParseError.UnexpectedToken.class, error);
    }

    // === Errors ===

    @Test
    void parse_emptyInput_unexpectedEof() {
        var error = parseError("");

        var eof = assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals("expression", eof.expected());
    }

    @Test
    void parse_trailingTokens_fail() {
        var error = parseError("a b");

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals("end of input", unexpected.expected());
        assertEquals("identifier 'b'", unexpected.found());
        assertEquals(3, unexpected.span().start().column());
    }

    @Test
    void parse_keywordInOperandPosition_fails() {
        var error = parseError("1 + else");

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals("keyword 'else'", unexpected.found());
    }

    @Test
    void parse_lexerError_invalidToken() {
        var error = parseError("\"unterminated");

        assertInstanceOf(ParseError.InvalidToken.class, error);
    }

    @Test
    void parse_oversizeInput_invalidToken() {
        var error = parseError("1".repeat(1_000_001));

        assertInstanceOf(ParseError.InvalidToken.class, error);
    }

    // === Nesting Limit ===

    @Test
    void parse_deepNesting_failsWithNestingError() {
        var source = "(".repeat(300) + "1" + ")".repeat(300);

        var error = parseError(source);

        var tooDeep = assertInstanceOf(ParseError.NestingTooDeep.class, error);
        assertEquals(256, tooDeep.limit());
    }

    @Test
    void parse_moderateNesting_succeeds() {
        var source = "(".repeat(40) + "1" + ")".repeat(40);

        assertInstanceOf(Expr.Paren.class, parse(source));
    }

    @Test
    void parse_parenthesesUpToLimit_oneLevelEach() {
        // the innermost operand takes the last level
        var atLimit = "(".repeat(255) + "1" + ")".repeat(255);
        var overLimit = "(".repeat(256) + "1" + ")".repeat(256);

        assertInstanceOf(Expr.Paren.class, parse(atLimit));
        assertInstanceOf(ParseError.NestingTooDeep.class, parseError(overLimit));
    }

    @Test
    void parse_longOperatorChain_countsEachOperator() {
        assertInstanceOf(Expr.Binary.class, parse("a" + " + a".repeat(200)));

        var tooDeep = assertInstanceOf(ParseError.NestingTooDeep.class, parseError("a" + " + a".repeat(600)));
        assertEquals(256, tooDeep.limit());
    }

    @Test
    void parse_longMethodChain_countsEachCall() {
        assertInstanceOf(Expr.MethodCall.class, parse("a" + ".f()".repeat(200)));

        assertInstanceOf(ParseError.NestingTooDeep.class, parseError("a" + ".f()".repeat(600)));
    }

    @Test
    void parse_longTryChain_countsEachOperator() {
        assertInstanceOf(Expr.Try.class, parse("a" + "?".repeat(200)));

        assertInstanceOf(ParseError.NestingTooDeep.class, parseError("a" + "?".repeat(600)));
    }

    @Test
    void parse_longElseIfChain_countsEachBranch() {
        assertInstanceOf(Expr.If.class, parse("if a {} else ".repeat(200) + "{}"));

        assertInstanceOf(ParseError.NestingTooDeep.class, parseError("if a {} else ".repeat(600) + "{}"));
    }

    @Test
    void parse_longChainWithRaisedLimit_nodesShareSourceTokens() {
        var terms = 30_000;
        var parser = Parser.create(ParserConfig.DEFAULT.withMaxNestingDepth(terms + 1));

        var expr = parser.parse("a" + " + a".repeat(terms)).unwrap();

        var folds = 0;
        while (expr instanceof Expr.Binary binary) {
            assertEquals(2 * (terms - folds) + 1, binary.tokens().size());
            expr = binary.left();
            folds++;
        }
        assertEquals(terms, folds);
        assertEquals(1, expr.tokens().size());
    }

    @Test
    void parse_customNestingLimit_applied() {
        var parser = Parser.create(ParserConfig.DEFAULT.withMaxNestingDepth(4));

        assertTrue(parser.parse("1").isSuccess());
        assertTrue(parser.parse("((((1))))").isFailure());
    }

    @Test
    void parserConfig_nonPositiveLimit_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(0));
    }
}
