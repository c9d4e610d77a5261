package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.Arm;
import org.pragmatica.exprjson.tree.Attribute;
import org.pragmatica.exprjson.tree.BinOp;
import org.pragmatica.exprjson.tree.CodeBlock;
import org.pragmatica.exprjson.tree.Expr;
import org.pragmatica.exprjson.tree.FieldValue;
import org.pragmatica.exprjson.tree.Label;
import org.pragmatica.exprjson.tree.Literal;
import org.pragmatica.exprjson.tree.Member;
import org.pragmatica.exprjson.tree.Pat;
import org.pragmatica.exprjson.tree.RangeLimits;
import org.pragmatica.exprjson.tree.Stmt;
import org.pragmatica.exprjson.tree.Type;
import org.pragmatica.exprjson.tree.UnOp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static java.util.Map.entry;

/**
 * Grammar rules for expressions, blocks and statements.
 *
 * <p>Binary operators use precedence climbing. The {@code allowStruct} flag is false in
 * {@code if}, {@code while}, {@code match} and {@code for} heads, where an opening brace starts
 * the body rather than a struct literal.
 */
final class ExprRules {

    private enum Precedence {
        ASSIGN,
        RANGE,
        OR,
        AND,
        COMPARE,
        BIT_OR,
        BIT_XOR,
        BIT_AND,
        SHIFT,
        SUM,
        PRODUCT,
        CAST;

        Precedence next() {
            return values()[ordinal() + 1];
        }
    }

    private static final long MAX_TUPLE_INDEX = 0xFFFF_FFFFL;

    private static final String PARENTHESIZE = "use parentheses to make the intended grouping explicit";

    private static final Map<String, Precedence> PRECEDENCE = Map.ofEntries(
        entry("=", Precedence.ASSIGN), entry("+=", Precedence.ASSIGN), entry("-=", Precedence.ASSIGN),
        entry("*=", Precedence.ASSIGN), entry("/=", Precedence.ASSIGN), entry("%=", Precedence.ASSIGN),
        entry("^=", Precedence.ASSIGN), entry("&=", Precedence.ASSIGN), entry("|=", Precedence.ASSIGN),
        entry("<<=", Precedence.ASSIGN), entry(">>=", Precedence.ASSIGN),
        entry("..", Precedence.RANGE), entry("..=", Precedence.RANGE),
        entry("||", Precedence.OR),
        entry("&&", Precedence.AND),
        entry("==", Precedence.COMPARE), entry("!=", Precedence.COMPARE), entry("<", Precedence.COMPARE),
        entry(">", Precedence.COMPARE), entry("<=", Precedence.COMPARE), entry(">=", Precedence.COMPARE),
        entry("|", Precedence.BIT_OR),
        entry("^", Precedence.BIT_XOR),
        entry("&", Precedence.BIT_AND),
        entry("<<", Precedence.SHIFT), entry(">>", Precedence.SHIFT),
        entry("+", Precedence.SUM), entry("-", Precedence.SUM),
        entry("*", Precedence.PRODUCT), entry("/", Precedence.PRODUCT), entry("%", Precedence.PRODUCT));

    private static final Map<String, Function<Token, BinOp>> BINARY_OPERATORS = Map.ofEntries(
        entry("+", BinOp.Add::new), entry("-", BinOp.Sub::new), entry("*", BinOp.Mul::new),
        entry("/", BinOp.Div::new), entry("%", BinOp.Rem::new),
        entry("&&", BinOp.And::new), entry("||", BinOp.Or::new),
        entry("^", BinOp.BitXor::new), entry("&", BinOp.BitAnd::new), entry("|", BinOp.BitOr::new),
        entry("<<", BinOp.Shl::new), entry(">>", BinOp.Shr::new),
        entry("==", BinOp.Eq::new), entry("<", BinOp.Lt::new), entry("<=", BinOp.Le::new),
        entry("!=", BinOp.Ne::new), entry(">=", BinOp.Ge::new), entry(">", BinOp.Gt::new),
        entry("+=", BinOp.AddAssign::new), entry("-=", BinOp.SubAssign::new),
        entry("*=", BinOp.MulAssign::new), entry("/=", BinOp.DivAssign::new),
        entry("%=", BinOp.RemAssign::new), entry("^=", BinOp.BitXorAssign::new),
        entry("&=", BinOp.BitAndAssign::new), entry("|=", BinOp.BitOrAssign::new),
        entry("<<=", BinOp.ShlAssign::new), entry(">>=", BinOp.ShrAssign::new));

    private static final Set<String> EXPR_KEYWORDS = Set.of(
        "async", "box", "break", "const", "continue", "false", "for", "if", "let", "loop", "match",
        "move", "return", "static", "true", "try", "unsafe", "while", "yield");

    private static final Set<String> EXPR_PUNCT = Set.of(
        "-", "!", "*", "&", "&&", "|", "||", "..", "..=", "<", "<<", "::", "#");

    private static final Set<String> ITEM_KEYWORDS = Set.of(
        "fn", "struct", "enum", "impl", "trait", "type", "use", "mod", "extern", "pub");

    private final ParsingContext ctx;
    private final TypeRules types;
    private final PatternRules patterns;

    ExprRules(ParsingContext ctx) {
        this.ctx = ctx;
        this.types = new TypeRules(ctx, this);
        this.patterns = new PatternRules(ctx, this, types);
    }

    /**
     * The whole input as one expression.
     */
    Expr parseComplete() {
        var expr = parseExpr(true);
        if (!ctx.isAtEnd()) {
            throw ctx.unexpected("end of input");
        }
        return expr;
    }

    Expr parseExpr(boolean allowStruct) {
        int start = ctx.mark();
        var lhs = parseOperand(allowStruct);
        return parseBinary(start, lhs, Precedence.ASSIGN, allowStruct);
    }

    // === Binary operators ===

    /**
     * Folds operators into {@code lhs} left to right. Every fold wraps the tree built so far, so each
     * one counts a nesting level until the chain ends.
     */
    private Expr parseBinary(int start, Expr lhs, Precedence min, boolean allowStruct) {
        int depth = ctx.depth();
        try {
            var result = lhs;
            while (true) {
                var precedence = peekPrecedence();
                if (precedence == null || precedence.compareTo(min) < 0) {
                    return result;
                }
                ctx.enter();
                switch (precedence) {
                    case ASSIGN -> result = parseAssign(start, result, allowStruct);
                    case RANGE -> result = parseRangeTail(start, result, allowStruct);
                    case CAST -> {
                        ctx.advance();
                        var ty = types.parseTypeNoBounds();
                        result = new Expr.Cast(ctx.since(start), List.of(), result, ty);
                    }
                    default -> {
                        var operator = ctx.advance();
                        int rhsStart = ctx.mark();
                        var rhs = parseBinary(rhsStart, parseUnary(allowStruct), precedence.next(), allowStruct);
                        result = new Expr.Binary(ctx.since(start), List.of(), result, binaryOperator(operator), rhs);
                        if (precedence == Precedence.COMPARE && peekPrecedence() == Precedence.COMPARE) {
                            throw ctx.invalid("comparison operators cannot be chained", PARENTHESIZE, ctx.peek().span());
                        }
                    }
                }
            }
        } finally {
            ctx.unwind(depth);
        }
    }

    private Expr parseAssign(int start, Expr lhs, boolean allowStruct) {
        var operator = ctx.advance();
        int rhsStart = ctx.mark();
        var rhs = parseBinary(rhsStart, parseOperand(allowStruct), Precedence.ASSIGN, allowStruct);
        if (operator.text().equals("=")) {
            return new Expr.Assign(ctx.since(start), List.of(), lhs, rhs);
        }
        return new Expr.Binary(ctx.since(start), List.of(), lhs, binaryOperator(operator), rhs);
    }

    private Expr parseRangeTail(int start, Expr lhs, boolean allowStruct) {
        if (lhs instanceof Expr.Range) {
            throw ctx.invalid("range operators cannot be chained", PARENTHESIZE, ctx.peek().span());
        }
        var limits = rangeLimits(ctx.advance());
        var end = parseRangeEnd(limits, allowStruct);
        return new Expr.Range(ctx.since(start), List.of(), Optional.of(lhs), limits, end);
    }

    private Optional<Expr> parseRangeEnd(RangeLimits limits, boolean allowStruct) {
        if (!canBeginExpr(allowStruct)) {
            if (limits == RangeLimits.CLOSED) {
                throw ctx.invalid("inclusive range with no end", ctx.peek().span());
            }
            return Optional.empty();
        }
        int endStart = ctx.mark();
        return Optional.of(parseBinary(endStart, parseUnary(allowStruct), Precedence.OR, allowStruct));
    }

    private Precedence peekPrecedence() {
        var token = ctx.peek();
        if (token instanceof Token.Ident ident && ident.is("as")) {
            return Precedence.CAST;
        }
        if (token instanceof Token.Punct punct) {
            return PRECEDENCE.get(punct.text());
        }
        return null;
    }

    private static BinOp binaryOperator(Token token) {
        return BINARY_OPERATORS.get(token.text()).apply(token);
    }

    private static RangeLimits rangeLimits(Token token) {
        return token.text().equals("..=")
               ? RangeLimits.CLOSED
               : RangeLimits.HALF_OPEN;
    }

    // === Prefix operators ===

    /**
     * Unary operand, or a range with no start.
     */
    private Expr parseOperand(boolean allowStruct) {
        if (ctx.isPunct("..") || ctx.isPunct("..=")) {
            int start = ctx.mark();
            var limits = rangeLimits(ctx.advance());
            var end = parseRangeEnd(limits, allowStruct);
            return new Expr.Range(ctx.since(start), List.of(), Optional.empty(), limits, end);
        }
        return parseUnary(allowStruct);
    }

    private Expr parseUnary(boolean allowStruct) {
        ctx.enter();
        try {
            int start = ctx.mark();
            var attrs = parseOuterAttrs();
            if (ctx.isPunct("-") || ctx.isPunct("!") || ctx.isPunct("*")) {
                var token = ctx.advance();
                var operand = parseUnary(allowStruct);
                return new Expr.Unary(ctx.since(start), attrs, unaryOperator(token), operand);
            }
            if (ctx.isPunct("&&")) {
                ctx.splitPunct("&");
            }
            if (ctx.eatPunct("&")) {
                return parseReference(start, attrs, allowStruct);
            }
            if (ctx.eatKeyword("box")) {
                parseUnary(allowStruct);
                return new Expr.Verbatim(ctx.since(start));
            }
            var expr = parsePostfix(allowStruct);
            return attrs.isEmpty()
                   ? expr
                   : Attributes.attach(expr, attrs, ctx.since(start));
        } finally {
            ctx.exit();
        }
    }

    private Expr parseReference(int start, List<Attribute> attrs, boolean allowStruct) {
        if (ctx.isKeyword("raw") && (ctx.isKeyword(1, "const") || ctx.isKeyword(1, "mut"))) {
            ctx.advance();
            var mutability = ctx.advance().text().equals("mut");
            var operand = parseUnary(allowStruct);
            return new Expr.RawAddr(ctx.since(start), attrs, mutability, operand);
        }
        var mutability = ctx.eatKeyword("mut");
        var operand = parseUnary(allowStruct);
        return new Expr.Reference(ctx.since(start), attrs, mutability, operand);
    }

    private static UnOp unaryOperator(Token token) {
        switch (token.text()) {
            case "-":
                return new UnOp.Neg(token);
            case "!":
                return new UnOp.Not(token);
            default:
                return new UnOp.Deref(token);
        }
    }

    // === Postfix ===

    private Expr parsePostfix(boolean allowStruct) {
        int start = ctx.mark();
        var expr = parsePrimary(allowStruct);
        return parseTrailers(start, expr);
    }

    /**
     * Applies postfix operators to {@code base}; like binary folds, each one counts a nesting level.
     */
    private Expr parseTrailers(int start, Expr base) {
        int depth = ctx.depth();
        try {
            var expr = base;
            while (isTrailerStart()) {
                ctx.enter();
                if (ctx.eatPunct("?")) {
                    expr = new Expr.Try(ctx.since(start), List.of(), expr);
                } else if (ctx.eatPunct(".")) {
                    expr = parseDotTrailer(start, expr);
                } else if (ctx.isOpen(Token.Delimiter.PAREN)) {
                    var args = parseCallArgs();
                    expr = new Expr.Call(ctx.since(start), List.of(), expr, args);
                } else {
                    ctx.advance();
                    var index = parseExpr(true);
                    ctx.expectClose(Token.Delimiter.BRACKET);
                    expr = new Expr.Index(ctx.since(start), List.of(), expr, index);
                }
            }
            return expr;
        } finally {
            ctx.unwind(depth);
        }
    }

    private boolean isTrailerStart() {
        return ctx.isPunct("?")
               || ctx.isPunct(".")
               || ctx.isOpen(Token.Delimiter.PAREN)
               || ctx.isOpen(Token.Delimiter.BRACKET);
    }

    private Expr parseDotTrailer(int start, Expr base) {
        var token = ctx.peek();
        if (token instanceof Token.Ident ident && ident.is("await")) {
            ctx.advance();
            return new Expr.Await(ctx.since(start), List.of(), base);
        }
        if (token instanceof Token.Ident ident && !ident.isReserved()) {
            ctx.advance();
            Optional<TokenStream> turbofish = Optional.empty();
            if (ctx.isPunct("::")) {
                int turbofishStart = ctx.mark();
                ctx.advance();
                types.parseGenericArgs();
                turbofish = Optional.of(ctx.since(turbofishStart));
            }
            if (ctx.isOpen(Token.Delimiter.PAREN)) {
                var args = parseCallArgs();
                return new Expr.MethodCall(ctx.since(start), List.of(), base, ident.text(), turbofish, args);
            }
            if (turbofish.isPresent()) {
                throw ctx.unexpected("'('");
            }
            return new Expr.Field(ctx.since(start), List.of(), base, new Member.Named(ident.text()));
        }
        if (token instanceof Token.Literal literal && literal.suffix().isEmpty()) {
            if (literal.kind() == Token.LiteralKind.INT) {
                ctx.advance();
                return new Expr.Field(ctx.since(start), List.of(), base, tupleIndex(literal.text()));
            }
            if (literal.kind() == Token.LiteralKind.FLOAT && literal.text().matches("\\d+\\.\\d+")) {
                // t.0.1 lexes as t . 0.1
                ctx.advance();
                var parts = literal.text().split("\\.");
                var inner = new Expr.Field(ctx.since(start), List.of(), base, tupleIndex(parts[0]));
                ctx.enter();
                return new Expr.Field(ctx.since(start), List.of(), inner, tupleIndex(parts[1]));
            }
        }
        throw ctx.unexpected("field name or method");
    }

    private Member tupleIndex(String digits) {
        if (digits.matches("\\d{1,10}")) {
            var index = Long.parseLong(digits);
            if (index <= MAX_TUPLE_INDEX) {
                return new Member.Unnamed(index);
            }
        }
        throw ctx.invalid("tuple index out of range: " + digits, ctx.peek().span());
    }

    private List<Expr> parseCallArgs() {
        ctx.expectOpen(Token.Delimiter.PAREN);
        var args = parseCommaSeparated(Token.Delimiter.PAREN);
        ctx.expectClose(Token.Delimiter.PAREN);
        return args;
    }

    private List<Expr> parseCommaSeparated(Token.Delimiter delimiter) {
        var elems = new ArrayList<Expr>();
        while (!ctx.isClose(delimiter)) {
            elems.add(parseExpr(true));
            if (!ctx.isClose(delimiter)) {
                ctx.expectPunct(",");
            }
        }
        return elems;
    }

    // === Primary ===

    private Expr parsePrimary(boolean allowStruct) {
        var token = ctx.peek();
        int start = ctx.mark();

        if (token instanceof Token.Literal literal) {
            ctx.advance();
            return new Expr.Lit(ctx.since(start), List.of(), literalOf(literal));
        }
        if (token instanceof Token.Lifetime && ctx.isPunct(1, ":")) {
            return parseLabeled();
        }
        if (ctx.isOpen(Token.Delimiter.PAREN)) {
            return parseParenOrTuple();
        }
        if (ctx.isOpen(Token.Delimiter.BRACKET)) {
            return parseArrayOrRepeat();
        }
        if (ctx.isOpen(Token.Delimiter.BRACE)) {
            var block = parseCodeBlock();
            return new Expr.Block(ctx.since(start), List.of(), Optional.empty(), block);
        }
        if (ctx.isPunct("|") || ctx.isPunct("||")) {
            return parseClosure(allowStruct);
        }
        if (ctx.isPunct("<") || ctx.isPunct("<<") || ctx.isPunct("::")) {
            return parsePathExpr(allowStruct);
        }
        if (token instanceof Token.Ident ident) {
            if (!ident.raw()) {
                var keywordExpr = parseKeywordExpr(ident, allowStruct);
                if (keywordExpr != null) {
                    return keywordExpr;
                }
            }
            if (ident.isReserved()) {
                throw ctx.unexpected("expression");
            }
            return parsePathExpr(allowStruct);
        }
        throw ctx.unexpected("expression");
    }

    /**
     * Expression introduced by a keyword, or null when the identifier does not start one.
     */
    private Expr parseKeywordExpr(Token.Ident ident, boolean allowStruct) {
        int start = ctx.mark();
        switch (ident.text()) {
            case "true":
            case "false":
                ctx.advance();
                return new Expr.Lit(ctx.since(start), List.of(), new Literal.Bool(ident, ident.text().equals("true")));
            case "_":
                ctx.advance();
                return new Expr.Infer(ctx.since(start), List.of());
            case "if":
                return parseIf();
            case "match":
                return parseMatch();
            case "loop":
                return parseLoop(start, Optional.empty());
            case "while":
                return parseWhile(start, Optional.empty());
            case "for":
                return ctx.isPunct(1, "<")
                       ? parseClosure(allowStruct)
                       : parseFor(start, Optional.empty());
            case "unsafe":
                ctx.advance();
                return new Expr.Unsafe(ctx.since(start), List.of(), finishBlock());
            case "async":
                return isAsyncBlock()
                       ? parseAsyncBlock()
                       : parseClosure(allowStruct);
            case "const":
                if (ctx.isOpen(1, Token.Delimiter.BRACE)) {
                    ctx.advance();
                    return new Expr.Const(ctx.since(start), List.of(), finishBlock());
                }
                return parseClosure(allowStruct);
            case "static":
            case "move":
                return parseClosure(allowStruct);
            case "try":
                if (ctx.isOpen(1, Token.Delimiter.BRACE)) {
                    ctx.advance();
                    return new Expr.TryBlock(ctx.since(start), List.of(), finishBlock());
                }
                return null;
            case "return":
                ctx.advance();
                return new Expr.Return(ctx.since(start), List.of(), parseOptionalValue(allowStruct));
            case "yield":
                ctx.advance();
                return new Expr.Yield(ctx.since(start), List.of(), parseOptionalValue(allowStruct));
            case "break": {
                ctx.advance();
                var label = parseOptionalLabel();
                var value = parseOptionalValue(allowStruct);
                return new Expr.Break(ctx.since(start), List.of(), label, value);
            }
            case "continue": {
                ctx.advance();
                var label = parseOptionalLabel();
                return new Expr.Continue(ctx.since(start), List.of(), label);
            }
            case "let":
                return parseLet(allowStruct);
            default:
                return null;
        }
    }

    private CodeBlock finishBlock() {
        if (!ctx.isOpen(Token.Delimiter.BRACE)) {
            throw ctx.unexpected("'{'");
        }
        return parseCodeBlock();
    }

    private Optional<Expr> parseOptionalValue(boolean allowStruct) {
        return canBeginExpr(allowStruct)
               ? Optional.of(parseExpr(allowStruct))
               : Optional.empty();
    }

    private Optional<Label> parseOptionalLabel() {
        if (ctx.peek() instanceof Token.Lifetime lifetime) {
            ctx.advance();
            return Optional.of(labelOf(lifetime));
        }
        return Optional.empty();
    }

    private static Label labelOf(Token.Lifetime lifetime) {
        return new Label(new TokenStream(List.of(lifetime)), lifetime.name());
    }

    private boolean canBeginExpr(boolean allowStruct) {
        var token = ctx.peek();
        if (token instanceof Token.Literal || token instanceof Token.Lifetime) {
            return true;
        }
        if (token instanceof Token.Open open) {
            return open.delimiter() != Token.Delimiter.BRACE || allowStruct;
        }
        if (token instanceof Token.Ident ident) {
            return !ident.isReserved() || EXPR_KEYWORDS.contains(ident.text());
        }
        if (token instanceof Token.Punct punct) {
            return EXPR_PUNCT.contains(punct.text());
        }
        return false;
    }

    static Literal literalOf(Token.Literal token) {
        switch (token.kind()) {
            case STR:
                return new Literal.Str(token);
            case BYTE_STR:
                return new Literal.ByteStr(token);
            case C_STR:
                return new Literal.CStr(token);
            case BYTE:
                return new Literal.Byte(token);
            case CHAR:
                return new Literal.Char(token);
            case INT:
                return new Literal.Int(token);
            case FLOAT:
                return new Literal.Float(token);
            default:
                throw new IllegalStateException("Unknown literal kind: " + token.kind());
        }
    }

    // === Aggregates ===

    private Expr parseParenOrTuple() {
        int start = ctx.mark();
        ctx.expectOpen(Token.Delimiter.PAREN);
        if (ctx.eatClose(Token.Delimiter.PAREN)) {
            return new Expr.Tuple(ctx.since(start), List.of(), List.of());
        }
        var first = parseExpr(true);
        if (ctx.eatClose(Token.Delimiter.PAREN)) {
            return new Expr.Paren(ctx.since(start), List.of(), first);
        }
        var elems = new ArrayList<Expr>();
        elems.add(first);
        while (!ctx.isClose(Token.Delimiter.PAREN)) {
            ctx.expectPunct(",");
            if (ctx.isClose(Token.Delimiter.PAREN)) {
                break;
            }
            elems.add(parseExpr(true));
        }
        ctx.expectClose(Token.Delimiter.PAREN);
        return new Expr.Tuple(ctx.since(start), List.of(), elems);
    }

    private Expr parseArrayOrRepeat() {
        int start = ctx.mark();
        ctx.expectOpen(Token.Delimiter.BRACKET);
        if (ctx.eatClose(Token.Delimiter.BRACKET)) {
            return new Expr.Array(ctx.since(start), List.of(), List.of());
        }
        var first = parseExpr(true);
        if (ctx.eatPunct(";")) {
            var len = parseExpr(true);
            ctx.expectClose(Token.Delimiter.BRACKET);
            return new Expr.Repeat(ctx.since(start), List.of(), first, len);
        }
        var elems = new ArrayList<Expr>();
        elems.add(first);
        if (!ctx.isClose(Token.Delimiter.BRACKET)) {
            ctx.expectPunct(",");
            elems.addAll(parseCommaSeparated(Token.Delimiter.BRACKET));
        }
        ctx.expectClose(Token.Delimiter.BRACKET);
        return new Expr.Array(ctx.since(start), List.of(), elems);
    }

    // === Paths, macros and struct literals ===

    private Expr parsePathExpr(boolean allowStruct) {
        int start = ctx.mark();
        var parts = types.parseExprPath();
        if (parts.qself().isEmpty() && ctx.isPunct("!") && ctx.peek(1) instanceof Token.Open) {
            ctx.advance();
            ctx.skipDelimited();
            return new Expr.Macro(ctx.since(start), List.of(), ctx.since(start));
        }
        if (allowStruct && ctx.isOpen(Token.Delimiter.BRACE)) {
            return parseStructLiteral(start, parts);
        }
        return new Expr.Path(ctx.since(start), List.of(), parts.qself(), parts.path());
    }

    private Expr parseStructLiteral(int start, TypeRules.PathParts parts) {
        ctx.expectOpen(Token.Delimiter.BRACE);
        var fields = new ArrayList<FieldValue>();
        var dot2 = false;
        Optional<Expr> rest = Optional.empty();
        while (!ctx.isClose(Token.Delimiter.BRACE)) {
            if (ctx.eatPunct("..")) {
                dot2 = true;
                if (!ctx.isClose(Token.Delimiter.BRACE)) {
                    rest = Optional.of(parseExpr(true));
                }
                break;
            }
            fields.add(parseFieldValue());
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        ctx.expectClose(Token.Delimiter.BRACE);
        return new Expr.Struct(ctx.since(start), List.of(), parts.qself(), parts.path(), fields, dot2, rest);
    }

    private FieldValue parseFieldValue() {
        int start = ctx.mark();
        var attrs = parseOuterAttrs();
        var token = ctx.peek();
        if (token instanceof Token.Literal literal && literal.kind() == Token.LiteralKind.INT) {
            ctx.advance();
            var member = tupleIndex(literal.text());
            ctx.expectPunct(":");
            return new FieldValue(ctx.since(start), attrs, member, parseExpr(true));
        }
        var name = ctx.expectName("field name");
        var member = new Member.Named(name.text());
        if (ctx.eatPunct(":")) {
            return new FieldValue(ctx.since(start), attrs, member, parseExpr(true));
        }
        var shorthand = new TokenStream(List.of(name));
        var value = new Expr.Path(shorthand, List.of(), Optional.empty(), shorthand);
        return new FieldValue(ctx.since(start), attrs, member, value);
    }

    // === Control flow ===

    private Expr parseLabeled() {
        int start = ctx.mark();
        var label = Optional.of(labelOf((Token.Lifetime) ctx.advance()));
        ctx.expectPunct(":");
        if (ctx.isKeyword("loop")) {
            return parseLoop(start, label);
        }
        if (ctx.isKeyword("while")) {
            return parseWhile(start, label);
        }
        if (ctx.isKeyword("for")) {
            return parseFor(start, label);
        }
        if (ctx.isOpen(Token.Delimiter.BRACE)) {
            var block = parseCodeBlock();
            return new Expr.Block(ctx.since(start), List.of(), label, block);
        }
        throw ctx.unexpected("'loop', 'while', 'for' or block after label");
    }

    private Expr parseIf() {
        int start = ctx.mark();
        ctx.expectKeyword("if");
        var cond = parseExpr(false);
        var thenBranch = finishBlock();
        Optional<Expr> elseBranch = Optional.empty();
        if (ctx.eatKeyword("else")) {
            if (ctx.isKeyword("if")) {
                ctx.enter();
                try {
                    elseBranch = Optional.of(parseIf());
                } finally {
                    ctx.exit();
                }
            } else if (ctx.isOpen(Token.Delimiter.BRACE)) {
                int elseStart = ctx.mark();
                var block = parseCodeBlock();
                elseBranch = Optional.of(new Expr.Block(ctx.since(elseStart), List.of(), Optional.empty(), block));
            } else {
                throw ctx.unexpected("'{' or 'if'");
            }
        }
        return new Expr.If(ctx.since(start), List.of(), cond, thenBranch, elseBranch);
    }

    private Expr parseMatch() {
        int start = ctx.mark();
        ctx.expectKeyword("match");
        var scrutinee = parseExpr(false);
        ctx.expectOpen(Token.Delimiter.BRACE);
        var innerAttrs = parseInnerAttrs();
        var arms = new ArrayList<Arm>();
        while (!ctx.isClose(Token.Delimiter.BRACE)) {
            int armStart = ctx.mark();
            var attrs = parseOuterAttrs();
            var pat = patterns.parseTop();
            Optional<Expr> guard = ctx.eatKeyword("if")
                                   ? Optional.of(parseExpr(true))
                                   : Optional.empty();
            ctx.expectPunct("=>");
            var body = parseExprEarly();
            var comma = ctx.eatPunct(",");
            arms.add(new Arm(ctx.since(armStart), attrs, pat, guard, body));
            if (!comma && !isBlockLike(body) && !ctx.isClose(Token.Delimiter.BRACE)) {
                throw ctx.unexpected("',' or '}'");
            }
        }
        ctx.expectClose(Token.Delimiter.BRACE);
        return new Expr.Match(ctx.since(start), innerAttrs, scrutinee, arms);
    }

    private Expr parseLoop(int start, Optional<Label> label) {
        ctx.expectKeyword("loop");
        var body = finishBlock();
        return new Expr.Loop(ctx.since(start), List.of(), label, body);
    }

    private Expr parseWhile(int start, Optional<Label> label) {
        ctx.expectKeyword("while");
        var cond = parseExpr(false);
        var body = finishBlock();
        return new Expr.While(ctx.since(start), List.of(), label, cond, body);
    }

    private Expr parseFor(int start, Optional<Label> label) {
        ctx.expectKeyword("for");
        var pat = patterns.parseTop();
        ctx.expectKeyword("in");
        var iterable = parseExpr(false);
        var body = finishBlock();
        return new Expr.ForLoop(ctx.since(start), List.of(), label, pat, iterable, body);
    }

    /**
     * {@code let pat = expr} in condition position. The scrutinee stops before {@code &&} and {@code ||}.
     */
    private Expr parseLet(boolean allowStruct) {
        int start = ctx.mark();
        ctx.expectKeyword("let");
        var pat = patterns.parseTop();
        ctx.expectPunct("=");
        int exprStart = ctx.mark();
        var expr = parseBinary(exprStart, parseUnary(allowStruct), Precedence.COMPARE, allowStruct);
        return new Expr.Let(ctx.since(start), List.of(), pat, expr);
    }

    // === Blocks and closures ===

    private boolean isAsyncBlock() {
        return ctx.isOpen(1, Token.Delimiter.BRACE)
               || (ctx.isKeyword(1, "move") && ctx.isOpen(2, Token.Delimiter.BRACE));
    }

    private Expr parseAsyncBlock() {
        int start = ctx.mark();
        ctx.expectKeyword("async");
        var capture = ctx.eatKeyword("move");
        var block = finishBlock();
        return new Expr.Async(ctx.since(start), List.of(), capture, block);
    }

    private Expr parseClosure(boolean allowStruct) {
        int start = ctx.mark();
        Optional<TokenStream> lifetimes = Optional.empty();
        if (ctx.isKeyword("for")) {
            int lifetimesStart = ctx.mark();
            types.parseForLifetimes();
            lifetimes = Optional.of(ctx.since(lifetimesStart));
        }
        var constness = ctx.eatKeyword("const");
        var movability = ctx.eatKeyword("static");
        var asyncness = ctx.eatKeyword("async");
        var capture = ctx.eatKeyword("move");
        var inputs = parseClosureInputs();

        var output = TokenStream.EMPTY;
        Expr body;
        if (ctx.isPunct("->")) {
            int outputStart = ctx.mark();
            ctx.advance();
            types.parseTypeNoBounds();
            output = ctx.since(outputStart);
            int bodyStart = ctx.mark();
            var block = finishBlock();
            body = new Expr.Block(ctx.since(bodyStart), List.of(), Optional.empty(), block);
        } else {
            body = parseExpr(allowStruct);
        }
        return new Expr.Closure(ctx.since(start), List.of(), lifetimes, constness, movability,
                                asyncness, capture, inputs, output, body);
    }

    private List<Pat> parseClosureInputs() {
        var inputs = new ArrayList<Pat>();
        if (ctx.eatPunct("||")) {
            return inputs;
        }
        ctx.expectPunct("|");
        while (!ctx.isPunct("|")) {
            int inputStart = ctx.mark();
            parseOuterAttrs();
            patterns.parseSingle();
            if (ctx.eatPunct(":")) {
                types.parseType();
            }
            inputs.add(new Pat(ctx.since(inputStart)));
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        ctx.expectPunct("|");
        return inputs;
    }

    /**
     * Braced block. Its nesting level is counted by the expression, statement, pattern or type
     * holding it.
     */
    CodeBlock parseCodeBlock() {
        int start = ctx.mark();
        ctx.expectOpen(Token.Delimiter.BRACE);
        var innerAttrs = parseInnerAttrs();
        var stmts = new ArrayList<Stmt>();
        while (!ctx.isClose(Token.Delimiter.BRACE)) {
            stmts.add(parseStmt());
        }
        ctx.expectClose(Token.Delimiter.BRACE);
        return new CodeBlock(ctx.since(start), innerAttrs, stmts);
    }

    // === Statements ===

    private Stmt parseStmt() {
        int start = ctx.mark();
        if (ctx.eatPunct(";")) {
            return new Stmt.Empty(ctx.since(start));
        }
        var attrs = parseOuterAttrs();
        if (ctx.isKeyword("let")) {
            return parseLocal(start, attrs);
        }
        if (isItemStart()) {
            skipItem();
            return new Stmt.Item(ctx.since(start));
        }
        ctx.reset(start);
        var expr = parseExprEarly();
        if (ctx.eatPunct(";")) {
            return new Stmt.Expression(ctx.since(start), expr, true);
        }
        if (ctx.isClose(Token.Delimiter.BRACE) || isBlockLike(expr)) {
            return new Stmt.Expression(ctx.since(start), expr, false);
        }
        throw ctx.unexpected("';' or '}'");
    }

    private Stmt parseLocal(int start, List<Attribute> attrs) {
        ctx.enter();
        try {
            ctx.expectKeyword("let");
            var pat = patterns.parseTop();
            Optional<Type> ty = ctx.eatPunct(":")
                                ? Optional.of(types.parseType())
                                : Optional.empty();
            Optional<Expr> init = Optional.empty();
            Optional<CodeBlock> diverge = Optional.empty();
            if (ctx.eatPunct("=")) {
                init = Optional.of(parseExpr(true));
                if (ctx.eatKeyword("else")) {
                    diverge = Optional.of(finishBlock());
                }
            }
            ctx.expectPunct(";");
            return new Stmt.Local(ctx.since(start), attrs, pat, ty, init, diverge);
        } finally {
            ctx.exit();
        }
    }

    /**
     * Expression in statement or match-arm position. A block-like expression ends the statement
     * unless a method call or {@code ?} follows it.
     */
    private Expr parseExprEarly() {
        int start = ctx.mark();
        var attrs = parseOuterAttrs();
        if (!startsBlockLike()) {
            ctx.reset(start);
            return parseExpr(true);
        }
        ctx.enter();
        try {
            var expr = parsePrimary(true);
            if (!attrs.isEmpty()) {
                expr = Attributes.attach(expr, attrs, ctx.since(start));
            }
            if (ctx.isPunct(".") || ctx.isPunct("?")) {
                expr = parseTrailers(start, expr);
                return parseBinary(start, expr, Precedence.ASSIGN, true);
            }
            return expr;
        } finally {
            ctx.exit();
        }
    }

    private boolean startsBlockLike() {
        var token = ctx.peek();
        if (ctx.isOpen(Token.Delimiter.BRACE)) {
            return true;
        }
        if (token instanceof Token.Lifetime) {
            return ctx.isPunct(1, ":");
        }
        if (!(token instanceof Token.Ident ident) || ident.raw()) {
            return false;
        }
        switch (ident.text()) {
            case "if":
            case "match":
            case "loop":
            case "while":
                return true;
            case "for":
                return !ctx.isPunct(1, "<");
            case "unsafe":
            case "const":
            case "try":
                return ctx.isOpen(1, Token.Delimiter.BRACE);
            case "async":
                return isAsyncBlock();
            default:
                return false;
        }
    }

    private static boolean isBlockLike(Expr expr) {
        if (expr instanceof Expr.Macro macro) {
            var tokens = macro.mac().tokens();
            return tokens.get(tokens.size() - 1) instanceof Token.Close close
                   && close.delimiter() == Token.Delimiter.BRACE;
        }
        return expr instanceof Expr.Block
               || expr instanceof Expr.If
               || expr instanceof Expr.Match
               || expr instanceof Expr.Loop
               || expr instanceof Expr.While
               || expr instanceof Expr.ForLoop
               || expr instanceof Expr.Unsafe
               || expr instanceof Expr.Async
               || expr instanceof Expr.Const
               || expr instanceof Expr.TryBlock;
    }

    private boolean isItemStart() {
        var token = ctx.peek();
        if (!(token instanceof Token.Ident ident) || ident.raw()) {
            return false;
        }
        if (ITEM_KEYWORDS.contains(ident.text())) {
            return true;
        }
        switch (ident.text()) {
            case "macro_rules":
                return ctx.isPunct(1, "!");
            case "union":
                return ctx.peek(1) instanceof Token.Ident;
            case "static":
                return ctx.peek(1) instanceof Token.Ident next && !next.is("move") && !next.is("async");
            case "const":
                return ctx.peek(1) instanceof Token.Ident next
                       && !next.is("move") && !next.is("async") && !next.is("static");
            case "unsafe":
                return ctx.isKeyword(1, "fn") || ctx.isKeyword(1, "impl")
                       || ctx.isKeyword(1, "trait") || ctx.isKeyword(1, "extern");
            case "async":
                return ctx.isKeyword(1, "fn") || ctx.isKeyword(1, "unsafe");
            default:
                return false;
        }
    }

    /**
     * Consume a nested item up to its closing brace or semicolon.
     */
    private void skipItem() {
        var braceEnds = !(ctx.isKeyword("use") || ctx.isKeyword("type")
                          || ctx.isKeyword("static")
                          || (ctx.isKeyword("const") && !ctx.isKeyword(1, "fn")));
        var seenEquals = false;
        while (true) {
            if (ctx.isAtEnd() || ctx.isClose()) {
                throw ctx.unexpected("';'");
            }
            if (ctx.peek() instanceof Token.Open open) {
                ctx.skipDelimited();
                if (open.delimiter() == Token.Delimiter.BRACE && braceEnds && !seenEquals) {
                    return;
                }
                continue;
            }
            var token = ctx.advance();
            if (token.text().equals(";")) {
                return;
            }
            if (token.text().equals("=")) {
                seenEquals = true;
            }
        }
    }

    // === Attributes ===

    List<Attribute> parseOuterAttrs() {
        var attrs = new ArrayList<Attribute>();
        while (ctx.isPunct("#") && ctx.isOpen(1, Token.Delimiter.BRACKET)) {
            int start = ctx.mark();
            ctx.advance();
            ctx.skipDelimited();
            attrs.add(new Attribute(ctx.since(start), false));
        }
        return attrs;
    }

    private List<Attribute> parseInnerAttrs() {
        var attrs = new ArrayList<Attribute>();
        while (ctx.isPunct("#") && ctx.isPunct(1, "!") && ctx.isOpen(2, Token.Delimiter.BRACKET)) {
            int start = ctx.mark();
            ctx.advance();
            ctx.advance();
            ctx.skipDelimited();
            attrs.add(new Attribute(ctx.since(start), true));
        }
        return attrs;
    }
}
