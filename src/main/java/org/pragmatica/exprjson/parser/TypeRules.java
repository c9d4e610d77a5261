package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.Type;

import java.util.Optional;

/**
 * Grammar rules for types, paths and generic arguments. Types are validated and kept as tokens.
 */
final class TypeRules {

    /**
     * Where a path appears. Expression paths need {@code ::} before generic arguments.
     */
    enum PathStyle {
        EXPR,
        TYPE
    }

    /**
     * A parsed path: optional qualified self type plus the path tokens after it.
     */
    record PathParts(Optional<Type> qself, TokenStream path) {}

    private final ParsingContext ctx;
    private final ExprRules exprs;

    TypeRules(ParsingContext ctx, ExprRules exprs) {
        this.ctx = ctx;
        this.exprs = exprs;
    }

    Type parseType() {
        return parseType(true);
    }

    /**
     * Type without a trailing {@code + Bound} list, as used after {@code as}, {@code &} and {@code ->}.
     */
    Type parseTypeNoBounds() {
        return parseType(false);
    }

    private Type parseType(boolean allowPlus) {
        ctx.enter();
        try {
            int start = ctx.mark();
            parseTypeInner(allowPlus);
            return new Type(ctx.since(start));
        } finally {
            ctx.exit();
        }
    }

    private void parseTypeInner(boolean allowPlus) {
        var token = ctx.peek();

        if (ctx.isOpen(Token.Delimiter.PAREN)) {
            ctx.advance();
            while (!ctx.isClose(Token.Delimiter.PAREN)) {
                parseType(true);
                if (!ctx.eatPunct(",")) {
                    break;
                }
            }
            ctx.expectClose(Token.Delimiter.PAREN);
            return;
        }
        if (ctx.isOpen(Token.Delimiter.BRACKET)) {
            ctx.advance();
            parseType(true);
            if (ctx.eatPunct(";")) {
                exprs.parseExpr(true);
            }
            ctx.expectClose(Token.Delimiter.BRACKET);
            return;
        }
        if (ctx.isPunct("!") || ctx.isKeyword("_")) {
            ctx.advance();
            return;
        }
        if (ctx.isPunct("&&")) {
            ctx.splitPunct("&");
        }
        if (ctx.eatPunct("&")) {
            if (ctx.peek() instanceof Token.Lifetime) {
                ctx.advance();
            }
            ctx.eatKeyword("mut");
            parseType(false);
            return;
        }
        if (ctx.eatPunct("*")) {
            if (!ctx.eatKeyword("const")) {
                ctx.expectKeyword("mut");
            }
            parseType(false);
            return;
        }
        if (ctx.isKeyword("impl") || ctx.isKeyword("dyn")) {
            ctx.advance();
            parseBounds(allowPlus);
            return;
        }
        if (ctx.isKeyword("for")) {
            parseForLifetimes();
            if (isFnPointerStart()) {
                parseFnPointer();
            } else {
                parsePathSegments(PathStyle.TYPE);
                parseMoreBounds(allowPlus);
            }
            return;
        }
        if (isFnPointerStart()) {
            parseFnPointer();
            return;
        }
        if (ctx.isPunct("<") || ctx.isPunct("<<")) {
            parseQualified(PathStyle.TYPE);
            return;
        }
        if (ctx.isPunct("::") || isSegmentStart(token)) {
            parsePathSegments(PathStyle.TYPE);
            if (ctx.isPunct("!") && ctx.peek(1) instanceof Token.Open) {
                ctx.advance();
                ctx.skipDelimited();
                return;
            }
            parseMoreBounds(allowPlus);
            return;
        }
        throw ctx.unexpected("type");
    }

    private boolean isFnPointerStart() {
        return ctx.isKeyword("fn") || ctx.isKeyword("unsafe") || ctx.isKeyword("extern");
    }

    private void parseFnPointer() {
        ctx.eatKeyword("unsafe");
        if (ctx.eatKeyword("extern") && ctx.peek() instanceof Token.Literal) {
            ctx.advance();
        }
        ctx.expectKeyword("fn");
        ctx.expectOpen(Token.Delimiter.PAREN);
        while (!ctx.isClose(Token.Delimiter.PAREN)) {
            exprs.parseOuterAttrs();
            if (ctx.eatPunct("...")) {
                break;
            }
            if (ctx.peek() instanceof Token.Ident && ctx.isPunct(1, ":")) {
                ctx.advance();
                ctx.advance();
            }
            parseType(true);
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        ctx.expectClose(Token.Delimiter.PAREN);
        parseReturnType();
    }

    /**
     * Optional {@code -> Type}.
     */
    void parseReturnType() {
        if (ctx.eatPunct("->")) {
            parseType(false);
        }
    }

    private void parseMoreBounds(boolean allowPlus) {
        while (allowPlus && ctx.isPunct("+")) {
            ctx.advance();
            if (!isBoundStart()) {
                return;
            }
            parseBound();
        }
    }

    private void parseBounds(boolean allowPlus) {
        parseBound();
        parseMoreBounds(allowPlus);
    }

    private boolean isBoundStart() {
        var token = ctx.peek();
        return token instanceof Token.Lifetime
               || ctx.isPunct("?")
               || ctx.isPunct("::")
               || ctx.isPunct("~")
               || ctx.isOpen(Token.Delimiter.PAREN)
               || ctx.isKeyword("for")
               || ctx.isKeyword("use")
               || ctx.isKeyword("const")
               || isSegmentStart(token);
    }

    private void parseBound() {
        if (ctx.peek() instanceof Token.Lifetime) {
            ctx.advance();
            return;
        }
        if (ctx.isOpen(Token.Delimiter.PAREN)) {
            ctx.advance();
            parseBound();
            ctx.expectClose(Token.Delimiter.PAREN);
            return;
        }
        if (ctx.eatKeyword("use")) {
            parseGenericArgs();
            return;
        }
        ctx.eatPunct("~");
        ctx.eatKeyword("const");
        ctx.eatPunct("?");
        if (ctx.isKeyword("for")) {
            parseForLifetimes();
        }
        parsePathSegments(PathStyle.TYPE);
    }

    /**
     * {@code for<'a, 'b>} binder.
     */
    void parseForLifetimes() {
        ctx.expectKeyword("for");
        parseGenericParams();
    }

    private void parseGenericParams() {
        ctx.expectPunct("<");
        while (!ctx.startsWithPunct(">")) {
            if (ctx.peek() instanceof Token.Lifetime) {
                ctx.advance();
                if (ctx.eatPunct(":")) {
                    while (ctx.peek() instanceof Token.Lifetime) {
                        ctx.advance();
                        if (!ctx.eatPunct("+")) {
                            break;
                        }
                    }
                }
            } else {
                ctx.eatKeyword("const");
                ctx.expectName("generic parameter");
                if (ctx.eatPunct(":")) {
                    parseBounds(true);
                }
            }
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        expectCloseAngle();
    }

    // === Paths ===

    /**
     * Path in expression or pattern position: {@code a::b::<T>}, {@code <T as Trait>::f}.
     */
    PathParts parseExprPath() {
        if (ctx.isPunct("<") || ctx.isPunct("<<")) {
            return parseQualified(PathStyle.EXPR);
        }
        int start = ctx.mark();
        parsePathSegments(PathStyle.EXPR);
        return new PathParts(Optional.empty(), ctx.since(start));
    }

    private PathParts parseQualified(PathStyle style) {
        ctx.splitPunct("<");
        ctx.expectPunct("<");
        var qself = parseType();
        var traitPath = TokenStream.EMPTY;
        if (ctx.eatKeyword("as")) {
            int traitStart = ctx.mark();
            parsePathSegments(PathStyle.TYPE);
            traitPath = ctx.since(traitStart);
        }
        expectCloseAngle();
        int restStart = ctx.mark();
        ctx.expectPunct("::");
        parseSegment(style);
        parsePathTail(style);
        return new PathParts(Optional.of(qself), traitPath.concat(ctx.since(restStart)));
    }

    void parsePathSegments(PathStyle style) {
        ctx.eatPunct("::");
        parseSegment(style);
        parsePathTail(style);
    }

    private void parsePathTail(PathStyle style) {
        while (ctx.isPunct("::")) {
            ctx.advance();
            if (ctx.isPunct("<") || ctx.isPunct("<<")) {
                parseGenericArgs();
                continue;
            }
            parseSegment(style);
        }
    }

    private void parseSegment(PathStyle style) {
        if (!isSegmentStart(ctx.peek())) {
            throw ctx.unexpected("path segment");
        }
        ctx.advance();
        if (style != PathStyle.TYPE) {
            return;
        }
        if (ctx.isPunct("<") || ctx.isPunct("<<")) {
            parseGenericArgs();
        } else if (ctx.isOpen(Token.Delimiter.PAREN)) {
            // Fn(A, B) -> C
            parseType(false);
            parseReturnType();
        }
    }

    static boolean isSegmentStart(Token token) {
        return token instanceof Token.Ident ident && !ident.isReserved();
    }

    /**
     * {@code <A, 'b, N, Item = T, { expr }>}.
     */
    void parseGenericArgs() {
        ctx.splitPunct("<");
        ctx.expectPunct("<");
        while (!ctx.startsWithPunct(">")) {
            parseGenericArg();
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        expectCloseAngle();
    }

    private void parseGenericArg() {
        var token = ctx.peek();
        if (token instanceof Token.Lifetime || token instanceof Token.Literal
            || ctx.isKeyword("true") || ctx.isKeyword("false")) {
            ctx.advance();
            return;
        }
        if (ctx.isPunct("-") && ctx.peek(1) instanceof Token.Literal) {
            ctx.advance();
            ctx.advance();
            return;
        }
        if (ctx.isOpen(Token.Delimiter.BRACE)) {
            exprs.parseCodeBlock();
            return;
        }
        if (isSegmentStart(token) && ctx.isPunct(1, "=")) {
            ctx.advance();
            ctx.advance();
            parseType();
            return;
        }
        if (isSegmentStart(token) && ctx.isPunct(1, ":")) {
            ctx.advance();
            ctx.advance();
            parseBounds(true);
            return;
        }
        parseType();
    }

    private void expectCloseAngle() {
        ctx.splitPunct(">");
        ctx.expectPunct(">");
    }
}
