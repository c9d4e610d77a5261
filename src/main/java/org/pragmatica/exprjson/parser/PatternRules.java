package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.tree.Pat;

/**
 * Grammar rules for patterns. Patterns are validated and kept as tokens.
 */
final class PatternRules {
    private final ParsingContext ctx;
    private final ExprRules exprs;
    private final TypeRules types;

    PatternRules(ParsingContext ctx, ExprRules exprs, TypeRules types) {
        this.ctx = ctx;
        this.exprs = exprs;
        this.types = types;
    }

    /**
     * Pattern with top-level alternatives: {@code A | B}, with an optional leading {@code |}.
     */
    Pat parseTop() {
        int start = ctx.mark();
        ctx.eatPunct("|");
        parseAlternatives();
        return new Pat(ctx.since(start));
    }

    /**
     * Single pattern without top-level alternatives, as in closure parameters.
     */
    Pat parseSingle() {
        int start = ctx.mark();
        parsePattern();
        return new Pat(ctx.since(start));
    }

    private void parseAlternatives() {
        parsePattern();
        while (ctx.isPunct("|")) {
            ctx.advance();
            parsePattern();
        }
    }

    private void parsePattern() {
        ctx.enter();
        try {
            parsePatternInner();
        } finally {
            ctx.exit();
        }
    }

    private void parsePatternInner() {
        var token = ctx.peek();

        if (ctx.isKeyword("_")) {
            ctx.advance();
            return;
        }
        if (ctx.isPunct("..")) {
            ctx.advance();
            return;
        }
        if (ctx.isPunct("..=")) {
            ctx.advance();
            parseRangeEnd();
            return;
        }
        if (ctx.isPunct("&&")) {
            ctx.splitPunct("&");
        }
        if (ctx.eatPunct("&")) {
            ctx.eatKeyword("mut");
            parsePattern();
            return;
        }
        if (ctx.isOpen(Token.Delimiter.PAREN)) {
            parseDelimitedList(Token.Delimiter.PAREN);
            return;
        }
        if (ctx.isOpen(Token.Delimiter.BRACKET)) {
            parseDelimitedList(Token.Delimiter.BRACKET);
            return;
        }
        if (token instanceof Token.Literal || (ctx.isPunct("-") && ctx.peek(1) instanceof Token.Literal)) {
            parseLiteral();
            parseRangeTail();
            return;
        }
        if (ctx.isKeyword("true") || ctx.isKeyword("false")) {
            ctx.advance();
            return;
        }
        if (ctx.eatKeyword("box")) {
            parsePattern();
            return;
        }
        if (ctx.isKeyword("ref") || ctx.isKeyword("mut")) {
            parseBinding();
            return;
        }
        if (ctx.isKeyword("const") && ctx.isOpen(1, Token.Delimiter.BRACE)) {
            ctx.advance();
            exprs.parseCodeBlock();
            return;
        }
        if (ctx.isPunct("<") || ctx.isPunct("<<") || ctx.isPunct("::") || TypeRules.isSegmentStart(token)) {
            parsePathPattern();
            return;
        }
        throw ctx.unexpected("pattern");
    }

    private void parseBinding() {
        ctx.eatKeyword("ref");
        ctx.eatKeyword("mut");
        ctx.expectName("binding name");
        if (ctx.eatPunct("@")) {
            parsePattern();
        }
    }

    private void parsePathPattern() {
        types.parseExprPath();
        if (ctx.isPunct("!") && ctx.peek(1) instanceof Token.Open) {
            ctx.advance();
            ctx.skipDelimited();
            return;
        }
        if (ctx.isOpen(Token.Delimiter.PAREN)) {
            parseDelimitedList(Token.Delimiter.PAREN);
            return;
        }
        if (ctx.isOpen(Token.Delimiter.BRACE)) {
            parseStructFields();
            return;
        }
        if (ctx.eatPunct("@")) {
            parsePattern();
            return;
        }
        parseRangeTail();
    }

    private void parseDelimitedList(Token.Delimiter delimiter) {
        ctx.expectOpen(delimiter);
        while (!ctx.isClose(delimiter)) {
            ctx.eatPunct("|");
            parseAlternatives();
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        ctx.expectClose(delimiter);
    }

    private void parseStructFields() {
        ctx.expectOpen(Token.Delimiter.BRACE);
        while (!ctx.isClose(Token.Delimiter.BRACE)) {
            exprs.parseOuterAttrs();
            if (ctx.eatPunct("..")) {
                break;
            }
            if (ctx.isKeyword("ref") || ctx.isKeyword("mut") || ctx.isKeyword("box")) {
                ctx.eatKeyword("box");
                parseBinding();
            } else {
                if (ctx.peek() instanceof Token.Literal) {
                    ctx.advance();
                } else {
                    ctx.expectName("field name");
                }
                if (ctx.eatPunct(":")) {
                    ctx.eatPunct("|");
                    parseAlternatives();
                }
            }
            if (!ctx.eatPunct(",")) {
                break;
            }
        }
        ctx.expectClose(Token.Delimiter.BRACE);
    }

    private void parseLiteral() {
        ctx.eatPunct("-");
        if (!(ctx.peek() instanceof Token.Literal)) {
            throw ctx.unexpected("literal");
        }
        ctx.advance();
    }

    private void parseRangeTail() {
        if (ctx.isPunct("..=") || ctx.isPunct("...")) {
            ctx.advance();
            parseRangeEnd();
            return;
        }
        if (ctx.eatPunct("..") && isRangeEndStart()) {
            parseRangeEnd();
        }
    }

    private boolean isRangeEndStart() {
        var token = ctx.peek();
        return token instanceof Token.Literal
               || ctx.isPunct("-")
               || ctx.isPunct("::")
               || ctx.isPunct("<")
               || TypeRules.isSegmentStart(token);
    }

    private void parseRangeEnd() {
        if (ctx.peek() instanceof Token.Literal || ctx.isPunct("-")) {
            parseLiteral();
            return;
        }
        types.parseExprPath();
    }
}
