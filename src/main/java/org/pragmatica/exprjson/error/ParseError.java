package org.pragmatica.exprjson.error;

import org.pragmatica.exprjson.tree.SourceSpan;

import java.util.Optional;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceSpan span();

    String message();

    /**
     * A token the grammar does not allow at this point.
     */
    record UnexpectedToken(
        SourceSpan span,
        String found,
        String expected) implements ParseError {
        @Override
        public String message() {
            return "expected " + expected + ", found " + found;
        }
    }

    /**
     * Input ended while more was expected.
     */
    record UnexpectedEof(
        SourceSpan span,
        String expected) implements ParseError {
        @Override
        public String message() {
            return "unexpected end of input, expected " + expected;
        }
    }

    /**
     * Malformed token reported by the lexer: bad literal, unknown character, unbalanced delimiter.
     */
    record InvalidToken(
        SourceSpan span,
        String reason) implements ParseError {
        @Override
        public String message() {
            return reason;
        }
    }

    /**
     * Input nested deeper than the configured limit.
     */
    record NestingTooDeep(
        SourceSpan span,
        int limit) implements ParseError {
        @Override
        public String message() {
            return "expression nesting exceeds the limit of " + limit + " levels";
        }
    }

    /**
     * Syntax that parses but is not valid Rust, e.g. chained comparisons.
     *
     * @param help how to rewrite the input, when there is one obvious fix
     */
    record InvalidSyntax(
        SourceSpan span,
        String reason,
        Optional<String> help) implements ParseError {
        public InvalidSyntax(SourceSpan span, String reason) {
            this(span, reason, Optional.empty());
        }

        @Override
        public String message() {
            return reason;
        }
    }
}
