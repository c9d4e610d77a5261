package org.pragmatica.exprjson.syntax;

import org.pragmatica.exprjson.tree.SourceSpan;

import java.util.Set;

/**
 * Token types for the expression lexer.
 */
public sealed interface Token {

    /**
     * Words that cannot start a path segment or a binding.
     */
    Set<String> RESERVED = Set.of(
        "as", "async", "await", "break", "const", "continue", "dyn", "else", "enum", "extern",
        "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut",
        "pub", "ref", "return", "static", "struct", "trait", "true", "type", "unsafe", "use",
        "where", "while", "abstract", "become", "box", "do", "final", "macro", "override",
        "priv", "typeof", "unsized", "virtual", "yield", "try");

    SourceSpan span();

    /**
     * Source text of the token as it is rendered in opaque output.
     */
    String text();

    /**
     * Identifier or keyword. Raw identifiers keep their {@code r#} prefix in {@link #text()}.
     */
    record Ident(SourceSpan span, String text, boolean raw) implements Token {
        public boolean is(String keyword) {
            return !raw && text.equals(keyword);
        }

        public boolean isReserved() {
            return !raw && RESERVED.contains(text);
        }

        /**
         * Name without the raw prefix.
         */
        public String name() {
            return raw
                   ? text.substring(2)
                   : text;
        }
    }

    /**
     * Lifetime or loop label: {@code 'a}.
     */
    record Lifetime(SourceSpan span, String text) implements Token {
        public String name() {
            return text.substring(1);
        }
    }

    /**
     * Literal token. {@code text} is the full source form including the suffix.
     */
    record Literal(SourceSpan span, LiteralKind kind, String text, String suffix) implements Token {
        /**
         * Source form without the suffix.
         */
        public String body() {
            return text.substring(0, text.length() - suffix.length());
        }
    }

    /**
     * Punctuation, possibly several characters long: {@code ::}, {@code ..=}, {@code >>=}.
     */
    record Punct(SourceSpan span, String text) implements Token {}

    record Open(SourceSpan span, Delimiter delimiter) implements Token {
        @Override
        public String text() {
            return String.valueOf(delimiter.open());
        }
    }

    record Close(SourceSpan span, Delimiter delimiter) implements Token {
        @Override
        public String text() {
            return String.valueOf(delimiter.close());
        }
    }

    record Eof(SourceSpan span) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(SourceSpan span, String message) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    enum Delimiter {
        PAREN('(', ')'),
        BRACKET('[', ']'),
        BRACE('{', '}');

        private final char open;
        private final char close;

        Delimiter(char open, char close) {
            this.open = open;
            this.close = close;
        }

        public char open() {
            return open;
        }

        public char close() {
            return close;
        }
    }

    enum LiteralKind {
        STR,
        BYTE_STR,
        C_STR,
        BYTE,
        CHAR,
        INT,
        FLOAT
    }
}
