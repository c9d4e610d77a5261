package org.pragmatica.exprjson.parser;

/**
 * Parser interface - parses Rust expression text into an expression tree.
 */
public interface Parser {

    /**
     * Parse a complete expression. Trailing tokens are an error.
     */
    ParseResult parse(String input);

    static Parser create() {
        return create(ParserConfig.DEFAULT);
    }

    static Parser create(ParserConfig config) {
        return new ExpressionParser(config);
    }
}
