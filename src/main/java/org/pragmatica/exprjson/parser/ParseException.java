package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.error.ParseError;

/**
 * Aborts recursive descent. Never escapes {@link ExpressionParser}.
 */
final class ParseException extends RuntimeException {
    private final transient ParseError error;

    ParseException(ParseError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    ParseError error() {
        return error;
    }
}
