package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.error.ParseError;
import org.pragmatica.exprjson.syntax.Lexer;
import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.tree.SourceLocation;
import org.pragmatica.exprjson.tree.SourceSpan;

import java.util.List;

/**
 * Recursive-descent parser for Rust expressions. Stateless; each call parses with a fresh context.
 */
public final class ExpressionParser implements Parser {
    private final ParserConfig config;

    ExpressionParser(ParserConfig config) {
        this.config = config;
    }

    @Override
    public ParseResult parse(String input) {
        List<Token> tokens;
        try {
            tokens = Lexer.tokenize(input);
        } catch (IllegalArgumentException e) {
            return new ParseResult.Failure(new ParseError.InvalidToken(SourceSpan.at(SourceLocation.START), e.getMessage()));
        }
        for (var token : tokens) {
            if (token instanceof Token.Error error) {
                return new ParseResult.Failure(new ParseError.InvalidToken(error.span(), error.message()));
            }
        }
        var context = ParsingContext.create(tokens, config);
        try {
            return new ParseResult.Success(new ExprRules(context).parseComplete());
        } catch (ParseException e) {
            return new ParseResult.Failure(e.error());
        }
    }
}
