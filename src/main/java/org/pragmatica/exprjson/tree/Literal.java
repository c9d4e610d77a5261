package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;

/**
 * Literal kinds. Each literal keeps its source token; values are decoded on conversion.
 * The set is open: kinds added later fall back to opaque rendering.
 */
public interface Literal {
    TokenStream tokens();

    /**
     * Literal backed by a single lexer token.
     */
    interface Scalar extends Literal {
        Token.Literal token();

        @Override
        default TokenStream tokens() {
            return new TokenStream(List.of(token()));
        }
    }

    /**
     * {@code "text"}, {@code r#"text"#}
     */
    record Str(Token.Literal token) implements Scalar {}

    /**
     * {@code b"bytes"}, {@code br"bytes"}
     */
    record ByteStr(Token.Literal token) implements Scalar {}

    /**
     * {@code c"text"}
     */
    record CStr(Token.Literal token) implements Scalar {}

    /**
     * {@code b'x'}
     */
    record Byte(Token.Literal token) implements Scalar {}

    /**
     * {@code 'x'}
     */
    record Char(Token.Literal token) implements Scalar {}

    /**
     * {@code 42}, {@code 0xff_u8}
     */
    record Int(Token.Literal token) implements Scalar {}

    /**
     * {@code 3.14}, {@code 1e10f64}
     */
    record Float(Token.Literal token) implements Scalar {}

    /**
     * {@code true}, {@code false}
     */
    record Bool(Token.Ident token, boolean value) implements Literal {
        @Override
        public TokenStream tokens() {
            return new TokenStream(List.of(token));
        }
    }

    /**
     * Tokens kept as-is.
     */
    record Verbatim(TokenStream tokens) implements Literal {}
}
