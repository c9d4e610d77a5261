package org.pragmatica.exprjson.convert;

import org.pragmatica.exprjson.syntax.LiteralText;
import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.tree.Literal;
import org.pragmatica.exprjson.value.Value;

import java.nio.charset.StandardCharsets;

/**
 * Converts literal nodes to tagged values. Numeric literals keep their digits as text, so no value
 * ever passes through a fixed-width number.
 */
public final class LiteralNormalizer {

    private LiteralNormalizer() {}

    public static Value normalize(Literal lit) {
        if (lit instanceof Literal.Bool bool) {
            return Value.object()
                        .put("kind", "Bool")
                        .put("value", bool.value())
                        .build();
        }
        if (lit instanceof Literal.Verbatim) {
            return opaque("Verbatim", lit);
        }
        if (lit instanceof Literal.Scalar scalar) {
            try {
                return scalar(scalar);
            } catch (IllegalArgumentException e) {
                // Hand-built token the lexer would have rejected
                return opaque("Verbatim", lit);
            }
        }
        return opaque("Unknown", lit);
    }

    private static Value scalar(Literal.Scalar scalar) {
        var token = scalar.token();
        var body = token.body();
        if (scalar instanceof Literal.Str) {
            return tagged("Str", Value.of(LiteralText.decodeString(body)), token);
        }
        if (scalar instanceof Literal.ByteStr) {
            var bytes = LiteralText.decodeByteString(body);
            return tagged("ByteStr", Value.of(new String(bytes, StandardCharsets.ISO_8859_1)), token);
        }
        if (scalar instanceof Literal.CStr) {
            var bytes = LiteralText.decodeCString(body);
            return tagged("CStr", Value.of(new String(bytes, StandardCharsets.UTF_8)), token);
        }
        if (scalar instanceof Literal.Byte) {
            return tagged("Byte", Value.of(LiteralText.decodeByte(body)), token);
        }
        if (scalar instanceof Literal.Char) {
            return tagged("Char", Value.of(LiteralText.decodeChar(body)), token);
        }
        if (scalar instanceof Literal.Int) {
            return tagged("Int", Value.of(LiteralText.integerDigits(body)), token);
        }
        if (scalar instanceof Literal.Float) {
            return tagged("Float", Value.of(LiteralText.floatDigits(body)), token);
        }
        return opaque("Unknown", scalar);
    }

    private static Value tagged(String kind, Value value, Token.Literal token) {
        return Value.object()
                    .put("kind", kind)
                    .put("value", value)
                    .put("suffix", token.suffix().isEmpty()
                                   ? Value.NULL
                                   : Value.of(token.suffix()))
                    .build();
    }

    private static Value opaque(String kind, Literal lit) {
        return Value.object()
                    .put("kind", kind)
                    .put("tokens", OpaqueRenderer.render(lit.tokens()))
                    .build();
    }
}
