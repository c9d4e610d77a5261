package org.pragmatica.exprjson.convert;

import org.pragmatica.exprjson.syntax.Token;
import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.Attribute;
import org.pragmatica.exprjson.tree.CodeBlock;
import org.pragmatica.exprjson.tree.Pat;
import org.pragmatica.exprjson.tree.Type;

/**
 * Deterministic text rendering of token streams.
 *
 * <p>Tokens are joined by single spaces, except that nothing separates an opening parenthesis or
 * bracket from what follows it, or a closing one from what precedes it. Braces keep their inner
 * spaces: {@code { x }}, or {@code { }} when empty. The rendering depends on tokens only, so
 * comments and layout in the source never show.
 */
public final class OpaqueRenderer {

    private OpaqueRenderer() {}

    public static String render(TokenStream tokens) {
        var sb = new StringBuilder();
        Token previous = null;
        for (var token : tokens.tokens()) {
            if (previous != null && spaceBetween(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.text());
            previous = token;
        }
        return sb.toString();
    }

    public static String type(Type type) {
        return render(type.tokens());
    }

    public static String pattern(Pat pat) {
        return render(pat.tokens());
    }

    public static String block(CodeBlock block) {
        return render(block.tokens());
    }

    public static String attribute(Attribute attribute) {
        return render(attribute.tokens());
    }

    private static boolean spaceBetween(Token previous, Token next) {
        if (previous instanceof Token.Open open && open.delimiter() != Token.Delimiter.BRACE) {
            return false;
        }
        return !(next instanceof Token.Close close && close.delimiter() != Token.Delimiter.BRACE);
    }
}
