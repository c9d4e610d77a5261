package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;
import java.util.Optional;

/**
 * One arm of a match expression: {@code pat if guard => body}.
 */
public record Arm(TokenStream tokens, List<Attribute> attrs, Pat pat, Optional<Expr> guard, Expr body) {
    public Arm {
        attrs = List.copyOf(attrs);
    }
}
