package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;

/**
 * One field of a struct literal. Shorthand fields ({@code Point { x }}) carry a path expression.
 */
public record FieldValue(TokenStream tokens, List<Attribute> attrs, Member member, Expr expr) {
    public FieldValue {
        attrs = List.copyOf(attrs);
    }
}
