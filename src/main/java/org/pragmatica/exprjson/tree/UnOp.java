package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.Token;

/**
 * Prefix operator.
 */
public interface UnOp {
    Token token();

    /**
     * {@code *x}
     */
    record Deref(Token token) implements UnOp {}

    /**
     * {@code !x}
     */
    record Not(Token token) implements UnOp {}

    /**
     * {@code -x}
     */
    record Neg(Token token) implements UnOp {}
}
