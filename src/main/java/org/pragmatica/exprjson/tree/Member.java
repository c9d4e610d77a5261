package org.pragmatica.exprjson.tree;

/**
 * Field selector in field access and struct literals.
 */
public sealed interface Member {

    /**
     * {@code value.name}
     */
    record Named(String name) implements Member {}

    /**
     * {@code tuple.0}
     */
    record Unnamed(long index) implements Member {}
}
