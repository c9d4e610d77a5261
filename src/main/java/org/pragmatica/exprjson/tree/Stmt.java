package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;
import java.util.Optional;

/**
 * Statement inside a {@link CodeBlock}.
 */
public sealed interface Stmt {
    TokenStream tokens();

    /**
     * {@code let pat: ty = init else { diverge };}
     */
    record Local(TokenStream tokens,
                 List<Attribute> attrs,
                 Pat pat,
                 Optional<Type> ty,
                 Optional<Expr> init,
                 Optional<CodeBlock> diverge) implements Stmt {}

    /**
     * Nested item ({@code fn}, {@code struct}, {@code use}, ...), kept as tokens.
     */
    record Item(TokenStream tokens) implements Stmt {}

    /**
     * Expression statement; {@code semi} is false for the trailing expression and block-like statements.
     */
    record Expression(TokenStream tokens, Expr expr, boolean semi) implements Stmt {}

    /**
     * Lone {@code ;}.
     */
    record Empty(TokenStream tokens) implements Stmt {}
}
