package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;
import java.util.Optional;

/**
 * Braced statement list: the body of blocks, loops, closures with return types and friends.
 */
public record CodeBlock(TokenStream tokens, List<Attribute> innerAttrs, List<Stmt> stmts) {
    public CodeBlock {
        innerAttrs = List.copyOf(innerAttrs);
        stmts = List.copyOf(stmts);
    }

    /**
     * The trailing expression when the block holds nothing else.
     */
    public Optional<Expr> soleExpr() {
        if (!innerAttrs.isEmpty() || stmts.size() != 1) {
            return Optional.empty();
        }
        if (stmts.get(0) instanceof Stmt.Expression statement && !statement.semi()) {
            return Optional.of(statement.expr());
        }
        return Optional.empty();
    }
}
