package org.pragmatica.exprjson.convert;

import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.BinOp;
import org.pragmatica.exprjson.tree.UnOp;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps operator nodes to their symbols. Operators outside the known set render their source token.
 */
public final class OperatorNormalizer {

    private static final Map<Class<? extends BinOp>, String> BINARY_SYMBOLS = Map.ofEntries(
        // Arithmetic
        entry(BinOp.Add.class, "+"),
        entry(BinOp.Sub.class, "-"),
        entry(BinOp.Mul.class, "*"),
        entry(BinOp.Div.class, "/"),
        entry(BinOp.Rem.class, "%"),
        // Logical
        entry(BinOp.And.class, "&&"),
        entry(BinOp.Or.class, "||"),
        // Bitwise
        entry(BinOp.BitXor.class, "^"),
        entry(BinOp.BitAnd.class, "&"),
        entry(BinOp.BitOr.class, "|"),
        entry(BinOp.Shl.class, "<<"),
        entry(BinOp.Shr.class, ">>"),
        // Comparison
        entry(BinOp.Eq.class, "=="),
        entry(BinOp.Lt.class, "<"),
        entry(BinOp.Le.class, "<="),
        entry(BinOp.Ne.class, "!="),
        entry(BinOp.Ge.class, ">="),
        entry(BinOp.Gt.class, ">"),
        // Compound assignment
        entry(BinOp.AddAssign.class, "+="),
        entry(BinOp.SubAssign.class, "-="),
        entry(BinOp.MulAssign.class, "*="),
        entry(BinOp.DivAssign.class, "/="),
        entry(BinOp.RemAssign.class, "%="),
        entry(BinOp.BitXorAssign.class, "^="),
        entry(BinOp.BitAndAssign.class, "&="),
        entry(BinOp.BitOrAssign.class, "|="),
        entry(BinOp.ShlAssign.class, "<<="),
        entry(BinOp.ShrAssign.class, ">>="));

    private static final Map<Class<? extends UnOp>, String> UNARY_SYMBOLS = Map.of(
        UnOp.Deref.class, "*",
        UnOp.Not.class, "!",
        UnOp.Neg.class, "-");

    private OperatorNormalizer() {}

    public static String symbol(BinOp op) {
        var symbol = BINARY_SYMBOLS.get(op.getClass());
        return symbol != null
               ? symbol
               : OpaqueRenderer.render(new TokenStream(List.of(op.token())));
    }

    public static String symbol(UnOp op) {
        var symbol = UNARY_SYMBOLS.get(op.getClass());
        return symbol != null
               ? symbol
               : OpaqueRenderer.render(new TokenStream(List.of(op.token())));
    }
}
