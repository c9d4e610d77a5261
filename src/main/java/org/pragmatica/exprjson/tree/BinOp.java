package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.Token;

/**
 * Binary operator, one record per operator. Operators are open for extension; unknown ones render as
 * their source token.
 */
public interface BinOp {
    Token token();

    // Arithmetic
    record Add(Token token) implements BinOp {}

    record Sub(Token token) implements BinOp {}

    record Mul(Token token) implements BinOp {}

    record Div(Token token) implements BinOp {}

    record Rem(Token token) implements BinOp {}

    // Logical
    record And(Token token) implements BinOp {}

    record Or(Token token) implements BinOp {}

    // Bitwise
    record BitXor(Token token) implements BinOp {}

    record BitAnd(Token token) implements BinOp {}

    record BitOr(Token token) implements BinOp {}

    record Shl(Token token) implements BinOp {}

    record Shr(Token token) implements BinOp {}

    // Comparison
    record Eq(Token token) implements BinOp {}

    record Lt(Token token) implements BinOp {}

    record Le(Token token) implements BinOp {}

    record Ne(Token token) implements BinOp {}

    record Ge(Token token) implements BinOp {}

    record Gt(Token token) implements BinOp {}

    // Compound assignment
    record AddAssign(Token token) implements BinOp {}

    record SubAssign(Token token) implements BinOp {}

    record MulAssign(Token token) implements BinOp {}

    record DivAssign(Token token) implements BinOp {}

    record RemAssign(Token token) implements BinOp {}

    record BitXorAssign(Token token) implements BinOp {}

    record BitAndAssign(Token token) implements BinOp {}

    record BitOrAssign(Token token) implements BinOp {}

    record ShlAssign(Token token) implements BinOp {}

    record ShrAssign(Token token) implements BinOp {}
}
