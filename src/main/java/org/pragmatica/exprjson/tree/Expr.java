package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

import java.util.List;
import java.util.Optional;

/**
 * Expression node - one syntactic form of Rust expression syntax.
 *
 * <p>The interface is deliberately not sealed: the grammar grows, and nodes unknown to a
 * consumer must still be representable. Every node keeps the tokens it was parsed from and
 * its outer attributes.
 */
public interface Expr {

    /**
     * Tokens this node was parsed from, attributes included.
     */
    TokenStream tokens();

    /**
     * Outer attributes in source order.
     */
    List<Attribute> attrs();

    // === Literals, paths and aggregates ===

    /**
     * {@code 42}, {@code "text"}, {@code true}
     */
    record Lit(TokenStream tokens, List<Attribute> attrs, Literal lit) implements Expr {}

    /**
     * {@code std::mem::swap}, {@code <T as Trait>::f}
     */
    record Path(TokenStream tokens, List<Attribute> attrs, Optional<Type> qself, TokenStream path) implements Expr {}

    /**
     * {@code [a, b, c]}
     */
    record Array(TokenStream tokens, List<Attribute> attrs, List<Expr> elems) implements Expr {}

    /**
     * {@code [value; len]}
     */
    record Repeat(TokenStream tokens, List<Attribute> attrs, Expr expr, Expr len) implements Expr {}

    /**
     * {@code ()}, {@code (a,)}, {@code (a, b)}
     */
    record Tuple(TokenStream tokens, List<Attribute> attrs, List<Expr> elems) implements Expr {}

    /**
     * {@code (a)}
     */
    record Paren(TokenStream tokens, List<Attribute> attrs, Expr expr) implements Expr {}

    /**
     * Expression in invisible delimiters. Only produced by macro expansion, never by parsing text.
     */
    record Group(TokenStream tokens, List<Attribute> attrs, Expr expr) implements Expr {}

    /**
     * {@code Point { x: 1, ..base }}
     */
    record Struct(TokenStream tokens,
                  List<Attribute> attrs,
                  Optional<Type> qself,
                  TokenStream path,
                  List<FieldValue> fields,
                  boolean dot2,
                  Optional<Expr> rest) implements Expr {}

    /**
     * {@code _}
     */
    record Infer(TokenStream tokens, List<Attribute> attrs) implements Expr {}

    /**
     * {@code vec![1, 2]}; {@code mac} covers the path, the bang and the delimited arguments.
     */
    record Macro(TokenStream tokens, List<Attribute> attrs, TokenStream mac) implements Expr {}

    // === Operators ===

    /**
     * {@code a + b}, {@code a += b}
     */
    record Binary(TokenStream tokens, List<Attribute> attrs, Expr left, BinOp op, Expr right) implements Expr {}

    /**
     * {@code -x}, {@code !x}, {@code *x}
     */
    record Unary(TokenStream tokens, List<Attribute> attrs, UnOp op, Expr expr) implements Expr {}

    /**
     * {@code a = b}
     */
    record Assign(TokenStream tokens, List<Attribute> attrs, Expr left, Expr right) implements Expr {}

    /**
     * {@code x as u8}
     */
    record Cast(TokenStream tokens, List<Attribute> attrs, Expr expr, Type ty) implements Expr {}

    /**
     * {@code &x}, {@code &mut x}
     */
    record Reference(TokenStream tokens, List<Attribute> attrs, boolean mutability, Expr expr) implements Expr {}

    /**
     * {@code &raw const x}, {@code &raw mut x}
     */
    record RawAddr(TokenStream tokens, List<Attribute> attrs, boolean mutability, Expr expr) implements Expr {}

    /**
     * {@code a..b}, {@code ..=b}, {@code ..}
     */
    record Range(TokenStream tokens,
                 List<Attribute> attrs,
                 Optional<Expr> start,
                 RangeLimits limits,
                 Optional<Expr> end) implements Expr {}

    /**
     * {@code let Some(x) = opt} in condition position.
     */
    record Let(TokenStream tokens, List<Attribute> attrs, Pat pat, Expr expr) implements Expr {}

    // === Postfix ===

    /**
     * {@code f(a, b)}
     */
    record Call(TokenStream tokens, List<Attribute> attrs, Expr func, List<Expr> args) implements Expr {}

    /**
     * {@code receiver.method::<T>(args)}; the turbofish keeps its leading {@code ::}.
     */
    record MethodCall(TokenStream tokens,
                      List<Attribute> attrs,
                      Expr receiver,
                      String method,
                      Optional<TokenStream> turbofish,
                      List<Expr> args) implements Expr {}

    /**
     * {@code base.member}
     */
    record Field(TokenStream tokens, List<Attribute> attrs, Expr base, Member member) implements Expr {}

    /**
     * {@code expr[index]}
     */
    record Index(TokenStream tokens, List<Attribute> attrs, Expr expr, Expr index) implements Expr {}

    /**
     * {@code expr?}
     */
    record Try(TokenStream tokens, List<Attribute> attrs, Expr expr) implements Expr {}

    /**
     * {@code future.await}
     */
    record Await(TokenStream tokens, List<Attribute> attrs, Expr base) implements Expr {}

    // === Control flow ===

    /**
     * {@code if cond { .. } else ..}; the else branch is a block, or a nested if.
     */
    record If(TokenStream tokens,
              List<Attribute> attrs,
              Expr cond,
              CodeBlock thenBranch,
              Optional<Expr> elseBranch) implements Expr {}

    /**
     * {@code match expr { arms }}
     */
    record Match(TokenStream tokens, List<Attribute> attrs, Expr expr, List<Arm> arms) implements Expr {}

    /**
     * {@code 'label: loop { .. }}
     */
    record Loop(TokenStream tokens, List<Attribute> attrs, Optional<Label> label, CodeBlock body) implements Expr {}

    /**
     * {@code 'label: while cond { .. }}
     */
    record While(TokenStream tokens,
                 List<Attribute> attrs,
                 Optional<Label> label,
                 Expr cond,
                 CodeBlock body) implements Expr {}

    /**
     * {@code 'label: for pat in expr { .. }}
     */
    record ForLoop(TokenStream tokens,
                   List<Attribute> attrs,
                   Optional<Label> label,
                   Pat pat,
                   Expr expr,
                   CodeBlock body) implements Expr {}

    /**
     * {@code break 'label value}
     */
    record Break(TokenStream tokens, List<Attribute> attrs, Optional<Label> label, Optional<Expr> expr) implements Expr {}

    /**
     * {@code continue 'label}
     */
    record Continue(TokenStream tokens, List<Attribute> attrs, Optional<Label> label) implements Expr {}

    /**
     * {@code return value}
     */
    record Return(TokenStream tokens, List<Attribute> attrs, Optional<Expr> expr) implements Expr {}

    /**
     * {@code yield value}
     */
    record Yield(TokenStream tokens, List<Attribute> attrs, Optional<Expr> expr) implements Expr {}

    // === Blocks and closures ===

    /**
     * {@code 'label: { .. }}
     */
    record Block(TokenStream tokens, List<Attribute> attrs, Optional<Label> label, CodeBlock block) implements Expr {}

    /**
     * {@code async move { .. }}
     */
    record Async(TokenStream tokens, List<Attribute> attrs, boolean capture, CodeBlock block) implements Expr {}

    /**
     * {@code const { .. }}
     */
    record Const(TokenStream tokens, List<Attribute> attrs, CodeBlock block) implements Expr {}

    /**
     * {@code unsafe { .. }}
     */
    record Unsafe(TokenStream tokens, List<Attribute> attrs, CodeBlock block) implements Expr {}

    /**
     * {@code try { .. }}
     */
    record TryBlock(TokenStream tokens, List<Attribute> attrs, CodeBlock block) implements Expr {}

    /**
     * {@code for<'a> const static async move |inputs| -> Output body}; {@code output} is empty
     * without an explicit return type.
     */
    record Closure(TokenStream tokens,
                   List<Attribute> attrs,
                   Optional<TokenStream> lifetimes,
                   boolean constness,
                   boolean movability,
                   boolean asyncness,
                   boolean capture,
                   List<Pat> inputs,
                   TokenStream output,
                   Expr body) implements Expr {}

    // === Unstructured ===

    /**
     * Tokens the parser accepts without modelling them, such as {@code box value}.
     */
    record Verbatim(TokenStream tokens) implements Expr {
        @Override
        public List<Attribute> attrs() {
            return List.of();
        }
    }
}
