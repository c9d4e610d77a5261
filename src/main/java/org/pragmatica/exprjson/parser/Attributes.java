package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.Attribute;
import org.pragmatica.exprjson.tree.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches outer attributes parsed ahead of an expression to the finished node.
 */
final class Attributes {

    private Attributes() {}

    /**
     * Copy of {@code expr} with {@code outer} prepended to its attributes and {@code tokens}
     * (which include the attributes) as its source tokens.
     */
    static Expr attach(Expr expr, List<Attribute> outer, TokenStream tokens) {
        var attrs = new ArrayList<Attribute>(outer);
        attrs.addAll(expr.attrs());
        var all = List.copyOf(attrs);

        if (expr instanceof Expr.Lit e) {
            return new Expr.Lit(tokens, all, e.lit());
        }
        if (expr instanceof Expr.Path e) {
            return new Expr.Path(tokens, all, e.qself(), e.path());
        }
        if (expr instanceof Expr.Array e) {
            return new Expr.Array(tokens, all, e.elems());
        }
        if (expr instanceof Expr.Repeat e) {
            return new Expr.Repeat(tokens, all, e.expr(), e.len());
        }
        if (expr instanceof Expr.Tuple e) {
            return new Expr.Tuple(tokens, all, e.elems());
        }
        if (expr instanceof Expr.Paren e) {
            return new Expr.Paren(tokens, all, e.expr());
        }
        if (expr instanceof Expr.Group e) {
            return new Expr.Group(tokens, all, e.expr());
        }
        if (expr instanceof Expr.Struct e) {
            return new Expr.Struct(tokens, all, e.qself(), e.path(), e.fields(), e.dot2(), e.rest());
        }
        if (expr instanceof Expr.Infer) {
            return new Expr.Infer(tokens, all);
        }
        if (expr instanceof Expr.Macro e) {
            return new Expr.Macro(tokens, all, e.mac());
        }
        if (expr instanceof Expr.Binary e) {
            return new Expr.Binary(tokens, all, e.left(), e.op(), e.right());
        }
        if (expr instanceof Expr.Unary e) {
            return new Expr.Unary(tokens, all, e.op(), e.expr());
        }
        if (expr instanceof Expr.Assign e) {
            return new Expr.Assign(tokens, all, e.left(), e.right());
        }
        if (expr instanceof Expr.Cast e) {
            return new Expr.Cast(tokens, all, e.expr(), e.ty());
        }
        if (expr instanceof Expr.Reference e) {
            return new Expr.Reference(tokens, all, e.mutability(), e.expr());
        }
        if (expr instanceof Expr.RawAddr e) {
            return new Expr.RawAddr(tokens, all, e.mutability(), e.expr());
        }
        if (expr instanceof Expr.Range e) {
            return new Expr.Range(tokens, all, e.start(), e.limits(), e.end());
        }
        if (expr instanceof Expr.Let e) {
            return new Expr.Let(tokens, all, e.pat(), e.expr());
        }
        if (expr instanceof Expr.Call e) {
            return new Expr.Call(tokens, all, e.func(), e.args());
        }
        if (expr instanceof Expr.MethodCall e) {
            return new Expr.MethodCall(tokens, all, e.receiver(), e.method(), e.turbofish(), e.args());
        }
        if (expr instanceof Expr.Field e) {
            return new Expr.Field(tokens, all, e.base(), e.member());
        }
        if (expr instanceof Expr.Index e) {
            return new Expr.Index(tokens, all, e.expr(), e.index());
        }
        if (expr instanceof Expr.Try e) {
            return new Expr.Try(tokens, all, e.expr());
        }
        if (expr instanceof Expr.Await e) {
            return new Expr.Await(tokens, all, e.base());
        }
        if (expr instanceof Expr.If e) {
            return new Expr.If(tokens, all, e.cond(), e.thenBranch(), e.elseBranch());
        }
        if (expr instanceof Expr.Match e) {
            return new Expr.Match(tokens, all, e.expr(), e.arms());
        }
        if (expr instanceof Expr.Loop e) {
            return new Expr.Loop(tokens, all, e.label(), e.body());
        }
        if (expr instanceof Expr.While e) {
            return new Expr.While(tokens, all, e.label(), e.cond(), e.body());
        }
        if (expr instanceof Expr.ForLoop e) {
            return new Expr.ForLoop(tokens, all, e.label(), e.pat(), e.expr(), e.body());
        }
        if (expr instanceof Expr.Break e) {
            return new Expr.Break(tokens, all, e.label(), e.expr());
        }
        if (expr instanceof Expr.Continue e) {
            return new Expr.Continue(tokens, all, e.label());
        }
        if (expr instanceof Expr.Return e) {
            return new Expr.Return(tokens, all, e.expr());
        }
        if (expr instanceof Expr.Yield e) {
            return new Expr.Yield(tokens, all, e.expr());
        }
        if (expr instanceof Expr.Block e) {
            return new Expr.Block(tokens, all, e.label(), e.block());
        }
        if (expr instanceof Expr.Async e) {
            return new Expr.Async(tokens, all, e.capture(), e.block());
        }
        if (expr instanceof Expr.Const e) {
            return new Expr.Const(tokens, all, e.block());
        }
        if (expr instanceof Expr.Unsafe e) {
            return new Expr.Unsafe(tokens, all, e.block());
        }
        if (expr instanceof Expr.TryBlock e) {
            return new Expr.TryBlock(tokens, all, e.block());
        }
        if (expr instanceof Expr.Closure e) {
            return new Expr.Closure(tokens, all, e.lifetimes(), e.constness(), e.movability(),
                                    e.asyncness(), e.capture(), e.inputs(), e.output(), e.body());
        }
        // Verbatim keeps attributes inside its tokens
        return new Expr.Verbatim(tokens);
    }
}
