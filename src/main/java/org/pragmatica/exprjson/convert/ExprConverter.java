package org.pragmatica.exprjson.convert;

import org.pragmatica.exprjson.syntax.TokenStream;
import org.pragmatica.exprjson.tree.Arm;
import org.pragmatica.exprjson.tree.Attribute;
import org.pragmatica.exprjson.tree.Expr;
import org.pragmatica.exprjson.tree.FieldValue;
import org.pragmatica.exprjson.tree.Label;
import org.pragmatica.exprjson.tree.Member;
import org.pragmatica.exprjson.tree.RangeLimits;
import org.pragmatica.exprjson.tree.Type;
import org.pragmatica.exprjson.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Converts expression trees to canonical values.
 *
 * <p>Every object carries {@code kind} first and {@code attrs} second, followed by the fields of its
 * variant in a fixed order. Absent optional fields are present as null. Nodes this converter does
 * not know become {@code {"kind": "Unknown", "tokens": ...}}, so conversion never fails.
 */
public final class ExprConverter {

    private ExprConverter() {}

    public static Value convert(Expr expr) {
        // Literals, paths and aggregates
        if (expr instanceof Expr.Lit e) {
            return node("Lit", e).put("lit", LiteralNormalizer.normalize(e.lit()))
                                 .build();
        }
        if (expr instanceof Expr.Path e) {
            return node("Path", e).put("qself", optionalType(e.qself()))
                                  .put("path", OpaqueRenderer.render(e.path()))
                                  .build();
        }
        if (expr instanceof Expr.Array e) {
            return node("Array", e).put("elems", all(e.elems()))
                                   .build();
        }
        if (expr instanceof Expr.Repeat e) {
            return node("Repeat", e).put("expr", convert(e.expr()))
                                    .put("len", convert(e.len()))
                                    .build();
        }
        if (expr instanceof Expr.Tuple e) {
            return node("Tuple", e).put("elems", all(e.elems()))
                                   .build();
        }
        if (expr instanceof Expr.Paren e) {
            return node("Paren", e).put("expr", convert(e.expr()))
                                   .build();
        }
        if (expr instanceof Expr.Group e) {
            return node("Group", e).put("expr", convert(e.expr()))
                                   .build();
        }
        if (expr instanceof Expr.Struct e) {
            return node("Struct", e).put("qself", optionalType(e.qself()))
                                    .put("path", OpaqueRenderer.render(e.path()))
                                    .put("fields", map(e.fields(), ExprConverter::fieldValue))
                                    .put("dot2", e.dot2())
                                    .put("rest", optional(e.rest()))
                                    .build();
        }
        if (expr instanceof Expr.Infer e) {
            return node("Infer", e).build();
        }
        if (expr instanceof Expr.Macro e) {
            return node("Macro", e).put("mac", OpaqueRenderer.render(e.mac()))
                                   .build();
        }

        // Operators
        if (expr instanceof Expr.Binary e) {
            return node("Binary", e).put("left", convert(e.left()))
                                    .put("op", OperatorNormalizer.symbol(e.op()))
                                    .put("right", convert(e.right()))
                                    .build();
        }
        if (expr instanceof Expr.Unary e) {
            return node("Unary", e).put("op", OperatorNormalizer.symbol(e.op()))
                                   .put("expr", convert(e.expr()))
                                   .build();
        }
        if (expr instanceof Expr.Assign e) {
            return node("Assign", e).put("left", convert(e.left()))
                                    .put("right", convert(e.right()))
                                    .build();
        }
        if (expr instanceof Expr.Cast e) {
            return node("Cast", e).put("expr", convert(e.expr()))
                                  .put("ty", OpaqueRenderer.type(e.ty()))
                                  .build();
        }
        if (expr instanceof Expr.Reference e) {
            return node("Reference", e).put("mutability", e.mutability())
                                       .put("expr", convert(e.expr()))
                                       .build();
        }
        if (expr instanceof Expr.RawAddr e) {
            return node("RawAddr", e).put("mutability", e.mutability())
                                     .put("expr", convert(e.expr()))
                                     .build();
        }
        if (expr instanceof Expr.Range e) {
            return node("Range", e).put("start", optional(e.start()))
                                   .put("limits", e.limits() == RangeLimits.CLOSED
                                                  ? "Closed"
                                                  : "HalfOpen")
                                   .put("end", optional(e.end()))
                                   .build();
        }
        if (expr instanceof Expr.Let e) {
            return node("Let", e).put("pat", OpaqueRenderer.pattern(e.pat()))
                                 .put("expr", convert(e.expr()))
                                 .build();
        }

        // Postfix
        if (expr instanceof Expr.Call e) {
            return node("Call", e).put("func", convert(e.func()))
                                  .put("args", all(e.args()))
                                  .build();
        }
        if (expr instanceof Expr.MethodCall e) {
            return node("MethodCall", e).put("receiver", convert(e.receiver()))
                                        .put("method", e.method())
                                        .put("turbofish", optionalTokens(e.turbofish()))
                                        .put("args", all(e.args()))
                                        .build();
        }
        if (expr instanceof Expr.Field e) {
            return node("Field", e).put("base", convert(e.base()))
                                   .put("member", member(e.member()))
                                   .build();
        }
        if (expr instanceof Expr.Index e) {
            return node("Index", e).put("expr", convert(e.expr()))
                                   .put("index", convert(e.index()))
                                   .build();
        }
        if (expr instanceof Expr.Try e) {
            return node("Try", e).put("expr", convert(e.expr()))
                                 .build();
        }
        if (expr instanceof Expr.Await e) {
            return node("Await", e).put("base", convert(e.base()))
                                   .build();
        }

        // Control flow
        if (expr instanceof Expr.If e) {
            return node("If", e).put("cond", convert(e.cond()))
                                .put("then_branch", OpaqueRenderer.block(e.thenBranch()))
                                .put("else_branch", e.elseBranch()
                                                     .map(ExprConverter::elseBranch)
                                                     .orElse(Value.NULL))
                                .build();
        }
        if (expr instanceof Expr.Match e) {
            return node("Match", e).put("expr", convert(e.expr()))
                                   .put("arms", map(e.arms(), ExprConverter::arm))
                                   .build();
        }
        if (expr instanceof Expr.Loop e) {
            return node("Loop", e).put("label", label(e.label()))
                                  .put("body", OpaqueRenderer.block(e.body()))
                                  .build();
        }
        if (expr instanceof Expr.While e) {
            return node("While", e).put("label", label(e.label()))
                                   .put("cond", convert(e.cond()))
                                   .put("body", OpaqueRenderer.block(e.body()))
                                   .build();
        }
        if (expr instanceof Expr.ForLoop e) {
            return node("ForLoop", e).put("label", label(e.label()))
                                     .put("pat", OpaqueRenderer.pattern(e.pat()))
                                     .put("expr", convert(e.expr()))
                                     .put("body", OpaqueRenderer.block(e.body()))
                                     .build();
        }
        if (expr instanceof Expr.Break e) {
            return node("Break", e).put("label", label(e.label()))
                                   .put("expr", optional(e.expr()))
                                   .build();
        }
        if (expr instanceof Expr.Continue e) {
            return node("Continue", e).put("label", label(e.label()))
                                      .build();
        }
        if (expr instanceof Expr.Return e) {
            return node("Return", e).put("expr", optional(e.expr()))
                                    .build();
        }
        if (expr instanceof Expr.Yield e) {
            return node("Yield", e).put("expr", optional(e.expr()))
                                   .build();
        }

        // Blocks and closures
        if (expr instanceof Expr.Block e) {
            return node("Block", e).put("label", label(e.label()))
                                   .put("block", OpaqueRenderer.block(e.block()))
                                   .build();
        }
        if (expr instanceof Expr.Async e) {
            return node("Async", e).put("capture", e.capture())
                                   .put("block", OpaqueRenderer.block(e.block()))
                                   .build();
        }
        if (expr instanceof Expr.Const e) {
            return node("Const", e).put("block", OpaqueRenderer.block(e.block()))
                                   .build();
        }
        if (expr instanceof Expr.Unsafe e) {
            return node("Unsafe", e).put("block", OpaqueRenderer.block(e.block()))
                                    .build();
        }
        if (expr instanceof Expr.TryBlock e) {
            return node("TryBlock", e).put("block", OpaqueRenderer.block(e.block()))
                                      .build();
        }
        if (expr instanceof Expr.Closure e) {
            return node("Closure", e).put("lifetimes", optionalTokens(e.lifetimes()))
                                     .put("constness", e.constness())
                                     .put("movability", e.movability())
                                     .put("asyncness", e.asyncness())
                                     .put("capture", e.capture())
                                     .put("inputs", map(e.inputs(), pat -> Value.of(OpaqueRenderer.pattern(pat))))
                                     .put("output", OpaqueRenderer.render(e.output()))
                                     .put("body", convert(e.body()))
                                     .build();
        }

        // Unstructured
        if (expr instanceof Expr.Verbatim e) {
            return opaque("Verbatim", e.tokens(), e);
        }
        return opaque("Unknown", expr.tokens(), expr);
    }

    private static Value.ObjBuilder node(String kind, Expr expr) {
        return Value.object()
                    .put("kind", kind)
                    .put("attrs", attrs(expr.attrs()));
    }

    private static Value opaque(String kind, TokenStream tokens, Expr expr) {
        var text = tokens == null
                   ? ""
                   : OpaqueRenderer.render(tokens);
        return Value.object()
                    .put("kind", kind)
                    .put("tokens", text.isEmpty()
                                   ? typeName(expr)
                                   : text)
                    .build();
    }

    private static String typeName(Expr expr) {
        var name = expr.getClass().getSimpleName();
        return name.isEmpty()
               ? expr.getClass().getName()
               : name;
    }

    /**
     * An else block holding nothing but a trailing expression stands for that expression.
     */
    private static Value elseBranch(Expr branch) {
        if (branch instanceof Expr.Block block && block.label().isEmpty() && block.attrs().isEmpty()) {
            return block.block()
                        .soleExpr()
                        .map(ExprConverter::convert)
                        .orElseGet(() -> convert(branch));
        }
        return convert(branch);
    }

    private static List<Value> attrs(List<Attribute> attrs) {
        return map(attrs, attr -> Value.of(OpaqueRenderer.attribute(attr)));
    }

    private static Value arm(Arm arm) {
        return Value.object()
                    .put("attrs", attrs(arm.attrs()))
                    .put("pat", OpaqueRenderer.pattern(arm.pat()))
                    .put("guard", optional(arm.guard()))
                    .put("body", convert(arm.body()))
                    .build();
    }

    private static Value fieldValue(FieldValue field) {
        return Value.object()
                    .put("attrs", attrs(field.attrs()))
                    .put("member", member(field.member()))
                    .put("expr", convert(field.expr()))
                    .build();
    }

    private static Value member(Member member) {
        if (member instanceof Member.Named named) {
            return Value.object()
                        .put("kind", "Named")
                        .put("name", named.name())
                        .build();
        }
        var unnamed = (Member.Unnamed) member;
        return Value.object()
                    .put("kind", "Unnamed")
                    .put("index", unnamed.index())
                    .build();
    }

    private static Value label(Optional<Label> label) {
        return label.map(l -> Value.of(l.name()))
                    .orElse(Value.NULL);
    }

    private static Value optional(Optional<Expr> expr) {
        return expr.map(ExprConverter::convert)
                   .orElse(Value.NULL);
    }

    private static Value optionalType(Optional<Type> type) {
        return type.map(t -> Value.of(OpaqueRenderer.type(t)))
                   .orElse(Value.NULL);
    }

    private static Value optionalTokens(Optional<TokenStream> tokens) {
        return tokens.map(t -> Value.of(OpaqueRenderer.render(t)))
                     .orElse(Value.NULL);
    }

    private static List<Value> all(List<Expr> exprs) {
        return map(exprs, ExprConverter::convert);
    }

    private static <T> List<Value> map(List<T> items, Function<T, Value> converter) {
        var values = new ArrayList<Value>(items.size());
        for (var item : items) {
            values.add(converter.apply(item));
        }
        return values;
    }
}
