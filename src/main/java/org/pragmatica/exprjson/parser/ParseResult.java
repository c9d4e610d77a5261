package org.pragmatica.exprjson.parser;

import org.pragmatica.exprjson.error.ParseError;
import org.pragmatica.exprjson.tree.Expr;

import java.util.function.Function;

/**
 * Result of parsing an expression - either success with a tree or failure with an error.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed tree. Throws {@link IllegalStateException} on failure.
     */
    Expr unwrap();

    <R> R fold(Function<ParseError, R> onFailure, Function<Expr, R> onSuccess);

    /**
     * Successful parse.
     */
    record Success(Expr expr) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Expr unwrap() {
            return expr;
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<Expr, R> onSuccess) {
            return onSuccess.apply(expr);
        }
    }

    /**
     * Failed parse.
     */
    record Failure(ParseError error) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Expr unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message() + " at " + error.span().start());
        }

        @Override
        public <R> R fold(Function<ParseError, R> onFailure, Function<Expr, R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
