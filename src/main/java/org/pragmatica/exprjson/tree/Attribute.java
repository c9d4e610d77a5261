package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

/**
 * Outer {@code #[...]} or inner {@code #![...]} attribute, kept as tokens.
 */
public record Attribute(TokenStream tokens, boolean inner) {}
