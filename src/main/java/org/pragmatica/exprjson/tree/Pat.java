package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

/**
 * A pattern. Patterns are validated by the parser but only their tokens are retained.
 */
public record Pat(TokenStream tokens) {}
