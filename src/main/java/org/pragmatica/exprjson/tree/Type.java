package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

/**
 * A type. Types are validated by the parser but only their tokens are retained.
 */
public record Type(TokenStream tokens) {}
