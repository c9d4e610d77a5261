package org.pragmatica.exprjson.tree;

import org.pragmatica.exprjson.syntax.TokenStream;

/**
 * Loop or block label. {@code name} excludes the leading apostrophe.
 */
public record Label(TokenStream tokens, String name) {}
