package org.pragmatica.exprjson.tree;

/**
 * {@code ..} or {@code ..=}.
 */
public enum RangeLimits {
    HALF_OPEN,
    CLOSED
}
