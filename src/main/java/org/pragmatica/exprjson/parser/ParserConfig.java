package org.pragmatica.exprjson.parser;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest allowed nesting; deeper input fails with a nesting error instead of
 *                        exhausting the stack. Each parenthesis, prefix operator, block, pattern and
 *                        type nesting costs one level, as does every binary operator, cast, range,
 *                        assignment, call, index, field access, method call and {@code ?} applied to
 *                        an operand, since each of them wraps the tree built so far
 */
public record ParserConfig(int maxNestingDepth) {
    public static final ParserConfig DEFAULT = new ParserConfig(256);

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(depth);
    }
}
