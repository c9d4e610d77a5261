package org.pragmatica.exprjson;

import org.pragmatica.exprjson.convert.ExprConverter;
import org.pragmatica.exprjson.emit.JsonEmitter;
import org.pragmatica.exprjson.error.Diagnostic;
import org.pragmatica.exprjson.parser.ParseResult;
import org.pragmatica.exprjson.parser.Parser;
import org.pragmatica.exprjson.parser.ParserConfig;
import org.pragmatica.exprjson.tree.Expr;
import org.pragmatica.exprjson.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for converting Rust expressions to canonical JSON.
 *
 * <p>Example usage:
 * <pre>{@code
 * var json = ExprJson.toJson("1 + 2 * 3");
 *
 * var result = ExprJson.parse("foo.bar(baz)");
 * var value = ExprJson.toValue(result.unwrap());
 * }</pre>
 */
public final class ExprJson {
    private static final Logger log = LoggerFactory.getLogger(ExprJson.class);

    private ExprJson() {}

    /**
     * Parse expression text with the default configuration.
     */
    public static ParseResult parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(String source, ParserConfig config) {
        long started = System.nanoTime();
        var result = Parser.create(config).parse(source);
        long micros = (System.nanoTime() - started) / 1_000;
        if (result instanceof ParseResult.Failure failure) {
            log.debug("Parse of {} characters failed after {} us: {}",
                      source.length(), micros, Diagnostic.of(failure.error()).formatSimple());
        } else {
            log.debug("Parsed {} characters in {} us", source.length(), micros);
        }
        return result;
    }

    /**
     * Convert an already parsed tree.
     */
    public static Value toValue(Expr expr) {
        return ExprConverter.convert(expr);
    }

    /**
     * Parse and convert.
     *
     * @throws IllegalArgumentException when the source does not parse; the message is the diagnostic
     */
    public static Value toValue(String source) {
        return parse(source).fold(error -> {
                                      throw new IllegalArgumentException(Diagnostic.of(error).formatSimple());
                                  },
                                  ExprConverter::convert);
    }

    /**
     * Parse, convert and pretty-print.
     */
    public static String toJson(String source) {
        return toJson(source, true);
    }

    /**
     * Parse, convert and print.
     *
     * @throws IllegalArgumentException when the source does not parse
     * @throws org.pragmatica.exprjson.emit.EmitException when the value cannot be written
     */
    public static String toJson(String source, boolean pretty) {
        return JsonEmitter.emit(toValue(source), pretty);
    }
}
