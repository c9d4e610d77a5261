package org.pragmatica.exprjson.emit;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import org.pragmatica.exprjson.value.Value;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Writes canonical values as JSON text, pretty-printed or compact. Object keys keep insertion order.
 */
public final class JsonEmitter {
    // Value depth is bounded by the parser's nesting limit, not by Jackson's default of 1000
    private static final JsonFactory FACTORY = JsonFactory.builder()
                                                          .streamWriteConstraints(StreamWriteConstraints.builder()
                                                                                                        .maxNestingDepth(Integer.MAX_VALUE)
                                                                                                        .build())
                                                          .build();

    private JsonEmitter() {}

    public static String pretty(Value value) {
        return emit(value, true);
    }

    public static String compact(Value value) {
        return emit(value, false);
    }

    /**
     * @throws EmitException when a string is not valid Unicode or the writer fails
     */
    public static String emit(Value value, boolean pretty) {
        var out = new StringWriter();
        try (var generator = FACTORY.createGenerator(out)) {
            if (pretty) {
                generator.setPrettyPrinter(new CanonicalPrettyPrinter());
            }
            write(generator, value);
        } catch (IOException e) {
            throw new EmitException("Failed to write JSON: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static void write(JsonGenerator generator, Value value) throws IOException {
        if (value instanceof Value.Null) {
            generator.writeNull();
        } else if (value instanceof Value.Bool bool) {
            generator.writeBoolean(bool.value());
        } else if (value instanceof Value.Num num) {
            generator.writeNumber(num.value());
        } else if (value instanceof Value.Str str) {
            generator.writeString(checkUnicode(str.value()));
        } else if (value instanceof Value.Arr arr) {
            generator.writeStartArray();
            for (var element : arr.elements()) {
                write(generator, element);
            }
            generator.writeEndArray();
        } else if (value instanceof Value.Obj obj) {
            generator.writeStartObject();
            for (Map.Entry<String, Value> member : obj.members().entrySet()) {
                generator.writeFieldName(checkUnicode(member.getKey()));
                write(generator, member.getValue());
            }
            generator.writeEndObject();
        }
    }

    private static String checkUnicode(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                throw new EmitException("String is not valid Unicode: lone surrogate at index " + i);
            }
        }
        return text;
    }
}
