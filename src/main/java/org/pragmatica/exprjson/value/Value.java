package org.pragmatica.exprjson.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical value - the JSON-shaped output of conversion.
 *
 * <p>Objects keep keys in insertion order. Navigation never throws: a missing key or index yields
 * {@link Null}, so assertions can walk deep paths directly.
 */
public sealed interface Value {

    Null NULL = new Null();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    static Value of(String text) {
        return text == null
               ? NULL
               : new Str(text);
    }

    static Value of(boolean flag) {
        return flag
               ? TRUE
               : FALSE;
    }

    static Value of(long number) {
        return new Num(number);
    }

    static Arr array(List<? extends Value> elements) {
        return new Arr(List.copyOf(elements));
    }

    static ObjBuilder object() {
        return new ObjBuilder();
    }

    /**
     * Member of an object, or {@link #NULL}.
     */
    default Value get(String key) {
        return NULL;
    }

    /**
     * Element of an array, or {@link #NULL}.
     */
    default Value get(int index) {
        return NULL;
    }

    default boolean isNull() {
        return false;
    }

    /**
     * Text of a string value, or null for any other value.
     */
    default String asText() {
        return null;
    }

    /**
     * Elements of an array or members of an object; 0 otherwise.
     */
    default int size() {
        return 0;
    }

    record Null() implements Value {
        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Num(long value) implements Value {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Str(String value) implements Value {
        @Override
        public String asText() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record Arr(List<Value> elements) implements Value {
        public Arr {
            elements = List.copyOf(elements);
        }

        @Override
        public Value get(int index) {
            return index >= 0 && index < elements.size()
                   ? elements.get(index)
                   : NULL;
        }

        @Override
        public int size() {
            return elements.size();
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    record Obj(Map<String, Value> members) implements Value {
        public Obj {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public Value get(String key) {
            return members.getOrDefault(key, NULL);
        }

        @Override
        public int size() {
            return members.size();
        }

        public List<String> keys() {
            return List.copyOf(members.keySet());
        }

        @Override
        public String toString() {
            return members.toString();
        }
    }

    /**
     * Builds an {@link Obj} with keys in call order.
     */
    final class ObjBuilder {
        private final LinkedHashMap<String, Value> members = new LinkedHashMap<>();

        private ObjBuilder() {}

        public ObjBuilder put(String key, Value value) {
            members.put(key, value);
            return this;
        }

        public ObjBuilder put(String key, String text) {
            return put(key, Value.of(text));
        }

        public ObjBuilder put(String key, boolean flag) {
            return put(key, Value.of(flag));
        }

        public ObjBuilder put(String key, long number) {
            return put(key, Value.of(number));
        }

        public ObjBuilder put(String key, List<? extends Value> elements) {
            return put(key, Value.array(elements));
        }

        public Obj build() {
            return new Obj(members);
        }
    }
}
