package org.noteg.lang.interpreter;

import org.noteg.lang.ast.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runtime values. The set is closed; consumers switch over {@link #kind()}.
 */
public sealed interface Value {

    enum Kind {
        NULL("null"),
        BOOL("bool"),
        NUMBER("number"),
        STRING("string"),
        ARRAY("array"),
        RECORD("record"),
        CLOSURE("function"),
        BUILTIN("function");

        private final String typeName;

        Kind(String typeName) {
            this.typeName = typeName;
        }

        /**
         * Name reported by the {@code type} builtin and used in error messages.
         */
        public String typeName() {
            return typeName;
        }
    }

    Kind kind();

    /**
     * Text form used by {@code print}, {@code str} and string templates.
     */
    String display();

    default String typeName() {
        return kind().typeName();
    }

    static Value of(Object literal) {
        if (literal == null) {
            return NullValue.INSTANCE;
        }
        if (literal instanceof Boolean bool) {
            return BoolValue.of(bool);
        }
        if (literal instanceof Double number) {
            return new NumberValue(number);
        }
        if (literal instanceof String string) {
            return new StringValue(string);
        }
        throw new IllegalArgumentException("Unsupported literal: " + literal.getClass().getName());
    }

    final class NullValue implements Value {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public Kind kind() {
            return Kind.NULL;
        }

        @Override
        public String display() {
            return "null";
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BoolValue(boolean value) implements Value {
        public static final BoolValue TRUE = new BoolValue(true);
        public static final BoolValue FALSE = new BoolValue(false);

        public static BoolValue of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public String display() {
            return Boolean.toString(value);
        }
    }

    record NumberValue(double value) implements Value {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String display() {
            return formatNumber(value);
        }

        public boolean isInteger() {
            return !Double.isInfinite(value) && value == Math.rint(value);
        }
    }

    record StringValue(String value) implements Value {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String display() {
            return value;
        }
    }

    record ArrayValue(List<Value> elements) implements Value {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }

        @Override
        public String display() {
            return elements.stream()
                           .map(Value::display)
                           .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    /**
     * Record value; fields keep insertion order.
     */
    record RecordValue(Map<String, Value> fields) implements Value {
        public RecordValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }

        @Override
        public String display() {
            if (fields.isEmpty()) {
                return "{}";
            }
            return fields.entrySet()
                         .stream()
                         .map(entry -> entry.getKey() + ": " + entry.getValue().display())
                         .collect(Collectors.joining(", ", "{ ", " }"));
        }

        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    /**
     * Function value paired with the environment it was defined in.
     */
    record Closure(List<String> parameters, Expr body, Environment environment) implements Value {
        public Closure {
            parameters = List.copyOf(parameters);
        }

        @Override
        public Kind kind() {
            return Kind.CLOSURE;
        }

        @Override
        public String display() {
            return "<fn(" + String.join(", ", parameters) + ")>";
        }

        @Override
        public boolean equals(Object other) {
            return this == other;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }

        @Override
        public String toString() {
            return display();
        }
    }

    record Builtin(String name, BuiltinFunction function) implements Value {
        @Override
        public Kind kind() {
            return Kind.BUILTIN;
        }

        @Override
        public String display() {
            return "<builtin " + name + ">";
        }
    }

    /**
     * Whole numbers print without a fraction: {@code 6} rather than {@code 6.0}.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
