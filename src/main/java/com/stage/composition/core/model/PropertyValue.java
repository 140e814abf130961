package com.stage.composition.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Typed value of a prim property, resolved once at parse time.
 * The set of variants is closed: string, number, boolean, color triple and string array.
 */
public interface PropertyValue {

    /**
     * Plain textual form of the value, as shown to users and compared by the conflict detector.
     */
    String asText();

    /**
     * Declared type written for this value when it is serialized as a custom property.
     */
    String typeName();

    static PropertyValue of(String value) {
        return new StringValue(value);
    }

    static PropertyValue of(double value) {
        return new NumberValue(value);
    }

    static PropertyValue of(boolean value) {
        return new BoolValue(value);
    }

    record StringValue(String value) implements PropertyValue {
        public StringValue {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    record NumberValue(double value) implements PropertyValue {
        @Override
        public String asText() {
            return formatNumber(value);
        }

        @Override
        public String typeName() {
            return "float";
        }
    }

    record BoolValue(boolean value) implements PropertyValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public String typeName() {
            return "bool";
        }
    }

    record ColorValue(double r, double g, double b) implements PropertyValue {
        @Override
        public String asText() {
            return "(" + formatNumber(r) + ", " + formatNumber(g) + ", " + formatNumber(b) + ")";
        }

        @Override
        public String typeName() {
            return "color3f[]";
        }
    }

    record StringArrayValue(List<String> values) implements PropertyValue {
        public StringArrayValue {
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public String asText() {
            return values.stream()
                    .map(v -> "\"" + v + "\"")
                    .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public String typeName() {
            return "string[]";
        }
    }

    /**
     * Formats a number without a trailing {@code .0} for whole values.
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
