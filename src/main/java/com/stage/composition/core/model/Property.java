package com.stage.composition.core.model;

import java.util.Objects;

/**
 * A property declared on a prim.
 *
 * @param name     declared name, including its namespace (e.g. {@code primvars:status})
 * @param typeName declared type token (e.g. {@code token}, {@code float}, {@code color3f[]})
 * @param custom   whether the declaration carries the {@code custom} keyword
 * @param rawValue value text exactly as written, or a canonical rendering for synthesized properties
 * @param value    typed value
 */
public record Property(
        String name,
        String typeName,
        boolean custom,
        String rawValue,
        PropertyValue value
) {
    public Property {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(value, "value is required");
        if (typeName == null) {
            typeName = value.typeName();
        }
        if (rawValue == null) {
            rawValue = value.asText();
        }
    }

    /**
     * Creates a custom property whose declared type follows the value.
     */
    public static Property of(String name, PropertyValue value) {
        return new Property(name, value.typeName(), true, null, value);
    }

    public static Property of(String name, String value) {
        return of(name, PropertyValue.of(value));
    }

    /**
     * Returns a copy carrying the given name.
     */
    public Property withName(String newName) {
        return new Property(newName, typeName, custom, rawValue, value);
    }

    public String asText() {
        return value.asText();
    }
}
