package com.stage.composition.core;

/**
 * Thrown when caller input is rejected before any mutation is applied:
 * an invalid prim name, a bad stack index, a duplicate layer, an unknown status.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final transient Object value;

    public ValidationException(String message, String field, Object value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public ValidationException(String message) {
        this(message, null, null);
    }

    /**
     * Name of the rejected input, or null when not tied to a single field.
     */
    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }
}
