package com.stage.composition.core;

/**
 * Checked exception raised when a span is dereferenced against a text
 * other than the one it was parsed from.
 */
public class StaleSpanException extends Exception {

    private final long spanGeneration;
    private final long textGeneration;

    public StaleSpanException(long spanGeneration, long textGeneration) {
        super("Span from source generation " + spanGeneration
                + " cannot be applied to source generation " + textGeneration);
        this.spanGeneration = spanGeneration;
        this.textGeneration = textGeneration;
    }

    public long getSpanGeneration() {
        return spanGeneration;
    }

    public long getTextGeneration() {
        return textGeneration;
    }
}
