package com.stage.composition.core;

/**
 * Runtime exception thrown by the parser when a prim body cannot be delimited,
 * typically an opening brace without a matching closing brace.
 */
public class MalformedSourceException extends RuntimeException {

    private final int offset;

    public MalformedSourceException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    /**
     * Offset in the source text where the malformed construct starts.
     */
    public int getOffset() {
        return offset;
    }
}
