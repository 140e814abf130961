package com.stage.composition.core.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One exact revision of a layer's text.
 * Each instance gets a fresh generation id; spans parsed from it are only
 * valid against an instance with the same generation.
 */
public final class SourceText {

    private static final AtomicLong GENERATIONS = new AtomicLong();

    private final String text;
    private final long generation;

    private SourceText(String text, long generation) {
        this.text = text;
        this.generation = generation;
    }

    /**
     * Wraps the given text in a new generation. A null text is treated as empty.
     */
    public static SourceText of(String text) {
        return new SourceText(text != null ? text : "", GENERATIONS.incrementAndGet());
    }

    public String text() {
        return text;
    }

    public long generation() {
        return generation;
    }

    public int length() {
        return text.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceText that = (SourceText) o;
        return generation == that.generation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(generation);
    }

    @Override
    public String toString() {
        return "SourceText{generation=" + generation + ", length=" + text.length() + '}';
    }
}
