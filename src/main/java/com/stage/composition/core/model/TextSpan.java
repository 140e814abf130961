package com.stage.composition.core.model;

import com.stage.composition.core.StaleSpanException;

/**
 * Byte range of a prim block inside one {@link SourceText} generation.
 *
 * @param generation generation of the text this span was parsed from
 * @param start      offset of the specifier keyword
 * @param openBrace  offset of the opening brace of the body
 * @param end        offset of the matching closing brace (inclusive)
 */
public record TextSpan(long generation, int start, int openBrace, int end) {

    public TextSpan {
        if (start < 0 || openBrace < start || end < openBrace) {
            throw new IllegalArgumentException(
                    "Invalid span offsets start=" + start + " openBrace=" + openBrace + " end=" + end);
        }
    }

    /**
     * Verifies that this span belongs to the given text.
     *
     * @throws StaleSpanException if the text is a different generation
     */
    public void checkAgainst(SourceText source) throws StaleSpanException {
        if (source.generation() != generation) {
            throw new StaleSpanException(generation, source.generation());
        }
    }

    /**
     * Full prim block text, keyword through closing brace.
     */
    public String slice(SourceText source) throws StaleSpanException {
        checkAgainst(source);
        return source.text().substring(start, end + 1);
    }

    /**
     * Text between the braces, exclusive.
     */
    public String body(SourceText source) throws StaleSpanException {
        checkAgainst(source);
        return source.text().substring(openBrace + 1, end);
    }

    /**
     * Returns the source text with this span's block removed.
     */
    public String cut(SourceText source) throws StaleSpanException {
        checkAgainst(source);
        String text = source.text();
        return text.substring(0, start) + text.substring(end + 1);
    }

    /**
     * Returns the source text with this span's block replaced.
     */
    public String replace(SourceText source, String replacement) throws StaleSpanException {
        checkAgainst(source);
        String text = source.text();
        return text.substring(0, start) + replacement + text.substring(end + 1);
    }

    public boolean contains(int offset) {
        return offset >= start && offset <= end;
    }

    public int length() {
        return end - start + 1;
    }
}
