package com.stage.composition.parse;

/**
 * Lexical scanning helpers shared by the prim parser and the change-log parser.
 * Quoted strings (single, double and triple-quoted, with backslash escapes) and
 * {@code #} line comments are skipped, so delimiters inside them never count.
 */
public final class BraceScanner {

    private BraceScanner() {
    }

    /**
     * Finds the delimiter closing the one at {@code openIndex}.
     *
     * @return the offset of the matching close delimiter, or -1 when the text ends first
     */
    public static int findMatching(String text, int openIndex, char open, char close) {
        int depth = 0;
        int i = openIndex;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
            } else if (c == '#') {
                i = skipComment(text, i);
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    public static int findMatchingBrace(String text, int openIndex) {
        return findMatching(text, openIndex, '{', '}');
    }

    /**
     * Skips a quoted string starting at {@code quoteIndex}.
     *
     * @return the offset of the closing quote, or the last offset of the text when unterminated
     */
    public static int skipString(String text, int quoteIndex) {
        char quote = text.charAt(quoteIndex);
        int length = text.length();
        if (isTripleQuote(text, quoteIndex, quote)) {
            int i = quoteIndex + 3;
            while (i < length) {
                if (text.charAt(i) == '\\') {
                    i += 2;
                    continue;
                }
                if (isTripleQuote(text, i, quote)) {
                    return i + 2;
                }
                i++;
            }
            return length - 1;
        }
        int i = quoteIndex + 1;
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i;
            }
            i++;
        }
        return length - 1;
    }

    /**
     * Skips a {@code #} comment.
     *
     * @return the offset of the terminating newline, or the last offset of the text
     */
    public static int skipComment(String text, int hashIndex) {
        int newline = text.indexOf('\n', hashIndex);
        return newline >= 0 ? newline : text.length() - 1;
    }

    /**
     * Offset of the next non-whitespace character at or after {@code from}, or the text length.
     */
    public static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isTripleQuote(String text, int index, char quote) {
        return index + 2 < text.length()
                && text.charAt(index) == quote
                && text.charAt(index + 1) == quote
                && text.charAt(index + 2) == quote;
    }
}
