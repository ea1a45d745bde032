package io.htmltpl.core.html;

import io.htmltpl.core.model.Position;

/** Forward-only reader over template source that keeps the current {@link Position} in step. */
final class SourceCursor {

    private final String source;
    private int index;
    private Position position;

    SourceCursor(String source, Position start) {
        this.source = source;
        this.index = 0;
        this.position = start;
    }

    String source() {
        return source;
    }

    int index() {
        return index;
    }

    Position position() {
        return position;
    }

    boolean atEnd() {
        return index >= source.length();
    }

    char peek() {
        return source.charAt(index);
    }

    /** Returns the character {@code ahead} places past the current one, or 0 past the end. */
    char peek(int ahead) {
        int i = index + ahead;
        return i < source.length() ? source.charAt(i) : 0;
    }

    boolean startsWith(String prefix) {
        return source.startsWith(prefix, index);
    }

    char next() {
        char c = source.charAt(index++);
        position = position.advance(c);
        return c;
    }

    /** Consumes up to (not including) {@code end}, a source index. */
    String advanceTo(int end) {
        String text = source.substring(index, end);
        index = end;
        position = position.advance(text);
        return text;
    }

    /** Consumes {@code count} characters. */
    String skip(int count) {
        return advanceTo(Math.min(index + count, source.length()));
    }

    /** Index of {@code needle} at or after the cursor, or -1. */
    int indexOf(String needle) {
        return source.indexOf(needle, index);
    }

    /** Returns the first non-whitespace character at or after the cursor without consuming, or 0. */
    char peekNonWhitespace() {
        int i = index;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i < source.length() ? source.charAt(i) : 0;
    }

    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            next();
        }
    }

    /**
     * If the cursor sits on a <code>${</code>, consumes the placeholder through its closing brace
     * (or to the end when unterminated, leaving the tokenizer to report it).
     *
     * @return {@code true} if a placeholder was consumed
     */
    boolean skipPlaceholder() {
        if (!startsWith(ValueTokenizer.CODE_OPEN)) {
            return false;
        }
        int close = source.indexOf(ValueTokenizer.CODE_CLOSE, index + ValueTokenizer.CODE_OPEN.length());
        advanceTo(close < 0 ? source.length() : close + ValueTokenizer.CODE_CLOSE.length());
        return true;
    }

    /**
     * Like {@link #skipPlaceholder()}, but consumes only a placeholder that has a closing brace.
     *
     * @return {@code true} if a placeholder was consumed
     */
    boolean skipClosedPlaceholder() {
        if (!startsWith(ValueTokenizer.CODE_OPEN)) {
            return false;
        }
        int close = source.indexOf(ValueTokenizer.CODE_CLOSE, index + ValueTokenizer.CODE_OPEN.length());
        if (close < 0) {
            return false;
        }
        advanceTo(close + ValueTokenizer.CODE_CLOSE.length());
        return true;
    }
}
