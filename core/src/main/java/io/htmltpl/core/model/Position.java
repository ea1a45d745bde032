package io.htmltpl.core.model;

/**
 * A location in template source. Stamped on every token and attribute span so that compile and
 * evaluation errors can point at the offending text.
 *
 * <p>Immutable. Ordered by {@link #offset()}.
 *
 * @param offset 0-based character offset into the source
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record Position(int offset, int line, int column) implements Comparable<Position> {

    /** The first character of a source. */
    public static final Position START = new Position(0, 1, 1);

    public Position {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based, got: " + line + ":" + column);
        }
    }

    /**
     * Returns the position just past {@code c}. A newline moves to column 1 of the next line.
     *
     * @param c the character being consumed
     * @return the next position
     */
    public Position advance(char c) {
        if (c == '\n') {
            return new Position(offset + 1, line + 1, 1);
        }
        return new Position(offset + 1, line, column + 1);
    }

    /**
     * Returns the position just past every character of {@code text}.
     *
     * @param text the consumed text
     * @return the position after {@code text}
     */
    public Position advance(CharSequence text) {
        Position pos = this;
        for (int i = 0; i < text.length(); i++) {
            pos = pos.advance(text.charAt(i));
        }
        return pos;
    }

    @Override
    public int compareTo(Position other) {
        return Integer.compare(offset, other.offset);
    }

    /** Canonical form {@code line:column}. */
    @Override
    public String toString() {
        return line + ":" + column;
    }
}
