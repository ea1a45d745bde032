package io.htmltpl.core.html;

import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.model.Position;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses the attribute list of a start tag into compiled {@link Attribute}s.
 *
 * <p>Accepted forms: {@code name}, {@code name=value}, {@code name="value"} and {@code
 * name='value'}, separated by whitespace. Quotes are not part of the stored value; the value
 * span covers the text between them. Unquoted values end at whitespace or {@code >}, except
 * inside a placeholder, which is always read through its closing brace.
 */
public final class AttributeParser {

    private final ValueTokenizer tokenizer;

    public AttributeParser(ValueTokenizer tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Parses a standalone attribute list, e.g. {@code href="/u/${id}" disabled}.
     *
     * @param source the attribute list
     * @param start  position of the first character of {@code source}
     * @return the attributes in source order
     * @throws ExpressionCompileException on malformed syntax or a value that does not compile
     */
    public List<Attribute> parse(String source, Position start) {
        SourceCursor cursor = new SourceCursor(source, start);
        List<Attribute> attributes = parseUntilTagEnd(cursor, null, null);
        if (!cursor.atEnd()) {
            throw new ExpressionCompileException("Unexpected '" + cursor.peek() + "' in attribute list", cursor.position());
        }
        return attributes;
    }

    /**
     * Reads attributes until {@code >} or {@code />} (left unconsumed). Inside a tag ({@code
     * tagStart} non-null) running out of input is an error anchored at the tag; otherwise it ends
     * the list.
     */
    List<Attribute> parseUntilTagEnd(SourceCursor cursor, String tagName, Position tagStart) {
        List<Attribute> attributes = new ArrayList<>();
        while (true) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                if (tagStart != null) {
                    throw new ExpressionCompileException(
                            "Unterminated start tag <" + tagName + ">: missing '>'", tagStart);
                }
                return attributes;
            }
            if (cursor.peek() == '>' || cursor.startsWith("/>")) {
                return attributes;
            }
            attributes.add(parseAttribute(cursor));
        }
    }

    private Attribute parseAttribute(SourceCursor cursor) {
        Position nameStart = cursor.position();
        StringBuilder name = new StringBuilder();
        while (!cursor.atEnd() && isNameChar(cursor)) {
            name.append(cursor.next());
        }
        if (name.length() == 0) {
            throw new ExpressionCompileException(
                    "Unexpected '" + cursor.peek() + "' where an attribute name was expected", nameStart);
        }
        Attribute.Builder builder = Attribute.builder().name(name.toString(), nameStart, cursor.position());

        if (cursor.peekNonWhitespace() != '=') {
            return builder.build();
        }
        cursor.skipWhitespace();
        cursor.next();
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw new ExpressionCompileException("Missing value for attribute '" + name + "'", cursor.position());
        }

        char quote = cursor.peek();
        if (quote == '"' || quote == '\'') {
            Position quotePos = cursor.position();
            cursor.next();
            Position valueStart = cursor.position();
            int from = cursor.index();
            // a quote inside a placeholder belongs to the expression
            while (!cursor.atEnd() && cursor.peek() != quote) {
                if (!cursor.skipClosedPlaceholder()) {
                    cursor.next();
                }
            }
            if (cursor.atEnd()) {
                throw new ExpressionCompileException(
                        "Unterminated value for attribute '" + name + "': missing " + quote, quotePos);
            }
            String value = cursor.source().substring(from, cursor.index());
            Position valueEnd = cursor.position();
            cursor.next();
            return builder.value(value, valueStart, valueEnd, tokenizer).build();
        }

        Position valueStart = cursor.position();
        int from = cursor.index();
        while (!cursor.atEnd()
                && !Character.isWhitespace(cursor.peek())
                && cursor.peek() != '>'
                && !cursor.startsWith("/>")) {
            if (!cursor.skipPlaceholder()) {
                cursor.next();
            }
        }
        if (cursor.index() == from) {
            throw new ExpressionCompileException("Missing value for attribute '" + name + "'", valueStart);
        }
        String value = cursor.source().substring(from, cursor.index());
        return builder.value(value, valueStart, cursor.position(), tokenizer).build();
    }

    private static boolean isNameChar(SourceCursor cursor) {
        char c = cursor.peek();
        if (Character.isWhitespace(c) || c == '=' || c == '>' || c == '"' || c == '\'' || c == '<') {
            return false;
        }
        return !(c == '/' && cursor.peek(1) == '>');
    }
}
