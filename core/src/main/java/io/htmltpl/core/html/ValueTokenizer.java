package io.htmltpl.core.html;

import io.htmltpl.core.error.ExpressionCompileException;
import io.htmltpl.core.model.CodeToken;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.spi.CompiledExpression;
import io.htmltpl.core.spi.ExpressionEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Splits a raw value into literal text and <code>${...}</code> placeholders, compiling each
 * placeholder with the configured {@link ExpressionEngine}.
 *
 * <p>Nested placeholders are not supported: the first <code>}</code> after a <code>${</code>
 * closes it. Whether an empty placeholder is legal is up to the engine.
 *
 * <p>Thread-safe: holds only the (thread-safe) engine.
 */
public final class ValueTokenizer {

    /** Opening delimiter. */
    public static final String CODE_OPEN = "${";

    /** Closing delimiter. */
    public static final String CODE_CLOSE = "}";

    private final ExpressionEngine engine;

    public ValueTokenizer(ExpressionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /** The engine placeholders are compiled with. */
    public ExpressionEngine engine() {
        return engine;
    }

    /**
     * Tokenizes {@code value}.
     *
     * @param value the raw value
     * @param start position of the first character of {@code value}
     * @return the tokens in source order, or an empty list if {@code value} holds no placeholder
     * @throws ExpressionCompileException if a placeholder is unterminated (anchored at its
     *     <code>${</code>) or its expression does not compile
     */
    public List<CodeToken> tokenize(String value, Position start) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(start, "start");

        int open = value.indexOf(CODE_OPEN);
        if (open < 0) {
            return List.of();
        }

        List<CodeToken> tokens = new ArrayList<>();
        int cursor = 0;
        Position pos = start;
        while (open >= 0) {
            if (open > cursor) {
                String text = value.substring(cursor, open);
                Position end = pos.advance(text);
                tokens.add(new CodeToken.Literal(text, pos, end));
                pos = end;
            }

            Position openEnd = pos.advance(CODE_OPEN);
            int close = value.indexOf(CODE_CLOSE, open + CODE_OPEN.length());
            if (close < 0) {
                throw new ExpressionCompileException("Unterminated expression: missing '" + CODE_CLOSE + "'", pos);
            }
            tokens.add(new CodeToken.CodeStart(pos, openEnd));

            String source = value.substring(open + CODE_OPEN.length(), close);
            CompiledExpression expression = engine.compile(source, openEnd);
            tokens.add(new CodeToken.CodeValue(expression, source, openEnd));

            Position closeStart = openEnd.advance(source);
            Position closeEnd = closeStart.advance(CODE_CLOSE);
            tokens.add(new CodeToken.CodeEnd(closeStart, closeEnd));

            pos = closeEnd;
            cursor = close + CODE_CLOSE.length();
            open = value.indexOf(CODE_OPEN, cursor);
        }

        if (cursor < value.length()) {
            String text = value.substring(cursor);
            tokens.add(new CodeToken.Literal(text, pos, pos.advance(text)));
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Rebuilds the value syntax from its tokens: literal text as-is, each placeholder as
     * <code>${</code> + source + <code>}</code>. For tokens produced by {@link #tokenize} this
     * returns the original value.
     *
     * @param tokens tokens in source order
     * @return the reconstructed value
     */
    public static String reconstruct(List<CodeToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (CodeToken token : tokens) {
            switch (token.kind()) {
                case LITERAL -> sb.append(((CodeToken.Literal) token).text());
                case CODE_START -> sb.append(CODE_OPEN);
                case CODE_VALUE -> sb.append(((CodeToken.CodeValue) token).source());
                case CODE_END -> sb.append(CODE_CLOSE);
                case BEG_END -> {
                    // zero width
                }
            }
        }
        return sb.toString();
    }
}
