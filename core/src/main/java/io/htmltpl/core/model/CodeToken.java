package io.htmltpl.core.model;

import io.htmltpl.core.spi.CompiledExpression;
import java.util.Objects;

/**
 * One classified fragment of a tokenized value: literal text, or one of the three parts of an
 * embedded {@code ${...}} expression.
 *
 * <p>Each kind carries only the fields that mean something for it. Tokens are immutable and may
 * be shared across threads.
 */
public sealed interface CodeToken
        permits CodeToken.BegEnd, CodeToken.Literal, CodeToken.CodeStart, CodeToken.CodeValue, CodeToken.CodeEnd {

    /** Token discriminator, for callers that prefer a {@code switch}. */
    enum Kind {
        BEG_END,
        LITERAL,
        CODE_START,
        CODE_VALUE,
        CODE_END
    }

    Kind kind();

    /** Zero-width value boundary. Produces no output. */
    record BegEnd(Position at) implements CodeToken {

        public BegEnd {
            Objects.requireNonNull(at, "at");
        }

        @Override
        public Kind kind() {
            return Kind.BEG_END;
        }
    }

    /** Plain text, copied verbatim to the output. */
    record Literal(String text, Position start, Position end) implements CodeToken {

        public Literal {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }
    }

    /** The opening <code>${</code> delimiter. */
    record CodeStart(Position start, Position end) implements CodeToken {

        public CodeStart {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        @Override
        public Kind kind() {
            return Kind.CODE_START;
        }
    }

    /**
     * A compiled expression.
     *
     * @param expression the compiled handle, evaluated once per render
     * @param source     the expression text between the delimiters
     * @param start      where the expression text begins; anchors evaluation errors
     */
    record CodeValue(CompiledExpression expression, String source, Position start) implements CodeToken {

        public CodeValue {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(start, "start");
        }

        @Override
        public Kind kind() {
            return Kind.CODE_VALUE;
        }
    }

    /** The closing <code>}</code> delimiter. */
    record CodeEnd(Position start, Position end) implements CodeToken {

        public CodeEnd {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        @Override
        public Kind kind() {
            return Kind.CODE_END;
        }
    }
}
