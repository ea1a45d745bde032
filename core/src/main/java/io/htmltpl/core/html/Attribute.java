package io.htmltpl.core.html;

import io.htmltpl.core.error.NoValueException;
import io.htmltpl.core.model.CodeToken;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A compiled markup attribute: a name, an optional raw value and, when the value embeds
 * <code>${...}</code> placeholders, the value's compiled tokens.
 *
 * <p>Built once through {@link #builder()} and never mutated afterwards. {@link
 * #evaluate(Scope)} only reads the compiled tokens, so one attribute may be evaluated by any
 * number of concurrent renders.
 */
public final class Attribute {

    private final String name;
    private final Position nameStart;
    private final Position nameEnd;
    private final String value;
    private final Position valueStart;
    private final Position valueEnd;
    private final List<CodeToken> valueTokens;

    private Attribute(Builder b) {
        this.name = b.name;
        this.nameStart = b.nameStart;
        this.nameEnd = b.nameEnd;
        this.value = b.value;
        this.valueStart = b.valueStart;
        this.valueEnd = b.valueEnd;
        this.valueTokens = Collections.unmodifiableList(new ArrayList<>(b.valueTokens));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public Position nameStart() {
        return nameStart;
    }

    public Position nameEnd() {
        return nameEnd;
    }

    /** The raw value, or {@code null} for a valueless (boolean) attribute. */
    public String value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    /** Start of the value span, or {@code null} without a value. */
    public Position valueStart() {
        return valueStart;
    }

    /** End of the value span, or {@code null} without a value. */
    public Position valueEnd() {
        return valueEnd;
    }

    /** Compiled value tokens; empty when the value is pure literal text. */
    public List<CodeToken> valueTokens() {
        return valueTokens;
    }

    /**
     * Evaluates the value against {@code scope}.
     *
     * <p>A value without placeholders is returned as-is and the scope is not consulted, so a
     * {@code null} scope is fine there.
     *
     * @param scope the render's bindings
     * @return the expanded value
     * @throws NoValueException if this attribute has no value
     * @throws io.htmltpl.core.error.ExpressionEvalException if a placeholder fails to evaluate
     */
    public String evaluate(Scope scope) {
        return evaluate(scope, UnaryOperator.identity());
    }

    /**
     * Same as {@link #evaluate(Scope)}, passing each placeholder result through {@code escaper}.
     * Literal text, including the whole of a placeholder-free value, is returned untouched.
     */
    public String evaluate(Scope scope, UnaryOperator<String> escaper) {
        if (value == null) {
            throw new NoValueException(name, nameStart);
        }
        if (valueTokens.isEmpty()) {
            return value;
        }
        return ValueEvaluator.evaluate(valueTokens, scope, escaper);
    }

    /**
     * Writes the attribute in its minimal syntactic form: a space, the name and, if there is a
     * value, {@code =} followed by the raw value. Never evaluates anything.
     *
     * @param out the sink
     * @throws IOException if the sink fails
     */
    public void print(Writer out) throws IOException {
        out.write(" " + name);
        if (value != null) {
            out.write("=" + value);
        }
    }

    /** Position-inclusive debug form, {@code nameStart|name|nameEnd[=valueStart|value|valueEnd]}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(nameStart).append('|').append(name).append('|').append(nameEnd);
        if (value != null) {
            sb.append('=')
                    .append(valueStart)
                    .append('|')
                    .append(value)
                    .append('|')
                    .append(valueEnd);
        }
        return sb.toString();
    }

    /** Builder for {@link Attribute}. */
    public static final class Builder {

        private String name;
        private Position nameStart;
        private Position nameEnd;
        private String value;
        private Position valueStart;
        private Position valueEnd;
        private List<CodeToken> valueTokens = List.of();

        Builder() {}

        /**
         * Sets the name and its span.
         *
         * @return this builder (fluent)
         */
        public Builder name(String name, Position start, Position end) {
            this.name = name;
            this.nameStart = start;
            this.nameEnd = end;
            return this;
        }

        /**
         * Sets a raw value and its span. Leaves the tokens alone; use {@link #value(String,
         * Position, Position, ValueTokenizer)} to compile placeholders.
         *
         * @return this builder (fluent)
         */
        public Builder value(String value, Position start, Position end) {
            this.value = value;
            this.valueStart = start;
            this.valueEnd = end;
            return this;
        }

        /**
         * Sets a raw value and its span, and compiles its placeholders.
         *
         * @return this builder (fluent)
         * @throws io.htmltpl.core.error.ExpressionCompileException if the value does not compile
         */
        public Builder value(String value, Position start, Position end, ValueTokenizer tokenizer) {
            value(value, start, end);
            this.valueTokens = tokenizer.tokenize(value, start);
            return this;
        }

        /**
         * Sets pre-built value tokens.
         *
         * @return this builder (fluent)
         */
        public Builder valueTokens(List<CodeToken> tokens) {
            this.valueTokens = Objects.requireNonNull(tokens, "tokens");
            return this;
        }

        /**
         * Builds the immutable attribute.
         *
         * @throws IllegalStateException if the name is blank, a span is missing, or tokens were
         *     given without a value
         */
        public Attribute build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("attribute name must not be blank");
            }
            if (nameStart == null || nameEnd == null) {
                throw new IllegalStateException("attribute '" + name + "' is missing its name span");
            }
            if (value != null && (valueStart == null || valueEnd == null)) {
                throw new IllegalStateException("attribute '" + name + "' is missing its value span");
            }
            if (value == null && !valueTokens.isEmpty()) {
                throw new IllegalStateException("attribute '" + name + "' has value tokens but no value");
            }
            return new Attribute(this);
        }
    }
}
