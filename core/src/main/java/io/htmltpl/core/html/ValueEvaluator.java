package io.htmltpl.core.html;

import com.fasterxml.jackson.databind.JsonNode;
import io.htmltpl.core.model.CodeToken;
import io.htmltpl.core.model.Scope;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Expands a compiled token list against a scope.
 *
 * <p>Evaluation is all-or-nothing: the first failing expression propagates its exception and
 * the partially built string is discarded. Nothing is cached between calls; the compiled tokens
 * are only read, so one token list may be evaluated from many threads at once.
 */
public final class ValueEvaluator {

    private ValueEvaluator() {
        // utility class
    }

    /**
     * Concatenates literal text and the text form of each evaluated expression.
     *
     * @param tokens compiled tokens
     * @param scope  the render's bindings
     * @return the expanded text
     * @throws io.htmltpl.core.error.ExpressionEvalException if an expression fails
     */
    public static String evaluate(List<CodeToken> tokens, Scope scope) {
        return evaluate(tokens, scope, UnaryOperator.identity());
    }

    /**
     * Same as {@link #evaluate(List, Scope)}, passing each expression result through {@code
     * escaper} before it is appended. Literal text is never escaped.
     */
    public static String evaluate(List<CodeToken> tokens, Scope scope, UnaryOperator<String> escaper) {
        Scope bindings = scope != null ? scope : Scope.empty();
        StringBuilder out = new StringBuilder();
        for (CodeToken token : tokens) {
            switch (token.kind()) {
                case LITERAL -> out.append(((CodeToken.Literal) token).text());
                case CODE_VALUE -> {
                    CodeToken.CodeValue code = (CodeToken.CodeValue) token;
                    JsonNode result = code.expression().evaluate(bindings, code.start());
                    out.append(escaper.apply(toText(result)));
                }
                case BEG_END, CODE_START, CODE_END -> {
                    // structural only
                }
            }
        }
        return out.toString();
    }

    /**
     * Default text form of an expression result: the raw text of a string, the JSON form of
     * anything else ({@code 1}, {@code true}, {@code null}, <code>{"a":1}</code>).
     */
    public static String toText(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "null";
        }
        return value.isTextual() ? value.asText() : value.toString();
    }
}
