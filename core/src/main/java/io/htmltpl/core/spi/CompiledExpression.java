package io.htmltpl.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.htmltpl.core.model.Position;
import io.htmltpl.core.model.Scope;

/**
 * An immutable, thread-safe compiled expression handle. Produced by {@link
 * ExpressionEngine#compile(String, Position)} and evaluated once per render.
 *
 * <p>Implementations MUST be thread-safe: a single {@code CompiledExpression} is shared by every
 * concurrent render of its template, each with its own {@link Scope}.
 */
@FunctionalInterface
public interface CompiledExpression {

    /**
     * Evaluates this expression against the given bindings.
     *
     * @param scope the render's bindings; never retained
     * @param start position of the expression in the template, used to anchor errors
     * @return the value; its text form is what ends up in the output
     * @throws io.htmltpl.core.error.ExpressionEvalException if evaluation fails (missing binding,
     *     type mismatch)
     */
    JsonNode evaluate(Scope scope, Position start);
}
