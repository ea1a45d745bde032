package io.htmltpl.core.spi;

import io.htmltpl.core.model.Position;

/**
 * Pluggable expression language behind {@code ${...}} placeholders. Implementations provide a
 * specific grammar (dotted paths, JSLT, ...) and are registered with the engine via {@code
 * EngineRegistry.register()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "path"}, {@code "jslt"}. Used in configuration to
     * select the engine templates are compiled with.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the text between <code>${</code> and <code>}</code> into an immutable, thread-safe handle.
     *
     * @param expression the expression source, possibly empty
     * @param start      position of the first character of {@code expression} in the template
     * @return a compiled expression ready for evaluation
     * @throws io.htmltpl.core.error.ExpressionCompileException if the expression has syntax
     *     errors; the exception carries the offending position
     */
    CompiledExpression compile(String expression, Position start);
}
