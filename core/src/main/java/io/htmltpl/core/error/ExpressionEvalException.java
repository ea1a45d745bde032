package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/**
 * Thrown when an expression fails at render time (e.g., missing binding, type error). Aborts the
 * whole value: no partial string is produced.
 */
public final class ExpressionEvalException extends TemplateRenderException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String detail, Position position) {
        super(detail, position);
    }

    public ExpressionEvalException(String detail, Throwable cause, Position position) {
        super(detail, cause, position);
    }
}
