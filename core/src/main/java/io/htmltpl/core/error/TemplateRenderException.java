package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/**
 * Abstract parent for per-render errors. Thrown while a compiled value is evaluated against a
 * scope, or while a template is looked up for rendering. Never retried: the caller gets the first
 * error and no output.
 */
public abstract class TemplateRenderException extends TemplateException {

    private static final long serialVersionUID = 1L;

    protected TemplateRenderException(String detail, Position position) {
        super(detail, position, Phase.RENDER);
    }

    protected TemplateRenderException(String detail, Throwable cause, Position position) {
        super(detail, cause, position, Phase.RENDER);
    }
}
