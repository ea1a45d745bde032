package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/**
 * Abstract parent for compile-time errors, thrown while a template or attribute value is being
 * tokenized and compiled. Fatal for the template concerned. Carries an additional {@code source}
 * field identifying the template file, when known.
 */
public abstract class TemplateLoadException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected TemplateLoadException(String detail, Position position, String source) {
        super(detail, position, Phase.COMPILE);
        this.source = source;
    }

    protected TemplateLoadException(String detail, Throwable cause, Position position, String source) {
        super(detail, cause, position, Phase.COMPILE);
        this.source = source;
    }

    /** The template name or file path that caused the error, or {@code null} if not yet known. */
    public String source() {
        return source;
    }
}
