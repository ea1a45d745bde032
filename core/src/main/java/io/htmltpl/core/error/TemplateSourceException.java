package io.htmltpl.core.error;

/** Thrown when a template file or directory cannot be read. */
public final class TemplateSourceException extends TemplateLoadException {

    private static final long serialVersionUID = 1L;

    public TemplateSourceException(String detail, String source) {
        super(detail, null, source);
    }

    public TemplateSourceException(String detail, Throwable cause, String source) {
        super(detail, cause, null, source);
    }
}
