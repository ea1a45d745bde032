package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/**
 * Abstract base for all html-tpl exceptions. Never thrown directly; use the concrete subclasses
 * under {@link TemplateLoadException} or {@link TemplateRenderException}.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        RENDER
    }

    private final transient Position position;
    private final String detail;
    private final Phase phase;

    protected TemplateException(String detail, Position position, Phase phase) {
        super(format(detail, position));
        this.detail = detail;
        this.position = position;
        this.phase = phase;
    }

    protected TemplateException(String detail, Throwable cause, Position position, Phase phase) {
        super(format(detail, position), cause);
        this.detail = detail;
        this.position = position;
        this.phase = phase;
    }

    /** Where in the template the error was detected, or {@code null} if not tied to a location. */
    public Position position() {
        return position;
    }

    /** Human-readable error description, without the position suffix. */
    public String detail() {
        return detail;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    private static String format(String detail, Position position) {
        return position != null ? detail + " (at " + position + ")" : detail;
    }
}
