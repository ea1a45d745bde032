package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/** Thrown when a valueless (boolean) attribute is evaluated as a string. */
public final class NoValueException extends TemplateRenderException {

    private static final long serialVersionUID = 1L;

    private final String attributeName;

    public NoValueException(String attributeName, Position position) {
        super("no value: attribute '" + attributeName + "' has no value", position);
        this.attributeName = attributeName;
    }

    /** The attribute that was evaluated. */
    public String attributeName() {
        return attributeName;
    }
}
