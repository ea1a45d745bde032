package io.htmltpl.core.error;

import io.htmltpl.core.model.Position;

/** Thrown when a placeholder is unterminated or its expression fails to compile. */
public final class ExpressionCompileException extends TemplateLoadException {

    private static final long serialVersionUID = 1L;

    public ExpressionCompileException(String detail, Position position) {
        super(detail, position, null);
    }

    public ExpressionCompileException(String detail, Throwable cause, Position position) {
        super(detail, cause, position, null);
    }

    public ExpressionCompileException(String detail, Throwable cause, Position position, String source) {
        super(detail, cause, position, source);
    }

    /**
     * Returns a copy of this exception attributed to a template. The tokenizer does not know which
     * template it is compiling; the loader attaches the name on the way out.
     *
     * @param source template name or file path
     * @return the attributed copy, sharing this exception's cause and stack trace
     */
    public ExpressionCompileException withSource(String source) {
        ExpressionCompileException copy = new ExpressionCompileException(detail(), getCause(), position(), source);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
