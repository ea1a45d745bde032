package io.htmltpl.core.error;

/** Thrown when a template is requested by a name the manager does not know. */
public final class TemplateNotFoundException extends TemplateRenderException {

    private static final long serialVersionUID = 1L;

    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super("template not found: '" + templateName + "'", null);
        this.templateName = templateName;
    }

    /** The requested name. */
    public String templateName() {
        return templateName;
    }
}
