package io.htmltpl.core.spi;

/** Looks templates up by name. */
public interface TemplateManager {

    /**
     * @param name the template name, e.g. {@code "index.html"} or {@code "users/list.html"}
     * @return the template
     * @throws io.htmltpl.core.error.TemplateNotFoundException if no template has that name
     */
    Template getTemplate(String name);
}
