package io.htmltpl.core.spi;

/** Entry point of the render pipeline used by HTTP handlers. */
public interface HtmlRender {

    /**
     * Creates a render for the named template. Lookup errors are not thrown here; they surface
     * from {@link Render#render}.
     *
     * @param name template name
     * @param data render data
     * @return a pending render
     */
    Render instance(String name, Object data);

    /**
     * @param name template name
     * @return the template
     * @throws io.htmltpl.core.error.TemplateException if the lookup (or a hot rebuild) fails
     */
    Template getTemplate(String name);
}
