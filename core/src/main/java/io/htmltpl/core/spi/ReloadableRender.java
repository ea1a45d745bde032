package io.htmltpl.core.spi;

/** An {@link HtmlRender} whose template set can be rebuilt while serving. */
public interface ReloadableRender extends HtmlRender {

    /**
     * Rebuilds the template set and swaps it in atomically. On failure the previous set stays
     * active and the failure is rethrown.
     *
     * @throws io.htmltpl.core.error.TemplateLoadException if the rebuild fails
     */
    void reload();
}
