package io.htmltpl.core.spi;

/**
 * Builds a {@link TemplateManager} from template sources. Called once at startup and again on
 * every reload, or on every render when hot reload is on.
 */
@FunctionalInterface
public interface TemplateFactory {

    /**
     * @return a freshly built manager
     * @throws io.htmltpl.core.error.TemplateLoadException if a template fails to load or compile
     */
    TemplateManager create();
}
