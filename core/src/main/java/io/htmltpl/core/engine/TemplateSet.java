package io.htmltpl.core.engine;

import io.htmltpl.core.error.TemplateNotFoundException;
import io.htmltpl.core.spi.Template;
import io.htmltpl.core.spi.TemplateManager;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of compiled templates, keyed by name.
 *
 * <p>This is the unit of atomic swap in {@link HtmlRenderer#reload()}: a reload builds a new set
 * and swaps it in, while renders that already captured the old set finish with it.
 */
public final class TemplateSet implements TemplateManager {

    private final Map<String, Template> templates;

    private TemplateSet(Map<String, Template> templates) {
        this.templates = Collections.unmodifiableMap(new TreeMap<>(templates));
    }

    public static TemplateSet empty() {
        return new TemplateSet(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws TemplateNotFoundException if no template has that name
     */
    @Override
    public Template getTemplate(String name) {
        Template template = name == null ? null : templates.get(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }

    public boolean contains(String name) {
        return name != null && templates.containsKey(name);
    }

    /** Template names, sorted. */
    public Set<String> names() {
        return templates.keySet();
    }

    public int size() {
        return templates.size();
    }

    @Override
    public String toString() {
        return "TemplateSet" + templates.keySet();
    }

    /** Collects templates for a {@link TemplateSet}. A later template replaces an earlier one of the same name. */
    public static final class Builder {

        private final Map<String, Template> templates = new TreeMap<>();

        Builder() {}

        public Builder add(String name, Template template) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("template name must not be null or empty");
            }
            if (template == null) {
                throw new NullPointerException("template must not be null");
            }
            templates.put(name, template);
            return this;
        }

        public Builder add(HtmlTemplate template) {
            return add(template.name(), template);
        }

        public TemplateSet build() {
            return new TemplateSet(templates);
        }
    }
}
