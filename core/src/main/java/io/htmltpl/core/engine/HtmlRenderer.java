package io.htmltpl.core.engine;

import io.htmltpl.core.error.TemplateException;
import io.htmltpl.core.spi.Render;
import io.htmltpl.core.spi.ReloadableRender;
import io.htmltpl.core.spi.ResponseSink;
import io.htmltpl.core.spi.Template;
import io.htmltpl.core.spi.TemplateFactory;
import io.htmltpl.core.spi.TemplateManager;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders named templates into HTTP responses.
 *
 * <p>Holds the current {@link TemplateManager} in an {@link AtomicReference}. {@link #reload()}
 * builds a new manager with the factory and swaps it in; renders that already looked up their
 * template keep using the old one. In hot-reload mode every {@link #getTemplate} builds a fresh
 * manager instead, which picks up template edits at the cost of a rebuild per request.
 */
public final class HtmlRenderer implements ReloadableRender {

    /** Content type set on responses that have none. */
    public static final String CONTENT_TYPE = "text/html; charset=utf-8";

    private static final Logger LOG = LoggerFactory.getLogger(HtmlRenderer.class);

    private final TemplateFactory factory;
    private final boolean hotReload;
    private final AtomicReference<TemplateManager> managerRef;

    private HtmlRenderer(TemplateFactory factory, boolean hotReload, TemplateManager initial) {
        this.factory = factory;
        this.hotReload = hotReload;
        this.managerRef = new AtomicReference<>(initial);
    }

    /**
     * Builds the initial manager and returns a renderer around it.
     *
     * @param factory   builds managers; called now and on every reload
     * @param hotReload rebuild on every template lookup
     * @throws io.htmltpl.core.error.TemplateLoadException if the initial build fails
     */
    public static HtmlRenderer create(TemplateFactory factory, boolean hotReload) {
        Objects.requireNonNull(factory, "factory");
        TemplateManager initial = Objects.requireNonNull(factory.create(), "factory returned null manager");
        LOG.info("Template renderer created: hotReload={}", hotReload);
        return new HtmlRenderer(factory, hotReload, initial);
    }

    public boolean hotReload() {
        return hotReload;
    }

    /** The manager currently serving lookups (ignored in hot-reload mode). */
    public TemplateManager currentManager() {
        return managerRef.get();
    }

    /**
     * Rebuilds the manager and swaps it in. If the rebuild fails the current manager keeps
     * serving, the failure is logged and rethrown.
     */
    @Override
    public void reload() {
        TemplateManager next;
        try {
            next = Objects.requireNonNull(factory.create(), "factory returned null manager");
        } catch (RuntimeException e) {
            LOG.warn("Template reload failed, keeping previous templates: {}", e.getMessage(), e);
            throw e;
        }
        managerRef.set(next);
        LOG.info("Templates reloaded: {}", next);
    }

    @Override
    public Template getTemplate(String name) {
        TemplateManager manager =
                hotReload ? Objects.requireNonNull(factory.create(), "factory returned null manager") : managerRef.get();
        return manager.getTemplate(name);
    }

    @Override
    public Render instance(String name, Object data) {
        try {
            return new TemplateRender(getTemplate(name), data, null);
        } catch (TemplateException e) {
            return new TemplateRender(null, data, e);
        }
    }

    /** A render bound to a looked-up template, or to the lookup failure. */
    private static final class TemplateRender implements Render {

        private final Template template;
        private final Object data;
        private final TemplateException failure;

        TemplateRender(Template template, Object data, TemplateException failure) {
            this.template = template;
            this.data = data;
            this.failure = failure;
        }

        @Override
        public void render(ResponseSink sink) throws IOException {
            if (failure != null) {
                throw failure;
            }
            writeContentType(sink);
            Writer writer = new OutputStreamWriter(sink.body(), StandardCharsets.UTF_8);
            template.execute(writer, data);
            writer.flush();
        }

        @Override
        public void writeContentType(ResponseSink sink) {
            String current = sink.header("Content-Type");
            if (current == null || current.isEmpty()) {
                sink.header("Content-Type", CONTENT_TYPE);
            }
        }
    }
}
