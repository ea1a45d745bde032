package io.htmltpl.standalone.server;

import io.htmltpl.core.engine.EngineRegistry;
import io.htmltpl.core.engine.HtmlRenderer;
import io.htmltpl.core.engine.TemplateLoader;
import io.htmltpl.core.spi.ExpressionEngine;
import io.htmltpl.standalone.config.ConfigLoadException;
import io.htmltpl.standalone.config.ConfigLoader;
import io.htmltpl.standalone.config.ServerConfig;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone template server.
 *
 * <ol>
 *   <li>Load configuration (YAML file plus environment overrides)
 *   <li>Configure logging
 *   <li>Resolve the placeholder expression engine
 *   <li>Compile all templates
 *   <li>Start the Javalin HTTP server
 *   <li>Start the file watcher, if enabled
 * </ol>
 *
 * <p>Kept apart from {@link io.htmltpl.standalone.StandaloneMain} so tests can start a server from
 * a {@link ServerConfig} without going through {@code main()}.
 */
public final class TemplateServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateServerApp.class);

    private final Javalin app;
    private final HtmlRenderer renderer;
    private final FileWatcher fileWatcher;
    private final ServerConfig config;

    private TemplateServerApp(Javalin app, HtmlRenderer renderer, FileWatcher fileWatcher, ServerConfig config) {
        this.app = app;
        this.renderer = renderer;
        this.fileWatcher = fileWatcher;
        this.config = config;
    }

    /**
     * Loads configuration from the command line and starts the server.
     *
     * <p>Without {@code --config}, a missing {@value ConfigLoader#DEFAULT_CONFIG_FILE} is not an
     * error: the defaults and environment overrides apply.
     *
     * @param args command-line arguments, e.g. {@code --config path/to/config.yaml}
     * @throws ConfigLoadException if the configuration is invalid
     * @throws IOException if the file watcher cannot be started
     */
    public static TemplateServerApp start(String[] args) throws IOException {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        boolean explicit = Arrays.asList(args).contains("--config");
        ServerConfig config = explicit || Files.exists(configPath)
                ? ConfigLoader.load(configPath)
                : ConfigLoader.fromEnvironment(System::getenv);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        if (explicit || Files.exists(configPath)) {
            LOG.info("Configuration loaded from {}", configPath);
        } else {
            LOG.info("No configuration file at {}, using defaults and environment", configPath);
        }
        return start(config);
    }

    /**
     * Starts a server for {@code config}.
     *
     * @throws ConfigLoadException if the configured engine is unknown
     * @throws io.htmltpl.core.error.TemplateLoadException if a template does not compile
     * @throws IOException if the file watcher cannot be started
     */
    public static TemplateServerApp start(ServerConfig config) throws IOException {
        long startTime = System.nanoTime();

        EngineRegistry registry = EngineRegistry.withBuiltins();
        ExpressionEngine engine;
        try {
            engine = registry.requireEngine(config.templatesEngine());
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("templates.engine: " + e.getMessage(), e);
        }
        LOG.info("Expression engines registered: {}, using '{}'", registry.ids(), engine.id());

        Path templatesDir = Path.of(config.templatesDir());
        TemplateLoader loader = new TemplateLoader(templatesDir, config.templatesSuffix(), engine);
        HtmlRenderer renderer = HtmlRenderer.create(loader, config.templatesHotReload());
        int templateCount = AdminReloadHandler.templateCount(renderer.currentManager());

        Javalin app = Javalin.create();
        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.post(config.adminReloadPath(), new AdminReloadHandler(renderer));

        RenderHandler renderHandler = new RenderHandler(renderer, config.templatesSuffix());
        app.addHttpHandler(HandlerType.GET, "/", renderHandler);
        app.addHttpHandler(HandlerType.GET, "/<path>", renderHandler);
        app.addHttpHandler(HandlerType.POST, "/<path>", renderHandler);

        app.start(config.serverHost(), config.serverPort());

        FileWatcher fileWatcher = null;
        if (config.reloadWatch() && config.templatesHotReload()) {
            LOG.info("reload.watch ignored: templates.hot-reload rebuilds on every request");
        } else if (config.reloadWatch()) {
            fileWatcher = new FileWatcher(templatesDir, config.reloadDebounceMs(), renderer::reload);
            try {
                fileWatcher.start();
            } catch (IOException e) {
                app.stop();
                throw e;
            }
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "html-tpl-server started: port={}, templatesDir={}, templates={}, engine={}, hotReload={}, watch={}, startupMs={}",
                app.port(),
                templatesDir,
                templateCount,
                engine.id(),
                config.templatesHotReload(),
                fileWatcher != null,
                elapsedMs);

        return new TemplateServerApp(app, renderer, fileWatcher, config);
    }

    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public HtmlRenderer renderer() {
        return renderer;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops the file watcher, then the HTTP server. */
    public void stop() {
        if (fileWatcher != null) {
            fileWatcher.stop();
        }
        app.stop();
        LOG.info("html-tpl-server stopped");
    }
}
