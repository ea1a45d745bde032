package io.htmltpl.standalone.config;

/**
 * Immutable configuration of the standalone template server.
 *
 * <p>Built by {@link ConfigLoader} from YAML plus environment overrides. Every field has a
 * default, see {@link Builder}.
 *
 * @param serverHost         address to bind, {@code server.host}
 * @param serverPort         port to bind, {@code server.port}; 0 picks a free port
 * @param templatesDir       template root directory, {@code templates.dir}
 * @param templatesSuffix    file suffix of templates, {@code templates.suffix}
 * @param templatesEngine    placeholder expression engine id, {@code templates.engine}
 * @param templatesHotReload rebuild templates on every request, {@code templates.hot-reload}
 * @param reloadWatch        reload when files under the template directory change, {@code
 *                           reload.watch}
 * @param reloadDebounceMs   quiet period before a watched change triggers a reload
 * @param healthEnabled      expose the health endpoint
 * @param healthPath         path of the health endpoint
 * @param loggingFormat      {@code json} or {@code text}
 * @param loggingLevel       root log level
 * @param adminReloadPath    path of the admin reload endpoint
 */
public record ServerConfig(
        String serverHost,
        int serverPort,
        String templatesDir,
        String templatesSuffix,
        String templatesEngine,
        boolean templatesHotReload,
        boolean reloadWatch,
        int reloadDebounceMs,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        String adminReloadPath) {

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8080;
        private String templatesDir = "./templates";
        private String templatesSuffix = ".html";
        private String templatesEngine = "path";
        private boolean templatesHotReload = false;
        private boolean reloadWatch = false;
        private int reloadDebounceMs = 500;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private String adminReloadPath = "/admin/reload";

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder templatesDir(String templatesDir) {
            this.templatesDir = templatesDir;
            return this;
        }

        public Builder templatesSuffix(String templatesSuffix) {
            this.templatesSuffix = templatesSuffix;
            return this;
        }

        public Builder templatesEngine(String templatesEngine) {
            this.templatesEngine = templatesEngine;
            return this;
        }

        public Builder templatesHotReload(boolean templatesHotReload) {
            this.templatesHotReload = templatesHotReload;
            return this;
        }

        public Builder reloadWatch(boolean reloadWatch) {
            this.reloadWatch = reloadWatch;
            return this;
        }

        public Builder reloadDebounceMs(int reloadDebounceMs) {
            this.reloadDebounceMs = reloadDebounceMs;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder adminReloadPath(String adminReloadPath) {
            this.adminReloadPath = adminReloadPath;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    serverHost,
                    serverPort,
                    templatesDir,
                    templatesSuffix,
                    templatesEngine,
                    templatesHotReload,
                    reloadWatch,
                    reloadDebounceMs,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    adminReloadPath);
        }
    }
}
