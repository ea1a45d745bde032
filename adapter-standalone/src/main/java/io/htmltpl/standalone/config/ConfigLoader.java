package io.htmltpl.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file with an environment variable overlay.
 *
 * <p>The file is {@code html-tpl-server.yaml} in the working directory unless {@code --config
 * <path>} names another. Missing keys keep the {@link ServerConfig.Builder} defaults.
 *
 * <p>Every key can be overridden by an environment variable, which wins over YAML. A variable
 * counts as set only if it is defined and non-blank after trimming.
 *
 * <pre>
 * server:
 *   host: 0.0.0.0            # SERVER_HOST
 *   port: 8080               # SERVER_PORT
 * templates:
 *   dir: ./templates         # TEMPLATES_DIR
 *   suffix: .html            # TEMPLATES_SUFFIX
 *   engine: path             # TEMPLATES_ENGINE
 *   hot-reload: false        # TEMPLATES_HOT_RELOAD
 * reload:
 *   watch: false             # RELOAD_WATCH
 *   debounce-ms: 500         # RELOAD_DEBOUNCE_MS
 * health:
 *   enabled: true            # HEALTH_ENABLED
 *   path: /health            # HEALTH_PATH
 * logging:
 *   format: json             # LOG_FORMAT
 *   level: INFO              # LOG_LEVEL
 * admin:
 *   reload-path: /admin/reload   # ADMIN_RELOAD_PATH
 * </pre>
 */
public final class ConfigLoader {

    /** Config file used when no {@code --config} argument is given. */
    public static final String DEFAULT_CONFIG_FILE = "html-tpl-server.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> LOG_FORMATS = Set.of("json", "text");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, with overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid
     *     value
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, with overrides from {@code envLookup}. A
     * {@code null} lookup result means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid
     *     value
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        ServerConfig config = fromTree(root, envLookup);
        validate(config);
        return config;
    }

    /**
     * Builds configuration from defaults and environment overrides only, for running without a
     * config file.
     *
     * @throws ConfigLoadException if an override holds an invalid value
     */
    public static ServerConfig fromEnvironment(Function<String, String> envLookup) {
        ServerConfig config = fromTree(MissingNode.getInstance(), envLookup);
        validate(config);
        return config;
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} is not followed by a path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServerConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());

        JsonNode templates = root.path("templates");
        if (templates.has("dir")) builder.templatesDir(templates.get("dir").asText());
        if (templates.has("suffix")) builder.templatesSuffix(templates.get("suffix").asText());
        if (templates.has("engine")) builder.templatesEngine(templates.get("engine").asText());
        if (templates.has("hot-reload"))
            builder.templatesHotReload(templates.get("hot-reload").asBoolean());

        JsonNode reload = root.path("reload");
        if (reload.has("watch")) builder.reloadWatch(reload.get("watch").asBoolean());
        if (reload.has("debounce-ms"))
            builder.reloadDebounceMs(reload.get("debounce-ms").asInt());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode admin = root.path("admin");
        if (admin.has("reload-path"))
            builder.adminReloadPath(admin.get("reload-path").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(ServerConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "TEMPLATES_DIR", builder::templatesDir);
        envString(envLookup, "TEMPLATES_SUFFIX", builder::templatesSuffix);
        envString(envLookup, "TEMPLATES_ENGINE", builder::templatesEngine);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "ADMIN_RELOAD_PATH", builder::adminReloadPath);

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "RELOAD_DEBOUNCE_MS", builder::reloadDebounceMs);

        envBool(envLookup, "TEMPLATES_HOT_RELOAD", builder::templatesHotReload);
        envBool(envLookup, "RELOAD_WATCH", builder::reloadWatch);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
    }

    private static void validate(ServerConfig config) {
        if (config.serverPort() < 0 || config.serverPort() > 65535) {
            throw new ConfigLoadException("server.port must be between 0 and 65535, got " + config.serverPort());
        }
        requireText(config.templatesDir(), "templates.dir");
        requireText(config.templatesSuffix(), "templates.suffix");
        requireText(config.templatesEngine(), "templates.engine");
        if (config.reloadDebounceMs() < 0) {
            throw new ConfigLoadException("reload.debounce-ms must not be negative, got " + config.reloadDebounceMs());
        }
        requirePath(config.healthPath(), "health.path");
        requirePath(config.adminReloadPath(), "admin.reload-path");
        if (config.loggingFormat() == null
                || !LOG_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.format must be one of " + LOG_FORMATS + ", got '" + config.loggingFormat() + "'");
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigLoadException(key + " is required and must not be blank");
        }
    }

    private static void requirePath(String value, String key) {
        requireText(value, key);
        if (!value.startsWith("/")) {
            throw new ConfigLoadException(key + " must start with '/', got '" + value + "'");
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
