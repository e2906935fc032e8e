package io.ucmsdk.tools.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ToolsConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code ucm-sdk.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts
 * as set only if it is defined and non-blank after trimming; otherwise the
 * YAML value (or the default) stands.
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code UCM_SCHEME}</td><td>{@code server.scheme}</td></tr>
 * <tr><td>{@code UCM_HOST}</td><td>{@code server.host}</td></tr>
 * <tr><td>{@code UCM_PORT}</td><td>{@code server.port}</td></tr>
 * <tr><td>{@code UCM_USERNAME}</td><td>{@code server.username}</td></tr>
 * <tr><td>{@code UCM_PASSWORD}</td><td>{@code server.password}</td></tr>
 * <tr><td>{@code UCM_API_VERSION}</td><td>{@code server.api-version}</td></tr>
 * <tr><td>{@code UCM_CONNECT_TIMEOUT_MS}</td><td>{@code server.connect-timeout-ms}</td></tr>
 * <tr><td>{@code UCM_READ_TIMEOUT_MS}</td><td>{@code server.read-timeout-ms}</td></tr>
 * <tr><td>{@code UCM_SCHEMA_DIR}</td><td>{@code schema.dir}</td></tr>
 * <tr><td>{@code UCM_LOGGING_FORMAT}</td><td>{@code logging.format}</td></tr>
 * <tr><td>{@code UCM_LOGGING_LEVEL}</td><td>{@code logging.level}</td></tr>
 * </table>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "ucm-sdk.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ToolsConfig} from the given YAML file, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ToolsConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ToolsConfig} from the given YAML file, applying
     * environment variable overrides from the supplied lookup function.
     * Returning {@code null} from {@code envLookup} means the variable is not
     * defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ToolsConfig load(Path configPath, Function<String, String> envLookup) {
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
        if (root != null && !root.isMissingNode() && !root.isNull() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }
        return mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
    }

    /**
     * Builds a configuration from defaults and environment variables only, for
     * when no configuration file exists.
     *
     * @param envLookup environment variable lookup function
     * @return the configuration
     */
    public static ToolsConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     * @throws IllegalArgumentException if {@code --config} has no value
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

    private static ToolsConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ToolsConfig.Builder builder = ToolsConfig.builder();

        // Server section
        JsonNode server = root.path("server");
        if (server.has("scheme")) builder.scheme(server.get("scheme").asText());
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(intValue(server, "port"));
        if (server.has("username")) builder.username(server.get("username").asText());
        if (server.has("password")) builder.password(server.get("password").asText());
        if (server.has("api-version")) builder.apiVersion(server.get("api-version").asText());
        if (server.has("connect-timeout-ms")) builder.connectTimeoutMs(intValue(server, "connect-timeout-ms"));
        if (server.has("read-timeout-ms")) builder.readTimeoutMs(intValue(server, "read-timeout-ms"));

        // Schema section
        JsonNode schema = root.path("schema");
        if (schema.has("dir")) builder.schemaDir(schema.get("dir").asText());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        envString(envLookup, "UCM_SCHEME", builder::scheme);
        envString(envLookup, "UCM_HOST", builder::host);
        envString(envLookup, "UCM_USERNAME", builder::username);
        envString(envLookup, "UCM_PASSWORD", builder::password);
        envString(envLookup, "UCM_API_VERSION", builder::apiVersion);
        envString(envLookup, "UCM_SCHEMA_DIR", builder::schemaDir);
        envString(envLookup, "UCM_LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "UCM_LOGGING_LEVEL", builder::loggingLevel);
        envInt(envLookup, "UCM_PORT", builder::port);
        envInt(envLookup, "UCM_CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "UCM_READ_TIMEOUT_MS", builder::readTimeoutMs);

        return builder.build();
    }

    private static int intValue(JsonNode section, String field) {
        JsonNode node = section.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigLoadException("'" + field + "' must be an integer, got '" + node.asText() + "'");
        }
        return node.intValue();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
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
}
