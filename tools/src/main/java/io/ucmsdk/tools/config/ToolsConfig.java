package io.ucmsdk.tools.config;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration for the command-line tools.
 *
 * <p>
 * Only the server address and credentials lack defaults, and only the
 * {@code probe} command needs them. Use {@link #builder()} to construct
 * instances.
 *
 * @param scheme           {@code https} (default) or {@code http}
 * @param host             CUCM publisher host name or address
 * @param port             HTTPS port of the CUCM web services
 * @param username         application user with AXL access
 * @param password         its password; never rendered by {@link #toString()}
 * @param apiVersion       schema version to use when the server is not asked,
 *                         or {@code null}
 * @param schemaDir        directory holding one sub-directory per API version
 * @param connectTimeoutMs TCP connect timeout in ms
 * @param readTimeoutMs    response timeout in ms
 * @param loggingFormat    {@code text} or {@code json}
 * @param loggingLevel     root log level
 */
public record ToolsConfig(
        String scheme,
        String host,
        int port,
        String username,
        String password,
        String apiVersion,
        String schemaDir,
        int connectTimeoutMs,
        int readTimeoutMs,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Base URI of the server, e.g. {@code https://cucm.example.com:8443}. */
    public URI baseUri() {
        if (host == null || host.isBlank()) {
            throw new IllegalStateException("No server host configured (server.host or UCM_HOST)");
        }
        return URI.create(scheme + "://" + host + ":" + port);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration readTimeout() {
        return Duration.ofMillis(readTimeoutMs);
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank() && password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "ToolsConfig[scheme=" + scheme + ", host=" + host + ", port=" + port + ", username=" + username
                + ", password=" + (password == null ? "null" : "****") + ", apiVersion=" + apiVersion
                + ", schemaDir=" + schemaDir + ", connectTimeoutMs=" + connectTimeoutMs + ", readTimeoutMs="
                + readTimeoutMs + ", loggingFormat=" + loggingFormat + ", loggingLevel=" + loggingLevel + "]";
    }

    /** Builder for {@link ToolsConfig}. */
    public static final class Builder {
        private String scheme = "https";
        private String host;
        private int port = 8443;
        private String username;
        private String password;
        private String apiVersion;
        private String schemaDir = "./schemas";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder schemaDir(String schemaDir) {
            this.schemaDir = schemaDir;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
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

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public ToolsConfig build() {
            if (!"https".equals(scheme) && !"http".equals(scheme)) {
                throw new ConfigLoadException("server.scheme must be 'https' or 'http', got '" + scheme + "'");
            }
            if (port < 1 || port > 65535) {
                throw new ConfigLoadException("server.port must be between 1 and 65535, got " + port);
            }
            if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
                throw new ConfigLoadException("Timeouts must be positive");
            }
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'text' or 'json', got '" + loggingFormat + "'");
            }
            return new ToolsConfig(
                    scheme,
                    host,
                    port,
                    username,
                    password,
                    apiVersion,
                    schemaDir,
                    connectTimeoutMs,
                    readTimeoutMs,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
