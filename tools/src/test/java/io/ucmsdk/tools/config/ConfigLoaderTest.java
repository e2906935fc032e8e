package io.ucmsdk.tools.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConfigLoader} YAML parsing: key mapping, defaults and
 * error paths, using classpath fixtures.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    private static ToolsConfig load(String name) throws Exception {
        return ConfigLoader.load(fixture(name), Map.<String, String>of()::get);
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Load minimal config → host set, everything else defaulted")
        void hostAndDefaults() throws Exception {
            ToolsConfig config = load("minimal-config.yaml");

            assertThat(config.host()).isEqualTo("cucm.example.com");
            assertThat(config.scheme()).isEqualTo("https");
            assertThat(config.port()).isEqualTo(8443);
            assertThat(config.username()).isNull();
            assertThat(config.hasCredentials()).isFalse();
            assertThat(config.apiVersion()).isNull();
            assertThat(config.schemaDir()).isEqualTo("./schemas");
            assertThat(config.connectTimeoutMs()).isEqualTo(5000);
            assertThat(config.readTimeoutMs()).isEqualTo(30000);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.baseUri()).isEqualTo(URI.create("https://cucm.example.com:8443"));
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Load full config → all fields populated")
        void allFieldsPopulated() throws Exception {
            ToolsConfig config = load("full-config.yaml");

            assertThat(config.scheme()).isEqualTo("http");
            assertThat(config.host()).isEqualTo("cucm-pub.lab.local");
            assertThat(config.port()).isEqualTo(8080);
            assertThat(config.username()).isEqualTo("axladmin");
            assertThat(config.password()).isEqualTo("s3cret");
            assertThat(config.hasCredentials()).isTrue();
            assertThat(config.apiVersion()).isEqualTo("12.5");
            assertThat(config.schemaDir()).isEqualTo("/opt/ucm-sdk/schemas");
            assertThat(config.connectTimeout().toMillis()).isEqualTo(2000);
            assertThat(config.readTimeout().toMillis()).isEqualTo(10000);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("toString masks the password")
        void toStringMasksPassword() throws Exception {
            assertThat(load("full-config.yaml").toString()).contains("password=****").doesNotContain("s3cret");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFile() {
            assertThatThrownBy(() -> ConfigLoader.load(Path.of("does-not-exist.yaml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found: does-not-exist.yaml");
        }

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> load("malformed.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        void rootMustBeMapping() {
            assertThatThrownBy(() -> load("not-a-mapping.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration root must be a mapping");
        }

        @Test
        void nonIntegerPort() {
            assertThatThrownBy(() -> load("bad-port.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("'port' must be an integer, got 'eighty'");
        }

        @Test
        void unsupportedScheme() {
            assertThatThrownBy(() -> load("bad-scheme.yaml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("server.scheme must be 'https' or 'http', got 'ftp'");
        }

        @Test
        void baseUriNeedsHost() {
            assertThatThrownBy(() -> ToolsConfig.builder().build().baseUri())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("UCM_HOST");
        }

        @Test
        void outOfRangeValues() {
            assertThatThrownBy(() -> ToolsConfig.builder().port(70000).build())
                    .isInstanceOf(ConfigLoadException.class);
            assertThatThrownBy(() -> ToolsConfig.builder().readTimeoutMs(0).build())
                    .isInstanceOf(ConfigLoadException.class);
            assertThatThrownBy(() -> ToolsConfig.builder().loggingFormat("xml").build())
                    .isInstanceOf(ConfigLoadException.class);
        }
    }

    @Nested
    @DisplayName("CLI path resolution")
    class ResolveConfigPath {

        @Test
        void defaultsToWorkingDirectoryFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"probe"})).isEqualTo(Path.of("ucm-sdk.yaml"));
        }

        @Test
        void explicitPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/ucm.yaml", "probe"}))
                    .isEqualTo(Path.of("/etc/ucm.yaml"));
        }

        @Test
        void missingValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"probe", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
