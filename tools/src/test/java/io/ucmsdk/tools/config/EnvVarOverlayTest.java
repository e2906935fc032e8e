package io.ucmsdk.tools.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable counts as
 * set only if its trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Test
    @DisplayName("String variables override YAML")
    void stringOverrides() {
        envVars.put("UCM_HOST", "cucm-sub.lab.local");
        envVars.put("UCM_USERNAME", "svc-axl");
        envVars.put("UCM_PASSWORD", "other");
        envVars.put("UCM_API_VERSION", "14.0");
        envVars.put("UCM_SCHEMA_DIR", "/srv/schemas");
        envVars.put("UCM_LOGGING_FORMAT", "text");
        envVars.put("UCM_LOGGING_LEVEL", "WARN");
        envVars.put("UCM_SCHEME", "https");

        ToolsConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.host()).isEqualTo("cucm-sub.lab.local");
        assertThat(config.username()).isEqualTo("svc-axl");
        assertThat(config.password()).isEqualTo("other");
        assertThat(config.apiVersion()).isEqualTo("14.0");
        assertThat(config.schemaDir()).isEqualTo("/srv/schemas");
        assertThat(config.loggingFormat()).isEqualTo("text");
        assertThat(config.loggingLevel()).isEqualTo("WARN");
        assertThat(config.scheme()).isEqualTo("https");
    }

    @Test
    @DisplayName("Integer variables override YAML")
    void integerOverrides() {
        envVars.put("UCM_PORT", " 9443 ");
        envVars.put("UCM_CONNECT_TIMEOUT_MS", "100");
        envVars.put("UCM_READ_TIMEOUT_MS", "200");

        ToolsConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.port()).isEqualTo(9443);
        assertThat(config.connectTimeoutMs()).isEqualTo(100);
        assertThat(config.readTimeoutMs()).isEqualTo(200);
    }

    @Test
    @DisplayName("Blank variables leave YAML values in place")
    void blankIsUnset() {
        envVars.put("UCM_HOST", "   ");
        envVars.put("UCM_PORT", "");

        ToolsConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.host()).isEqualTo("cucm-pub.lab.local");
        assertThat(config.port()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Non-integer value names the variable")
    void invalidInteger() {
        envVars.put("UCM_READ_TIMEOUT_MS", "soon");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessage("UCM_READ_TIMEOUT_MS must be an integer, got 'soon'");
    }

    @Test
    @DisplayName("Environment alone, without a file")
    void environmentOnly() {
        envVars.put("UCM_HOST", "10.0.0.5");
        envVars.put("UCM_API_VERSION", "12.5");

        ToolsConfig config = ConfigLoader.fromEnvironment(envLookup());

        assertThat(config.host()).isEqualTo("10.0.0.5");
        assertThat(config.apiVersion()).isEqualTo("12.5");
        assertThat(config.port()).isEqualTo(8443);
    }
}
