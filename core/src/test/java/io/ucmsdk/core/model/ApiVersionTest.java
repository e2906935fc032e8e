package io.ucmsdk.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ApiVersionTest {

    @ParameterizedTest
    @CsvSource({
        "12.5.1.10000-1, 12.5",
        "14.0.1.11900-132, 14.0",
        "14, 14.0",
        "11.5, 11.5",
        "' 15.0', 15.0",
        "08.0, 8.0"
    })
    void normalizesToMajorMinor(String raw, String expected) {
        assertThat(ApiVersion.normalize(raw)).isEqualTo(expected);
        assertThat(ApiVersion.isValid(raw)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "current", "v14.0", "123.4", ".5"})
    void rejectsNonVersions(String raw) {
        assertThat(ApiVersion.isValid(raw)).isFalse();
        assertThatThrownBy(() -> ApiVersion.normalize(raw))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a valid UCM version");
    }

    @Test
    void nullIsRejected() {
        assertThat(ApiVersion.isValid(null)).isFalse();
        assertThatThrownBy(() -> ApiVersion.normalize(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
