package io.ucmsdk.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ucmsdk.core.error.SchemaParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaSourceTest {

    @TempDir
    Path dir;

    @Test
    void formatFollowsExtension() throws IOException {
        Path yaml = Files.writeString(dir.resolve("axl.YAML"), "operations: {}\n");
        Path wsdl = Files.writeString(dir.resolve("AXLAPI.wsdl"), "<definitions/>");

        SchemaSource descriptor = SchemaSource.fromPath(yaml, "14.0");
        SchemaSource xsd = SchemaSource.fromPath(wsdl, null);

        assertThat(descriptor.format()).isEqualTo(SchemaSource.Format.DESCRIPTOR);
        assertThat(descriptor.apiVersion()).isEqualTo("14.0");
        assertThat(descriptor.content()).isEqualTo("operations: {}\n");
        assertThat(descriptor.location()).isEqualTo(yaml.toString());
        assertThat(xsd.format()).isEqualTo(SchemaSource.Format.XSD);
    }

    @Test
    void unknownExtensionIsRejected() throws IOException {
        Path txt = Files.writeString(dir.resolve("axl.txt"), "x");

        assertThatThrownBy(() -> SchemaSource.fromPath(txt, "14.0"))
                .isInstanceOf(SchemaParseException.class)
                .hasMessageContaining("Unrecognized schema file extension")
                .satisfies(e -> assertThat(((SchemaParseException) e).source()).isEqualTo(txt.toString()));
    }

    @Test
    void unreadableFileIsAParseError() {
        assertThatThrownBy(() -> SchemaSource.fromPath(dir.resolve("missing.yaml"), null))
                .isInstanceOf(SchemaParseException.class)
                .hasMessageStartingWith("Failed to read schema file");
    }

    @Test
    void locationDefaultsToInline() {
        assertThat(SchemaSource.descriptor(null, null, "operations: {}").location()).isEqualTo("<inline>");
    }
}
