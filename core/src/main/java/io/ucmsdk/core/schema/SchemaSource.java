package io.ucmsdk.core.schema;

import io.ucmsdk.core.error.SchemaParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema document handed to the {@link SchemaCatalog}, keyed by API version.
 *
 * @param apiVersion API version the schema describes, or {@code null} to
 *                   take it from the document
 * @param format     how to parse {@code content}
 * @param location   file path or resource name, used in error messages
 * @param content    the document text
 */
public record SchemaSource(String apiVersion, Format format, String location, String content) {

    /** Supported schema document formats. */
    public enum Format {
        /** YAML or JSON schema descriptor. */
        DESCRIPTOR,
        /** XML Schema, bare or embedded in a WSDL {@code types} section. */
        XSD
    }

    public SchemaSource {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(content, "content must not be null");
        location = location != null ? location : "<inline>";
    }

    /** Creates an in-memory descriptor source. */
    public static SchemaSource descriptor(String apiVersion, String location, String content) {
        return new SchemaSource(apiVersion, Format.DESCRIPTOR, location, content);
    }

    /** Creates an in-memory XSD/WSDL source. */
    public static SchemaSource xsd(String apiVersion, String location, String content) {
        return new SchemaSource(apiVersion, Format.XSD, location, content);
    }

    /**
     * Reads a schema file, choosing the format from its extension.
     * {@code .wsdl} and {@code .xsd} are XSD; {@code .yaml}, {@code .yml} and
     * {@code .json} are descriptors.
     *
     * @param path       the file to read
     * @param apiVersion the version it describes, or {@code null}
     * @return the loaded source
     * @throws SchemaParseException if the file cannot be read or has an
     *                              unknown extension
     */
    public static SchemaSource fromPath(Path path, String apiVersion) {
        Objects.requireNonNull(path, "path must not be null");
        String location = path.toString();
        Format format = formatOf(path)
                .orElseThrow(() -> new SchemaParseException(
                        "Unrecognized schema file extension (expected .yaml, .yml, .json, .wsdl or .xsd)",
                        apiVersion,
                        location));
        try {
            return new SchemaSource(apiVersion, format, location, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read schema file: " + e.getMessage(), e, apiVersion, location);
        }
    }

    /** Returns the format implied by a file name, if any. */
    static Optional<Format> formatOf(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".yaml") || fileName.endsWith(".yml") || fileName.endsWith(".json")) {
            return Optional.of(Format.DESCRIPTOR);
        }
        if (fileName.endsWith(".wsdl") || fileName.endsWith(".xsd")) {
            return Optional.of(Format.XSD);
        }
        return Optional.empty();
    }
}
