package io.ucmsdk.core.spi;

import io.ucmsdk.core.error.SchemaParseException;
import io.ucmsdk.core.schema.SchemaSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves schemas from a directory tree laid out as {@code <root>/<version>/}.
 * Within a version directory the first descriptor ({@code *.yaml},
 * {@code *.yml}, {@code *.json}, by file name) wins; otherwise the first
 * {@code *.wsdl} or {@code *.xsd}.
 */
public final class DirectorySchemaSourceResolver implements SchemaSourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DirectorySchemaSourceResolver.class);

    private static final List<String> DESCRIPTOR_EXTENSIONS = List.of(".yaml", ".yml", ".json");
    private static final List<String> XSD_EXTENSIONS = List.of(".wsdl", ".xsd");

    private final Path root;

    public DirectorySchemaSourceResolver(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    /** The directory holding one sub-directory per version. */
    public Path root() {
        return root;
    }

    @Override
    public Optional<SchemaSource> resolve(String apiVersion) {
        Path versionDir = root.resolve(apiVersion);
        if (!Files.isDirectory(versionDir)) {
            LOG.debug("No schema directory for version {} under {}", apiVersion, root);
            return Optional.empty();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(versionDir)) {
            files = listing.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SchemaParseException(
                    "Failed to list schema directory: " + e.getMessage(), e, apiVersion, versionDir.toString());
        }
        Optional<Path> chosen = firstWithExtension(files, DESCRIPTOR_EXTENSIONS)
                .or(() -> firstWithExtension(files, XSD_EXTENSIONS));
        chosen.ifPresent(path -> LOG.debug("Resolved schema for version {}: {}", apiVersion, path));
        return chosen.map(path -> SchemaSource.fromPath(path, apiVersion));
    }

    private static Optional<Path> firstWithExtension(List<Path> files, List<String> extensions) {
        return files.stream()
                .filter(p -> {
                    String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                    return extensions.stream().anyMatch(name::endsWith);
                })
                .findFirst();
    }
}
