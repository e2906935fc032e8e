package io.ucmsdk.core.spi;

import io.ucmsdk.core.schema.SchemaSource;
import java.util.Optional;

/**
 * Supplies the schema document for an API version on demand. Consulted by
 * {@link io.ucmsdk.core.schema.SchemaCatalog#ensureVersion} when a server
 * reports a version the catalog has not loaded yet.
 *
 * <p>
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface SchemaSourceResolver {

    /**
     * Resolves the schema source for a normalized API version.
     *
     * @param apiVersion normalized version, e.g. {@code 14.0}
     * @return the source, or empty if this resolver has none for the version
     */
    Optional<SchemaSource> resolve(String apiVersion);

    /** A resolver that never finds anything. */
    static SchemaSourceResolver none() {
        return apiVersion -> Optional.empty();
    }
}
