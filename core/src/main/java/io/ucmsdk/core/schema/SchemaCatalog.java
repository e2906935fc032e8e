package io.ucmsdk.core.schema;

import io.ucmsdk.core.error.UnsupportedVersionException;
import io.ucmsdk.core.model.ApiVersion;
import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.spi.SchemaSourceResolver;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current {@link SchemaIndex} of one {@link Backend} and its
 * load/refresh lifecycle.
 *
 * <p>
 * Readers call {@link #current()} or {@link #lookup} without locking and
 * always see a fully built snapshot. Writers ({@link #load},
 * {@link #refresh}, {@link #ensureVersion}) are serialized by a lock, build a
 * complete new index off to the side and publish it with a single reference
 * swap. A failed load leaves the previous snapshot in place.
 */
public final class SchemaCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCatalog.class);

    private final Backend backend;
    private final SchemaSourceResolver resolver;
    private final Map<SchemaSource.Format, SchemaParser> parsers;
    private final AtomicReference<SchemaIndex> indexRef = new AtomicReference<>(SchemaIndex.empty());
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Creates a catalog without a resolver; versions must be loaded
     * explicitly.
     *
     * @param backend the backend the schemas describe
     */
    public SchemaCatalog(Backend backend) {
        this(backend, SchemaSourceResolver.none());
    }

    /**
     * Creates a catalog that resolves unknown versions on demand.
     *
     * @param backend  the backend the schemas describe
     * @param resolver supplies sources for {@link #ensureVersion}
     */
    public SchemaCatalog(Backend backend, SchemaSourceResolver resolver) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.parsers = new EnumMap<>(SchemaSource.Format.class);
        this.parsers.put(SchemaSource.Format.DESCRIPTOR, new DescriptorSchemaParser());
        this.parsers.put(SchemaSource.Format.XSD, new XsdSchemaParser());
    }

    public Backend backend() {
        return backend;
    }

    /**
     * Returns the current snapshot. Callers that need a consistent view across
     * several lookups should capture it once.
     *
     * @return the current immutable index
     */
    public SchemaIndex current() {
        return indexRef.get();
    }

    /**
     * Looks up an operation in the current snapshot.
     *
     * @see SchemaIndex#lookup(String, String)
     */
    public OperationSchema lookup(String operationName, String apiVersion) {
        return indexRef.get().lookup(operationName, apiVersion);
    }

    /**
     * Parses a source and publishes a new index holding the previously loaded
     * versions plus this one. A version that was already loaded is replaced
     * entirely.
     *
     * @param source the schema document
     * @return the newly published index
     * @throws io.ucmsdk.core.error.SchemaParseException if the source is
     *                                                   malformed; the current
     *                                                   index is unchanged
     */
    public SchemaIndex load(SchemaSource source) {
        Objects.requireNonNull(source, "source must not be null");
        writeLock.lock();
        try {
            List<OperationSchema> schemas = parse(source);
            String version = schemas.get(0).apiVersion();
            SchemaIndex next = indexRef.get().toBuilder()
                    .removeVersion(version)
                    .addAll(schemas)
                    .build();
            indexRef.set(next);
            LOG.info(
                    "Schema loaded: backend={}, version={}, operations={}, source={}",
                    backend.displayName(),
                    version,
                    schemas.size(),
                    source.location());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Rebuilds the index from scratch. All sources are parsed before anything
     * is published; if any of them fails, the current index is unchanged.
     *
     * @param sources the complete set of schema documents
     * @return the newly published index
     */
    public SchemaIndex refresh(List<SchemaSource> sources) {
        Objects.requireNonNull(sources, "sources must not be null");
        writeLock.lock();
        try {
            SchemaIndex.Builder builder = SchemaIndex.builder();
            for (SchemaSource source : sources) {
                builder.addAll(parse(source));
            }
            SchemaIndex next = builder.build();
            SchemaIndex previous = indexRef.getAndSet(next);
            LOG.info(
                    "Schema index refreshed: backend={}, versions={}, operations={} (was {})",
                    backend.displayName(),
                    next.versions(),
                    next.size(),
                    previous.size());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Makes sure the schema for a server-reported version is loaded, resolving
     * and loading it if needed.
     *
     * @param serverVersion raw or normalized version, e.g. {@code 12.5.1.10000-1}
     * @return the normalized version, now present in the index
     * @throws UnsupportedVersionException if the version is malformed or no
     *                                     source can be resolved for it
     */
    public String ensureVersion(String serverVersion) {
        String version;
        try {
            version = ApiVersion.normalize(serverVersion);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedVersionException(e.getMessage(), serverVersion);
        }
        if (indexRef.get().hasVersion(version)) {
            return version;
        }
        writeLock.lock();
        try {
            if (indexRef.get().hasVersion(version)) {
                return version;
            }
            SchemaSource source = resolver.resolve(version)
                    .orElseThrow(() -> new UnsupportedVersionException(
                            backend.displayName() + " API version " + version + " is not supported: no schema available",
                            version));
            if (source.apiVersion() == null) {
                source = new SchemaSource(version, source.format(), source.location(), source.content());
            }
            load(source);
            return version;
        } finally {
            writeLock.unlock();
        }
    }

    private List<OperationSchema> parse(SchemaSource source) {
        List<OperationSchema> schemas = parsers.get(source.format()).parse(source);
        LOG.debug("Parsed {} operations from {}", schemas.size(), source.location());
        return schemas;
    }
}
