package io.ucmsdk.core.schema;

import io.ucmsdk.core.error.UnknownOperationException;
import io.ucmsdk.core.model.OperationSchema;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of every loaded {@link OperationSchema}, keyed by API
 * version and operation name. May hold several versions at once.
 *
 * <p>
 * This is the unit of atomic swap in {@link SchemaCatalog}: the catalog holds
 * the current index in an {@link java.util.concurrent.atomic.AtomicReference}
 * and replaces it wholesale on every load, so callers that captured an index
 * keep a consistent view.
 *
 * <p>
 * Thread-safe: all maps are unmodifiable.
 */
public final class SchemaIndex {

    private static final int MAX_SUGGESTIONS = 3;

    private final Map<String, Map<String, OperationSchema>> byVersion;

    private SchemaIndex(Map<String, Map<String, OperationSchema>> byVersion) {
        Map<String, Map<String, OperationSchema>> copy = new TreeMap<>();
        byVersion.forEach((version, ops) -> copy.put(version, Collections.unmodifiableMap(new TreeMap<>(ops))));
        this.byVersion = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates an empty index.
     *
     * @return an empty, immutable index
     */
    public static SchemaIndex empty() {
        return new SchemaIndex(Map.of());
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with every version of this index, for
     * deriving a new snapshot.
     *
     * @return a builder holding this index's operations
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        byVersion.values().forEach(ops -> ops.values().forEach(builder::add));
        return builder;
    }

    /**
     * Looks up an operation's schema.
     *
     * @param operationName the remote operation, e.g. {@code getPhone}
     * @param apiVersion    the normalized API version
     * @return the schema
     * @throws UnknownOperationException if the version is not loaded or has no
     *                                   such operation; the message lists close
     *                                   matches when there are any
     */
    public OperationSchema lookup(String operationName, String apiVersion) {
        Map<String, OperationSchema> ops = byVersion.get(apiVersion);
        if (ops == null) {
            throw new UnknownOperationException(
                    "No schema loaded for API version " + apiVersion + " (loaded: " + versions() + ")",
                    operationName,
                    apiVersion);
        }
        OperationSchema schema = ops.get(operationName);
        if (schema == null) {
            List<String> suggestions = closeMatches(operationName, ops.keySet());
            String hint = suggestions.isEmpty() ? "" : "; did you mean " + String.join(", ", suggestions) + "?";
            throw new UnknownOperationException(
                    "Unknown operation '" + operationName + "' for API version " + apiVersion + hint,
                    operationName,
                    apiVersion);
        }
        return schema;
    }

    /** Returns {@code true} if the operation exists for the version. */
    public boolean contains(String operationName, String apiVersion) {
        Map<String, OperationSchema> ops = byVersion.get(apiVersion);
        return ops != null && ops.containsKey(operationName);
    }

    /** Returns {@code true} if any operation is loaded for the version. */
    public boolean hasVersion(String apiVersion) {
        return byVersion.containsKey(apiVersion);
    }

    /**
     * Returns the sorted operation names for a version.
     *
     * @return operation names, empty if the version is not loaded
     */
    public Set<String> operations(String apiVersion) {
        Map<String, OperationSchema> ops = byVersion.get(apiVersion);
        return ops == null ? Set.of() : ops.keySet();
    }

    /** Returns the loaded versions, sorted. */
    public Set<String> versions() {
        return byVersion.keySet();
    }

    /** Returns the number of operations across all versions. */
    public int size() {
        return byVersion.values().stream().mapToInt(Map::size).sum();
    }

    static List<String> closeMatches(String name, Set<String> candidates) {
        String needle = name.toLowerCase(Locale.ROOT);
        int threshold = Math.max(2, needle.length() / 3);
        return candidates.stream()
                .filter(c -> c.toLowerCase(Locale.ROOT).contains(needle)
                        || distance(needle, c.toLowerCase(Locale.ROOT)) <= threshold)
                .sorted(Comparator.comparingInt((String c) -> distance(needle, c.toLowerCase(Locale.ROOT)))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(MAX_SUGGESTIONS)
                .collect(Collectors.toList());
    }

    private static int distance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[b.length()];
    }

    /**
     * Builder for {@link SchemaIndex}. Adding an operation that already exists
     * for its version replaces it.
     */
    public static final class Builder {

        private final Map<String, Map<String, OperationSchema>> byVersion = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers an operation schema under its version and name.
         *
         * @param schema the schema to register
         * @return this builder (fluent)
         */
        public Builder add(OperationSchema schema) {
            byVersion.computeIfAbsent(schema.apiVersion(), v -> new LinkedHashMap<>()).put(schema.name(), schema);
            return this;
        }

        /**
         * Registers every schema in the list.
         *
         * @param schemas the schemas to register
         * @return this builder (fluent)
         */
        public Builder addAll(List<OperationSchema> schemas) {
            schemas.forEach(this::add);
            return this;
        }

        /**
         * Drops every operation of a version, so that a reloaded version does
         * not keep operations its new schema no longer defines.
         *
         * @param apiVersion the version to drop
         * @return this builder (fluent)
         */
        public Builder removeVersion(String apiVersion) {
            byVersion.remove(apiVersion);
            return this;
        }

        /**
         * Builds the immutable index.
         *
         * @return the new index
         */
        public SchemaIndex build() {
            return new SchemaIndex(byVersion);
        }
    }
}
