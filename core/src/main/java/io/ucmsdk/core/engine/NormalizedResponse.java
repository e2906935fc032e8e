package io.ucmsdk.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ucmsdk.core.model.Absent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A response in canonical form: field name to value, in schema order.
 *
 * <p>
 * Values are {@link String}, {@link Boolean}, {@link Long},
 * {@link java.math.BigDecimal}, {@link java.time.OffsetDateTime},
 * {@link java.time.LocalDate}, {@link List} (repeated fields), {@link Map}
 * (objects), {@code null} (returned empty) or {@link Absent#VALUE} (not
 * returned). Nested maps and lists are unmodifiable.
 *
 * <p>
 * When response normalization is switched off the raw tree is only
 * converted to maps and lists; {@link #isNormalized()} then returns
 * {@code false}.
 */
public final class NormalizedResponse {

    private static final ObjectMapper RAW_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String operation;
    private final String apiVersion;
    private final Map<String, Object> values;
    private final JsonNode raw;
    private final boolean normalized;

    NormalizedResponse(String operation, String apiVersion, Map<String, Object> values, JsonNode raw, boolean normalized) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.apiVersion = apiVersion;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.raw = raw;
        this.normalized = normalized;
    }

    /**
     * Wraps a raw response without normalizing it.
     *
     * @param operation  remote operation name
     * @param apiVersion API version in effect
     * @param raw        the transport's response, may be {@code null}
     * @return the wrapped response
     */
    public static NormalizedResponse unnormalized(String operation, String apiVersion, JsonNode raw) {
        Map<String, Object> values = raw != null && raw.isObject() ? RAW_MAPPER.convertValue(raw, MAP_TYPE) : Map.of();
        return new NormalizedResponse(operation, apiVersion, values, raw, false);
    }

    public String operation() {
        return operation;
    }

    public String apiVersion() {
        return apiVersion;
    }

    /** All top-level values, in schema order. */
    public Map<String, Object> values() {
        return values;
    }

    /** The response as the transport returned it, or {@code null}. */
    public JsonNode raw() {
        return raw;
    }

    public boolean isNormalized() {
        return normalized;
    }

    /** Returns a top-level value; {@link Absent#VALUE} if the field is unknown or was not returned. */
    public Object get(String name) {
        return values.containsKey(name) ? values.get(name) : Absent.VALUE;
    }

    /**
     * Follows a dotted path through nested objects, e.g.
     * {@code return.phone.name}. Returns {@link Absent#VALUE} as soon as a
     * segment is absent, {@code null} if a segment is {@code null}.
     */
    public Object find(String dottedPath) {
        Object current = values;
        for (String segment : dottedPath.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return current == null ? null : Absent.VALUE;
            }
            current = map.containsKey(segment) ? map.get(segment) : Absent.VALUE;
            if (Absent.is(current)) {
                return Absent.VALUE;
            }
        }
        return current;
    }

    public boolean isAbsent(String name) {
        return Absent.is(get(name));
    }

    /** Returns a string value, or {@code null} if it is null or absent. */
    public String getString(String name) {
        return typed(name, String.class);
    }

    /** Returns an object value, or {@code null} if it is null or absent. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getObject(String name) {
        return typed(name, Map.class);
    }

    /** Returns a repeated value, or {@code null} if it is absent. */
    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        return typed(name, List.class);
    }

    private <T> T typed(String name, Class<T> type) {
        Object value = get(name);
        if (value == null || Absent.is(value)) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                    "Field '" + name + "' holds " + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * Renders the values as JSON: absent fields are omitted, nulls kept,
     * temporals written as ISO-8601 text.
     *
     * @return a fresh JSON object
     */
    public ObjectNode toJson() {
        return JsonRendering.objectNode(values);
    }

    @Override
    public String toString() {
        return "NormalizedResponse[" + operation + "@" + apiVersion + ", " + values + "]";
    }
}
