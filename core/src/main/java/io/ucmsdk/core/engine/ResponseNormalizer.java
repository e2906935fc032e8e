package io.ucmsdk.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.ucmsdk.core.error.ResponseShapeException;
import io.ucmsdk.core.error.UnknownEnumValueException;
import io.ucmsdk.core.model.Absent;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.model.PrimitiveType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw response tree into a {@link NormalizedResponse} by walking it in
 * lockstep with the operation's response schema.
 *
 * <ul>
 * <li>Fields missing from the raw tree become {@link Absent#VALUE}; a raw
 * {@code null} stays {@code null} (an empty list for repeated fields).</li>
 * <li>Repeated fields are always lists, also when the server returned a
 * single bare element.</li>
 * <li>Primitives wrapped as {@code {"_value_1": v, ...}} or
 * {@code {"value": v}} are unwrapped to {@code v}.</li>
 * <li>Strings are trimmed; blank text for any other type reads as
 * {@code null}.</li>
 * <li>Date-times accept ISO-8601 text or epoch seconds.</li>
 * <li>Raw keys the schema does not know are dropped and logged at DEBUG.</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ResponseNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseNormalizer.class);

    private static final String WRAPPED_VALUE = "_value_1";
    private static final String PLAIN_VALUE = "value";

    private final boolean strictEnums;

    /** Creates a normalizer that rejects unknown enum values. */
    public ResponseNormalizer() {
        this(true);
    }

    /**
     * @param strictEnums {@code true} to raise {@link UnknownEnumValueException}
     *                    for values outside an enum's known set, {@code false}
     *                    to pass them through with a warning
     */
    public ResponseNormalizer(boolean strictEnums) {
        this.strictEnums = strictEnums;
    }

    public boolean strictEnums() {
        return strictEnums;
    }

    /**
     * Normalizes a raw response.
     *
     * @param schema      the operation's schema
     * @param rawResponse the response body as returned by the transport; may be
     *                    {@code null}
     * @return the normalized response
     * @throws UnknownEnumValueException if strict and an enum value is unknown
     * @throws ResponseShapeException    if a value does not fit its field
     */
    public NormalizedResponse normalize(OperationSchema schema, JsonNode rawResponse) {
        Call call = new Call(schema);
        JsonNode root = rawResponse == null || rawResponse.isNull() || rawResponse.isMissingNode()
                ? null
                : rawResponse;
        if (root != null && !root.isObject()) {
            throw new ResponseShapeException(
                    call.prefix() + "response body must be an object but got " + ValueCoercion.describe(root),
                    schema.name(),
                    schema.apiVersion(),
                    "");
        }
        Map<String, Object> values = normalizeObject(call, schema.response(), root, "");
        return new NormalizedResponse(schema.name(), schema.apiVersion(), values, rawResponse, true);
    }

    private Map<String, Object> normalizeObject(Call call, FieldSpec spec, JsonNode object, String path) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (object != null) {
            for (Iterator<String> names = object.fieldNames(); names.hasNext(); ) {
                String name = names.next();
                if (!spec.hasChild(name)) {
                    LOG.debug("Dropping unknown response field {}: {}", call.operation(), child(path, name));
                }
            }
        }
        for (FieldSpec field : spec.children()) {
            JsonNode node = object != null ? object.get(field.name()) : null;
            String fieldPath = child(path, field.name());
            result.put(field.name(), node == null ? Absent.VALUE : normalizeField(call, field, node, fieldPath));
        }
        return Collections.unmodifiableMap(result);
    }

    private Object normalizeField(Call call, FieldSpec field, JsonNode node, String path) {
        if (node.isNull()) {
            return field.repeated() ? List.of() : null;
        }
        if (field.repeated()) {
            List<Object> values = new ArrayList<>();
            if (node.isArray()) {
                for (int i = 0; i < node.size(); i++) {
                    values.add(normalizeValue(call, field, node.get(i), path + "[" + i + "]"));
                }
            } else {
                values.add(normalizeValue(call, field, node, path + "[0]"));
            }
            return Collections.unmodifiableList(values);
        }
        if (node.isArray()) {
            if (node.size() == 1) {
                return normalizeValue(call, field, node.get(0), path);
            }
            throw new ResponseShapeException(
                    call.prefix() + "'" + path + "' is single-valued but the response holds " + node.size()
                            + " values",
                    call.operation(),
                    call.apiVersion(),
                    path);
        }
        return normalizeValue(call, field, node, path);
    }

    private Object normalizeValue(Call call, FieldSpec field, JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (field.isObject()) {
            if (node.isObject()) {
                return normalizeObject(call, field, node, path);
            }
            if (node.isTextual() && node.textValue().isBlank()) {
                return null;
            }
            throw new ResponseShapeException(
                    call.prefix() + "'" + path + "' must be an object but got " + ValueCoercion.describe(node),
                    call.operation(),
                    call.apiVersion(),
                    path);
        }

        JsonNode scalarNode = unwrap(call, node, path);
        if (scalarNode.isNull()) {
            return null;
        }
        Object scalar;
        try {
            scalar = ValueCoercion.scalarOf(scalarNode);
        } catch (IllegalArgumentException e) {
            throw new ResponseShapeException(
                    call.prefix() + "'" + path + "': " + e.getMessage(), e, call.operation(), call.apiVersion(), path);
        }

        if (field.primitiveType() == PrimitiveType.STRING) {
            return ValueCoercion.toText(scalar);
        }
        if (scalar instanceof String text && text.isBlank()) {
            return null;
        }
        return switch (field.kind()) {
            case ENUM -> enumValue(call, field, scalar, path);
            default -> coerce(call, field, scalar, path);
        };
    }

    private Object enumValue(Call call, FieldSpec field, Object scalar, String path) {
        String matched = ValueCoercion.matchEnum(field.enumValues(), scalar);
        if (matched != null) {
            return matched;
        }
        String value = ValueCoercion.toText(scalar);
        if (strictEnums) {
            throw new UnknownEnumValueException(
                    call.prefix() + "'" + path + "' returned unknown value '" + value + "', known values are "
                            + field.enumValues(),
                    call.operation(),
                    call.apiVersion(),
                    path,
                    value,
                    field.enumValues());
        }
        LOG.warn(
                "Passing through unknown enum value: operation={}, version={}, field={}, value={}",
                call.operation(),
                call.apiVersion(),
                path,
                value);
        return value;
    }

    private Object coerce(Call call, FieldSpec field, Object scalar, String path) {
        try {
            return ValueCoercion.coerce(field.primitiveType(), scalar, true);
        } catch (IllegalArgumentException e) {
            throw new ResponseShapeException(
                    call.prefix() + "'" + path + "': " + e.getMessage(), e, call.operation(), call.apiVersion(), path);
        }
    }

    /** Unwraps {@code {"_value_1": v}} and {@code {"value": v}} to {@code v}. */
    private static JsonNode unwrap(Call call, JsonNode node, String path) {
        if (!node.isObject()) {
            return node;
        }
        if (node.has(WRAPPED_VALUE)) {
            return node.get(WRAPPED_VALUE);
        }
        if (node.size() == 1 && node.has(PLAIN_VALUE)) {
            return node.get(PLAIN_VALUE);
        }
        throw new ResponseShapeException(
                call.prefix() + "'" + path + "' expects a single value but got an object with keys "
                        + fieldNames(node),
                call.operation(),
                call.apiVersion(),
                path);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private record Call(OperationSchema schema) {
        String operation() {
            return schema.name();
        }

        String apiVersion() {
            return schema.apiVersion();
        }

        String prefix() {
            return schema.name() + " (v" + schema.apiVersion() + "): ";
        }
    }
}
