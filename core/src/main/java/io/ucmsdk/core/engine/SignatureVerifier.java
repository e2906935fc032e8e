package io.ucmsdk.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ucmsdk.core.error.ArgumentValidationException;
import io.ucmsdk.core.error.ChoiceViolationException;
import io.ucmsdk.core.error.MissingFieldException;
import io.ucmsdk.core.error.TypeMismatchException;
import io.ucmsdk.core.error.UnexpectedFieldException;
import io.ucmsdk.core.model.Absent;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks caller-supplied arguments against an operation's request shape
 * before anything is sent.
 *
 * <p>
 * Policy, applied level by level:
 * <ol>
 * <li>keys not declared in the schema fail with
 * {@link UnexpectedFieldException};</li>
 * <li>choice groups with members of several alternatives supplied, or none
 * when the group is required, fail with {@link ChoiceViolationException};
 * members of one multi-field alternative may be supplied together, each of
 * them optional;</li>
 * <li>fields are then checked in schema order: a missing or {@code null}
 * required field fails with {@link MissingFieldException}, a value that
 * cannot be coerced or that exceeds the field's {@code maxLength} fails with
 * {@link TypeMismatchException}.</li>
 * </ol>
 * The first error wins. Omitted optional fields are filled with their declared
 * default or {@link Absent#VALUE}, so the payload always has the full request
 * shape. {@link Absent#VALUE} supplied by the caller counts as omitted, which
 * lets normalized responses be sent back unchanged.
 *
 * <p>
 * Stateless and thread-safe; performs no I/O.
 */
public final class SignatureVerifier {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    /**
     * Verifies arguments given as a map.
     *
     * @param schema the operation's schema
     * @param args   field name to value; {@code null} means no arguments
     * @return the payload, or the first validation error
     */
    public ValidationResult verify(OperationSchema schema, Map<String, ?> args) {
        Call call = new Call(schema);
        try {
            Map<String, Object> fields = verifyObject(call, schema.request(), args != null ? args : Map.of(), "");
            return ValidationResult.valid(new RequestPayload(schema.name(), schema.apiVersion(), fields, true));
        } catch (ArgumentValidationException e) {
            return ValidationResult.invalid(e);
        }
    }

    /**
     * Verifies arguments given as a JSON object.
     *
     * @param schema the operation's schema
     * @param args   a JSON object; {@code null}, missing and JSON null mean no
     *               arguments
     * @return the payload, or the first validation error
     */
    public ValidationResult verify(OperationSchema schema, JsonNode args) {
        if (args == null || args.isNull() || args.isMissingNode()) {
            return verify(schema, Map.of());
        }
        if (!args.isObject()) {
            return ValidationResult.invalid(new TypeMismatchException(
                    "Arguments for " + schema.key() + " must be an object but got " + ValueCoercion.describe(args),
                    schema.name(),
                    schema.apiVersion(),
                    ""));
        }
        return verify(schema, MAPPER.convertValue(args, MAP_TYPE));
    }

    private Map<String, Object> verifyObject(Call call, FieldSpec objectSpec, Map<?, ?> supplied, String path) {
        for (Object key : supplied.keySet()) {
            String name = String.valueOf(key);
            if (!objectSpec.hasChild(name)) {
                String fieldPath = child(path, name);
                throw new UnexpectedFieldException(
                        call.prefix() + "unexpected field '" + fieldPath + "'" + expected(objectSpec),
                        call.operation(),
                        call.apiVersion(),
                        fieldPath);
            }
        }

        for (Map.Entry<String, List<FieldSpec>> group : objectSpec.choiceGroups().entrySet()) {
            List<FieldSpec> members = group.getValue();
            Map<String, List<String>> alternatives = new LinkedHashMap<>();
            for (FieldSpec member : members) {
                alternatives.computeIfAbsent(member.choiceAlternative(), a -> new ArrayList<>()).add(member.name());
            }
            List<String> options = alternatives.values().stream()
                    .map(names -> String.join("+", names))
                    .collect(Collectors.toList());
            List<FieldSpec> present = members.stream()
                    .filter(member -> isSupplied(supplied, member.name()))
                    .collect(Collectors.toList());
            FieldSpec conflicting = present.stream()
                    .filter(member -> !member.choiceAlternative().equals(present.get(0).choiceAlternative()))
                    .findFirst()
                    .orElse(null);
            if (conflicting != null) {
                List<String> names = present.stream().map(FieldSpec::name).collect(Collectors.toList());
                throw new ChoiceViolationException(
                        call.prefix() + "fields " + names + at(path) + " are mutually exclusive; supply one of "
                                + options,
                        call.operation(),
                        call.apiVersion(),
                        child(path, conflicting.name()),
                        options);
            }
            boolean required = members.stream().anyMatch(FieldSpec::required);
            if (present.isEmpty() && required) {
                throw new ChoiceViolationException(
                        call.prefix() + "one of " + options + " is required" + at(path),
                        call.operation(),
                        call.apiVersion(),
                        path,
                        options);
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        for (FieldSpec field : objectSpec.children()) {
            Object raw = supplied.containsKey(field.name()) ? plain(supplied.get(field.name())) : Absent.VALUE;
            result.put(field.name(), verifyField(call, field, raw, child(path, field.name())));
        }
        return Collections.unmodifiableMap(result);
    }

    private Object verifyField(Call call, FieldSpec field, Object raw, String path) {
        boolean choiceMember = field.choiceGroup() != null;
        if (Absent.is(raw)) {
            if (choiceMember) {
                return Absent.VALUE;
            }
            if (field.required()) {
                throw missing(call, path);
            }
            if (field.defaultValue() != null) {
                Object defaultValue = ValueCoercion.coerceDefault(field);
                return field.repeated() ? List.of(defaultValue) : defaultValue;
            }
            return Absent.VALUE;
        }
        if (raw == null) {
            if (choiceMember) {
                return Absent.VALUE;
            }
            if (field.required()) {
                throw missing(call, path);
            }
            return null;
        }

        if (field.repeated()) {
            List<Object> elements = raw instanceof Collection<?> collection ? new ArrayList<>(collection) : List.of(raw);
            if (elements.isEmpty() && field.required() && !choiceMember) {
                throw missing(call, path);
            }
            List<Object> values = new ArrayList<>(elements.size());
            for (int i = 0; i < elements.size(); i++) {
                String elementPath = path + "[" + i + "]";
                Object element = plain(elements.get(i));
                if (element == null || Absent.is(element)) {
                    throw new TypeMismatchException(
                            call.prefix() + "'" + elementPath + "' must not be null",
                            call.operation(),
                            call.apiVersion(),
                            elementPath);
                }
                values.add(verifyValue(call, field, element, elementPath));
            }
            return Collections.unmodifiableList(values);
        }
        if (raw instanceof Collection<?>) {
            throw new TypeMismatchException(
                    call.prefix() + "'" + path + "' takes a single value but got a list",
                    call.operation(),
                    call.apiVersion(),
                    path);
        }
        return verifyValue(call, field, raw, path);
    }

    private Object verifyValue(Call call, FieldSpec field, Object value, String path) {
        switch (field.kind()) {
            case OBJECT -> {
                if (!(value instanceof Map<?, ?> map)) {
                    throw new TypeMismatchException(
                            call.prefix() + "'" + path + "' must be an object but got " + ValueCoercion.describe(value),
                            call.operation(),
                            call.apiVersion(),
                            path);
                }
                return verifyObject(call, field, map, path);
            }
            case ENUM -> {
                String matched = ValueCoercion.matchEnum(field.enumValues(), value);
                if (matched == null) {
                    throw new TypeMismatchException(
                            call.prefix() + "'" + path + "' must be one of " + field.enumValues() + " but got "
                                    + ValueCoercion.describe(value),
                            call.operation(),
                            call.apiVersion(),
                            path,
                            field.enumValues());
                }
                return matched;
            }
            default -> {
                if (value instanceof Map<?, ?>) {
                    throw new TypeMismatchException(
                            call.prefix() + "'" + path + "' expects " + field.primitiveType().descriptorName()
                                    + " but got an object",
                            call.operation(),
                            call.apiVersion(),
                            path);
                }
                Object coerced;
                try {
                    coerced = ValueCoercion.coerce(field.primitiveType(), value, false);
                } catch (IllegalArgumentException e) {
                    throw new TypeMismatchException(
                            call.prefix() + "'" + path + "': " + e.getMessage(),
                            call.operation(),
                            call.apiVersion(),
                            path);
                }
                if (field.maxLength() != null && coerced instanceof String text) {
                    int length = text.codePointCount(0, text.length());
                    if (length > field.maxLength()) {
                        throw new TypeMismatchException(
                                call.prefix() + "'" + path + "' is longer than " + field.maxLength()
                                        + " characters (got " + length + ")",
                                call.operation(),
                                call.apiVersion(),
                                path);
                    }
                }
                return coerced;
            }
        }
    }

    /** Unwraps JSON nodes nested in map arguments into plain Java values. */
    private static Object plain(Object value) {
        if (!(value instanceof JsonNode node)) {
            return value;
        }
        if (node.isMissingNode()) {
            return Absent.VALUE;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return MAPPER.convertValue(node, MAP_TYPE);
        }
        if (node.isArray()) {
            return MAPPER.convertValue(node, LIST_TYPE);
        }
        return ValueCoercion.scalarOf(node);
    }

    private static boolean isSupplied(Map<?, ?> supplied, String name) {
        if (!supplied.containsKey(name)) {
            return false;
        }
        Object value = plain(supplied.get(name));
        return value != null && !Absent.is(value);
    }

    private static MissingFieldException missing(Call call, String path) {
        return new MissingFieldException(
                call.prefix() + "required field '" + path + "' is missing", call.operation(), call.apiVersion(), path);
    }

    private static String expected(FieldSpec objectSpec) {
        List<String> names = objectSpec.children().stream().map(FieldSpec::name).collect(Collectors.toList());
        return names.isEmpty() ? " (no fields are accepted here)" : " (expected one of " + names + ")";
    }

    private static String at(String path) {
        return path.isEmpty() ? "" : " in '" + path + "'";
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
