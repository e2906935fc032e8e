package io.ucmsdk.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.ucmsdk.core.engine.ValueCoercion;
import io.ucmsdk.core.error.SchemaParseException;
import io.ucmsdk.core.model.ApiVersion;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.model.PrimitiveType;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses YAML or JSON schema descriptors into {@link OperationSchema}s.
 *
 * <p>
 * A descriptor has an optional {@code version}, optional named {@code types}
 * and the {@code operations} map. Each field declares exactly one of
 * {@code type} (a primitive name or a named type), {@code enum} or inline
 * {@code fields}, plus the optional {@code required}, {@code repeated},
 * {@code default}, {@code maxLength}, {@code choice}, {@code branch} and
 * {@code description} keys. A bare string is shorthand for
 * {@code {type: <string>}}. Members of one {@code choice} that also name the
 * same {@code branch} form a single alternative.
 *
 * <p>
 * The document is first checked against the bundled
 * {@code descriptor.schema.json} for value types, then walked with strict
 * unknown-key detection so that typos fail at load time instead of silently
 * loosening validation.
 *
 * <p>
 * Thread-safe.
 */
public final class DescriptorSchemaParser implements SchemaParser {

    private static final ObjectMapper YAML_MAPPER =
            new ObjectMapper(new YAMLFactory()).enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    private static final String DESCRIPTOR_SCHEMA = "/io/ucmsdk/core/schema/descriptor.schema.json";
    private static final JsonSchema STRUCTURE = loadStructureSchema();

    /** Recognized top-level descriptor keys. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("version", "description", "types", "operations");

    /** Recognized keys of an operation. */
    private static final Set<String> KNOWN_OPERATION_KEYS = Set.of("description", "request", "response");

    /** Recognized keys of a named type. */
    private static final Set<String> KNOWN_TYPE_KEYS = Set.of("description", "fields", "enum", "type");

    /** Recognized keys of a field. */
    private static final Set<String> KNOWN_FIELD_KEYS =
            Set.of("type", "enum", "fields", "required", "repeated", "default", "maxLength", "choice", "branch",
                    "description");

    @Override
    public List<OperationSchema> parse(SchemaSource source) {
        String location = source.location();
        JsonNode root = readTree(source);
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Schema descriptor must be a mapping", source.apiVersion(), location);
        }

        String apiVersion = resolveVersion(root, source);
        validateStructure(root, apiVersion, location);
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "descriptor root", apiVersion, location);

        Context ctx = new Context(apiVersion, location, root.path("types"));
        JsonNode operations = root.get("operations");
        if (operations == null || !operations.isObject() || operations.isEmpty()) {
            throw new SchemaParseException("Descriptor declares no 'operations'", apiVersion, location);
        }

        List<OperationSchema> result = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : operations.properties()) {
            String operation = entry.getKey();
            JsonNode opNode = entry.getValue();
            String block = "operations." + operation;
            if (!opNode.isObject()) {
                throw new SchemaParseException("'" + block + "' must be a mapping", apiVersion, location);
            }
            rejectUnknownKeys(opNode, KNOWN_OPERATION_KEYS, block, apiVersion, location);

            FieldSpec request = FieldSpec.builder(operation)
                    .object(parseFields(ctx, opNode.get("request"), block + ".request"))
                    .build();
            FieldSpec response = FieldSpec.builder(operation + "Response")
                    .object(parseFields(ctx, opNode.get("response"), block + ".response"))
                    .build();
            result.add(new OperationSchema(operation, apiVersion, request, response));
        }
        return result;
    }

    private List<FieldSpec> parseFields(Context ctx, JsonNode fieldsNode, String block) {
        if (fieldsNode == null || fieldsNode.isNull()) {
            return List.of();
        }
        if (!fieldsNode.isObject()) {
            throw ctx.error("'" + block + "' must be a mapping of field names");
        }
        List<FieldSpec> fields = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : fieldsNode.properties()) {
            fields.add(parseField(ctx, entry.getKey(), entry.getValue(), block + "." + entry.getKey()));
        }
        return fields;
    }

    private FieldSpec parseField(Context ctx, String name, JsonNode def, String block) {
        FieldSpec.Builder builder = FieldSpec.builder(name);
        if (def.isTextual()) {
            applyTypeRef(ctx, builder, def.asText(), block);
            return build(ctx, builder, block);
        }
        if (!def.isObject()) {
            throw ctx.error("Field '" + block + "' must be a type name or a mapping");
        }
        rejectUnknownKeys(def, KNOWN_FIELD_KEYS, block, ctx.apiVersion, ctx.location);

        int shapeKeys = (def.has("type") ? 1 : 0) + (def.has("enum") ? 1 : 0) + (def.has("fields") ? 1 : 0);
        if (shapeKeys != 1) {
            throw ctx.error("Field '" + block + "' must declare exactly one of 'type', 'enum' or 'fields'");
        }
        if (def.has("type")) {
            applyTypeRef(ctx, builder, def.get("type").asText(), block);
        } else if (def.has("enum")) {
            builder.enumeration(enumValues(ctx, def.get("enum"), block));
        } else {
            builder.object(parseFields(ctx, def.get("fields"), block + ".fields"));
        }

        builder.required(def.path("required").asBoolean(false));
        builder.repeated(def.path("repeated").asBoolean(false));
        if (def.hasNonNull("default")) {
            builder.defaultValue(def.get("default").asText());
        }
        if (def.hasNonNull("maxLength")) {
            builder.maxLength(def.get("maxLength").intValue());
        }
        if (def.hasNonNull("choice")) {
            builder.choiceGroup(def.get("choice").asText());
        }
        if (def.hasNonNull("branch")) {
            builder.choiceBranch(def.get("branch").asText());
        }
        if (def.hasNonNull("description")) {
            builder.description(def.get("description").asText());
        }
        return build(ctx, builder, block);
    }

    private void applyTypeRef(Context ctx, FieldSpec.Builder builder, String typeName, String block) {
        var primitive = PrimitiveType.fromDescriptorName(typeName);
        if (primitive.isPresent()) {
            builder.primitive(primitive.get());
            return;
        }
        JsonNode typeDef = ctx.types.get(typeName);
        if (typeDef == null) {
            throw ctx.error("Field '" + block + "' references unknown type '" + typeName + "'");
        }
        if (!ctx.expanding.add(typeName)) {
            throw ctx.error("Type '" + typeName + "' is recursive (via '" + block + "'); recursive types are not supported");
        }
        ctx.stack.push(typeName);
        try {
            String typeBlock = "types." + typeName;
            if (!typeDef.isObject()) {
                throw ctx.error("'" + typeBlock + "' must be a mapping");
            }
            rejectUnknownKeys(typeDef, KNOWN_TYPE_KEYS, typeBlock, ctx.apiVersion, ctx.location);
            if (typeDef.has("fields")) {
                builder.object(parseFields(ctx, typeDef.get("fields"), typeBlock + ".fields"));
            } else if (typeDef.has("enum")) {
                builder.enumeration(enumValues(ctx, typeDef.get("enum"), typeBlock));
            } else if (typeDef.has("type")) {
                applyTypeRef(ctx, builder, typeDef.get("type").asText(), typeBlock);
            } else {
                throw ctx.error("'" + typeBlock + "' must declare 'fields', 'enum' or 'type'");
            }
        } finally {
            ctx.expanding.remove(ctx.stack.pop());
        }
    }

    private List<String> enumValues(Context ctx, JsonNode node, String block) {
        if (!node.isArray() || node.isEmpty()) {
            throw ctx.error("'" + block + ".enum' must be a non-empty list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            if (!value.isValueNode()) {
                throw ctx.error("'" + block + ".enum' must contain only scalar values");
            }
            values.add(value.asText());
        }
        return values;
    }

    private FieldSpec build(Context ctx, FieldSpec.Builder builder, String block) {
        FieldSpec field;
        try {
            field = builder.build();
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException("Invalid field '" + block + "': " + e.getMessage(), e, ctx.apiVersion, ctx.location);
        }
        if (field.defaultValue() != null) {
            try {
                ValueCoercion.coerceDefault(field);
            } catch (IllegalArgumentException e) {
                throw new SchemaParseException(
                        "Invalid default for '" + block + "': " + e.getMessage(), e, ctx.apiVersion, ctx.location);
            }
        }
        return field;
    }

    private JsonNode readTree(SchemaSource source) {
        try {
            return YAML_MAPPER.readTree(source.content());
        } catch (JsonProcessingException e) {
            throw new SchemaParseException(
                    "Failed to parse schema descriptor: " + e.getOriginalMessage(), e, source.apiVersion(), source.location());
        }
    }

    private String resolveVersion(JsonNode root, SchemaSource source) {
        String declared = root.hasNonNull("version") ? root.get("version").asText() : null;
        String requested = source.apiVersion();
        if (declared == null && requested == null) {
            throw new SchemaParseException(
                    "No API version: the descriptor declares none and the source was loaded without one",
                    null,
                    source.location());
        }
        try {
            String normalizedRequested = requested != null ? ApiVersion.normalize(requested) : null;
            String normalizedDeclared = declared != null ? ApiVersion.normalize(declared) : null;
            if (normalizedRequested != null && normalizedDeclared != null
                    && !normalizedRequested.equals(normalizedDeclared)) {
                throw new SchemaParseException(
                        "Descriptor declares version " + normalizedDeclared + " but was loaded as " + normalizedRequested,
                        normalizedRequested,
                        source.location());
            }
            return normalizedRequested != null ? normalizedRequested : normalizedDeclared;
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(e.getMessage(), e, requested, source.location());
        }
    }

    private void validateStructure(JsonNode root, String apiVersion, String location) {
        Set<ValidationMessage> errors = STRUCTURE.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaParseException("Schema descriptor is structurally invalid: " + detail, apiVersion, location);
        }
    }

    /**
     * Rejects unknown keys in a descriptor block by throwing
     * {@link SchemaParseException} if any key is not in the allowed set.
     */
    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String apiVersion, String location) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SchemaParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + ", recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    apiVersion,
                    location);
        }
    }

    private static JsonSchema loadStructureSchema() {
        try (InputStream in = DescriptorSchemaParser.class.getResourceAsStream(DESCRIPTOR_SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DESCRIPTOR_SCHEMA);
            }
            JsonNode schemaNode = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DESCRIPTOR_SCHEMA, e);
        }
    }

    /** Per-parse state: version, location, named types and the expansion stack for cycle detection. */
    private static final class Context {
        final String apiVersion;
        final String location;
        final JsonNode types;
        final Set<String> expanding = new HashSet<>();
        final Deque<String> stack = new ArrayDeque<>();

        Context(String apiVersion, String location, JsonNode types) {
            this.apiVersion = apiVersion;
            this.location = location;
            this.types = types;
        }

        SchemaParseException error(String message) {
            return new SchemaParseException(message, apiVersion, location);
        }
    }
}
