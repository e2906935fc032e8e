package io.ucmsdk.core.engine;

import io.ucmsdk.core.error.ReturnTagNotValidException;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the {@code returnedTags} argument of AXL {@code get}/{@code list}
 * operations, which selects the fields the server sends back.
 *
 * <p>
 * Each requested tag must be a child of the operation's {@code returnedTags}
 * element. Optional leaf tags are emitted as {@code null}, which the server
 * reads as a nil element; object tags are emitted as their whole sub-tree.
 * Within a sub-tree only the first alternative of each choice group is
 * emitted. An empty selection means every tag.
 *
 * <p>
 * AXL declares every return tag optional. A leaf that is nonetheless
 * required gets its declared default, or its first enum value, or an empty
 * string.
 */
public final class ReturnTagResolver {

    /** Name of the request element holding the selection. */
    public static final String RETURNED_TAGS = "returnedTags";

    /**
     * Resolves a tag selection for an operation.
     *
     * @param schema the operation's schema
     * @param tags   the tags to return; {@code null} or empty for all of them
     * @return the {@code returnedTags} value, ready to be placed in the
     *         arguments
     * @throws ReturnTagNotValidException if a tag is unknown or the operation
     *                                    takes no {@code returnedTags}
     */
    public Map<String, Object> resolve(OperationSchema schema, Collection<String> tags) {
        FieldSpec returnedTags = schema.requestField(RETURNED_TAGS);
        if (returnedTags == null || !returnedTags.isObject()) {
            throw new ReturnTagNotValidException(
                    schema.name() + " (v" + schema.apiVersion() + "): operation does not accept return tags",
                    schema.name(),
                    schema.apiVersion(),
                    RETURNED_TAGS,
                    List.of());
        }
        if (tags == null || tags.isEmpty()) {
            return subtree(returnedTags);
        }
        Map<String, Object> selection = new LinkedHashMap<>();
        for (String tag : tags) {
            FieldSpec field = returnedTags.child(tag);
            if (field == null) {
                List<String> valid = validTags(returnedTags);
                throw new ReturnTagNotValidException(
                        schema.name() + " (v" + schema.apiVersion() + "): '" + tag
                                + "' is not a valid return tag; valid tags are " + valid,
                        schema.name(),
                        schema.apiVersion(),
                        RETURNED_TAGS + "." + tag,
                        valid);
            }
            selection.put(tag, valueOf(field));
        }
        return Collections.unmodifiableMap(selection);
    }

    /** Returns the tags an operation accepts, empty if it takes no {@code returnedTags}. */
    public List<String> validTags(OperationSchema schema) {
        FieldSpec returnedTags = schema.requestField(RETURNED_TAGS);
        return returnedTags == null ? List.of() : validTags(returnedTags);
    }

    private static List<String> validTags(FieldSpec returnedTags) {
        return returnedTags.children().stream().map(FieldSpec::name).collect(Collectors.toList());
    }

    private static Object valueOf(FieldSpec field) {
        if (field.isObject()) {
            return subtree(field);
        }
        return field.required() ? placeholder(field) : null;
    }

    private static Object placeholder(FieldSpec leaf) {
        if (leaf.defaultValue() != null) {
            return leaf.defaultValue();
        }
        if (!leaf.enumValues().isEmpty()) {
            return leaf.enumValues().get(0);
        }
        return "";
    }

    private static Map<String, Object> subtree(FieldSpec object) {
        Map<String, String> chosen = new HashMap<>();
        for (Map.Entry<String, List<FieldSpec>> group : object.choiceGroups().entrySet()) {
            chosen.put(group.getKey(), group.getValue().get(0).choiceAlternative());
        }
        // LinkedHashMap because leaf values are null
        Map<String, Object> tree = new LinkedHashMap<>();
        for (FieldSpec child : object.children()) {
            if (child.choiceGroup() == null || child.choiceAlternative().equals(chosen.get(child.choiceGroup()))) {
                tree.put(child.name(), valueOf(child));
            }
        }
        return Collections.unmodifiableMap(tree);
    }
}
