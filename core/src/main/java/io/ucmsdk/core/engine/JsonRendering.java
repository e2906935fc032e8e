package io.ucmsdk.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.ucmsdk.core.model.Absent;
import java.util.Collection;
import java.util.Map;

/**
 * Renders canonical value trees (maps, lists, scalars, {@link Absent}) as JSON.
 * Absent entries are omitted; temporals are written as ISO-8601 text.
 */
final class JsonRendering {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonRendering() {}

    static ObjectNode objectNode(Map<?, ?> map) {
        ObjectNode node = MAPPER.createObjectNode();
        map.forEach((key, value) -> {
            if (!Absent.is(value)) {
                node.set(String.valueOf(key), toNode(value));
            }
        });
        return node;
    }

    static JsonNode toNode(Object value) {
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            return objectNode(map);
        }
        if (value instanceof Collection<?> list) {
            ArrayNode array = MAPPER.createArrayNode();
            for (Object element : list) {
                if (!Absent.is(element)) {
                    array.add(toNode(element));
                }
            }
            return array;
        }
        return MAPPER.valueToTree(value);
    }
}
