package io.ucmsdk.core.schema;

import io.ucmsdk.core.model.OperationSchema;
import java.util.List;

/**
 * Turns one schema document into the operations it declares.
 *
 * <p>
 * Implementations are stateless and thread-safe. A failure is always
 * reported as a {@link io.ucmsdk.core.error.SchemaParseException} and never
 * yields a partial result.
 */
public interface SchemaParser {

    /**
     * Parses the source.
     *
     * @param source the schema document
     * @return the declared operations, all stamped with the same normalized
     *         API version
     * @throws io.ucmsdk.core.error.SchemaParseException if the document is
     *                                                   malformed or uses an
     *                                                   unsupported construct
     */
    List<OperationSchema> parse(SchemaSource source);
}
