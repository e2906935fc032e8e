package io.ucmsdk.core.model;

import java.util.Objects;

/**
 * Expected shape of one remote operation for one API version: an object root
 * for the request arguments and one for the response body.
 *
 * <p>
 * Immutable, thread-safe. Created at load time by the schema parsers and
 * owned by the {@code SchemaIndex}.
 *
 * @param name       operation name, e.g. {@code getPhone}
 * @param apiVersion normalized API version, e.g. {@code 14.0}
 * @param request    object root holding the request fields
 * @param response   object root holding the response fields
 */
public record OperationSchema(String name, String apiVersion, FieldSpec request, FieldSpec response) {

    public OperationSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(apiVersion, "apiVersion must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(response, "response must not be null");
        if (!request.isObject() || !response.isObject()) {
            throw new IllegalArgumentException("request and response roots must be object fields");
        }
    }

    /** Returns the top-level request field with the given name, or {@code null}. */
    public FieldSpec requestField(String fieldName) {
        return request.child(fieldName);
    }

    /** Returns the top-level response field with the given name, or {@code null}. */
    public FieldSpec responseField(String fieldName) {
        return response.child(fieldName);
    }

    /** Returns the {@code name@version} key used in log lines. */
    public String key() {
        return name + "@" + apiVersion;
    }
}
