package io.ucmsdk.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ucmsdk.core.model.Absent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verified request arguments for one call, in schema order. Every field of the
 * operation's request is present: supplied values are coerced, omitted
 * optional fields carry their default or {@link Absent#VALUE}.
 *
 * <p>
 * Immutable, per call.
 */
public final class RequestPayload {

    private final String operation;
    private final String apiVersion;
    private final Map<String, Object> fields;
    private final boolean verified;

    RequestPayload(String operation, String apiVersion, Map<String, Object> fields, boolean verified) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.apiVersion = apiVersion;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.verified = verified;
    }

    /**
     * Wraps caller arguments as-is, without verification. Used when argument
     * checking is turned off in the facade options.
     *
     * @param operation  remote operation name
     * @param apiVersion API version in effect
     * @param args       the caller's arguments, may be {@code null}
     * @return an unverified payload
     */
    public static RequestPayload unverified(String operation, String apiVersion, Map<String, ?> args) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (args != null) {
            copy.putAll(args);
        }
        return new RequestPayload(operation, apiVersion, copy, false);
    }

    public String operation() {
        return operation;
    }

    public String apiVersion() {
        return apiVersion;
    }

    /** The top-level fields, in schema order for verified payloads. */
    public Map<String, Object> fields() {
        return fields;
    }

    /** Returns a top-level value, {@link Absent#VALUE} if the field is not present. */
    public Object get(String name) {
        return fields.containsKey(name) ? fields.get(name) : Absent.VALUE;
    }

    /** Whether the payload went through the signature verifier. */
    public boolean isVerified() {
        return verified;
    }

    /**
     * Renders the payload as a JSON object for transports. Absent fields are
     * omitted, explicit nulls are kept and temporal values are written as
     * ISO-8601 text.
     *
     * @return a fresh JSON object
     */
    public ObjectNode toJson() {
        return JsonRendering.objectNode(fields);
    }

    @Override
    public String toString() {
        return "RequestPayload[" + operation + "@" + apiVersion + ", fields=" + fields.keySet() + "]";
    }
}
