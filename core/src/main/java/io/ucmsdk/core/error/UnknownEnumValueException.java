package io.ucmsdk.core.error;

import java.util.List;

/** Thrown when the server returns an enum value the loaded schema does not know. */
public final class UnknownEnumValueException extends ResponseNormalizationException {

    private static final long serialVersionUID = 1L;

    private final String value;
    private final List<String> allowedValues;

    public UnknownEnumValueException(
            String message,
            String operation,
            String apiVersion,
            String fieldPath,
            String value,
            List<String> allowedValues) {
        super(message, operation, apiVersion, fieldPath);
        this.value = value;
        this.allowedValues = List.copyOf(allowedValues);
    }

    /** The value the server returned. */
    public String value() {
        return value;
    }

    /** The values the schema declares, in schema order. */
    public List<String> allowedValues() {
        return allowedValues;
    }
}
