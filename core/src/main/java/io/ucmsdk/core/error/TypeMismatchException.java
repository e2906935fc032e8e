package io.ucmsdk.core.error;

import java.util.List;

/**
 * Thrown when a supplied value cannot be coerced to the declared field type,
 * or is longer than the field allows. For enum fields
 * {@link #allowedValues()} lists the accepted values; otherwise it is empty.
 */
public final class TypeMismatchException extends ArgumentValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> allowedValues;

    public TypeMismatchException(String message, String operation, String apiVersion, String fieldPath) {
        this(message, operation, apiVersion, fieldPath, List.of());
    }

    public TypeMismatchException(
            String message, String operation, String apiVersion, String fieldPath, List<String> allowedValues) {
        super(message, operation, apiVersion, fieldPath);
        this.allowedValues = List.copyOf(allowedValues);
    }

    /** The accepted enum values, in schema order. */
    public List<String> allowedValues() {
        return allowedValues;
    }
}
