package io.ucmsdk.core.error;

/** Thrown when a required field is absent or explicitly null. */
public final class MissingFieldException extends ArgumentValidationException {

    private static final long serialVersionUID = 1L;

    public MissingFieldException(String message, String operation, String apiVersion, String fieldPath) {
        super(message, operation, apiVersion, fieldPath);
    }
}
