package io.ucmsdk.core.error;

/** Thrown when a returned value cannot be coerced to its declared type (e.g. an object where text is due). */
public final class ResponseShapeException extends ResponseNormalizationException {

    private static final long serialVersionUID = 1L;

    public ResponseShapeException(String message, String operation, String apiVersion, String fieldPath) {
        super(message, operation, apiVersion, fieldPath);
    }

    public ResponseShapeException(
            String message, Throwable cause, String operation, String apiVersion, String fieldPath) {
        super(message, cause, operation, apiVersion, fieldPath);
    }
}
