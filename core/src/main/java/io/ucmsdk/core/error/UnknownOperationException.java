package io.ucmsdk.core.error;

/** Thrown when the schema index holds no operation with the given name for the given version. */
public final class UnknownOperationException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public UnknownOperationException(String message, String operation, String apiVersion) {
        super(message, operation, apiVersion, null);
    }
}
