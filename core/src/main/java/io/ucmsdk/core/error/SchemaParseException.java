package io.ucmsdk.core.error;

/** Thrown when a schema source is malformed or uses a construct the parsers do not support. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String apiVersion, String source) {
        super(message, null, apiVersion, source);
    }

    public SchemaParseException(String message, Throwable cause, String apiVersion, String source) {
        super(message, cause, null, apiVersion, source);
    }
}
