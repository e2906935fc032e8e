package io.ucmsdk.core.error;

/**
 * Abstract parent for schema load and lookup errors. Carries an additional
 * {@code source} field identifying the schema file or resource involved.
 */
public abstract class SchemaLoadException extends UcmSdkException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String operation, String apiVersion, String source) {
        super(message, operation, apiVersion, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(
            String message, Throwable cause, String operation, String apiVersion, String source) {
        super(message, cause, operation, apiVersion, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier involved, or {@code null}. */
    public String source() {
        return source;
    }
}
