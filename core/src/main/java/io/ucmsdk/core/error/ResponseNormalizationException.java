package io.ucmsdk.core.error;

/**
 * Abstract parent for errors raised while normalizing a response. These
 * signal schema or version drift between the client and the server and are
 * never silently dropped.
 */
public abstract class ResponseNormalizationException extends UcmSdkException {

    private static final long serialVersionUID = 1L;

    private final String fieldPath;

    protected ResponseNormalizationException(String message, String operation, String apiVersion, String fieldPath) {
        super(message, operation, apiVersion, Phase.RESPONSE);
        this.fieldPath = fieldPath;
    }

    protected ResponseNormalizationException(
            String message, Throwable cause, String operation, String apiVersion, String fieldPath) {
        super(message, cause, operation, apiVersion, Phase.RESPONSE);
        this.fieldPath = fieldPath;
    }

    /** Path of the response field that could not be normalized. */
    public String fieldPath() {
        return fieldPath;
    }
}
