package io.ucmsdk.core.error;

/**
 * Abstract parent for caller-input validation failures.
 *
 * <p>
 * Raised before anything is sent to the transport. Carries the full path of
 * the offending field, e.g. {@code phone.lines[0].directoryNumber}.
 */
public abstract class ArgumentValidationException extends UcmSdkException {

    private static final long serialVersionUID = 1L;

    private final String fieldPath;

    protected ArgumentValidationException(String message, String operation, String apiVersion, String fieldPath) {
        super(message, operation, apiVersion, Phase.VALIDATION);
        this.fieldPath = fieldPath;
    }

    /** Path of the offending field, or {@code null} when the error concerns the whole argument set. */
    public String fieldPath() {
        return fieldPath;
    }
}
