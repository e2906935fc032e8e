package io.ucmsdk.core.error;

/**
 * Abstract base for all ucm-sdk exceptions.
 *
 * <p>
 * Never thrown directly. The concrete subclasses sit under
 * {@link SchemaLoadException}, {@link ArgumentValidationException},
 * {@link ResponseNormalizationException} and {@link TransportException}.
 */
public abstract class UcmSdkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        VALIDATION,
        RESPONSE,
        TRANSPORT
    }

    private final String operation;
    private final String apiVersion;
    private final Phase phase;

    protected UcmSdkException(String message, String operation, String apiVersion, Phase phase) {
        super(message);
        this.operation = operation;
        this.apiVersion = apiVersion;
        this.phase = phase;
    }

    protected UcmSdkException(String message, Throwable cause, String operation, String apiVersion, Phase phase) {
        super(message, cause);
        this.operation = operation;
        this.apiVersion = apiVersion;
        this.phase = phase;
    }

    /** The remote operation that failed, or {@code null} if not yet known. */
    public String operation() {
        return operation;
    }

    /** The API version in effect, or {@code null} if not yet identified. */
    public String apiVersion() {
        return apiVersion;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
