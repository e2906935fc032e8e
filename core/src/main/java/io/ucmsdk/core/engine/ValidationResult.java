package io.ucmsdk.core.engine;

import io.ucmsdk.core.error.ArgumentValidationException;
import java.util.Objects;

/**
 * Outcome of {@link SignatureVerifier#verify}: either a complete
 * {@link RequestPayload} or the first {@link ArgumentValidationException}
 * found.
 */
public final class ValidationResult {

    private final RequestPayload payload;
    private final ArgumentValidationException error;

    private ValidationResult(RequestPayload payload, ArgumentValidationException error) {
        this.payload = payload;
        this.error = error;
    }

    public static ValidationResult valid(RequestPayload payload) {
        return new ValidationResult(Objects.requireNonNull(payload, "payload must not be null"), null);
    }

    public static ValidationResult invalid(ArgumentValidationException error) {
        return new ValidationResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * Returns the verified payload.
     *
     * @throws IllegalStateException if validation failed
     */
    public RequestPayload payload() {
        if (error != null) {
            throw new IllegalStateException("Validation failed: " + error.getMessage(), error);
        }
        return payload;
    }

    /** The validation error, or {@code null} if the arguments are valid. */
    public ArgumentValidationException error() {
        return error;
    }

    /**
     * Returns the payload, or throws the validation error.
     *
     * @throws ArgumentValidationException if validation failed
     */
    public RequestPayload payloadOrThrow() {
        if (error != null) {
            throw error;
        }
        return payload;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid, " + payload + "]" : "ValidationResult[invalid, " + error.getMessage() + "]";
    }
}
