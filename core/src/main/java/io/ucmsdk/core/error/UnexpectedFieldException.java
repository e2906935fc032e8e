package io.ucmsdk.core.error;

/** Thrown when the caller supplies a key the operation's schema does not declare. */
public final class UnexpectedFieldException extends ArgumentValidationException {

    private static final long serialVersionUID = 1L;

    public UnexpectedFieldException(String message, String operation, String apiVersion, String fieldPath) {
        super(message, operation, apiVersion, fieldPath);
    }
}
