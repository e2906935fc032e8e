package io.ucmsdk.core.error;

/**
 * Abstract parent for failures raised by an {@code ApiTransport}.
 *
 * <p>
 * Facades rethrow these with the operation and API version attached (see
 * {@link #withContext}); the original exception becomes the cause.
 */
public abstract class TransportException extends UcmSdkException {

    private static final long serialVersionUID = 1L;

    protected TransportException(String message, String operation, String apiVersion) {
        super(message, operation, apiVersion, Phase.TRANSPORT);
    }

    protected TransportException(String message, Throwable cause, String operation, String apiVersion) {
        super(message, cause, operation, apiVersion, Phase.TRANSPORT);
    }

    /**
     * Returns a copy of this exception, of the same concrete type, with the
     * given call context attached. This exception is the copy's cause.
     *
     * @param operation  the remote operation being called
     * @param apiVersion the API version in effect
     * @return the contextualized exception
     */
    public abstract TransportException withContext(String operation, String apiVersion);

    /** Prefixes a transport message with call context, unless it is already there. */
    protected static String contextMessage(String message, String operation, String apiVersion) {
        String prefix = operation + " (v" + apiVersion + "): ";
        return message != null && message.startsWith(prefix) ? message : prefix + message;
    }
}
