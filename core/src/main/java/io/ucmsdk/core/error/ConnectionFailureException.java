package io.ucmsdk.core.error;

/**
 * Thrown when the remote server cannot be reached, refuses the connection or
 * times out, and when a transport fails with an exception it did not classify.
 */
public final class ConnectionFailureException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final String server;

    public ConnectionFailureException(String message, String server) {
        super(message, null, null);
        this.server = server;
    }

    public ConnectionFailureException(String message, Throwable cause, String server) {
        super(message, cause, null, null);
        this.server = server;
    }

    private ConnectionFailureException(ConnectionFailureException original, String operation, String apiVersion) {
        super(contextMessage(original.getMessage(), operation, apiVersion), original, operation, apiVersion);
        this.server = original.server;
    }

    /** The server address the transport tried to reach. */
    public String server() {
        return server;
    }

    @Override
    public ConnectionFailureException withContext(String operation, String apiVersion) {
        return new ConnectionFailureException(this, operation, apiVersion);
    }
}
