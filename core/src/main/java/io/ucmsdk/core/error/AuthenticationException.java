package io.ucmsdk.core.error;

/** Thrown when the server rejects the configured credentials. The password is never carried. */
public final class AuthenticationException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final String server;
    private final String username;

    public AuthenticationException(String message, String server, String username) {
        super(message, null, null);
        this.server = server;
        this.username = username;
    }

    private AuthenticationException(AuthenticationException original, String operation, String apiVersion) {
        super(contextMessage(original.getMessage(), operation, apiVersion), original, operation, apiVersion);
        this.server = original.server;
        this.username = original.username;
    }

    /** The server that rejected the credentials. */
    public String server() {
        return server;
    }

    /** The username that was rejected. */
    public String username() {
        return username;
    }

    @Override
    public AuthenticationException withContext(String operation, String apiVersion) {
        return new AuthenticationException(this, operation, apiVersion);
    }
}
