package io.ucmsdk.tools.probe;

import java.net.URI;

/**
 * A failed diagnostic step of {@link ServerProbe}.
 *
 * <p>
 * The {@link Kind} tells an operator where to look: the network, the server
 * itself, or the credentials.
 */
public class ProbeException extends Exception {

    private static final long serialVersionUID = 1L;

    /** What went wrong. */
    public enum Kind {
        /** The address answered but is not a CUCM server. */
        NOT_UCM,
        /** Connection refused or host unreachable. */
        UNREACHABLE,
        /** No answer within the configured timeouts. */
        TIMEOUT,
        /** The server answered with a status the step does not expect. */
        UNEXPECTED_STATUS,
        /** The server rejected the username or password. */
        INVALID_CREDENTIALS,
        /** The web service is not deployed or not activated. */
        SERVICE_NOT_FOUND,
        /** The version document was missing or malformed. */
        VERSION_UNREADABLE
    }

    private final Kind kind;
    private final URI url;

    public ProbeException(Kind kind, String message, URI url) {
        this(kind, message, url, null);
    }

    public ProbeException(Kind kind, String message, URI url, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
    }

    public Kind kind() {
        return kind;
    }

    /** The URL the failed request went to. */
    public URI url() {
        return url;
    }
}
