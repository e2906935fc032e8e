package io.ucmsdk.core.error;

/** Thrown when no schema source can be resolved for a server's API version. */
public final class UnsupportedVersionException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public UnsupportedVersionException(String message, String apiVersion) {
        super(message, null, apiVersion, null);
    }
}
