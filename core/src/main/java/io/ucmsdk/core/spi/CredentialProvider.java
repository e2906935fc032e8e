package io.ucmsdk.core.spi;

import java.util.Objects;

/**
 * Supplies credentials to {@link ApiTransport} implementations. The core never
 * reads credentials itself.
 */
@FunctionalInterface
public interface CredentialProvider {

    /** Returns the credentials to use for the next call. */
    Credentials credentials();

    /** A provider that always returns the same credentials. */
    static CredentialProvider of(String username, String password) {
        Credentials credentials = new Credentials(username, password);
        return () -> credentials;
    }

    /**
     * Username and password for HTTP basic authentication.
     *
     * @param username the account name
     * @param password the password; never rendered by {@link #toString()}
     */
    record Credentials(String username, String password) {

        public Credentials {
            Objects.requireNonNull(username, "username must not be null");
            Objects.requireNonNull(password, "password must not be null");
        }

        @Override
        public String toString() {
            return "Credentials[username=" + username + ", password=****]";
        }
    }
}
