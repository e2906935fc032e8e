package io.ucmsdk.core.error;

import java.util.List;

/** Thrown when a requested return tag is not part of the operation's {@code returnedTags} element. */
public final class ReturnTagNotValidException extends ArgumentValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> validTags;

    public ReturnTagNotValidException(
            String message, String operation, String apiVersion, String tag, List<String> validTags) {
        super(message, operation, apiVersion, tag);
        this.validTags = List.copyOf(validTags);
    }

    /** The tags the operation accepts. */
    public List<String> validTags() {
        return validTags;
    }
}
