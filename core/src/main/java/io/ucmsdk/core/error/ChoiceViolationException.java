package io.ucmsdk.core.error;

import java.util.List;

/** Thrown when a choice group receives more than one member, or none when the group is required. */
public final class ChoiceViolationException extends ArgumentValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> options;

    public ChoiceViolationException(
            String message, String operation, String apiVersion, String fieldPath, List<String> options) {
        super(message, operation, apiVersion, fieldPath);
        this.options = List.copyOf(options);
    }

    /** Paths of the fields the caller may choose between. */
    public List<String> options() {
        return options;
    }
}
