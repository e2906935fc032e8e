package io.ucmsdk.core.model;

/**
 * Marker for a field that the caller did not supply or the server did not
 * return.
 *
 * <p>
 * Tells "not there" apart from "there but empty" ({@code ""} or
 * {@code null}), in request payloads and normalized responses alike.
 */
public enum Absent {
    VALUE;

    /** Returns {@code true} if the given value is the absent marker. */
    public static boolean is(Object value) {
        return value == VALUE;
    }

    @Override
    public String toString() {
        return "<absent>";
    }
}
