package io.ucmsdk.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes server version strings to the {@code major.minor} granularity at
 * which schemas are kept.
 *
 * <p>
 * {@code "12.5.1.10000-1"} becomes {@code "12.5"}; {@code "14"} becomes
 * {@code "14.0"}.
 */
public final class ApiVersion {

    private static final Pattern VERSION = Pattern.compile("^\\s*(\\d{1,2})(?!\\d)(?:\\.(\\d+))?");

    private ApiVersion() {}

    /**
     * Normalizes a version string.
     *
     * @param version raw version, e.g. from the UDS
     *                {@code /cucm-uds/version} resource
     * @return the {@code major.minor} form
     * @throws IllegalArgumentException if the string does not start with a
     *                                  version number
     */
    public static String normalize(String version) {
        if (version == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        Matcher matcher = VERSION.matcher(version);
        if (!matcher.find()) {
            throw new IllegalArgumentException("'" + version + "' is not a valid UCM version");
        }
        String minor = matcher.group(2) != null ? matcher.group(2) : "0";
        return Integer.parseInt(matcher.group(1)) + "." + minor;
    }

    /** Returns {@code true} if {@link #normalize} would accept the string. */
    public static boolean isValid(String version) {
        return version != null && VERSION.matcher(version).find();
    }
}
