package io.ucmsdk.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Scalar types a {@link FieldSpec} can declare. The descriptor name is the
 * spelling used in schema descriptor files.
 */
public enum PrimitiveType {
    STRING("string"),
    INTEGER("integer"),
    DECIMAL("decimal"),
    BOOLEAN("boolean"),
    DATE_TIME("dateTime"),
    DATE("date");

    private final String descriptorName;

    PrimitiveType(String descriptorName) {
        this.descriptorName = descriptorName;
    }

    /** The name used for this type in schema descriptors. */
    public String descriptorName() {
        return descriptorName;
    }

    /**
     * Looks up a type by its descriptor name (case-insensitive).
     *
     * @param name descriptor type name, e.g. {@code dateTime}
     * @return the type, or empty if the name is not a primitive
     */
    public static Optional<PrimitiveType> fromDescriptorName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for (PrimitiveType type : values()) {
            if (type.descriptorName.toLowerCase(Locale.ROOT).equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
