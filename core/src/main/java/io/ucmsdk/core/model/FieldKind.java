package io.ucmsdk.core.model;

/** Structural kind of a {@link FieldSpec}. Cardinality is tracked separately by {@link FieldSpec#repeated()}. */
public enum FieldKind {
    PRIMITIVE,
    ENUM,
    OBJECT
}
