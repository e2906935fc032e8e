package io.ucmsdk.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of an operation's request or response tree.
 *
 * <p>
 * A field is a primitive, an enum with a fixed value set, or an object with
 * ordered children unique by name. Cardinality is orthogonal to the kind: a
 * {@link #repeated()} field carries a sequence of values of its kind.
 *
 * <p>
 * Fields that share a {@link #choiceGroup()} are mutually exclusive. For
 * choice members {@link #required()} applies to the group as a whole: at least
 * one member must then be supplied, and never more than one. Members that
 * also share a {@link #choiceBranch()} form one alternative and may be
 * supplied together.
 *
 * <p>
 * The parent link is set once when the node is adopted by its parent and is
 * used only for path reporting. Ownership flows strictly downward from the
 * {@link OperationSchema} that holds the root.
 *
 * <p>
 * Immutable after construction apart from that one-time link; safe to share
 * across threads once the owning index is published.
 */
public final class FieldSpec {

    private final String name;
    private final FieldKind kind;
    private final PrimitiveType primitiveType;
    private final List<String> enumValues;
    private final Map<String, FieldSpec> children;
    private final boolean required;
    private final boolean repeated;
    private final String defaultValue;
    private final Integer maxLength;
    private final String choiceGroup;
    private final String choiceBranch;
    private final String description;
    private FieldSpec parent;

    private FieldSpec(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.primitiveType = builder.primitiveType;
        this.enumValues = List.copyOf(builder.enumValues);
        this.required = builder.required;
        this.repeated = builder.repeated;
        this.defaultValue = builder.defaultValue;
        this.maxLength = builder.maxLength;
        this.choiceGroup = builder.choiceGroup;
        this.choiceBranch = builder.choiceBranch;
        this.description = builder.description;

        if (choiceBranch != null && choiceGroup == null) {
            throw new IllegalArgumentException("Field '" + name + "' names a choice branch but no choice group");
        }
        if (maxLength != null && (kind != FieldKind.PRIMITIVE || primitiveType != PrimitiveType.STRING)) {
            throw new IllegalArgumentException("maxLength applies only to string fields, not '" + name + "'");
        }

        Map<String, FieldSpec> adopted = new LinkedHashMap<>();
        for (FieldSpec child : builder.children) {
            if (adopted.containsKey(child.name)) {
                throw new IllegalArgumentException(
                        "Duplicate child '" + child.name + "' in field '" + name + "'");
            }
            if (child.parent != null) {
                throw new IllegalArgumentException(
                        "Field '" + child.name + "' already belongs to '" + child.parent.name + "'");
            }
            child.parent = this;
            adopted.put(child.name, child);
        }
        this.children = Collections.unmodifiableMap(adopted);
    }

    /**
     * Returns a builder for a field with the given name. The kind defaults to
     * {@link FieldKind#PRIMITIVE} with type {@link PrimitiveType#STRING}.
     *
     * @param name the field name
     * @return a fresh builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Shorthand for an optional, single-valued primitive field. */
    public static FieldSpec primitive(String name, PrimitiveType type) {
        return builder(name).primitive(type).build();
    }

    /** Shorthand for an optional, single-valued enum field. */
    public static FieldSpec enumeration(String name, List<String> values) {
        return builder(name).enumeration(values).build();
    }

    public String name() {
        return name;
    }

    public FieldKind kind() {
        return kind;
    }

    /** The scalar type for {@link FieldKind#PRIMITIVE} fields, otherwise {@code null}. */
    public PrimitiveType primitiveType() {
        return primitiveType;
    }

    /** Allowed values for {@link FieldKind#ENUM} fields, in schema order; empty otherwise. */
    public List<String> enumValues() {
        return enumValues;
    }

    /** Children in schema order; empty unless this is an {@link FieldKind#OBJECT}. */
    public Collection<FieldSpec> children() {
        return children.values();
    }

    /** Returns the named child, or {@code null}. */
    public FieldSpec child(String childName) {
        return children.get(childName);
    }

    public boolean hasChild(String childName) {
        return children.containsKey(childName);
    }

    public boolean required() {
        return required;
    }

    public boolean repeated() {
        return repeated;
    }

    /** Declared default in its textual schema form, or {@code null}. */
    public String defaultValue() {
        return defaultValue;
    }

    /** Longest accepted string value in characters, or {@code null} if unbounded. */
    public Integer maxLength() {
        return maxLength;
    }

    /** Name of the choice group this field belongs to, or {@code null}. */
    public String choiceGroup() {
        return choiceGroup;
    }

    /**
     * Name of the alternative within the choice group this field belongs to,
     * or {@code null} if the field is an alternative on its own.
     */
    public String choiceBranch() {
        return choiceBranch;
    }

    /**
     * Key of the alternative this choice member belongs to: the branch name,
     * or the field name for a single-field alternative.
     */
    public String choiceAlternative() {
        return choiceBranch != null ? choiceBranch : name;
    }

    public String description() {
        return description;
    }

    /** The enclosing field, or {@code null} for a root. */
    public FieldSpec parent() {
        return parent;
    }

    public boolean isObject() {
        return kind == FieldKind.OBJECT;
    }

    /**
     * Dotted schema path from the operation root, excluding the root itself,
     * e.g. {@code phone.lines.line.dirn}. Runtime paths with element indexes
     * are built by the verifier and normalizer.
     */
    public String path() {
        if (parent == null || parent.parent == null) {
            return name;
        }
        return parent.path() + "." + name;
    }

    /**
     * Groups this object's children by choice group, in schema order. Children
     * without a group are not included.
     *
     * @return choice group name to member fields
     */
    public Map<String, List<FieldSpec>> choiceGroups() {
        Map<String, List<FieldSpec>> groups = new LinkedHashMap<>();
        for (FieldSpec child : children.values()) {
            if (child.choiceGroup != null) {
                groups.computeIfAbsent(child.choiceGroup, g -> new ArrayList<>()).add(child);
            }
        }
        return groups;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(':');
        switch (kind) {
            case PRIMITIVE -> sb.append(primitiveType.descriptorName());
            case ENUM -> sb.append("enum").append(enumValues);
            case OBJECT -> sb.append("object").append(children.keySet());
        }
        if (repeated) {
            sb.append("[]");
        }
        if (required) {
            sb.append(" (required)");
        }
        return sb.toString();
    }

    /** Builder for {@link FieldSpec}. Children are adopted when {@link #build()} is called. */
    public static final class Builder {

        private final String name;
        private FieldKind kind = FieldKind.PRIMITIVE;
        private PrimitiveType primitiveType = PrimitiveType.STRING;
        private List<String> enumValues = List.of();
        private final List<FieldSpec> children = new ArrayList<>();
        private boolean required;
        private boolean repeated;
        private String defaultValue;
        private Integer maxLength;
        private String choiceGroup;
        private String choiceBranch;
        private String description;

        Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name must not be null or blank");
            }
            this.name = name;
        }

        public Builder primitive(PrimitiveType type) {
            this.kind = FieldKind.PRIMITIVE;
            this.primitiveType = Objects.requireNonNull(type, "type must not be null");
            this.enumValues = List.of();
            return this;
        }

        public Builder enumeration(List<String> values) {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("enum field '" + name + "' must declare at least one value");
            }
            this.kind = FieldKind.ENUM;
            this.primitiveType = null;
            this.enumValues = List.copyOf(values);
            return this;
        }

        /** Makes this an object field with the given children (may be empty). */
        public Builder object(List<FieldSpec> fields) {
            this.kind = FieldKind.OBJECT;
            this.primitiveType = null;
            this.enumValues = List.of();
            this.children.clear();
            this.children.addAll(fields);
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder repeated(boolean repeated) {
            this.repeated = repeated;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        /** Limits string values to {@code maxLength} characters; {@code null} removes the limit. */
        public Builder maxLength(Integer maxLength) {
            if (maxLength != null && maxLength < 1) {
                throw new IllegalArgumentException("maxLength of '" + name + "' must be positive, got " + maxLength);
            }
            this.maxLength = maxLength;
            return this;
        }

        public Builder choiceGroup(String choiceGroup) {
            this.choiceGroup = choiceGroup;
            return this;
        }

        public Builder choiceBranch(String choiceBranch) {
            this.choiceBranch = choiceBranch;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public FieldSpec build() {
            return new FieldSpec(this);
        }
    }
}
