package io.ucmsdk.tools;

import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;

/**
 * Renders an operation's request and response trees as indented text, one
 * field per line:
 *
 * <pre>
 * getPhone (v14.0)
 *   request:
 *     name: string (required) {choice1}
 *     uuid: string {choice1}
 *     returnedTags: object
 *       model: string
 *   response:
 *     return: object (required)
 *       phone: object
 *         lines[]: object
 * </pre>
 *
 * <p>
 * {@code []} marks repeated fields, {@code {group}} members of a choice
 * group and {@code {group/branch}} members of a multi-field alternative.
 * {@code = value} shows a default, {@code <= n} a string length limit.
 */
public final class SchemaTreePrinter {

    private static final String INDENT = "  ";

    /** Renders both trees of an operation. */
    public String render(OperationSchema schema) {
        StringBuilder out = new StringBuilder();
        out.append(schema.name()).append(" (v").append(schema.apiVersion()).append(")\n");
        out.append(INDENT).append("request:\n");
        appendChildren(out, schema.request(), 2);
        out.append(INDENT).append("response:\n");
        appendChildren(out, schema.response(), 2);
        return out.toString();
    }

    private void appendChildren(StringBuilder out, FieldSpec object, int depth) {
        if (object.children().isEmpty()) {
            out.append(INDENT.repeat(depth)).append("(none)\n");
            return;
        }
        for (FieldSpec field : object.children()) {
            appendField(out, field, depth);
        }
    }

    private void appendField(StringBuilder out, FieldSpec field, int depth) {
        out.append(INDENT.repeat(depth)).append(field.name());
        if (field.repeated()) {
            out.append("[]");
        }
        out.append(": ");
        switch (field.kind()) {
            case PRIMITIVE -> out.append(field.primitiveType().descriptorName());
            case ENUM -> out.append("enum ").append(field.enumValues());
            case OBJECT -> out.append("object");
        }
        if (field.required()) {
            out.append(" (required)");
        }
        if (field.defaultValue() != null) {
            out.append(" = ").append(field.defaultValue());
        }
        if (field.maxLength() != null) {
            out.append(" <= ").append(field.maxLength());
        }
        if (field.choiceGroup() != null) {
            out.append(" {").append(field.choiceGroup());
            if (field.choiceBranch() != null) {
                out.append('/').append(field.choiceBranch());
            }
            out.append('}');
        }
        out.append('\n');
        if (field.isObject() && !field.children().isEmpty()) {
            for (FieldSpec child : field.children()) {
                appendField(out, child, depth + 1);
            }
        }
    }
}
