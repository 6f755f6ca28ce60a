package com.retosca.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * A Terraform variable type reduced to the tags the IR understands.
 *
 * Types arrive either as strings ({@code "list(string)"}) or in the JSON array form used by
 * plans ({@code ["list", "string"]}).
 */
@Value
public class VariableType {

    public enum Tag {
        STRING("string"),
        NUMBER("float"),
        BOOL("boolean"),
        LIST("list"),
        MAP("map");

        private final String toscaType;

        Tag(String toscaType) {
            this.toscaType = toscaType;
        }

        public String getToscaType() {
            return toscaType;
        }

        public boolean isCollection() {
            return this == LIST || this == MAP;
        }
    }

    @NonNull
    Tag tag;

    /**
     * IR type of the collection entries, null for scalars.
     */
    String entrySchema;

    /**
     * False when the declared type was not recognized and defaulted to string.
     */
    boolean recognized;

    @NonNull
    String declared;

    public static VariableType string() {
        return new VariableType(Tag.STRING, null, true, "string");
    }

    public static VariableType parse(JsonNode type) {
        if (type == null || type.isMissingNode() || type.isNull()) {
            return new VariableType(Tag.STRING, null, true, "string");
        }
        if (type.isArray()) {
            String head = type.path(0).asText("");
            JsonNode element = type.path(1);
            String entry = element.isMissingNode() ? "string" : scalarToscaType(element);
            return fromHead(head, entry, type.toString());
        }
        return parse(type.asText());
    }

    public static VariableType parse(String type) {
        if (type == null || type.isBlank()) {
            return string();
        }
        String t = type.trim().toLowerCase(Locale.ROOT);
        int open = t.indexOf('(');
        if (open > 0 && t.endsWith(")")) {
            String head = t.substring(0, open);
            String inner = t.substring(open + 1, t.length() - 1).trim();
            return fromHead(head, toscaTypeOf(inner), type);
        }
        return fromHead(t, null, type);
    }

    private static VariableType fromHead(String head, String entry, String declared) {
        return switch (head) {
            case "string" -> new VariableType(Tag.STRING, null, true, declared);
            case "number" -> new VariableType(Tag.NUMBER, null, true, declared);
            case "bool" -> new VariableType(Tag.BOOL, null, true, declared);
            case "list", "set", "tuple" -> new VariableType(Tag.LIST, entry == null ? "string" : entry, true, declared);
            case "map", "object" -> new VariableType(Tag.MAP, entry == null ? "string" : entry, true, declared);
            case "any", "dynamic" -> new VariableType(Tag.STRING, null, true, declared);
            default -> new VariableType(Tag.STRING, null, false, declared);
        };
    }

    private static String scalarToscaType(JsonNode element) {
        if (element.isArray()) {
            return fromHead(element.path(0).asText(""), null, element.toString()).getTag().getToscaType();
        }
        return toscaTypeOf(element.asText());
    }

    private static String toscaTypeOf(String inner) {
        if (inner.isEmpty()) {
            return "string";
        }
        int open = inner.indexOf('(');
        String head = open > 0 ? inner.substring(0, open) : inner;
        return fromHead(head.trim(), null, inner).getTag().getToscaType();
    }
}
