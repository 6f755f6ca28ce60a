package com.retosca.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of resolving one property: a literal, an input reference or an attribute reference.
 *
 * The set of variants is closed; the constructor is private to this file.
 */
public abstract class ResolvedValue {

    public enum Kind {
        LITERAL, SYMBOLIC_INPUT, SYMBOLIC_ATTRIBUTE
    }

    private ResolvedValue() {
    }

    public abstract Kind getKind();

    /**
     * Rendering of this value inside the emitted template.
     */
    public abstract Object toTemplateValue();

    public boolean isSymbolic() {
        return getKind() != Kind.LITERAL;
    }

    public static Literal literal(Object value) {
        return new Literal(value);
    }

    public static SymbolicInput input(String variable) {
        return new SymbolicInput(variable, null);
    }

    public static SymbolicInput input(String variable, Object key) {
        return new SymbolicInput(variable, key);
    }

    public static SymbolicAttribute attribute(String nodeId, String attributeName) {
        return new SymbolicAttribute(nodeId, attributeName);
    }

    public static final class Literal extends ResolvedValue {
        private final Object value;

        private Literal(Object value) {
            this.value = value;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.LITERAL;
        }

        @Override
        public Object toTemplateValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Literal(" + value + ")";
        }
    }

    /**
     * {@code {"$get_input": name}} or {@code {"$get_input": [name, key]}}.
     */
    public static final class SymbolicInput extends ResolvedValue {
        private final String variable;
        private final Object key;

        private SymbolicInput(String variable, Object key) {
            this.variable = Objects.requireNonNull(variable, "variable");
            this.key = key;
        }

        public String getVariable() {
            return variable;
        }

        public Object getKey() {
            return key;
        }

        @Override
        public Kind getKind() {
            return Kind.SYMBOLIC_INPUT;
        }

        @Override
        public Object toTemplateValue() {
            Map<String, Object> fn = new LinkedHashMap<>();
            fn.put("$get_input", key == null ? variable : List.of(variable, key));
            return fn;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SymbolicInput other
                    && variable.equals(other.variable)
                    && Objects.equals(key, other.key);
        }

        @Override
        public int hashCode() {
            return Objects.hash(variable, key);
        }

        @Override
        public String toString() {
            return key == null ? "SymbolicInput(" + variable + ")" : "SymbolicInput(" + variable + ", " + key + ")";
        }
    }

    /**
     * {@code {"$get_attribute": [node, attribute]}}.
     */
    public static final class SymbolicAttribute extends ResolvedValue {
        private final String nodeId;
        private final String attributeName;

        private SymbolicAttribute(String nodeId, String attributeName) {
            this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
            this.attributeName = Objects.requireNonNull(attributeName, "attributeName");
        }

        public String getNodeId() {
            return nodeId;
        }

        public String getAttributeName() {
            return attributeName;
        }

        @Override
        public Kind getKind() {
            return Kind.SYMBOLIC_ATTRIBUTE;
        }

        @Override
        public Object toTemplateValue() {
            Map<String, Object> fn = new LinkedHashMap<>();
            fn.put("$get_attribute", List.of(nodeId, attributeName));
            return fn;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SymbolicAttribute other
                    && nodeId.equals(other.nodeId)
                    && attributeName.equals(other.attributeName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeId, attributeName);
        }

        @Override
        public String toString() {
            return "SymbolicAttribute(" + nodeId + ", " + attributeName + ")";
        }
    }
}
