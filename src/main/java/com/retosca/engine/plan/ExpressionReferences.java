package com.retosca.engine.plan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the {@code references} lists declared anywhere inside a configuration expression,
 * including nested blocks. Constant values are not inspected.
 */
public final class ExpressionReferences {

    private ExpressionReferences() {
    }

    public static List<String> collect(JsonNode expression) {
        Set<String> refs = new LinkedHashSet<>();
        collectInto(expression, refs);
        return new ArrayList<>(refs);
    }

    /**
     * References pointing at input variables, returned as bare variable names in declaration order.
     */
    public static List<String> variableNames(JsonNode expression) {
        List<String> names = new ArrayList<>();
        for (String ref : collect(expression)) {
            if (ref.startsWith("var.")) {
                String name = ref.substring(4);
                int cut = indexOfAny(name, '.', '[');
                if (cut >= 0) {
                    name = name.substring(0, cut);
                }
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static void collectInto(JsonNode node, Set<String> refs) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectInto(item, refs);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if ("references".equals(key) && value.isArray()) {
                for (JsonNode ref : value) {
                    if (ref.isTextual()) {
                        refs.add(ref.asText());
                    }
                }
            } else if (!"constant_value".equals(key)) {
                collectInto(value, refs);
            }
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }
}
