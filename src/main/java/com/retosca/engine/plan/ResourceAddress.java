package com.retosca.engine.plan;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Parsed Terraform resource address.
 *
 * Handles module nesting with instance keys, data sources, numeric and string instance keys and a
 * trailing attribute path, e.g. {@code module.net["eu"].aws_subnet.private[1].cidr_block}.
 */
@Value
@Builder(toBuilder = true)
public class ResourceAddress {

    public static final String MANAGED = "managed";
    public static final String DATA = "data";

    @Singular
    List<ModuleInstance> modules;

    @NonNull
    @Builder.Default
    String mode = MANAGED;

    @NonNull
    String type;

    @NonNull
    String name;

    InstanceKey key;

    /**
     * Attribute path following the resource part, only present for references.
     */
    String attribute;

    @Value
    public static class ModuleInstance {
        @NonNull
        String name;
        InstanceKey key;

        public String render() {
            return "module." + name + (key == null ? "" : key.render());
        }
    }

    /**
     * A count index or for_each key.
     */
    @Value
    public static class InstanceKey {
        @NonNull
        String value;
        boolean quoted;

        public static InstanceKey index(int index) {
            return new InstanceKey(Integer.toString(index), false);
        }

        public static InstanceKey parse(String token) {
            String t = token.trim();
            if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
                return new InstanceKey(t.substring(1, t.length() - 1), true);
            }
            return new InstanceKey(t, false);
        }

        public Integer asIndex() {
            if (quoted || value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
                return null;
            }
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        public String render() {
            return quoted ? "[\"" + value + "\"]" : "[" + value + "]";
        }
    }

    public static ResourceAddress parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        List<String> segments = splitSegments(raw);
        ResourceAddressBuilder builder = ResourceAddress.builder();

        int i = 0;
        while (i + 1 < segments.size() && "module".equals(segments.get(i))) {
            Segment s = Segment.of(segments.get(i + 1));
            builder.module(new ModuleInstance(s.name, s.key));
            i += 2;
        }
        if (i < segments.size() && DATA.equals(segments.get(i))) {
            builder.mode(DATA);
            i++;
        }
        if (i + 1 >= segments.size()) {
            throw new IllegalArgumentException("Not a resource address: " + raw);
        }
        builder.type(segments.get(i));
        Segment n = Segment.of(segments.get(i + 1));
        builder.name(n.name).key(n.key);
        i += 2;
        if (i < segments.size()) {
            builder.attribute(String.join(".", segments.subList(i, segments.size())));
        }
        return builder.build();
    }

    /**
     * Parses without throwing; returns null when the text is not a resource address.
     */
    public static ResourceAddress tryParse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return parse(raw);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isData() {
        return DATA.equals(mode);
    }

    public Integer getIndex() {
        return key == null ? null : key.asIndex();
    }

    /**
     * Module instance path with keys, e.g. {@code module.a[0].module.b}; empty for the root module.
     */
    public String modulePath() {
        return modules.stream().map(ModuleInstance::render).collect(Collectors.joining("."));
    }

    /**
     * Module path without instance keys, as used by the configuration section.
     */
    public String moduleConfigPath() {
        return modules.stream().map(m -> "module." + m.getName()).collect(Collectors.joining("."));
    }

    public List<String> moduleNames() {
        return modules.stream().map(ModuleInstance::getName).toList();
    }

    /**
     * {@code type.name} or {@code data.type.name} with no module prefix and no key.
     */
    public String localName() {
        return (isData() ? "data." : "") + type + "." + name;
    }

    /**
     * Address with every instance key removed; matches configuration entries.
     */
    public String configAddress() {
        String modulePart = moduleConfigPath();
        return modulePart.isEmpty() ? localName() : modulePart + "." + localName();
    }

    /**
     * Canonical resource address without the attribute path.
     */
    public String resourceAddress() {
        String modulePart = modulePath();
        String local = localName() + (key == null ? "" : key.render());
        return modulePart.isEmpty() ? local : modulePart + "." + local;
    }

    public ResourceAddress withoutAttribute() {
        return attribute == null ? this : toBuilder().attribute(null).build();
    }

    public ResourceAddress withKey(InstanceKey newKey) {
        return toBuilder().key(newKey).build();
    }

    public ResourceAddress withModules(List<ModuleInstance> newModules) {
        return toBuilder().clearModules().modules(newModules).build();
    }

    @Override
    public String toString() {
        return attribute == null ? resourceAddress() : resourceAddress() + "." + attribute;
    }

    /**
     * Splits on dots outside brackets and quotes.
     */
    public static List<String> splitSegments(String raw) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inQuote = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"' && depth > 0 && (i == 0 || raw.charAt(i - 1) != '\\')) {
                inQuote = !inQuote;
            } else if (!inQuote && c == '[') {
                depth++;
            } else if (!inQuote && c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (!inQuote && depth == 0 && c == '.') {
                segments.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        segments.add(current.toString());
        return segments;
    }

    private static final class Segment {
        final String name;
        final InstanceKey key;

        private Segment(String name, InstanceKey key) {
            this.name = name;
            this.key = key;
        }

        static Segment of(String text) {
            int open = text.indexOf('[');
            if (open < 0 || !text.endsWith("]")) {
                return new Segment(text, null);
            }
            String keyText = text.substring(open + 1, text.length() - 1);
            // splat references such as aws_subnet.private[*] carry no usable key
            if ("*".equals(keyText.trim())) {
                return new Segment(text.substring(0, open), null);
            }
            return new Segment(text.substring(0, open), InstanceKey.parse(keyText));
        }
    }
}
