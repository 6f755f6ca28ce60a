package com.retosca.engine.ir;

import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.model.ResolvedValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Mutable node template under construction. Owned by a single {@link ServiceTemplateBuilder}.
 */
public class NodeTemplate {

    private final String name;
    private final String type;
    private String description;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> capabilities = new LinkedHashMap<>();
    private final List<RequirementAssignment> requirements = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    NodeTemplate(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public NodeTemplate withDescription(String description) {
        this.description = description;
        return this;
    }

    /**
     * Sets a property; resolved values are stored in their template rendering. Null values are ignored.
     */
    public NodeTemplate withProperty(String key, Object value) {
        Object rendered = value instanceof ResolvedValue rv ? rv.toTemplateValue() : value;
        if (rendered != null) {
            properties.put(key, rendered);
        }
        return this;
    }

    public NodeTemplate withMetadata(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
        return this;
    }

    public NodeTemplate withMetadata(Map<String, Object> entries) {
        entries.forEach(this::withMetadata);
        return this;
    }

    public NodeTemplate addCapability(String capabilityName) {
        capabilities.computeIfAbsent(capabilityName, k -> new LinkedHashMap<>());
        return this;
    }

    public NodeTemplate addCapability(String capabilityName, Map<String, Object> capabilityProperties) {
        Map<String, Object> props = capabilities.computeIfAbsent(capabilityName, k -> new LinkedHashMap<>());
        capabilityProperties.forEach((k, v) -> {
            if (v != null) {
                props.put(k, v instanceof ResolvedValue rv ? rv.toTemplateValue() : v);
            }
        });
        return this;
    }

    public NodeTemplate addRequirement(String requirementName, String targetNode, RelationshipKind relationship) {
        return addRequirement(RequirementAssignment.builder()
                .name(requirementName)
                .node(targetNode)
                .relationship(relationship)
                .build());
    }

    /**
     * Adds a requirement unless an identical one is already present.
     */
    public NodeTemplate addRequirement(RequirementAssignment requirement) {
        if (!requirements.contains(requirement)) {
            requirements.add(requirement);
        }
        return this;
    }

    public boolean hasRequirementTo(String targetNode) {
        return requirements.stream().anyMatch(r -> r.getNode().equals(targetNode));
    }

    List<RequirementAssignment> removeRequirementsIf(Predicate<RequirementAssignment> predicate) {
        List<RequirementAssignment> removed = requirements.stream().filter(predicate).toList();
        requirements.removeAll(removed);
        return removed;
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, Map<String, Object>> getCapabilities() {
        return Collections.unmodifiableMap(capabilities);
    }

    public List<RequirementAssignment> getRequirements() {
        return Collections.unmodifiableList(requirements);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Map<String, Object> toTemplateMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        if (description != null) {
            body.put("description", description);
        }
        if (!metadata.isEmpty()) {
            body.put("metadata", new LinkedHashMap<>(metadata));
        }
        if (!properties.isEmpty()) {
            body.put("properties", new LinkedHashMap<>(properties));
        }
        if (!capabilities.isEmpty()) {
            Map<String, Object> caps = new LinkedHashMap<>();
            capabilities.forEach((capName, props) -> {
                Map<String, Object> cap = new LinkedHashMap<>();
                if (!props.isEmpty()) {
                    cap.put("properties", new LinkedHashMap<>(props));
                }
                caps.put(capName, cap);
            });
            body.put("capabilities", caps);
        }
        if (!requirements.isEmpty()) {
            body.put("requirements", requirements.stream().map(RequirementAssignment::toTemplateMap).toList());
        }
        return body;
    }
}
