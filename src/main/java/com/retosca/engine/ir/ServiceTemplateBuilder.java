package com.retosca.engine.ir;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates nodes, inputs and outputs for one translation run.
 *
 * Not thread-safe and not meant to be shared between runs.
 */
public class ServiceTemplateBuilder {

    private static final Logger log = LoggerFactory.getLogger(ServiceTemplateBuilder.class);

    private final MappingDiagnostics diagnostics;
    private final Map<String, NodeTemplate> nodes = new LinkedHashMap<>();
    private final Map<String, ParameterDefinition> inputs = new LinkedHashMap<>();
    private final Map<String, TemplateOutput> outputs = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String description;

    public ServiceTemplateBuilder(MappingDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public ServiceTemplateBuilder withDescription(String description) {
        this.description = description;
        return this;
    }

    public ServiceTemplateBuilder withMetadata(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
        return this;
    }

    /**
     * Creates a node; a second node with the same name replaces the first and is reported.
     */
    public NodeTemplate addNode(String name, String type) {
        if (nodes.containsKey(name)) {
            diagnostics.report(DiagnosticKind.NODE_COLLISION,
                    "Node '" + name + "' emitted twice; the later definition replaces the earlier one");
            log.warn("Node '{}' emitted twice", name);
        }
        NodeTemplate node = new NodeTemplate(name, type);
        nodes.put(name, node);
        return node;
    }

    public Optional<NodeTemplate> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean hasNode(String name) {
        return nodes.containsKey(name);
    }

    public Map<String, NodeTemplate> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public ServiceTemplateBuilder addInput(String name, ParameterDefinition input) {
        inputs.put(name, input);
        return this;
    }

    public ServiceTemplateBuilder addOutput(String name, TemplateOutput output) {
        outputs.put(name, output);
        return this;
    }

    public Map<String, ParameterDefinition> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    public Map<String, TemplateOutput> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /**
     * Removes every requirement whose target node does not exist.
     *
     * @return removed requirements, keyed by the owning node name
     */
    public Map<String, List<RequirementAssignment>> pruneDanglingRequirements() {
        Map<String, List<RequirementAssignment>> removed = new LinkedHashMap<>();
        for (NodeTemplate node : nodes.values()) {
            List<RequirementAssignment> gone = node.removeRequirementsIf(r -> !nodes.containsKey(r.getNode()));
            if (!gone.isEmpty()) {
                removed.computeIfAbsent(node.getName(), k -> new ArrayList<>()).addAll(gone);
            }
        }
        return removed;
    }

    public ServiceTemplate build() {
        return ServiceTemplate.builder()
                .description(description)
                .metadata(metadata)
                .inputs(inputs)
                .nodeTemplates(nodes)
                .outputs(outputs)
                .build();
    }
}
