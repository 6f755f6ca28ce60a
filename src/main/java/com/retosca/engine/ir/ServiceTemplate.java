package com.retosca.engine.ir;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Finished service template, produced by {@link ServiceTemplateBuilder#build()}.
 */
@Value
@Builder
public class ServiceTemplate {

    public static final String TOSCA_VERSION = "tosca_2_0";

    @NonNull
    @Builder.Default
    String toscaDefinitionsVersion = TOSCA_VERSION;

    String description;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    @Singular
    Map<String, ParameterDefinition> inputs;

    @Singular
    Map<String, NodeTemplate> nodeTemplates;

    @Singular
    Map<String, TemplateOutput> outputs;

    /**
     * Nested map in TOSCA file layout, ready for serialization.
     */
    public Map<String, Object> toTemplateMap() {
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("tosca_definitions_version", toscaDefinitionsVersion);
        if (description != null) {
            file.put("description", description);
        }
        if (!metadata.isEmpty()) {
            file.put("metadata", new LinkedHashMap<>(metadata));
        }

        Map<String, Object> serviceTemplate = new LinkedHashMap<>();
        if (!inputs.isEmpty()) {
            Map<String, Object> in = new LinkedHashMap<>();
            inputs.forEach((k, v) -> in.put(k, v.toTemplateMap()));
            serviceTemplate.put("inputs", in);
        }
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodeTemplates.forEach((k, v) -> nodes.put(k, v.toTemplateMap()));
        serviceTemplate.put("node_templates", nodes);
        if (!outputs.isEmpty()) {
            Map<String, Object> out = new LinkedHashMap<>();
            outputs.forEach((k, v) -> out.put(k, v.toTemplateMap()));
            serviceTemplate.put("outputs", out);
        }
        file.put("service_template", serviceTemplate);
        return file;
    }
}
