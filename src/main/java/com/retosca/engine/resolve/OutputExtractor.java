package com.retosca.engine.resolve;

import com.retosca.engine.model.OutputDefinition;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.ExpressionReferences;
import com.retosca.engine.plan.JsonValues;
import com.retosca.engine.plan.PlanDocument;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects root-module outputs from the configuration and pairs them with their values.
 *
 * Values come from the planned outputs, then from the prior state. An output is sensitive when
 * either its declaration or its planned value says so.
 */
public class OutputExtractor {

    private static final Logger log = LoggerFactory.getLogger(OutputExtractor.class);

    public Map<String, OutputDefinition> extract(PlanDocument plan, ConfigurationIndex configuration) {
        Map<String, OutputDefinition> outputs = new LinkedHashMap<>();
        JsonNode planned = plan.plannedOutputs();
        JsonNode prior = plan.priorStateOutputs();

        Iterator<Map.Entry<String, JsonNode>> it = configuration.rootOutputs().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            JsonNode decl = entry.getValue();
            outputs.put(name, OutputDefinition.builder()
                    .name(name)
                    .description(decl.path("description").asText(null))
                    .sensitive(decl.path("sensitive").asBoolean(false)
                            || planned.path(name).path("sensitive").asBoolean(false)
                            || prior.path(name).path("sensitive").asBoolean(false))
                    .resolvedValue(valueOf(name, planned, prior))
                    .definingReferences(ExpressionReferences.collect(decl.path("expression")))
                    .build());
        }

        // outputs recorded in the values sections without a configuration entry
        for (JsonNode section : new JsonNode[] { planned, prior }) {
            Iterator<String> names = section.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!outputs.containsKey(name)) {
                    outputs.put(name, OutputDefinition.builder()
                            .name(name)
                            .sensitive(section.path(name).path("sensitive").asBoolean(false))
                            .resolvedValue(valueOf(name, planned, prior))
                            .build());
                }
            }
        }
        log.debug("Extracted {} output(s)", outputs.size());
        return outputs;
    }

    private static Object valueOf(String name, JsonNode planned, JsonNode prior) {
        Object value = JsonValues.toJava(planned.path(name).path("value"));
        return value != null ? value : JsonValues.toJava(prior.path(name).path("value"));
    }
}
