package com.retosca.engine.resolve;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.ir.ParameterDefinition;
import com.retosca.engine.model.VariableDefinition;
import com.retosca.engine.model.VariableType;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.JsonValues;
import com.retosca.engine.plan.PlanDocument;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads root-module variable declarations and translates them to template inputs.
 */
public class VariableExtractor {

    private static final Logger log = LoggerFactory.getLogger(VariableExtractor.class);

    /**
     * Declared variables in declaration order, each carrying the value effective for this plan.
     */
    public Map<String, VariableDefinition> extract(PlanDocument plan, ConfigurationIndex configuration,
                                                   MappingDiagnostics diagnostics) {
        Map<String, VariableDefinition> variables = new LinkedHashMap<>();
        JsonNode declared = configuration.rootVariables();
        JsonNode supplied = plan.variableValues();

        Iterator<Map.Entry<String, JsonNode>> it = declared.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            JsonNode decl = entry.getValue();

            VariableType type = VariableType.parse(decl.path("type"));
            if (!type.isRecognized()) {
                diagnostics.report(DiagnosticKind.UNKNOWN_VARIABLE_TYPE,
                        "Variable '" + name + "' has unrecognized type '" + type.getDeclared() + "'; using string");
                log.warn("Variable '{}' has unrecognized type '{}'; using string", name, type.getDeclared());
            }

            boolean hasDefault = decl.has("default");
            Object defaultValue = hasDefault ? JsonValues.toJava(decl.get("default")) : null;
            JsonNode suppliedValue = supplied.path(name).path("value");
            Object effective = suppliedValue.isMissingNode() ? defaultValue : JsonValues.toJava(suppliedValue);

            variables.put(name, VariableDefinition.builder()
                    .name(name)
                    .type(type)
                    .defaultValue(defaultValue)
                    .hasDefault(hasDefault && defaultValue != null)
                    .sensitive(decl.path("sensitive").asBoolean(false))
                    .description(decl.path("description").asText(null))
                    .effectiveValue(effective)
                    .build());
        }

        // values supplied for variables the configuration section does not declare
        Iterator<String> names = supplied.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!variables.containsKey(name)) {
                Object value = JsonValues.toJava(supplied.path(name).path("value"));
                variables.put(name, VariableDefinition.builder()
                        .name(name)
                        .type(inferType(value))
                        .effectiveValue(value)
                        .build());
            }
        }

        log.debug("Extracted {} variable(s)", variables.size());
        return variables;
    }

    public ParameterDefinition toParameter(VariableDefinition variable) {
        VariableType type = variable.getType();
        return ParameterDefinition.builder()
                .type(type.getTag().getToscaType())
                .description(variable.getDescription())
                .defaultValue(variable.isSensitive() ? null : variable.getDefaultValue())
                .required(variable.isRequired())
                .entrySchema(type.getEntrySchema())
                .build();
    }

    private static VariableType inferType(Object value) {
        if (value instanceof Map) {
            return VariableType.parse("map(string)");
        }
        if (value instanceof List) {
            return VariableType.parse("list(string)");
        }
        if (value instanceof Number) {
            return VariableType.parse("number");
        }
        if (value instanceof Boolean) {
            return VariableType.parse("bool");
        }
        return VariableType.string();
    }
}
