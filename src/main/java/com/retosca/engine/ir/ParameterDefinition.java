package com.retosca.engine.ir;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A template input parameter.
 */
@Value
@Builder
public class ParameterDefinition {

    @NonNull
    String type;

    String description;

    Object defaultValue;

    boolean required;

    /**
     * Entry type of list and map parameters.
     */
    String entrySchema;

    public Map<String, Object> toTemplateMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        if (description != null && !description.isBlank()) {
            body.put("description", description);
        }
        if (defaultValue != null) {
            body.put("default", defaultValue);
        }
        body.put("required", required);
        if (entrySchema != null) {
            Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("type", entrySchema);
            body.put("entry_schema", schema);
        }
        return body;
    }
}
