package com.retosca.engine.ir;

import com.retosca.engine.model.ResolvedValue;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A template output parameter.
 */
@Value
@Builder
public class TemplateOutput {

    String description;

    @NonNull
    ResolvedValue value;

    public Map<String, Object> toTemplateMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (description != null && !description.isBlank()) {
            body.put("description", description);
        }
        body.put("value", value.toTemplateValue());
        return body;
    }
}
