package com.retosca.engine.ir;

import com.retosca.engine.model.RelationshipKind;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named requirement of a node template pointing at another node template.
 */
@Value
@Builder(toBuilder = true)
public class RequirementAssignment {

    @NonNull
    String name;

    @NonNull
    String node;

    @NonNull
    RelationshipKind relationship;

    /**
     * Properties of the relationship, e.g. the device name of a volume attachment.
     */
    @NonNull
    @Builder.Default
    Map<String, Object> relationshipProperties = Collections.emptyMap();

    public Map<String, Object> toTemplateMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("node", node);
        if (relationshipProperties.isEmpty()) {
            body.put("relationship", relationship.getToscaName());
        } else {
            Map<String, Object> rel = new LinkedHashMap<>();
            rel.put("type", relationship.getToscaName());
            rel.put("properties", new LinkedHashMap<>(relationshipProperties));
            body.put("relationship", rel);
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(name, body);
        return entry;
    }
}
