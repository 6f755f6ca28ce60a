package com.retosca.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A root-module input variable as declared in the plan configuration.
 */
@Value
@Builder
public class VariableDefinition {

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    VariableType type = VariableType.string();

    Object defaultValue;

    boolean hasDefault;

    boolean sensitive;

    String description;

    /**
     * Value supplied for this plan run, or the default when none was supplied.
     */
    Object effectiveValue;

    public boolean isRequired() {
        return !hasDefault;
    }
}
