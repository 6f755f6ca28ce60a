package com.retosca.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A root-module output with its resolved value and the references of its defining expression.
 */
@Value
@Builder
public class OutputDefinition {

    @NonNull
    String name;

    String description;

    boolean sensitive;

    Object resolvedValue;

    @Singular
    List<String> definingReferences;
}
