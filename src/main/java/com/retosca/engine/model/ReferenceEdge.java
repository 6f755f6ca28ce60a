package com.retosca.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A directed reference from one resource property to another resource.
 */
@Value
@Builder(toBuilder = true)
public class ReferenceEdge {

    /**
     * Property name used for {@code depends_on} entries and synthetic edges.
     */
    public static final String DEPENDENCY = "dependency";

    @NonNull
    String sourceAddress;

    @NonNull
    String propertyName;

    @NonNull
    String targetAddress;

    @NonNull
    String targetType;

    @NonNull
    RelationshipKind relationshipKind;

    /**
     * True when the edge was inferred by a heuristic rather than read from the plan.
     */
    boolean synthetic;
}
