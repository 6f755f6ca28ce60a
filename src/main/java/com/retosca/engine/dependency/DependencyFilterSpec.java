package com.retosca.engine.dependency;

import com.retosca.engine.model.ReferenceEdge;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Per-mapper edge filter: target types and property names to drop, plus edges to add.
 */
@Value
@Builder(toBuilder = true)
public class DependencyFilterSpec {

    @Singular
    Set<String> excludeTargetTypes;

    @Singular
    Set<String> excludeProperties;

    /**
     * Heuristic edges appended after filtering, unless their target is already covered.
     */
    @Singular
    List<ReferenceEdge> syntheticEdges;

    public static DependencyFilterSpec none() {
        return DependencyFilterSpec.builder().build();
    }
}
