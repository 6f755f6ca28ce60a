package com.retosca.engine.dependency;

import com.retosca.engine.model.ReferenceEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies a {@link DependencyFilterSpec} to the raw edges of one resource.
 */
public final class DependencyFilter {

    private static final Logger log = LoggerFactory.getLogger(DependencyFilter.class);

    private DependencyFilter() {
    }

    public static List<ReferenceEdge> apply(List<ReferenceEdge> edges, DependencyFilterSpec spec) {
        List<ReferenceEdge> kept = new ArrayList<>();
        Set<String> targets = new LinkedHashSet<>();
        for (ReferenceEdge edge : edges) {
            if (spec.getExcludeTargetTypes().contains(edge.getTargetType())
                    || spec.getExcludeProperties().contains(edge.getPropertyName())) {
                log.debug("Filtered edge {}.{} -> {}", edge.getSourceAddress(), edge.getPropertyName(),
                        edge.getTargetAddress());
                continue;
            }
            kept.add(edge);
            targets.add(edge.getTargetAddress());
        }
        for (ReferenceEdge synthetic : spec.getSyntheticEdges()) {
            if (targets.add(synthetic.getTargetAddress())) {
                kept.add(synthetic.isSynthetic() ? synthetic : synthetic.toBuilder().synthetic(true).build());
            }
        }
        return kept;
    }
}
