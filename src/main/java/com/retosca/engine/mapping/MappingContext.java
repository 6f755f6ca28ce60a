package com.retosca.engine.mapping;

import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.core.context.TranslatorConfig;
import com.retosca.engine.dependency.DependencyFilter;
import com.retosca.engine.dependency.DependencyFilterSpec;
import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.ir.ServiceTemplateBuilder;
import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.resolve.NodeAddressResolver;
import com.retosca.engine.resolve.PropertyResolver;
import com.retosca.engine.resolve.ReferenceGraphExtractor;
import com.retosca.engine.resolve.VariableBindingTracker;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Optional;

/**
 * Everything a mapper may read or write during one translation run. Passed explicitly to every
 * mapper call.
 */
@Getter
@Builder
public final class MappingContext {

    @NonNull
    private final TranslatorConfig config;

    @NonNull
    private final PlanDocument plan;

    @Singular
    private final List<PlanResource> resources;

    @NonNull
    private final ReferenceGraphExtractor extractor;

    @NonNull
    private final VariableBindingTracker tracker;

    @NonNull
    private final PropertyResolver resolver;

    @NonNull
    private final ServiceTemplateBuilder builder;

    @NonNull
    private final NodeAddressResolver nodeResolver;

    @NonNull
    private final MappingDiagnostics diagnostics;

    public Optional<PlanResource> resource(String address) {
        return extractor.resource(address);
    }

    public List<PlanResource> resourcesOfType(String type) {
        return resources.stream().filter(r -> r.getType().equals(type)).toList();
    }

    public String nodeId(PlanResource resource) {
        return nodeResolver.resolve(resource.getParsedAddress(), resource.getType());
    }

    public String nodeId(String address, String type) {
        return nodeResolver.resolve(address, type);
    }

    public Optional<NodeTemplate> node(String address, String type) {
        return builder.getNode(nodeId(address, type));
    }

    /**
     * Edges of a resource after the mapper's filter and synthetic edges are applied.
     */
    public List<ReferenceEdge> filteredEdges(String address, DependencyFilterSpec spec) {
        return DependencyFilter.apply(extractor.extract(address), spec);
    }
}
