package com.retosca.engine.mapping.aws;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.dependency.DependencyFilterSpec;
import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.mapping.ResourceMapper;
import com.retosca.engine.model.ReferenceEdge;
import com.retosca.engine.model.ResolutionContext;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.plan.PlanResource;
import com.retosca.engine.plan.ResourceAddress.InstanceKey;
import com.retosca.engine.resolve.ReferenceGraphExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared plumbing for AWS mappers: node creation with the standard metadata, value resolution
 * and requirement wiring from filtered reference edges.
 */
public abstract class AbstractAwsResourceMapper implements ResourceMapper {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String resourceType;

    protected AbstractAwsResourceMapper(String resourceType) {
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    }

    @Override
    public String resourceType() {
        return resourceType;
    }

    /**
     * Accepts resources of the registered type that carry at least one value.
     */
    @Override
    public boolean canMap(String type, PlanResource resource) {
        return resourceType.equals(type)
                && (!resource.getValues().isEmpty() || !resource.getPriorValues().isEmpty());
    }

    /**
     * Edge filter applied to this mapper's requirements; none by default.
     */
    protected DependencyFilterSpec dependencyFilter(MappingContext context, PlanResource resource) {
        return DependencyFilterSpec.none();
    }

    /**
     * Creates the node and writes the metadata every AWS node carries.
     */
    protected NodeTemplate addNode(MappingContext context, PlanResource resource, String toscaType) {
        NodeTemplate node = context.getBuilder().addNode(context.nodeId(resource), toscaType);
        node.withMetadata("original_resource_type", resource.getType());
        node.withMetadata("original_resource_name", originalName(resource));
        node.withMetadata("aws_provider", resource.getProviderName());
        node.withMetadata("terraform_change_action", resource.getChangeAction());
        log.debug("Created {} node '{}' for {}", toscaType, node.getName(), resource.getAddress());
        return node;
    }

    protected ResolvedValue property(MappingContext context, PlanResource resource, String name) {
        return context.getResolver().resolve(resource, name, ResolutionContext.PROPERTY);
    }

    /**
     * Concrete value of a property, for metadata and for decisions taken while mapping.
     */
    protected Object concrete(MappingContext context, PlanResource resource, String name) {
        ResolvedValue value = context.getResolver().resolve(resource, name, ResolutionContext.METADATA);
        return value.toTemplateValue();
    }

    protected Optional<String> concreteString(MappingContext context, PlanResource resource, String name) {
        return concrete(context, resource, name) instanceof String s && !s.isBlank()
                ? Optional.of(s)
                : Optional.empty();
    }

    /**
     * Copies concrete values into {@code aws_<property>} metadata entries; absent values are skipped.
     */
    protected void copyMetadata(MappingContext context, NodeTemplate node, PlanResource resource,
                                String... properties) {
        for (String property : properties) {
            node.withMetadata("aws_" + property, concrete(context, resource, property));
        }
    }

    protected Optional<String> nameTag(MappingContext context, PlanResource resource) {
        if (concrete(context, resource, "tags") instanceof Map<?, ?> tags && tags.get("Name") instanceof String name) {
            return Optional.of(name);
        }
        return Optional.empty();
    }

    /**
     * Adds one requirement per filtered edge whose target is a resource.
     */
    protected void addRequirements(MappingContext context, NodeTemplate node, PlanResource resource) {
        List<ReferenceEdge> edges = context.filteredEdges(resource.getAddress(), dependencyFilter(context, resource));
        for (ReferenceEdge edge : edges) {
            String target = context.nodeId(edge.getTargetAddress(), edge.getTargetType());
            node.addRequirement(requirementName(edge), target, edge.getRelationshipKind());
        }
    }

    /**
     * Node of the first edge target of the given type, if that node was emitted.
     */
    protected Optional<NodeTemplate> endpoint(MappingContext context, PlanResource resource, String targetType) {
        return context.getExtractor().extract(resource.getAddress()).stream()
                .filter(e -> targetType.equals(e.getTargetType()))
                .map(e -> context.node(e.getTargetAddress(), e.getTargetType()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * Reports an associative resource whose endpoints are not both present.
     */
    protected boolean endpointMissing(MappingContext context, PlanResource resource, String detail) {
        context.getDiagnostics().report(DiagnosticKind.ENDPOINT_MISSING, detail, resource.getAddress(),
                resource.getType());
        log.warn("{}: {}", resource.getAddress(), detail);
        return false;
    }

    static String requirementName(ReferenceEdge edge) {
        return edge.isSynthetic() || ReferenceGraphExtractor.DEPENDS_ON_PROPERTY.equals(edge.getPropertyName())
                ? ReferenceEdge.DEPENDENCY
                : edge.getPropertyName();
    }

    static String originalName(PlanResource resource) {
        InstanceKey key = resource.getParsedAddress().getKey();
        return resource.getName() + (key == null ? "" : key.render());
    }
}
