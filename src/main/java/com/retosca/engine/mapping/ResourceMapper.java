package com.retosca.engine.mapping;

import com.retosca.engine.plan.PlanResource;

/**
 * Maps one resource type into the service template.
 */
public interface ResourceMapper {

    /**
     * Resource type this mapper registers under.
     */
    String resourceType();

    /**
     * Whether this mapper accepts the given payload. A mapper registered for a type may still refuse
     * individual resources.
     */
    boolean canMap(String type, PlanResource resource);

    /**
     * Writes the resource into {@link MappingContext#getBuilder()}.
     *
     * @return false when the resource was skipped and a diagnostic reported
     */
    boolean map(MappingContext context, String address, String type, PlanResource resource);

    default ResourceRole role() {
        return ResourceRole.PRIMARY;
    }
}
