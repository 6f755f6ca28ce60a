package com.retosca.engine.mapping.aws;

import com.retosca.engine.dependency.DependencyFilterSpec;
import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_security_group} to {@code Root}. The rules are kept as metadata only.
 *
 * Rule blocks referencing other groups are not turned into requirements: groups that allow each
 * other would otherwise form a cycle.
 */
public class AwsSecurityGroupMapper extends AbstractAwsResourceMapper {

    private static final DependencyFilterSpec FILTER = DependencyFilterSpec.builder()
            .excludeProperty("ingress")
            .excludeProperty("egress")
            .build();

    public AwsSecurityGroupMapper() {
        super("aws_security_group");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Root");
        if (concrete(context, resource, "description") instanceof String description) {
            node.withDescription(description);
        }
        copyMetadata(context, node, resource,
                "name", "vpc_id", "ingress", "egress", "tags");
        addRequirements(context, node, resource);
        return true;
    }

    @Override
    protected DependencyFilterSpec dependencyFilter(MappingContext context, PlanResource resource) {
        return FILTER;
    }
}
