package com.retosca.engine.mapping.aws;

import com.retosca.engine.dependency.DependencyFilterSpec;
import com.retosca.engine.dependency.RouteTableAffinityRules;
import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_subnet} to {@code Network}.
 *
 * Subnets not covered by any route table association are linked to the route tables picked by
 * {@link RouteTableAffinityRules}.
 */
public class AwsSubnetMapper extends AbstractAwsResourceMapper {

    static final String ASSOCIATION_TYPE = "aws_route_table_association";

    public AwsSubnetMapper() {
        super("aws_subnet");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Network");

        node.withProperty("cidr", property(context, resource, "cidr_block"));
        node.withProperty("ipv6_cidr", property(context, resource, "ipv6_cidr_block"));
        String networkName = nameTag(context, resource)
                .or(() -> concreteString(context, resource, "availability_zone").map(az -> "subnet-" + az))
                .orElse(null);
        node.withProperty("network_name", networkName);
        node.withProperty("ip_version", concrete(context, resource, "cidr_block") == null
                && concrete(context, resource, "ipv6_cidr_block") != null ? 6 : 4);

        copyMetadata(context, node, resource,
                "availability_zone", "map_public_ip_on_launch", "vpc_id", "tags");

        node.addCapability("link");
        addRequirements(context, node, resource);
        return true;
    }

    @Override
    protected DependencyFilterSpec dependencyFilter(MappingContext context, PlanResource resource) {
        if (isAssociated(context, resource)) {
            return DependencyFilterSpec.none();
        }
        return DependencyFilterSpec.builder()
                .syntheticEdges(RouteTableAffinityRules.synthesize(resource,
                        context.resourcesOfType("aws_route_table")))
                .build();
    }

    private static boolean isAssociated(MappingContext context, PlanResource subnet) {
        return context.resourcesOfType(ASSOCIATION_TYPE).stream()
                .flatMap(a -> context.getExtractor().extract(a.getAddress()).stream())
                .anyMatch(e -> e.getTargetAddress().equals(subnet.getAddress()));
    }
}
