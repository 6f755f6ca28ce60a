package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

import java.util.List;
import java.util.Map;

/**
 * {@code aws_route_table} to a {@code Network} of type {@code routing}.
 */
public class AwsRouteTableMapper extends AbstractAwsResourceMapper {

    public AwsRouteTableMapper() {
        super("aws_route_table");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Network");

        node.withProperty("network_name", nameTag(context, resource).orElse(resource.getName()));
        node.withProperty("network_type", "routing");
        node.withProperty("ip_version", hasIpv6Route(concrete(context, resource, "route")) ? 6 : 4);

        copyMetadata(context, node, resource,
                "vpc_id", "route", "propagating_vgws", "tags");

        node.addCapability("link");
        addRequirements(context, node, resource);
        return true;
    }

    private static boolean hasIpv6Route(Object routes) {
        if (!(routes instanceof List<?> list)) {
            return false;
        }
        return list.stream().anyMatch(r -> r instanceof Map<?, ?> m
                && m.get("ipv6_cidr_block") instanceof String s && !s.isBlank());
    }
}
