package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_vpc} to {@code Network}.
 */
public class AwsVpcMapper extends AbstractAwsResourceMapper {

    public AwsVpcMapper() {
        super("aws_vpc");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Network");

        node.withProperty("cidr", property(context, resource, "cidr_block"));
        boolean ipv6 = concrete(context, resource, "ipv6_cidr_block") != null
                || Boolean.TRUE.equals(concrete(context, resource, "assign_generated_ipv6_cidr_block"));
        boolean ipv4 = concrete(context, resource, "cidr_block") != null;
        node.withProperty("ip_version", ipv6 && !ipv4 ? 6 : 4);
        node.withProperty("dhcp_enabled", true);
        nameTag(context, resource).ifPresent(name -> node.withProperty("network_name", name));

        copyMetadata(context, node, resource,
                "instance_tenancy", "enable_dns_support", "enable_dns_hostnames",
                "default_route_table_id", "main_route_table_id", "tags");

        node.addCapability("link");
        addRequirements(context, node, resource);
        return true;
    }
}
