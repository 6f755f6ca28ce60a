package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_nat_gateway} to {@code Network}; the connectivity type decides public or private.
 */
public class AwsNatGatewayMapper extends AbstractAwsResourceMapper {

    public AwsNatGatewayMapper() {
        super("aws_nat_gateway");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Network");

        boolean privateNat = "private".equals(concrete(context, resource, "connectivity_type"));
        node.withProperty("network_type", privateNat ? "private" : "public");
        node.withProperty("ip_version", 4);
        node.withProperty("network_name", "NATGW-" + nameTag(context, resource).orElse(resource.getName()));

        copyMetadata(context, node, resource,
                "allocation_id", "subnet_id", "connectivity_type", "private_ip", "public_ip", "tags");

        node.addCapability("link");
        addRequirements(context, node, resource);
        return true;
    }
}
