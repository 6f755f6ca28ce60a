package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_internet_gateway} to a public {@code Network}.
 */
public class AwsInternetGatewayMapper extends AbstractAwsResourceMapper {

    public AwsInternetGatewayMapper() {
        super("aws_internet_gateway");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Network");

        node.withProperty("network_type", "public");
        node.withProperty("network_name", nameTag(context, resource).orElse("IGW-" + resource.getName()));

        copyMetadata(context, node, resource,
                "vpc_id", "tags");

        node.addCapability("link");
        addRequirements(context, node, resource);
        return true;
    }
}
