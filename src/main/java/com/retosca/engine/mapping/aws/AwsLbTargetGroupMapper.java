package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_lb_target_group} to {@code Root}, carrying its settings as metadata.
 */
public class AwsLbTargetGroupMapper extends AbstractAwsResourceMapper {

    public AwsLbTargetGroupMapper() {
        super("aws_lb_target_group");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Root");
        copyMetadata(context, node, resource,
                "name", "port", "protocol", "target_type", "vpc_id", "health_check", "tags");
        addRequirements(context, node, resource);
        return true;
    }
}
