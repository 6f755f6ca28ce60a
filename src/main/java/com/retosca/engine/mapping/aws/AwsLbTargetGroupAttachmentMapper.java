package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.mapping.ResourceRole;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.plan.PlanResource;

import java.util.Optional;

/**
 * {@code aws_lb_target_group_attachment}: routes the target group to the attached instance.
 */
public class AwsLbTargetGroupAttachmentMapper extends AbstractAwsResourceMapper {

    static final String REQUIREMENT = "application";

    public AwsLbTargetGroupAttachmentMapper() {
        super("aws_lb_target_group_attachment");
    }

    @Override
    public ResourceRole role() {
        return ResourceRole.ASSOCIATIVE;
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        Optional<NodeTemplate> targetGroup = endpoint(context, resource, "aws_lb_target_group");
        Optional<NodeTemplate> instance = endpoint(context, resource, "aws_instance");
        if (targetGroup.isEmpty() || instance.isEmpty()) {
            return endpointMissing(context, resource, "Target group or instance node not found");
        }
        targetGroup.get().addRequirement(REQUIREMENT, instance.get().getName(), RelationshipKind.ROUTES_TO);
        return true;
    }
}
