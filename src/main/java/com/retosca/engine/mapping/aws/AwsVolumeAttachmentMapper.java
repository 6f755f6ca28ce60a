package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.ir.RequirementAssignment;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.mapping.ResourceRole;
import com.retosca.engine.model.RelationshipKind;
import com.retosca.engine.plan.PlanResource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code aws_volume_attachment}: gives the instance a {@code local_storage} requirement on the
 * volume, recording the device name on the relationship.
 */
public class AwsVolumeAttachmentMapper extends AbstractAwsResourceMapper {

    static final String REQUIREMENT = "local_storage";

    public AwsVolumeAttachmentMapper() {
        super("aws_volume_attachment");
    }

    @Override
    public ResourceRole role() {
        return ResourceRole.ASSOCIATIVE;
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        Optional<NodeTemplate> instance = endpoint(context, resource, "aws_instance");
        Optional<NodeTemplate> volume = endpoint(context, resource, "aws_ebs_volume");
        if (instance.isEmpty() || volume.isEmpty()) {
            return endpointMissing(context, resource, "Instance or volume node not found");
        }
        Map<String, Object> relationshipProperties = new LinkedHashMap<>();
        Object device = property(context, resource, "device_name").toTemplateValue();
        if (device != null) {
            relationshipProperties.put("device", device);
        }
        instance.get().addRequirement(RequirementAssignment.builder()
                .name(REQUIREMENT)
                .node(volume.get().getName())
                .relationship(RelationshipKind.ATTACHES_TO)
                .relationshipProperties(relationshipProperties)
                .build());
        log.debug("Attached volume {} to {} as {}", volume.get().getName(), instance.get().getName(), device);
        return true;
    }
}
