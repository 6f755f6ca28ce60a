package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_ebs_volume} to {@code Storage.BlockStorage}.
 */
public class AwsEbsVolumeMapper extends AbstractAwsResourceMapper {

    public AwsEbsVolumeMapper() {
        super("aws_ebs_volume");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Storage.BlockStorage");

        // size is a unit string; an input reference would lose the unit
        ResolvedValue size = property(context, resource, "size");
        if (size.isSymbolic()) {
            node.withProperty("size", size);
        } else if (concrete(context, resource, "size") instanceof Number n) {
            node.withProperty("size", n.longValue() + " GB");
        }
        node.withProperty("snapshot_id", property(context, resource, "snapshot_id"));
        node.withProperty("volume_id", concrete(context, resource, "id"));

        copyMetadata(context, node, resource,
                "availability_zone", "type", "iops", "throughput", "encrypted", "kms_key_id", "tags");

        node.addCapability("attachment");
        addRequirements(context, node, resource);
        return true;
    }
}
