package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

/**
 * {@code aws_s3_bucket} to {@code Storage.ObjectStorage}.
 */
public class AwsS3BucketMapper extends AbstractAwsResourceMapper {

    public AwsS3BucketMapper() {
        super("aws_s3_bucket");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Storage.ObjectStorage");
        node.withProperty("name", property(context, resource, "bucket"));
        copyMetadata(context, node, resource,
                "bucket_prefix", "force_destroy", "object_lock_enabled", "region", "arn", "tags");
        addRequirements(context, node, resource);
        return true;
    }
}
