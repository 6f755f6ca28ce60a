package com.retosca.engine.mapping.aws;

import com.retosca.engine.dependency.DependencyFilterSpec;
import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * {@code aws_instance} to {@code Compute}.
 *
 * The host capability comes from {@link InstanceTypeCatalog}; the os capability is guessed from
 * the AMI string. Volume references are left to {@link AwsVolumeAttachmentMapper}.
 */
public class AwsInstanceMapper extends AbstractAwsResourceMapper {

    private static final DependencyFilterSpec FILTER = DependencyFilterSpec.builder()
            .excludeTargetType("aws_ebs_volume")
            .build();

    public AwsInstanceMapper() {
        super("aws_instance");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "Compute");

        String instanceType = concreteString(context, resource, "instance_type").orElse(null);
        InstanceTypeCatalog.InstanceSpec spec = InstanceTypeCatalog.lookup(instanceType).orElseGet(() -> {
            log.warn("No specs for instance type '{}' on {}; using defaults", instanceType, address);
            return InstanceTypeCatalog.DEFAULT;
        });
        Map<String, Object> host = new LinkedHashMap<>();
        host.put("num_cpus", spec.getVcpu());
        host.put("mem_size", spec.memSize());
        node.addCapability("host", host);

        Map<String, Object> os = inferOs(concreteString(context, resource, "ami").orElse(null));
        if (!os.isEmpty()) {
            node.addCapability("os", os);
        }

        copyMetadata(context, node, resource,
                "instance_type", "ami", "availability_zone", "key_name", "subnet_id",
                "associate_public_ip_address", "monitoring", "tags");

        addRequirements(context, node, resource);
        return true;
    }

    @Override
    protected DependencyFilterSpec dependencyFilter(MappingContext context, PlanResource resource) {
        return FILTER;
    }

    static Map<String, Object> inferOs(String ami) {
        Map<String, Object> os = new LinkedHashMap<>();
        if (ami == null || ami.isBlank()) {
            return os;
        }
        String lower = ami.toLowerCase(Locale.ROOT);
        if (lower.contains("amazon") || lower.contains("al2023") || lower.contains("amzn")) {
            os.put("type", "linux");
            os.put("distribution", "amazon");
        } else if (lower.contains("ubuntu")) {
            os.put("type", "linux");
            os.put("distribution", "ubuntu");
        } else if (lower.contains("rhel") || lower.contains("red-hat")) {
            os.put("type", "linux");
            os.put("distribution", "rhel");
        } else if (lower.contains("centos")) {
            os.put("type", "linux");
            os.put("distribution", "centos");
        } else if (lower.contains("debian")) {
            os.put("type", "linux");
            os.put("distribution", "debian");
        } else if (lower.contains("windows")) {
            os.put("type", "windows");
        }
        boolean arm = lower.contains("arm64") || lower.contains("aarch64");
        os.put("architecture", arm ? "arm64" : "x86_64");
        return os;
    }
}
