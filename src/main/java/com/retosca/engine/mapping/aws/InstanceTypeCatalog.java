package com.retosca.engine.mapping.aws;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * vCPU and memory of common EC2 instance types.
 */
final class InstanceTypeCatalog {

    @Value
    static class InstanceSpec {
        int vcpu;
        double memoryGb;

        /**
         * Memory rendered the way the host capability expects it, e.g. {@code 512 MB} or {@code 4 GB}.
         */
        String memSize() {
            if (memoryGb < 1) {
                return (int) (memoryGb * 1024) + " MB";
            }
            return memoryGb == Math.floor(memoryGb) ? (long) memoryGb + " GB" : memoryGb + " GB";
        }
    }

    static final InstanceSpec DEFAULT = new InstanceSpec(1, 1);

    private static final Map<String, InstanceSpec> SPECS = new LinkedHashMap<>();

    static {
        put("t2.nano", 1, 0.5);
        put("t2.micro", 1, 1);
        put("t2.small", 1, 2);
        put("t2.medium", 2, 4);
        put("t2.large", 2, 8);
        put("t3.nano", 2, 0.5);
        put("t3.micro", 2, 1);
        put("t3.small", 2, 2);
        put("t3.medium", 2, 4);
        put("t3.large", 2, 8);
        put("t3.xlarge", 4, 16);
        put("t3.2xlarge", 8, 32);
        put("t4g.nano", 2, 0.5);
        put("t4g.micro", 2, 1);
        put("t4g.small", 2, 2);
        put("t4g.medium", 2, 4);
        put("t4g.large", 2, 8);
        put("t4g.xlarge", 4, 16);
        put("t4g.2xlarge", 8, 32);
        put("m5.large", 2, 8);
        put("m5.xlarge", 4, 16);
        put("m5.2xlarge", 8, 32);
        put("m6i.large", 2, 8);
        put("m6i.xlarge", 4, 16);
        put("m6i.2xlarge", 8, 32);
        put("m6i.4xlarge", 16, 64);
        put("m6i.8xlarge", 32, 128);
        put("c6i.large", 2, 4);
        put("c6i.xlarge", 4, 8);
        put("c6i.2xlarge", 8, 16);
        put("c6i.4xlarge", 16, 32);
        put("r6i.large", 2, 16);
        put("r6i.xlarge", 4, 32);
        put("r6i.2xlarge", 8, 64);
    }

    private InstanceTypeCatalog() {
    }

    private static void put(String type, int vcpu, double memoryGb) {
        SPECS.put(type, new InstanceSpec(vcpu, memoryGb));
    }

    static Optional<InstanceSpec> lookup(String instanceType) {
        if (instanceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SPECS.get(instanceType.toLowerCase(Locale.ROOT)));
    }
}
