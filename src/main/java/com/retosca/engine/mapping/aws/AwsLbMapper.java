package com.retosca.engine.mapping.aws;

import com.retosca.engine.ir.NodeTemplate;
import com.retosca.engine.mapping.MappingContext;
import com.retosca.engine.plan.PlanResource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code aws_lb} to {@code LoadBalancer}. Application balancers speak HTTP on port 80, network
 * and gateway balancers TCP.
 */
public class AwsLbMapper extends AbstractAwsResourceMapper {

    public AwsLbMapper() {
        super("aws_lb");
    }

    @Override
    public boolean map(MappingContext context, String address, String type, PlanResource resource) {
        NodeTemplate node = addNode(context, resource, "LoadBalancer");

        String lbType = concreteString(context, resource, "load_balancer_type").orElse("application");
        node.withProperty("algorithm", "network".equals(lbType) ? "flow_hash" : "round_robin");

        Map<String, Object> client = new LinkedHashMap<>();
        boolean internal = Boolean.TRUE.equals(concrete(context, resource, "internal"));
        client.put("network_name", internal ? "PRIVATE" : "PUBLIC");
        if ("application".equals(lbType)) {
            client.put("protocol", "http");
            client.put("port", 80);
            client.put("secure", false);
        } else {
            client.put("protocol", "tcp");
        }
        node.addCapability("client", client);

        copyMetadata(context, node, resource,
                "name", "load_balancer_type", "internal", "ip_address_type", "dns_name", "tags");

        addRequirements(context, node, resource);
        return true;
    }
}
