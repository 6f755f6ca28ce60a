package com.retosca.engine.plan;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.core.exception.ExtractionFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enumerates every resource instance of a plan, descending into child modules.
 *
 * Planned values are authoritative; the prior state is walked only when the plan has no planned
 * values, and is otherwise used to back-fill values the plan leaves unknown.
 */
public class PlanWalker {

    private static final Logger log = LoggerFactory.getLogger(PlanWalker.class);

    public List<PlanResource> walk(PlanDocument plan, MappingDiagnostics diagnostics) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(diagnostics, "diagnostics");

        if (!plan.hasRootModule()) {
            diagnostics.report(DiagnosticKind.ROOT_MODULE_MISSING,
                    "Plan has neither planned_values.root_module nor prior state values");
            log.warn("Plan has no root module container; nothing to walk");
            return Collections.emptyList();
        }

        Map<String, JsonNode> priorByAddress = new HashMap<>();
        if (plan.hasPriorState()) {
            collect(plan.priorStateRootModule(), (address, node) -> priorByAddress.put(address, node));
        }

        JsonNode root = plan.hasPlannedValues() ? plan.plannedRootModule() : plan.priorStateRootModule();
        List<PlanResource> resources = new ArrayList<>();
        collect(root, (address, node) -> resources.add(toResource(address, node, priorByAddress.get(address), plan)));

        log.debug("Walked {} resource(s) from {}", resources.size(),
                plan.hasPlannedValues() ? "planned values" : "prior state");
        return resources;
    }

    private interface ResourceSink {
        void accept(String address, JsonNode node);
    }

    private void collect(JsonNode module, ResourceSink sink) {
        JsonNode resources = module.path("resources");
        if (resources.isArray()) {
            for (JsonNode resource : resources) {
                String address = resource.path("address").asText(null);
                if (address == null || address.isBlank()) {
                    log.warn("Skipping resource entry without address in module {}",
                            module.path("address").asText("root"));
                    continue;
                }
                sink.accept(address, resource);
            }
        }
        JsonNode children = module.path("child_modules");
        if (children.isArray()) {
            for (JsonNode child : children) {
                collect(child, sink);
            }
        }
    }

    private PlanResource toResource(String address, JsonNode node, JsonNode prior, PlanDocument plan) {
        ResourceAddress parsed;
        try {
            parsed = ResourceAddress.parse(address);
        } catch (IllegalArgumentException e) {
            throw new ExtractionFailureException("Malformed resource address '" + address + "' (type "
                    + node.path("type").asText("unknown") + ")", e);
        }
        Map<String, Object> values = JsonValues.toMap(node.path("values"));
        Map<String, Object> priorValues = prior == null ? Map.of() : JsonValues.toMap(prior.path("values"));
        if (values.isEmpty() && !priorValues.isEmpty()) {
            values = priorValues;
        }
        String mode = node.path("mode").asText(parsed.getMode());
        List<String> dependsOn = new ArrayList<>();
        JsonNode recorded = prior != null ? prior.path("depends_on") : node.path("depends_on");
        if (recorded.isArray()) {
            recorded.forEach(d -> dependsOn.add(d.asText()));
        }
        return PlanResource.builder()
                .address(address)
                .parsedAddress(parsed)
                .type(node.path("type").asText(parsed.getType()))
                .name(node.path("name").asText(parsed.getName()))
                .mode(mode)
                .values(Collections.unmodifiableMap(values))
                .priorValues(Collections.unmodifiableMap(priorValues))
                .changeAction(plan.changeAction(address))
                .providerName(node.path("provider_name").asText(null))
                .stateDependsOn(dependsOn)
                .build();
    }
}
