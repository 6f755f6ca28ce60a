package com.retosca.engine.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view over a Terraform plan document.
 *
 * Accepts both the raw {@code terraform show -json} layout and the combined
 * {@code {"plan": {...}, "state": {"values": {...}}}} layout. Every accessor returns a
 * {@link MissingNode} rather than null when a section is absent.
 */
public final class PlanDocument {

    private final JsonNode root;
    private final JsonNode plan;
    private final JsonNode priorStateValues;
    private final Map<String, String> changeActions;

    private PlanDocument(JsonNode root) {
        this.root = root;
        this.plan = root.has("plan") && root.get("plan").isObject() ? root.get("plan") : root;
        JsonNode combinedState = root.path("state").path("values");
        this.priorStateValues = combinedState.isObject()
                ? combinedState
                : plan.path("prior_state").path("values");
        this.changeActions = indexChangeActions(plan.path("resource_changes"));
    }

    public static PlanDocument of(JsonNode root) {
        Objects.requireNonNull(root, "root");
        return new PlanDocument(root);
    }

    public JsonNode getRoot() {
        return root;
    }

    public String getFormatVersion() {
        return plan.path("format_version").asText(null);
    }

    public String getTerraformVersion() {
        return plan.path("terraform_version").asText(null);
    }

    public JsonNode configurationRootModule() {
        return plan.path("configuration").path("root_module");
    }

    public JsonNode plannedRootModule() {
        return plan.path("planned_values").path("root_module");
    }

    public JsonNode priorStateRootModule() {
        return priorStateValues.path("root_module");
    }

    public JsonNode plannedOutputs() {
        return plan.path("planned_values").path("outputs");
    }

    public JsonNode priorStateOutputs() {
        return priorStateValues.path("outputs");
    }

    /**
     * Top-level {@code variables} section carrying the values supplied for this plan.
     */
    public JsonNode variableValues() {
        return plan.path("variables");
    }

    public boolean hasPlannedValues() {
        return plannedRootModule().isObject();
    }

    public boolean hasPriorState() {
        return priorStateRootModule().isObject();
    }

    public boolean hasRootModule() {
        return hasPlannedValues() || hasPriorState();
    }

    /**
     * Change action for a resource address, joined with '-', e.g. {@code delete-create}.
     * Resources absent from the change set report {@code no-op}.
     */
    public String changeAction(String address) {
        return changeActions.getOrDefault(address, "no-op");
    }

    public Map<String, String> getChangeActions() {
        return Collections.unmodifiableMap(changeActions);
    }

    private static Map<String, String> indexChangeActions(JsonNode resourceChanges) {
        Map<String, String> actions = new LinkedHashMap<>();
        if (!resourceChanges.isArray()) {
            return actions;
        }
        for (JsonNode change : resourceChanges) {
            String address = change.path("address").asText(null);
            JsonNode list = change.path("change").path("actions");
            if (address == null || !list.isArray() || list.isEmpty()) {
                continue;
            }
            StringBuilder sb = new StringBuilder();
            for (JsonNode a : list) {
                if (sb.length() > 0) {
                    sb.append('-');
                }
                sb.append(a.asText());
            }
            actions.put(address, sb.toString());
        }
        return actions;
    }
}
