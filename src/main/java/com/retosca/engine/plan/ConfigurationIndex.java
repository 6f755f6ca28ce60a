package com.retosca.engine.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup tables over the plan's configuration section.
 *
 * Resource entries of child modules carry module-relative addresses in the plan; they are indexed
 * here under their absolute configuration address ({@code module.net.aws_subnet.this}).
 */
public final class ConfigurationIndex {

    private final JsonNode rootModule;
    private final Map<String, JsonNode> resourcesByAddress = new LinkedHashMap<>();
    private final Map<String, JsonNode> modulesByPath = new LinkedHashMap<>();

    private ConfigurationIndex(JsonNode rootModule) {
        this.rootModule = rootModule;
        if (rootModule.isObject()) {
            index("", rootModule);
        }
    }

    public static ConfigurationIndex of(PlanDocument plan) {
        return new ConfigurationIndex(plan.configurationRootModule());
    }

    public boolean isPresent() {
        return rootModule.isObject();
    }

    public Optional<JsonNode> resource(String configAddress) {
        return Optional.ofNullable(resourcesByAddress.get(configAddress));
    }

    public Map<String, JsonNode> getResources() {
        return Collections.unmodifiableMap(resourcesByAddress);
    }

    public JsonNode module(String moduleConfigPath) {
        JsonNode module = modulesByPath.get(moduleConfigPath == null ? "" : moduleConfigPath);
        return module == null ? MissingNode.getInstance() : module;
    }

    public JsonNode rootVariables() {
        return rootModule.path("variables");
    }

    public JsonNode rootOutputs() {
        return rootModule.path("outputs");
    }

    /**
     * Expression of output {@code outputName} declared by the module at {@code moduleConfigPath}.
     */
    public JsonNode moduleOutputExpression(String moduleConfigPath, String outputName) {
        return module(moduleConfigPath).path("outputs").path(outputName).path("expression");
    }

    /**
     * Expression passed for input {@code variableName} of the module at {@code moduleConfigPath}.
     */
    public JsonNode moduleCallArgument(String moduleConfigPath, String variableName) {
        int cut = moduleConfigPath.lastIndexOf(".module.");
        String parentPath;
        String moduleName;
        if (cut >= 0) {
            parentPath = moduleConfigPath.substring(0, cut);
            moduleName = moduleConfigPath.substring(cut + ".module.".length());
        } else {
            parentPath = "";
            moduleName = moduleConfigPath.substring("module.".length());
        }
        return module(parentPath).path("module_calls").path(moduleName).path("expressions").path(variableName);
    }

    private void index(String path, JsonNode module) {
        modulesByPath.put(path, module);
        String prefix = path.isEmpty() ? "" : path + ".";
        JsonNode resources = module.path("resources");
        if (resources.isArray()) {
            for (JsonNode resource : resources) {
                String address = resource.path("address").asText(null);
                if (address != null) {
                    resourcesByAddress.put(prefix + address, resource);
                }
            }
        }
        JsonNode calls = module.path("module_calls");
        if (calls.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = calls.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> call = it.next();
                JsonNode child = call.getValue().path("module");
                if (child.isObject()) {
                    index(prefix + "module." + call.getKey(), child);
                }
            }
        }
    }
}
