package com.retosca.engine.resolve;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.model.VariableBinding;
import com.retosca.engine.model.VariableDefinition;
import com.retosca.engine.model.VariableType;
import com.retosca.engine.plan.ConfigurationIndex;
import com.retosca.engine.plan.ExpressionReferences;
import com.retosca.engine.plan.JsonValues;
import com.retosca.engine.plan.PlanResource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Index of {@code (resource address, property) -> variable binding}, built once per run.
 *
 * Bindings are found in three tiers, first hit wins:
 * <ol>
 *   <li>the property expression references a variable directly; for collection variables the
 *       binding is narrowed to the matching key or index;</li>
 *   <li>the concrete value equals one entry of a map variable;</li>
 *   <li>the resource address carries an index {@code n} and a list variable holds the same value at
 *       position {@code n}.</li>
 * </ol>
 * When several candidates match, the first declared one is used and the ambiguity is reported.
 */
public class VariableBindingTracker {

    private static final Logger log = LoggerFactory.getLogger(VariableBindingTracker.class);

    private final ConfigurationIndex configuration;
    private final Map<String, VariableDefinition> variables;
    private final MappingDiagnostics diagnostics;
    private final Map<String, Map<String, VariableBinding>> bindings = new LinkedHashMap<>();

    public VariableBindingTracker(ConfigurationIndex configuration, Collection<PlanResource> resources,
                                  Map<String, VariableDefinition> variables, MappingDiagnostics diagnostics) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.variables = Objects.requireNonNull(variables, "variables");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        for (PlanResource resource : resources) {
            if (!resource.isData()) {
                index(resource);
            }
        }
        log.debug("Recorded {} variable binding(s)", allBindings().size());
    }

    public Optional<VariableBinding> binding(String address, String property) {
        Map<String, VariableBinding> byProperty = bindings.get(address);
        return byProperty == null ? Optional.empty() : Optional.ofNullable(byProperty.get(property));
    }

    public Map<String, VariableBinding> bindingsFor(String address) {
        return Collections.unmodifiableMap(bindings.getOrDefault(address, Map.of()));
    }

    public List<VariableBinding> allBindings() {
        List<VariableBinding> all = new ArrayList<>();
        bindings.values().forEach(m -> all.addAll(m.values()));
        return all;
    }

    public Map<String, VariableDefinition> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    private void index(PlanResource resource) {
        JsonNode expressions = configuration.resource(resource.getParsedAddress().configAddress())
                .map(c -> c.path("expressions"))
                .orElse(MissingNode.getInstance());

        Set<String> properties = new LinkedHashSet<>(resource.getValues().keySet());
        expressions.fieldNames().forEachRemaining(properties::add);

        for (String property : properties) {
            Object value = resource.concreteValue(property);
            VariableBinding binding = directBinding(resource, property, expressions.path(property), value);
            if (binding == null) {
                binding = mapKeyBinding(resource, property, value);
            }
            if (binding == null) {
                binding = listIndexBinding(resource, property, value);
            }
            if (binding != null) {
                bindings.computeIfAbsent(resource.getAddress(), k -> new LinkedHashMap<>()).put(property, binding);
                log.debug("Binding {}.{} -> {} {}", resource.getAddress(), property, binding.getVariableName(),
                        binding.getCollectionKey() == null ? "" : "[" + binding.getCollectionKey() + "]");
            }
        }
    }

    private VariableBinding directBinding(PlanResource resource, String property, JsonNode expression, Object value) {
        List<String> referenced = new ArrayList<>();
        String modulePath = resource.getParsedAddress().moduleConfigPath();
        for (String name : ExpressionReferences.variableNames(expression)) {
            for (String root : toRootVariables(modulePath, name, 0)) {
                if (variables.containsKey(root) && !referenced.contains(root)) {
                    referenced.add(root);
                }
            }
        }
        if (referenced.isEmpty()) {
            return null;
        }
        if (referenced.size() > 1) {
            reportAmbiguity(resource, property, "references variables " + referenced);
        }
        VariableDefinition variable = variables.get(referenced.get(0));
        return narrow(resource, property, variable, value);
    }

    /**
     * Narrows a direct reference to the key or index whose entry equals the concrete value.
     */
    private VariableBinding narrow(PlanResource resource, String property, VariableDefinition variable, Object value) {
        String address = resource.getAddress();
        Object effective = variable.getEffectiveValue();
        if (value == null || JsonValues.sameValue(effective, value)) {
            return VariableBinding.scalar(address, property, variable.getName());
        }
        if (variable.getType().getTag() == VariableType.Tag.MAP && effective instanceof Map<?, ?> map) {
            List<String> keys = matchingKeys(map, value);
            if (!keys.isEmpty()) {
                if (keys.size() > 1) {
                    reportAmbiguity(resource, property, "matches keys " + keys + " of map '" + variable.getName() + "'");
                }
                return VariableBinding.mapKey(address, property, variable.getName(), keys.get(0));
            }
        }
        if (variable.getType().getTag() == VariableType.Tag.LIST && effective instanceof List<?> list) {
            Integer index = resource.getIndex();
            if (index != null && index < list.size() && JsonValues.sameValue(list.get(index), value)) {
                return VariableBinding.listIndex(address, property, variable.getName(), index);
            }
            for (int i = 0; i < list.size(); i++) {
                if (JsonValues.sameValue(list.get(i), value)) {
                    return VariableBinding.listIndex(address, property, variable.getName(), i);
                }
            }
        }
        return VariableBinding.scalar(address, property, variable.getName());
    }

    private VariableBinding mapKeyBinding(PlanResource resource, String property, Object value) {
        if (!isMatchable(value)) {
            return null;
        }
        List<String[]> matches = new ArrayList<>();
        for (VariableDefinition variable : variables.values()) {
            if (variable.getType().getTag() != VariableType.Tag.MAP
                    || !(variable.getEffectiveValue() instanceof Map<?, ?> map)) {
                continue;
            }
            for (String key : matchingKeys(map, value)) {
                matches.add(new String[] { variable.getName(), key });
            }
        }
        if (matches.isEmpty()) {
            return null;
        }
        if (matches.size() > 1) {
            List<String> described = matches.stream().map(m -> m[0] + "[" + m[1] + "]").toList();
            reportAmbiguity(resource, property, "value matches " + described);
        }
        String[] first = matches.get(0);
        return VariableBinding.mapKey(resource.getAddress(), property, first[0], first[1]);
    }

    private VariableBinding listIndexBinding(PlanResource resource, String property, Object value) {
        Integer index = resource.getIndex();
        if (index == null || !isMatchable(value)) {
            return null;
        }
        List<String> matches = new ArrayList<>();
        for (VariableDefinition variable : variables.values()) {
            if (variable.getType().getTag() == VariableType.Tag.LIST
                    && variable.getEffectiveValue() instanceof List<?> list
                    && index < list.size()
                    && JsonValues.sameValue(list.get(index), value)) {
                matches.add(variable.getName());
            }
        }
        if (matches.isEmpty()) {
            return null;
        }
        if (matches.size() > 1) {
            reportAmbiguity(resource, property, "value matches position " + index + " of lists " + matches);
        }
        return VariableBinding.listIndex(resource.getAddress(), property, matches.get(0), index);
    }

    /**
     * Follows a module variable up through the module call arguments to root variables.
     */
    private List<String> toRootVariables(String modulePath, String name, int depth) {
        if (modulePath.isEmpty()) {
            return List.of(name);
        }
        if (depth > 32) {
            return List.of();
        }
        JsonNode argument = configuration.moduleCallArgument(modulePath, name);
        int cut = modulePath.lastIndexOf(".module.");
        String parent = cut >= 0 ? modulePath.substring(0, cut) : "";
        List<String> roots = new ArrayList<>();
        for (String outer : ExpressionReferences.variableNames(argument)) {
            roots.addAll(toRootVariables(parent, outer, depth + 1));
        }
        return roots;
    }

    private static List<String> matchingKeys(Map<?, ?> map, Object value) {
        List<String> keys = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (JsonValues.sameValue(entry.getValue(), value)) {
                keys.add(String.valueOf(entry.getKey()));
            }
        }
        return keys;
    }

    private static boolean isMatchable(Object value) {
        return value instanceof String s ? !s.isEmpty() : value instanceof Number;
    }

    private void reportAmbiguity(PlanResource resource, String property, String detail) {
        String message = "Property '" + property + "' " + detail + "; using the first declared match";
        diagnostics.report(DiagnosticKind.BINDING_AMBIGUOUS, message, resource.getAddress(), resource.getType());
        log.warn("{}: {}", resource.getAddress(), message);
    }
}
