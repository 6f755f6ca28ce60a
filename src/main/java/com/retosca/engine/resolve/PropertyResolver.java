package com.retosca.engine.resolve;

import com.retosca.engine.model.ResolutionContext;
import com.retosca.engine.model.ResolvedValue;
import com.retosca.engine.model.VariableBinding;
import com.retosca.engine.plan.PlanResource;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves property values for one of two audiences.
 *
 * Metadata always receives the concrete value. Properties receive a {@code $get_input} reference
 * when the value is bound to an input variable, and the concrete value otherwise.
 */
public class PropertyResolver {

    private final VariableBindingTracker tracker;
    private final Map<String, PlanResource> resourcesByAddress = new LinkedHashMap<>();

    public PropertyResolver(VariableBindingTracker tracker, Collection<PlanResource> resources) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        resources.forEach(r -> resourcesByAddress.put(r.getAddress(), r));
    }

    /**
     * Resolves by address. An unknown address resolves to a null literal.
     */
    public ResolvedValue resolve(String address, String property, ResolutionContext context) {
        PlanResource resource = resourcesByAddress.get(address);
        if (resource == null) {
            return ResolvedValue.literal(null);
        }
        return resolve(resource, property, context);
    }

    public ResolvedValue resolve(PlanResource resource, String property, ResolutionContext context) {
        Object concrete = resource.concreteValue(property);
        if (context == ResolutionContext.METADATA) {
            return ResolvedValue.literal(concrete);
        }
        Optional<VariableBinding> binding = tracker.binding(resource.getAddress(), property);
        if (binding.isEmpty()) {
            return ResolvedValue.literal(concrete);
        }
        VariableBinding b = binding.get();
        return b.getKind() == VariableBinding.Kind.SCALAR
                ? ResolvedValue.input(b.getVariableName())
                : ResolvedValue.input(b.getVariableName(), b.getCollectionKey());
    }

    /**
     * Every top-level property of the resource, rendered for the given context.
     */
    public Map<String, Object> resolveAll(PlanResource resource, ResolutionContext context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String property : resource.getValues().keySet()) {
            resolved.put(property, resolve(resource, property, context).toTemplateValue());
        }
        return resolved;
    }
}
