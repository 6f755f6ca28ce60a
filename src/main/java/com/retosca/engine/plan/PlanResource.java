package com.retosca.engine.plan;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One resource instance discovered in the plan, with its concrete attribute values.
 */
@Value
@Builder(toBuilder = true)
public class PlanResource {

    @NonNull
    String address;

    @NonNull
    ResourceAddress parsedAddress;

    @NonNull
    String type;

    @NonNull
    String name;

    @NonNull
    @Builder.Default
    String mode = ResourceAddress.MANAGED;

    /**
     * Concrete values from planned values, or from the prior state when the plan has none.
     */
    @NonNull
    @Builder.Default
    Map<String, Object> values = Collections.emptyMap();

    /**
     * Values recorded for the same address in the prior state, possibly empty.
     */
    @NonNull
    @Builder.Default
    Map<String, Object> priorValues = Collections.emptyMap();

    @Builder.Default
    String changeAction = "no-op";

    String providerName;

    /**
     * Explicit dependencies recorded by the prior state, used when the configuration is absent.
     */
    @Singular("stateDependency")
    List<String> stateDependsOn;

    public boolean isData() {
        return ResourceAddress.DATA.equals(mode);
    }

    public Integer getIndex() {
        return parsedAddress.getIndex();
    }

    /**
     * Concrete value of a top-level attribute, falling back to the prior state when the planned
     * value is unknown.
     */
    public Object concreteValue(String property) {
        Object planned = values.get(property);
        if (planned != null) {
            return planned;
        }
        return priorValues.get(property);
    }
}
