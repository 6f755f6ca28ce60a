package com.retosca.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Records that the value of {@code (resourceAddress, propertyName)} originates from an input
 * variable, optionally narrowed to one map key or list index.
 */
@Value
@Builder
public class VariableBinding {

    public enum Kind {
        /**
         * The property is bound to the whole variable.
         */
        SCALAR,

        /**
         * The property is bound to one entry of a map variable.
         */
        MAP_KEY,

        /**
         * The property is bound to one position of a list variable.
         */
        LIST_INDEX
    }

    @NonNull
    String resourceAddress;

    @NonNull
    String propertyName;

    @NonNull
    String variableName;

    @NonNull
    Kind kind;

    /**
     * Map key (String) or list index (Integer); null for scalar bindings.
     */
    Object collectionKey;

    public static VariableBinding scalar(String address, String property, String variable) {
        return new VariableBinding(address, property, variable, Kind.SCALAR, null);
    }

    public static VariableBinding mapKey(String address, String property, String variable, String key) {
        return new VariableBinding(address, property, variable, Kind.MAP_KEY, key);
    }

    public static VariableBinding listIndex(String address, String property, String variable, int index) {
        return new VariableBinding(address, property, variable, Kind.LIST_INDEX, index);
    }
}
