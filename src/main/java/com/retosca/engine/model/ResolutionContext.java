package com.retosca.engine.model;

/**
 * Where a resolved value is going to be used.
 */
public enum ResolutionContext {

    /**
     * Node properties: values bound to variables are emitted symbolically.
     */
    PROPERTY,

    /**
     * Metadata and other human-facing fields: always concrete.
     */
    METADATA
}
