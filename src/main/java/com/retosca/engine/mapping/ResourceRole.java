package com.retosca.engine.mapping;

/**
 * Dispatch phase of a mapper.
 */
public enum ResourceRole {

    /**
     * Emits an independent node. Runs in the first phase.
     */
    PRIMARY,

    /**
     * Only links two nodes emitted by primary mappers. Runs after every primary mapper.
     */
    ASSOCIATIVE
}
