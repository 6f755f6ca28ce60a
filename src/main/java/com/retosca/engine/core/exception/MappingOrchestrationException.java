package com.retosca.engine.core.exception;

/**
 * Raised when the dispatch logic itself fails, as opposed to a single mapper.
 * Carries the resource that was being processed when the fault happened.
 */
public class MappingOrchestrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String resourceAddress;
    private final String resourceType;

    public MappingOrchestrationException(String message, String resourceAddress, String resourceType, Throwable cause) {
        super(message + " (resource " + resourceAddress + ", type " + resourceType + ")", cause);
        this.resourceAddress = resourceAddress;
        this.resourceType = resourceType;
    }

    public String getResourceAddress() {
        return resourceAddress;
    }

    public String getResourceType() {
        return resourceType;
    }
}
