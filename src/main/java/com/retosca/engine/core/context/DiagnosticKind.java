package com.retosca.engine.core.context;

/**
 * Recoverable conditions reported during a translation run.
 */
public enum DiagnosticKind {

    /**
     * The plan carries neither planned values nor a prior state root module.
     */
    ROOT_MODULE_MISSING(Severity.WARNING),

    /**
     * No mapper is registered for the resource type.
     */
    UNSUPPORTED_RESOURCE_TYPE(Severity.INFO),

    /**
     * A mapper is registered for the type but refused this payload.
     */
    CAPABILITY_DECLINED(Severity.WARNING),

    /**
     * An edge points at a node that was never emitted.
     */
    REFERENCE_UNRESOLVED(Severity.WARNING),

    /**
     * A value matched more than one variable or collection entry; the first declared match was used.
     */
    BINDING_AMBIGUOUS(Severity.WARNING),

    /**
     * A mapper threw while handling one resource.
     */
    MAPPER_FAILURE(Severity.ERROR),

    /**
     * A mapper replaced a previously registered mapper for the same type.
     */
    REGISTRY_OVERWRITE(Severity.WARNING),

    /**
     * An associative resource could not find one of its endpoint nodes.
     */
    ENDPOINT_MISSING(Severity.WARNING),

    /**
     * An output has neither a symbolic mapping nor a concrete value.
     */
    OUTPUT_UNRESOLVED(Severity.WARNING),

    /**
     * A variable declares a type tag outside the recognized set.
     */
    UNKNOWN_VARIABLE_TYPE(Severity.WARNING),

    /**
     * Two distinct resources were assigned the same node identifier.
     */
    NODE_COLLISION(Severity.WARNING);

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    public enum Severity {
        INFO, WARNING, ERROR
    }
}
