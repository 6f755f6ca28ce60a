package com.retosca.engine.core.context;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One structured diagnostic entry, optionally tied to the resource that produced it.
 */
@Value
@Builder
public class Diagnostic {

    @NonNull
    DiagnosticKind kind;

    @NonNull
    String message;

    String resourceAddress;

    String resourceType;

    public DiagnosticKind.Severity getSeverity() {
        return kind.getSeverity();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind).append(']');
        if (resourceAddress != null) {
            sb.append(' ').append(resourceAddress);
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
