package com.retosca.engine.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics accumulated during a translation run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
public class MappingDiagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    public void report(DiagnosticKind kind, String message) {
        report(kind, message, null, null);
    }

    public void report(DiagnosticKind kind, String message, String resourceAddress, String resourceType) {
        entries.add(Diagnostic.builder()
                .kind(kind)
                .message(message)
                .resourceAddress(resourceAddress)
                .resourceType(resourceType)
                .build());
    }

    public void addAll(List<Diagnostic> diagnostics) {
        entries.addAll(diagnostics);
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return entries.stream().filter(d -> d.getKind() == kind).toList();
    }

    public boolean has(DiagnosticKind kind) {
        return entries.stream().anyMatch(d -> d.getKind() == kind);
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(d -> d.getSeverity() == DiagnosticKind.Severity.ERROR);
    }

    public List<Diagnostic> getErrors() {
        return entries.stream().filter(d -> d.getSeverity() == DiagnosticKind.Severity.ERROR).toList();
    }

    public List<Diagnostic> getWarnings() {
        return entries.stream().filter(d -> d.getSeverity() == DiagnosticKind.Severity.WARNING).toList();
    }
}
