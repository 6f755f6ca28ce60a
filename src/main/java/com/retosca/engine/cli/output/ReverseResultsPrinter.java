package com.retosca.engine.cli.output;

import com.retosca.engine.cli.model.ValidatedReverseOptions;
import com.retosca.engine.core.context.Diagnostic;
import com.retosca.engine.core.context.MappingStats;
import com.retosca.engine.translate.TranslationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Responsible only for printing CLI output for the "reverse" command.
 * No validation, no execution.
 */
public class ReverseResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ReverseResultsPrinter.class);

    public void printBanner(ValidatedReverseOptions v) {
        log.info("=================================================");
        log.info("retosca: Terraform plan to TOSCA");
        log.info("=================================================");
        log.info("Plan: {}", v.getPlanPath());
        log.info("Output: {}", v.writesToStdout() ? "stdout" : v.getOutputPath());
        log.info("Template Name: {}", v.getTranslatorConfig().getTemplateName());
        log.info("Author: {}", v.getTranslatorConfig().getTemplateAuthor());
        log.info("=================================================");
    }

    public void printSummary(ValidatedReverseOptions v, TranslationResult result) {
        MappingStats stats = result.getStats();
        log.info("");
        log.info("=================================================");
        log.info(result.hasMapperFailures() ? "TRANSLATION COMPLETED WITH MAPPER FAILURES" : "TRANSLATION SUCCESSFUL");
        log.info("=================================================");
        if (!v.writesToStdout()) {
            log.info("Output Path: {}", v.getOutputPath());
        }
        log.info("Resources Discovered: {}", stats.getResourcesDiscovered());
        log.info("  Primary Mapped: {}", stats.getPrimaryMapped());
        log.info("  Associative Mapped: {}", stats.getAssociativeMapped());
        log.info("  Unsupported: {}", stats.getUnsupported());
        log.info("  Declined: {}", stats.getDeclined());
        log.info("  Failed: {}", stats.getFailed());
        log.info("Node Templates: {}", stats.getNodesEmitted());
        log.info("Inputs: {}", stats.getInputsEmitted());
        log.info("Outputs: {}", stats.getOutputsEmitted());
        log.info("Time: {} ms", stats.getTranslationTimeMillis());

        List<Diagnostic> warnings = result.getDiagnostics().getWarnings();
        List<Diagnostic> errors = result.getDiagnostics().getErrors();
        if (!warnings.isEmpty() || !errors.isEmpty()) {
            log.info("");
            log.info("Diagnostics: {} warning(s), {} error(s)", warnings.size(), errors.size());
            errors.forEach(d -> log.error("  {}", d));
            warnings.forEach(d -> log.warn("  {}", d));
        }
        log.info("=================================================");
    }
}
