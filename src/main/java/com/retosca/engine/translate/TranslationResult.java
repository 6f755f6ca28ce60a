package com.retosca.engine.translate;

import com.retosca.engine.core.context.DiagnosticKind;
import com.retosca.engine.core.context.MappingDiagnostics;
import com.retosca.engine.core.context.MappingStats;
import com.retosca.engine.ir.ServiceTemplate;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one plan translation.
 */
@Data
@Builder
public class TranslationResult {

    private ServiceTemplate template;
    private MappingDiagnostics diagnostics;
    private MappingStats stats;

    /**
     * True when every dispatched mapper completed; run-level failures are thrown, not reported here.
     */
    public boolean isSuccess() {
        return !hasMapperFailures();
    }

    /**
     * True when at least one mapper threw; the template is still complete for every other resource.
     */
    public boolean hasMapperFailures() {
        return diagnostics != null && diagnostics.has(DiagnosticKind.MAPPER_FAILURE);
    }
}
