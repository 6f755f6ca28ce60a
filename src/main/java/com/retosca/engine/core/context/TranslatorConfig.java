package com.retosca.engine.core.context;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one plan translation.
 */
@Data
@Builder
public class TranslatorConfig {

    /**
     * Name recorded in the template metadata.
     */
    @Builder.Default
    private String templateName = "retosca-template";

    /**
     * Author recorded in the template metadata.
     */
    @Builder.Default
    private String templateAuthor = "retosca";

    @Builder.Default
    private String templateVersion = "1.0.0";

    /**
     * Free-text description of the generated service template.
     */
    @Builder.Default
    private String description = "Service template reverse-engineered from a Terraform plan";

    /**
     * When true, data sources are offered to the mapper registry like managed resources.
     */
    private boolean includeDataSources;

    public static TranslatorConfig defaults() {
        return TranslatorConfig.builder().build();
    }
}
