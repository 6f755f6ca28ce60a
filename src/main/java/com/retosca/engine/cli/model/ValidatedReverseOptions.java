package com.retosca.engine.cli.model;

import com.retosca.engine.core.context.TranslatorConfig;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Derived values needed to run a translation. Keeps ReverseCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedReverseOptions {
    Path planPath;
    Path outputPath;
    TranslatorConfig translatorConfig;

    public boolean writesToStdout() {
        return outputPath == null;
    }
}
