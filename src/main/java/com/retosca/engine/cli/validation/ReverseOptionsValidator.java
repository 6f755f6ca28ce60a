package com.retosca.engine.cli.validation;

import com.retosca.engine.cli.exception.OptionsValidationException;
import com.retosca.engine.cli.model.ReverseOptions;
import com.retosca.engine.cli.model.ValidatedReverseOptions;
import com.retosca.engine.core.context.TranslatorConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ReverseOptionsValidator {

    public ValidatedReverseOptions validate(ReverseOptions o) {
        List<String> errors = new ArrayList<>();

        Path plan = o.getPlan();
        if (plan == null) {
            errors.add("Plan file is required (--plan / -p).");
        } else if (!Files.exists(plan)) {
            errors.add("Plan file does not exist: " + plan);
        } else if (!Files.isRegularFile(plan)) {
            errors.add("Plan path is not a file: " + plan);
        }

        Path output = null;
        if (o.getOutput() != null) {
            output = o.getOutput().toAbsolutePath().normalize();
            String fileName = output.getFileName() == null
                    ? ""
                    : output.getFileName().toString().toLowerCase(Locale.ROOT);
            if (!fileName.endsWith(".yaml") && !fileName.endsWith(".yml")) {
                errors.add("Output file must have a .yaml or .yml extension: " + o.getOutput());
            }
            if (Files.isDirectory(output)) {
                errors.add("Output path is a directory: " + o.getOutput());
            } else if (Files.exists(output) && !o.isForce()) {
                errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
            }
        }

        if (o.getTemplateName() != null && o.getTemplateName().isBlank()) {
            errors.add("Template name must not be blank (--template-name / -n).");
        }
        if (o.getAuthor() != null && o.getAuthor().isBlank()) {
            errors.add("Author must not be blank (--author / -a).");
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        TranslatorConfig.TranslatorConfigBuilder config = TranslatorConfig.builder();
        if (o.getTemplateName() != null) {
            config.templateName(o.getTemplateName().trim());
        }
        if (o.getAuthor() != null) {
            config.templateAuthor(o.getAuthor().trim());
        }
        return new ValidatedReverseOptions(plan.toAbsolutePath().normalize(), output, config.build());
    }
}
