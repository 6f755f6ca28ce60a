package com.retosca.engine.cli.model;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options of the "reverse" command. No validation, no execution logic, no printing.
 */
@Getter
@Setter
public class ReverseOptions {

    @Option(names = { "--plan", "-p" },
            description = "Terraform plan JSON (terraform show -json) to translate")
    private Path plan;

    @Option(names = { "--output", "-o" },
            description = "YAML file to write; the template is printed to stdout when omitted")
    private Path output;

    @Option(names = { "--template-name", "-n" }, description = "Template name recorded in the metadata")
    private String templateName;

    @Option(names = { "--author", "-a" }, description = "Template author recorded in the metadata")
    private String author;

    @Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
    private boolean force;

    @Option(names = { "--fail-on-mapper-errors" },
            description = "Exit with code 2 when any resource mapper failed")
    private boolean failOnMapperErrors;

    @Option(names = { "--verbose", "-v" }, description = "Log resolution details at debug level")
    private boolean verbose;
}
