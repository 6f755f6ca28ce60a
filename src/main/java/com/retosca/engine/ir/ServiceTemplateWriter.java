package com.retosca.engine.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders service templates as TOSCA YAML.
 */
public class ServiceTemplateWriter {

    private static final Logger log = LoggerFactory.getLogger(ServiceTemplateWriter.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .build());

    public String toYaml(ServiceTemplate template) {
        try {
            return YAML_MAPPER.writeValueAsString(template.toTemplateMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize service template", e);
        }
    }

    public void write(ServiceTemplate template, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toYaml(template));
            log.info("Wrote service template to {}", target.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write service template: " + target, e);
        }
    }
}
