package com.retosca.engine.plan;

import com.retosca.engine.core.exception.ExtractionFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads plan JSON documents from disk or from a string.
 */
public final class PlanLoader {

    private static final Logger log = LoggerFactory.getLogger(PlanLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    public PlanDocument load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ExtractionFailureException("Plan file does not exist: " + path);
        }
        try {
            JsonNode root = JSON.readTree(path.toFile());
            log.debug("Loaded plan document {} ({} bytes)", path, Files.size(path));
            return toDocument(root, path.toString());
        } catch (IOException e) {
            throw new ExtractionFailureException("Failed to read plan: " + path, e);
        }
    }

    public PlanDocument parse(String json) {
        try {
            return toDocument(JSON.readTree(json), "<inline>");
        } catch (JsonProcessingException e) {
            throw new ExtractionFailureException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static PlanDocument toDocument(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ExtractionFailureException("Plan document is not a JSON object: " + source);
        }
        return PlanDocument.of(root);
    }
}
