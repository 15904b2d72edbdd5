package com.trading.flow.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link WorkflowDefinition}s from JSON.
 *
 * Malformed JSON and a missing {@code workflow} key are reported as
 * {@link IllegalArgumentException}.
 */
public final class WorkflowDefinitionParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowDefinitionParser() {
        // Utility class
    }

    /** Parses a JSON file into a WorkflowDefinition. */
    public static WorkflowDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON string into a WorkflowDefinition. */
    public static WorkflowDefinition parse(String json) {
        try {
            return checked(MAPPER.readValue(json, WorkflowDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a classpath resource, e.g. {@code workflows/stock_analysis.json}. */
    public static WorkflowDefinition parseResource(String resource) {
        ClassLoader loader = WorkflowDefinitionParser.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Workflow resource not found: " + resource);
            return checked(MAPPER.readValue(in, WorkflowDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid workflow JSON in " + resource + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static WorkflowDefinition checked(WorkflowDefinition def) {
        if (def == null || def.getWorkflow() == null)
            throw new IllegalArgumentException("Missing 'workflow' key");
        return def;
    }
}
