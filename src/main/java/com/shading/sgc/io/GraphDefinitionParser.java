package com.shading.sgc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads {@link GraphDefinition}s from JSON.
 */
public final class GraphDefinitionParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphDefinitionParser() {
        // Utility class
    }

    /**
     * Parses a JSON string.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or lacks
     *                                  the {@code graph} key.
     */
    public static GraphDefinition parse(String json) {
        GraphDefinition def;
        try {
            def = MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        return def;
    }

    /** Parses a JSON file. */
    public static GraphDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON file from the classpath.
     *
     * @throws UncheckedIOException if the resource is missing or unreadable.
     */
    public static GraphDefinition parseResource(String resource) {
        try (InputStream in = GraphDefinitionParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new UncheckedIOException(new IOException("Resource not found: " + resource));
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resource " + resource, e);
        }
    }
}
