package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.exception.ArtifactNotFoundException;
import com.ainnovators.viewer.backend.exception.ArtifactReadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads whole JSON artifacts into memory and translates failures into the viewer's error taxonomy.
 */
@Component
public class JsonDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentReader.class);

    private final ObjectMapper objectMapper;

    public JsonDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Read and parse a document as a tree.
     */
    public JsonNode readTree(Path file) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException("File not found: " + file.getFileName());
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            throw new ArtifactReadException("Failed to read " + file.getFileName(), e);
        }

        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || node.isMissingNode()) {
                throw new ArtifactReadException("Empty document: " + file.getFileName(), null);
            }
            return node;
        } catch (IOException e) {
            log.error("Malformed JSON in {}: {}", file, e.getMessage());
            throw new ArtifactReadException("Malformed JSON in " + file.getFileName(), e);
        }
    }

    /**
     * Read a document and bind it to {@code type}.
     */
    public <T> T read(Path file, Class<T> type) {
        return bind(readTree(file), type, file.getFileName().toString());
    }

    /**
     * Bind an already parsed tree; a shape mismatch is a read error.
     */
    public <T> T bind(JsonNode node, Class<T> type, String origin) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unexpected {} shape in {}: {}", type.getSimpleName(), origin, e.getMessage());
            throw new ArtifactReadException("Unexpected document shape in " + origin, e);
        }
    }

    /**
     * Bind an already parsed tree, or return empty when its shape does not fit {@code type}.
     */
    public <T> Optional<T> tryBind(JsonNode node, Class<T> type, String origin) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("{} does not fit the {} model, serving it untyped: {}",
                    origin, type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }
}
