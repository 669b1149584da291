package com.ainnovators.viewer.backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of resolving an experiment id to its authoritative artifact.
 * {@code source}, {@code sourceFile} and {@code rawContext} are null when the directory
 * holds no context document at all.
 */
@Value
@Builder
public class ResolvedExperiment {

    Experiment experiment;

    List<String> subfolders;

    SourceKind source;

    String sourceFile;

    JsonNode rawContext;

    // Parsed results.json, whenever one exists
    JsonNode resultsBundle;

    public boolean hasContext() {
        return rawContext != null;
    }
}
