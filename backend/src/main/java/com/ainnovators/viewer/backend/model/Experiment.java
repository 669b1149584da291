package com.ainnovators.viewer.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.SortedSet;

/**
 * Summary of one experiment directory, rebuilt on every scan.
 */
@Value
@Builder
public class Experiment {

    String id;

    @JsonProperty("type")
    ExperimentKind kind;

    @JsonProperty("hasStatistics")
    boolean hasStatistics;

    @JsonProperty("hasCompleteContext")
    boolean hasCompleteContext;

    @JsonProperty("hasResults")
    boolean hasResultsBundle;

    // Every *.json document in the directory
    @JsonProperty("contextFiles")
    SortedSet<String> artifactFileNames;

    @JsonProperty("timestamp")
    Instant modifiedAt;
}
