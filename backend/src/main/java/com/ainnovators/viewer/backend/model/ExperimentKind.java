package com.ainnovators.viewer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of pipeline execution an experiment directory holds.
 * Derived from the directory naming convention.
 */
public enum ExperimentKind {
    FULL("full"), // Complete pipeline run (experiment_<timestamp>)
    STAGE_RUN("stage_run"); // Single stage run (stage_run_<stage>_<timestamp>)

    public static final String STAGE_RUN_PREFIX = "stage_run_";

    private final String wireName;

    ExperimentKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static ExperimentKind fromId(String experimentId) {
        return experimentId.startsWith(STAGE_RUN_PREFIX) ? STAGE_RUN : FULL;
    }
}
