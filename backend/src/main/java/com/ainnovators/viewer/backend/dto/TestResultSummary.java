package com.ainnovators.viewer.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing entry for one recorded test run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Test result summary")
public class TestResultSummary {

    @Schema(description = "Test result ID (file name without extension)", example = "researcher_agent_20240102_101500")
    private String id;

    @Schema(description = "File name", example = "researcher_agent_20240102_101500.json")
    private String filename;

    @Schema(description = "Stage under test")
    private String stageName;

    @Schema(description = "Test name")
    private String testName;

    @Schema(description = "Agent under test")
    private String agentName;

    @Schema(description = "Test type", example = "agent")
    private String testType;

    @Schema(description = "Run timestamp, falling back to the start timestamp")
    private String timestamp;

    @Schema(description = "Execution time in milliseconds")
    private Long executionTimeMs;

    @Schema(description = "Whether the run succeeded")
    private Boolean success;
}
