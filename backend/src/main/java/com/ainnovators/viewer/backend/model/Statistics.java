package com.ainnovators.viewer.backend.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cost, token and timing aggregation of a run (statistics.json).
 * Two levels deep: stage, then agent within the stage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Statistics {

    private long totalExecutionTimeMs;

    private int totalCalls;

    private long totalTokens;

    private long totalPromptTokens;

    private long totalCompletionTokens;

    private double totalCost;

    private double maxBudget;

    private double budgetUsedPercent;

    @Builder.Default
    private Map<String, StageStatistics> stages = new LinkedHashMap<>();

    // Per-agent totals across all stages
    @Builder.Default
    private Map<String, AgentStatistics> agents = new LinkedHashMap<>();

    // Keys the model does not name, kept verbatim
    @JsonIgnore
    @Builder.Default
    private Map<String, JsonNode> additionalFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, JsonNode> getAdditionalFields() {
        return additionalFields;
    }

    @JsonAnySetter
    public void putAdditionalField(String name, JsonNode value) {
        additionalFields.put(name, value);
    }
}
