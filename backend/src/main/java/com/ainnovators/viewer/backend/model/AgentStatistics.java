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
 * Usage of a single agent within a stage, or across the whole run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AgentStatistics {

    private int callCount;

    private long executionTimeMs;

    private long promptTokens;

    private long completionTokens;

    private long totalTokens;

    private double cost;

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
