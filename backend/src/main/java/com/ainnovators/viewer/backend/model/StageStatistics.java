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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StageStatistics {

    private long executionTimeMs;

    private int totalCalls;

    private long totalTokens;

    private double totalCost;

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
