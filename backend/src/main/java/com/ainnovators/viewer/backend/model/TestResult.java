package com.ainnovators.viewer.backend.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recorded agent or stage test run, identified by its file name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestResult {

    private String id;

    private String stageName;

    private String testName;

    private String agentName;

    private String testType;

    private String timestamp;

    private String timestampStart;

    private String timestampEnd;

    private Long executionTimeMs;

    private Boolean success;

    private JsonNode input;

    private List<JsonNode> iterations;

    private JsonNode finalOutput;

    private List<JsonNode> events;

    private JsonNode error;

    private List<JsonNode> tools;

    private Integer toolCount;

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
