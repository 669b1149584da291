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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-wide shared state as written by the pipeline.
 *
 * <p>Carries both schema generations: the structured {@link #stageOutputs} section and the
 * legacy flat stage fields. After normalization consumers only need {@code stageOutputs};
 * the flat fields stay for raw-dump views. Keys the pipeline adds later are kept in
 * {@link #getAdditionalFields()} so nothing is lost on the way out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContextState {

    // Stage tracking
    private String currentStage;

    @Builder.Default
    private List<String> completedStages = new ArrayList<>();

    private StageOutputs stageOutputs;

    // Legacy flat stage fields
    private JsonNode idea;
    private JsonNode research;
    private JsonNode researchFinal;
    private JsonNode legalInsights;
    private JsonNode refinementFeedback;
    private JsonNode prototype;
    private JsonNode architecture;
    private JsonNode design;
    private JsonNode finalDesigns;
    private JsonNode marketingStrategies;
    private JsonNode pitch;

    // Decisions and agent interactions
    private List<JsonNode> decisions;
    private List<JsonNode> rejections;
    private Integer iterations;
    private List<JsonNode> conversations;
    private List<JsonNode> toolCalls;

    // Metadata
    private String startTime;
    private CostInfo costs;
    private TokenUsage tokenUsage;
    private String experimentDir;
    private String experimentName;
    private String chairmanInput;

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
