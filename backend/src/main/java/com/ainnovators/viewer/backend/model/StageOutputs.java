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
import java.util.Map;

/**
 * Structured per-stage output bundles. Payloads are opaque to the viewer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageOutputs {

    // idea + final_validation + optional legal_insights
    private JsonNode ideaDevelopment;

    // architecture + design + prototype + optional final_designs / qa_results
    private JsonNode prototyping;

    // marketing_strategies + pitch_deck
    private JsonNode pitch;

    // Stages added to the pipeline later, e.g. documentation
    @JsonIgnore
    @Builder.Default
    private Map<String, JsonNode> additionalStages = new LinkedHashMap<>();

    public JsonNode get(Stage stage) {
        return switch (stage) {
            case IDEA_DEVELOPMENT -> ideaDevelopment;
            case PROTOTYPING -> prototyping;
            case PITCH -> pitch;
        };
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getAdditionalStages() {
        return additionalStages;
    }

    @JsonAnySetter
    public void putAdditionalStage(String name, JsonNode value) {
        additionalStages.put(name, value);
    }
}
