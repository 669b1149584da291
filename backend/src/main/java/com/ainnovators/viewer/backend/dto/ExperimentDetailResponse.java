package com.ainnovators.viewer.backend.dto;

import com.ainnovators.viewer.backend.model.ContextSchema;
import com.ainnovators.viewer.backend.model.Experiment;
import com.ainnovators.viewer.backend.model.ExperimentContext;
import com.ainnovators.viewer.backend.model.SourceKind;
import com.ainnovators.viewer.backend.model.StageRunResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Experiment summary plus its resolved, normalized context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Experiment details with normalized context")
public class ExperimentDetailResponse {

    @JsonUnwrapped
    @Schema(description = "Experiment summary fields")
    private Experiment experiment;

    @Schema(description = "Folders inside the experiment directory", example = "[\"designs\", \"logs\", \"prototype\"]")
    private List<String> subfolders;

    @Schema(description = "Artifact the context was resolved from; absent when there is none")
    private SourceKind source;

    @Schema(description = "File the context was read from", example = "context_final.json")
    private String sourceFile;

    @Schema(description = "Schema generation of the raw context document")
    private ContextSchema schema;

    @Schema(description = "Normalized context, for final and partial contexts")
    private ExperimentContext context;

    @Schema(description = "Context served as stored when its shape does not fit the typed model")
    private JsonNode rawContext;

    @Schema(description = "Stage run bundle from results.json, with its embedded context normalized")
    private StageRunResult results;

    @Schema(description = "results.json served as stored when its shape does not fit the typed model")
    private JsonNode rawResults;
}
