package com.ainnovators.viewer.backend.controller;

import com.ainnovators.viewer.backend.config.ViewerProperties;
import com.ainnovators.viewer.backend.dto.ExperimentDetailResponse;
import com.ainnovators.viewer.backend.model.DesignAsset;
import com.ainnovators.viewer.backend.model.Experiment;
import com.ainnovators.viewer.backend.model.Statistics;
import com.ainnovators.viewer.backend.service.ExperimentService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/experiments")
@Tag(name = "Experiments", description = "Pipeline experiment artifacts")
public class ExperimentController {

    private final ExperimentService experimentService;
    private final ViewerProperties properties;

    public ExperimentController(ExperimentService experimentService, ViewerProperties properties) {
        this.experimentService = experimentService;
        this.properties = properties;
    }

    @GetMapping
    @Operation(summary = "List experiments", description = "List all experiment directories, newest first")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Experiments listed"),
            @ApiResponse(responseCode = "500", description = "Experiments directory could not be read")
    })
    public ResponseEntity<List<Experiment>> listExperiments() {
        return ResponseEntity.ok(experimentService.listExperiments());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get experiment", description = "Get an experiment with its authoritative context, normalized to the structured schema")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Experiment found"),
            @ApiResponse(responseCode = "400", description = "Invalid experiment ID"),
            @ApiResponse(responseCode = "404", description = "Experiment not found")
    })
    public ResponseEntity<ExperimentDetailResponse> getExperiment(
            @Parameter(description = "Experiment ID") @PathVariable String id) {

        return ResponseEntity.ok(experimentService.getExperiment(id));
    }

    @GetMapping("/{id}/statistics")
    @Operation(summary = "Get statistics", description = "Get cost, token and timing statistics of an experiment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Statistics found"),
            @ApiResponse(responseCode = "404", description = "Statistics not found")
    })
    public ResponseEntity<Statistics> getStatistics(
            @Parameter(description = "Experiment ID") @PathVariable String id) {

        return ResponseEntity.ok(experimentService.getStatistics(id));
    }

    @GetMapping("/{id}/context/{stage}")
    @Operation(summary = "Get stage snapshot", description = "Get the raw context snapshot written after a stage")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot found"),
            @ApiResponse(responseCode = "400", description = "Invalid experiment ID or stage"),
            @ApiResponse(responseCode = "404", description = "Snapshot not found")
    })
    public ResponseEntity<JsonNode> getStageContext(
            @Parameter(description = "Experiment ID") @PathVariable String id,
            @Parameter(description = "Stage name", example = "idea_development") @PathVariable String stage) {

        return ResponseEntity.ok(experimentService.getStageContext(id, stage));
    }

    @GetMapping("/{id}/designs/{fileName}")
    @Operation(summary = "Get design image", description = "Download a design image produced by the prototyping stage")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Image returned"),
            @ApiResponse(responseCode = "400", description = "Invalid path"),
            @ApiResponse(responseCode = "404", description = "Image not found")
    })
    public ResponseEntity<byte[]> getDesignAsset(
            @Parameter(description = "Experiment ID") @PathVariable String id,
            @Parameter(description = "Image file name", example = "landing_page.png") @PathVariable String fileName) {

        DesignAsset asset = experimentService.getDesignAsset(id, fileName);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(asset.contentType()))
                .cacheControl(CacheControl.maxAge(properties.getAssetCacheMaxAge()).cachePublic())
                .body(asset.content());
    }
}
