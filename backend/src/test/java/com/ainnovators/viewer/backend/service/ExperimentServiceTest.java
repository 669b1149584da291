package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.config.ViewerProperties;
import com.ainnovators.viewer.backend.dto.ExperimentDetailResponse;
import com.ainnovators.viewer.backend.exception.ArtifactNotFoundException;
import com.ainnovators.viewer.backend.model.ContextSchema;
import com.ainnovators.viewer.backend.model.SourceKind;
import com.ainnovators.viewer.backend.model.Stage;
import com.ainnovators.viewer.backend.model.Statistics;
import com.ainnovators.viewer.backend.support.ExperimentFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentServiceTest {

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ExperimentService experimentService;

    @BeforeEach
    void setUp() {
        ViewerProperties properties = new ViewerProperties();
        properties.setExperimentsDir(root.toString());
        JsonDocumentReader documentReader = new JsonDocumentReader(objectMapper);
        ExperimentScanner scanner = new ExperimentScanner();
        experimentService = new ExperimentService(properties, scanner,
                new ArtifactResolver(scanner, documentReader), new ContextNormalizer(documentReader), documentReader);
    }

    @Test
    void shouldNormalizeLegacyFinalContext() {
        // Given
        Path dir = ExperimentFixtures.experiment(root, "experiment_20240102_101500");
        ExperimentFixtures.write(dir, "context_final.json", ExperimentFixtures.LEGACY_CONTEXT);

        // When
        ExperimentDetailResponse response = experimentService.getExperiment("experiment_20240102_101500");

        // Then
        assertEquals(SourceKind.FINAL_CONTEXT, response.getSource());
        assertEquals(ContextSchema.LEGACY, response.getSchema());
        assertNull(response.getResults());
        assertEquals("GO", response.getContext().getState().getStageOutputs()
                .get(Stage.IDEA_DEVELOPMENT).at("/final_validation/recommendation").asText());
    }

    @Test
    void shouldNormalizeContextEmbeddedInResultsBundle() {
        // Given
        Path dir = ExperimentFixtures.experiment(root, "stage_run_pitch_20240105_120000");
        ExperimentFixtures.write(dir, "results.json",
                ExperimentFixtures.resultsBundle("pitch", ExperimentFixtures.LEGACY_CONTEXT));

        // When
        ExperimentDetailResponse response = experimentService.getExperiment("stage_run_pitch_20240105_120000");

        // Then
        assertEquals(SourceKind.RESULTS_BUNDLE, response.getSource());
        assertNull(response.getContext());
        assertEquals("pitch", response.getResults().getStage());
        assertTrue(response.getResults().isSuccess());
        assertEquals("Books that close themselves", response.getResults().getFullContext().getState()
                .getStageOutputs().get(Stage.PITCH).at("/pitch_deck/tagline").asText());
    }

    @Test
    void shouldServeUnrecognizedContextsUntyped() throws Exception {
        // Given
        List<String> documents = List.of(
                "{\"state\": 42}",
                "{\"state\": \"oops\"}",
                "{\"state\": {\"stage_outputs\": [1, 2], \"idea\": {}}}",
                "{\"state\": {\"stage_outputs\": \"corrupted\"}}",
                "[1, 2, 3]");

        for (int i = 0; i < documents.size(); i++) {
            String id = "experiment_2024010" + (i + 1) + "_000000";
            Path dir = ExperimentFixtures.experiment(root, id);
            ExperimentFixtures.write(dir, "context_final.json", documents.get(i));

            // When
            ExperimentDetailResponse response = experimentService.getExperiment(id);

            // Then
            assertEquals(SourceKind.FINAL_CONTEXT, response.getSource());
            assertNull(response.getContext(), documents.get(i));
            assertEquals(objectMapper.readTree(documents.get(i)), response.getRawContext(), documents.get(i));
        }
    }

    @Test
    void shouldServeNormalizedContextUntypedWhenFieldTypesDoNotBind() {
        Path dir = ExperimentFixtures.experiment(root, "experiment_20240109_000000");
        ExperimentFixtures.write(dir, "context_final.json", """
                {"state": {"iterations": "two", "idea": {"problem": "P"}}}
                """);

        ExperimentDetailResponse response = experimentService.getExperiment("experiment_20240109_000000");

        assertNull(response.getContext());
        assertEquals(ContextSchema.LEGACY, response.getSchema());
        assertEquals("P", response.getRawContext().at("/state/stage_outputs/idea_development/idea/problem").asText());
    }

    @Test
    void shouldReportUnrecognizedSchemaForNonObjectStageOutputs() {
        Path dir = ExperimentFixtures.experiment(root, "experiment_20240108_000000");
        ExperimentFixtures.write(dir, "context_final.json", "{\"state\": {\"stage_outputs\": [1, 2]}}");

        ExperimentDetailResponse response = experimentService.getExperiment("experiment_20240108_000000");

        assertEquals(ContextSchema.UNRECOGNIZED, response.getSchema());
        assertTrue(response.getRawContext().at("/state/stage_outputs").isArray());
    }

    @Test
    void shouldServeUnrecognizedEmbeddedContextUntyped() {
        Path dir = ExperimentFixtures.experiment(root, "stage_run_pitch_20240105_120000");
        ExperimentFixtures.write(dir, "results.json", ExperimentFixtures.resultsBundle("pitch", "{\"state\": 42}"));

        ExperimentDetailResponse response = experimentService.getExperiment("stage_run_pitch_20240105_120000");

        assertEquals(SourceKind.RESULTS_BUNDLE, response.getSource());
        assertEquals(ContextSchema.UNRECOGNIZED, response.getSchema());
        assertEquals("pitch", response.getResults().getStage());
        assertNull(response.getResults().getFullContext());
        assertEquals(42, response.getResults().getRawFullContext().path("state").asInt());
    }

    @Test
    void shouldServeMalformedResultsBundleUntyped() {
        // Given
        Path dir = ExperimentFixtures.experiment(root, "stage_run_prototyping_20240104_080000");
        ExperimentFixtures.write(dir, "results.json", "[\"not\", \"a\", \"bundle\"]");
        ExperimentFixtures.write(dir, "context_prototyping.json", ExperimentFixtures.STRUCTURED_CONTEXT);

        // When
        ExperimentDetailResponse response = experimentService.getExperiment("stage_run_prototyping_20240104_080000");

        // Then
        assertEquals(SourceKind.PARTIAL_CONTEXT, response.getSource());
        assertNull(response.getResults());
        assertTrue(response.getRawResults().isArray());
        assertNotNull(response.getContext());
    }

    @Test
    void shouldServeBundleWithUnexpectedFieldTypesUntyped() {
        Path dir = ExperimentFixtures.experiment(root, "stage_run_pitch_20240105_130000");
        ExperimentFixtures.write(dir, "results.json", """
                {"stage": "pitch", "success": {"nested": true}, "full_context": {"state": {"pitch": {}}}}
                """);

        ExperimentDetailResponse response = experimentService.getExperiment("stage_run_pitch_20240105_130000");

        assertNull(response.getResults());
        assertTrue(response.getRawResults().at("/full_context/state/stage_outputs/pitch/pitch_deck").isObject());
    }

    @Test
    void shouldAttachBundleAlongsidePartialContext() {
        Path dir = ExperimentFixtures.experiment(root, "stage_run_prototyping_20240104_080000");
        ExperimentFixtures.write(dir, "results.json", ExperimentFixtures.resultsBundle("prototyping", "null"));
        ExperimentFixtures.write(dir, "context_prototyping.json", ExperimentFixtures.STRUCTURED_CONTEXT);

        ExperimentDetailResponse response = experimentService.getExperiment("stage_run_prototyping_20240104_080000");

        assertEquals(SourceKind.PARTIAL_CONTEXT, response.getSource());
        assertEquals(ContextSchema.STRUCTURED, response.getSchema());
        assertEquals(3, response.getContext().getHistoryLength());
        assertNull(response.getResults().getFullContext());
    }

    @Test
    void shouldReturnSummaryWithoutContext() {
        ExperimentFixtures.experiment(root, "experiment_20240106_000000");

        ExperimentDetailResponse response = experimentService.getExperiment("experiment_20240106_000000");

        assertEquals("experiment_20240106_000000", response.getExperiment().getId());
        assertNull(response.getSource());
        assertNull(response.getSchema());
        assertNull(response.getContext());
    }

    @Test
    void shouldReadStatistics() {
        Path dir = ExperimentFixtures.experiment(root, "experiment_20240102_101500");
        ExperimentFixtures.write(dir, "statistics.json", ExperimentFixtures.STATISTICS);

        Statistics statistics = experimentService.getStatistics("experiment_20240102_101500");

        assertEquals(14, statistics.getTotalCalls());
        assertEquals(3, statistics.getStages().get("idea_development").getAgents().get("researcher").getCallCount());
    }

    @Test
    void shouldKeepStatisticsKeysTheModelDoesNotName() {
        Path dir = ExperimentFixtures.experiment(root, "experiment_20240102_101500");
        ExperimentFixtures.write(dir, "statistics.json", """
                {"total_calls": 2, "cache_hits": 5,
                 "stages": {"pitch": {"total_calls": 2, "retries": 1,
                                      "agents": {"ceo": {"call_count": 2, "model": "large"}}}}}
                """);

        Statistics statistics = experimentService.getStatistics("experiment_20240102_101500");

        assertEquals(5, statistics.getAdditionalFields().get("cache_hits").asInt());
        assertEquals(1, statistics.getStages().get("pitch").getAdditionalFields().get("retries").asInt());
        assertEquals("large", statistics.getStages().get("pitch").getAgents().get("ceo")
                .getAdditionalFields().get("model").asText());
    }

    @Test
    void shouldReportMissingStatisticsAsNotFound() {
        ExperimentFixtures.experiment(root, "experiment_20240102_101500");

        assertThrows(ArtifactNotFoundException.class,
                () -> experimentService.getStatistics("experiment_20240102_101500"));
        assertThrows(ArtifactNotFoundException.class,
                () -> experimentService.getStatistics("experiment_20990101_000000"));
    }
}
