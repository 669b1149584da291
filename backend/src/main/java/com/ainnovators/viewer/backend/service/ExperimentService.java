package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.config.ViewerProperties;
import com.ainnovators.viewer.backend.dto.ExperimentDetailResponse;
import com.ainnovators.viewer.backend.exception.ArtifactNotFoundException;
import com.ainnovators.viewer.backend.model.DesignAsset;
import com.ainnovators.viewer.backend.model.Experiment;
import com.ainnovators.viewer.backend.model.ExperimentContext;
import com.ainnovators.viewer.backend.model.ResolvedExperiment;
import com.ainnovators.viewer.backend.model.SourceKind;
import com.ainnovators.viewer.backend.model.StageRunResult;
import com.ainnovators.viewer.backend.model.Statistics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over the experiments directory.
 * Each call reads from disk afresh; nothing is cached between requests.
 */
@Service
public class ExperimentService {

    private static final Logger log = LoggerFactory.getLogger(ExperimentService.class);

    private final ViewerProperties properties;
    private final ExperimentScanner scanner;
    private final ArtifactResolver resolver;
    private final ContextNormalizer normalizer;
    private final JsonDocumentReader documentReader;

    public ExperimentService(ViewerProperties properties,
            ExperimentScanner scanner,
            ArtifactResolver resolver,
            ContextNormalizer normalizer,
            JsonDocumentReader documentReader) {
        this.properties = properties;
        this.scanner = scanner;
        this.resolver = resolver;
        this.normalizer = normalizer;
        this.documentReader = documentReader;
    }

    /**
     * All experiments, newest first.
     */
    public List<Experiment> listExperiments() {
        return scanner.listExperiments(root());
    }

    /**
     * Summary of one experiment with its authoritative context normalized.
     */
    public ExperimentDetailResponse getExperiment(String id) {
        ResolvedExperiment resolved = resolver.resolve(root(), id);

        ExperimentDetailResponse.ExperimentDetailResponseBuilder response = ExperimentDetailResponse.builder()
                .experiment(resolved.getExperiment())
                .subfolders(resolved.getSubfolders())
                .source(resolved.getSource())
                .sourceFile(resolved.getSourceFile());

        if (resolved.hasContext()) {
            response.schema(normalizer.detectSchema(resolved.getRawContext()));
        }

        if (resolved.getResultsBundle() != null) {
            attachResults(response, resolved.getResultsBundle());
        }

        if (resolved.hasContext() && resolved.getSource() != SourceKind.RESULTS_BUNDLE) {
            JsonNode rawContext = resolved.getRawContext();
            Optional<ExperimentContext> context = normalizer.toContext(rawContext, resolved.getSourceFile());
            if (context.isPresent()) {
                response.context(context.get());
            } else {
                response.rawContext(normalizer.normalize(rawContext));
            }
        }

        log.debug("Loaded experiment {} (source: {})", id, resolved.getSource());
        return response.build();
    }

    /**
     * Cost, token and timing statistics of one experiment.
     */
    public Statistics getStatistics(String id) {
        Path experimentDir = experimentDir(id);
        return documentReader.read(experimentDir.resolve(ArtifactPaths.STATISTICS), Statistics.class);
    }

    /**
     * Raw snapshot written after {@code stage}, as stored on disk.
     */
    public JsonNode getStageContext(String id, String stage) {
        return resolver.loadStageContext(root(), id, stage);
    }

    /**
     * Design image referenced by the prototyping stage.
     */
    public DesignAsset getDesignAsset(String id, String fileName) {
        return resolver.loadAsset(root(), id, fileName);
    }

    private void attachResults(ExperimentDetailResponse.ExperimentDetailResponseBuilder response, JsonNode bundle) {
        if (!bundle.isObject()) {
            log.warn("{} is not a JSON object, serving it untyped", ArtifactPaths.RESULTS);
            response.rawResults(bundle);
            return;
        }

        ObjectNode fields = bundle.deepCopy();
        JsonNode embedded = fields.remove(ArtifactResolver.FULL_CONTEXT);
        Optional<StageRunResult> typed = documentReader.tryBind(fields, StageRunResult.class, ArtifactPaths.RESULTS);
        if (typed.isEmpty()) {
            if (embedded != null) {
                fields.set(ArtifactResolver.FULL_CONTEXT, normalizer.normalize(embedded));
            }
            response.rawResults(fields);
            return;
        }

        StageRunResult result = typed.get();
        if (embedded != null && !embedded.isNull()) {
            Optional<ExperimentContext> context = normalizer.toContext(embedded, ArtifactPaths.RESULTS);
            if (context.isPresent()) {
                result.setFullContext(context.get());
            } else {
                result.setRawFullContext(normalizer.normalize(embedded));
            }
        }
        response.results(result);
    }

    private Path experimentDir(String id) {
        Path experimentDir = ArtifactPaths.resolveWithin(root(), id, "experiment id");
        if (!Files.isDirectory(experimentDir)) {
            throw new ArtifactNotFoundException("Experiment not found: " + id);
        }
        return experimentDir;
    }

    private Path root() {
        return properties.experimentsRoot();
    }
}
