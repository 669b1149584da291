package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.exception.ArtifactNotFoundException;
import com.ainnovators.viewer.backend.exception.ArtifactReadException;
import com.ainnovators.viewer.backend.model.DesignAsset;
import com.ainnovators.viewer.backend.model.Experiment;
import com.ainnovators.viewer.backend.model.ResolvedExperiment;
import com.ainnovators.viewer.backend.model.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

/**
 * Picks the authoritative context document of an experiment and serves its auxiliary files.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>{@code context_final.json}, written when a full run completes;</li>
 *   <li>the {@code full_context} embedded in a stage run's {@code results.json};</li>
 *   <li>the lexically first {@code context_<stage>.json} snapshot.</li>
 * </ol>
 * A directory with none of these still resolves, just without a context.
 */
@Component
public class ArtifactResolver {

    private static final Logger log = LoggerFactory.getLogger(ArtifactResolver.class);

    static final String FULL_CONTEXT = "full_context";

    private static final String DEFAULT_IMAGE_TYPE = "image/png";

    private static final Map<String, String> IMAGE_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "webp", "image/webp",
            "svg", "image/svg+xml");

    private final ExperimentScanner scanner;
    private final JsonDocumentReader documentReader;

    public ArtifactResolver(ExperimentScanner scanner, JsonDocumentReader documentReader) {
        this.scanner = scanner;
        this.documentReader = documentReader;
    }

    /**
     * Resolve experiment {@code id} under {@code root}.
     */
    public ResolvedExperiment resolve(Path root, String id) {
        Path experimentDir = ArtifactPaths.resolveWithin(root, id, "experiment id");

        SortedSet<String> fileNames;
        Experiment experiment;
        List<String> subfolders;
        try {
            fileNames = ExperimentScanner.listFileNames(experimentDir);
            experiment = scanner.describe(experimentDir, fileNames);
            subfolders = subfolders(experimentDir, fileNames);
        } catch (NoSuchFileException | NotDirectoryException e) {
            throw new ArtifactNotFoundException("Experiment not found: " + id);
        } catch (IOException e) {
            log.error("Failed to read experiment directory {}: {}", experimentDir, e.getMessage());
            throw new ArtifactReadException("Failed to load experiment " + id, e);
        }

        ResolvedExperiment.ResolvedExperimentBuilder resolved = ResolvedExperiment.builder()
                .experiment(experiment)
                .subfolders(subfolders);

        if (fileNames.contains(ArtifactPaths.FINAL_CONTEXT)) {
            log.debug("Resolved {} from final context", id);
            return resolved
                    .source(SourceKind.FINAL_CONTEXT)
                    .sourceFile(ArtifactPaths.FINAL_CONTEXT)
                    .rawContext(documentReader.readTree(experimentDir.resolve(ArtifactPaths.FINAL_CONTEXT)))
                    .build();
        }

        if (fileNames.contains(ArtifactPaths.RESULTS)) {
            JsonNode results = documentReader.readTree(experimentDir.resolve(ArtifactPaths.RESULTS));
            resolved.resultsBundle(results);
            JsonNode embedded = results.path(FULL_CONTEXT);
            if (!embedded.isMissingNode() && !embedded.isNull()) {
                log.debug("Resolved {} from results bundle", id);
                return resolved
                        .source(SourceKind.RESULTS_BUNDLE)
                        .sourceFile(ArtifactPaths.RESULTS)
                        .rawContext(embedded)
                        .build();
            }
            log.debug("Results bundle of {} has no embedded context, trying snapshots", id);
        }

        // SortedSet iteration is lexical order
        for (String fileName : fileNames) {
            if (ArtifactPaths.isStageContext(fileName)) {
                log.debug("Resolved {} from partial context {}", id, fileName);
                return resolved
                        .source(SourceKind.PARTIAL_CONTEXT)
                        .sourceFile(fileName)
                        .rawContext(documentReader.readTree(experimentDir.resolve(fileName)))
                        .build();
            }
        }

        log.debug("Experiment {} has no context document", id);
        return resolved.build();
    }

    /**
     * Read one stage snapshot verbatim, without normalization.
     */
    public JsonNode loadStageContext(Path root, String id, String stage) {
        Path experimentDir = ArtifactPaths.resolveWithin(root, id, "experiment id");
        ArtifactPaths.requireSafeSegment(stage, "stage");
        Path contextFile = ArtifactPaths.resolveWithin(experimentDir, ArtifactPaths.stageContextFile(stage), "stage");

        if (!Files.isDirectory(experimentDir)) {
            throw new ArtifactNotFoundException("Experiment not found: " + id);
        }
        return documentReader.readTree(contextFile);
    }

    /**
     * Load a design image from {@code <root>/<id>/designs/<fileName>}.
     * Both segments are checked before the filesystem is touched.
     */
    public DesignAsset loadAsset(Path root, String id, String fileName) {
        ArtifactPaths.requireSafeSegment(id, "experiment id");
        ArtifactPaths.requireSafeSegment(fileName, "file name");

        Path designsDir = ArtifactPaths.resolveWithin(root, id, "experiment id").resolve(ArtifactPaths.DESIGNS_DIR);
        Path imagePath = ArtifactPaths.resolveWithin(designsDir, fileName, "file name");

        if (!Files.isRegularFile(imagePath)) {
            throw new ArtifactNotFoundException("Image not found: " + fileName);
        }

        try {
            byte[] content = Files.readAllBytes(imagePath);
            return new DesignAsset(fileName, contentTypeOf(fileName), content);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException("Image not found: " + fileName);
        } catch (IOException e) {
            log.error("Failed to read design image {}: {}", imagePath, e.getMessage());
            throw new ArtifactReadException("Failed to read image " + fileName, e);
        }
    }

    static String contentTypeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_IMAGE_TYPE;
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return IMAGE_TYPES.getOrDefault(extension, DEFAULT_IMAGE_TYPE);
    }

    private static List<String> subfolders(Path experimentDir, SortedSet<String> fileNames) {
        List<String> folders = new ArrayList<>();
        for (String name : fileNames) {
            if (Files.isDirectory(experimentDir.resolve(name))) {
                folders.add(name);
            }
        }
        return folders;
    }
}
