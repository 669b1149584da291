package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.exception.ArtifactReadException;
import com.ainnovators.viewer.backend.model.Experiment;
import com.ainnovators.viewer.backend.model.ExperimentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Enumerates experiment directories under a root and summarizes each from file presence alone.
 */
@Component
public class ExperimentScanner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentScanner.class);

    /**
     * List all experiments under {@code root}, newest id first.
     *
     * <p>Ids end in a zero-padded yyyyMMdd_HHmmss suffix for both naming conventions, so
     * descending lexical order is also reverse chronological order. Any I/O failure while
     * scanning aborts the whole listing.
     */
    public List<Experiment> listExperiments(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Experiments directory does not exist: {}", root.toAbsolutePath());
            return List.of();
        }

        List<Experiment> experiments = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (entry.getFileName().toString().startsWith(".")) {
                    continue;
                }
                // Throws for an entry that vanished or dangles, which fails the listing
                BasicFileAttributes attributes = Files.readAttributes(entry, BasicFileAttributes.class);
                if (!attributes.isDirectory()) {
                    continue;
                }
                experiments.add(describe(entry, listFileNames(entry)));
            }
        } catch (IOException e) {
            log.error("Failed to scan experiments directory {}: {}", root, e.getMessage());
            throw new ArtifactReadException("Failed to load experiments", e);
        }

        experiments.sort(Comparator.comparing(Experiment::getId).reversed());
        log.debug("Scanned {} experiments under {}", experiments.size(), root);
        return experiments;
    }

    /**
     * Build the summary of one experiment directory from its already listed entry names.
     */
    Experiment describe(Path experimentDir, SortedSet<String> fileNames) throws IOException {
        String id = experimentDir.getFileName().toString();

        SortedSet<String> jsonDocuments = new TreeSet<>();
        for (String fileName : fileNames) {
            if (ArtifactPaths.isJsonDocument(fileName)) {
                jsonDocuments.add(fileName);
            }
        }

        Instant modifiedAt = Files.getLastModifiedTime(experimentDir).toInstant();

        return Experiment.builder()
                .id(id)
                .kind(ExperimentKind.fromId(id))
                .hasStatistics(fileNames.contains(ArtifactPaths.STATISTICS))
                .hasCompleteContext(fileNames.contains(ArtifactPaths.FINAL_CONTEXT))
                .hasResultsBundle(fileNames.contains(ArtifactPaths.RESULTS))
                .artifactFileNames(jsonDocuments)
                .modifiedAt(modifiedAt)
                .build();
    }

    /**
     * Names of every entry (files and folders) directly inside {@code dir}, sorted.
     */
    static SortedSet<String> listFileNames(Path dir) throws IOException {
        SortedSet<String> names = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                names.add(entry.getFileName().toString());
            }
        }
        return names;
    }
}
