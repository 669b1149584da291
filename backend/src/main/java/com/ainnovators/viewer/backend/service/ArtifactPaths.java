package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.exception.InvalidArtifactPathException;

import java.nio.file.Path;

/**
 * File naming conventions of an experiment directory, and the guard applied to every
 * caller-supplied path segment.
 */
public final class ArtifactPaths {

    public static final String FINAL_CONTEXT = "context_final.json";
    public static final String RESULTS = "results.json";
    public static final String STATISTICS = "statistics.json";
    public static final String CONTEXT_PREFIX = "context_";
    public static final String JSON_SUFFIX = ".json";
    public static final String DESIGNS_DIR = "designs";

    private ArtifactPaths() {
    }

    /**
     * Reject a segment that could address anything outside its parent directory.
     * Pure string check, so it runs before the filesystem is touched.
     */
    public static String requireSafeSegment(String segment, String what) {
        if (segment == null || segment.isBlank()) {
            throw new InvalidArtifactPathException("Missing " + what);
        }
        if (segment.contains("..") || segment.indexOf('/') >= 0 || segment.indexOf('\\') >= 0
                || segment.indexOf('\0') >= 0) {
            throw new InvalidArtifactPathException("Invalid " + what + ": " + segment);
        }
        return segment;
    }

    /**
     * Resolve a guarded segment under {@code parent}, re-checking containment after normalization.
     */
    public static Path resolveWithin(Path parent, String segment, String what) {
        requireSafeSegment(segment, what);
        Path base = parent.toAbsolutePath().normalize();
        Path resolved = base.resolve(segment).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new InvalidArtifactPathException("Invalid " + what + ": " + segment);
        }
        return resolved;
    }

    public static boolean isJsonDocument(String fileName) {
        return fileName.endsWith(JSON_SUFFIX);
    }

    public static boolean isStageContext(String fileName) {
        return fileName.startsWith(CONTEXT_PREFIX) && isJsonDocument(fileName);
    }

    public static String stageContextFile(String stage) {
        return CONTEXT_PREFIX + stage + JSON_SUFFIX;
    }
}
