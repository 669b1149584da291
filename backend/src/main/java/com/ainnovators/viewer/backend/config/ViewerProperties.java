package com.ainnovators.viewer.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Locations of the artifact stores the viewer reads from.
 */
@Data
@ConfigurationProperties(prefix = "viewer")
public class ViewerProperties {

    // One subdirectory per experiment
    private String experimentsDir = "../experiments";

    // Flat <id>.json test records
    private String testResultsDir = "../test_results";

    // Cache-Control max-age for design images
    private Duration assetCacheMaxAge = Duration.ofHours(1);

    public Path experimentsRoot() {
        return Path.of(experimentsDir);
    }

    public Path testResultsRoot() {
        return Path.of(testResultsDir);
    }
}
