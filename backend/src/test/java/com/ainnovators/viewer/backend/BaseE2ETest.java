package com.ainnovators.viewer.backend;

import com.ainnovators.viewer.backend.support.ExperimentFixtures;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for E2E tests, backed by artifact directories under a temporary folder.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class BaseE2ETest {

    protected static final Path ARTIFACTS = createArtifactsDir();
    protected static final Path EXPERIMENTS = ARTIFACTS.resolve("experiments");
    protected static final Path TEST_RESULTS = ARTIFACTS.resolve("test_results");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("viewer.experiments-dir", EXPERIMENTS::toString);
        registry.add("viewer.test-results-dir", TEST_RESULTS::toString);
    }

    protected static Path experiment(String id) {
        return ExperimentFixtures.experiment(EXPERIMENTS, id);
    }

    private static Path createArtifactsDir() {
        try {
            Path dir = Files.createTempDirectory("experiment-viewer-e2e");
            Files.createDirectories(dir.resolve("experiments"));
            Files.createDirectories(dir.resolve("test_results"));
            // Shared by every cached context, so it outlives any single test class
            Runtime.getRuntime().addShutdownHook(new Thread(() -> FileSystemUtils.deleteRecursively(dir.toFile())));
            return dir;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
