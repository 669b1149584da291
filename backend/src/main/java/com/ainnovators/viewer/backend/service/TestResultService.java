package com.ainnovators.viewer.backend.service;

import com.ainnovators.viewer.backend.config.ViewerProperties;
import com.ainnovators.viewer.backend.dto.TestResultSummary;
import com.ainnovators.viewer.backend.exception.ArtifactReadException;
import com.ainnovators.viewer.backend.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads recorded agent and stage test runs from the test results directory.
 */
@Service
public class TestResultService {

    private static final Logger log = LoggerFactory.getLogger(TestResultService.class);

    // *_latest.json files duplicate the newest run of a test
    private static final String LATEST_MARKER = "latest";

    private final ViewerProperties properties;
    private final JsonDocumentReader documentReader;

    public TestResultService(ViewerProperties properties, JsonDocumentReader documentReader) {
        this.properties = properties;
        this.documentReader = documentReader;
    }

    /**
     * Summaries of all recorded runs, newest first. Files that fail to parse are skipped.
     */
    public List<TestResultSummary> listTestResults() {
        Path root = properties.testResultsRoot();
        if (!Files.isDirectory(root)) {
            log.warn("Test results directory does not exist: {}", root.toAbsolutePath());
            return List.of();
        }

        List<TestResultSummary> summaries = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, "*" + ArtifactPaths.JSON_SUFFIX)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                if (fileName.contains(LATEST_MARKER) || !Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    TestResult result = documentReader.read(file, TestResult.class);
                    summaries.add(toSummary(idOf(fileName), fileName, result));
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable test result {}: {}", fileName, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list test results in {}: {}", root, e.getMessage());
            throw new ArtifactReadException("Failed to load test results", e);
        }

        summaries.sort(Comparator.comparing(TestResultService::sortKey).reversed());
        return summaries;
    }

    /**
     * Full record of one test run.
     */
    public TestResult getTestResult(String id) {
        Path file = ArtifactPaths.resolveWithin(properties.testResultsRoot(), id + ArtifactPaths.JSON_SUFFIX,
                "test result id");
        TestResult result = documentReader.read(file, TestResult.class);
        result.setId(id);
        return result;
    }

    private static TestResultSummary toSummary(String id, String fileName, TestResult result) {
        return TestResultSummary.builder()
                .id(id)
                .filename(fileName)
                .stageName(result.getStageName())
                .testName(result.getTestName())
                .agentName(result.getAgentName())
                .testType(result.getTestType())
                .timestamp(result.getTimestamp() != null ? result.getTimestamp() : result.getTimestampStart())
                .executionTimeMs(result.getExecutionTimeMs())
                .success(result.getSuccess())
                .build();
    }

    private static String sortKey(TestResultSummary summary) {
        if (summary.getTimestamp() != null && !summary.getTimestamp().isEmpty()) {
            return summary.getTimestamp();
        }
        return summary.getId();
    }

    private static String idOf(String fileName) {
        return fileName.substring(0, fileName.length() - ArtifactPaths.JSON_SUFFIX.length());
    }
}
