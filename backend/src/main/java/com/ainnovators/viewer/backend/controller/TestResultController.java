package com.ainnovators.viewer.backend.controller;

import com.ainnovators.viewer.backend.dto.TestResultSummary;
import com.ainnovators.viewer.backend.model.TestResult;
import com.ainnovators.viewer.backend.service.TestResultService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tests")
@Tag(name = "Test Results", description = "Recorded agent and stage test runs")
public class TestResultController {

    private final TestResultService testResultService;

    public TestResultController(TestResultService testResultService) {
        this.testResultService = testResultService;
    }

    @GetMapping
    @Operation(summary = "List test results", description = "List recorded test runs, newest first")
    public ResponseEntity<List<TestResultSummary>> listTestResults() {
        return ResponseEntity.ok(testResultService.listTestResults());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get test result", description = "Get the full record of a test run")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Test result found"),
            @ApiResponse(responseCode = "400", description = "Invalid test result ID"),
            @ApiResponse(responseCode = "404", description = "Test result not found")
    })
    public ResponseEntity<TestResult> getTestResult(
            @Parameter(description = "Test result ID") @PathVariable String id) {

        return ResponseEntity.ok(testResultService.getTestResult(id));
    }
}
