package com.ainnovators.viewer.backend.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds experiment and test-result directories the way the pipeline lays them out on disk.
 */
public final class ExperimentFixtures {

    public static final String LEGACY_CONTEXT = """
            {
              "state": {
                "current_stage": "pitch",
                "completed_stages": ["idea_development", "prototyping", "pitch"],
                "idea": {"problem": "Manual invoice matching", "solution": "Auto-reconciliation"},
                "research": {"recommendation": "PIVOT", "reasoning": "first pass"},
                "research_final": {"recommendation": "GO", "reasoning": "refined"},
                "legal_insights": {"overall_risk_level": "LOW"},
                "prototype": {"directory": "prototype", "files_generated": 12},
                "architecture": {"system_name": "ReconcileAI"},
                "design": {"design_rationale": "minimal"},
                "final_designs": [{"screen_name": "Dashboard", "filepath": "designs/dashboard.png"}],
                "marketing_strategies": [{"channel": "LinkedIn"}],
                "pitch": {"title": "ReconcileAI", "tagline": "Books that close themselves", "slides": []},
                "decisions": [],
                "rejections": [],
                "iterations": 2,
                "conversations": [],
                "tool_calls": [],
                "start_time": "2024-01-02T10:00:00",
                "costs": {"total": 1.25, "by_stage": {"idea_development": 0.75}},
                "token_usage": {"total": 42000, "by_agent": {"ceo": 12000}}
              },
              "stage_contexts": {"idea_development": {}, "prototyping": {}, "pitch": {}},
              "history_length": 17
            }
            """;

    public static final String STRUCTURED_CONTEXT = """
            {
              "state": {
                "current_stage": "idea_development",
                "completed_stages": ["idea_development"],
                "stage_outputs": {
                  "idea_development": {
                    "idea": {"problem": "Structured problem"},
                    "final_validation": {"recommendation": "GO"}
                  }
                },
                "iterations": 1
              },
              "stage_contexts": {"idea_development": {"iteration": 1}},
              "history_length": 3
            }
            """;

    public static final String STATISTICS = """
            {
              "total_execution_time_ms": 93000,
              "total_calls": 14,
              "total_tokens": 42000,
              "total_prompt_tokens": 30000,
              "total_completion_tokens": 12000,
              "total_cost": 1.25,
              "max_budget": 10.0,
              "budget_used_percent": 12.5,
              "stages": {
                "idea_development": {
                  "execution_time_ms": 41000,
                  "total_calls": 6,
                  "total_tokens": 18000,
                  "total_cost": 0.75,
                  "agents": {
                    "researcher": {
                      "call_count": 3,
                      "execution_time_ms": 20000,
                      "prompt_tokens": 7000,
                      "completion_tokens": 2000,
                      "total_tokens": 9000,
                      "cost": 0.4
                    }
                  }
                }
              },
              "agents": {}
            }
            """;

    private ExperimentFixtures() {
    }

    public static Path experiment(Path root, String id) {
        try {
            return Files.createDirectories(root.resolve(id));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path write(Path dir, String fileName, String content) {
        try {
            Files.createDirectories(dir);
            return Files.writeString(dir.resolve(fileName), content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path writeBytes(Path dir, String fileName, byte[] content) {
        try {
            Files.createDirectories(dir);
            return Files.write(dir.resolve(fileName), content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String resultsBundle(String stage, String fullContext) {
        return """
                {
                  "stage": "%s",
                  "input": "An app for freelancers",
                  "success": true,
                  "experiment_dir": "experiments/stage_run_%s",
                  "stage_output": {"converged": true},
                  "full_context": %s
                }
                """.formatted(stage, stage, fullContext);
    }
}
