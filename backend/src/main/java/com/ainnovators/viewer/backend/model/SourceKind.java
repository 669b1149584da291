package com.ainnovators.viewer.backend.model;

/**
 * Which artifact an experiment's context was resolved from, highest precedence first.
 */
public enum SourceKind {
    FINAL_CONTEXT, // context_final.json
    RESULTS_BUNDLE, // full_context embedded in results.json
    PARTIAL_CONTEXT // first context_<stage>.json snapshot
}
