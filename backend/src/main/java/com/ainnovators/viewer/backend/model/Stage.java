package com.ainnovators.viewer.backend.model;

/**
 * The three fixed pipeline stages, keyed by their name in {@code stage_outputs}.
 */
public enum Stage {
    IDEA_DEVELOPMENT("idea_development"),
    PROTOTYPING("prototyping"),
    PITCH("pitch");

    private final String key;

    Stage(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
