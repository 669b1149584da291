package com.ainnovators.viewer.backend.model;

/**
 * Binary design image served from an experiment's designs folder.
 */
public record DesignAsset(String fileName, String contentType, byte[] content) {
}
