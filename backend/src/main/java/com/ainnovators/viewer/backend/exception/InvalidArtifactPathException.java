package com.ainnovators.viewer.backend.exception;

/**
 * A caller-supplied identifier would escape the artifact root. Raised before any filesystem access.
 */
public class InvalidArtifactPathException extends RuntimeException {

    public InvalidArtifactPathException(String message) {
        super(message);
    }
}
