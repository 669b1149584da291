package com.ainnovators.viewer.backend.exception;

/**
 * An experiment directory, test result, or expected artifact file does not exist.
 */
public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String message) {
        super(message);
    }
}
