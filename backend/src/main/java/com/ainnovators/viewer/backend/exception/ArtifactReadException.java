package com.ainnovators.viewer.backend.exception;

/**
 * An artifact could not be listed, read, or parsed. Never retried.
 */
public class ArtifactReadException extends RuntimeException {

    public ArtifactReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
