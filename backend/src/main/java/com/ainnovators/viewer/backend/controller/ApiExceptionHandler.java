package com.ainnovators.viewer.backend.controller;

import com.ainnovators.viewer.backend.dto.ErrorResponse;
import com.ainnovators.viewer.backend.exception.ArtifactNotFoundException;
import com.ainnovators.viewer.backend.exception.ArtifactReadException;
import com.ainnovators.viewer.backend.exception.InvalidArtifactPathException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps artifact errors to HTTP responses for all controllers.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ArtifactNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(InvalidArtifactPathException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPath(InvalidArtifactPathException e) {
        log.warn("Rejected path: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid path", e.getMessage());
    }

    @ExceptionHandler(ArtifactReadException.class)
    public ResponseEntity<ErrorResponse> handleReadFailure(ArtifactReadException e) {
        log.error("Artifact read failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load artifact", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .build());
    }
}
