package com.project.lepidoptera.landmarks.exceptions;

/**
 * Domain-specific exception for images the pipeline cannot measure.
 * Retrying with the same input gives the same failure, so callers route
 * these to manual review.
 */
public class LandmarkException extends RuntimeException {
    public LandmarkException(String message) { super(message); }
    public LandmarkException(String message, Throwable cause) { super(message, cause); }
}
