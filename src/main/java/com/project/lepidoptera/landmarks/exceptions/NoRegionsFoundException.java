package com.project.lepidoptera.landmarks.exceptions;

/** A detector that needs at least one connected region found none. */
public class NoRegionsFoundException extends LandmarkException {
    public NoRegionsFoundException(String message) { super(message); }
}
