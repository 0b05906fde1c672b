package com.project.lepidoptera.landmarks.exceptions;

/** Otsu thresholding found no split, e.g. a region of constant intensity. */
public class ThresholdingFailedException extends LandmarkException {
    public ThresholdingFailedException(String message) { super(message); }
}
