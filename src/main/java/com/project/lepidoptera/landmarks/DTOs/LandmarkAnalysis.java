package com.project.lepidoptera.landmarks.DTOs;

import com.project.lepidoptera.landmarks.imaging.BinaryMask;

/** Silhouette of one picture together with the landmarks found on it. */
public record LandmarkAnalysis(BinaryMask silhouette, LandmarksResult landmarks) {

    public int midline() {
        return landmarks.bodyCenter().col();
    }
}
