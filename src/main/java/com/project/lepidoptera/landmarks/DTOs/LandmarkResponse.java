package com.project.lepidoptera.landmarks.DTOs;

import java.util.Map;

public record LandmarkResponse(
        int width,        // silhouette width, i.e. the tag edge column
        int height,       // silhouette height, i.e. top_ruler
        int midline,
        Map<String, int[]> landmarks
) {
    public static LandmarkResponse from(LandmarkAnalysis analysis) {
        return new LandmarkResponse(
                analysis.silhouette().width(),
                analysis.silhouette().height(),
                analysis.midline(),
                analysis.landmarks().asMap()
        );
    }
}
