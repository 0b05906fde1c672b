package com.project.lepidoptera.landmarks.render;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;

import java.awt.Color;
import java.util.List;

/**
 * Write-only drawing target for diagnostic overlays. Nothing drawn here is
 * ever read back by the pipeline.
 */
public interface RenderingSurface {

    void setTitle(String title);

    /** Replaces the surface content with the mask. */
    void showMask(BinaryMask mask);

    void drawVerticalLine(int col, Color color, boolean dashed);

    void scatter(List<Point> points, Color color, int markerSize);
}
