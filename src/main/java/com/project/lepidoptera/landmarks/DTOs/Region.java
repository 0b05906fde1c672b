package com.project.lepidoptera.landmarks.DTOs;

import com.project.lepidoptera.landmarks.imaging.BinaryMask;

import java.util.List;

/**
 * One 4-connected component. Bounding box bounds are inclusive and
 * {@code coordinates} are listed in row-major order.
 */
public record Region(
        int label,
        int area,
        int minRow,
        int minCol,
        int maxRow,
        int maxCol,
        List<Point> coordinates
) {
    public Region {
        coordinates = List.copyOf(coordinates);
    }

    /** The region painted on an otherwise empty mask of the given size. */
    public BinaryMask toMask(int width, int height) {
        boolean[] cells = new boolean[width * height];
        for (Point p : coordinates) cells[p.row() * width + p.col()] = true;
        return BinaryMask.of(width, height, cells);
    }
}
