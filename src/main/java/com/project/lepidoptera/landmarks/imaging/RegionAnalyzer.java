package com.project.lepidoptera.landmarks.imaging;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.DTOs.Region;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Labels 4-connected foreground components.
 * <p>
 * Labels are handed out in raster-scan order of each component's first
 * cell, starting at 1, and the returned list follows label order. Several
 * detectors rely on that ordering, so it is part of the contract.
 */
public final class RegionAnalyzer {
    private static final int[][] DIRS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    private RegionAnalyzer() {}

    public static List<Region> label(BinaryMask mask) {
        final int w = mask.width(), h = mask.height();
        boolean[] fg = mask.raw();
        int[] labels = new int[w * h];
        ArrayDeque<int[]> q = new ArrayDeque<>();
        int nextLabel = 1;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!fg[idx] || labels[idx] != 0) continue;
                floodFill(fg, labels, q, y, x, w, h, nextLabel);
                nextLabel++;
            }
        }

        int count = nextLabel - 1;
        List<List<Point>> coords = new ArrayList<>(count);
        int[][] bbox = new int[count][];
        for (int i = 0; i < count; i++) {
            coords.add(new ArrayList<>());
            bbox[i] = new int[]{Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1};
        }
        // Second raster pass keeps each coordinate list in row-major order.
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int lab = labels[y * w + x];
                if (lab == 0) continue;
                coords.get(lab - 1).add(new Point(y, x));
                int[] b = bbox[lab - 1];
                b[0] = Math.min(b[0], y);
                b[1] = Math.min(b[1], x);
                b[2] = Math.max(b[2], y);
                b[3] = Math.max(b[3], x);
            }
        }

        List<Region> regions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int[] b = bbox[i];
            List<Point> c = coords.get(i);
            regions.add(new Region(i + 1, c.size(), b[0], b[1], b[2], b[3], c));
        }
        return regions;
    }

    private static void floodFill(boolean[] fg, int[] labels, ArrayDeque<int[]> q,
                                  int startY, int startX, int w, int h, int label) {
        q.clear();
        q.add(new int[]{startY, startX});
        labels[startY * w + startX] = label;

        while (!q.isEmpty()) {
            int[] p = q.removeFirst();
            for (int[] dir : DIRS) {
                int ny = p[0] + dir[0];
                int nx = p[1] + dir[1];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (fg[nIdx] && labels[nIdx] == 0) {
                        labels[nIdx] = label;
                        q.add(new int[]{ny, nx});
                    }
                }
            }
        }
    }
}
