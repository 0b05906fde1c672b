package com.project.lepidoptera.landmarks.imaging;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Binary morphology with the 4-connected cross as structuring element.
 */
public final class Morphology {
    private static final int[][] DIRS = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};

    private Morphology() {}

    /** Background not 4-connected to the border becomes foreground. */
    public static BinaryMask fillHoles(BinaryMask mask) {
        final int w = mask.width(), h = mask.height(), n = w * h;
        boolean[] src = mask.raw();
        boolean[] outside = new boolean[n];
        ArrayDeque<int[]> q = new ArrayDeque<>();

        for (int x = 0; x < w; x++) {
            seedOutside(src, outside, q, 0, x, w);
            seedOutside(src, outside, q, h - 1, x, w);
        }
        for (int y = 1; y < h - 1; y++) {
            seedOutside(src, outside, q, y, 0, w);
            seedOutside(src, outside, q, y, w - 1, w);
        }

        while (!q.isEmpty()) {
            int[] p = q.removeFirst();
            for (int[] dir : DIRS) {
                int ny = p[0] + dir[0];
                int nx = p[1] + dir[1];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (!src[nIdx] && !outside[nIdx]) {
                        outside[nIdx] = true;
                        q.add(new int[]{ny, nx});
                    }
                }
            }
        }

        boolean[] out = Arrays.copyOf(src, n);
        for (int i = 0; i < n; i++) {
            if (!src[i] && !outside[i]) out[i] = true;
        }
        return BinaryMask.wrap(w, h, out);
    }

    private static void seedOutside(boolean[] src, boolean[] outside, ArrayDeque<int[]> q, int y, int x, int w) {
        int idx = y * w + x;
        if (!src[idx] && !outside[idx]) {
            outside[idx] = true;
            q.add(new int[]{y, x});
        }
    }

    /**
     * Single erosion pass. Cells beyond the grid count as foreground, so
     * shapes touching the border are not eaten from that side.
     */
    public static BinaryMask erode(BinaryMask mask) {
        final int w = mask.width(), h = mask.height();
        boolean[] src = mask.raw();
        boolean[] dst = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!src[idx]) continue;

                boolean keep = true;
                for (int[] dir : DIRS) {
                    int yy = y + dir[0];
                    int xx = x + dir[1];
                    if (yy >= 0 && yy < h && xx >= 0 && xx < w && !src[yy * w + xx]) {
                        keep = false;
                        break;
                    }
                }
                dst[idx] = keep;
            }
        }
        return BinaryMask.wrap(w, h, dst);
    }

    /**
     * {@code iterations} dilation passes, i.e. every cell within Manhattan
     * distance {@code iterations} of the foreground. Cells beyond the grid
     * count as background.
     */
    public static BinaryMask dilate(BinaryMask mask, int iterations) {
        final int w = mask.width(), h = mask.height(), n = w * h;
        boolean[] src = mask.raw();
        int[] dist = new int[n];
        Arrays.fill(dist, -1);
        ArrayDeque<int[]> q = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (src[i]) {
                dist[i] = 0;
                q.add(new int[]{i / w, i % w});
            }
        }

        while (!q.isEmpty()) {
            int[] p = q.removeFirst();
            int d = dist[p[0] * w + p[1]];
            if (d == iterations) continue;
            for (int[] dir : DIRS) {
                int ny = p[0] + dir[0];
                int nx = p[1] + dir[1];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (dist[nIdx] < 0) {
                        dist[nIdx] = d + 1;
                        q.add(new int[]{ny, nx});
                    }
                }
            }
        }

        boolean[] out = new boolean[n];
        for (int i = 0; i < n; i++) out[i] = dist[i] >= 0;
        return BinaryMask.wrap(w, h, out);
    }
}
