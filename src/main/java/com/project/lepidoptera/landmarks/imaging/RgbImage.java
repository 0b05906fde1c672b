package com.project.lepidoptera.landmarks.imaging;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable three-channel image. Channel values keep whatever scale the
 * source used (0..255 for decoded 8-bit images, 0..1 for normalized data).
 */
public final class RgbImage {
    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;

    private final int width;
    private final int height;
    private final double[][] channels;

    private RgbImage(int width, int height, double[][] channels) {
        this.width = width;
        this.height = height;
        this.channels = channels;
    }

    public static RgbImage of(int width, int height, double[] red, double[] green, double[] blue) {
        int n = width * height;
        if (red.length != n || green.length != n || blue.length != n) {
            throw new IllegalArgumentException("Channel length does not match " + width + "x" + height);
        }
        return new RgbImage(width, height, new double[][]{
                Arrays.copyOf(red, n), Arrays.copyOf(green, n), Arrays.copyOf(blue, n)
        });
    }

    public static RgbImage fromBufferedImage(BufferedImage input) {
        final int w = input.getWidth(), h = input.getHeight(), n = w * h;
        int[] argb = new int[n];
        input.getRGB(0, 0, w, h, argb, 0, w);

        double[] r = new double[n], g = new double[n], b = new double[n];
        for (int i = 0; i < n; i++) {
            int p = argb[i];
            r[i] = (p >> 16) & 0xFF;
            g[i] = (p >> 8) & 0xFF;
            b[i] = p & 0xFF;
        }
        return new RgbImage(w, h, new double[][]{r, g, b});
    }

    public int width() { return width; }

    public int height() { return height; }

    public double[] channel(int index) {
        return Arrays.copyOf(channels[index], channels[index].length);
    }

    /** Rows {@code [rowStart, rowEnd)}, columns {@code [colStart, colEnd)}. */
    public RgbImage crop(int rowStart, int rowEnd, int colStart, int colEnd) {
        if (rowStart < 0 || rowEnd > height || rowStart > rowEnd
                || colStart < 0 || colEnd > width || colStart > colEnd) {
            throw new IllegalArgumentException("Crop [" + rowStart + ", " + rowEnd + ") x ["
                    + colStart + ", " + colEnd + ") outside " + width + "x" + height);
        }
        int w = colEnd - colStart, h = rowEnd - rowStart;
        double[][] out = new double[3][w * h];
        for (int ch = 0; ch < 3; ch++) {
            for (int r = 0; r < h; r++) {
                System.arraycopy(channels[ch], (rowStart + r) * width + colStart, out[ch], r * w, w);
            }
        }
        return new RgbImage(w, h, out);
    }

    /**
     * Saturation channel of the HSV representation: {@code (max - min) / max}
     * per pixel, 0 for black pixels.
     */
    public double[] saturation() {
        double[] r = channels[RED], g = channels[GREEN], b = channels[BLUE];
        double[] s = new double[r.length];
        for (int i = 0; i < s.length; i++) {
            double max = Math.max(r[i], Math.max(g[i], b[i]));
            double min = Math.min(r[i], Math.min(g[i], b[i]));
            s[i] = max == 0 ? 0 : (max - min) / max;
        }
        return s;
    }
}
