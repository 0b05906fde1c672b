package com.project.lepidoptera.landmarks.imaging;

import com.project.lepidoptera.landmarks.exceptions.ThresholdingFailedException;

/**
 * Histogram-based helpers over flat intensity arrays: Otsu thresholding,
 * range rescaling and binarization.
 */
public final class Intensity {
    public static final int DEFAULT_BINS = 256;

    private Intensity() {}

    /**
     * Otsu threshold over an {@code nbins}-bin histogram spanning the value range.
     * Returns the centre of the bin that maximises the between-class variance.
     *
     * @throws ThresholdingFailedException if the input is empty or constant
     */
    public static double otsu(double[] values, int nbins) {
        if (nbins < 2) {
            throw new IllegalArgumentException("Otsu needs at least 2 bins, got " + nbins);
        }
        if (values.length == 0) {
            throw new ThresholdingFailedException("Cannot threshold an empty region");
        }
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min == max) {
            throw new ThresholdingFailedException(
                    "Intensity is constant (" + min + "), no bimodal split exists");
        }

        long[] counts = new long[nbins];
        double span = max - min;
        for (double v : values) {
            int bin = (int) ((v - min) / span * nbins);
            counts[Math.min(bin, nbins - 1)]++;
        }
        double binWidth = span / nbins;
        double[] centers = new double[nbins];
        for (int i = 0; i < nbins; i++) centers[i] = min + binWidth * (i + 0.5);

        // Lower class = bins [0, t], upper class = bins (t, nbins).
        double[] weightLow = new double[nbins], meanLow = new double[nbins];
        double w = 0, s = 0;
        for (int i = 0; i < nbins; i++) {
            w += counts[i];
            s += counts[i] * centers[i];
            weightLow[i] = w;
            meanLow[i] = w == 0 ? 0 : s / w;
        }
        double[] weightHigh = new double[nbins], meanHigh = new double[nbins];
        w = 0;
        s = 0;
        for (int i = nbins - 1; i >= 0; i--) {
            w += counts[i];
            s += counts[i] * centers[i];
            weightHigh[i] = w;
            meanHigh[i] = w == 0 ? 0 : s / w;
        }

        int best = 0;
        double maxBetween = -1.0;
        for (int t = 0; t < nbins - 1; t++) {
            double d = meanLow[t] - meanHigh[t + 1];
            double between = weightLow[t] * weightHigh[t + 1] * d * d;
            if (between > maxBetween) {
                maxBetween = between;
                best = t;
            }
        }
        return centers[best];
    }

    /**
     * Linearly maps the value range onto {@code [outMin, outMax]}.
     *
     * @throws ThresholdingFailedException if the input is constant, since nothing is left to threshold
     */
    public static double[] rescale(double[] values, double outMin, double outMax) {
        if (values.length == 0) {
            throw new ThresholdingFailedException("Cannot rescale an empty region");
        }
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min == max) {
            throw new ThresholdingFailedException(
                    "Intensity is constant (" + min + "), cannot stretch its range");
        }
        double scale = (outMax - outMin) / (max - min);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = outMin + (values[i] - min) * scale;
        }
        return out;
    }

    /** Foreground where {@code value > threshold}. */
    public static BinaryMask above(double[] values, int width, int height, double threshold) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " values, got " + values.length);
        }
        boolean[] out = new boolean[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i] > threshold;
        return BinaryMask.wrap(width, height, out);
    }
}
