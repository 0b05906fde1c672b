package com.project.lepidoptera.landmarks.imaging;

import java.util.Arrays;

/**
 * Immutable boolean grid, stored row-major. {@code true} marks foreground.
 * Every operation returns a fresh mask, so a mask can be handed to several
 * detectors (or threads) without copying.
 */
public final class BinaryMask {
    private final int width;
    private final int height;
    private final boolean[] data;

    private BinaryMask(int width, int height, boolean[] data) {
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public static BinaryMask of(int width, int height, boolean[] data) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative mask size " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new IllegalArgumentException(
                    "Mask data has " + data.length + " cells, expected " + width * height);
        }
        return new BinaryMask(width, height, Arrays.copyOf(data, data.length));
    }

    public static BinaryMask empty(int width, int height) {
        return of(width, height, new boolean[width * height]);
    }

    /** Places {@code right} next to {@code left}; both must have the same height. */
    public static BinaryMask concatColumns(BinaryMask left, BinaryMask right) {
        if (left.height != right.height) {
            throw new IllegalArgumentException(
                    "Cannot join masks of height " + left.height + " and " + right.height);
        }
        int w = left.width + right.width;
        boolean[] out = new boolean[w * left.height];
        for (int r = 0; r < left.height; r++) {
            System.arraycopy(left.data, r * left.width, out, r * w, left.width);
            System.arraycopy(right.data, r * right.width, out, r * w + left.width, right.width);
        }
        return new BinaryMask(w, left.height, out);
    }

    public int width() { return width; }

    public int height() { return height; }

    public boolean isEmpty() { return width == 0 || height == 0; }

    public boolean get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + width + "x" + height);
        }
        return data[row * width + col];
    }

    public int count() {
        int n = 0;
        for (boolean b : data) if (b) n++;
        return n;
    }

    /** Foreground cells per column. */
    public int[] columnCounts() {
        int[] counts = new int[width];
        for (int r = 0; r < height; r++) {
            int base = r * width;
            for (int c = 0; c < width; c++) {
                if (data[base + c]) counts[c]++;
            }
        }
        return counts;
    }

    /** Sub-grid of rows {@code [rowStart, rowEnd)} and columns {@code [colStart, colEnd)}. */
    public BinaryMask crop(int rowStart, int rowEnd, int colStart, int colEnd) {
        checkRange(rowStart, rowEnd, height, "row");
        checkRange(colStart, colEnd, width, "column");
        int w = colEnd - colStart, h = rowEnd - rowStart;
        boolean[] out = new boolean[w * h];
        for (int r = 0; r < h; r++) {
            System.arraycopy(data, (rowStart + r) * width + colStart, out, r * w, w);
        }
        return new BinaryMask(w, h, out);
    }

    public BinaryMask invert() {
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) out[i] = !data[i];
        return new BinaryMask(width, height, out);
    }

    public BinaryMask and(BinaryMask other) {
        checkSameShape(other);
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i] && other.data[i];
        return new BinaryMask(width, height, out);
    }

    /** Copy of this mask with every cell set in {@code cleared} turned to background. */
    public BinaryMask andNot(BinaryMask cleared) {
        checkSameShape(cleared);
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i] && !cleared.data[i];
        return new BinaryMask(width, height, out);
    }

    public boolean[] toArray() {
        return Arrays.copyOf(data, data.length);
    }

    // Package-level access for the imaging algorithms; callers must not modify the array.
    boolean[] raw() {
        return data;
    }

    static BinaryMask wrap(int width, int height, boolean[] data) {
        return new BinaryMask(width, height, data);
    }

    private void checkSameShape(BinaryMask other) {
        if (other.width != width || other.height != height) {
            throw new IllegalArgumentException("Mask shapes differ: " + width + "x" + height
                    + " vs " + other.width + "x" + other.height);
        }
    }

    private static void checkRange(int start, int end, int size, String axis) {
        if (start < 0 || end > size || start > end) {
            throw new IllegalArgumentException(
                    "Invalid " + axis + " range [" + start + ", " + end + ") for size " + size);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryMask other)) return false;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "BinaryMask[" + width + "x" + height + ", foreground=" + count() + "]";
    }
}
