package com.project.lepidoptera.landmarks;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.service.OuterPixelDetector;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OuterPixelDetectorTest {
    private final OuterPixelDetector detector = new OuterPixelDetector();

    @Test
    void detectOuterPixel_matchesBruteForceScan() {
        Random rnd = new Random(12345);
        for (int trial = 0; trial < 20; trial++) {
            BinaryMask blob = randomBlob(rnd, 40, 30);
            Point center = new Point(rnd.nextInt(30), rnd.nextInt(40));

            Point expected = null;
            long best = -1;
            for (int r = 0; r < blob.height(); r++) {
                for (int c = 0; c < blob.width(); c++) {
                    if (!blob.get(r, c)) continue;
                    long d = (long) (r - center.row()) * (r - center.row())
                            + (long) (c - center.col()) * (c - center.col());
                    if (d > best) {
                        best = d;
                        expected = new Point(r, c);
                    }
                }
            }

            assertThat(detector.detectOuterPixel(blob, center)).as("trial %d", trial).isEqualTo(expected);
        }
    }

    @Test
    void detectOuterPixel_ignoresSmallerSpecks() {
        BinaryMask mask = SpecimenFixtures.parse(
                "#.........",
                "..........",
                "....####..",
                "....####..",
                "....####..");

        assertThat(detector.detectOuterPixel(mask, new Point(4, 7))).isEqualTo(new Point(2, 4));
    }

    @Test
    void detectOuterPixel_butterflyLeftHalf_findsTip() {
        BinaryMask left = SpecimenFixtures.butterfly().crop(0, 20, 0, 10);

        assertThat(detector.detectOuterPixel(left, new Point(9, 10))).isEqualTo(new Point(2, 3));
    }

    @Test
    void detectOuterPixel_emptyHalf_fails() {
        assertThatThrownBy(() -> detector.detectOuterPixel(BinaryMask.empty(5, 5), new Point(0, 0)))
                .isInstanceOf(NoRegionsFoundException.class);
    }

    /** A single 4-connected blob grown by a random walk. */
    private static BinaryMask randomBlob(Random rnd, int width, int height) {
        boolean[] cells = new boolean[width * height];
        int r = height / 2, c = width / 2;
        for (int step = 0; step < 300; step++) {
            cells[r * width + c] = true;
            switch (rnd.nextInt(4)) {
                case 0 -> r = Math.max(0, r - 1);
                case 1 -> r = Math.min(height - 1, r + 1);
                case 2 -> c = Math.max(0, c - 1);
                default -> c = Math.min(width - 1, c + 1);
            }
        }
        return BinaryMask.of(width, height, cells);
    }
}
