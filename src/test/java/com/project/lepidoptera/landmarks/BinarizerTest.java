package com.project.lepidoptera.landmarks;

import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.exceptions.ThresholdingFailedException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RgbImage;
import com.project.lepidoptera.landmarks.service.Binarizer;
import com.project.lepidoptera.landmarks.service.TagEdgeFinder;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinarizerTest {
    private final Binarizer binarizer = new Binarizer(new TagEdgeFinder());

    @Test
    void binarize_cropsTagsAndRulerAndKeepsSpecimen() {
        RgbImage image = RgbImage.fromBufferedImage(SpecimenFixtures.specimenPicture());

        BinaryMask silhouette = binarizer.binarize(image, SpecimenFixtures.TOP_RULER);

        // Tag starts at column 90; erosion moves the detected edge one column right.
        assertThat(silhouette.width()).isEqualTo(91);
        assertThat(silhouette.height()).isEqualTo(SpecimenFixtures.TOP_RULER);
        for (int r = 0; r < silhouette.height(); r++) {
            for (int c = 0; c < silhouette.width(); c++) {
                assertThat(silhouette.get(r, c))
                        .as("pixel (%d, %d)", r, c)
                        .isEqualTo(SpecimenFixtures.isSpecimenPixel(r, c));
            }
        }
    }

    @Test
    void binarize_isPure() {
        RgbImage image = RgbImage.fromBufferedImage(SpecimenFixtures.specimenPicture());

        assertThat(binarizer.binarize(image, 80)).isEqualTo(binarizer.binarize(image, 80));
    }

    @Test
    void binarize_uniformPicture_failsThresholding() {
        BufferedImage img = new BufferedImage(50, 40, BufferedImage.TYPE_INT_RGB);

        assertThatThrownBy(() -> binarizer.binarize(RgbImage.fromBufferedImage(img), 30))
                .isInstanceOf(ThresholdingFailedException.class);
    }

    @Test
    void binarize_withoutTags_reportsMissingRegions() {
        BufferedImage img = new BufferedImage(60, 50, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.GRAY);
        g.fillRect(0, 40, 60, 10);
        g.setColor(SpecimenFixtures.SPECIMEN_COLOR);
        g.fillRect(10, 10, 20, 15);
        g.dispose();

        assertThatThrownBy(() -> binarizer.binarize(RgbImage.fromBufferedImage(img), 40))
                .isInstanceOf(NoRegionsFoundException.class);
    }
}
