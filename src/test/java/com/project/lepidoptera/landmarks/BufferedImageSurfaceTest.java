package com.project.lepidoptera.landmarks;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.render.BufferedImageSurface;
import com.project.lepidoptera.landmarks.render.OverlaySurfaces;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.List;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferedImageSurfaceTest {

    @Test
    void showMask_paintsForegroundOnBlack() {
        BufferedImageSurface surface = new BufferedImageSurface(1, 1);
        surface.showMask(SpecimenFixtures.parse("#..", "..."));

        BufferedImage img = surface.image();
        assertThat(img.getWidth()).isEqualTo(3);
        assertThat(img.getHeight()).isEqualTo(2);
        assertThat(img.getRGB(0, 0)).isNotEqualTo(img.getRGB(1, 0));
        assertThat(img.getRGB(1, 0) & 0xFFFFFF).isZero();
    }

    @Test
    void drawVerticalLine_solid_coversColumn() {
        BufferedImageSurface surface = new BufferedImageSurface(5, 6);
        surface.drawVerticalLine(2, Color.MAGENTA, false);

        for (int y = 0; y < 6; y++) {
            assertThat(surface.image().getRGB(2, y)).isEqualTo(Color.MAGENTA.getRGB());
        }
        assertThat(surface.image().getRGB(1, 0)).isNotEqualTo(Color.MAGENTA.getRGB());
    }

    @Test
    void scatter_marksPoints_andPngDecodes() throws Exception {
        BufferedImageSurface surface = new BufferedImageSurface(30, 30);
        surface.setTitle("Points of interest");
        surface.scatter(List.of(new Point(15, 15)), Color.RED, 10);

        assertThat(surface.title()).isEqualTo("Points of interest");
        assertThat(surface.image().getRGB(15, 15)).isEqualTo(Color.RED.getRGB());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(surface.toPng()));
        assertThat(decoded.getWidth()).isEqualTo(30);
    }

    @Test
    void overlaySurfaces_slotsAreOptional() {
        BufferedImageSurface surface = new BufferedImageSurface(2, 2);
        OverlaySurfaces surfaces = OverlaySurfaces.of(null, surface);

        assertThat(surfaces.get(0)).isEmpty();
        assertThat(surfaces.get(1)).containsSame(surface);
        assertThat(surfaces.get(3)).isEmpty();
        assertThat(surfaces.isEmpty()).isFalse();
        assertThat(OverlaySurfaces.of(null, null).isEmpty()).isTrue();
        assertThat(OverlaySurfaces.none().isEmpty()).isTrue();
    }

    @Test
    void overlaySurfaces_atMostFour() {
        BufferedImageSurface s = new BufferedImageSurface(1, 1);
        assertThatThrownBy(() -> OverlaySurfaces.of(s, s, s, s, s))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
