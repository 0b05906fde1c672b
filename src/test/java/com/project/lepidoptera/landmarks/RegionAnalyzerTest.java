package com.project.lepidoptera.landmarks;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.DTOs.Region;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RegionAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegionAnalyzerTest {

    @Test
    void label_emptyMask_returnsNoRegions() {
        assertThat(RegionAnalyzer.label(BinaryMask.empty(5, 4))).isEmpty();
        assertThat(RegionAnalyzer.label(BinaryMask.empty(0, 0))).isEmpty();
    }

    @Test
    void label_diagonalNeighbours_areSeparateRegions() {
        BinaryMask mask = SpecimenFixtures.parse(
                "#.",
                ".#");

        List<Region> regions = RegionAnalyzer.label(mask);

        assertThat(regions).hasSize(2);
        assertThat(regions).extracting(Region::area).containsExactly(1, 1);
    }

    @Test
    void label_numbersRegionsInRasterOrder() {
        BinaryMask mask = SpecimenFixtures.parse(
                "....##",
                "##..##",
                "##....",
                "...#..");

        List<Region> regions = RegionAnalyzer.label(mask);

        assertThat(regions).extracting(Region::label).containsExactly(1, 2, 3);
        assertThat(regions.get(0).minCol()).isEqualTo(4);
        assertThat(regions.get(1).minCol()).isZero();
        assertThat(regions.get(2).coordinates()).containsExactly(new Point(3, 3));
    }

    @Test
    void label_reportsInclusiveBoundingBoxAndRowMajorCoordinates() {
        BinaryMask mask = SpecimenFixtures.parse(
                "......",
                "..#...",
                ".###..",
                "..#.#.",
                "..###.");

        Region region = RegionAnalyzer.label(mask).get(0);

        assertThat(region.area()).isEqualTo(9);
        assertThat(new int[]{region.minRow(), region.minCol(), region.maxRow(), region.maxCol()})
                .containsExactly(1, 1, 4, 4);
        assertThat(region.coordinates()).containsExactly(
                new Point(1, 2),
                new Point(2, 1), new Point(2, 2), new Point(2, 3),
                new Point(3, 2), new Point(3, 4),
                new Point(4, 2), new Point(4, 3), new Point(4, 4));
    }

    @Test
    void toMask_paintsOnlyTheRegion() {
        BinaryMask mask = SpecimenFixtures.parse(
                "##..",
                "...#");

        Region second = RegionAnalyzer.label(mask).get(1);

        assertThat(second.toMask(4, 2)).isEqualTo(SpecimenFixtures.parse(
                "....",
                "...#"));
    }
}
