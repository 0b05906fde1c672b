package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.Region;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.Morphology;
import com.project.lepidoptera.landmarks.imaging.RegionAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Finds the vertical line separating the printed tags (right) from the
 * specimen (left). Tags are looked for in the top-right quadrant, above the ruler.
 */
@Service
public class TagEdgeFinder {
    private static final Logger log = LoggerFactory.getLogger(TagEdgeFinder.class);

    static final double TAG_AREA_START = 0.5;
    static final int MAX_TAG_REGIONS = 3;

    // Largest first; ties go to the region reaching furthest right, then to the earlier label.
    static final Comparator<Region> TAG_ORDER = Comparator.comparingInt(Region::area).reversed()
            .thenComparing(Comparator.comparingInt(Region::maxCol).reversed())
            .thenComparingInt(Region::label);

    /**
     * @param binary    first-pass binarization of the whole picture
     * @param topRuler  row of the ruler's top edge
     * @return column of the tag/specimen boundary in whole-picture coordinates
     */
    public int findTagsEdge(BinaryMask binary, int topRuler) {
        if (topRuler <= 0 || topRuler > binary.height()) {
            throw new IllegalArgumentException(
                    "top_ruler " + topRuler + " outside image of height " + binary.height());
        }
        int leftBound = (int) (binary.width() * TAG_AREA_START);
        BinaryMask focus = binary.crop(0, topRuler, leftBound, binary.width());

        BinaryMask prepared = Morphology.erode(Morphology.fillHoles(focus));
        List<Region> regions = RegionAnalyzer.label(prepared);
        if (regions.isEmpty()) {
            throw new NoRegionsFoundException("No tag regions found right of column " + leftBound
                    + " above row " + topRuler);
        }
        if (regions.size() < MAX_TAG_REGIONS) {
            log.warn("Ambiguous region ordering: expected {} tag regions, found {}", MAX_TAG_REGIONS, regions.size());
        }

        int minLeft = regions.stream()
                .sorted(TAG_ORDER)
                .limit(MAX_TAG_REGIONS)
                .mapToInt(Region::minCol)
                .min()
                .getAsInt();

        int edge = leftBound + minLeft;
        log.debug("Tag edge at column {} ({} candidate regions)", edge, regions.size());
        return edge;
    }
}
