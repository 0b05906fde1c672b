package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.Region;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.Morphology;
import com.project.lepidoptera.landmarks.imaging.RegionAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Cuts an antenna away from the wing where it touches it.
 * <p>
 * An antenna resting on the wing encloses a background pocket. Growing the
 * two largest background regions until they overlap marks the thin
 * foreground strip between them, which is then cleared.
 */
@Service
public class AntennaRemover {
    private static final Logger log = LoggerFactory.getLogger(AntennaRemover.class);

    static final int BRIDGE_DILATION = 35;

    private static final Comparator<Region> LARGEST_FIRST =
            Comparator.comparingInt(Region::area).reversed().thenComparingInt(Region::label);

    /**
     * @return the half-mask without the antenna bridge, or {@code halfMask}
     * itself when fewer than two background regions exist
     */
    public BinaryMask removeAntenna(BinaryMask halfMask) {
        List<Region> background = RegionAnalyzer.label(halfMask.invert());
        if (background.size() < 2) {
            log.debug("No enclosed background pocket, nothing to remove");
            return halfMask;
        }

        List<Region> largest = background.stream().sorted(LARGEST_FIRST).limit(2).toList();
        int w = halfMask.width(), h = halfMask.height();
        BinaryMask grownOuter = Morphology.dilate(largest.get(0).toMask(w, h), BRIDGE_DILATION);
        BinaryMask grownPocket = Morphology.dilate(largest.get(1).toMask(w, h), BRIDGE_DILATION);

        BinaryMask withoutAntenna = halfMask.andNot(grownOuter.and(grownPocket));
        log.debug("Cleared {} bridge pixels between background regions {} and {}",
                halfMask.count() - withoutAntenna.count(), largest.get(0).label(), largest.get(1).label());
        return withoutAntenna;
    }
}
