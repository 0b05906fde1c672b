package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.DTOs.Region;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RegionAnalyzer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Locates the shoulder, where the wing's leading edge meets the body.
 * <p>
 * The search window spans the upper three quarters of the half-mask, between
 * the wingtip column and the body side. Inside it, the background pocket above
 * the wing is taken to be the first background region in raster-scan order.
 * Its lowest row, at the end closest to the body, is the shoulder.
 */
@Service
public class InnerPixelDetector {

    static final double SEARCH_HEIGHT = 0.75;

    /**
     * @return shoulder relative to the search window; add
     * {@link #windowColumnOffset(Point, WingSide)} to get half-mask coordinates
     */
    public Point detectInnerPixel(BinaryMask halfMask, Point outerPixel, WingSide side) {
        int lowerBound = (int) (halfMask.height() * SEARCH_HEIGHT);
        BinaryMask focus = side == WingSide.LEFT
                ? halfMask.crop(0, lowerBound, outerPixel.col(), halfMask.width())
                : halfMask.crop(0, lowerBound, 0, outerPixel.col());

        // Assumes labels follow raster-scan order, which makes the region holding
        // the window's first background cell the pocket above the wing.
        List<Region> pockets = RegionAnalyzer.label(focus.invert());
        if (pockets.isEmpty()) {
            throw new NoRegionsFoundException("No background above the " + side.name().toLowerCase()
                    + " wing in a " + focus.width() + "x" + focus.height() + " search window");
        }
        Region top = pockets.get(0);

        Point inner = null;
        for (Point p : top.coordinates()) {
            if (p.row() != top.maxRow()) continue;
            if (inner == null
                    || (side == WingSide.LEFT && p.col() > inner.col())
                    || (side == WingSide.RIGHT && p.col() < inner.col())) {
                inner = p;
            }
        }
        return inner;
    }

    /** Column where the search window starts inside the half-mask. */
    public static int windowColumnOffset(Point outerPixel, WingSide side) {
        return side == WingSide.LEFT ? outerPixel.col() : 0;
    }
}
