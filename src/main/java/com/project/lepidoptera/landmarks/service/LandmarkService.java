package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.LandmarksResult;
import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.render.OverlaySurfaces;
import com.project.lepidoptera.landmarks.render.RenderingSurface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;

/**
 * Finds the two wingtips, the two shoulders and the body centre on a
 * silhouette. Each wing half is processed in its own frame and the results
 * are translated back to silhouette coordinates.
 */
@Service
public class LandmarkService {
    private static final Logger log = LoggerFactory.getLogger(LandmarkService.class);

    static final int LANDMARK_PANEL = 2;
    static final int COMPACT_MARKERS_PANEL = 3;
    static final int MARKER_SIZE = 10;
    static final int COMPACT_MARKER_SIZE = 2;
    private static final Color MIDLINE_COLOR = Color.MAGENTA;
    private static final Color LANDMARK_COLOR = Color.RED;

    private final BodySplitter bodySplitter;
    private final AntennaRemover antennaRemover;
    private final OuterPixelDetector outerPixelDetector;
    private final InnerPixelDetector innerPixelDetector;

    public LandmarkService(BodySplitter bodySplitter,
                           AntennaRemover antennaRemover,
                           OuterPixelDetector outerPixelDetector,
                           InnerPixelDetector innerPixelDetector) {
        this.bodySplitter = bodySplitter;
        this.antennaRemover = antennaRemover;
        this.outerPixelDetector = outerPixelDetector;
        this.innerPixelDetector = innerPixelDetector;
    }

    public LandmarksResult locate(BinaryMask silhouette) {
        return locate(silhouette, OverlaySurfaces.none());
    }

    public LandmarksResult locate(BinaryMask silhouette, OverlaySurfaces surfaces) {
        log.debug("Locating landmarks on {}", silhouette);
        int w = silhouette.width(), h = silhouette.height();

        int middle = bodySplitter.findMidline(silhouette);
        BinaryMask binaryLeft = silhouette.crop(0, h, 0, middle);
        BinaryMask binaryRight = silhouette.crop(0, h, middle, w);
        Point bodyCenter = new Point(midlineCentroidRow(silhouette, middle), middle);
        log.debug("Midline at column {}, body centre {}", middle, bodyCenter);

        BinaryMask withoutAntennaL = antennaRemover.removeAntenna(binaryLeft);
        Point outerPixL = outerPixelDetector.detectOuterPixel(withoutAntennaL, bodyCenter);
        Point innerPixL = innerPixelDetector.detectInnerPixel(withoutAntennaL, outerPixL, WingSide.LEFT)
                .translate(0, InnerPixelDetector.windowColumnOffset(outerPixL, WingSide.LEFT));

        // The right half starts at the midline, so the body centre sits on its column 0.
        Point bodyCenterR = new Point(bodyCenter.row(), 0);
        BinaryMask withoutAntennaR = antennaRemover.removeAntenna(binaryRight);
        Point outerPixR = outerPixelDetector.detectOuterPixel(withoutAntennaR, bodyCenterR);
        Point innerPixR = innerPixelDetector.detectInnerPixel(withoutAntennaR, outerPixR, WingSide.RIGHT)
                .translate(0, InnerPixelDetector.windowColumnOffset(outerPixR, WingSide.RIGHT) + middle);
        outerPixR = outerPixR.translate(0, middle);

        LandmarksResult result = new LandmarksResult(outerPixL, innerPixL, outerPixR, innerPixR, bodyCenter);
        log.info("Landmarks found: {}", result);

        surfaces.get(LANDMARK_PANEL).ifPresent(panel -> draw(panel, surfaces,
                BinaryMask.concatColumns(withoutAntennaL, withoutAntennaR), middle, result));
        return result;
    }

    private static int midlineCentroidRow(BinaryMask silhouette, int middle) {
        if (middle >= silhouette.width()) {
            throw new NoRegionsFoundException("Midline column " + middle + " lies outside the silhouette");
        }
        long sum = 0;
        int n = 0;
        for (int r = 0; r < silhouette.height(); r++) {
            if (silhouette.get(r, middle)) {
                sum += r;
                n++;
            }
        }
        if (n == 0) {
            throw new NoRegionsFoundException("Midline column " + middle + " has no body pixels");
        }
        return (int) ((double) sum / n);
    }

    private static void draw(RenderingSurface panel, OverlaySurfaces surfaces,
                             BinaryMask withoutAntennae, int middle, LandmarksResult result) {
        panel.setTitle("Points of interest");
        panel.showMask(withoutAntennae);
        panel.drawVerticalLine(middle, MIDLINE_COLOR, true);
        int markerSize = surfaces.get(COMPACT_MARKERS_PANEL).isPresent() ? COMPACT_MARKER_SIZE : MARKER_SIZE;
        panel.scatter(result.points(), LANDMARK_COLOR, markerSize);
    }
}
