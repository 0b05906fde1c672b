package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.Intensity;
import com.project.lepidoptera.landmarks.imaging.RgbImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces the specimen silhouette: a coarse threshold locates the tags, the
 * picture is cropped to the specimen area and thresholded again on saturation.
 */
@Service
public class Binarizer {
    private static final Logger log = LoggerFactory.getLogger(Binarizer.class);

    static final int FIRST_PASS_BINS = 60;

    private final TagEdgeFinder tagEdgeFinder;

    public Binarizer(TagEdgeFinder tagEdgeFinder) {
        this.tagEdgeFinder = tagEdgeFinder;
    }

    /**
     * @param image     whole picture
     * @param topRuler  row of the ruler's top edge, from ruler detection
     * @return silhouette of rows {@code [0, topRuler)} and columns left of the tag edge
     */
    public BinaryMask binarize(RgbImage image, int topRuler) {
        log.info("Binarizing image {}x{}, top_ruler={}", image.width(), image.height(), topRuler);

        double[] gray = image.channel(RgbImage.RED);
        double coarse = Intensity.otsu(gray, FIRST_PASS_BINS);
        log.debug("First-pass Otsu threshold: {}", coarse);
        BinaryMask binary = Intensity.above(gray, image.width(), image.height(), coarse);

        int labelEdge = tagEdgeFinder.findTagsEdge(binary, topRuler);

        RgbImage specimen = image.crop(0, topRuler, 0, labelEdge);
        double[] rescaled = Intensity.rescale(specimen.saturation(), 0, 255);
        double refined = Intensity.otsu(rescaled, Intensity.DEFAULT_BINS);
        log.debug("Saturation Otsu threshold: {}", refined);

        BinaryMask silhouette = Intensity.above(rescaled, specimen.width(), specimen.height(), refined);
        log.info("Silhouette {}x{} with {} foreground pixels",
                silhouette.width(), silhouette.height(), silhouette.count());
        return silhouette;
    }
}
