package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.LandmarkAnalysis;
import com.project.lepidoptera.landmarks.DTOs.LandmarksResult;
import com.project.lepidoptera.landmarks.cache.Fingerprints;
import com.project.lepidoptera.landmarks.cache.ResultCache;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RgbImage;
import com.project.lepidoptera.landmarks.render.OverlaySurfaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point combining binarization and landmark location, memoized through
 * the injected {@link ResultCache}.
 */
@Service
public class LandmarkPipeline {
    private static final Logger log = LoggerFactory.getLogger(LandmarkPipeline.class);

    private final Binarizer binarizer;
    private final LandmarkService landmarkService;
    private final ResultCache cache;

    public LandmarkPipeline(Binarizer binarizer, LandmarkService landmarkService, ResultCache cache) {
        this.binarizer = binarizer;
        this.landmarkService = landmarkService;
        this.cache = cache;
    }

    public BinaryMask binarize(RgbImage image, int topRuler) {
        String key = "binarize:" + Fingerprints.of(image, topRuler);
        Object cached = cache.get(key);
        if (cached instanceof BinaryMask mask) {
            log.debug("Silhouette served from cache");
            return mask;
        }
        BinaryMask silhouette = binarizer.binarize(image, topRuler);
        cache.put(key, silhouette);
        return silhouette;
    }

    /**
     * Drawing is a side effect of the computation, so a call with surfaces
     * always recomputes; its result still refreshes the cache.
     */
    public LandmarksResult locate(BinaryMask silhouette, OverlaySurfaces surfaces) {
        String key = "landmarks:" + Fingerprints.of(silhouette);
        if (surfaces.isEmpty()) {
            Object cached = cache.get(key);
            if (cached instanceof LandmarksResult result) {
                log.debug("Landmarks served from cache");
                return result;
            }
        }
        LandmarksResult result = landmarkService.locate(silhouette, surfaces);
        cache.put(key, result);
        return result;
    }

    public LandmarkAnalysis analyze(RgbImage image, int topRuler, OverlaySurfaces surfaces) {
        BinaryMask silhouette = binarize(image, topRuler);
        return new LandmarkAnalysis(silhouette, locate(silhouette, surfaces));
    }
}
