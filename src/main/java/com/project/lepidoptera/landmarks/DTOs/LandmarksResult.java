package com.project.lepidoptera.landmarks.DTOs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The five landmarks, all in the coordinate frame of the whole silhouette.
 */
public record LandmarksResult(
        Point outerPixL,
        Point innerPixL,
        Point outerPixR,
        Point innerPixR,
        Point bodyCenter
) {
    public static final String OUTER_PIX_L = "outer_pix_l";
    public static final String INNER_PIX_L = "inner_pix_l";
    public static final String OUTER_PIX_R = "outer_pix_r";
    public static final String INNER_PIX_R = "inner_pix_r";
    public static final String BODY_CENTER = "body_center";

    public LandmarksResult {
        Objects.requireNonNull(outerPixL, OUTER_PIX_L);
        Objects.requireNonNull(innerPixL, INNER_PIX_L);
        Objects.requireNonNull(outerPixR, OUTER_PIX_R);
        Objects.requireNonNull(innerPixR, INNER_PIX_R);
        Objects.requireNonNull(bodyCenter, BODY_CENTER);
    }

    /** Landmarks in the fixed key order, each as {@code [row, col]}. */
    public Map<String, int[]> asMap() {
        Map<String, int[]> map = new LinkedHashMap<>();
        map.put(OUTER_PIX_L, outerPixL.toArray());
        map.put(INNER_PIX_L, innerPixL.toArray());
        map.put(OUTER_PIX_R, outerPixR.toArray());
        map.put(INNER_PIX_R, innerPixR.toArray());
        map.put(BODY_CENTER, bodyCenter.toArray());
        return map;
    }

    public List<Point> points() {
        return List.of(outerPixL, innerPixL, outerPixR, innerPixR, bodyCenter);
    }
}
