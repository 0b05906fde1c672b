package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import org.springframework.stereotype.Service;

@Service
public class BodySplitter {

    /**
     * Column of the body axis: the foreground's column centre of gravity,
     * rounded to the nearest column.
     */
    public int findMidline(BinaryMask silhouette) {
        int[] weights = silhouette.columnCounts();
        long total = 0;
        for (int w : weights) total += w;
        if (total == 0) {
            throw new NoRegionsFoundException("Silhouette has no foreground pixels");
        }

        double centroid = 0;
        for (int c = 0; c < weights.length; c++) {
            centroid += (double) weights[c] / total * c;
        }
        return (int) Math.round(centroid);
    }
}
