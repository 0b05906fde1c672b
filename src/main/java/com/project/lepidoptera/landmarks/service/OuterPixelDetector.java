package com.project.lepidoptera.landmarks.service;

import com.project.lepidoptera.landmarks.DTOs.Point;
import com.project.lepidoptera.landmarks.DTOs.Region;
import com.project.lepidoptera.landmarks.exceptions.NoRegionsFoundException;
import com.project.lepidoptera.landmarks.imaging.BinaryMask;
import com.project.lepidoptera.landmarks.imaging.RegionAnalyzer;
import org.springframework.stereotype.Service;

import java.util.List;

/** Locates the wingtip: the wing pixel farthest from the body centre. */
@Service
public class OuterPixelDetector {

    /**
     * @param halfMask one wing half, antenna already removed
     * @param center   reference point in the half-mask's own frame
     * @return wingtip in the half-mask's frame
     */
    public Point detectOuterPixel(BinaryMask halfMask, Point center) {
        List<Region> regions = RegionAnalyzer.label(halfMask);
        if (regions.isEmpty()) {
            throw new NoRegionsFoundException("Wing half " + halfMask.width() + "x" + halfMask.height()
                    + " has no foreground");
        }

        // Largest region is the wing; smaller ones are specks. Earlier label wins ties.
        Region wing = regions.get(0);
        for (Region r : regions) {
            if (r.area() > wing.area()) wing = r;
        }

        Point outer = null;
        long maxDistance = -1;
        for (Point p : wing.coordinates()) {
            long d = p.distanceSquaredTo(center);
            if (d > maxDistance) {
                maxDistance = d;
                outer = p;
            }
        }
        return outer;
    }
}
