package com.locode.resolution.geo;

import com.locode.resolution.core.model.Code;

/**
 * The code closest to a point, with its planar distance in degrees.
 */
public record NearestMatch(Code code, double distance) {

    /**
     * Distance converted with the rough ratio of 111 km per degree.
     */
    public double distanceKm() {
        return distance * GeoLocator.KM_PER_DEGREE;
    }
}
