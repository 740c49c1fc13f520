package com.locode.resolution.core.model;

import com.locode.resolution.match.InvalidQueryException;

import java.util.Locale;

/**
 * A latitude/longitude pair in degrees.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got " + longitude);
        }
    }

    /**
     * Planar distance in degrees. Not a geodesic distance.
     */
    public double distanceTo(double otherLatitude, double otherLongitude) {
        return Math.sqrt(squaredDistanceTo(otherLatitude, otherLongitude));
    }

    public double distanceTo(Coordinates other) {
        return distanceTo(other.latitude, other.longitude);
    }

    public double squaredDistanceTo(double otherLatitude, double otherLongitude) {
        double dLat = latitude - otherLatitude;
        double dLon = longitude - otherLongitude;
        return dLat * dLat + dLon * dLon;
    }

    /**
     * Parses {@code "lat lon"} or {@code "lat,lon"}.
     *
     * @throws InvalidQueryException if the text is not two numbers in range
     */
    public static Coordinates parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("Coordinates are required");
        }
        String[] parts = text.trim().split("[,\\s]+");
        if (parts.length != 2) {
            throw new InvalidQueryException("Expected 'latitude longitude', got '" + text + "'");
        }
        try {
            return new Coordinates(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Coordinates must be numeric, got '" + text + "'", e);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException(e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.4f, %.4f)", latitude, longitude);
    }
}
