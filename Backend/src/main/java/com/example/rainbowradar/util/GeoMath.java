package com.example.rainbowradar.util;

import com.example.rainbowradar.model.GeoPoint;

/**
 * Spherical-earth distance and bearing, plus a local flat-earth offset helper.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoMath() {
    }

    /**
     * Haversine great-circle distance in meters.
     */
    public static double distanceMeters(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.getLatitude());
        double phi2 = Math.toRadians(b.getLatitude());
        double dPhi = Math.toRadians(b.getLatitude() - a.getLatitude());
        double dLambda = Math.toRadians(b.getLongitude() - a.getLongitude());

        double sinHalfPhi = Math.sin(dPhi / 2);
        double sinHalfLambda = Math.sin(dLambda / 2);
        double h = sinHalfPhi * sinHalfPhi + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Initial great-circle bearing from {@code a} to {@code b}, degrees clockwise from north in
     * [0, 360). Identical points give 0 (atan2(0, 0)).
     */
    public static double bearingDegrees(GeoPoint a, GeoPoint b) {
        double phi1 = Math.toRadians(a.getLatitude());
        double phi2 = Math.toRadians(b.getLatitude());
        double dLambda = Math.toRadians(b.getLongitude() - a.getLongitude());

        double y = Math.sin(dLambda) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLambda);
        return normalizeDegrees(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Moves {@code origin} by {@code dxMeters} east and {@code dyMeters} north on a local
     * flat-earth tangent plane. Only meant for offsets of tens of kilometers; no geodesic
     * correction is applied. The resulting longitude is wrapped into [-180, 180); the latitude is
     * not, so an offset that crosses a pole yields a latitude beyond +/-90. Grids are therefore
     * only meaningful for centers further than the offset from either pole.
     */
    public static GeoPoint offsetToPoint(GeoPoint origin, double dxMeters, double dyMeters) {
        double dLat = Math.toDegrees(dyMeters / EARTH_RADIUS_METERS);
        double dLon = Math.toDegrees(dxMeters / (EARTH_RADIUS_METERS * Math.cos(Math.toRadians(origin.getLatitude()))));
        return new GeoPoint(origin.getLatitude() + dLat, wrapLongitude(origin.getLongitude() + dLon));
    }

    /**
     * Smallest angle between two bearings, in [0, 180]. Symmetric in its arguments.
     */
    public static double angularDistance(double bearingA, double bearingB) {
        double delta = Math.abs(normalizeDegrees(bearingA) - normalizeDegrees(bearingB));
        return Math.min(delta, 360.0 - delta);
    }

    /**
     * Maps any angle into [0, 360).
     */
    public static double normalizeDegrees(double degrees) {
        double r = degrees % 360.0;
        if (r < 0) {
            r += 360.0;
        }
        // -1e-15 % 360 + 360 rounds to 360.0
        return r >= 360.0 ? 0.0 : r;
    }

    static double wrapLongitude(double longitude) {
        if (longitude >= -180.0 && longitude < 180.0) {
            return longitude;
        }
        return normalizeDegrees(longitude + 180.0) - 180.0;
    }
}
