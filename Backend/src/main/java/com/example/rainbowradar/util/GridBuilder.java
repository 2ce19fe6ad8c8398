package com.example.rainbowradar.util;

import com.example.rainbowradar.exception.InvalidGridConfigException;
import com.example.rainbowradar.model.GeoPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Square lattice around a center, cropped to a circle on the local tangent plane.
 * The crop uses the planar offset, not a geodesic distance, so it is only accurate for radii
 * of a few tens of kilometers away from the poles.
 */
public final class GridBuilder {

    /** Lattice width limit, about 3 million points before the circular crop. */
    public static final int MAX_STEPS = 2_000;

    private GridBuilder() {
    }

    /**
     * Lattice points within {@code radiusMeters} of {@code center}. Rows run south to north
     * ({@code iy} ascending), and within a row west to east ({@code ix} ascending).
     *
     * @throws InvalidGridConfigException if radius or spacing is not a positive finite number
     */
    public static List<GeoPoint> buildGrid(GeoPoint center, double radiusMeters, double spacingMeters) {
        int half = steps(radiusMeters, spacingMeters) / 2;

        List<GeoPoint> points = new ArrayList<>();
        for (int iy = -half; iy <= half; iy++) {
            for (int ix = -half; ix <= half; ix++) {
                double dx = ix * spacingMeters;
                double dy = iy * spacingMeters;
                if (Math.hypot(dx, dy) <= radiusMeters) {
                    points.add(GeoMath.offsetToPoint(center, dx, dy));
                }
            }
        }
        return points;
    }

    /**
     * Checks radius and spacing without building anything.
     *
     * @throws InvalidGridConfigException if either value is not a positive finite number, or the
     *         lattice would be wider than {@value #MAX_STEPS} cells
     */
    public static void validate(double radiusMeters, double spacingMeters) {
        steps(radiusMeters, spacingMeters);
    }

    private static int steps(double radiusMeters, double spacingMeters) {
        requirePositive("radiusMeters", radiusMeters);
        requirePositive("spacingMeters", spacingMeters);

        double steps = Math.ceil(2 * radiusMeters / spacingMeters);
        if (steps > MAX_STEPS) {
            throw new InvalidGridConfigException(String.format(Locale.US,
                    "Grid of radius %s m at spacing %s m needs %.0f steps per side, limit is %d",
                    radiusMeters, spacingMeters, steps, MAX_STEPS));
        }
        return (int) steps;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidGridConfigException(
                    String.format(Locale.US, "%s must be a positive number: %s", name, value));
        }
    }
}
