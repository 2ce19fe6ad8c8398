package com.example.rainbowradar.util;

import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.RainMeasurement;
import com.example.rainbowradar.model.SolarPosition;
import com.example.rainbowradar.model.WeatherSample;
import lombok.Value;

/**
 * Heuristic rainbow probability for one direction around the observer.
 *
 * <p>A primary bow sits 42 degrees around the antisolar point, so it can only be above the
 * horizon while the sun is between 0 and 42 degrees high. Within that band five factors are
 * combined as a weighted geometric mean:
 * <ul>
 *   <li>azimuth: Gaussian falloff (sigma 18 degrees) away from the antisolar bearing</li>
 *   <li>sun: linear preference for a low sun</li>
 *   <li>rain: rain rate, saturating at 2 mm/h</li>
 *   <li>cloud: Gaussian around 50% cover</li>
 *   <li>visibility: saturating at 10 km</li>
 * </ul>
 */
public final class RainbowScorer {

    public static final double MAX_SUN_ELEVATION_DEG = 42.0;

    static final double AZIMUTH_SIGMA_DEG = 18.0;
    static final double SATURATING_RAIN_MM_PER_HOUR = 2.0;
    // Not measured: assumed rate when only the condition code says it is raining.
    static final double CONDITION_CODE_RAIN_MM_PER_HOUR = 0.2;
    static final double DEFAULT_CLOUD_COVER_PCT = 50.0;
    static final double CLOUD_SIGMA_PCT = 30.0;
    static final double DEFAULT_VISIBILITY_METERS = 10_000.0;

    private static final double AZIMUTH_EXPONENT = 0.4;
    private static final double SUN_EXPONENT = 0.8;
    private static final double RAIN_EXPONENT = 1.2;
    private static final double CLOUD_EXPONENT = 0.6;
    private static final double VISIBILITY_EXPONENT = 0.4;

    private RainbowScorer() {
    }

    /**
     * Score in [0, 1] for the direction from {@code center} to {@code cell}.
     */
    public static double score(GeoPoint center, GeoPoint cell, SolarPosition sun, WeatherSample weather) {
        if (!isSunInRange(sun)) {
            return 0.0;
        }
        return score(GeoMath.bearingDegrees(center, cell), sun, weather);
    }

    /**
     * Score in [0, 1] for a bearing (degrees from north) already computed by the caller.
     */
    public static double score(double bearingDeg, SolarPosition sun, WeatherSample weather) {
        if (!isSunInRange(sun)) {
            return 0.0;
        }
        return factors(bearingDeg, sun, weather).combined();
    }

    /**
     * True while the sun is strictly between the horizon and 42 degrees.
     */
    public static boolean isSunInRange(SolarPosition sun) {
        return sun.getElevationDeg() > 0 && sun.getElevationDeg() < MAX_SUN_ELEVATION_DEG;
    }

    /**
     * Every individual factor, computed without the sun gate.
     */
    public static Factors factors(double bearingDeg, SolarPosition sun, WeatherSample weather) {
        WeatherSample w = weather != null ? weather : WeatherSample.empty();

        double antisolarAzimuth = GeoMath.normalizeDegrees(sun.getAzimuthDeg() + 180.0);
        double deltaTheta = GeoMath.angularDistance(bearingDeg, antisolarAzimuth);
        double azimuthWeight = Math.exp(-square(deltaTheta / AZIMUTH_SIGMA_DEG));

        double sunWeight = Math.max(0.0, 1.0 - sun.getElevationDeg() / MAX_SUN_ELEVATION_DEG);

        double rainWeight = Math.min(1.0, rainRateMmPerHour(w) / SATURATING_RAIN_MM_PER_HOUR);

        double clouds = w.getCloudCoverPct() != null
                ? clamp(w.getCloudCoverPct(), 0.0, 100.0)
                : DEFAULT_CLOUD_COVER_PCT;
        double cloudWeight = Math.exp(-square((clouds - DEFAULT_CLOUD_COVER_PCT) / CLOUD_SIGMA_PCT));

        double visibility = w.getVisibilityMeters() != null
                ? Math.max(0.0, w.getVisibilityMeters())
                : DEFAULT_VISIBILITY_METERS;
        double visibilityWeight = Math.min(1.0, visibility / DEFAULT_VISIBILITY_METERS);

        return new Factors(antisolarAzimuth, deltaTheta, azimuthWeight, sunWeight, rainWeight,
                cloudWeight, visibilityWeight);
    }

    /**
     * Rain rate in mm/h: the provider's value when it is a positive number, else 0.2 for a
     * drizzle (3xx) or rain (5xx) condition code, else 0. A reported 0 counts as no reading.
     */
    public static double rainRateMmPerHour(WeatherSample weather) {
        RainMeasurement rain = weather.getRain();
        if (rain != null && rain.isPresent() && Double.isFinite(rain.getMmPerHour()) && rain.getMmPerHour() > 0) {
            return rain.getMmPerHour();
        }
        Integer code = weather.getConditionCode();
        if (code != null && (isInBand(code, 300, 400) || isInBand(code, 500, 600))) {
            return CONDITION_CODE_RAIN_MM_PER_HOUR;
        }
        return 0.0;
    }

    private static boolean isInBand(int code, int fromInclusive, int toExclusive) {
        return code >= fromInclusive && code < toExclusive;
    }

    private static double square(double v) {
        return v * v;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    @Value
    public static class Factors {
        double antisolarAzimuthDeg;
        double deltaThetaDeg;
        double azimuthWeight;
        double sunWeight;
        double rainWeight;
        double cloudWeight;
        double visibilityWeight;

        /**
         * Weighted geometric mean of the factors, clamped to [0, 1].
         */
        public double combined() {
            double score = Math.pow(azimuthWeight, AZIMUTH_EXPONENT)
                    * Math.pow(sunWeight, SUN_EXPONENT)
                    * Math.pow(rainWeight, RAIN_EXPONENT)
                    * Math.pow(cloudWeight, CLOUD_EXPONENT)
                    * Math.pow(visibilityWeight, VISIBILITY_EXPONENT);
            return clamp(score, 0.0, 1.0);
        }
    }
}
