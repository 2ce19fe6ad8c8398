package com.example.rainbowradar.util;

import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.SolarPosition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.JulianFields;

/**
 * Solar position utility based on the NOAA low-precision solar position algorithm
 * (valid 1900-2099, about 0.01 degree accuracy). Works entirely in UTC; the elevation is
 * geometric, without atmospheric refraction.
 */
public final class SunPositionCalculator {

    private static final double J2000 = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double MINUTES_PER_DAY = 1440.0;

    private SunPositionCalculator() {
    }

    /**
     * Sun elevation and azimuth seen from {@code observer} at {@code instant}.
     */
    public static SolarPosition calculate(GeoPoint observer, Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        double secondOfDay = utc.toLocalTime().toNanoOfDay() / 1e9;

        // 1. Julian day (JDN starts at noon, hence -0.5) and Julian centuries since J2000.0
        double julianDay = utc.getLong(JulianFields.JULIAN_DAY) - 0.5 + secondOfDay / 86400.0;
        double t = (julianDay - J2000) / DAYS_PER_CENTURY;

        // 2. geometric mean longitude, mean anomaly, orbit eccentricity
        double geomMeanLongSun = GeoMath.normalizeDegrees(280.46646 + t * (36000.76983 + t * 0.0003032));
        double geomMeanAnomSun = GeoMath.normalizeDegrees(357.52911 + t * (35999.05029 - 0.0001537 * t));
        double eccentEarthOrbit = 0.016708634 - t * (0.000042037 + 0.0000001267 * t);

        // 3. equation of center, true longitude
        double m = Math.toRadians(geomMeanAnomSun);
        double sunEqOfCtr = Math.sin(m) * (1.914602 - t * (0.004817 + 0.000014 * t))
                + Math.sin(2 * m) * (0.019993 - 0.000101 * t)
                + Math.sin(3 * m) * 0.000289;
        double sunTrueLong = geomMeanLongSun + sunEqOfCtr;

        // 4. apparent longitude
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        double sunAppLong = sunTrueLong - 0.00569 - 0.00478 * Math.sin(omega);

        // 5. obliquity of the ecliptic
        double meanObliqEcliptic = 23 + (26 + (21.448 - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60) / 60;
        double obliqCorr = Math.toRadians(meanObliqEcliptic + 0.00256 * Math.cos(omega));

        // 6. declination
        double declination = Math.asin(Math.sin(obliqCorr) * Math.sin(Math.toRadians(sunAppLong)));

        // 7. equation of time (minutes)
        double y = Math.tan(obliqCorr / 2) * Math.tan(obliqCorr / 2);
        double l0 = Math.toRadians(geomMeanLongSun);
        double eqOfTime = 4 * Math.toDegrees(y * Math.sin(2 * l0)
                - 2 * eccentEarthOrbit * Math.sin(m)
                + 4 * eccentEarthOrbit * y * Math.sin(m) * Math.cos(2 * l0)
                - 0.5 * y * y * Math.sin(4 * l0)
                - 1.25 * eccentEarthOrbit * eccentEarthOrbit * Math.sin(2 * m));

        // 8. true solar time and hour angle
        double trueSolarTime = (secondOfDay / 60.0 + eqOfTime + 4 * observer.getLongitude()) % MINUTES_PER_DAY;
        double hourAngleDeg = trueSolarTime / 4 < 0 ? trueSolarTime / 4 + 180 : trueSolarTime / 4 - 180;

        // 9. elevation
        double lat = Math.toRadians(observer.getLatitude());
        double hourAngle = Math.toRadians(hourAngleDeg);
        double sinElevation = Math.sin(lat) * Math.sin(declination)
                + Math.cos(lat) * Math.cos(declination) * Math.cos(hourAngle);
        double elevation = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinElevation))));

        // 10. azimuth from north, clockwise
        double azimuth = Math.toDegrees(Math.atan2(
                -Math.sin(hourAngle),
                Math.tan(declination) * Math.cos(lat) - Math.sin(lat) * Math.cos(hourAngle)));

        return new SolarPosition(elevation, GeoMath.normalizeDegrees(azimuth));
    }
}
