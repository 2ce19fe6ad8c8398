package com.example.rainbowradar.model;

import com.example.rainbowradar.exception.InvalidCoordinateException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Locale;

/**
 * Immutable WGS84 position in degrees.
 */
@Value
public class GeoPoint {

    @JsonProperty("lat")
    double latitude;

    @JsonProperty("lng")
    double longitude;

    /**
     * Validating factory for coordinates coming from outside (requests, providers).
     * A longitude of exactly 180 is folded onto -180.
     *
     * @throws InvalidCoordinateException if either value is not finite or out of range
     */
    public static GeoPoint of(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidCoordinateException(
                    String.format(Locale.US, "Latitude must be between -90 and 90 degrees: %s", latitude));
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidCoordinateException(
                    String.format(Locale.US, "Longitude must be between -180 and 180 degrees: %s", longitude));
        }
        return new GeoPoint(latitude, longitude == 180.0 ? -180.0 : longitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "GeoPoint{lat=%.6f, lng=%.6f}", latitude, longitude);
    }
}
