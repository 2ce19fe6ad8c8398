package com.example.rainbowradar.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Rain rate as reported by a provider: absent, a bare mm/h value, or the value of an hourly
 * accumulation ({@code "rain": {"1h": x}}).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RainMeasurement {

    public enum Kind {
        NONE,
        SCALAR,
        ACCUMULATED
    }

    private static final RainMeasurement NONE = new RainMeasurement(Kind.NONE, 0.0);

    Kind kind;
    double mmPerHour;

    public static RainMeasurement none() {
        return NONE;
    }

    public static RainMeasurement scalar(double mmPerHour) {
        return new RainMeasurement(Kind.SCALAR, mmPerHour);
    }

    public static RainMeasurement accumulated(double mmPerHour) {
        return new RainMeasurement(Kind.ACCUMULATED, mmPerHour);
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }
}
