package com.example.rainbowradar.model;

import lombok.Builder;
import lombok.Value;

/**
 * One weather observation or hourly forecast entry. Every field may be missing; the scorer
 * substitutes physical defaults.
 */
@Value
@Builder
public class WeatherSample {

    @Builder.Default
    RainMeasurement rain = RainMeasurement.none();

    Double cloudCoverPct;

    Double visibilityMeters;

    /** OpenWeatherMap condition id, e.g. 3xx drizzle, 5xx rain. */
    Integer conditionCode;

    public static WeatherSample empty() {
        return WeatherSample.builder().build();
    }
}
