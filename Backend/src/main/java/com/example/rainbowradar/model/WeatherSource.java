package com.example.rainbowradar.model;

/**
 * Supplies the weather sample to use for a given hour offset from now.
 */
@FunctionalInterface
public interface WeatherSource {

    WeatherSample forHourOffset(int hourOffset);
}
