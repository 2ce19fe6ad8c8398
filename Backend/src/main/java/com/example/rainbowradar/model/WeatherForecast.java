package com.example.rainbowradar.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Current conditions plus hourly entries indexed by hour offset from now.
 */
@Value
public class WeatherForecast implements WeatherSource {

    WeatherSample current;
    List<WeatherSample> hourly;

    public WeatherForecast(WeatherSample current, List<WeatherSample> hourly) {
        this.current = current != null ? current : WeatherSample.empty();
        this.hourly = hourly != null ? Collections.unmodifiableList(hourly) : Collections.emptyList();
    }

    /**
     * Hourly entry for the offset, or the current sample when the forecast has no such hour.
     */
    @Override
    public WeatherSample forHourOffset(int hourOffset) {
        if (hourOffset >= 0 && hourly.size() > hourOffset) {
            return hourly.get(hourOffset);
        }
        return current;
    }
}
