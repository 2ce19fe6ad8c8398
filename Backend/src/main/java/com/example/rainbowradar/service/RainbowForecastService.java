package com.example.rainbowradar.service;

import com.example.rainbowradar.config.RainbowProperties;
import com.example.rainbowradar.exception.InvalidGridConfigException;
import com.example.rainbowradar.exception.WeatherUnavailableException;
import com.example.rainbowradar.model.EvaluationResult;
import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.RainbowForecast;
import com.example.rainbowradar.model.SolarPosition;
import com.example.rainbowradar.model.WeatherForecast;
import com.example.rainbowradar.util.SunPositionCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Request-level entry point: validates input, fetches the weather and runs one grid evaluation.
 */
@Service
@Slf4j
public class RainbowForecastService {

    private final GridEvaluator gridEvaluator;
    private final OpenWeatherService openWeatherService;
    private final RainbowProperties properties;
    private final Clock clock;

    public RainbowForecastService(GridEvaluator gridEvaluator,
                                  OpenWeatherService openWeatherService,
                                  RainbowProperties properties,
                                  Clock clock) {
        this.gridEvaluator = gridEvaluator;
        this.openWeatherService = openWeatherService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Rainbow forecast around ({@code latitude}, {@code longitude}) for now + {@code timeOffsetHours}.
     *
     * @param zoom map zoom level of the caller, may be null
     */
    public RainbowForecast forecast(double latitude, double longitude, Integer zoom, int timeOffsetHours) {
        GeoPoint center = GeoPoint.of(latitude, longitude);
        if (timeOffsetHours < 0 || timeOffsetHours > properties.getMaxTimeOffsetHours()) {
            throw new InvalidGridConfigException(String.format(
                    "timeOffsetHours must be between 0 and %d: %d", properties.getMaxTimeOffsetHours(), timeOffsetHours));
        }

        double radius = properties.getGrid().getRadiusMeters();
        double spacing = properties.spacingForZoom(zoom);
        Instant instant = clock.instant().plus(Duration.ofHours(timeOffsetHours));

        WeatherForecast weather;
        try {
            weather = openWeatherService.fetchForecast(center);
        } catch (WeatherUnavailableException e) {
            log.warn("Weather unavailable for {}: {}", center, e.getMessage());
            return RainbowForecast.from(center, instant, timeOffsetHours, spacing, EvaluationResult.weatherUnavailable());
        }

        EvaluationResult result = gridEvaluator.evaluate(center, instant, radius, spacing, timeOffsetHours, weather);

        log.info("Rainbow forecast for {} at {} (+{}h): {} with {} cells",
                center, instant, timeOffsetHours, result.getStatus(), result.getCells().size());
        return RainbowForecast.from(center, instant, timeOffsetHours, spacing, result);
    }

    /**
     * Sun elevation and azimuth at a location; {@code instant} defaults to now.
     */
    public SolarPosition sunPosition(double latitude, double longitude, Instant instant) {
        GeoPoint observer = GeoPoint.of(latitude, longitude);
        return SunPositionCalculator.calculate(observer, instant != null ? instant : clock.instant());
    }
}
