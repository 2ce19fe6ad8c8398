package com.example.rainbowradar.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.rainbowradar.config.RainbowProperties;
import com.example.rainbowradar.exception.InvalidCoordinateException;
import com.example.rainbowradar.exception.InvalidGridConfigException;
import com.example.rainbowradar.exception.WeatherUnavailableException;
import com.example.rainbowradar.model.EvaluationStatus;
import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.RainMeasurement;
import com.example.rainbowradar.model.RainbowForecast;
import com.example.rainbowradar.model.SolarPosition;
import com.example.rainbowradar.model.WeatherForecast;
import com.example.rainbowradar.model.WeatherSample;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RainbowForecastServiceTest {

    private static final Instant LONDON_AFTERNOON = Instant.parse("2024-09-15T16:00:00Z");

    private static final WeatherSample RAINY = WeatherSample.builder()
            .rain(RainMeasurement.scalar(1.0)).cloudCoverPct(60.0).build();
    private static final WeatherSample DRY = WeatherSample.builder()
            .cloudCoverPct(10.0).conditionCode(800).build();

    private OpenWeatherService openWeatherService;
    private RainbowForecastService service;

    @BeforeEach
    void setUp() {
        openWeatherService = mock(OpenWeatherService.class);
        service = new RainbowForecastService(new GridEvaluator(), openWeatherService, new RainbowProperties(),
                Clock.fixed(LONDON_AFTERNOON, ZoneOffset.UTC));
    }

    @Test
    void favorableForecastForRainyAfternoon() {
        when(openWeatherService.fetchForecast(any(GeoPoint.class))).thenReturn(new WeatherForecast(RAINY, List.of()));

        RainbowForecast forecast = service.forecast(51.5, -0.12, null, 0);

        assertEquals(EvaluationStatus.FAVORABLE, forecast.getStatus());
        assertEquals(EvaluationStatus.FAVORABLE.getMessage(), forecast.getMessage());
        assertEquals(LONDON_AFTERNOON, forecast.getEvaluatedAt());
        assertEquals(2_000, forecast.getSpacingMeters());
        assertEquals(489, forecast.getCells().size());
        assertNotNull(forecast.getSun());
    }

    @Test
    void timeOffsetMovesTheInstantAndPicksTheHourlyEntry() {
        // current is dry, +1h is rainy
        when(openWeatherService.fetchForecast(any(GeoPoint.class)))
                .thenReturn(new WeatherForecast(DRY, List.of(DRY, RAINY)));

        RainbowForecast now = service.forecast(51.5, -0.12, null, 0);
        RainbowForecast later = service.forecast(51.5, -0.12, null, 1);

        assertEquals(EvaluationStatus.NO_RESULTS, now.getStatus());
        assertEquals(EvaluationStatus.FAVORABLE, later.getStatus());
        assertEquals(LONDON_AFTERNOON.plusSeconds(3600), later.getEvaluatedAt());
        assertEquals(1, later.getTimeOffsetHours());
    }

    @Test
    void closeZoomUsesFinerSpacing() {
        when(openWeatherService.fetchForecast(any(GeoPoint.class))).thenReturn(new WeatherForecast(RAINY, List.of()));

        RainbowForecast forecast = service.forecast(51.5, -0.12, 13, 0);

        assertEquals(1_500, forecast.getSpacingMeters());
        assertEquals(877, forecast.getCells().size());
    }

    @Test
    void weatherOutageIsReportedAsStatus() {
        when(openWeatherService.fetchForecast(any(GeoPoint.class)))
                .thenThrow(new WeatherUnavailableException("connection refused"));

        RainbowForecast forecast = service.forecast(51.5, -0.12, null, 0);

        assertEquals(EvaluationStatus.WEATHER_UNAVAILABLE, forecast.getStatus());
        assertEquals("Weather unavailable.", forecast.getMessage());
        assertTrue(forecast.getCells().isEmpty());
        assertNull(forecast.getSun());
    }

    @Test
    void invalidCoordinateIsRejectedBeforeFetchingWeather() {
        assertThrows(InvalidCoordinateException.class, () -> service.forecast(95.0, 0.0, null, 0));
        verify(openWeatherService, never()).fetchForecast(any());
    }

    @Test
    void timeOffsetOutsideTheWindowIsRejected() {
        assertThrows(InvalidGridConfigException.class, () -> service.forecast(51.5, -0.12, null, 3));
        assertThrows(InvalidGridConfigException.class, () -> service.forecast(51.5, -0.12, null, -1));
        verify(openWeatherService, never()).fetchForecast(any());
    }

    @Test
    void sunPositionDefaultsToNow() {
        SolarPosition position = service.sunPosition(51.5, -0.12, null);

        assertEquals(19.67, position.getElevationDeg(), 0.5);
        assertEquals(248.27, position.getAzimuthDeg(), 0.5);
    }

    @Test
    void sunPositionValidatesCoordinates() {
        assertThrows(InvalidCoordinateException.class, () -> service.sunPosition(0.0, 200.0, null));
    }
}
