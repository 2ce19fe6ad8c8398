package com.example.rainbowradar.service;

import static org.junit.jupiter.api.Assertions.*;

import com.example.rainbowradar.exception.InvalidGridConfigException;
import com.example.rainbowradar.model.EvaluationResult;
import com.example.rainbowradar.model.EvaluationStatus;
import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.GridCell;
import com.example.rainbowradar.model.RainMeasurement;
import com.example.rainbowradar.model.WeatherSample;
import com.example.rainbowradar.model.WeatherSource;
import com.example.rainbowradar.util.GeoMath;
import com.example.rainbowradar.util.GridBuilder;
import com.example.rainbowradar.util.SunPositionCalculator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class GridEvaluatorTest {

    private static final GeoPoint LONDON = new GeoPoint(51.5, -0.12);
    // sun at ~19.7 degrees, azimuth ~248.3
    private static final Instant LONDON_AFTERNOON = Instant.parse("2024-09-15T16:00:00Z");

    private static final WeatherSample RAINY = WeatherSample.builder()
            .rain(RainMeasurement.accumulated(2.0))
            .cloudCoverPct(50.0)
            .visibilityMeters(10_000.0)
            .build();

    private final GridEvaluator evaluator = new GridEvaluator();

    @Test
    void highSunShortCircuitsWithoutGridOrWeather() {
        List<Integer> requestedOffsets = new ArrayList<>();
        WeatherSource weather = offset -> {
            requestedOffsets.add(offset);
            return RAINY;
        };

        EvaluationResult result = evaluator.evaluate(
                new GeoPoint(0.0, 0.0), Instant.parse("2024-06-21T12:00:00Z"), 25_000, 2_000, 0, weather);

        assertEquals(EvaluationStatus.SUN_OUT_OF_RANGE, result.getStatus());
        assertTrue(result.getCells().isEmpty());
        assertTrue(result.getSun().getElevationDeg() > 42.0);
        assertTrue(requestedOffsets.isEmpty());
    }

    @Test
    void invalidGridConfigIsRejectedAtNightToo() {
        Instant night = Instant.parse("2024-09-15T23:00:00Z");

        assertThrows(InvalidGridConfigException.class,
                () -> evaluator.evaluate(LONDON, night, -1, 2_000, 0, offset -> RAINY));
        assertThrows(InvalidGridConfigException.class,
                () -> evaluator.evaluate(LONDON, night, 25_000, 0, 0, offset -> RAINY));
    }

    @Test
    void nightWithValidGridIsSunOutOfRange() {
        EvaluationResult result = evaluator.evaluate(
                LONDON, Instant.parse("2024-09-15T23:00:00Z"), 25_000, 2_000, 0, offset -> RAINY);

        assertEquals(EvaluationStatus.SUN_OUT_OF_RANGE, result.getStatus());
    }

    @Test
    void rainyAfternoonIsFavorable() {
        EvaluationResult result = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> RAINY);

        assertEquals(EvaluationStatus.FAVORABLE, result.getStatus());
        assertEquals(489, result.getCells().size());
        assertEquals(SunPositionCalculator.calculate(LONDON, LONDON_AFTERNOON), result.getSun());
        for (GridCell cell : result.getCells()) {
            assertTrue(cell.getScore() > 0.0 && cell.getScore() <= 1.0, "score " + cell.getScore());
            assertTrue(cell.getBearingFromCenterDeg() >= 0.0 && cell.getBearingFromCenterDeg() < 360.0);
        }
    }

    @Test
    void cellsKeepGridOrder() {
        EvaluationResult result = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> RAINY);

        List<GeoPoint> points = result.getCells().stream().map(GridCell::getPoint).collect(Collectors.toList());
        assertEquals(GridBuilder.buildGrid(LONDON, 25_000, 2_000), points);
    }

    @Test
    void bestCellLiesTowardTheAntisolarPoint() {
        EvaluationResult result = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> RAINY);

        double antisolar = GeoMath.normalizeDegrees(result.getSun().getAzimuthDeg() + 180.0);
        GridCell best = result.getCells().stream().max(Comparator.comparingDouble(GridCell::getScore)).orElseThrow();

        assertTrue(GeoMath.angularDistance(best.getBearingFromCenterDeg(), antisolar) < 10.0,
                "best bearing " + best.getBearingFromCenterDeg() + " antisolar " + antisolar);
    }

    @Test
    void dryWeatherGivesNoResults() {
        WeatherSample dry = WeatherSample.builder().cloudCoverPct(50.0).conditionCode(800).build();

        EvaluationResult result = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> dry);

        assertEquals(EvaluationStatus.NO_RESULTS, result.getStatus());
        assertTrue(result.getCells().isEmpty());
        assertNotNull(result.getSun());
    }

    @Test
    void weatherIsResolvedOnceForTheRequestedOffset() {
        List<Integer> requestedOffsets = new ArrayList<>();
        WeatherSource weather = offset -> {
            requestedOffsets.add(offset);
            return RAINY;
        };

        evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 2, weather);

        assertEquals(List.of(2), requestedOffsets);
    }

    @Test
    void invalidGridConfigIsRejectedWhenTheSunIsUp() {
        assertThrows(InvalidGridConfigException.class,
                () -> evaluator.evaluate(LONDON, LONDON_AFTERNOON, 0, 2_000, 0, offset -> RAINY));
    }

    @Test
    void repeatedEvaluationsAreIdentical() {
        EvaluationResult first = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> RAINY);
        EvaluationResult second = evaluator.evaluate(LONDON, LONDON_AFTERNOON, 25_000, 2_000, 0, offset -> RAINY);

        assertEquals(first, second);
    }
}
