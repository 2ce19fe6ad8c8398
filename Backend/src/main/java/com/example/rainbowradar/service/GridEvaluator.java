package com.example.rainbowradar.service;

import com.example.rainbowradar.model.EvaluationResult;
import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.GridCell;
import com.example.rainbowradar.model.SolarPosition;
import com.example.rainbowradar.model.WeatherSample;
import com.example.rainbowradar.model.WeatherSource;
import com.example.rainbowradar.util.GeoMath;
import com.example.rainbowradar.util.GridBuilder;
import com.example.rainbowradar.util.RainbowScorer;
import com.example.rainbowradar.util.SunPositionCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class GridEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(GridEvaluator.class);

    /**
     * Scores every grid cell around {@code center} for one instant. The sun position is computed
     * once and the weather sample for {@code hourOffset} is resolved once; both are shared by all
     * cells. Cells scoring 0 are dropped, the rest keep grid order. Radius and spacing are
     * validated first, whatever the sun position.
     */
    public EvaluationResult evaluate(GeoPoint center, Instant instantUtc,
                                     double radiusMeters, double spacingMeters,
                                     int hourOffset, WeatherSource weather) {
        GridBuilder.validate(radiusMeters, spacingMeters);

        SolarPosition sun = SunPositionCalculator.calculate(center, instantUtc);

        if (!RainbowScorer.isSunInRange(sun)) {
            logger.debug("Sun out of range at {} for {}: elevation={}", instantUtc, center, sun.getElevationDeg());
            return EvaluationResult.sunOutOfRange(sun);
        }

        List<GeoPoint> grid = GridBuilder.buildGrid(center, radiusMeters, spacingMeters);
        WeatherSample sample = weather.forHourOffset(hourOffset);

        List<GridCell> cells = scoreGrid(center, sun, grid, sample);

        logger.debug("Evaluated {} grid points around {}: {} cells retained (sun elevation={}, azimuth={})",
                grid.size(), center, cells.size(), sun.getElevationDeg(), sun.getAzimuthDeg());
        return EvaluationResult.of(sun, cells);
    }

    private List<GridCell> scoreGrid(GeoPoint center, SolarPosition sun, List<GeoPoint> grid, WeatherSample sample) {
        List<GridCell> cells = new ArrayList<>();
        for (GeoPoint point : grid) {
            double bearing = GeoMath.bearingDegrees(center, point);
            double score = RainbowScorer.score(bearing, sun, sample);
            if (score > 0) {
                cells.add(new GridCell(point, bearing, score));
            }
        }
        return cells;
    }
}
