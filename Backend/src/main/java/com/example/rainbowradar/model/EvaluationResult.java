package com.example.rainbowradar.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Scored cells of one evaluation pass, in grid order, with the pass status.
 * {@code sun} is null only when no solar position was computed (weather unavailable).
 */
@Value
public class EvaluationResult {

    EvaluationStatus status;
    SolarPosition sun;
    List<GridCell> cells;

    public EvaluationResult(EvaluationStatus status, SolarPosition sun, List<GridCell> cells) {
        this.status = status;
        this.sun = sun;
        this.cells = Collections.unmodifiableList(cells);
    }

    public static EvaluationResult sunOutOfRange(SolarPosition sun) {
        return new EvaluationResult(EvaluationStatus.SUN_OUT_OF_RANGE, sun, Collections.emptyList());
    }

    public static EvaluationResult weatherUnavailable() {
        return new EvaluationResult(EvaluationStatus.WEATHER_UNAVAILABLE, null, Collections.emptyList());
    }

    public static EvaluationResult of(SolarPosition sun, List<GridCell> cells) {
        return new EvaluationResult(
                cells.isEmpty() ? EvaluationStatus.NO_RESULTS : EvaluationStatus.FAVORABLE, sun, cells);
    }
}
