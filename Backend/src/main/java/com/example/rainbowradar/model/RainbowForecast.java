package com.example.rainbowradar.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class RainbowForecast {

    @JsonProperty("center")
    private GeoPoint center;

    @JsonProperty("evaluatedAt")
    private Instant evaluatedAt;

    @JsonProperty("timeOffsetHours")
    private int timeOffsetHours;

    @JsonProperty("spacingMeters")
    private double spacingMeters;

    @JsonProperty("sun")
    private SolarPosition sun; // null when the weather was unavailable

    @JsonProperty("status")
    private EvaluationStatus status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("cells")
    private List<GridCell> cells = new ArrayList<>();

    public static RainbowForecast from(GeoPoint center, Instant evaluatedAt, int timeOffsetHours,
                                       double spacingMeters, EvaluationResult result) {
        RainbowForecast forecast = new RainbowForecast();
        forecast.setCenter(center);
        forecast.setEvaluatedAt(evaluatedAt);
        forecast.setTimeOffsetHours(timeOffsetHours);
        forecast.setSpacingMeters(spacingMeters);
        forecast.setSun(result.getSun());
        forecast.setStatus(result.getStatus());
        forecast.setMessage(result.getStatus().getMessage());
        forecast.setCells(new ArrayList<>(result.getCells()));
        return forecast;
    }
}
