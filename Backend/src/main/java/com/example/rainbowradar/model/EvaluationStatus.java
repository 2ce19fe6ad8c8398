package com.example.rainbowradar.model;

public enum EvaluationStatus {
    FAVORABLE("Rainbow conditions possible nearby."),
    SUN_OUT_OF_RANGE("Conditions unfavorable (Sun too low/high)."),
    NO_RESULTS("No likely rainbow areas nearby."),
    // only produced at the weather-provider boundary, never by the grid evaluation itself
    WEATHER_UNAVAILABLE("Weather unavailable.");

    private final String message;

    EvaluationStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
