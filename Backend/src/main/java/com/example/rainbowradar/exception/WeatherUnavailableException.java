package com.example.rainbowradar.exception;

/**
 * The weather provider could not deliver a forecast (no key, transport error, bad payload).
 */
public class WeatherUnavailableException extends RuntimeException {

    public WeatherUnavailableException(String message) {
        super(message);
    }

    public WeatherUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
