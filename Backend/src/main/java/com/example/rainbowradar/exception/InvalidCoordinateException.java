package com.example.rainbowradar.exception;

/**
 * Latitude or longitude outside the valid range.
 */
public class InvalidCoordinateException extends IllegalArgumentException {

    public InvalidCoordinateException(String message) {
        super(message);
    }
}
