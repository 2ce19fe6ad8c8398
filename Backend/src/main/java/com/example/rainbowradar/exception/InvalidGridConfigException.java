package com.example.rainbowradar.exception;

/**
 * Grid radius, spacing or time offset out of range.
 */
public class InvalidGridConfigException extends IllegalArgumentException {

    public InvalidGridConfigException(String message) {
        super(message);
    }
}
