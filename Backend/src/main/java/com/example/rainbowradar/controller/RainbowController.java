package com.example.rainbowradar.controller;

import com.example.rainbowradar.model.RainbowForecast;
import com.example.rainbowradar.model.SolarPosition;
import com.example.rainbowradar.service.RainbowForecastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/rainbow")
public class RainbowController {

    private static final Logger logger = LoggerFactory.getLogger(RainbowController.class);

    private final RainbowForecastService rainbowForecastService;

    public RainbowController(RainbowForecastService rainbowForecastService) {
        this.rainbowForecastService = rainbowForecastService;
    }

    /**
     * Scored grid cells around the given location.
     */
    @GetMapping("/forecast")
    public ResponseEntity<RainbowForecast> getForecast(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false) Integer zoom,
            @RequestParam(required = false, defaultValue = "0") int timeOffsetHours) {

        logger.debug("Forecast request: ({}, {}), zoom={}, offset={}h", lat, lng, zoom, timeOffsetHours);

        RainbowForecast forecast = rainbowForecastService.forecast(lat, lng, zoom, timeOffsetHours);
        return ResponseEntity.ok(forecast);
    }

    /**
     * Sun elevation and azimuth; {@code dateTime} defaults to now.
     */
    @GetMapping("/sun-position")
    public ResponseEntity<SolarPosition> getSunPosition(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime dateTime) {

        SolarPosition position = rainbowForecastService.sunPosition(
                lat, lng, dateTime != null ? dateTime.toInstant() : null);
        return ResponseEntity.ok(position);
    }
}
