package com.example.rainbowradar.service;

import com.example.rainbowradar.exception.WeatherUnavailableException;
import com.example.rainbowradar.model.GeoPoint;
import com.example.rainbowradar.model.RainMeasurement;
import com.example.rainbowradar.model.WeatherForecast;
import com.example.rainbowradar.model.WeatherSample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * OpenWeatherMap One Call client. Turns the current and hourly blocks into a {@link WeatherForecast}.
 * Failures surface as {@link WeatherUnavailableException}; nothing is retried here.
 */
@Service
public class OpenWeatherService {

    private static final Logger logger = LoggerFactory.getLogger(OpenWeatherService.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String weatherApiKey;
    private final String baseUrl;

    public OpenWeatherService(RestTemplate restTemplate,
                              @Value("${weather.api.key:}") String weatherApiKey,
                              @Value("${weather.api.base-url:https://api.openweathermap.org/data/3.0/onecall}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = new ObjectMapper();
        this.weatherApiKey = weatherApiKey;
        this.baseUrl = baseUrl;
    }

    /**
     * Current conditions and hourly forecast for a location.
     */
    public WeatherForecast fetchForecast(GeoPoint location) {
        if (weatherApiKey == null || weatherApiKey.trim().isEmpty()) {
            throw new WeatherUnavailableException("Weather API key is not configured");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("lat", location.getLatitude())
                .queryParam("lon", location.getLongitude())
                .queryParam("units", "metric")
                .queryParam("exclude", "minutely,alerts")
                .queryParam("appid", weatherApiKey)
                .build()
                .toUri();

        logger.debug("Fetching weather for {}", location);

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (RestClientException e) {
            throw new WeatherUnavailableException("Weather API call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new WeatherUnavailableException("Weather API returned status " + response.getStatusCode());
        }

        return parseForecast(response.getBody());
    }

    /**
     * Parses a One Call document. Missing blocks and fields become empty samples / null fields.
     */
    public WeatherForecast parseForecast(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new WeatherUnavailableException("Weather API response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new WeatherUnavailableException("Weather API response is not a JSON object");
        }

        WeatherSample current = parseSample(root.path("current"));

        List<WeatherSample> hourly = new ArrayList<>();
        for (JsonNode entry : root.path("hourly")) {
            hourly.add(parseSample(entry));
        }

        logger.debug("Parsed weather forecast: {} hourly entries", hourly.size());
        return new WeatherForecast(current, hourly);
    }

    WeatherSample parseSample(JsonNode node) {
        if (node == null || !node.isObject()) {
            return WeatherSample.empty();
        }

        JsonNode weather = node.path("weather");
        Integer conditionCode = null;
        if (weather.isArray() && weather.size() > 0 && weather.get(0).path("id").isNumber()) {
            conditionCode = weather.get(0).path("id").asInt();
        }

        return WeatherSample.builder()
                .rain(parseRain(node.path("rain")))
                .cloudCoverPct(numberOrNull(node.path("clouds")))
                .visibilityMeters(numberOrNull(node.path("visibility")))
                .conditionCode(conditionCode)
                .build();
    }

    // "rain": 0.8  or  "rain": {"1h": 0.8}
    private RainMeasurement parseRain(JsonNode rain) {
        if (rain.isNumber()) {
            return RainMeasurement.scalar(rain.asDouble());
        }
        if (rain.isObject() && rain.path("1h").isNumber()) {
            return RainMeasurement.accumulated(rain.path("1h").asDouble());
        }
        return RainMeasurement.none();
    }

    private Double numberOrNull(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }
}
