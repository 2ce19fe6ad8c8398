package com.example.rainbowradar;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.rainbowradar.config.RainbowProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "weather.api.key=")
class RainbowRadarApplicationTests {

    @Autowired
    private RainbowProperties properties;

    @Test
    void contextLoadsWithGridDefaults() {
        assertEquals(25_000, properties.getGrid().getRadiusMeters());
        assertEquals(2_000, properties.spacingForZoom(12));
        assertEquals(1_500, properties.spacingForZoom(13));
        assertEquals(2, properties.getMaxTimeOffsetHours());
    }
}
