package com.example.rainbowradar.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DeployCheckControllerTest {

    @Test
    void reportsCurrentUtcTimestamp() {
        Clock clock = Clock.fixed(Instant.parse("2024-09-15T16:00:00Z"), ZoneOffset.UTC);

        assertEquals("rainbow-radar up - timestamp (UTC): 2024-09-15 16:00:00",
                new DeployCheckController(clock).checkDeploy());
    }
}
