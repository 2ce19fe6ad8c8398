package com.example.rainbowradar.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@RestController
public class DeployCheckController {

    private final Clock clock;

    public DeployCheckController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/deploy-check")
    public String checkDeploy() {
        return "rainbow-radar up - timestamp (UTC): " +
                LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    }
}
