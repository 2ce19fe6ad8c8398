package com.example.rainbowradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RainbowRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RainbowRadarApplication.class, args);
    }
}
