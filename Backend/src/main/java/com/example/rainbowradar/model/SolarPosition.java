package com.example.rainbowradar.model;

import lombok.Value;

@Value
public class SolarPosition {
    double elevationDeg; // above horizon, -90..90
    double azimuthDeg;   // from north, clockwise, [0, 360)
}
