package com.example.rainbowradar.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

@Value
public class GridCell {

    @JsonUnwrapped
    GeoPoint point;

    @JsonProperty("bearing")
    double bearingFromCenterDeg;

    @JsonProperty("score")
    double score;
}
