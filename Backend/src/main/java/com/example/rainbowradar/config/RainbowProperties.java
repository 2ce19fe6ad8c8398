package com.example.rainbowradar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "rainbow")
public class RainbowProperties {

    private Grid grid = new Grid();

    // 0 = now, 1 = +1h, ...
    private int maxTimeOffsetHours = 2;

    @Data
    public static class Grid {
        private double radiusMeters = 25_000;
        private double spacingMeters = 2_000;
        private double fineSpacingMeters = 1_500;
        private int fineZoomThreshold = 13;
    }

    /**
     * Lattice spacing for a map zoom level; closer zooms get the finer spacing.
     */
    public double spacingForZoom(Integer zoom) {
        if (zoom != null && zoom >= grid.getFineZoomThreshold()) {
            return grid.getFineSpacingMeters();
        }
        return grid.getSpacingMeters();
    }
}
