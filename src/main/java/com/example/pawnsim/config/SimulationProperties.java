package com.example.pawnsim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pawnsim")
public class SimulationProperties {

    // Fixed seed for reproducible runs; unset picks one from the clock.
    private Long seed;

    private int startHour = 8;

    private int minX = 0;
    private int maxX = 23;
    private int minY = 0;
    private int maxY = 15;

    private int paletteSize = 8;

    private boolean skipBootstrap = false;

    private boolean loopEnabled = true;

    private long tickIntervalMs = 100;

    private List<PlacedBuilding> buildings = new ArrayList<>();

    private List<TerrainPatch> terrain = new ArrayList<>();

    @Data
    public static class PlacedBuilding {
        private String key;
        private int x;
        private int y;
        private int colorIndex;
    }

    // Rectangle painted with one terrain after the world is built.
    @Data
    public static class TerrainPatch {
        private String key;
        private int x;
        private int y;
        private int width = 1;
        private int height = 1;
        private int colorIndex;
    }
}
