package com.example.pawnsim.engine;

import lombok.Value;

@Value
public class WorldBounds {

    public static final WorldBounds DEFAULT = new WorldBounds(0, 23, 0, 15);

    int minX;
    int maxX;
    int minY;
    int maxY;
}
