package com.example.pawnsim.engine;

import lombok.Value;

@Value
public class BuildingPlacement {

    int buildingDefId;
    int x;
    int y;
    int colorIndex;

    public static BuildingPlacement of(int buildingDefId, int x, int y) {
        return new BuildingPlacement(buildingDefId, x, y, 0);
    }
}
