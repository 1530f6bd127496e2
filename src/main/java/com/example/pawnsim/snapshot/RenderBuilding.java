package com.example.pawnsim.snapshot;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RenderBuilding {

    int id;
    int x;
    int y;
    int buildingDefId;
    String name;
    int tileSize;
    boolean inUse;
    String usedByName;
    int colorIndex;
    String resourceType;
    int resourceAmount;
    int maxResourceAmount;
    int gold;
}
