package com.example.pawnsim.world;

import lombok.Getter;

@Getter
public class Tile {

    private int terrainTypeId;
    private boolean terrainWalkable = true;
    private boolean buildable = true;
    private boolean blocksLight;

    private int colorIndex;

    private int occupantCount;
    private int blockingCount;

    Tile(int terrainTypeId) {
        this.terrainTypeId = terrainTypeId;
    }

    public boolean isWalkable() {
        return terrainWalkable && blockingCount == 0;
    }

    public boolean isOccupied() {
        return occupantCount > 0;
    }

    /** Free for a new building: terrain allows building and nothing stands here yet. */
    public boolean canPlace() {
        return buildable && occupantCount == 0;
    }

    void paint(int terrainTypeId, boolean walkable, boolean buildable, boolean blocksLight, int colorIndex) {
        this.terrainTypeId = terrainTypeId;
        this.terrainWalkable = walkable;
        this.buildable = buildable;
        this.blocksLight = blocksLight;
        this.colorIndex = colorIndex;
    }

    void addOccupant(boolean blocking) {
        occupantCount++;
        if (blocking) {
            blockingCount++;
        }
    }

    void removeOccupant(boolean blocking) {
        occupantCount = Math.max(0, occupantCount - 1);
        if (blocking) {
            blockingCount = Math.max(0, blockingCount - 1);
        }
    }
}
