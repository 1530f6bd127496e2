package com.example.pawnsim.world;

import com.example.pawnsim.content.TerrainDef;
import com.example.pawnsim.model.TileCoord;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class World {

    @Getter
    private final int minX;
    @Getter
    private final int maxX;
    @Getter
    private final int minY;
    @Getter
    private final int maxY;
    @Getter
    private final int paletteSize;

    private final int defaultTerrainId;
    private final Map<Long, Chunk> chunks = new HashMap<>();

    // bumped on every terrain change so derived maps know to recompute
    @Getter
    private long terrainVersion;

    public World(int minX, int maxX, int minY, int maxY, int defaultTerrainId, int paletteSize) {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException("World bounds are empty: x " + minX + ".." + maxX + ", y " + minY + ".." + maxY);
        }
        if (paletteSize <= 0) {
            throw new IllegalArgumentException("Palette size must be positive, was " + paletteSize);
        }
        this.minX = minX;
        this.maxX = maxX;
        this.minY = minY;
        this.maxY = maxY;
        this.defaultTerrainId = defaultTerrainId;
        this.paletteSize = paletteSize;
    }

    public int getWidth() {
        return maxX - minX + 1;
    }

    public int getHeight() {
        return maxY - minY + 1;
    }

    public boolean isInBounds(TileCoord coord) {
        return coord.getX() >= minX && coord.getX() <= maxX && coord.getY() >= minY && coord.getY() <= maxY;
    }

    public boolean isWalkable(TileCoord coord) {
        return isInBounds(coord) && getTile(coord).isWalkable();
    }

    public Tile getTile(int x, int y) {
        int cx = Math.floorDiv(x, Chunk.SIZE);
        int cy = Math.floorDiv(y, Chunk.SIZE);
        Chunk chunk = chunks.computeIfAbsent(chunkKey(cx, cy), k -> new Chunk());
        return chunk.getOrCreate(Math.floorMod(x, Chunk.SIZE), Math.floorMod(y, Chunk.SIZE), defaultTerrainId);
    }

    public Tile getTile(TileCoord coord) {
        return getTile(coord.getX(), coord.getY());
    }

    /**
     * Rewrites a tile's terrain flags from the definition. The colour index is clamped into the palette.
     */
    public void paintTerrain(TileCoord coord, TerrainDef terrain, int colorIndex) {
        if (!isInBounds(coord)) {
            throw new IllegalArgumentException("Cannot paint outside the world: " + coord);
        }
        int clamped = Math.max(0, Math.min(paletteSize - 1, colorIndex));
        getTile(coord).paint(terrain.getId(), terrain.isWalkable(), terrain.isBuildable(), terrain.isBlocksLight(), clamped);
        terrainVersion++;
    }

    public void addOccupant(TileCoord coord, boolean blocking) {
        getTile(coord).addOccupant(blocking);
    }

    public void removeOccupant(TileCoord coord, boolean blocking) {
        getTile(coord).removeOccupant(blocking);
    }

    /** In-bounds tiles painted with the given terrain, in row-major order. */
    public List<TileCoord> tilesWithTerrain(int terrainId) {
        List<TileCoord> result = new ArrayList<>();
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                if (getTile(x, y).getTerrainTypeId() == terrainId) {
                    result.add(TileCoord.of(x, y));
                }
            }
        }
        return result;
    }

    private static long chunkKey(int cx, int cy) {
        return ((long) cx << 32) ^ (cy & 0xffffffffL);
    }
}
