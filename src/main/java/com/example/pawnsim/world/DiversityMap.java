package com.example.pawnsim.world;

import com.example.pawnsim.model.TileCoord;

import java.util.HashSet;
import java.util.Set;

public class DiversityMap {

    private int[] scores = new int[0];
    private long computedVersion = -1;
    private int originX;
    private int originY;
    private int width;

    public int get(World world, TileCoord coord) {
        if (!world.isInBounds(coord)) {
            return 0;
        }
        refresh(world);
        return scores[(coord.getY() - originY) * width + (coord.getX() - originX)];
    }

    private void refresh(World world) {
        if (computedVersion == world.getTerrainVersion() && width == world.getWidth()) {
            return;
        }
        originX = world.getMinX();
        originY = world.getMinY();
        width = world.getWidth();
        scores = new int[width * world.getHeight()];
        for (int y = world.getMinY(); y <= world.getMaxY(); y++) {
            for (int x = world.getMinX(); x <= world.getMaxX(); x++) {
                scores[(y - originY) * width + (x - originX)] = score(world, x, y);
            }
        }
        computedVersion = world.getTerrainVersion();
    }

    private static int score(World world, int x, int y) {
        Set<Long> seen = new HashSet<>();
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                TileCoord c = TileCoord.of(x + dx, y + dy);
                if (world.isInBounds(c)) {
                    Tile tile = world.getTile(c);
                    seen.add(((long) tile.getTerrainTypeId() << 32) | (tile.getColorIndex() & 0xffffffffL));
                }
            }
        }
        return Math.max(0, seen.size() - 1);
    }
}
