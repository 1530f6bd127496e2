package com.example.pawnsim.world;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.model.TileCoord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class BuildingFootprint {

    private static final int[][] DIRECTIONS = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    private BuildingFootprint() {
    }

    public static List<TileCoord> occupiedTiles(TileCoord anchor, BuildingDef def) {
        int size = Math.max(1, def.getTileSize());
        List<TileCoord> tiles = new ArrayList<>(size * size);
        for (int dy = 0; dy < size; dy++) {
            for (int dx = 0; dx < size; dx++) {
                tiles.add(anchor.offset(dx, dy));
            }
        }
        return tiles;
    }

    /**
     * Explicit use-area offsets when the definition has them, otherwise every tile
     * Manhattan-adjacent to the footprint (and the footprint itself for walkable buildings).
     */
    public static List<TileCoord> useAreaTiles(TileCoord anchor, BuildingDef def) {
        if (def.getUseAreas() != null && !def.getUseAreas().isEmpty()) {
            List<TileCoord> tiles = new ArrayList<>();
            for (TileCoord offset : def.getUseAreas()) {
                tiles.add(anchor.offset(offset.getX(), offset.getY()));
            }
            return tiles;
        }
        List<TileCoord> footprint = occupiedTiles(anchor, def);
        Set<TileCoord> covered = new LinkedHashSet<>(footprint);
        Set<TileCoord> result = new LinkedHashSet<>();
        for (TileCoord tile : footprint) {
            for (int[] d : DIRECTIONS) {
                TileCoord next = tile.offset(d[0], d[1]);
                if (!covered.contains(next)) {
                    result.add(next);
                }
            }
        }
        if (def.isWalkable()) {
            result.addAll(footprint);
        }
        return new ArrayList<>(result);
    }
}
