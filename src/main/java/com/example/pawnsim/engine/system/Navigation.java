package com.example.pawnsim.engine.system;

import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.pathfinding.Pathfinder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class Navigation {

    private static final int[][] ADJACENT = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    private Navigation() {
    }

    /**
     * Nearest (by Manhattan distance) walkable tile among {@code tiles} that no other pawn stands on
     * and that has a path from {@code from}.
     */
    static Optional<TileCoord> nearestReachable(SimContext ctx, EntityId pawn, TileCoord from, List<TileCoord> tiles) {
        Set<TileCoord> occupied = ctx.getEntities().pawnTiles(pawn);
        List<TileCoord> candidates = new ArrayList<>();
        for (TileCoord tile : tiles) {
            if (ctx.getWorld().isWalkable(tile) && !occupied.contains(tile)) {
                candidates.add(tile);
            }
        }
        candidates.sort(Comparator.comparingInt(from::manhattan));
        for (TileCoord tile : candidates) {
            if (Pathfinder.findPath(ctx.getWorld(), from, tile, occupied).isPresent()) {
                return Optional.of(tile);
            }
        }
        return Optional.empty();
    }

    /** Tiles a terrain harvest point can be worked from: the tile itself, or its neighbours when it blocks movement. */
    static List<TileCoord> harvestTiles(SimContext ctx, TileCoord tile) {
        if (ctx.getWorld().isWalkable(tile)) {
            return List.of(tile);
        }
        List<TileCoord> around = new ArrayList<>();
        for (int[] d : ADJACENT) {
            around.add(tile.offset(d[0], d[1]));
        }
        return around;
    }
}
