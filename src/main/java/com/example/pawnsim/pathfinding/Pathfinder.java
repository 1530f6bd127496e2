package com.example.pawnsim.pathfinding;

import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.world.World;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* over the 4-connected tile grid with unit step cost and a Manhattan heuristic.
 * Ties on f are broken by discovery order, so identical inputs always give the identical path.
 */
public final class Pathfinder {

    public static final int DEFAULT_MAX_EXPLORED = 10_000;

    private static final int[][] DIRECTIONS = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};

    private static final Comparator<Node> ORDER = Comparator
            .comparingInt((Node n) -> n.f)
            .thenComparingLong(n -> n.seq);

    private Pathfinder() {
    }

    public static Optional<List<TileCoord>> findPath(World world, TileCoord start, TileCoord goal, Set<TileCoord> blocked) {
        return findPath(world, start, goal, blocked, DEFAULT_MAX_EXPLORED);
    }

    /**
     * @param blocked extra impassable tiles, typically other pawns. The goal is never treated as blocked.
     * @return the path including both endpoints, or empty when the goal cannot be reached
     *         within {@code maxExplored} expanded nodes
     */
    public static Optional<List<TileCoord>> findPath(World world, TileCoord start, TileCoord goal,
                                                     Set<TileCoord> blocked, int maxExplored) {
        if (start.equals(goal)) {
            return Optional.of(List.of(start));
        }
        if (!world.isWalkable(goal)) {
            return Optional.empty();
        }

        PriorityQueue<Node> open = new PriorityQueue<>(ORDER);
        Map<TileCoord, Integer> bestG = new HashMap<>();
        Map<TileCoord, TileCoord> cameFrom = new HashMap<>();
        long seq = 0;

        open.add(new Node(start, 0, start.manhattan(goal), seq++));
        bestG.put(start, 0);
        int explored = 0;

        while (!open.isEmpty()) {
            Node current = open.poll();
            if (current.g > bestG.getOrDefault(current.coord, Integer.MAX_VALUE)) {
                continue; // stale entry
            }
            if (current.coord.equals(goal)) {
                return Optional.of(reconstruct(cameFrom, goal));
            }
            if (++explored > maxExplored) {
                return Optional.empty();
            }
            for (int[] d : DIRECTIONS) {
                TileCoord next = current.coord.offset(d[0], d[1]);
                if (!world.isWalkable(next)) {
                    continue;
                }
                if (!next.equals(goal) && blocked.contains(next)) {
                    continue;
                }
                int g = current.g + 1;
                if (g < bestG.getOrDefault(next, Integer.MAX_VALUE)) {
                    bestG.put(next, g);
                    cameFrom.put(next, current.coord);
                    open.add(new Node(next, g, g + next.manhattan(goal), seq++));
                }
            }
        }
        return Optional.empty();
    }

    private static List<TileCoord> reconstruct(Map<TileCoord, TileCoord> cameFrom, TileCoord end) {
        List<TileCoord> path = new ArrayList<>();
        TileCoord current = end;
        path.add(current);
        while (cameFrom.containsKey(current)) {
            current = cameFrom.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    private static final class Node {
        final TileCoord coord;
        final int g;
        final int f;
        final long seq;

        Node(TileCoord coord, int g, int f, long seq) {
            this.coord = coord;
            this.g = g;
            this.f = f;
            this.seq = seq;
        }
    }
}
