package com.example.pawnsim.model;

import lombok.Value;

@Value
public class TileCoord {

    int x;
    int y;

    public static TileCoord of(int x, int y) {
        return new TileCoord(x, y);
    }

    public TileCoord offset(int dx, int dy) {
        return new TileCoord(x + dx, y + dy);
    }

    public int manhattan(TileCoord other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
