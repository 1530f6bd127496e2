package com.example.pawnsim.world;

class Chunk {

    static final int SIZE = 32;

    private final Tile[] tiles = new Tile[SIZE * SIZE];

    Tile getOrCreate(int localX, int localY, int defaultTerrainId) {
        int index = localY * SIZE + localX;
        Tile tile = tiles[index];
        if (tile == null) {
            tile = new Tile(defaultTerrainId);
            tiles[index] = tile;
        }
        return tile;
    }
}
