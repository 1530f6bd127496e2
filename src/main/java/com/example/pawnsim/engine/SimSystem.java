package com.example.pawnsim.engine;

public interface SimSystem {

    void tick(SimContext ctx);
}
