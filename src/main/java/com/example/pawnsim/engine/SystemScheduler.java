package com.example.pawnsim.engine;

import java.util.ArrayList;
import java.util.List;

public class SystemScheduler {

    private final List<SimSystem> systems = new ArrayList<>();

    public void add(SimSystem system) {
        systems.add(system);
    }

    public void tickAll(SimContext ctx) {
        for (SimSystem system : systems) {
            system.tick(ctx);
        }
    }
}
