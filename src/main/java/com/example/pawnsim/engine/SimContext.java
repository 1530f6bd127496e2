package com.example.pawnsim.engine;

import com.example.pawnsim.content.ContentRegistry;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.world.DiversityMap;
import com.example.pawnsim.world.World;

import java.util.Random;

public class SimContext {

    private final Simulation sim;

    public SimContext(Simulation sim) {
        this.sim = sim;
    }

    public Simulation getSim() {
        return sim;
    }

    public ContentRegistry getContent() {
        return sim.getContent();
    }

    public EntityStore getEntities() {
        return sim.getEntities();
    }

    public World getWorld() {
        return sim.getWorld();
    }

    public TimeService getTime() {
        return sim.getTime();
    }

    public Random getRandom() {
        return sim.getRandom();
    }

    public DiversityMap getDiversity() {
        return sim.getDiversity();
    }

    public long now() {
        return sim.getTime().getTick();
    }
}
