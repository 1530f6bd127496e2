package com.example.pawnsim.service;

import com.example.pawnsim.config.SimulationProperties;
import com.example.pawnsim.content.ContentRegistry;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.BuildingPlacement;
import com.example.pawnsim.engine.PawnConfig;
import com.example.pawnsim.engine.Simulation;
import com.example.pawnsim.engine.SimulationConfig;
import com.example.pawnsim.engine.WorldBounds;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.snapshot.RenderSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
public class WorldService {

    @Autowired
    private ContentRegistry content;

    @Autowired
    private SimulationProperties properties;

    private Simulation simulation;

    @PostConstruct
    public void init() {
        initializeWorld();
    }

    public synchronized void initializeWorld() {
        log.info(">>> Building world...");
        Simulation sim = new Simulation(content, toConfig());
        for (SimulationProperties.TerrainPatch patch : properties.getTerrain()) {
            int terrainId = content.getTerrains().findId(patch.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown terrain key: " + patch.getKey()));
            for (int dy = 0; dy < patch.getHeight(); dy++) {
                for (int dx = 0; dx < patch.getWidth(); dx++) {
                    sim.paintTerrain(patch.getX() + dx, patch.getY() + dy, terrainId, patch.getColorIndex());
                }
            }
        }
        this.simulation = sim;
        log.info(">>> World ready: {} pawns, {} buildings", sim.getEntities().allPawns().size(),
                sim.getEntities().allBuildings().size());
    }

    public synchronized void tick() {
        simulation.tick();
    }

    public synchronized RenderSnapshot snapshot() {
        return simulation.createRenderSnapshot();
    }

    // Adds a pawn whose needs are given by need name.
    // @throws IllegalArgumentException for unknown need names or a position outside the world
    public synchronized EntityId spawnPawn(String name, int age, int x, int y, Map<String, Float> needsByName, Integer gold) {
        Map<Integer, Float> needs = new LinkedHashMap<>();
        if (needsByName != null) {
            needsByName.forEach((needName, value) -> {
                NeedDef need = content.findNeedByName(needName)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown need: " + needName));
                needs.put(need.getId(), value);
            });
        }
        PawnConfig.PawnConfigBuilder config = PawnConfig.builder().name(name).age(age).x(x).y(y).needs(needs);
        if (gold != null) {
            config.gold(gold);
        }
        EntityId id = simulation.createPawn(config.build());
        log.info("Spawned pawn {} ({}) at ({},{})", name, id, x, y);
        return id;
    }

    public synchronized Simulation getSimulation() {
        return simulation;
    }

    private SimulationConfig toConfig() {
        SimulationConfig.SimulationConfigBuilder builder = SimulationConfig.builder()
                .seed(properties.getSeed())
                .startHour(properties.getStartHour())
                .bounds(new WorldBounds(properties.getMinX(), properties.getMaxX(), properties.getMinY(), properties.getMaxY()))
                .paletteSize(properties.getPaletteSize())
                .skipDefaultBootstrap(properties.isSkipBootstrap());
        for (SimulationProperties.PlacedBuilding placed : properties.getBuildings()) {
            int defId = content.getBuildings().findId(placed.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown building key: " + placed.getKey()));
            builder.building(new BuildingPlacement(defId, placed.getX(), placed.getY(), placed.getColorIndex()));
        }
        return builder.build();
    }
}
