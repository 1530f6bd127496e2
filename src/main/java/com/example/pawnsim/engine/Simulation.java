package com.example.pawnsim.engine;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.content.ContentRegistry;
import com.example.pawnsim.content.DefaultContent;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.content.TerrainDef;
import com.example.pawnsim.engine.system.ActionSystem;
import com.example.pawnsim.engine.system.AiSystem;
import com.example.pawnsim.engine.system.BuffSystem;
import com.example.pawnsim.engine.system.MoodSystem;
import com.example.pawnsim.engine.system.NeedsSystem;
import com.example.pawnsim.engine.system.ProximitySocialSystem;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.component.BuildingComponent;
import com.example.pawnsim.snapshot.RenderSnapshot;
import com.example.pawnsim.snapshot.RenderSnapshotBuilder;
import com.example.pawnsim.world.BuildingFootprint;
import com.example.pawnsim.world.DiversityMap;
import com.example.pawnsim.world.World;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * One self-contained simulation: world, entities, clock, random source and the system pipeline.
 * Systems run in a fixed order every tick: needs, social, buffs, mood, actions, AI.
 */
@Slf4j
@Getter
public class Simulation {

    private final ContentRegistry content;
    private final World world;
    private final EntityStore entities = new EntityStore();
    private final TimeService time;
    private final long seed;
    private final Random random;
    private final DiversityMap diversity = new DiversityMap();
    private final SystemScheduler scheduler = new SystemScheduler();

    public Simulation(ContentRegistry content) {
        this(content, SimulationConfig.defaults());
    }

    public Simulation(ContentRegistry content, SimulationConfig config) {
        if (content == null) {
            throw new IllegalArgumentException("Content registry is required");
        }
        SimulationConfig cfg = config != null ? config : SimulationConfig.defaults();
        this.content = content;
        this.time = new TimeService(cfg.getStartHour());
        this.seed = cfg.getSeed() != null ? cfg.getSeed() : System.nanoTime();
        this.random = new Random(seed);

        WorldBounds bounds = cfg.getBounds() != null ? cfg.getBounds() : WorldBounds.DEFAULT;
        this.world = new World(bounds.getMinX(), bounds.getMaxX(), bounds.getMinY(), bounds.getMaxY(),
                content.defaultTerrainId(), cfg.getPaletteSize());

        scheduler.add(new NeedsSystem());
        scheduler.add(new ProximitySocialSystem());
        scheduler.add(new BuffSystem());
        scheduler.add(new MoodSystem());
        scheduler.add(new ActionSystem());
        scheduler.add(new AiSystem());

        if (!cfg.isSkipDefaultBootstrap()) {
            bootstrapPawns();
        }
        if (cfg.getBuildings() != null) {
            for (BuildingPlacement placement : cfg.getBuildings()) {
                createBuilding(placement.getBuildingDefId(), placement.getX(), placement.getY(), placement.getColorIndex());
            }
        }
        if (cfg.getPawns() != null) {
            for (PawnConfig pawn : cfg.getPawns()) {
                createPawn(pawn);
            }
        }
        log.info("Simulation created: seed={}, bounds={}x{}, start={}, pawns={}, buildings={}",
                seed, world.getWidth(), world.getHeight(), time.getTimeString(),
                entities.allPawns().size(), entities.allBuildings().size());
    }

    public void tick() {
        scheduler.tickAll(new SimContext(this));
        time.advance();
    }

    public SimContext context() {
        return new SimContext(this);
    }

    /**
     * Places a building with its anchor at (x, y).
     *
     * @throws IllegalArgumentException for an unknown definition or a footprint leaving the world
     * @throws IllegalStateException when any footprint tile is occupied or not buildable
     */
    public EntityId createBuilding(int buildingDefId, int x, int y, int colorIndex) {
        BuildingDef def = content.getBuildings().find(buildingDefId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown building definition id: " + buildingDefId));
        TileCoord anchor = TileCoord.of(x, y);
        List<TileCoord> footprint = BuildingFootprint.occupiedTiles(anchor, def);
        for (TileCoord tile : footprint) {
            if (!world.isInBounds(tile)) {
                throw new IllegalArgumentException("Cannot place " + def.getName() + " at " + anchor + ": " + tile + " is out of bounds");
            }
            if (!world.getTile(tile).canPlace()) {
                throw new IllegalStateException("Cannot place " + def.getName() + " at " + anchor + ": " + tile + " is occupied or unbuildable");
            }
        }
        int safeColor = Math.max(0, Math.min(world.getPaletteSize() - 1, colorIndex));
        EntityId id = entities.createBuilding(anchor, def, safeColor);
        for (TileCoord tile : footprint) {
            world.addOccupant(tile, !def.isWalkable());
        }
        return id;
    }

    public EntityId createBuilding(int buildingDefId, int x, int y) {
        return createBuilding(buildingDefId, x, y, 0);
    }

    /**
     * @throws IllegalArgumentException for unknown need ids or a position outside the world
     */
    public EntityId createPawn(PawnConfig config) {
        Map<Integer, Float> needs = config.getNeeds() != null ? config.getNeeds() : Map.of();
        for (Integer needId : needs.keySet()) {
            if (!content.getNeeds().contains(needId)) {
                throw new IllegalArgumentException("Unknown need definition id: " + needId);
            }
        }
        TileCoord coord = TileCoord.of(config.getX(), config.getY());
        if (!world.isInBounds(coord)) {
            throw new IllegalArgumentException("Cannot place pawn " + config.getName() + " outside the world at " + coord);
        }
        return entities.createPawn(coord, config.getName(), config.getAge(), needs, config.getGold());
    }

    /**
     * Removes an entity. Buildings give their tiles back and any pawn using one is left to
     * notice the missing target on its next action tick. A destroyed pawn drops every
     * building claim it held.
     */
    public void destroyEntity(EntityId id) {
        for (EntityId other : entities.allBuildings()) {
            entities.getBuildings().get(other)
                    .filter(b -> b.isInUse() && id.equals(b.getUsedBy()))
                    .ifPresent(BuildingComponent::release);
        }
        Optional<BuildingComponent> building = entities.getBuildings().get(id);
        Optional<TileCoord> anchor = entities.positionOf(id);
        if (building.isPresent() && anchor.isPresent()) {
            content.getBuildings().find(building.get().getBuildingDefId()).ifPresent(def -> {
                for (TileCoord tile : BuildingFootprint.occupiedTiles(anchor.get(), def)) {
                    world.removeOccupant(tile, !def.isWalkable());
                }
            });
        }
        entities.destroy(id);
    }

    /** Deletes the building covering the tile, if there is one. */
    public boolean tryDeleteBuildingAt(int x, int y) {
        Optional<EntityId> building = buildingAt(TileCoord.of(x, y));
        building.ifPresent(this::destroyEntity);
        return building.isPresent();
    }

    public Optional<EntityId> buildingAt(TileCoord coord) {
        for (EntityId id : entities.allBuildings()) {
            Optional<BuildingDef> def = entities.getBuildings().get(id)
                    .flatMap(b -> content.getBuildings().find(b.getBuildingDefId()));
            Optional<TileCoord> anchor = entities.positionOf(id);
            if (def.isPresent() && anchor.isPresent()
                    && BuildingFootprint.occupiedTiles(anchor.get(), def.get()).contains(coord)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Repaints a tile. Tiles outside the world are ignored.
     *
     * @throws IllegalArgumentException for an unknown terrain id
     */
    public void paintTerrain(int x, int y, int terrainDefId, int colorIndex) {
        TerrainDef terrain = content.getTerrains().find(terrainDefId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown terrain definition id: " + terrainDefId));
        TileCoord coord = TileCoord.of(x, y);
        if (world.isInBounds(coord)) {
            world.paintTerrain(coord, terrain, colorIndex);
        }
    }

    public RenderSnapshot createRenderSnapshot() {
        return RenderSnapshotBuilder.build(this);
    }

    private void bootstrapPawns() {
        int[] needIds = {
                requireNeed(DefaultContent.HUNGER),
                requireNeed(DefaultContent.ENERGY),
                requireNeed(DefaultContent.FUN),
                requireNeed(DefaultContent.SOCIAL),
                requireNeed(DefaultContent.HYGIENE),
                content.findNeedByName(DefaultContent.PURPOSE).map(NeedDef::getId).orElse(-1)
        };
        // hunger, energy, fun, social, hygiene, purpose
        bootstrapPawn("Alex", 25, 5, 5, needIds, 70f, 60f, 50f, 80f, 65f, 60f);
        bootstrapPawn("Jordan", 32, 3, 7, needIds, 55f, 75f, 40f, 60f, 70f, 45f);
        bootstrapPawn("Sam", 28, 9, 3, needIds, 80f, 45f, 65f, 50f, 85f, 70f);
        bootstrapPawn("Riley", 22, 7, 9, needIds, 60f, 55f, 75f, 70f, 50f, 35f);
    }

    private void bootstrapPawn(String name, int age, int x, int y, int[] needIds, float... values) {
        Map<Integer, Float> needs = new LinkedHashMap<>();
        for (int i = 0; i < needIds.length; i++) {
            if (needIds[i] >= 0) {
                needs.put(needIds[i], values[i]);
            }
        }
        createPawn(PawnConfig.builder().name(name).age(age).x(x).y(y).needs(needs).build());
    }

    private int requireNeed(String name) {
        return content.findNeedByName(name)
                .map(NeedDef::getId)
                .orElseThrow(() -> new IllegalStateException("Required need '" + name + "' not found in content"));
    }
}
