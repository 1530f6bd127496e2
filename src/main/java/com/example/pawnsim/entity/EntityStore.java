package com.example.pawnsim.entity;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.component.ActionComponent;
import com.example.pawnsim.model.component.AttachmentComponent;
import com.example.pawnsim.model.component.BuffComponent;
import com.example.pawnsim.model.component.BuildingComponent;
import com.example.pawnsim.model.component.GoldComponent;
import com.example.pawnsim.model.component.InventoryComponent;
import com.example.pawnsim.model.component.MoodComponent;
import com.example.pawnsim.model.component.NeedsComponent;
import com.example.pawnsim.model.component.PawnComponent;
import com.example.pawnsim.model.component.PositionComponent;
import com.example.pawnsim.model.component.ResourceComponent;
import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Getter
public class EntityStore {

    public static final int DEFAULT_PAWN_GOLD = 100;

    private int nextId = 1;

    private final ComponentTable<PositionComponent> positions = new ComponentTable<>();
    private final ComponentTable<PawnComponent> pawns = new ComponentTable<>();
    private final ComponentTable<NeedsComponent> needs = new ComponentTable<>();
    private final ComponentTable<MoodComponent> moods = new ComponentTable<>();
    private final ComponentTable<BuffComponent> buffs = new ComponentTable<>();
    private final ComponentTable<ActionComponent> actions = new ComponentTable<>();
    private final ComponentTable<BuildingComponent> buildings = new ComponentTable<>();
    private final ComponentTable<ResourceComponent> resources = new ComponentTable<>();
    private final ComponentTable<AttachmentComponent> attachments = new ComponentTable<>();
    private final ComponentTable<GoldComponent> gold = new ComponentTable<>();
    private final ComponentTable<InventoryComponent> inventory = new ComponentTable<>();

    public EntityId create() {
        return EntityId.of(nextId++);
    }

    public EntityId createPawn(TileCoord position, String name, int age, Map<Integer, Float> initialNeeds, int startingGold) {
        EntityId id = create();
        pawns.put(id, new PawnComponent(name, age));
        positions.put(id, new PositionComponent(position));
        moods.put(id, new MoodComponent());
        needs.put(id, new NeedsComponent(initialNeeds));
        buffs.put(id, new BuffComponent());
        actions.put(id, new ActionComponent());
        gold.put(id, new GoldComponent(startingGold));
        inventory.put(id, new InventoryComponent());
        return id;
    }

    // Creates the entity rows only; tile occupancy is the caller's job. Resource stores start full.
    public EntityId createBuilding(TileCoord anchor, BuildingDef def, int colorIndex) {
        EntityId id = create();
        positions.put(id, new PositionComponent(anchor));
        buildings.put(id, new BuildingComponent(def.getId(), colorIndex));
        gold.put(id, new GoldComponent(def.getStartingGold()));
        attachments.put(id, new AttachmentComponent());
        if (def.hasResource()) {
            resources.put(id, new ResourceComponent(def.getResourceType(), def.getMaxResourceAmount(), def.getMaxResourceAmount()));
        }
        return id;
    }

    // Removes every component of the id. Safe to call more than once.
    public void destroy(EntityId id) {
        positions.remove(id);
        pawns.remove(id);
        needs.remove(id);
        moods.remove(id);
        buffs.remove(id);
        actions.remove(id);
        buildings.remove(id);
        resources.remove(id);
        attachments.remove(id);
        gold.remove(id);
        inventory.remove(id);
    }

    public boolean exists(EntityId id) {
        return positions.contains(id) || pawns.contains(id) || buildings.contains(id);
    }

    public List<EntityId> allPawns() {
        return pawns.ids();
    }

    public List<EntityId> allBuildings() {
        return buildings.ids();
    }

    public Optional<TileCoord> positionOf(EntityId id) {
        return positions.get(id).map(PositionComponent::getCoord);
    }

    public Optional<EntityId> pawnAt(TileCoord coord, EntityId exclude) {
        for (EntityId pawn : pawns.ids()) {
            if (pawn.equals(exclude)) {
                continue;
            }
            if (positionOf(pawn).filter(coord::equals).isPresent()) {
                return Optional.of(pawn);
            }
        }
        return Optional.empty();
    }

    // Tiles currently stood on by pawns other than exclude.
    public Set<TileCoord> pawnTiles(EntityId exclude) {
        Set<TileCoord> tiles = new HashSet<>();
        for (EntityId pawn : pawns.ids()) {
            if (!pawn.equals(exclude)) {
                positionOf(pawn).ifPresent(tiles::add);
            }
        }
        return tiles;
    }
}
