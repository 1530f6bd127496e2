package com.example.pawnsim.snapshot;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.Simulation;
import com.example.pawnsim.engine.TimeService;
import com.example.pawnsim.entity.EntityStore;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.ActionDef;
import com.example.pawnsim.model.action.AnimationType;
import com.example.pawnsim.model.component.ActionComponent;
import com.example.pawnsim.model.component.BuildingComponent;
import com.example.pawnsim.model.component.GoldComponent;
import com.example.pawnsim.model.component.InventoryComponent;
import com.example.pawnsim.model.component.MoodComponent;
import com.example.pawnsim.model.component.PawnComponent;
import com.example.pawnsim.model.component.ResourceComponent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class RenderSnapshotBuilder {

    private RenderSnapshotBuilder() {
    }

    public static RenderSnapshot build(Simulation sim) {
        return RenderSnapshot.builder()
                .tick(sim.getTime().getTick())
                .time(time(sim.getTime()))
                .pawns(pawns(sim))
                .buildings(buildings(sim))
                .build();
    }

    private static RenderTime time(TimeService time) {
        return RenderTime.builder()
                .day(time.getDay())
                .hour(time.getHour())
                .minute(time.getMinute())
                .night(time.isNight())
                .timeString(time.getTimeString())
                .dayFraction(time.getDayFraction())
                .build();
    }

    private static List<RenderPawn> pawns(Simulation sim) {
        EntityStore entities = sim.getEntities();
        List<RenderPawn> result = new ArrayList<>();
        for (EntityId id : entities.allPawns()) {
            Optional<TileCoord> pos = entities.positionOf(id);
            if (pos.isEmpty()) {
                continue;
            }
            Optional<ActionComponent> ac = entities.getActions().get(id);
            ActionDef action = ac.map(ActionComponent::getCurrentAction).orElse(null);
            Optional<InventoryComponent> inventory = entities.getInventory().get(id);

            Map<String, Float> needs = new LinkedHashMap<>();
            entities.getNeeds().get(id).ifPresent(n -> n.asMap().forEach((needId, value) ->
                    needs.put(sim.getContent().getNeeds().find(needId).map(NeedDef::getName).orElse("#" + needId), value)));

            RenderPawn.RenderPawnBuilder pawn = RenderPawn.builder()
                    .id(id.getValue())
                    .name(entities.getPawns().get(id).map(PawnComponent::getName).orElse("Pawn " + id))
                    .x(pos.get().getX())
                    .y(pos.get().getY())
                    .mood(entities.getMoods().get(id).map(MoodComponent::getMood).orElse(0f))
                    .gold(entities.getGold().get(id).map(GoldComponent::getAmount).orElse(0))
                    .needs(needs)
                    .animation(action != null ? action.getAnimation() : AnimationType.IDLE)
                    .inventoryResource(inventory.map(InventoryComponent::getResourceType).orElse(null))
                    .inventoryAmount(inventory.map(InventoryComponent::getAmount).orElse(0));

            if (action != null) {
                pawn.currentAction(action.getDisplayName() != null ? action.getDisplayName() : action.getType().name())
                        .expression(action.getExpression())
                        .expressionIconDefId(action.getExpressionIconDefId())
                        .targetTile(action.getTargetCoord());
            }
            ac.filter(a -> a.getCurrentPath() != null).ifPresent(a -> pawn
                    .currentPath(List.copyOf(a.getCurrentPath()))
                    .pathIndex(a.getPathIndex()));
            result.add(pawn.build());
        }
        return result;
    }

    private static List<RenderBuilding> buildings(Simulation sim) {
        EntityStore entities = sim.getEntities();
        List<RenderBuilding> result = new ArrayList<>();
        for (EntityId id : entities.allBuildings()) {
            Optional<TileCoord> pos = entities.positionOf(id);
            Optional<BuildingComponent> building = entities.getBuildings().get(id);
            Optional<BuildingDef> def = building.flatMap(b -> sim.getContent().getBuildings().find(b.getBuildingDefId()));
            if (pos.isEmpty() || def.isEmpty()) {
                continue;
            }
            BuildingComponent bc = building.get();
            Optional<ResourceComponent> store = entities.getResources().get(id);
            String usedBy = bc.getUsedBy() == null ? null
                    : entities.getPawns().get(bc.getUsedBy()).map(PawnComponent::getName).orElse(null);

            result.add(RenderBuilding.builder()
                    .id(id.getValue())
                    .x(pos.get().getX())
                    .y(pos.get().getY())
                    .buildingDefId(bc.getBuildingDefId())
                    .name(def.get().getName())
                    .tileSize(def.get().getTileSize())
                    .inUse(bc.isInUse())
                    .usedByName(usedBy)
                    .colorIndex(bc.getColorIndex())
                    .resourceType(store.map(ResourceComponent::getResourceType).orElse(null))
                    .resourceAmount(store.map(ResourceComponent::getCurrentAmount).orElse(0))
                    .maxResourceAmount(store.map(ResourceComponent::getMaxAmount).orElse(0))
                    .gold(entities.getGold().get(id).map(GoldComponent::getAmount).orElse(0))
                    .build());
        }
        return result;
    }
}
