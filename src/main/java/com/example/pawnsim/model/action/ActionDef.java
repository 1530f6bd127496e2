package com.example.pawnsim.model.action;

import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder(toBuilder = true)
public class ActionDef {

    ActionType type;

    @Builder.Default
    AnimationType animation = AnimationType.IDLE;

    TileCoord targetCoord;
    EntityId targetEntity;

    // PickUp: building to take from (null when harvesting terrain at targetCoord). DropOff: building the load came from.
    EntityId sourceEntity;

    int durationTicks;
    Integer satisfiesNeedId;
    float needSatisfactionAmount;

    @With
    String displayName;

    ExpressionType expression;
    Integer expressionIconDefId;

    String resourceType;
    int resourceAmount;

    // Low-priority roaming; yields to goal-directed pawns when blocked.
    boolean wander;

    public static ActionDef idle(int durationTicks, String displayName) {
        return ActionDef.builder()
                .type(ActionType.IDLE)
                .durationTicks(durationTicks)
                .displayName(displayName)
                .build();
    }

    public static ActionDef idle(int durationTicks, String displayName, ExpressionType expression, Integer iconDefId) {
        return ActionDef.builder()
                .type(ActionType.IDLE)
                .durationTicks(durationTicks)
                .displayName(displayName)
                .expression(expression)
                .expressionIconDefId(iconDefId)
                .build();
    }

    public static ActionDef moveTo(TileCoord target, String displayName) {
        return ActionDef.builder()
                .type(ActionType.MOVE_TO)
                .animation(AnimationType.WALK)
                .targetCoord(target)
                .displayName(displayName)
                .build();
    }

    public static ActionDef wander(TileCoord target) {
        return moveTo(target, "Wandering").toBuilder().wander(true).build();
    }

    public static ActionDef useBuilding(EntityId building, int durationTicks, Integer needId, float amount, String displayName) {
        return ActionDef.builder()
                .type(ActionType.USE_BUILDING)
                .targetEntity(building)
                .durationTicks(durationTicks)
                .satisfiesNeedId(needId)
                .needSatisfactionAmount(amount)
                .displayName(displayName)
                .build();
    }

    public static ActionDef work(EntityId building, int durationTicks, Integer needId, float amount, String displayName) {
        return ActionDef.builder()
                .type(ActionType.WORK)
                .animation(AnimationType.PICKAXE)
                .targetEntity(building)
                .durationTicks(durationTicks)
                .satisfiesNeedId(needId)
                .needSatisfactionAmount(amount)
                .displayName(displayName)
                .build();
    }

    // Takes from a building's store.
    public static ActionDef pickUpFromBuilding(EntityId source, String resourceType, int amount, int durationTicks, String displayName) {
        return ActionDef.builder()
                .type(ActionType.PICK_UP)
                .animation(AnimationType.LOOK_DOWN)
                .sourceEntity(source)
                .resourceType(resourceType)
                .resourceAmount(amount)
                .durationTicks(durationTicks)
                .displayName(displayName)
                .build();
    }

    // Harvests from an inexhaustible terrain tile.
    public static ActionDef pickUpFromTerrain(TileCoord tile, String resourceType, int amount, int durationTicks, String displayName) {
        return ActionDef.builder()
                .type(ActionType.PICK_UP)
                .animation(AnimationType.AXE)
                .targetCoord(tile)
                .resourceType(resourceType)
                .resourceAmount(amount)
                .durationTicks(durationTicks)
                .displayName(displayName)
                .build();
    }

    public static ActionDef dropOff(EntityId destination, EntityId source, String resourceType, int amount,
                                    int durationTicks, Integer needId, float needAmount, String displayName) {
        return ActionDef.builder()
                .type(ActionType.DROP_OFF)
                .animation(AnimationType.LOOK_DOWN)
                .targetEntity(destination)
                .sourceEntity(source)
                .resourceType(resourceType)
                .resourceAmount(amount)
                .durationTicks(durationTicks)
                .satisfiesNeedId(needId)
                .needSatisfactionAmount(needAmount)
                .displayName(displayName)
                .build();
    }
}
