package com.example.pawnsim.snapshot;

import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.AnimationType;
import com.example.pawnsim.model.action.ExpressionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class RenderPawn {

    int id;
    String name;
    int x;
    int y;
    float mood;
    int gold;

    // Need values keyed by need name.
    Map<String, Float> needs;

    String currentAction;
    AnimationType animation;
    ExpressionType expression;
    Integer expressionIconDefId;

    // debug: pathfinding
    TileCoord targetTile;
    List<TileCoord> currentPath;
    int pathIndex;

    String inventoryResource;
    int inventoryAmount;
}
