package com.example.pawnsim.snapshot;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RenderSnapshot {

    long tick;
    RenderTime time;
    List<RenderPawn> pawns;
    List<RenderBuilding> buildings;
}
