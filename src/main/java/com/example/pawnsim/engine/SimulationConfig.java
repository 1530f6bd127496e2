package com.example.pawnsim.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationConfig {

    private boolean skipDefaultBootstrap;

    /** Null picks a seed from the clock. */
    private Long seed;

    @Builder.Default
    private WorldBounds bounds = WorldBounds.DEFAULT;

    @Builder.Default
    private int startHour = TimeService.DEFAULT_START_HOUR;

    @Builder.Default
    private int paletteSize = 8;

    @Singular
    private List<BuildingPlacement> buildings;

    @Singular
    private List<PawnConfig> pawns;

    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }
}
