package com.example.pawnsim.engine;

import com.example.pawnsim.entity.EntityStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PawnConfig {

    @Builder.Default
    private String name = "Pawn";

    @Builder.Default
    private int age = 25;

    private int x;
    private int y;

    /** Starting need values keyed by need definition id. */
    @Builder.Default
    private Map<Integer, Float> needs = new LinkedHashMap<>();

    @Builder.Default
    private int gold = EntityStore.DEFAULT_PAWN_GOLD;
}
