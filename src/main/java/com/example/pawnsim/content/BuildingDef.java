package com.example.pawnsim.content;

import com.example.pawnsim.model.TileCoord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildingDef implements ContentDef {

    private static final double COST_GROWTH = 1.15;

    private int id;
    private String name;

    private Integer satisfiesNeedId;

    @Builder.Default
    private float needSatisfactionAmount = 30f;

    @Builder.Default
    private int interactionDurationTicks = 100;

    private Integer grantsBuffId;
    private Integer workBuffId;

    // Side length of the square footprint anchored at the placement tile.
    @Builder.Default
    private int tileSize = 1;

    // Offsets relative to the anchor tile; empty means every tile bordering the footprint.
    @Builder.Default
    private List<TileCoord> useAreas = new ArrayList<>();

    private boolean walkable;

    // economy
    @Builder.Default
    private int baseCost = 10;

    @Builder.Default
    private float baseProduction = 1.0f;

    @Builder.Default
    private int startingGold = 100;

    @Builder.Default
    private boolean canSellToConsumers = true;

    private float wholesalePricePerUnit;

    // resource store
    private String resourceType;

    @Builder.Default
    private int maxResourceAmount = 100;

    @Builder.Default
    private float depletionMult = 1.0f;

    @Builder.Default
    private int resourcePerUse = 10;

    // work
    private boolean canBeWorkedAt;

    @Builder.Default
    private BuildingWorkType workType = BuildingWorkType.DIRECT;

    @Builder.Default
    private int workProduction = 20;

    @Builder.Default
    private int workDurationTicks = 100;

    @Builder.Default
    private float workSatisfactionAmount = 30f;

    private String haulSourceResourceType;
    private String haulSourceTerrainKey;

    public int cost(int level) {
        return (int) Math.floor(baseCost * Math.pow(COST_GROWTH, level));
    }

    public int getCost() {
        return cost(0);
    }

    public int getPayout() {
        return (int) Math.floor(getCost() * baseProduction);
    }

    public int getWorkBuyIn() {
        int payout = getPayout();
        return payout <= 10 ? 0 : payout / 2;
    }

    public boolean isGoldSource() {
        return baseCost == 0;
    }

    public boolean hasResource() {
        return resourceType != null;
    }

    public boolean isHauled() {
        return workType == BuildingWorkType.HAUL_FROM_BUILDING || workType == BuildingWorkType.HAUL_FROM_TERRAIN;
    }

    // Amount drawn from the store by one use.
    public int consumptionPerUse() {
        return Math.round(resourcePerUse * depletionMult);
    }
}
