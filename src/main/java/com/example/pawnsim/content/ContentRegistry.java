package com.example.pawnsim.content;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
public class ContentRegistry {

    private final ContentStore<BuffDef> buffs = new ContentStore<>("buff");
    private final ContentStore<NeedDef> needs = new ContentStore<>("need");
    private final ContentStore<TerrainDef> terrains = new ContentStore<>("terrain");
    private final ContentStore<BuildingDef> buildings = new ContentStore<>("building");

    public int registerBuff(String key, BuffDef def) {
        return buffs.register(key, def);
    }

    public int registerNeed(String key, NeedDef def) {
        requireBuff(def.getCriticalDebuffId(), "need '" + key + "' critical debuff");
        requireBuff(def.getLowDebuffId(), "need '" + key + "' low debuff");
        if (def.getLowThreshold() < def.getCriticalThreshold()) {
            throw new IllegalArgumentException("need '" + key + "' low threshold is below its critical threshold");
        }
        return needs.register(key, def);
    }

    public int registerTerrain(String key, TerrainDef def) {
        return terrains.register(key, def);
    }

    public int registerBuilding(String key, BuildingDef def) {
        if (def.getSatisfiesNeedId() != null && !needs.contains(def.getSatisfiesNeedId())) {
            throw new IllegalArgumentException("building '" + key + "' satisfies unknown need id " + def.getSatisfiesNeedId());
        }
        requireBuff(def.getGrantsBuffId(), "building '" + key + "' granted buff");
        requireBuff(def.getWorkBuffId(), "building '" + key + "' work buff");
        if (def.getTileSize() <= 0) {
            throw new IllegalArgumentException("building '" + key + "' tile size must be positive, was " + def.getTileSize());
        }
        if (def.hasResource() && def.getMaxResourceAmount() <= 0) {
            throw new IllegalArgumentException("building '" + key + "' resource capacity must be positive");
        }
        if (def.getWorkType() == BuildingWorkType.HAUL_FROM_TERRAIN && def.getHaulSourceTerrainKey() != null
                && terrains.findId(def.getHaulSourceTerrainKey()).isEmpty()) {
            throw new IllegalArgumentException("building '" + key + "' hauls from unknown terrain '" + def.getHaulSourceTerrainKey() + "'");
        }
        return buildings.register(key, def);
    }

    private void requireBuff(Integer buffId, String what) {
        if (buffId != null && !buffs.contains(buffId)) {
            throw new IllegalArgumentException(what + " references unknown buff id " + buffId);
        }
    }

    public ContentStore<BuffDef> getBuffs() {
        return buffs;
    }

    public ContentStore<NeedDef> getNeeds() {
        return needs;
    }

    public ContentStore<TerrainDef> getTerrains() {
        return terrains;
    }

    public ContentStore<BuildingDef> getBuildings() {
        return buildings;
    }

    public Optional<NeedDef> findNeedByName(String name) {
        return needs.all().values().stream().filter(n -> n.getName().equalsIgnoreCase(name)).findFirst();
    }

    // First registered terrain, used for tiles never painted.
    public int defaultTerrainId() {
        return terrains.all().keySet().stream().findFirst().orElse(0);
    }

    public void logSummary() {
        log.info("Content loaded: {} needs, {} buffs, {} terrains, {} buildings",
                needs.size(), buffs.size(), terrains.size(), buildings.size());
    }
}
