package com.example.pawnsim.content;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentRegistryTest {

    @Test
    void assignsIdsAfterTheHighestExplicitOne() {
        ContentRegistry content = new ContentRegistry();

        int explicit = content.registerBuff("Hungry", BuffDef.builder().id(5).name("Hungry").build());
        int assigned = content.registerBuff("Tired", BuffDef.builder().name("Tired").build());

        assertEquals(5, explicit);
        assertEquals(6, assigned);
        assertEquals(6, content.getBuffs().findId("Tired").orElseThrow());
    }

    @Test
    void needWithUnknownDebuffIsRejected() {
        ContentRegistry content = new ContentRegistry();

        assertThrows(IllegalArgumentException.class, () -> content.registerNeed("Hunger",
                NeedDef.builder().id(1).name("Hunger").criticalDebuffId(42).build()));
    }

    @Test
    void needThresholdsMustBeOrdered() {
        ContentRegistry content = new ContentRegistry();

        assertThrows(IllegalArgumentException.class, () -> content.registerNeed("Hunger",
                NeedDef.builder().id(1).name("Hunger").criticalThreshold(50).lowThreshold(30).build()));
    }

    @Test
    void buildingReferencesAreValidated() {
        ContentRegistry content = new ContentRegistry();
        content.registerNeed("Hunger", NeedDef.builder().id(1).name("Hunger").build());

        assertThrows(IllegalArgumentException.class, () -> content.registerBuilding("Farm",
                BuildingDef.builder().name("Farm").satisfiesNeedId(2).build()));
        assertThrows(IllegalArgumentException.class, () -> content.registerBuilding("Farm",
                BuildingDef.builder().name("Farm").satisfiesNeedId(1).grantsBuffId(3).build()));
        assertThrows(IllegalArgumentException.class, () -> content.registerBuilding("Farm",
                BuildingDef.builder().name("Farm").tileSize(0).build()));
        assertThrows(IllegalArgumentException.class, () -> content.registerBuilding("Mill",
                BuildingDef.builder().name("Mill").resourceType("wood").workType(BuildingWorkType.HAUL_FROM_TERRAIN)
                        .haulSourceTerrainKey("Trees").build()));
    }

    @Test
    void blankKeysAndNegativeIdsAreRejected() {
        ContentRegistry content = new ContentRegistry();

        assertThrows(IllegalArgumentException.class, () -> content.registerTerrain(" ", TerrainDef.builder().name("x").build()));
        assertThrows(IllegalArgumentException.class, () -> content.registerTerrain("Bad", TerrainDef.builder().id(-1).name("Bad").build()));
    }

    @Test
    void requireFailsForUnknownIds() {
        ContentRegistry content = new ContentRegistry();

        assertThrows(IllegalArgumentException.class, () -> content.getBuildings().require(3));
        assertTrue(content.getBuildings().find((Integer) null).isEmpty());
    }

    @Test
    void needsAreFoundByNameIgnoringCase() {
        ContentRegistry content = new ContentRegistry();
        content.registerNeed("Hunger", NeedDef.builder().id(1).name("Hunger").build());

        assertEquals(1, content.findNeedByName("hunger").orElseThrow().getId());
        assertTrue(content.findNeedByName("Thirst").isEmpty());
    }

    @Test
    void firstTerrainIsTheDefault() {
        ContentRegistry content = new ContentRegistry();
        content.registerTerrain("Grass", TerrainDef.builder().name("Grass").build());
        content.registerTerrain("Dirt", TerrainDef.builder().name("Dirt").build());

        assertEquals(1, content.defaultTerrainId());
    }
}
