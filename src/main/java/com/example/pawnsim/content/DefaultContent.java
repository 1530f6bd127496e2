package com.example.pawnsim.content;

public final class DefaultContent {

    public static final String HUNGER = "Hunger";
    public static final String ENERGY = "Energy";
    public static final String FUN = "Fun";
    public static final String SOCIAL = "Social";
    public static final String HYGIENE = "Hygiene";
    public static final String PURPOSE = "Purpose";

    private DefaultContent() {
    }

    public static ContentRegistry create() {
        ContentRegistry content = new ContentRegistry();
        registerBuffs(content);
        registerNeeds(content);
        registerTerrains(content);
        registerBuildings(content);
        content.logSummary();
        return content;
    }

    private static void registerBuffs(ContentRegistry content) {
        needBuff(content, "Starving", "Starving!", -30);
        needBuff(content, "Hungry", "Hungry", -10);
        needBuff(content, "Exhausted", "Exhausted!", -25);
        needBuff(content, "Tired", "Tired", -8);
        needBuff(content, "Bored", "Bored!", -20);
        needBuff(content, "Understimulated", "Understimulated", -6);
        needBuff(content, "Lonely", "Lonely!", -25);
        needBuff(content, "Isolated", "Isolated", -8);
        needBuff(content, "Filthy", "Filthy!", -20);
        needBuff(content, "Dirty", "Dirty", -8);
        needBuff(content, "Aimless", "Aimless!", -22);
        needBuff(content, "Unfulfilled", "Unfulfilled", -7);

        actionBuff(content, "GoodMeal", "Good Meal", 15, 2400);
        actionBuff(content, "WellRested", "Well Rested", 20, 4800);
        actionBuff(content, "FeelingFresh", "Feeling Fresh", 8, 2000);
        actionBuff(content, "Productive", "Productive", 12, 3000);
        actionBuff(content, "Socialized", "Socialized", 12, 3000);
        actionBuff(content, "Entertained", "Entertained", 14, 3000);
    }

    private static void needBuff(ContentRegistry content, String key, String name, float mood) {
        content.registerBuff(key, BuffDef.builder().name(name).moodOffset(mood).build());
    }

    private static void actionBuff(ContentRegistry content, String key, String name, float mood, int duration) {
        content.registerBuff(key, BuffDef.builder().name(name).moodOffset(mood).durationTicks(duration).build());
    }

    private static void registerNeeds(ContentRegistry content) {
        need(content, 1, HUNGER, 0.02f, 15, 35, "Starving", "Hungry", false, false);
        need(content, 2, ENERGY, 0.01f, 10, 30, "Exhausted", "Tired", true, false);
        need(content, 3, FUN, 0.008f, 20, 40, "Bored", "Understimulated", false, false);
        need(content, 4, SOCIAL, 0.005f, 15, 35, "Lonely", "Isolated", false, false);
        need(content, 6, HYGIENE, 0.008f, 15, 30, "Filthy", "Dirty", false, false);
        need(content, 7, PURPOSE, 0.006f, 15, 35, "Aimless", "Unfulfilled", false, true);
    }

    private static void need(ContentRegistry content, int id, String name, float decay, float critical, float low,
                             String criticalBuff, String lowBuff, boolean nightSensitive, boolean workNeed) {
        content.registerNeed(name, NeedDef.builder()
                .id(id)
                .name(name)
                .decayPerTick(decay)
                .criticalThreshold(critical)
                .lowThreshold(low)
                .criticalDebuffId(buff(content, criticalBuff))
                .lowDebuffId(buff(content, lowBuff))
                .nightSensitive(nightSensitive)
                .workNeed(workNeed)
                .build());
    }

    private static void registerTerrains(ContentRegistry content) {
        terrain(content, "Grass", "Grass", true, true, false);
        terrain(content, "Dirt", "Dirt", true, true, false);
        terrain(content, "Concrete", "Concrete", true, true, false);
        terrain(content, "WoodFloor", "Wood Floor", true, true, false);
        terrain(content, "Stone", "Stone Floor", true, true, false);
        terrain(content, "Water", "Water", false, false, false);
        terrain(content, "Path", "Path", true, true, false);
        terrain(content, "Trees", "Trees", true, false, true);
    }

    private static void terrain(ContentRegistry content, String key, String name,
                                boolean walkable, boolean buildable, boolean blocksLight) {
        content.registerTerrain(key, TerrainDef.builder()
                .name(name)
                .walkable(walkable)
                .buildable(buildable)
                .blocksLight(blocksLight)
                .build());
    }

    private static void registerBuildings(ContentRegistry content) {
        content.registerBuilding("Home", BuildingDef.builder()
                .name("Home")
                .satisfiesNeedId(need(content, ENERGY))
                .needSatisfactionAmount(60f)
                .interactionDurationTicks(200)
                .grantsBuffId(buff(content, "WellRested"))
                .tileSize(2)
                .baseCost(0)
                .build());

        content.registerBuilding("Farm", BuildingDef.builder()
                .name("Farm")
                .satisfiesNeedId(need(content, HUNGER))
                .grantsBuffId(buff(content, "GoodMeal"))
                .workBuffId(buff(content, "Productive"))
                .tileSize(2)
                .baseCost(8)
                .baseProduction(1.5f)
                .resourceType("food")
                .maxResourceAmount(100)
                .canBeWorkedAt(true)
                .workType(BuildingWorkType.DIRECT)
                .workProduction(25)
                .build());

        content.registerBuilding("Market", BuildingDef.builder()
                .name("Market")
                .satisfiesNeedId(need(content, HUNGER))
                .needSatisfactionAmount(40f)
                .grantsBuffId(buff(content, "GoodMeal"))
                .workBuffId(buff(content, "Productive"))
                .tileSize(2)
                .baseCost(12)
                .baseProduction(1.5f)
                .resourceType("food")
                .maxResourceAmount(100)
                .canBeWorkedAt(true)
                .workType(BuildingWorkType.HAUL_FROM_BUILDING)
                .haulSourceResourceType("food")
                .wholesalePricePerUnit(0.5f)
                .build());

        content.registerBuilding("Well", BuildingDef.builder()
                .name("Well")
                .satisfiesNeedId(need(content, HYGIENE))
                .grantsBuffId(buff(content, "FeelingFresh"))
                .baseCost(0)
                .resourceType("water")
                .maxResourceAmount(999)
                .depletionMult(0f)
                .build());

        content.registerBuilding("Tavern", BuildingDef.builder()
                .name("Tavern")
                .satisfiesNeedId(need(content, SOCIAL))
                .grantsBuffId(buff(content, "Socialized"))
                .tileSize(2)
                .baseCost(5)
                .build());

        content.registerBuilding("Theatre", BuildingDef.builder()
                .name("Theatre")
                .satisfiesNeedId(need(content, FUN))
                .needSatisfactionAmount(45f)
                .interactionDurationTicks(150)
                .grantsBuffId(buff(content, "Entertained"))
                .tileSize(2)
                .baseCost(15)
                .build());

        content.registerBuilding("LumberMill", BuildingDef.builder()
                .name("Lumber Mill")
                .workBuffId(buff(content, "Productive"))
                .tileSize(2)
                .baseCost(10)
                .baseProduction(1.2f)
                .canSellToConsumers(false)
                .resourceType("wood")
                .maxResourceAmount(200)
                .canBeWorkedAt(true)
                .workType(BuildingWorkType.HAUL_FROM_TERRAIN)
                .haulSourceTerrainKey("Trees")
                .build());
    }

    private static int buff(ContentRegistry content, String key) {
        return content.getBuffs().findId(key)
                .orElseThrow(() -> new IllegalStateException("Default content is missing buff " + key));
    }

    private static int need(ContentRegistry content, String key) {
        return content.getNeeds().findId(key)
                .orElseThrow(() -> new IllegalStateException("Default content is missing need " + key));
    }
}
