package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.BuildingDef;
import com.example.pawnsim.content.BuildingWorkType;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.PawnConfig;
import com.example.pawnsim.engine.Simulation;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;
import com.example.pawnsim.model.action.ActionDef;
import com.example.pawnsim.model.action.ActionType;
import com.example.pawnsim.model.action.ExpressionType;
import com.example.pawnsim.model.component.ActionComponent;
import com.example.pawnsim.model.component.InventoryComponent;
import com.example.pawnsim.support.TestSimulationBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.pawnsim.support.SimulationTestSupport.actions;
import static com.example.pawnsim.support.SimulationTestSupport.gold;
import static com.example.pawnsim.support.SimulationTestSupport.need;
import static com.example.pawnsim.support.SimulationTestSupport.runSystem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AiSystemTest {

    private static final int HUNGER = 1;
    private static final int FUN = 3;
    private static final int PURPOSE = 7;

    private static final int FARM = 1;
    private static final int THEATRE = 2;
    private static final int QUARRY = 3;
    private static final int MARKET = 4;
    private static final int GRANARY = 5;
    private static final int MILL = 6;
    private static final int TREES = 4;

    private final AiSystem ai = new AiSystem();

    private static Simulation world() {
        return new TestSimulationBuilder()
                .defineNeed("Hunger", HUNGER, 0f)
                .defineNeed("Fun", FUN, 0f)
                .defineNeed(NeedDef.builder().id(PURPOSE).name("Purpose").decayPerTick(0f).workNeed(true), "Purpose")
                .defineTerrain("Trees", TREES, true, false)
                .defineBuilding("Farm", BuildingDef.builder().id(FARM).satisfiesNeedId(HUNGER)
                        .interactionDurationTicks(25).needSatisfactionAmount(35).baseCost(10)
                        .resourceType("food").maxResourceAmount(100))
                .defineBuilding("Theatre", BuildingDef.builder().id(THEATRE).satisfiesNeedId(FUN).baseCost(5))
                .defineBuilding("Quarry", BuildingDef.builder().id(QUARRY).canBeWorkedAt(true)
                        .workType(BuildingWorkType.DIRECT).workDurationTicks(60).canSellToConsumers(false)
                        .resourceType("stone").maxResourceAmount(100))
                .defineBuilding("Market", BuildingDef.builder().id(MARKET).canBeWorkedAt(true)
                        .workType(BuildingWorkType.HAUL_FROM_BUILDING).haulSourceResourceType("food")
                        .canSellToConsumers(false).resourceType("food").maxResourceAmount(100))
                .defineBuilding("Granary", BuildingDef.builder().id(GRANARY).canSellToConsumers(false)
                        .resourceType("food").maxResourceAmount(100))
                .defineBuilding("Mill", BuildingDef.builder().id(MILL).canBeWorkedAt(true)
                        .workType(BuildingWorkType.HAUL_FROM_TERRAIN).haulSourceTerrainKey("Trees")
                        .canSellToConsumers(false).resourceType("wood").maxResourceAmount(100))
                .build();
    }

    private static EntityId pawn(Simulation sim, String name, int x, int y, Map<Integer, Float> needs, int gold) {
        return sim.createPawn(PawnConfig.builder().name(name).x(x).y(y).needs(needs).gold(gold).build());
    }

    private static void setStock(Simulation sim, EntityId building, int amount) {
        sim.getEntities().getResources().get(building).orElseThrow().setCurrentAmount(amount);
    }

    private static List<ActionDef> plan(Simulation sim, EntityId pawn) {
        ActionComponent ac = actions(sim, pawn);
        List<ActionDef> plan = new ArrayList<>();
        if (ac.getCurrentAction() != null) {
            plan.add(ac.getCurrentAction());
        }
        plan.addAll(ac.getQueue());
        return plan;
    }

    private static void assertWanders(Simulation sim, EntityId pawn) {
        List<ActionDef> plan = plan(sim, pawn);
        assertEquals(2, plan.size());
        assertEquals(ActionType.MOVE_TO, plan.get(0).getType());
        assertTrue(plan.get(0).isWander());
        assertEquals(ActionType.IDLE, plan.get(1).getType());
    }

    @Test
    void lowestNeedIsServedFirst() {
        Simulation sim = world();
        EntityId farm = sim.createBuilding(FARM, 8, 8);
        sim.createBuilding(THEATRE, 1, 1);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f, FUN, 50f), 100);

        ai.tick(sim.context());

        List<ActionDef> plan = plan(sim, alex);
        assertEquals(1, plan.size());
        ActionDef use = plan.get(0);
        assertEquals(ActionType.USE_BUILDING, use.getType());
        assertEquals(farm, use.getTargetEntity());
        assertEquals(HUNGER, use.getSatisfiesNeedId());
        assertEquals(35f, use.getNeedSatisfactionAmount());
        assertEquals(25, use.getDurationTicks());
        assertEquals("Going to Farm", use.getDisplayName());
    }

    @Test
    void fallsThroughToTheNextNeedWhenNothingServesTheFirst() {
        Simulation sim = world();
        EntityId theatre = sim.createBuilding(THEATRE, 5, 5);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f, FUN, 50f), 100);

        ai.tick(sim.context());

        assertEquals(theatre, plan(sim, alex).get(0).getTargetEntity());
    }

    @Test
    void buildingsInUseAreSkipped() {
        Simulation sim = world();
        EntityId near = sim.createBuilding(FARM, 2, 0);
        EntityId far = sim.createBuilding(FARM, 6, 0);
        EntityId sam = pawn(sim, "Sam", 9, 9, Map.of(), 100);
        sim.getEntities().getBuildings().get(near).orElseThrow().claim(sam);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f), 100);

        ai.tick(sim.context());

        assertEquals(far, plan(sim, alex).get(0).getTargetEntity());
    }

    @Test
    void emptyStoresAreSkipped() {
        Simulation sim = world();
        EntityId empty = sim.createBuilding(FARM, 2, 0);
        setStock(sim, empty, 5);
        EntityId stocked = sim.createBuilding(FARM, 6, 0);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f), 100);

        ai.tick(sim.context());

        assertEquals(stocked, plan(sim, alex).get(0).getTargetEntity());
    }

    @Test
    void pawnsThatCannotPayWander() {
        Simulation sim = world();
        sim.createBuilding(FARM, 2, 0);
        EntityId alex = pawn(sim, "Alex", 5, 5, Map.of(HUNGER, 10f), 0);

        ai.tick(sim.context());

        assertWanders(sim, alex);
        ActionDef idle = plan(sim, alex).get(1);
        assertEquals(ExpressionType.THOUGHT, idle.getExpression());
        assertEquals(HUNGER, idle.getExpressionIconDefId());
    }

    @Test
    void satisfiedPawnsWanderToAFreeWalkableTile() {
        Simulation sim = world();
        sim.createBuilding(FARM, 2, 0);
        EntityId alex = pawn(sim, "Alex", 5, 5, Map.of(HUNGER, 90f), 100);

        ai.tick(sim.context());

        assertWanders(sim, alex);
        TileCoord target = plan(sim, alex).get(0).getTargetCoord();
        assertNotEquals(TileCoord.of(5, 5), target);
        assertTrue(sim.getWorld().isWalkable(target));
        assertNull(plan(sim, alex).get(1).getExpression());
    }

    @Test
    void busyPawnsAreLeftAlone() {
        Simulation sim = world();
        sim.createBuilding(FARM, 2, 0);
        EntityId alex = pawn(sim, "Alex", 5, 5, Map.of(HUNGER, 10f), 100);
        actions(sim, alex).enqueue(ActionDef.idle(50, "Rest"));

        ai.tick(sim.context());

        assertEquals(1, plan(sim, alex).size());
    }

    @Test
    void ownAttachmentOutweighsSomeDistance() {
        Simulation sim = world();
        EntityId near = sim.createBuilding(FARM, 4, 0);
        EntityId familiar = sim.createBuilding(FARM, 0, 7);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f), 100);
        sim.getEntities().getAttachments().get(familiar).orElseThrow().set(alex, 2);

        ai.tick(sim.context());

        assertEquals(familiar, plan(sim, alex).get(0).getTargetEntity());
        assertNotEquals(near, plan(sim, alex).get(0).getTargetEntity());
    }

    @Test
    void pawnsAvoidBuildingsOthersAreHeadingTo() {
        Simulation sim = world();
        EntityId near = sim.createBuilding(FARM, 4, 0);
        EntityId other = sim.createBuilding(FARM, 0, 7);
        EntityId sam = pawn(sim, "Sam", 9, 9, Map.of(), 100);
        actions(sim, sam).enqueue(ActionDef.useBuilding(near, 25, HUNGER, 35, "Going to Farm"));
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(HUNGER, 10f), 100);

        ai.tick(sim.context());

        assertEquals(1, AiSystem.convergingPawns(sim.context(), near, alex));
        assertEquals(other, plan(sim, alex).get(0).getTargetEntity());
    }

    // =================================================
    // Work
    // =================================================

    @Test
    void workNeedPicksAWorksiteThatIsNotFull() {
        Simulation sim = world();
        EntityId quarry = sim.createBuilding(QUARRY, 5, 5);
        setStock(sim, quarry, 50);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        ActionDef work = plan(sim, alex).get(0);
        assertEquals(ActionType.WORK, work.getType());
        assertEquals(quarry, work.getTargetEntity());
        assertEquals(PURPOSE, work.getSatisfiesNeedId());
        assertEquals(60, work.getDurationTicks());
    }

    @Test
    void fullWorksitesOfferNoWork() {
        Simulation sim = world();
        sim.createBuilding(QUARRY, 5, 5);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        assertWanders(sim, alex);
    }

    @Test
    void crowdedWorksitesOfferNoWork() {
        Simulation sim = world();
        EntityId quarry = sim.createBuilding(QUARRY, 5, 5);
        setStock(sim, quarry, 50);
        for (String name : List.of("Sam", "Riley")) {
            EntityId worker = pawn(sim, name, 9, name.length(), Map.of(), 100);
            actions(sim, worker).enqueue(ActionDef.work(quarry, 60, PURPOSE, 30, "Going to work at Quarry"));
        }
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        assertWanders(sim, alex);
    }

    @Test
    void haulsFromTheNearestStockedBuilding() {
        Simulation sim = world();
        EntityId market = sim.createBuilding(MARKET, 5, 5);
        setStock(sim, market, 0);
        EntityId farGranary = sim.createBuilding(GRANARY, 9, 9);
        EntityId granary = sim.createBuilding(GRANARY, 2, 2);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        List<ActionDef> plan = plan(sim, alex);
        assertEquals(2, plan.size());
        ActionDef pickUp = plan.get(0);
        assertEquals(ActionType.PICK_UP, pickUp.getType());
        assertEquals(granary, pickUp.getSourceEntity());
        assertNotEquals(farGranary, pickUp.getSourceEntity());
        assertEquals("food", pickUp.getResourceType());
        assertEquals(20, pickUp.getResourceAmount());
        ActionDef dropOff = plan.get(1);
        assertEquals(ActionType.DROP_OFF, dropOff.getType());
        assertEquals(market, dropOff.getTargetEntity());
        assertEquals(granary, dropOff.getSourceEntity());
        assertEquals(PURPOSE, dropOff.getSatisfiesNeedId());
    }

    @Test
    void haulsFromTerrain() {
        Simulation sim = world();
        EntityId mill = sim.createBuilding(MILL, 5, 5);
        setStock(sim, mill, 0);
        sim.paintTerrain(8, 8, TREES, 0);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        List<ActionDef> plan = plan(sim, alex);
        assertEquals(ActionType.PICK_UP, plan.get(0).getType());
        assertEquals(TileCoord.of(8, 8), plan.get(0).getTargetCoord());
        assertNull(plan.get(0).getSourceEntity());
        assertEquals(ActionType.DROP_OFF, plan.get(1).getType());
        assertEquals(mill, plan.get(1).getTargetEntity());
    }

    @Test
    void carriedGoodsAreDeliveredStraightAway() {
        Simulation sim = world();
        EntityId mill = sim.createBuilding(MILL, 5, 5);
        setStock(sim, mill, 0);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);
        sim.getEntities().getInventory().get(alex).orElseThrow().add("wood", 35);

        ai.tick(sim.context());

        List<ActionDef> plan = plan(sim, alex);
        assertEquals(1, plan.size());
        assertEquals(ActionType.DROP_OFF, plan.get(0).getType());
        assertEquals(35, plan.get(0).getResourceAmount());
    }

    @Test
    void leftoverGoodsAreStowedBeforeTheNextHaul() {
        Simulation sim = world();
        EntityId mill = sim.createBuilding(MILL, 5, 5);
        setStock(sim, mill, 0);
        sim.paintTerrain(8, 8, TREES, 0);
        EntityId granary = sim.createBuilding(GRANARY, 2, 2);
        setStock(sim, granary, 50);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);
        InventoryComponent inventory = sim.getEntities().getInventory().get(alex).orElseThrow();
        inventory.add("food", 20);

        ai.tick(sim.context());

        List<ActionDef> plan = plan(sim, alex);
        assertEquals(1, plan.size());
        ActionDef stow = plan.get(0);
        assertEquals(ActionType.DROP_OFF, stow.getType());
        assertEquals(granary, stow.getTargetEntity());
        assertEquals(20, stow.getResourceAmount());
        assertNull(stow.getSatisfiesNeedId());

        runSystem(sim, new ActionSystem(), 100);

        assertTrue(inventory.isEmpty());
        assertEquals(70, sim.getEntities().getResources().get(granary).orElseThrow().getCurrentAmount());
        assertEquals(100, gold(sim, alex));
        assertEquals(10f, need(sim, alex, PURPOSE));
    }

    @Test
    void noHarvestableTerrainMeansNoHaul() {
        Simulation sim = world();
        EntityId mill = sim.createBuilding(MILL, 5, 5);
        setStock(sim, mill, 0);
        EntityId alex = pawn(sim, "Alex", 0, 0, Map.of(PURPOSE, 10f), 100);

        ai.tick(sim.context());

        assertWanders(sim, alex);
    }
}
