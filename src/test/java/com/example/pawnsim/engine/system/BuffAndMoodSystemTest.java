package com.example.pawnsim.engine.system;

import com.example.pawnsim.engine.Simulation;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.component.BuffComponent;
import com.example.pawnsim.model.component.BuffInstance;
import com.example.pawnsim.model.component.BuffSource;
import com.example.pawnsim.support.TestSimulationBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.pawnsim.support.SimulationTestSupport.pawnByName;
import static com.example.pawnsim.support.SimulationTestSupport.runSystem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuffAndMoodSystemTest {

    private Simulation sim;
    private EntityId pawn;
    private BuffComponent buffs;

    @BeforeEach
    void setUp() {
        sim = new TestSimulationBuilder().addPawn("Alex", 0, 0, Map.of()).build();
        pawn = pawnByName(sim, "Alex");
        buffs = sim.getEntities().getBuffs().get(pawn).orElseThrow();
    }

    @Test
    void timedBuffExpiresAtItsEndTick() {
        long now = sim.getTime().getTick();
        buffs.apply(new BuffInstance(BuffSource.BUILDING, 3, 10, 15f, now, now + 5));

        runSystem(sim, new BuffSystem(), 5);
        assertEquals(1, buffs.getActive().size());

        runSystem(sim, new BuffSystem(), 1);
        assertTrue(buffs.getActive().isEmpty());
    }

    @Test
    void permanentBuffsStay() {
        long now = sim.getTime().getTick();
        buffs.apply(new BuffInstance(BuffSource.NEED_LOW, 1, 11, -10f, now, BuffInstance.PERMANENT));

        runSystem(sim, new BuffSystem(), 10_000);

        assertEquals(1, buffs.getActive().size());
    }

    @Test
    void reapplyingFromTheSameSourceReplaces() {
        long now = sim.getTime().getTick();
        buffs.apply(new BuffInstance(BuffSource.BUILDING, 3, 10, 15f, now, now + 5));
        buffs.apply(new BuffInstance(BuffSource.BUILDING, 3, 10, 15f, now, now + 50));
        buffs.apply(new BuffInstance(BuffSource.WORK, 3, 12, 5f, now, now + 50));

        assertEquals(2, buffs.getActive().size());
        assertEquals(now + 50, buffs.find(BuffSource.BUILDING, 3).orElseThrow().getEndTick());
    }

    @Test
    void moodIsTheSumOfOffsets() {
        long now = sim.getTime().getTick();
        buffs.apply(new BuffInstance(BuffSource.BUILDING, 3, 10, 15f, now, now + 100));
        buffs.apply(new BuffInstance(BuffSource.NEED_LOW, 1, 11, -10f, now, BuffInstance.PERMANENT));

        runSystem(sim, new MoodSystem(), 1);

        assertEquals(5f, sim.getEntities().getMoods().get(pawn).orElseThrow().getMood());
    }

    @Test
    void moodIsClamped() {
        long now = sim.getTime().getTick();
        buffs.apply(new BuffInstance(BuffSource.NEED_CRITICAL, 1, 10, -60f, now, BuffInstance.PERMANENT));
        buffs.apply(new BuffInstance(BuffSource.NEED_CRITICAL, 2, 11, -70f, now, BuffInstance.PERMANENT));

        runSystem(sim, new MoodSystem(), 1);

        assertEquals(-100f, sim.getEntities().getMoods().get(pawn).orElseThrow().getMood());
    }

    @Test
    void moodFallsBackToZeroWithoutBuffs() {
        sim.getEntities().getMoods().get(pawn).orElseThrow().setMood(40f);

        runSystem(sim, new MoodSystem(), 1);

        assertEquals(0f, sim.getEntities().getMoods().get(pawn).orElseThrow().getMood());
    }
}
