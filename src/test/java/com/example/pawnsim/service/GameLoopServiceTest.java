package com.example.pawnsim.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {"pawnsim.loop-enabled=false", "pawnsim.seed=7"})
class GameLoopServiceTest {

    @Autowired
    private GameLoopService gameLoopService;

    @Autowired
    private WorldService worldService;

    @BeforeEach
    void resetWorld() {
        gameLoopService.reset();
    }

    @Test
    void disabledLoopDoesNotTick() {
        long before = worldService.snapshot().getTick();

        gameLoopService.runGameTurn();

        assertEquals(before, worldService.snapshot().getTick());
    }

    @Test
    void advanceRunsTicksAndRecordsWhatPawnsStart() {
        long before = worldService.snapshot().getTick();

        gameLoopService.advance(30);

        assertEquals(before + 30, worldService.snapshot().getTick());
        List<String> logs = gameLoopService.getLatestLogs();
        assertTrue(logs.contains("World reset"));
        assertTrue(logs.stream().anyMatch(line -> line.startsWith("Day 1, 08:03 ")));
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < 40; i++) {
            gameLoopService.reset();
        }

        assertEquals(GameLoopService.MAX_LOG_LINES, gameLoopService.getLatestLogs().size());
    }

    @Test
    void spawnedPawnsJoinTheWorld() {
        worldService.spawnPawn("Casey", 30, 10, 10, Map.of("hunger", 50f), 12);

        assertEquals(5, worldService.snapshot().getPawns().size());
        assertThrows(IllegalArgumentException.class,
                () -> worldService.spawnPawn("Drew", 30, 10, 11, Map.of("Thirst", 50f), null));
        assertFalse(worldService.snapshot().getPawns().stream().anyMatch(p -> p.getName().equals("Drew")));
    }
}
