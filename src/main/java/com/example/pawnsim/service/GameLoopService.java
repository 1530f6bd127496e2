package com.example.pawnsim.service;

import com.example.pawnsim.config.SimulationProperties;
import com.example.pawnsim.snapshot.RenderPawn;
import com.example.pawnsim.snapshot.RenderSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
public class GameLoopService {

    static final int MAX_LOG_LINES = 50;

    @Autowired private WorldService worldService;
    @Autowired private SimulationProperties properties;

    // guarded by itself
    private final LinkedList<String> logHistory = new LinkedList<>();

    // last action label seen per pawn id, touched only from the loop and reset paths
    private final Map<Integer, String> lastLabels = new HashMap<>();

    public List<String> getLatestLogs() {
        synchronized (logHistory) { return new ArrayList<>(logHistory); }
    }

    private void record(String message) {
        log.info(message);
        synchronized (logHistory) {
            logHistory.add(message);
            if (logHistory.size() > MAX_LOG_LINES) logHistory.removeFirst();
        }
    }

    @Scheduled(fixedRateString = "${pawnsim.tick-interval-ms:100}")
    public void runGameTurn() {
        if (!properties.isLoopEnabled()) {
            return;
        }
        try {
            advance(1);
        } catch (RuntimeException e) {
            log.error("Game turn failed; the loop keeps running", e);
        }
    }

    // Runs ticks simulation ticks and records any change in what pawns are doing.
    public synchronized void advance(int ticks) {
        for (int i = 0; i < ticks; i++) {
            worldService.tick();
        }
        recordActionChanges(worldService.snapshot());
    }

    public synchronized void reset() {
        worldService.initializeWorld();
        lastLabels.clear();
        record("World reset");
    }

    private void recordActionChanges(RenderSnapshot snapshot) {
        for (RenderPawn pawn : snapshot.getPawns()) {
            String previous = lastLabels.put(pawn.getId(), pawn.getCurrentAction());
            if (pawn.getCurrentAction() != null && !Objects.equals(previous, pawn.getCurrentAction())) {
                record(snapshot.getTime().getTimeString() + " " + pawn.getName() + ": " + pawn.getCurrentAction());
            }
        }
    }
}
