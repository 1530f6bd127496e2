package com.example.pawnsim.controller;

import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.service.GameLoopService;
import com.example.pawnsim.service.WorldService;
import com.example.pawnsim.snapshot.RenderPawn;
import com.example.pawnsim.snapshot.RenderSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class GameController {

    @Autowired private WorldService worldService;
    @Autowired private GameLoopService gameLoopService;

    @GetMapping("/gamestate")
    public GameState getGameState() {
        return new GameState(worldService.snapshot(), gameLoopService.getLatestLogs());
    }

    @PostMapping("/world/reset")
    public GameState resetWorld() {
        gameLoopService.reset();
        return getGameState();
    }

    @PostMapping("/pawns")
    public ResponseEntity<RenderPawn> spawnPawn(@RequestBody SpawnPawnRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Pawn name is required");
        }
        EntityId id = worldService.spawnPawn(request.getName(), request.getAge(), request.getX(), request.getY(),
                request.getNeeds(), request.getGold());
        RenderPawn pawn = worldService.snapshot().getPawns().stream()
                .filter(p -> p.getId() == id.getValue())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Spawned pawn " + id + " is missing from the snapshot"));
        return ResponseEntity.status(HttpStatus.CREATED).body(pawn);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @Data
    @AllArgsConstructor
    public static class GameState {
        private RenderSnapshot world;
        private List<String> logs;
    }

    @Data
    @NoArgsConstructor
    public static class SpawnPawnRequest {
        private String name;
        private int age = 25;
        private int x;
        private int y;
        private Map<String, Float> needs = new LinkedHashMap<>();
        private Integer gold;
    }
}
