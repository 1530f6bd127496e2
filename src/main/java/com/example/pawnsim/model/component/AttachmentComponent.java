package com.example.pawnsim.model.component;

import com.example.pawnsim.model.EntityId;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public class AttachmentComponent {

    public static final int MAX = 10;

    private final Map<EntityId, Integer> scores = new TreeMap<>();

    public int get(EntityId pawn) {
        return scores.getOrDefault(pawn, 0);
    }

    public void increment(EntityId pawn) {
        scores.put(pawn, Math.min(MAX, get(pawn) + 1));
    }

    public void set(EntityId pawn, int score) {
        scores.put(pawn, Math.max(0, Math.min(MAX, score)));
    }

    public int sumExcluding(EntityId pawn) {
        return scores.entrySet().stream()
                .filter(e -> !e.getKey().equals(pawn))
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    public Map<EntityId, Integer> asMap() {
        return Collections.unmodifiableMap(scores);
    }
}
