package com.example.pawnsim.model.component;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

public class NeedsComponent {

    public static final float MIN = 0f;
    public static final float MAX = 100f;

    private final Map<Integer, Float> values = new TreeMap<>();

    public NeedsComponent() {
    }

    public NeedsComponent(Map<Integer, Float> initial) {
        initial.forEach(this::set);
    }

    public boolean has(int needId) {
        return values.containsKey(needId);
    }

    public OptionalDouble get(int needId) {
        Float value = values.get(needId);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public void set(int needId, float value) {
        values.put(needId, clamp(value));
    }

    // Adds to an existing need; a need the pawn does not have is left alone.
    public void add(int needId, float delta) {
        Float value = values.get(needId);
        if (value != null) {
            values.put(needId, clamp(value + delta));
        }
    }

    public Map<Integer, Float> asMap() {
        return Collections.unmodifiableMap(values);
    }

    private static float clamp(float value) {
        return Math.max(MIN, Math.min(MAX, value));
    }
}
