package com.example.pawnsim.model.component;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceComponent {

    private String resourceType;
    private int currentAmount;
    private int maxAmount;

    public int room() {
        return Math.max(0, maxAmount - currentAmount);
    }

    public float fillRatio() {
        return maxAmount <= 0 ? 1f : (float) currentAmount / maxAmount;
    }

    // Removes up to amount and returns what was actually taken.
    public int take(int amount) {
        int taken = Math.min(Math.max(0, amount), currentAmount);
        currentAmount -= taken;
        return taken;
    }

    // Adds up to the remaining capacity and returns what was actually stored.
    public int store(int amount) {
        int stored = Math.min(Math.max(0, amount), room());
        currentAmount += stored;
        return stored;
    }
}
