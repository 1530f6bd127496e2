package com.example.pawnsim.model.component;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class InventoryComponent {

    public static final int DEFAULT_CAPACITY = 50;

    private String resourceType;
    private int amount;
    private int maxAmount = DEFAULT_CAPACITY;

    public boolean isEmpty() {
        return resourceType == null || amount <= 0;
    }

    // Room left for the given resource; a slot holding another resource has none.
    public int roomFor(String type) {
        if (isEmpty()) {
            return maxAmount;
        }
        return type.equals(resourceType) ? maxAmount - amount : 0;
    }

    public int add(String type, int requested) {
        int added = Math.min(Math.max(0, requested), roomFor(type));
        if (added > 0) {
            resourceType = type;
            amount += added;
        }
        return added;
    }

    public int remove(int requested) {
        int removed = Math.min(Math.max(0, requested), amount);
        amount -= removed;
        if (amount == 0) {
            resourceType = null;
        }
        return removed;
    }
}
