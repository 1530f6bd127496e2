package com.example.pawnsim.model;

import lombok.Value;

@Value
public class EntityId implements Comparable<EntityId> {

    int value;

    public static EntityId of(int value) {
        return new EntityId(value);
    }

    @Override
    public int compareTo(EntityId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
