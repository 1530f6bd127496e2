package com.example.pawnsim.entity;

import com.example.pawnsim.model.EntityId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ComponentTable<T> {

    private final List<T> slots = new ArrayList<>();
    private int size;

    public Optional<T> get(EntityId id) {
        int index = id.getValue();
        if (index < 0 || index >= slots.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(index));
    }

    public boolean contains(EntityId id) {
        return get(id).isPresent();
    }

    public void put(EntityId id, T component) {
        int index = id.getValue();
        while (slots.size() <= index) {
            slots.add(null);
        }
        if (slots.set(index, component) == null) {
            size++;
        }
    }

    public boolean remove(EntityId id) {
        int index = id.getValue();
        if (index < 0 || index >= slots.size() || slots.get(index) == null) {
            return false;
        }
        slots.set(index, null);
        size--;
        return true;
    }

    public List<EntityId> ids() {
        List<EntityId> ids = new ArrayList<>(size);
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i) != null) {
                ids.add(EntityId.of(i));
            }
        }
        return ids;
    }

    public int size() {
        return size;
    }
}
