package com.example.pawnsim.model.component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

public class BuffComponent {

    private final List<BuffInstance> active = new ArrayList<>();

    // Replaces any instance from the same source pair, keeping the slot it held.
    public void apply(BuffInstance buff) {
        for (int i = 0; i < active.size(); i++) {
            BuffInstance existing = active.get(i);
            if (existing.getSource() == buff.getSource() && existing.getSourceId() == buff.getSourceId()) {
                active.set(i, buff);
                return;
            }
        }
        active.add(buff);
    }

    public boolean remove(BuffSource source, int sourceId) {
        return active.removeIf(b -> b.getSource() == source && b.getSourceId() == sourceId);
    }

    public int removeIf(Predicate<BuffInstance> filter) {
        int before = active.size();
        active.removeIf(filter);
        return before - active.size();
    }

    public Optional<BuffInstance> find(BuffSource source, int sourceId) {
        return active.stream()
                .filter(b -> b.getSource() == source && b.getSourceId() == sourceId)
                .findFirst();
    }

    public List<BuffInstance> getActive() {
        return Collections.unmodifiableList(active);
    }
}
