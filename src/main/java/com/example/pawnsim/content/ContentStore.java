package com.example.pawnsim.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class ContentStore<T extends ContentDef> {

    private final String kind;
    private final Map<Integer, T> byId = new TreeMap<>();
    private final Map<String, Integer> idsByKey = new LinkedHashMap<>();
    private int nextId = 1;

    public ContentStore(String kind) {
        this.kind = kind;
    }

    public int register(String key, T def) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(kind + " key must not be blank");
        }
        if (def.getId() < 0) {
            throw new IllegalArgumentException(kind + " '" + key + "' has negative id " + def.getId());
        }
        if (def.getId() == 0) {
            def.setId(nextId++);
        } else if (def.getId() >= nextId) {
            nextId = def.getId() + 1;
        }
        byId.put(def.getId(), def);
        idsByKey.put(key, def.getId());
        return def.getId();
    }

    public Optional<T> find(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<T> find(Integer id) {
        return id == null ? Optional.empty() : find(id.intValue());
    }

    // Lookup for callers holding an id that must exist; used outside the tick path.
    public T require(int id) {
        T def = byId.get(id);
        if (def == null) {
            throw new IllegalArgumentException("Unknown " + kind + " definition id: " + id);
        }
        return def;
    }

    public boolean contains(Integer id) {
        return id != null && byId.containsKey(id);
    }

    public Optional<Integer> findId(String key) {
        return Optional.ofNullable(idsByKey.get(key));
    }

    public Map<Integer, T> all() {
        return Collections.unmodifiableMap(byId);
    }

    public int size() {
        return byId.size();
    }
}
