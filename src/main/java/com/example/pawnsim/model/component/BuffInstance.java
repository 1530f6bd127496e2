package com.example.pawnsim.model.component;

import lombok.Value;

@Value
public class BuffInstance {

    public static final long PERMANENT = -1;

    BuffSource source;
    int sourceId;
    int buffDefId;
    float moodOffset;
    long startTick;
    long endTick;

    public boolean isPermanent() {
        return endTick <= 0;
    }

    public boolean isExpired(long now) {
        return !isPermanent() && now >= endTick;
    }
}
