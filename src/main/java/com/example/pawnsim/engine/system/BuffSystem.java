package com.example.pawnsim.engine.system;

import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.model.EntityId;

public class BuffSystem implements SimSystem {

    @Override
    public void tick(SimContext ctx) {
        long now = ctx.now();
        for (EntityId id : ctx.getEntities().getBuffs().ids()) {
            ctx.getEntities().getBuffs().get(id).ifPresent(buffs -> buffs.removeIf(b -> b.isExpired(now)));
        }
    }
}
