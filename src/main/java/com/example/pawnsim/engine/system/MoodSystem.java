package com.example.pawnsim.engine.system;

import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.component.BuffComponent;
import com.example.pawnsim.model.component.BuffInstance;
import com.example.pawnsim.model.component.MoodComponent;

import java.util.Optional;

public class MoodSystem implements SimSystem {

    @Override
    public void tick(SimContext ctx) {
        for (EntityId pawn : ctx.getEntities().allPawns()) {
            Optional<MoodComponent> mood = ctx.getEntities().getMoods().get(pawn);
            Optional<BuffComponent> buffs = ctx.getEntities().getBuffs().get(pawn);
            if (mood.isEmpty() || buffs.isEmpty()) {
                continue;
            }
            float total = 0f;
            for (BuffInstance buff : buffs.get().getActive()) {
                total += buff.getMoodOffset();
            }
            mood.get().setMood(Math.max(MoodComponent.MIN, Math.min(MoodComponent.MAX, total)));
        }
    }
}
