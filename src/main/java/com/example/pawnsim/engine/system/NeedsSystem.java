package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.BuffDef;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.component.BuffComponent;
import com.example.pawnsim.model.component.BuffInstance;
import com.example.pawnsim.model.component.BuffSource;
import com.example.pawnsim.model.component.NeedsComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class NeedsSystem implements SimSystem {

    @Override
    public void tick(SimContext ctx) {
        for (EntityId pawn : ctx.getEntities().allPawns()) {
            Optional<NeedsComponent> needs = ctx.getEntities().getNeeds().get(pawn);
            Optional<BuffComponent> buffs = ctx.getEntities().getBuffs().get(pawn);
            if (needs.isEmpty() || buffs.isEmpty()) {
                continue;
            }
            List<Integer> needIds = new ArrayList<>(needs.get().asMap().keySet());
            for (Integer needId : needIds) {
                Optional<NeedDef> def = ctx.getContent().getNeeds().find(needId);
                if (def.isEmpty()) {
                    continue;
                }
                float decay = def.get().getDecayPerTick() * ctx.getTime().decayMultiplier(def.get().isNightSensitive());
                needs.get().add(needId, -decay);
                float value = (float) needs.get().get(needId).orElse(0);
                reconcileDebuffs(ctx, buffs.get(), def.get(), value);
            }
        }
    }

    private void reconcileDebuffs(SimContext ctx, BuffComponent buffs, NeedDef need, float value) {
        buffs.remove(BuffSource.NEED_CRITICAL, need.getId());
        buffs.remove(BuffSource.NEED_LOW, need.getId());

        if (value < need.getCriticalThreshold() && need.getCriticalDebuffId() != null) {
            applyDebuff(ctx, buffs, BuffSource.NEED_CRITICAL, need.getId(), need.getCriticalDebuffId());
        } else if (value < need.getLowThreshold() && need.getLowDebuffId() != null) {
            applyDebuff(ctx, buffs, BuffSource.NEED_LOW, need.getId(), need.getLowDebuffId());
        }
    }

    private void applyDebuff(SimContext ctx, BuffComponent buffs, BuffSource source, int needId, int buffDefId) {
        float offset = ctx.getContent().getBuffs().find(buffDefId).map(BuffDef::getMoodOffset).orElse(0f);
        buffs.apply(new BuffInstance(source, needId, buffDefId, offset, ctx.now(), BuffInstance.PERMANENT));
    }
}
