package com.example.pawnsim.engine.system;

import com.example.pawnsim.content.DefaultContent;
import com.example.pawnsim.content.NeedDef;
import com.example.pawnsim.engine.SimContext;
import com.example.pawnsim.engine.SimSystem;
import com.example.pawnsim.model.EntityId;
import com.example.pawnsim.model.TileCoord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class ProximitySocialSystem implements SimSystem {

    static final int RADIUS = 2;
    static final float GAIN_PER_NEIGHBOUR = 0.02f;

    @Override
    public void tick(SimContext ctx) {
        Optional<NeedDef> social = ctx.getContent().findNeedByName(DefaultContent.SOCIAL);
        if (social.isEmpty()) {
            return;
        }
        int socialId = social.get().getId();

        // positions are read before any gain so the pass is order independent
        Map<EntityId, TileCoord> positions = new LinkedHashMap<>();
        for (EntityId pawn : ctx.getEntities().allPawns()) {
            ctx.getEntities().positionOf(pawn).ifPresent(p -> positions.put(pawn, p));
        }

        for (Map.Entry<EntityId, TileCoord> entry : positions.entrySet()) {
            ctx.getEntities().getNeeds().get(entry.getKey()).ifPresent(needs -> {
                if (!needs.has(socialId)) {
                    return;
                }
                int neighbours = 0;
                for (Map.Entry<EntityId, TileCoord> other : positions.entrySet()) {
                    if (!other.getKey().equals(entry.getKey()) && other.getValue().manhattan(entry.getValue()) <= RADIUS) {
                        neighbours++;
                    }
                }
                if (neighbours > 0) {
                    needs.add(socialId, neighbours * GAIN_PER_NEIGHBOUR);
                }
            });
        }
    }
}
