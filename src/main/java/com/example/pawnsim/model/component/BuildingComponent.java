package com.example.pawnsim.model.component;

import com.example.pawnsim.model.EntityId;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class BuildingComponent {

    private int buildingDefId;
    private int colorIndex;
    private boolean inUse;
    private EntityId usedBy;

    public BuildingComponent(int buildingDefId, int colorIndex) {
        this.buildingDefId = buildingDefId;
        this.colorIndex = colorIndex;
    }

    public void claim(EntityId pawn) {
        inUse = true;
        usedBy = pawn;
    }

    public void release() {
        inUse = false;
        usedBy = null;
    }

    public boolean isUsedByOther(EntityId pawn) {
        return inUse && usedBy != null && !usedBy.equals(pawn);
    }
}
