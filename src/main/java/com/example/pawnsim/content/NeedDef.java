package com.example.pawnsim.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NeedDef implements ContentDef {

    private int id;
    private String name;

    @Builder.Default
    private float decayPerTick = 0.05f;

    @Builder.Default
    private float criticalThreshold = 20f;

    @Builder.Default
    private float lowThreshold = 40f;

    private Integer criticalDebuffId;
    private Integer lowDebuffId;

    // Decays faster at night and during the sleep window.
    private boolean nightSensitive;

    // Satisfied by working at buildings rather than by consuming from them.
    private boolean workNeed;
}
