package com.example.pawnsim.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerrainDef implements ContentDef {

    private int id;
    private String name;

    @Builder.Default
    private boolean walkable = true;

    @Builder.Default
    private boolean buildable = true;

    private boolean blocksLight;
}
