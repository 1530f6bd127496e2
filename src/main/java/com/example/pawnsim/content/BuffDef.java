package com.example.pawnsim.content;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuffDef implements ContentDef {

    private int id;
    private String name;
    private float moodOffset;

    // 0 = permanent until removed by whoever applied it
    private int durationTicks;
}
