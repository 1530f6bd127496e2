package com.example.pawnsim.snapshot;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RenderTime {

    int day;
    int hour;
    int minute;
    boolean night;
    String timeString;

    // 0 at midnight, 0.5 at noon.
    float dayFraction;
}
