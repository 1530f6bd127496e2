package com.example.pawnsim.model.component;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class MoodComponent {

    public static final float MIN = -100f;
    public static final float MAX = 100f;

    private float mood;
}
