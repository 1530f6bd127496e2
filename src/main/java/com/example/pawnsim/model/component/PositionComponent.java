package com.example.pawnsim.model.component;

import com.example.pawnsim.model.TileCoord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PositionComponent {

    private TileCoord coord;
}
