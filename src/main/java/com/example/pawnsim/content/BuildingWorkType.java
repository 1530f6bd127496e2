package com.example.pawnsim.content;

public enum BuildingWorkType {
    // Work on site; production goes straight into the building's store.
    DIRECT,
    // Carry the building's resource over from another building that holds it.
    HAUL_FROM_BUILDING,
    // Harvest the resource from a terrain tile and carry it over.
    HAUL_FROM_TERRAIN
}
