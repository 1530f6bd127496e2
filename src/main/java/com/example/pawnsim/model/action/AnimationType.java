package com.example.pawnsim.model.action;

public enum AnimationType {
    IDLE,
    WALK,
    AXE,
    PICKAXE,
    LOOK_DOWN
}
