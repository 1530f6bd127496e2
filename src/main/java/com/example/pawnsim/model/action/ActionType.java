package com.example.pawnsim.model.action;

public enum ActionType {
    IDLE,
    MOVE_TO,
    USE_BUILDING,
    WORK,
    PICK_UP,
    DROP_OFF
}
