package com.example.pawnsim.model.component;

public enum BuffSource {
    NEED_CRITICAL,
    NEED_LOW,
    BUILDING,
    WORK
}
