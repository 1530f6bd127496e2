package com.example.pawnsim.model.action;

public enum ExpressionType {
    // Wanting something.
    THOUGHT,
    HAPPY,
    COMPLAINT,
    QUESTION
}
