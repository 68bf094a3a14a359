package com.food.manufacture.model;

public enum VariableDomain {
    CONTINUOUS,
    BINARY
}
