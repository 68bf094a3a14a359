package com.food.manufacture.domain;

public enum PlanningMode {
    // Pure LP: buy, use and stock quantities only
    CONTINUOUS,
    // MIP: adds usage indicators with threshold, recipe-size and dependency rules
    DISCRETE
}
