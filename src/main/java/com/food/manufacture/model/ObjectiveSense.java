package com.food.manufacture.model;

public enum ObjectiveSense {
    MAXIMIZE,
    MINIMIZE
}
