package com.food.manufacture.model;

/**
 * Relational operator between a constraint's expression and its right-hand side.
 */
public enum Relation {
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL("==");

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public double lowerBound(double rhs) {
        return this == LESS_EQUAL ? Double.NEGATIVE_INFINITY : rhs;
    }

    public double upperBound(double rhs) {
        return this == GREATER_EQUAL ? Double.POSITIVE_INFINITY : rhs;
    }

    public boolean holds(double activity, double rhs, double tolerance) {
        return switch (this) {
            case LESS_EQUAL -> activity <= rhs + tolerance;
            case GREATER_EQUAL -> activity >= rhs - tolerance;
            case EQUAL -> Math.abs(activity - rhs) <= tolerance;
        };
    }
}
