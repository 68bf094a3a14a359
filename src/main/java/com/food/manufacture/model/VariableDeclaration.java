package com.food.manufacture.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class VariableDeclaration {
    @NonNull
    VariableRef ref;
    @NonNull
    VariableDomain domain;
    double lowerBound;
    double upperBound; // Double.POSITIVE_INFINITY when unbounded

    public static VariableDeclaration nonNegative(VariableRef ref) {
        return new VariableDeclaration(ref, VariableDomain.CONTINUOUS, 0.0, Double.POSITIVE_INFINITY);
    }

    public static VariableDeclaration bounded(VariableRef ref, double upperBound) {
        return new VariableDeclaration(ref, VariableDomain.CONTINUOUS, 0.0, upperBound);
    }

    public static VariableDeclaration binary(VariableRef ref) {
        return new VariableDeclaration(ref, VariableDomain.BINARY, 0.0, 1.0);
    }
}
