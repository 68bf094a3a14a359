package com.food.manufacture.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class Objective {
    @NonNull
    LinearExpression expression;
    @NonNull
    ObjectiveSense sense;

    public static Objective maximize(LinearExpression expression) {
        return new Objective(expression, ObjectiveSense.MAXIMIZE);
    }
}
