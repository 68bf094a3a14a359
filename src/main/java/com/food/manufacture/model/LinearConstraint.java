package com.food.manufacture.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One member of a constraint family: {@code expression relation rhs}.
 */
@Value
public class LinearConstraint {
    @NonNull
    ConstraintFamily family;
    // Index tuple within the family, e.g. [VEG1, 3] or [NON_VEGETABLE, 2]
    @NonNull
    List<String> index;
    @NonNull
    LinearExpression expression;
    @NonNull
    Relation relation;
    double rhs;

    public static LinearConstraint of(ConstraintFamily family, List<?> index,
                                      LinearExpression expression, Relation relation, double rhs) {
        List<String> key = index.stream().map(String::valueOf).collect(Collectors.toUnmodifiableList());
        return new LinearConstraint(family, key, expression, relation, rhs);
    }

    public String name() {
        return family.label() + "[" + String.join(",", index) + "]";
    }

    public boolean isSatisfied(Function<VariableRef, Double> values, double tolerance) {
        return relation.holds(expression.evaluate(values), rhs, tolerance);
    }

    @Override
    public String toString() {
        return name() + ": " + expression + " " + relation.symbol() + " " + rhs;
    }
}
