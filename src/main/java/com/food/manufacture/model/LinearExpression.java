package com.food.manufacture.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable sum of coefficient * variable terms. Terms keep insertion order and
 * coefficients of a repeated variable are merged.
 */
@EqualsAndHashCode
public final class LinearExpression {

    private static final LinearExpression EMPTY = new LinearExpression(Collections.emptyMap());

    private final Map<VariableRef, Double> terms;

    private LinearExpression(Map<VariableRef, Double> terms) {
        this.terms = terms;
    }

    public static LinearExpression empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<VariableRef, Double> terms() {
        return terms;
    }

    public double coefficientOf(VariableRef ref) {
        return terms.getOrDefault(ref, 0.0);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * Activity of the expression under the given assignment. Variables missing from
     * the lookup throw, so callers are expected to pass a complete assignment.
     */
    public double evaluate(Function<VariableRef, Double> values) {
        double total = 0.0;
        for (Map.Entry<VariableRef, Double> term : terms.entrySet()) {
            Double value = values.apply(term.getKey());
            if (value == null) {
                throw new IllegalArgumentException("No value for " + term.getKey().name());
            }
            total += term.getValue() * value;
        }
        return total;
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        terms.forEach((ref, coef) -> {
            if (sb.length() > 0) {
                sb.append(coef < 0 ? " - " : " + ");
            } else if (coef < 0) {
                sb.append("-");
            }
            double abs = Math.abs(coef);
            if (abs != 1.0) {
                sb.append(abs).append("*");
            }
            sb.append(ref.name());
        });
        return sb.toString();
    }

    public static final class Builder {
        private final Map<VariableRef, Double> terms = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(VariableRef ref, double coefficient) {
            terms.merge(ref, coefficient, Double::sum);
            return this;
        }

        public Builder add(VariableRef ref) {
            return add(ref, 1.0);
        }

        public LinearExpression build() {
            return new LinearExpression(Collections.unmodifiableMap(new LinkedHashMap<>(terms)));
        }
    }
}
