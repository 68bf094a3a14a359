package com.food.manufacture.solver;

import com.food.manufacture.model.VariableRef;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solver answer for one model. Values are present only when the status carries a solution.
 */
@Value
public class Solution {
    @NonNull
    SolutionStatus status;
    double objectiveValue;
    Map<VariableRef, Double> values;

    public static Solution of(SolutionStatus status, double objectiveValue, Map<VariableRef, Double> values) {
        return new Solution(status, objectiveValue, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Solution withoutValues(SolutionStatus status) {
        return new Solution(status, Double.NaN, Collections.emptyMap());
    }

    public double value(VariableRef ref) {
        Double value = values.get(ref);
        if (value == null) {
            throw new IllegalStateException("Solution (" + status + ") has no value for " + ref.name());
        }
        return value;
    }
}
