package com.food.manufacture.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanningOutcome {
    private PlanningMode mode;
    private boolean feasible;
    private String status; // "OPTIMAL", "FEASIBLE", "INFEASIBLE", "UNBOUNDED", "ERROR"

    // Total profit in currency units, NaN when no solution exists
    private double objectiveValue;

    // Ordered by period, then catalog order of oils
    private List<PlanRecord> records;

    // Constraint or bound checks the solver output failed, normally empty
    private List<String> violations;

    private long computationTimeMs;
}
