package com.food.manufacture.solver;

public enum SolutionStatus {
    OPTIMAL,
    // Stopped early (time limit) with an incumbent that is not proven optimal
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    ERROR;

    public boolean hasValues() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
