package com.food.manufacture.solver;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SolverSettings {
    // OR-Tools backend ids, see MPSolver.createSolver
    @Builder.Default
    String lpBackend = "GLOP";
    @Builder.Default
    String mipBackend = "SCIP";

    // 0 disables the limit
    @Builder.Default
    double timeLimitSec = 0;

    @Builder.Default
    double relativeMipGap = 1e-7;

    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }
}
