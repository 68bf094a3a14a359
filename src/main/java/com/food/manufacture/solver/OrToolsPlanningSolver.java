package com.food.manufacture.solver;

import com.food.manufacture.model.LinearConstraint;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableDeclaration;
import com.food.manufacture.model.VariableDomain;
import com.food.manufacture.model.VariableRef;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solves planning models with Google OR-Tools. Continuous models go to the LP
 * backend (GLOP by default), discrete ones to the MIP backend (SCIP by default).
 */
@Slf4j
public class OrToolsPlanningSolver implements PlanningSolver {

    static {
        Loader.loadNativeLibraries();
    }

    private final SolverSettings settings;

    public OrToolsPlanningSolver(SolverSettings settings) {
        this.settings = settings;
    }

    @Override
    public Solution solve(ProductionModel model) {
        long startTime = System.currentTimeMillis();
        String backend = model.isDiscrete() ? settings.getMipBackend() : settings.getLpBackend();

        MPSolver solver = MPSolver.createSolver(backend);
        if (solver == null) {
            log.error("Could not create solver {}", backend);
            throw new SolverUnavailableException("OR-Tools backend " + backend + " is not available");
        }
        try {
            if (settings.getTimeLimitSec() > 0) {
                solver.setTimeLimit((long) (settings.getTimeLimitSec() * 1000));
            }

            // 1. Variables
            Map<VariableRef, MPVariable> variables = new LinkedHashMap<>();
            for (VariableDeclaration declaration : model.getVariables()) {
                double lb = declaration.getLowerBound();
                double ub = Double.isInfinite(declaration.getUpperBound()) ? MPSolver.infinity() : declaration.getUpperBound();
                String name = declaration.getRef().name();
                MPVariable var = declaration.getDomain() == VariableDomain.BINARY
                        ? solver.makeIntVar(lb, ub, name)
                        : solver.makeNumVar(lb, ub, name);
                variables.put(declaration.getRef(), var);
            }

            // 2. Constraints: expr in [lb, ub]
            for (LinearConstraint constraint : model.getConstraints()) {
                double lb = constraint.getRelation().lowerBound(constraint.getRhs());
                double ub = constraint.getRelation().upperBound(constraint.getRhs());
                MPConstraint ct = solver.makeConstraint(
                        Double.isInfinite(lb) ? -MPSolver.infinity() : lb,
                        Double.isInfinite(ub) ? MPSolver.infinity() : ub,
                        constraint.name());
                constraint.getExpression().terms().forEach((ref, coef) -> ct.setCoefficient(lookup(variables, ref), coef));
            }

            // 3. Objective
            MPObjective objective = solver.objective();
            model.getObjective().getExpression().terms()
                    .forEach((ref, coef) -> objective.setCoefficient(lookup(variables, ref), coef));
            switch (model.getObjective().getSense()) {
                case MAXIMIZE -> objective.setMaximization();
                case MINIMIZE -> objective.setMinimization();
            }

            MPSolverParameters parameters = new MPSolverParameters();
            if (model.isDiscrete()) {
                parameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, settings.getRelativeMipGap());
            }

            final MPSolver.ResultStatus resultStatus = solver.solve(parameters);
            SolutionStatus status = toStatus(resultStatus);
            log.info("{} solved {} model ({} vars, {} constraints): {} in {} ms",
                    backend, model.getMode(), solver.numVariables(), solver.numConstraints(),
                    resultStatus, System.currentTimeMillis() - startTime);

            if (!status.hasValues()) {
                return Solution.withoutValues(status);
            }
            Map<VariableRef, Double> values = new LinkedHashMap<>();
            variables.forEach((ref, var) -> values.put(ref, var.solutionValue()));
            return Solution.of(status, objective.value(), values);
        } finally {
            solver.delete();
        }
    }

    private static MPVariable lookup(Map<VariableRef, MPVariable> variables, VariableRef ref) {
        MPVariable var = variables.get(ref);
        if (var == null) {
            throw new IllegalStateException("Expression references undeclared variable " + ref.name());
        }
        return var;
    }

    static SolutionStatus toStatus(MPSolver.ResultStatus status) {
        return switch (status) {
            case OPTIMAL -> SolutionStatus.OPTIMAL;
            case FEASIBLE -> SolutionStatus.FEASIBLE;
            case INFEASIBLE -> SolutionStatus.INFEASIBLE;
            case UNBOUNDED -> SolutionStatus.UNBOUNDED;
            default -> SolutionStatus.ERROR;
        };
    }
}
