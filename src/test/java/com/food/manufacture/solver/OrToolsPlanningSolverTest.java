package com.food.manufacture.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.food.manufacture.data.ReferenceScenario;
import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilCategory;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.engine.ProductionModelBuilder;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableRef;
import com.google.ortools.linearsolver.MPSolver;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/** Solves the Food Manufacture reference case with the real OR-Tools backends. */
final class OrToolsPlanningSolverTest {

    // Published optimum of Food Manufacture 1 (LP)
    private static final double LP_BASELINE = 107_842.59;
    // Published optimum of Food Manufacture 2 (MIP)
    private static final double MIP_BASELINE = 100_278.70;

    // GLOP residuals are near machine precision; SCIP works to a relative feasibility tolerance of 1e-6
    private static final double LP_TOL = 1e-6;
    private static final double MIP_TOL = 1e-3;

    private static final PlanningParameters PARAMS = PlanningParameters.reference();
    private static final List<Oil> OILS = ReferenceScenario.oils();

    private static ProductionModel lpModel;
    private static ProductionModel mipModel;
    private static Solution lp;
    private static Solution mip;

    private final ProductionModelBuilder builder = new ProductionModelBuilder();

    @BeforeAll
    static void solveBothModes() {
        ProductionModelBuilder builder = new ProductionModelBuilder();
        OrToolsPlanningSolver solver = new OrToolsPlanningSolver(SolverSettings.defaults());
        lpModel = builder.build(ReferenceScenario.referenceData(), PARAMS, PlanningMode.CONTINUOUS);
        mipModel = builder.build(ReferenceScenario.referenceData(), PARAMS, PlanningMode.DISCRETE);
        lp = solver.solve(lpModel);
        mip = solver.solve(mipModel);
    }

    @Test
    void bothModesAreOptimal() {
        assertEquals(SolutionStatus.OPTIMAL, lp.getStatus());
        assertEquals(SolutionStatus.OPTIMAL, mip.getStatus());
    }

    @Test
    void continuousProfitMatchesBaseline() {
        assertEquals(LP_BASELINE, lp.getObjectiveValue(), 0.01);
    }

    @Test
    void discreteProfitMatchesBaseline() {
        assertEquals(MIP_BASELINE, mip.getObjectiveValue(), 0.5);
    }

    @Test
    void discreteNeverBeatsContinuous() {
        assertTrue(mip.getObjectiveValue() <= lp.getObjectiveValue() + MIP_TOL,
                mip.getObjectiveValue() + " > " + lp.getObjectiveValue());
    }

    @Test
    void rebuildAndResolveReproducesObjective() {
        OrToolsPlanningSolver solver = new OrToolsPlanningSolver(SolverSettings.defaults());
        Solution again = solver.solve(builder.build(ReferenceScenario.referenceData(), PARAMS, PlanningMode.CONTINUOUS));

        assertEquals(lp.getObjectiveValue(), again.getObjectiveValue(), 1e-6);
    }

    @Test
    void inventoryBalancesEveryMonth() {
        for (Solution solution : List.of(lp, mip)) {
            double tol = toleranceFor(solution);
            for (Oil oil : OILS) {
                String o = oil.getId();
                assertEquals(PARAMS.require(ParameterKey.INITIAL_STOCK)
                                + solution.value(VariableRef.buy(o, 1)) - solution.value(VariableRef.use(o, 1)),
                        solution.value(VariableRef.stock(o, 1)), tol, "first month of " + o);
                for (int t = 2; t <= 6; t++) {
                    double residual = solution.value(VariableRef.stock(o, t))
                            - solution.value(VariableRef.stock(o, t - 1))
                            - solution.value(VariableRef.buy(o, t))
                            + solution.value(VariableRef.use(o, t));
                    assertEquals(0.0, residual, tol, o + " month " + t);
                }
                assertEquals(500.0, solution.value(VariableRef.stock(o, 6)), tol, "final stock of " + o);
            }
        }
    }

    @Test
    void stockStaysWithinStorageCapacity() {
        for (Solution solution : List.of(lp, mip)) {
            double tol = toleranceFor(solution);
            for (Oil oil : OILS) {
                for (int t = 1; t <= 6; t++) {
                    double stock = solution.value(VariableRef.stock(oil.getId(), t));
                    assertTrue(stock >= -tol && stock <= 1000.0 + tol, oil.getId() + " month " + t + ": " + stock);
                }
            }
        }
    }

    @Test
    void refiningRespectsCategoryCaps() {
        for (Solution solution : List.of(lp, mip)) {
            double tol = toleranceFor(solution);
            for (int t = 1; t <= 6; t++) {
                double veg = 0;
                double nonVeg = 0;
                for (Oil oil : OILS) {
                    double use = solution.value(VariableRef.use(oil.getId(), t));
                    if (oil.getCategory() == OilCategory.VEGETABLE) {
                        veg += use;
                    } else {
                        nonVeg += use;
                    }
                }
                assertTrue(veg <= 200.0 + tol, "veg month " + t + ": " + veg);
                assertTrue(nonVeg <= 250.0 + tol, "non-veg month " + t + ": " + nonVeg);
            }
        }
    }

    @Test
    void blendHardnessStaysInRange() {
        for (Solution solution : List.of(lp, mip)) {
            double tol = toleranceFor(solution);
            for (int t = 1; t <= 6; t++) {
                double produce = solution.value(VariableRef.produce(t));
                double weighted = 0;
                double used = 0;
                for (Oil oil : OILS) {
                    double use = solution.value(VariableRef.use(oil.getId(), t));
                    weighted += oil.getHardness() * use;
                    used += use;
                }
                assertEquals(used, produce, tol);
                if (produce > 1.0) {
                    double hardness = weighted / produce;
                    assertTrue(hardness >= 3.0 - tol && hardness <= 6.0 + tol, "month " + t + ": " + hardness);
                }
            }
        }
    }

    @Test
    void discreteIndicatorsAreConsistentWithUsage() {
        for (int t = 1; t <= 6; t++) {
            int ingredients = 0;
            for (Oil oil : OILS) {
                double use = mip.value(VariableRef.use(oil.getId(), t));
                double isUsed = mip.value(VariableRef.isUsed(oil.getId(), t));
                assertTrue(Math.abs(isUsed - Math.rint(isUsed)) < MIP_TOL, "indicator not integral: " + isUsed);
                if (use > MIP_TOL) {
                    assertEquals(1.0, isUsed, MIP_TOL, oil.getId() + " month " + t);
                }
                if (Math.rint(isUsed) == 1.0) {
                    assertTrue(use >= 20.0 - MIP_TOL, oil.getId() + " month " + t + " uses only " + use);
                    ingredients++;
                }
            }
            assertTrue(ingredients <= 3, "month " + t + " uses " + ingredients + " oils");
            for (String veg : List.of("VEG1", "VEG2")) {
                assertTrue(mip.value(VariableRef.isUsed(veg, t)) <= mip.value(VariableRef.isUsed("OIL3", t)) + MIP_TOL,
                        veg + " used without OIL3 in month " + t);
            }
        }
    }

    @Test
    void continuousSolutionPassesModelCheck() {
        assertEquals(List.of(), new ModelEvaluator(LP_TOL).violations(lpModel, lp.getValues()));
    }

    private static double toleranceFor(Solution solution) {
        return solution == mip ? MIP_TOL : LP_TOL;
    }

    @Test
    void unreachableFinalStockIsInfeasible() {
        PlanningParameters params = PARAMS.toBuilder()
                .value(ParameterKey.TARGET_FINAL_STOCK, 1500.0)
                .build();
        ProductionModel model = builder.build(ReferenceScenario.referenceData(), params, PlanningMode.CONTINUOUS);

        Solution solution = new OrToolsPlanningSolver(SolverSettings.defaults()).solve(model);

        assertEquals(SolutionStatus.INFEASIBLE, solution.getStatus());
        assertTrue(solution.getValues().isEmpty());
        assertThrows(IllegalStateException.class, () -> solution.value(VariableRef.buy("VEG1", 1)));
    }

    @Test
    void unknownBackendIsUnavailable() {
        OrToolsPlanningSolver solver = new OrToolsPlanningSolver(
                SolverSettings.builder().lpBackend("NO_SUCH_BACKEND").build());

        assertThrows(SolverUnavailableException.class, () -> solver.solve(lpModel));
    }

    @Test
    void mapsOrToolsStatuses() {
        assertEquals(SolutionStatus.FEASIBLE, OrToolsPlanningSolver.toStatus(MPSolver.ResultStatus.FEASIBLE));
        assertEquals(SolutionStatus.UNBOUNDED, OrToolsPlanningSolver.toStatus(MPSolver.ResultStatus.UNBOUNDED));
        assertEquals(SolutionStatus.ERROR, OrToolsPlanningSolver.toStatus(MPSolver.ResultStatus.ABNORMAL));
        assertEquals(SolutionStatus.ERROR, OrToolsPlanningSolver.toStatus(MPSolver.ResultStatus.NOT_SOLVED));
    }
}
