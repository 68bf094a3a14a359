package com.food.manufacture.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.food.manufacture.data.ReferenceScenario;
import com.food.manufacture.domain.PlanRecord;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.engine.ProductionModelBuilder;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableRef;
import com.food.manufacture.solver.FixedAssignmentSolver;
import com.food.manufacture.solver.Solution;
import com.food.manufacture.solver.SolutionStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class PlanExtractorTest {

    private final PlanExtractor extractor = new PlanExtractor();
    private final ProductionModel model = new ProductionModelBuilder().build(
            ReferenceScenario.referenceData(), PlanningParameters.reference(), PlanningMode.CONTINUOUS);

    @Test
    void recordsAreOrderedByMonthThenCatalogOrder() {
        Map<VariableRef, Double> values = FixedAssignmentSolver.idlePlan(model, 500.0);
        values.put(VariableRef.buy("OIL2", 3), 42.0);
        values.put(VariableRef.use("VEG1", 1), 17.5);

        List<PlanRecord> records = extractor.extract(model, Solution.of(SolutionStatus.OPTIMAL, 0.0, values));

        assertEquals(30, records.size());
        assertEquals(1, records.get(0).getPeriod());
        assertEquals("VEG1", records.get(0).getOil());
        assertEquals(17.5, records.get(0).getUse());
        assertEquals("OIL3", records.get(4).getOil());
        assertEquals(2, records.get(5).getPeriod());

        PlanRecord oil2March = records.get(2 * 5 + 3);
        assertEquals(3, oil2March.getPeriod());
        assertEquals("OIL2", oil2March.getOil());
        assertEquals(42.0, oil2March.getBuy());
        assertEquals(500.0, oil2March.getStock());
    }

    @Test
    void solutionWithoutValuesCannotBeExtracted() {
        assertThrows(IllegalStateException.class,
                () -> extractor.extract(model, Solution.withoutValues(SolutionStatus.INFEASIBLE)));
    }
}
