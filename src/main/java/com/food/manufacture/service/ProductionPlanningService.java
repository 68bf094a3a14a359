package com.food.manufacture.service;

import com.food.manufacture.domain.PlanRecord;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningOutcome;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ReferenceData;
import com.food.manufacture.engine.ProductionModelBuilder;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.solver.ModelEvaluator;
import com.food.manufacture.solver.PlanningSolver;
import com.food.manufacture.solver.Solution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * One planning run: build the model, solve it once, verify and flatten the answer.
 * Infeasible, unbounded and failed solves come back as outcomes, not exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductionPlanningService {

    private final ProductionModelBuilder modelBuilder;
    private final PlanningSolver solver;
    private final ModelEvaluator evaluator;
    private final PlanExtractor extractor;

    public PlanningOutcome plan(ReferenceData data, PlanningParameters params, PlanningMode mode) {
        if (data == null) {
            throw new IllegalArgumentException("Reference data cannot be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("Parameters cannot be null");
        }
        long startTime = System.currentTimeMillis();

        ProductionModel model = modelBuilder.build(data, params, mode);
        Solution solution = solver.solve(model);

        PlanningOutcome outcome = PlanningOutcome.builder()
                .mode(mode)
                .status(solution.getStatus().name())
                .feasible(solution.getStatus().hasValues())
                .objectiveValue(solution.getObjectiveValue())
                .records(Collections.emptyList())
                .violations(Collections.emptyList())
                .build();

        if (solution.getStatus().hasValues()) {
            List<String> violations = evaluator.violations(model, solution.getValues());
            if (!violations.isEmpty()) {
                log.warn("{} solution violates {} checks, first: {}", mode, violations.size(), violations.get(0));
            }
            List<PlanRecord> records = extractor.extract(model, solution);
            outcome.setRecords(records);
            outcome.setViolations(violations);
        } else {
            log.warn("{} model returned {}", mode, solution.getStatus());
        }

        outcome.setComputationTimeMs(System.currentTimeMillis() - startTime);
        return outcome;
    }
}
