package com.food.manufacture;

import com.food.manufacture.data.ReferenceScenario;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningOutcome;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ReferenceData;
import com.food.manufacture.service.PlanReportFormatter;
import com.food.manufacture.service.ProductionPlanningService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Solves the reference scenario twice, first as a pure LP (Food Manufacture 1),
 * then with the logical rules (Food Manufacture 2), and prints both plans.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "planning.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlanningRunner implements CommandLineRunner {

    private final ProductionPlanningService service;
    private final PlanningParameters parameters;
    private final PlanReportFormatter formatter;

    @Override
    public void run(String... args) {
        ReferenceData data = ReferenceScenario.referenceData();

        System.out.println("Solving Food Manufacture 1 (continuous LP)...");
        PlanningOutcome lp = service.plan(data, parameters, PlanningMode.CONTINUOUS);
        System.out.println(formatter.format(lp, "LP Results (Food Manufacture 1)"));

        System.out.println("\n" + "=".repeat(40) + "\n");

        System.out.println("Solving Food Manufacture 2 (MIP with logical constraints)...");
        PlanningOutcome mip = service.plan(data, parameters, PlanningMode.DISCRETE);
        System.out.println(formatter.format(mip, "MIP Results (Food Manufacture 2)"));
    }
}
