package com.food.manufacture.service;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.PlanRecord;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableRef;
import com.food.manufacture.solver.Solution;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a solved model into one record per (period, oil): month by month,
 * oils in catalog order.
 */
public class PlanExtractor {

    public List<PlanRecord> extract(ProductionModel model, Solution solution) {
        if (!solution.getStatus().hasValues()) {
            throw new IllegalStateException("Cannot extract a plan from a " + solution.getStatus() + " solution");
        }
        List<PlanRecord> records = new ArrayList<>();
        for (int t : model.getHorizon().periods()) {
            for (Oil oil : model.getOils()) {
                String o = oil.getId();
                records.add(PlanRecord.builder()
                        .period(t)
                        .oil(o)
                        .buy(solution.value(VariableRef.buy(o, t)))
                        .use(solution.value(VariableRef.use(o, t)))
                        .stock(solution.value(VariableRef.stock(o, t)))
                        .build());
            }
        }
        return records;
    }
}
