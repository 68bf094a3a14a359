package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.PlanningHorizon;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ReferenceData;
import lombok.Value;

import java.util.List;

/**
 * Validated inputs shared by the constraint families of one build.
 */
@Value
class BuildContext {
    ReferenceData data;
    PlanningParameters params;
    PlanningHorizon horizon;
    CategoryIndex categories;

    static BuildContext of(ReferenceData data, PlanningParameters params) {
        return new BuildContext(data, params,
                PlanningHorizon.of(data.getPrices().periods()),
                CategoryIndex.of(data.getOils()));
    }

    List<Oil> oils() {
        return data.getOils();
    }

    List<Integer> periods() {
        return horizon.periods();
    }
}
