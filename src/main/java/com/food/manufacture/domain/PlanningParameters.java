package com.food.manufacture.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scalar business parameters of a planning run, plus per-oil storage overrides
 * and the oil dependency rules used in discrete mode.
 */
@Value
@Builder(toBuilder = true)
public class PlanningParameters {
    @Singular
    Map<ParameterKey, Double> values;

    // Oil id -> tons, overrides STORAGE_CAPACITY_PER_OIL
    @Singular("storageCapacity")
    Map<String, Double> storageCapacities;

    @Singular
    List<OilDependency> dependencies;

    public OptionalDouble find(ParameterKey key) {
        Double value = values.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public double require(ParameterKey key) {
        Double value = values.get(key);
        if (value == null) {
            throw new ValidationException("Missing parameter '" + key.key() + "'");
        }
        return value;
    }

    public double storageCapacityOf(String oilId) {
        Double override = storageCapacities.get(oilId);
        return override != null ? override : require(ParameterKey.STORAGE_CAPACITY_PER_OIL);
    }

    /**
     * Parameters of the published Food Manufacture case (H. P. Williams).
     */
    public static PlanningParameters reference() {
        return PlanningParameters.builder()
                .value(ParameterKey.STORAGE_COST_PER_TON, 5.0)
                .value(ParameterKey.PRODUCT_SALES_PRICE, 150.0)
                .value(ParameterKey.MAX_VEG_REFINE_PER_MONTH, 200.0)
                .value(ParameterKey.MAX_NONVEG_REFINE_PER_MONTH, 250.0)
                .value(ParameterKey.STORAGE_CAPACITY_PER_OIL, 1000.0)
                .value(ParameterKey.INITIAL_STOCK, 500.0)
                .value(ParameterKey.TARGET_FINAL_STOCK, 500.0)
                .value(ParameterKey.MIN_HARDNESS, 3.0)
                .value(ParameterKey.MAX_HARDNESS, 6.0)
                .value(ParameterKey.MIN_USAGE_IF_USED, 20.0)
                .value(ParameterKey.MAX_INGREDIENTS_PER_MONTH, 3.0)
                .dependency(new OilDependency("VEG1", "OIL3"))
                .dependency(new OilDependency("VEG2", "OIL3"))
                .build();
    }
}
