package com.food.manufacture.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Keys of the flat scalar parameter mapping.
 */
public enum ParameterKey {
    STORAGE_COST_PER_TON("storage_cost_per_ton", false),
    PRODUCT_SALES_PRICE("product_sales_price", false),
    MAX_VEG_REFINE_PER_MONTH("max_veg_refine_per_month", false),
    MAX_NONVEG_REFINE_PER_MONTH("max_nonveg_refine_per_month", false),
    STORAGE_CAPACITY_PER_OIL("storage_capacity_per_oil", false),
    INITIAL_STOCK("initial_stock", false),
    TARGET_FINAL_STOCK("target_final_stock", false),
    MIN_HARDNESS("min_hardness", false),
    MAX_HARDNESS("max_hardness", false),
    MIN_USAGE_IF_USED("min_usage_if_used", true),
    MAX_INGREDIENTS_PER_MONTH("max_ingredients_per_month", true);

    private final String key;
    private final boolean discreteOnly;

    ParameterKey(String key, boolean discreteOnly) {
        this.key = key;
        this.discreteOnly = discreteOnly;
    }

    public String key() {
        return key;
    }

    public boolean isRequiredFor(PlanningMode mode) {
        return !discreteOnly || mode == PlanningMode.DISCRETE;
    }

    /**
     * Looks a key up ignoring case, '_' and '-', so "min_hardness" and "min-hardness" both match.
     */
    public static Optional<ParameterKey> fromKey(String key) {
        String wanted = normalize(key);
        return Arrays.stream(values())
                .filter(k -> normalize(k.key).equals(wanted))
                .findFirst();
    }

    private static String normalize(String key) {
        return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
