package com.food.manufacture.domain;

/**
 * Refining line an oil goes through. Each line has its own monthly throughput cap.
 */
public enum OilCategory {
    VEGETABLE(ParameterKey.MAX_VEG_REFINE_PER_MONTH),
    NON_VEGETABLE(ParameterKey.MAX_NONVEG_REFINE_PER_MONTH);

    private final ParameterKey capacityKey;

    OilCategory(ParameterKey capacityKey) {
        this.capacityKey = capacityKey;
    }

    public ParameterKey capacityKey() {
        return capacityKey;
    }
}
