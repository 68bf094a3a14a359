package com.food.manufacture.model;

public enum ConstraintFamily {
    BALANCE("Balance", false),
    FINAL_STOCK("FinalStock", false),
    CATEGORY_CAPACITY("CategoryCapacity", false),
    PRODUCTION_DEFINITION("ProductionDef", false),
    HARDNESS_MIN("HardnessMin", false),
    HARDNESS_MAX("HardnessMax", false),
    LINKING("LinkVars", true),
    MIN_THRESHOLD("MinThreshold", true),
    MAX_INGREDIENTS("MaxIngredients", true),
    LOGICAL_IMPLICATION("LogicalImplication", true);

    private final String label;
    private final boolean discrete;

    ConstraintFamily(String label, boolean discrete) {
        this.label = label;
        this.discrete = discrete;
    }

    public String label() {
        return label;
    }

    public boolean isDiscrete() {
        return discrete;
    }
}
