package com.food.manufacture.model;

public enum VariableFamily {
    BUY("Buy"),
    USE("Use"),
    STOCK("Stock"),
    PRODUCE("Produce"),
    IS_USED("IsUsed");

    private final String label;

    VariableFamily(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
