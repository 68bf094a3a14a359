package com.food.manufacture.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies one decision variable: its family plus the (oil, period) index.
 * Period-only families such as {@link VariableFamily#PRODUCE} carry a null oil.
 */
@Value
public class VariableRef {
    @NonNull
    VariableFamily family;
    String oil;
    int period;

    public static VariableRef of(VariableFamily family, String oil, int period) {
        return new VariableRef(family, oil, period);
    }

    public static VariableRef buy(String oil, int period) {
        return new VariableRef(VariableFamily.BUY, oil, period);
    }

    public static VariableRef use(String oil, int period) {
        return new VariableRef(VariableFamily.USE, oil, period);
    }

    public static VariableRef stock(String oil, int period) {
        return new VariableRef(VariableFamily.STOCK, oil, period);
    }

    public static VariableRef produce(int period) {
        return new VariableRef(VariableFamily.PRODUCE, null, period);
    }

    public static VariableRef isUsed(String oil, int period) {
        return new VariableRef(VariableFamily.IS_USED, oil, period);
    }

    public String name() {
        return oil == null
                ? family.label() + "[" + period + "]"
                : family.label() + "[" + oil + "," + period + "]";
    }
}
