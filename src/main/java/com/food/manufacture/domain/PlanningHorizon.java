package com.food.manufacture.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered run of consecutive planning months.
 */
@ToString
@EqualsAndHashCode
public final class PlanningHorizon {

    private final List<Integer> periods;

    private PlanningHorizon(List<Integer> periods) {
        this.periods = periods;
    }

    public static PlanningHorizon of(Collection<Integer> periods) {
        List<Integer> sorted = new ArrayList<>(periods);
        sorted.sort(Integer::compareTo);
        if (sorted.isEmpty()) {
            throw new ValidationException("Planning horizon has no periods");
        }
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i) != sorted.get(i - 1) + 1) {
                throw new ValidationException("Periods must be consecutive, found gap after " + sorted.get(i - 1));
            }
        }
        return new PlanningHorizon(List.copyOf(sorted));
    }

    public List<Integer> periods() {
        return periods;
    }

    public int first() {
        return periods.get(0);
    }

    public int last() {
        return periods.get(periods.size() - 1);
    }

    public boolean isFirst(int period) {
        return period == first();
    }

    public int previous(int period) {
        if (isFirst(period)) {
            throw new IllegalArgumentException("Period " + period + " has no predecessor");
        }
        return period - 1;
    }

    public int size() {
        return periods.size();
    }
}
