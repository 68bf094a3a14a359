package com.food.manufacture.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class PlanningHorizonTest {

    @Test
    void ordersPeriodsAndExposesBoundaries() {
        PlanningHorizon horizon = PlanningHorizon.of(Set.of(3, 1, 2));

        assertEquals(List.of(1, 2, 3), horizon.periods());
        assertEquals(1, horizon.first());
        assertEquals(3, horizon.last());
        assertTrue(horizon.isFirst(1));
        assertFalse(horizon.isFirst(2));
        assertEquals(2, horizon.previous(3));
    }

    @Test
    void firstPeriodHasNoPredecessor() {
        PlanningHorizon horizon = PlanningHorizon.of(List.of(1, 2));

        assertThrows(IllegalArgumentException.class, () -> horizon.previous(1));
    }

    @Test
    void rejectsGapsAndEmptyHorizon() {
        assertThrows(ValidationException.class, () -> PlanningHorizon.of(List.of(1, 3)));
        assertThrows(ValidationException.class, () -> PlanningHorizon.of(List.of()));
    }

    @Test
    void singleMonthIsBothFirstAndLast() {
        PlanningHorizon horizon = PlanningHorizon.of(List.of(7));

        assertEquals(7, horizon.first());
        assertEquals(7, horizon.last());
        assertEquals(1, horizon.size());
    }
}
