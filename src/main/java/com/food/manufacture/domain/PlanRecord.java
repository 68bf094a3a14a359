package com.food.manufacture.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One line of the purchasing and refining plan, in tons.
 */
@Value
@Builder
public class PlanRecord {
    int period;
    String oil;
    double buy;
    double use;
    double stock;
}
