package com.food.manufacture.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Oil {
    @NonNull
    String id;

    @NonNull
    OilCategory category;

    // Hardness on the supplier's scale, blended linearly by weight
    double hardness;
}
