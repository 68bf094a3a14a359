package com.food.manufacture.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Business rule: {@code dependent} may only be refined in a month in which
 * {@code prerequisite} is refined as well.
 */
@Value
public class OilDependency {
    @NonNull
    String dependent;

    @NonNull
    String prerequisite;
}
