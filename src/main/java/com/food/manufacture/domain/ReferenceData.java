package com.food.manufacture.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Read-only scenario input: the oil catalog and the purchase price forecast.
 */
@Value
@Builder
public class ReferenceData {
    @Singular
    List<Oil> oils;

    @NonNull
    PriceTable prices;

    public Optional<Oil> findOil(String id) {
        return oils.stream().filter(o -> o.getId().equals(id)).findFirst();
    }
}
